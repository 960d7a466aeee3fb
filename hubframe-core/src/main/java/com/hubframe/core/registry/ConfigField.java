package com.hubframe.core.registry;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 配置字段声明
 */
@Value
@Builder
public class ConfigField {

    FieldType type;

    boolean required;

    /**
     * 允许的取值；为空表示不限制
     */
    @Singular("allowedValue")
    List<Object> allowed;

    Object defaultValue;

    String description;
}
