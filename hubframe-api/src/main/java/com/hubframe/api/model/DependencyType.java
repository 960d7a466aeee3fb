package com.hubframe.api.model;

import java.util.Locale;

/**
 * 插件间依赖的类型
 */
public enum DependencyType {

    /**
     * 依赖必须已安装、版本匹配且已加载
     */
    REQUIRED("required"),

    /**
     * 可以缺失；存在时版本必须匹配，并先于本插件加载
     */
    OPTIONAL("optional"),

    /**
     * 对方已加载时本插件不能加载，反之亦然
     */
    CONFLICTS("conflicts"),

    /**
     * 只影响加载顺序
     */
    SUGGESTED("suggested");

    private final String wireName;

    DependencyType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * 参与加载排序的依赖（除冲突外都是）
     */
    public boolean affectsOrder() {
        return this != CONFLICTS;
    }

    public static DependencyType fromWire(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (DependencyType type : values()) {
                if (type.wireName.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown dependency type: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
