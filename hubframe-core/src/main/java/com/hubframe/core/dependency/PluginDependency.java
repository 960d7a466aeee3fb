package com.hubframe.core.dependency;

import com.hubframe.api.model.DependencyType;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * 插件声明的一条依赖
 */
@Value
@Builder
public class PluginDependency {

    /**
     * 被依赖插件的ID
     */
    @NonNull
    String pluginId;

    /**
     * 版本约束，为空表示任意版本
     */
    String versionSpec;

    @NonNull
    @Builder.Default
    DependencyType type = DependencyType.REQUIRED;

    public VersionSpec spec() {
        return VersionSpec.parse(versionSpec);
    }

    @Override
    public String toString() {
        return type + " " + pluginId + (versionSpec == null || versionSpec.isBlank() ? "" : " " + versionSpec);
    }
}
