package com.hubframe.core.install;

import com.hubframe.core.loader.PluginManifest;

import java.nio.file.Path;

/**
 * 安装产物：解析后的清单及其所在目录
 */
public record InstallResult(PluginManifest manifest, Path location) {
}
