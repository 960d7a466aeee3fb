package com.hubframe.core.install;

import com.hubframe.core.loader.PluginManifest;
import com.hubframe.core.loader.PluginManifestLoader;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 本地目录安装：直接读取目录中的 plugin.yml，插件文件留在原处
 * <p>
 * 负载：{@code path}
 */
@Slf4j
public class LocalPathInstaller implements InstallerBackend {

    @Override
    public InstallResult install(InstallRequest request, InstallCallback callback) throws Exception {
        Path source = Paths.get(request.requirePayload("path", "source"));
        if (!Files.isDirectory(source)) {
            throw new IllegalArgumentException("Local plugin path is not a directory: " + source);
        }
        callback.acknowledge();
        Path manifestDir = InstallFiles.locateManifestDir(source);
        PluginManifest manifest = PluginManifestLoader.load(manifestDir);
        callback.log("read manifest " + manifest.getId() + " v" + manifest.getVersion() + " from " + manifestDir);
        log.info("[{}] Local install from {}", request.pluginId(), manifestDir.toAbsolutePath());
        return new InstallResult(manifest, manifestDir);
    }
}
