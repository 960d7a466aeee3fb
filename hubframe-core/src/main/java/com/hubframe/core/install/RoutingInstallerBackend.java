package com.hubframe.core.install;

import com.hubframe.api.exception.HubException;
import com.hubframe.api.model.InstallType;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * 按安装类型分派到具体后端
 */
@Slf4j
public class RoutingInstallerBackend implements InstallerBackend {

    private final Map<InstallType, InstallerBackend> backends;
    private final Path pluginHome;

    public RoutingInstallerBackend(Map<InstallType, InstallerBackend> backends, Path pluginHome) {
        this.backends = new EnumMap<>(InstallType.class);
        this.backends.putAll(backends);
        this.pluginHome = pluginHome;
    }

    /**
     * URL、Git、本地目录三种后端
     */
    public static RoutingInstallerBackend defaults(Path pluginHome, Duration timeout) {
        return new RoutingInstallerBackend(Map.of(
                InstallType.URL, new UrlInstaller(timeout),
                InstallType.GIT, new GitInstaller(timeout),
                InstallType.LOCAL, new LocalPathInstaller()), pluginHome);
    }

    @Override
    public InstallResult install(InstallRequest request, InstallCallback callback) throws Exception {
        InstallerBackend backend = backends.get(request.installType());
        if (backend == null) {
            throw new HubException("No installer for type " + request.installType());
        }
        return backend.install(request, callback);
    }

    /**
     * 删除插件目录；本地安装的插件不在插件目录下，不受影响
     */
    @Override
    public void remove(String pluginId) throws Exception {
        Path dir = pluginHome.resolve(pluginId);
        InstallFiles.deleteRecursively(dir);
        log.info("[{}] Removed plugin files at {}", pluginId, dir.toAbsolutePath());
    }
}
