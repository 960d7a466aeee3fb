package com.hubframe.core.loader;

import com.hubframe.core.config.HubFrameConfig;
import com.hubframe.core.registry.PluginRecord;
import com.hubframe.core.registry.PluginRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * 插件自动发现服务
 * <p>
 * 职责：
 * 1. 扫描 pluginHome 下的子目录
 * 2. 解析其中的 plugin.yml
 * 3. 将清单登记到注册表（已存在则更新）
 * <p>
 * 发现只负责登记，不负责加载。
 */
@Slf4j
@RequiredArgsConstructor
public class PluginDiscoveryService {

    private final HubFrameConfig config;
    private final PluginRegistry registry;

    /**
     * 执行扫描
     *
     * @return 本次登记或更新的插件ID
     */
    public List<String> scan() {
        List<String> discovered = new ArrayList<>();
        if (!config.isAutoScan()) {
            log.info("Plugin auto scan is disabled");
            return discovered;
        }
        String home = config.getPluginHome();
        if (home == null || home.isBlank()) {
            return discovered;
        }
        Path homePath = Paths.get(home);
        if (!Files.isDirectory(homePath)) {
            log.info("Plugin home {} does not exist, nothing to discover", homePath.toAbsolutePath());
            return discovered;
        }

        List<Path> candidates;
        try (Stream<Path> children = Files.list(homePath)) {
            candidates = children.filter(Files::isDirectory).sorted().toList();
        } catch (IOException e) {
            log.error("Failed to list plugin home {}", homePath.toAbsolutePath(), e);
            return discovered;
        }

        log.info("Starting plugin discovery from {}, count: {}", homePath.toAbsolutePath(), candidates.size());
        for (Path dir : candidates) {
            if (!Files.isRegularFile(dir.resolve(PluginManifestLoader.MANIFEST_FILE))) {
                continue;
            }
            try {
                // 单个插件失败只记录日志，不中断扫描
                PluginManifest manifest = PluginManifestLoader.load(dir);
                PluginRecord record = registry.upsertFromManifest(manifest);
                discovered.add(record.getId());
                log.info("Discovered plugin: {} v{} at {}", record.getId(), record.getLatestVersion(), dir.getFileName());
            } catch (Exception e) {
                log.error("Failed to register plugin from: {}", dir.toAbsolutePath(), e);
            }
        }

        log.info("Plugin discovery finished. Total registered: {}", discovered.size());
        return discovered;
    }
}
