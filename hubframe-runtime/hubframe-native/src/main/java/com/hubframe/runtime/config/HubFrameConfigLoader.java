package com.hubframe.runtime.config;

import com.hubframe.api.exception.HubException;
import com.hubframe.core.config.HubFrameConfig;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 原生运行时的 YAML 配置加载
 * <p>
 * 查找顺序：系统属性 {@code hubframe.config} 指定的文件 → 工作目录下的 hubframe.yml → classpath 中的 hubframe.yml → 默认值。
 * 配置项可以放在 {@code hubframe:} 节点下，也可以直接写在根上；键名同时接受 camelCase 和 kebab-case。
 * <pre>
 * hubframe:
 *   plugin-home: /var/lib/hub/plugins
 *   registry-file: /var/lib/hub/registry.yml
 *   load-timeout-seconds: 30
 *   sandbox:
 *     max-concurrent-calls: 2
 * </pre>
 */
@Slf4j
public final class HubFrameConfigLoader {

    public static final String CONFIG_FILE = "hubframe.yml";
    public static final String CONFIG_PROPERTY = "hubframe.config";
    private static final String ROOT_KEY = "hubframe";

    private HubFrameConfigLoader() {
    }

    /**
     * 按默认查找顺序加载
     */
    public static HubFrameConfig load() {
        String explicit = System.getProperty(CONFIG_PROPERTY);
        if (explicit != null && !explicit.isBlank()) {
            return load(Paths.get(explicit));
        }
        Path local = Paths.get(CONFIG_FILE);
        if (Files.isRegularFile(local)) {
            return load(local);
        }
        try (InputStream in = HubFrameConfigLoader.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (in != null) {
                log.info("Loading HubFrame config from classpath:{}", CONFIG_FILE);
                return load(in);
            }
        } catch (IOException e) {
            throw new HubException("Failed to read classpath:" + CONFIG_FILE, e);
        }
        log.info("No {} found, using default HubFrame config", CONFIG_FILE);
        return HubFrameConfig.defaults();
    }

    public static HubFrameConfig load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new HubException("HubFrame config not found: " + file.toAbsolutePath());
        }
        log.info("Loading HubFrame config from {}", file.toAbsolutePath());
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        } catch (IOException e) {
            throw new HubException("Failed to read HubFrame config " + file.toAbsolutePath(), e);
        }
    }

    public static HubFrameConfig load(InputStream in) {
        Object raw;
        try {
            raw = new Yaml().load(in);
        } catch (RuntimeException e) {
            throw new HubException("Malformed HubFrame config: " + e.getMessage(), e);
        }
        if (raw == null) {
            return HubFrameConfig.defaults();
        }
        if (!(raw instanceof Map<?, ?> root)) {
            throw new HubException("HubFrame config must be a mapping, got " + raw.getClass().getSimpleName());
        }
        Object section = root.containsKey(ROOT_KEY) ? root.get(ROOT_KEY) : root;
        if (section == null) {
            return HubFrameConfig.defaults();
        }
        if (!(section instanceof Map<?, ?> values)) {
            throw new HubException("'" + ROOT_KEY + "' must be a mapping");
        }

        // 规范化键名后交给 Bean 构造器，未知字段由 SnakeYAML 报错
        String normalized = new Yaml().dump(normalizeKeys(values));
        Yaml beanYaml = new Yaml(new Constructor(HubFrameConfig.class, new LoaderOptions()));
        try {
            HubFrameConfig config = beanYaml.load(normalized);
            return config != null ? config : HubFrameConfig.defaults();
        } catch (RuntimeException e) {
            throw new HubException("Invalid HubFrame config: " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> normalizeKeys(Map<?, ?> source) {
        Map<String, Object> result = new LinkedHashMap<>();
        source.forEach((key, value) -> result.put(camelCase(String.valueOf(key)), normalizeValue(value)));
        return result;
    }

    private static Object normalizeValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return normalizeKeys(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(normalizeValue(item)));
            return copy;
        }
        return value;
    }

    static String camelCase(String key) {
        if (key.indexOf('-') < 0 && key.indexOf('_') < 0) {
            return key;
        }
        StringBuilder sb = new StringBuilder(key.length());
        boolean upper = false;
        for (char c : key.toCharArray()) {
            if (c == '-' || c == '_') {
                upper = sb.length() > 0;
                continue;
            }
            sb.append(upper ? Character.toUpperCase(c) : c);
            upper = false;
        }
        return sb.toString();
    }
}
