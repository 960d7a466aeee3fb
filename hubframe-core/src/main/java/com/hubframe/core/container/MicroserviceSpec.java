package com.hubframe.core.container;

import com.hubframe.api.exception.PluginLoadException;

import java.io.File;
import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 微服务模式参数，取自插件配置
 * <pre>
 * endpoint: http://127.0.0.1:9101
 * command: [python3, -m, lights_service]   # 可选，由宿主拉起进程
 * workingDir: plugins/lights                # 可选
 * env: { LOG_LEVEL: info }                  # 可选
 * </pre>
 */
public record MicroserviceSpec(URI endpoint, List<String> command, File workingDir, Map<String, String> environment) {

    public static MicroserviceSpec from(String pluginId, Map<String, Object> config) {
        Object endpoint = config.get("endpoint");
        if (endpoint == null || String.valueOf(endpoint).isBlank()) {
            throw new PluginLoadException(pluginId, PluginLoadException.Reason.START_FAILED,
                    "microservice mode requires an 'endpoint' in plugin config");
        }
        URI uri;
        try {
            uri = URI.create(String.valueOf(endpoint));
        } catch (IllegalArgumentException e) {
            throw new PluginLoadException(pluginId, PluginLoadException.Reason.START_FAILED,
                    "invalid endpoint '" + endpoint + "'", e);
        }

        List<String> command = new ArrayList<>();
        Object rawCommand = config.get("command");
        if (rawCommand instanceof List<?> list) {
            list.forEach(part -> command.add(String.valueOf(part)));
        } else if (rawCommand != null && !String.valueOf(rawCommand).isBlank()) {
            command.addAll(Arrays.asList(String.valueOf(rawCommand).trim().split("\\s+")));
        }

        File workingDir = config.get("workingDir") == null ? null : new File(String.valueOf(config.get("workingDir")));

        Map<String, String> env = new LinkedHashMap<>();
        if (config.get("env") instanceof Map<?, ?> rawEnv) {
            rawEnv.forEach((k, v) -> env.put(String.valueOf(k), String.valueOf(v)));
        }
        return new MicroserviceSpec(uri, List.copyOf(command), workingDir, env);
    }

    public boolean launchesProcess() {
        return !command.isEmpty();
    }
}
