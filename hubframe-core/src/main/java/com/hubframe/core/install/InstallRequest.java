package com.hubframe.core.install;

import com.hubframe.api.model.InstallType;

import java.nio.file.Path;
import java.util.Map;

/**
 * 交给安装后端的请求
 *
 * @param pluginHome 插件根目录，后端在其下为插件建立目录
 */
public record InstallRequest(
        String jobId,
        String pluginId,
        JobOperation operation,
        InstallType installType,
        Map<String, Object> payload,
        Path pluginHome
) {

    public String payloadString(String key) {
        Object value = payload.get(key);
        return value == null ? null : String.valueOf(value);
    }

    /**
     * 按顺序取第一个存在的负载字段
     */
    public String requirePayload(String... keys) {
        for (String key : keys) {
            String value = payloadString(key);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        throw new IllegalArgumentException(installType + " install of [" + pluginId + "] requires payload '"
                + keys[0] + "'");
    }

    public Path pluginDirectory() {
        return pluginHome.resolve(pluginId);
    }
}
