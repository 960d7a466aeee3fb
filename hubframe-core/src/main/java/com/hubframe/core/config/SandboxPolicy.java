package com.hubframe.core.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 嵌入模式沙箱策略
 * <p>
 * 插件可在自身配置的 {@code sandbox} 节点中覆盖主题白名单，其余限制只能由宿主配置。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SandboxPolicy {

    /**
     * 同时执行的调用数
     */
    @Builder.Default
    private int maxConcurrentCalls = 1;

    @Builder.Default
    private int callTimeoutMs = 5000;

    @Builder.Default
    private int maxSubscriptions = 16;

    @Builder.Default
    private int maxBindings = 16;

    /**
     * 允许发布的主题前缀；为空时只允许 {@code <pluginId>.} 开头的主题
     */
    @Builder.Default
    private List<String> allowedTopicPrefixes = new ArrayList<>();

    @Builder.Default
    private boolean tokenServiceAllowed = false;

    public static SandboxPolicy defaults() {
        return SandboxPolicy.builder().build();
    }

    /**
     * 叠加插件配置中的白名单
     */
    @SuppressWarnings("unchecked")
    public SandboxPolicy withPluginOverrides(Map<String, Object> pluginConfig) {
        if (pluginConfig == null || !(pluginConfig.get("sandbox") instanceof Map<?, ?> section)) {
            return this;
        }
        Object topics = ((Map<String, Object>) section).get("allowedTopicPrefixes");
        if (!(topics instanceof List<?> list)) {
            return this;
        }
        List<String> merged = new ArrayList<>(allowedTopicPrefixes);
        list.forEach(t -> merged.add(String.valueOf(t)));
        return toBuilder().allowedTopicPrefixes(merged).build();
    }

    public boolean isTopicAllowed(String pluginId, String topic) {
        if (allowedTopicPrefixes == null || allowedTopicPrefixes.isEmpty()) {
            return topic.startsWith(pluginId + ".");
        }
        return allowedTopicPrefixes.stream().anyMatch(topic::startsWith);
    }
}
