package com.hubframe.core.rpc;

import com.hubframe.api.context.PluginContext;
import com.hubframe.api.event.Event;
import com.hubframe.api.exception.RpcException;
import com.hubframe.api.plugin.HubPlugin;
import com.hubframe.core.spi.InboundRpcHandler;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 微服务插件在宿主侧的代理
 * <p>
 * 出站方法：handshake / onLoad / onUnload / health / invoke / deliver。
 * 入站方法：emitEvent / subscribeEvent / unsubscribeEvent / bindDevices，转交给插件上下文。
 * onLoad 响应中可以携带 {@code subscriptions} 和 {@code bindings} 列表，效果等同于逐个入站调用。
 */
@Slf4j
public class RemotePluginProxy implements HubPlugin, InboundRpcHandler {

    private final String pluginId;
    private final RpcChannel channel;
    private volatile PluginContext context;

    public RemotePluginProxy(String pluginId, RpcChannel channel) {
        this.pluginId = pluginId;
        this.channel = channel;
    }

    /**
     * 就绪握手
     *
     * @return 远端是否就绪
     */
    public boolean handshake() {
        Object result = channel.callForResult(RpcRequest.of("handshake", Map.of("pluginId", pluginId)));
        if (result instanceof Map<?, ?> map) {
            return Boolean.TRUE.equals(map.get("ready"));
        }
        return Boolean.TRUE.equals(result);
    }

    @Override
    public void onLoad(PluginContext context) {
        this.context = context;
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("pluginId", pluginId);
        params.put("mode", context.getRuntimeMode().wireName());
        params.put("config", context.getConfig());
        Object result = channel.callForResult(RpcRequest.of("onLoad", params));

        if (result instanceof Map<?, ?> declared) {
            if (declared.get("subscriptions") instanceof List<?> patterns) {
                patterns.forEach(p -> subscribeRemote(String.valueOf(p)));
            }
            if (declared.get("bindings") instanceof List<?> selectors) {
                selectors.forEach(s -> context.bindDevices(String.valueOf(s)));
            }
        }
    }

    @Override
    public void onUnload(PluginContext context) {
        channel.callForResult(RpcRequest.of("onUnload", Map.of("pluginId", pluginId)));
    }

    @Override
    public Object invoke(String action, Map<String, Object> params) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("action", action);
        request.put("params", params == null ? Map.of() : params);
        return channel.callForResult(RpcRequest.of("invoke", request));
    }

    @Override
    public boolean healthCheck() {
        Object result = channel.callForResult(RpcRequest.of("health"));
        if (result instanceof Map<?, ?> map) {
            return Boolean.TRUE.equals(map.get("healthy"));
        }
        return Boolean.TRUE.equals(result);
    }

    // ==================== 入站 ====================

    @Override
    public RpcResponse handleInbound(RpcRequest request) {
        PluginContext ctx = context;
        if (ctx == null) {
            return RpcResponse.failure("Plugin [" + pluginId + "] is not loaded");
        }
        try {
            switch (request.method()) {
                case "emitEvent" -> {
                    ctx.emitEvent(required(request, "topic"), payloadOf(request));
                    return RpcResponse.success(null);
                }
                case "subscribeEvent" -> {
                    return RpcResponse.success(subscribeRemote(required(request, "pattern")));
                }
                case "unsubscribeEvent" -> {
                    ctx.unsubscribeEvent(required(request, "subscriptionId"));
                    return RpcResponse.success(null);
                }
                case "bindDevices" -> {
                    ctx.bindDevices(required(request, "selector"));
                    return RpcResponse.success(null);
                }
                default -> {
                    return RpcResponse.failure("Unknown inbound method: " + request.method());
                }
            }
        } catch (RuntimeException e) {
            log.warn("[{}] Inbound '{}' failed: {}", pluginId, request.method(), e.getMessage());
            return RpcResponse.failure(e.getMessage());
        }
    }

    /**
     * 代表远端订阅，事件通过 deliver 推送给远端
     */
    private String subscribeRemote(String pattern) {
        return context.subscribeEvent(pattern, event -> deliver(pattern, event));
    }

    private void deliver(String pattern, Event event) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("pattern", pattern);
        params.put("topic", event.topic());
        params.put("payload", event.payload());
        params.put("source", event.source());
        params.put("timestamp", event.timestamp().toString());
        channel.callForResult(RpcRequest.of("deliver", params));
    }

    private static String required(RpcRequest request, String name) {
        String value = request.stringParam(name);
        if (value == null || value.isBlank()) {
            throw new RpcException("Missing parameter '" + name + "' for " + request.method());
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> payloadOf(RpcRequest request) {
        Object payload = request.params().get("payload");
        return payload instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }
}
