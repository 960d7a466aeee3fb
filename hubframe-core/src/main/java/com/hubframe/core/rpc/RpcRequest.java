package com.hubframe.core.rpc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RPC 请求
 *
 * @param method 方法名，如 {@code handshake} / {@code invoke} / {@code emitEvent}
 * @param params 参数
 */
public record RpcRequest(String method, Map<String, Object> params) {

    public RpcRequest {
        params = params == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static RpcRequest of(String method) {
        return new RpcRequest(method, Map.of());
    }

    public static RpcRequest of(String method, Map<String, Object> params) {
        return new RpcRequest(method, params);
    }

    public String stringParam(String name) {
        Object value = params.get(name);
        return value == null ? null : String.valueOf(value);
    }
}
