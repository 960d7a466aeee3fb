package com.hubframe.core.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hubframe.api.exception.RpcException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP + JSON 的 RPC 通道
 * <p>
 * 每次调用是一次 {@code POST {endpoint}/rpc}，请求体 {@code {"pluginId","method","params"}}，
 * 响应体为 {@link RpcResponse} 的 JSON 形式。
 */
@Slf4j
public class HttpRpcChannel implements RpcChannel {

    private final String pluginId;
    private final URI rpcUri;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;
    private volatile boolean closed;

    public HttpRpcChannel(String pluginId, URI endpoint, HttpClient httpClient, ObjectMapper objectMapper,
                          Duration timeout) {
        this.pluginId = pluginId;
        String base = endpoint.toString();
        this.rpcUri = URI.create(base.endsWith("/") ? base + "rpc" : base + "/rpc");
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    @Override
    public RpcResponse call(RpcRequest request) {
        if (closed) {
            throw new RpcException("RPC channel of [" + pluginId + "] is closed");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("pluginId", pluginId);
        body.put("method", request.method());
        body.put("params", request.params());

        HttpRequest httpRequest;
        try {
            httpRequest = HttpRequest.newBuilder(rpcUri)
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to encode RPC request '" + request.method() + "'", e);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RpcException("RPC '" + request.method() + "' to " + rpcUri + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("RPC '" + request.method() + "' interrupted", e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new RpcException("RPC '" + request.method() + "' returned HTTP " + response.statusCode());
        }
        try {
            return objectMapper.readValue(response.body(), RpcResponse.class);
        } catch (JsonProcessingException e) {
            throw new RpcException("Malformed RPC response for '" + request.method() + "'", e);
        }
    }

    @Override
    public void close() {
        closed = true;
        log.debug("[{}] RPC channel to {} closed", pluginId, rpcUri);
    }
}
