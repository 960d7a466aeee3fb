package com.hubframe.core.rpc;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;

/**
 * 所有通道共享一个 {@link HttpClient} 和 {@link ObjectMapper}
 */
public class HttpRpcChannelFactory implements RpcChannelFactory {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public HttpRpcChannelFactory(Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(),
                new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false),
                timeout);
    }

    public HttpRpcChannelFactory(HttpClient httpClient, ObjectMapper objectMapper, Duration timeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    @Override
    public RpcChannel open(String pluginId, URI endpoint) {
        return new HttpRpcChannel(pluginId, endpoint, httpClient, objectMapper, timeout);
    }
}
