package com.hubframe.core.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hubframe.api.exception.RpcException;
import com.hubframe.core.testing.StubHttpServer;
import com.hubframe.core.testing.StubHttpServer.Reply;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HttpRpcChannel 单元测试")
public class HttpRpcChannelTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private StubHttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
    }

    @Test
    @DisplayName("POST 到 /rpc，请求体带插件ID、方法和参数")
    void postsJsonEnvelope() throws Exception {
        server = new StubHttpServer((method, path, body) ->
                Reply.json("{\"ok\":true,\"result\":{\"ready\":true},\"error\":null}"));
        RpcChannel channel = open();

        RpcResponse response = channel.call(RpcRequest.of("handshake", Map.of("attempt", 1)));

        assertTrue(response.ok());
        assertEquals(Map.of("ready", true), response.result());
        StubHttpServer.Recorded recorded = server.requests.get(0);
        assertEquals("POST", recorded.method());
        assertEquals("/rpc", recorded.path());
        JsonNode sent = mapper.readTree(recorded.body());
        assertEquals("lights", sent.get("pluginId").asText());
        assertEquals("handshake", sent.get("method").asText());
        assertEquals(1, sent.get("params").get("attempt").asInt());
    }

    @Test
    @DisplayName("远端失败时 callForResult 抛出异常")
    void remoteFailure() throws Exception {
        server = new StubHttpServer((method, path, body) ->
                Reply.json("{\"ok\":false,\"error\":\"device offline\"}"));

        RpcException e = assertThrows(RpcException.class, () -> open().callForResult(RpcRequest.of("invoke")));
        assertTrue(e.getMessage().contains("device offline"));
    }

    @Test
    @DisplayName("非 2xx 响应和无法解析的响应体")
    void httpErrors() throws Exception {
        server = new StubHttpServer((method, path, body) ->
                body.contains("health") ? Reply.status(503) : Reply.json("not json"));
        RpcChannel channel = open();

        assertThrows(RpcException.class, () -> channel.call(RpcRequest.of("health")));
        assertThrows(RpcException.class, () -> channel.call(RpcRequest.of("invoke")));
    }

    @Test
    @DisplayName("连接失败和关闭后的调用")
    void unreachableAndClosed() {
        RpcChannel channel = new HttpRpcChannelFactory(Duration.ofSeconds(1))
                .open("lights", URI.create("http://127.0.0.1:1"));

        assertThrows(RpcException.class, () -> channel.call(RpcRequest.of("handshake")));
        channel.close();
        assertThrows(RpcException.class, () -> channel.call(RpcRequest.of("handshake")));
    }

    // ==================== 辅助方法 ====================

    private RpcChannel open() {
        return new HttpRpcChannelFactory(Duration.ofSeconds(2)).open("lights", URI.create(server.baseUrl()));
    }
}
