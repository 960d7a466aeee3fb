package com.hubframe.core.rpc;

import com.hubframe.api.model.RuntimeMode;
import com.hubframe.core.context.CorePluginContext;
import com.hubframe.core.device.BindingRegistry;
import com.hubframe.core.event.TopicEventBus;
import com.hubframe.core.testing.ScriptedRpcChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RemotePluginProxy 单元测试")
public class RemotePluginProxyTest {

    private TopicEventBus bus;
    private BindingRegistry bindings;
    private CorePluginContext context;
    private ScriptedRpcChannel channel;
    private RemotePluginProxy proxy;

    @BeforeEach
    void setUp() {
        bus = new TopicEventBus(0, 10, 100, 100, 1);
        bindings = new BindingRegistry();
        context = new CorePluginContext("lights", RuntimeMode.MICROSERVICE, Map.of("brightness", 80),
                bus, bindings, null, null);
        channel = ScriptedRpcChannel.healthyRemote();
        proxy = new RemotePluginProxy("lights", channel);
    }

    @AfterEach
    void tearDown() {
        bus.shutdown();
    }

    @Test
    @DisplayName("加载前的入站调用被拒绝")
    void inboundBeforeLoad() {
        assertFalse(proxy.handleInbound(RpcRequest.of("emitEvent", Map.of("topic", "lights.x"))).ok());
    }

    @Test
    @DisplayName("onLoad 发送模式和配置")
    void onLoadSendsModeAndConfig() {
        proxy.onLoad(context);

        RpcRequest sent = channel.requests.get(0);
        assertEquals("onLoad", sent.method());
        assertEquals("microservice", sent.params().get("mode"));
        assertEquals(Map.of("brightness", 80), sent.params().get("config"));
    }

    @Test
    @DisplayName("远端订阅的事件通过 deliver 推送")
    void subscriptionDeliversToRemote() {
        proxy.onLoad(context);

        RpcResponse subscribed = proxy.handleInbound(RpcRequest.of("subscribeEvent", Map.of("pattern", "device.*.updated")));
        assertTrue(subscribed.ok());
        bus.emit("device.lamp.updated", Map.of("on", true));

        await().atMost(Duration.ofSeconds(2)).until(() -> channel.methods().contains("deliver"));
        RpcRequest delivered = channel.requests.stream().filter(r -> r.method().equals("deliver")).findFirst().orElseThrow();
        assertEquals("device.lamp.updated", delivered.params().get("topic"));
        assertEquals("device.*.updated", delivered.params().get("pattern"));

        RpcResponse unsubscribed = proxy.handleInbound(RpcRequest.of("unsubscribeEvent",
                Map.of("subscriptionId", subscribed.result())));
        assertTrue(unsubscribed.ok());
        assertEquals(0, context.getSubscriptionCount());
    }

    @Test
    @DisplayName("入站绑定、缺少参数和未知方法")
    void inboundBindAndErrors() {
        proxy.onLoad(context);

        assertTrue(proxy.handleInbound(RpcRequest.of("bindDevices", Map.of("selector", "type=light"))).ok());
        assertTrue(bindings.hasBindings("lights"));

        RpcResponse missing = proxy.handleInbound(RpcRequest.of("emitEvent"));
        assertFalse(missing.ok());
        assertTrue(missing.error().contains("topic"));
        assertFalse(proxy.handleInbound(RpcRequest.of("reboot")).ok());
    }

    @Test
    @DisplayName("握手和健康检查支持布尔或对象结果")
    void handshakeAndHealthShapes() {
        assertTrue(proxy.handshake());
        assertTrue(proxy.healthCheck());

        RemotePluginProxy bare = new RemotePluginProxy("lights",
                new ScriptedRpcChannel(request -> RpcResponse.success(Boolean.FALSE)));
        assertFalse(bare.handshake());
        assertFalse(bare.healthCheck());
    }
}
