package com.hubframe.core.container;

import com.hubframe.api.exception.PluginLoadException;
import com.hubframe.api.model.RuntimeMode;
import com.hubframe.core.context.CorePluginContext;
import com.hubframe.core.device.BindingRegistry;
import com.hubframe.core.event.TopicEventBus;
import com.hubframe.core.testing.RecordingPlugin;
import com.hubframe.core.testing.ScriptedRpcChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HybridContainer 单元测试")
public class HybridContainerTest {

    private ExecutorService pool;
    private TopicEventBus bus;
    private CorePluginContext context;
    private RecordingPlugin shim;
    private ScriptedRpcChannel channel;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(2);
        bus = new TopicEventBus(0, 10, 100, 100, 1);
        context = new CorePluginContext("lights", RuntimeMode.HYBRID, Map.of(), bus, new BindingRegistry(), null, null);
        shim = new RecordingPlugin();
        channel = ScriptedRpcChannel.healthyRemote();
    }

    @AfterEach
    void tearDown() {
        bus.shutdown();
        pool.shutdownNow();
    }

    @Test
    @DisplayName("本地动作走 shim，其余转发远端")
    @SuppressWarnings("unchecked")
    void routesByAction() throws Exception {
        HybridContainer container = hybrid(localShim(), Set.of("status"));
        container.start(context, Duration.ofSeconds(1));

        Map<String, Object> local = (Map<String, Object>) container.invoke("status", Map.of());
        Map<String, Object> remote = (Map<String, Object>) container.invoke("turn_on", Map.of());

        assertEquals("local", local.get("handledBy"));
        assertEquals("remote", remote.get("handledBy"));
        assertEquals(List.of("status"), shim.invocations);
        assertTrue(container.isActive());
    }

    @Test
    @DisplayName("shim 启动失败时停止远端部分")
    void shimFailureStopsRemote() {
        shim.loadFailure = new IllegalStateException("shim broken");
        HybridContainer container = hybrid(localShim(), Set.of("status"));

        assertThrows(PluginLoadException.class, () -> container.start(context, Duration.ofSeconds(1)));
        assertTrue(channel.closed);
        assertFalse(container.isActive());
    }

    @Test
    @DisplayName("没有 shim 时全部转发远端")
    void remoteOnly() throws Exception {
        HybridContainer container = hybrid(null, Set.of());
        container.start(context, Duration.ofSeconds(1));

        container.invoke("status", Map.of());

        assertTrue(shim.invocations.isEmpty());
        container.stop(Duration.ofSeconds(1));
        assertTrue(channel.closed);
    }

    // ==================== 辅助方法 ====================

    private InProcessContainer localShim() {
        return new InProcessContainer("lights", shim, new PluginCallExecutor("lights", pool, 2, 1000, 100),
                RuntimeMode.HYBRID);
    }

    private HybridContainer hybrid(InProcessContainer local, Set<String> localActions) {
        MicroserviceContainer remote = new MicroserviceContainer("lights",
                new MicroserviceSpec(URI.create("http://127.0.0.1:9101"), List.of(), null, Map.of()),
                (id, uri) -> channel, Duration.ofMillis(20), Duration.ofSeconds(1));
        return new HybridContainer("lights", local, remote, localActions);
    }
}
