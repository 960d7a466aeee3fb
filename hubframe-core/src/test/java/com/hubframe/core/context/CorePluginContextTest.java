package com.hubframe.core.context;

import com.hubframe.api.exception.HubException;
import com.hubframe.api.model.RuntimeMode;
import com.hubframe.core.cache.CaffeineKeyValueCache;
import com.hubframe.core.device.BindingRegistry;
import com.hubframe.core.event.TopicEventBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CorePluginContext 单元测试")
public class CorePluginContextTest {

    private TopicEventBus bus;
    private BindingRegistry bindings;
    private CaffeineKeyValueCache cache;
    private CorePluginContext context;

    @BeforeEach
    void setUp() {
        bus = new TopicEventBus(0, 10, 100, 100, 1);
        bindings = new BindingRegistry();
        cache = new CaffeineKeyValueCache(Duration.ofMinutes(1), 100);
        context = new CorePluginContext("lights", RuntimeMode.IN_PROCESS, Map.of("brightness", 80),
                bus, bindings, cache, null);
    }

    @AfterEach
    void tearDown() {
        bus.shutdown();
    }

    @Test
    @DisplayName("release 回收订阅、绑定和缓存")
    void releaseReclaimsEverything() {
        context.subscribeEvent("device.*.updated", e -> { });
        bus.subscribe("lights.extra", e -> { }, "lights");
        context.bindDevices("type=light");
        context.getCache().orElseThrow().set("scene", "movie");
        cache.set("plugin:blinds:scene", "day");

        context.release();

        assertEquals(0, bus.subscriptionCount("lights"));
        assertFalse(bindings.hasBindings("lights"));
        assertTrue(cache.get("plugin:lights:scene").isEmpty());
        assertTrue(cache.get("plugin:blinds:scene").isPresent());
        assertTrue(context.isReleased());
    }

    @Test
    @DisplayName("释放后拒绝所有操作")
    void releasedContextRejectsOperations() {
        context.release();
        context.release();

        assertThrows(HubException.class, () -> context.emitEvent("lights.state", Map.of()));
        assertThrows(HubException.class, () -> context.bindDevices("*"));
        assertThrows(HubException.class, () -> context.subscribeEvent("a", e -> { }));
    }

    @Test
    @DisplayName("配置是只读快照")
    void configIsSnapshot() {
        Map<String, Object> source = new HashMap<>(Map.of("brightness", 80));
        CorePluginContext ctx = new CorePluginContext("lights", RuntimeMode.IN_PROCESS, source, bus, bindings, null, null);
        source.put("brightness", 10);

        assertEquals(80, ctx.getConfig().get("brightness"));
        assertThrows(UnsupportedOperationException.class, () -> ctx.getConfig().put("x", 1));
        assertTrue(ctx.getCache().isEmpty());
        assertTrue(ctx.getTokenService().isEmpty());
    }

    @Test
    @DisplayName("发布的事件来源标记为插件")
    void emitTagsSource() {
        context.emitEvent("lights.state", Map.of("on", true));

        assertEquals("lights", bus.recentEvents("lights.state").get(0).source());
    }
}
