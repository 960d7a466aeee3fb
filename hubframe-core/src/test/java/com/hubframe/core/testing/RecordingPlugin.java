package com.hubframe.core.testing;

import com.hubframe.api.context.PluginContext;
import com.hubframe.api.event.Event;
import com.hubframe.api.plugin.HubPlugin;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 测试用插件，记录生命周期回调和调用
 */
public class RecordingPlugin implements HubPlugin {

    public final AtomicInteger loads = new AtomicInteger();
    public final AtomicInteger unloads = new AtomicInteger();
    public final List<String> invocations = new CopyOnWriteArrayList<>();
    public final List<Event> received = new CopyOnWriteArrayList<>();

    public volatile boolean healthy = true;
    public volatile RuntimeException loadFailure;
    public volatile long loadDelayMs;
    public volatile String bindSelector;
    public volatile String subscribePattern;
    public volatile PluginContext context;

    @Override
    public void onLoad(PluginContext context) throws Exception {
        if (loadDelayMs > 0) {
            Thread.sleep(loadDelayMs);
        }
        if (loadFailure != null) {
            throw loadFailure;
        }
        this.context = context;
        if (bindSelector != null) {
            context.bindDevices(bindSelector);
        }
        if (subscribePattern != null) {
            context.subscribeEvent(subscribePattern, received::add);
        }
        loads.incrementAndGet();
    }

    @Override
    public void onUnload(PluginContext context) {
        unloads.incrementAndGet();
    }

    @Override
    public Object invoke(String action, Map<String, Object> params) {
        invocations.add(action);
        return Map.of("action", action, "handledBy", "local");
    }

    @Override
    public boolean healthCheck() {
        return healthy;
    }
}
