package com.hubframe.core.concurrent;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 守护线程工厂，线程名为 {@code <prefix>-<序号>}
 */
@Slf4j
public class NamedThreadFactory implements ThreadFactory {

    private final String prefix;
    private final AtomicInteger threadNumber = new AtomicInteger(1);

    public NamedThreadFactory(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread t = new Thread(r, prefix + "-" + threadNumber.getAndIncrement());
        // 不阻止 JVM 退出
        t.setDaemon(true);
        t.setUncaughtExceptionHandler((thread, e) ->
                log.error("Uncaught exception in thread {}: {}", thread.getName(), e.getMessage(), e));
        return t;
    }
}
