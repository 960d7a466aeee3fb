package com.hubframe.core.concurrent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PluginLocks 单元测试")
public class PluginLocksTest {

    private final PluginLocks locks = new PluginLocks();

    @Test
    @DisplayName("同一插件复用同一把锁")
    void sameLockPerPlugin() {
        assertSame(locks.lockFor("lights"), locks.lockFor("lights"));
        assertNotSame(locks.lockFor("lights"), locks.lockFor("scenes"));
    }

    @Test
    @DisplayName("插件删除后锁被丢弃")
    void releaseDropsIdleLock() {
        locks.withLock("lights", () -> { });

        locks.release("lights");

        assertEquals(0, locks.size());
    }

    @Test
    @DisplayName("持锁线程在锁内删除也会丢弃")
    void releaseInsideOwnLock() {
        locks.withLock("lights", () -> locks.release("lights"));

        assertEquals(0, locks.size());
    }

    @Test
    @DisplayName("其他线程持有时保留")
    void releaseKeepsLockHeldElsewhere() throws Exception {
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(1);
        Thread owner = new Thread(() -> locks.withLock("lights", () -> {
            held.countDown();
            try {
                done.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
        owner.start();
        assertTrue(held.await(5, TimeUnit.SECONDS));
        ReentrantLock lock = locks.lockFor("lights");

        locks.release("lights");

        assertSame(lock, locks.lockFor("lights"));
        done.countDown();
        owner.join(5000);
    }
}
