package com.hubframe.core.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CaffeineKeyValueCache 单元测试")
public class CaffeineKeyValueCacheTest {

    private CaffeineKeyValueCache cache;

    @BeforeEach
    void setUp() {
        cache = new CaffeineKeyValueCache(Duration.ofMinutes(5), 1000);
    }

    @Test
    @DisplayName("读写与删除")
    void setGetDelete() {
        cache.set("lights:scene", "movie");

        assertEquals(Optional.of("movie"), cache.get("lights:scene"));
        assertTrue(cache.delete("lights:scene"));
        assertFalse(cache.delete("lights:scene"));
        assertTrue(cache.get("lights:scene").isEmpty());
    }

    @Test
    @DisplayName("条目按自己的 TTL 过期")
    void perEntryTtl() {
        cache.set("short", 1, Duration.ofMillis(50));
        cache.set("long", 2);

        await().atMost(Duration.ofSeconds(2)).until(() -> cache.get("short").isEmpty());
        assertEquals(Optional.of(2), cache.get("long"));
    }

    @Test
    @DisplayName("按通配模式删除")
    void deletePattern() {
        cache.set("plugin:lights:a", 1);
        cache.set("plugin:lights:b", 2);
        cache.set("plugin:blinds:a", 3);
        cache.set("plugin:lights.x", 4);

        assertEquals(2, cache.deletePattern("plugin:lights:*"));
        assertTrue(cache.get("plugin:blinds:a").isPresent());
        assertTrue(cache.get("plugin:lights.x").isPresent());
    }
}
