package com.hubframe.core.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NamespacedCache 单元测试")
public class NamespacedCacheTest {

    private CaffeineKeyValueCache shared;
    private NamespacedCache lights;
    private NamespacedCache blinds;

    @BeforeEach
    void setUp() {
        shared = new CaffeineKeyValueCache(Duration.ofMinutes(5), 1000);
        lights = new NamespacedCache(shared, "lights");
        blinds = new NamespacedCache(shared, "blinds");
    }

    @Test
    @DisplayName("键加上插件前缀，插件之间互不可见")
    void keysArePrefixed() {
        lights.set("scene", "movie");

        assertEquals(Optional.of("movie"), shared.get("plugin:lights:scene"));
        assertTrue(blinds.get("scene").isEmpty());
    }

    @Test
    @DisplayName("clear 只清空自己的命名空间")
    void clearOnlyOwnNamespace() {
        lights.set("a", 1);
        lights.set("b", 2);
        blinds.set("a", 3);

        assertEquals(2, lights.clear());
        assertTrue(lights.get("a").isEmpty());
        assertEquals(Optional.of(3), blinds.get("a"));
    }
}
