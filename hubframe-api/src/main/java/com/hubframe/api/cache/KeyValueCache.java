package com.hubframe.api.cache;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Optional;

/**
 * 键值缓存协作者接口
 * <p>
 * {@code deletePattern} 支持 {@code *} 通配，如 {@code plugin:lights:*}。
 *
 * @author HubFrame
 */
public interface KeyValueCache {

    Optional<Object> get(String key);

    /**
     * @param ttl 为空时使用实现的默认过期时间
     */
    void set(String key, Object value, @Nullable Duration ttl);

    default void set(String key, Object value) {
        set(key, value, null);
    }

    boolean delete(String key);

    /**
     * @return 删除的条目数
     */
    int deletePattern(String pattern);
}
