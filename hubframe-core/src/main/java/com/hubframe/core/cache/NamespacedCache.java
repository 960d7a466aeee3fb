package com.hubframe.core.cache;

import com.hubframe.api.cache.KeyValueCache;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Optional;

/**
 * 插件专属的缓存视图，所有键加上 {@code plugin:<id>:} 前缀
 */
public class NamespacedCache implements KeyValueCache {

    private final KeyValueCache delegate;
    private final String prefix;

    public NamespacedCache(KeyValueCache delegate, String pluginId) {
        this.delegate = delegate;
        this.prefix = namespaceOf(pluginId);
    }

    public static String namespaceOf(String pluginId) {
        return "plugin:" + pluginId + ":";
    }

    @Override
    public Optional<Object> get(String key) {
        return delegate.get(prefix + key);
    }

    @Override
    public void set(String key, Object value, @Nullable Duration ttl) {
        delegate.set(prefix + key, value, ttl);
    }

    @Override
    public boolean delete(String key) {
        return delegate.delete(prefix + key);
    }

    @Override
    public int deletePattern(String pattern) {
        return delegate.deletePattern(prefix + pattern);
    }

    /**
     * 清空整个命名空间
     */
    public int clear() {
        return delegate.deletePattern(prefix + "*");
    }
}
