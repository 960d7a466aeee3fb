package com.hubframe.core.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.hubframe.api.cache.KeyValueCache;
import com.hubframe.core.config.HubFrameConfig;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 基于 Caffeine 的键值缓存
 * 每个条目携带自己的过期时间，未指定时使用默认 TTL。
 */
@Slf4j
public class CaffeineKeyValueCache implements KeyValueCache {

    private final Cache<String, Entry> cache;
    private final Duration defaultTtl;

    public CaffeineKeyValueCache(HubFrameConfig config) {
        this(Duration.ofSeconds(config.getCacheDefaultTtlSeconds()), config.getCacheMaximumSize());
    }

    public CaffeineKeyValueCache(Duration defaultTtl, long maximumSize) {
        this.defaultTtl = defaultTtl;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new EntryExpiry())
                .build();
    }

    @Override
    public Optional<Object> get(String key) {
        Entry entry = cache.getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.value());
    }

    @Override
    public void set(String key, Object value, @Nullable Duration ttl) {
        Duration effective = ttl == null || ttl.isNegative() || ttl.isZero() ? defaultTtl : ttl;
        cache.put(key, new Entry(value, effective.toNanos()));
    }

    @Override
    public boolean delete(String key) {
        return cache.asMap().remove(key) != null;
    }

    @Override
    public int deletePattern(String pattern) {
        Pattern regex = globToRegex(pattern);
        List<String> keys = cache.asMap().keySet().stream()
                .filter(k -> regex.matcher(k).matches())
                .toList();
        cache.invalidateAll(keys);
        if (!keys.isEmpty()) {
            log.debug("Deleted {} cache keys matching {}", keys.size(), pattern);
        }
        return keys.size();
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    private static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (String part : glob.split("\\*", -1)) {
            if (!regex.isEmpty()) {
                regex.append(".*");
            }
            regex.append(Pattern.quote(part));
        }
        return Pattern.compile(regex.toString());
    }

    private record Entry(Object value, long ttlNanos) {
    }

    private static final class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(@NonNull String key, @NonNull Entry entry, long currentTime) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(@NonNull String key, @NonNull Entry entry, long currentTime,
                                      long currentDuration) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterRead(@NonNull String key, @NonNull Entry entry, long currentTime,
                                    long currentDuration) {
            return currentDuration;
        }
    }
}
