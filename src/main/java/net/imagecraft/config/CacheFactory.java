package net.imagecraft.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Factory for creating Caffeine caches with consistent configuration.
 * Centralizes cache creation to reduce duplication across services.
 */
@Component
public class CacheFactory {

    /**
     * Create a cache whose entries expire a fixed time after they were written.
     */
    public <K, V> Cache<K, V> createCache(String name, int maxSize, Duration ttl) {
        return Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(ttl)
            .recordStats()
            .build();
    }

    /**
     * Create a cache whose entries expire once they go unread and unwritten for {@code idle}.
     */
    public <K, V> Cache<K, V> createAccessExpiringCache(String name, int maxSize, Duration idle) {
        return Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterAccess(idle)
            .recordStats()
            .build();
    }
}
