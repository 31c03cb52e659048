package com.evidence.consensus.identity.cache;

import com.evidence.consensus.identity.IdentityResolution;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed identity resolution cache.
 */
public class CaffeineResolutionCache implements ResolutionCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResolutionCache.class);

    private final Cache<CacheKey, IdentityResolution> cache;

    public CaffeineResolutionCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("identity.cache.initialized maxSize={} ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    /**
     * Creates the cache matching the config: Caffeine when enabled, no-op otherwise.
     */
    public static ResolutionCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineResolutionCache(config) : new NoOpResolutionCache();
    }

    @Override
    public Optional<IdentityResolution> get(String rawName, String aliasCode, String externalId) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(rawName, aliasCode, externalId)));
    }

    @Override
    public void put(String rawName, String aliasCode, String externalId, IdentityResolution resolution) {
        cache.put(new CacheKey(rawName, aliasCode, externalId), resolution);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("identity.cache.invalidated");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    record CacheKey(String rawName, String aliasCode, String externalId) {}
}
