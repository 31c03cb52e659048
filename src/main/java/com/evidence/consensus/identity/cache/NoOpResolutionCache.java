package com.evidence.consensus.identity.cache;

import com.evidence.consensus.identity.IdentityResolution;

import java.util.Optional;

/**
 * No-op cache implementation, used when caching is disabled.
 */
public class NoOpResolutionCache implements ResolutionCache {

    @Override
    public Optional<IdentityResolution> get(String rawName, String aliasCode, String externalId) {
        return Optional.empty();
    }

    @Override
    public void put(String rawName, String aliasCode, String externalId, IdentityResolution resolution) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
