package com.evidence.consensus.identity.cache;

import com.evidence.consensus.identity.IdentityResolution;

import java.util.Optional;

/**
 * Cache for single-candidate identity resolutions.
 * Keyed by raw name, alias code and external identifier, which together fully determine
 * a resolution under one alias table.
 */
public interface ResolutionCache {

    /**
     * Gets a cached resolution.
     *
     * @param rawName    the raw candidate name
     * @param aliasCode  the development code, may be null
     * @param externalId the formatted external identifier, may be null
     * @return the cached resolution, or empty if not cached
     */
    Optional<IdentityResolution> get(String rawName, String aliasCode, String externalId);

    void put(String rawName, String aliasCode, String externalId, IdentityResolution resolution);

    /**
     * Invalidates all cache entries. Called when the alias table the entries were computed against changes.
     */
    void invalidateAll();

    CacheStats getStats();
}
