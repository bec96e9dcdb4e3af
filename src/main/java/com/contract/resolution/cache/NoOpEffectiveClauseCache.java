package com.contract.resolution.cache;

import com.contract.resolution.core.model.CanonicalClauseId;
import com.contract.resolution.resolver.ClauseResolutionResult;

import java.util.Optional;

/**
 * Cache that stores nothing. Used when caching is disabled.
 */
public class NoOpEffectiveClauseCache implements EffectiveClauseCache {

    @Override
    public Optional<ClauseResolutionResult> get(String contractId, long version, CanonicalClauseId clauseId,
                                                String optionsKey) {
        return Optional.empty();
    }

    @Override
    public void put(String contractId, long version, CanonicalClauseId clauseId, String optionsKey,
                    ClauseResolutionResult result) {
        // no-op
    }

    @Override
    public void invalidateContract(String contractId) {
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
