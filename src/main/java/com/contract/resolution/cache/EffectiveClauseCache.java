package com.contract.resolution.cache;

import com.contract.resolution.core.model.CanonicalClauseId;
import com.contract.resolution.resolver.ClauseResolutionResult;

import java.util.Optional;

/**
 * Cache of resolution results keyed by contract, snapshot version, clause ID and options.
 * A key never outlives its snapshot version, so stale hits are impossible; invalidation
 * only frees memory.
 */
public interface EffectiveClauseCache {

    Optional<ClauseResolutionResult> get(String contractId, long version, CanonicalClauseId clauseId,
                                         String optionsKey);

    void put(String contractId, long version, CanonicalClauseId clauseId, String optionsKey,
             ClauseResolutionResult result);

    /**
     * Drops every entry of a contract.
     */
    void invalidateContract(String contractId);

    void invalidateAll();

    CacheStats getStats();
}
