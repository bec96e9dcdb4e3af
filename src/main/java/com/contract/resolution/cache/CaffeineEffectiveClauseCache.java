package com.contract.resolution.cache;

import com.contract.resolution.core.model.CanonicalClauseId;
import com.contract.resolution.registry.ContractSnapshot;
import com.contract.resolution.registry.SnapshotListener;
import com.contract.resolution.resolver.ClauseResolutionResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Caffeine-backed effective clause cache with a contract index for targeted invalidation.
 * Implements {@link SnapshotListener} so a published snapshot or a retraction drops the
 * contract's entries.
 */
public class CaffeineEffectiveClauseCache implements EffectiveClauseCache, SnapshotListener {
    private static final Logger log = LoggerFactory.getLogger(CaffeineEffectiveClauseCache.class);

    private final Cache<CacheKey, ClauseResolutionResult> cache;
    // contractId -> keys cached for that contract
    private final ConcurrentMap<String, Set<CacheKey>> contractIndex = new ConcurrentHashMap<>();

    public CaffeineEffectiveClauseCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .removalListener((CacheKey key, ClauseResolutionResult value,
                                  RemovalCause cause) -> {
                    if (key != null) {
                        removeFromIndex(key);
                    }
                })
                .build();
        log.info("CaffeineEffectiveClauseCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<ClauseResolutionResult> get(String contractId, long version, CanonicalClauseId clauseId,
                                                String optionsKey) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(contractId, version, clauseId, optionsKey)));
    }

    @Override
    public void put(String contractId, long version, CanonicalClauseId clauseId, String optionsKey,
                    ClauseResolutionResult result) {
        CacheKey key = new CacheKey(contractId, version, clauseId, optionsKey);
        cache.put(key, result);
        contractIndex.computeIfAbsent(contractId, k -> ConcurrentHashMap.newKeySet()).add(key);
    }

    @Override
    public void invalidateContract(String contractId) {
        Set<CacheKey> keys = contractIndex.remove(contractId);
        if (keys != null) {
            cache.invalidateAll(keys);
            log.debug("Invalidated {} cache entries for contract {}", keys.size(), contractId);
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        contractIndex.clear();
        log.debug("Invalidated all cache entries");
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

    @Override
    public void onSnapshotPublished(ContractSnapshot snapshot) {
        invalidateContract(snapshot.getContractId());
    }

    @Override
    public void onOverrideRetracted(String contractId, String overrideId, Set<CanonicalClauseId> affectedClauses) {
        invalidateContract(contractId);
        log.debug("Cache invalidated for retraction of override {} ({} clauses)", overrideId, affectedClauses.size());
    }

    private void removeFromIndex(CacheKey key) {
        Set<CacheKey> keys = contractIndex.get(key.contractId());
        if (keys != null) {
            keys.remove(key);
        }
    }

    record CacheKey(String contractId, long version, CanonicalClauseId clauseId, String optionsKey) {}
}
