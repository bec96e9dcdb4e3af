package com.contract.resolution.metrics;

import com.contract.resolution.core.model.ResolutionTier;
import com.contract.resolution.validation.ErrorCode;

import java.time.Duration;

/**
 * Interface for recording engine metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine works
 * without a metrics backend.
 */
public interface MetricsService {

    /**
     * Records one resolution. {@code outcome} is {@code resolved} or the failing error code.
     */
    void recordResolutionDuration(String outcome, Duration duration);

    /**
     * Counts a contest decided at the given tier.
     */
    void incrementContestDecided(ResolutionTier tier);

    void incrementFuzzyMatch();

    /**
     * Counts an accepted registry mutation, e.g. {@code addChunk}.
     */
    void incrementMutationAccepted(String operation);

    void incrementMutationRejected(String operation, ErrorCode code);

    void incrementOverrideInferred();

    void recordSnapshotVersion(String contractId, long version);

    void recordCacheHit();

    void recordCacheMiss();
}
