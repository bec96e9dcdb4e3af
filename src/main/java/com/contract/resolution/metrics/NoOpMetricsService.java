package com.contract.resolution.metrics;

import com.contract.resolution.core.model.ResolutionTier;
import com.contract.resolution.validation.ErrorCode;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolutionDuration(String outcome, Duration duration) {
    }

    @Override
    public void incrementContestDecided(ResolutionTier tier) {
    }

    @Override
    public void incrementFuzzyMatch() {
    }

    @Override
    public void incrementMutationAccepted(String operation) {
    }

    @Override
    public void incrementMutationRejected(String operation, ErrorCode code) {
    }

    @Override
    public void incrementOverrideInferred() {
    }

    @Override
    public void recordSnapshotVersion(String contractId, long version) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
