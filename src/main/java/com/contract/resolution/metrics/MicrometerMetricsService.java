package com.contract.resolution.metrics;

import com.contract.resolution.core.model.ResolutionTier;
import com.contract.resolution.validation.ErrorCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code clause.resolution.duration}: Timer (tag: outcome)</li>
 *   <li>{@code clause.contest.decided}: Counter (tag: tier)</li>
 *   <li>{@code clause.resolution.fuzzy}: Counter</li>
 *   <li>{@code registry.mutation.accepted}: Counter (tag: operation)</li>
 *   <li>{@code registry.mutation.rejected}: Counter (tags: operation, code)</li>
 *   <li>{@code registry.override.inferred}: Counter</li>
 *   <li>{@code registry.snapshot.version}: Gauge (tag: contractId)</li>
 *   <li>{@code clause.cache.hit} and {@code clause.cache.miss}: Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> versionGauges = new ConcurrentHashMap<>();
    private final Counter fuzzyMatchCounter;
    private final Counter inferredCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.fuzzyMatchCounter = Counter.builder("clause.resolution.fuzzy")
                .description("Resolutions answered through a variant spelling")
                .register(registry);
        this.inferredCounter = Counter.builder("registry.override.inferred")
                .description("Overrides added by group-precedence inference")
                .register(registry);
        this.cacheHitCounter = Counter.builder("clause.cache.hit")
                .description("Number of effective clause cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("clause.cache.miss")
                .description("Number of effective clause cache misses")
                .register(registry);
    }

    @Override
    public void recordResolutionDuration(String outcome, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(outcome, k ->
                Timer.builder("clause.resolution.duration")
                        .description("Duration of effective clause resolution")
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementContestDecided(ResolutionTier tier) {
        counter("contest:" + tier.name(), () -> Counter.builder("clause.contest.decided")
                .description("Pairwise contests decided per tier")
                .tag("tier", tier.name())
                .register(registry)).increment();
    }

    @Override
    public void incrementFuzzyMatch() {
        fuzzyMatchCounter.increment();
    }

    @Override
    public void incrementMutationAccepted(String operation) {
        counter("accepted:" + operation, () -> Counter.builder("registry.mutation.accepted")
                .description("Accepted registry mutations")
                .tag("operation", operation)
                .register(registry)).increment();
    }

    @Override
    public void incrementMutationRejected(String operation, ErrorCode code) {
        counter("rejected:" + operation + ":" + code.name(), () -> Counter.builder("registry.mutation.rejected")
                .description("Rejected registry mutations")
                .tag("operation", operation)
                .tag("code", code.name())
                .register(registry)).increment();
    }

    @Override
    public void incrementOverrideInferred() {
        inferredCounter.increment();
    }

    @Override
    public void recordSnapshotVersion(String contractId, long version) {
        versionGauges.computeIfAbsent(contractId, id -> {
            AtomicLong holder = new AtomicLong();
            registry.gauge("registry.snapshot.version",
                    Tags.of("contractId", id), holder);
            return holder;
        }).set(version);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter counter(String key, Supplier<Counter> factory) {
        return counterCache.computeIfAbsent(key, k -> factory.get());
    }
}
