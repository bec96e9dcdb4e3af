package com.contract.resolution.metrics;

import com.contract.resolution.core.model.ResolutionTier;
import com.contract.resolution.validation.ErrorCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordResolutionDuration("resolved", Duration.ofMillis(5));
                noOp.incrementContestDecided(ResolutionTier.FULL);
                noOp.incrementFuzzyMatch();
                noOp.incrementMutationAccepted("addChunk");
                noOp.incrementMutationRejected("addOverride", ErrorCode.ADDENDUM_ORDER);
                noOp.incrementOverrideInferred();
                noOp.recordSnapshotVersion("c1", 3);
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record resolution duration per outcome")
        void recordResolutionDuration() {
            metrics.recordResolutionDuration("resolved", Duration.ofMillis(2));
            metrics.recordResolutionDuration("resolved", Duration.ofMillis(3));
            metrics.recordResolutionDuration("UNRESOLVED_REFERENCE", Duration.ofMillis(1));

            Timer resolved = registry.find("clause.resolution.duration").tag("outcome", "resolved").timer();
            Timer unresolved = registry.find("clause.resolution.duration").tag("outcome", "UNRESOLVED_REFERENCE").timer();

            assertNotNull(resolved);
            assertEquals(2, resolved.count());
            assertNotNull(unresolved);
            assertEquals(1, unresolved.count());
        }

        @Test
        @DisplayName("Should count contests per tier")
        void incrementContestDecided() {
            metrics.incrementContestDecided(ResolutionTier.FULL);
            metrics.incrementContestDecided(ResolutionTier.FULL);
            metrics.incrementContestDecided(ResolutionTier.SEQUENCE);

            Counter full = registry.find("clause.contest.decided").tag("tier", "FULL").counter();
            Counter sequence = registry.find("clause.contest.decided").tag("tier", "SEQUENCE").counter();

            assertEquals(2.0, full.count());
            assertEquals(1.0, sequence.count());
        }

        @Test
        @DisplayName("Should count registry mutations by operation and code")
        void mutationCounters() {
            metrics.incrementMutationAccepted("addChunk");
            metrics.incrementMutationRejected("addOverride", ErrorCode.ADDENDUM_ORDER);
            metrics.incrementMutationRejected("addOverride", ErrorCode.ADDENDUM_ORDER);

            Counter accepted = registry.find("registry.mutation.accepted").tag("operation", "addChunk").counter();
            Counter rejected = registry.find("registry.mutation.rejected")
                    .tag("operation", "addOverride")
                    .tag("code", "ADDENDUM_ORDER")
                    .counter();

            assertEquals(1.0, accepted.count());
            assertEquals(2.0, rejected.count());
        }

        @Test
        @DisplayName("Should track the latest snapshot version per contract")
        void recordSnapshotVersion() {
            metrics.recordSnapshotVersion("c1", 3);
            metrics.recordSnapshotVersion("c1", 7);
            metrics.recordSnapshotVersion("c2", 1);

            Gauge c1 = registry.find("registry.snapshot.version").tag("contractId", "c1").gauge();
            Gauge c2 = registry.find("registry.snapshot.version").tag("contractId", "c2").gauge();

            assertNotNull(c1);
            assertEquals(7.0, c1.value());
            assertEquals(1.0, c2.value());
        }

        @Test
        @DisplayName("Should count fuzzy matches, inferences and cache hits and misses")
        void simpleCounters() {
            metrics.incrementFuzzyMatch();
            metrics.incrementOverrideInferred();
            metrics.incrementOverrideInferred();
            metrics.recordCacheHit();
            metrics.recordCacheMiss();
            metrics.recordCacheMiss();

            assertEquals(1.0, registry.find("clause.resolution.fuzzy").counter().count());
            assertEquals(2.0, registry.find("registry.override.inferred").counter().count());
            assertEquals(1.0, registry.find("clause.cache.hit").counter().count());
            assertEquals(2.0, registry.find("clause.cache.miss").counter().count());
        }
    }
}
