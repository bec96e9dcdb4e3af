package com.contract.resolution.registry;

import com.contract.resolution.audit.AuditAction;
import com.contract.resolution.audit.AuditEntry;
import com.contract.resolution.audit.AuditService;
import com.contract.resolution.core.model.CanonicalClauseId;
import com.contract.resolution.core.model.DocumentGroup;
import com.contract.resolution.core.model.DocumentOverride;
import com.contract.resolution.core.model.OverrideOrigin;
import com.contract.resolution.core.model.OverrideType;
import com.contract.resolution.lock.ContractWriteLock;
import com.contract.resolution.metrics.MetricsService;
import com.contract.resolution.validation.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.contract.resolution.ContractFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("ContractRegistry Tests")
@ExtendWith(MockitoExtension.class)
class ContractRegistryTest {

    @Mock
    private MetricsService metricsService;

    private AuditService auditService;
    private ContractRegistry registry;

    @BeforeEach
    void setUp() {
        auditService = new AuditService();
        registry = ContractRegistry.builder(CONTRACT)
                .auditService(auditService)
                .metricsService(metricsService)
                .actorId("tester")
                .build();
    }

    @Nested
    @DisplayName("Writes")
    class WriteTests {

        @Test
        @DisplayName("Accepted writes should publish a new snapshot and be audited")
        void testAcceptedWrite() {
            ContractSnapshot before = registry.snapshot();

            RegistryResult result = registry.addDocument(document("gc", DocumentGroup.C, 1));

            assertTrue(result.isAccepted());
            assertSame(result.snapshot(), registry.snapshot());
            assertEquals(before.getVersion() + 1, registry.snapshot().getVersion());
            assertEquals(0, before.documentCount());
            verify(metricsService).incrementMutationAccepted("addDocument");
            verify(metricsService).recordSnapshotVersion(CONTRACT, 1L);

            List<AuditEntry> entries = auditService.getEntriesForContract(CONTRACT);
            assertEquals(1, entries.size());
            assertEquals(AuditAction.DOCUMENT_ADDED, entries.get(0).action());
            assertEquals("tester", entries.get(0).actorId());
        }

        @Test
        @DisplayName("Rejected writes should keep the snapshot and be audited as rejections")
        void testRejectedWrite() {
            registry.addDocument(document("gc", DocumentGroup.C, 1));
            ContractSnapshot current = registry.snapshot();

            RegistryResult result = registry.addChunk(chunk("c1", "ghost", "1"));

            assertTrue(result.isRejected());
            assertSame(current, registry.snapshot());
            verify(metricsService).incrementMutationRejected("addChunk", ErrorCode.UNRESOLVED_REFERENCE);

            AuditEntry rejection = auditService.getEntriesByAction(AuditAction.MUTATION_REJECTED).get(0);
            assertEquals("CHUNK_ADDED", rejection.details().get("attemptedAction"));
            assertEquals("UNRESOLVED_REFERENCE", rejection.details().get("code"));
        }

        @Test
        @DisplayName("Unchanged snapshots should not be republished")
        void testNoOpWrite() {
            SnapshotListener listener = mock(SnapshotListener.class);
            registry.addDocument(document("pc", DocumentGroup.C, 2, "Particular Conditions"));
            registry.addDocument(document("gc", DocumentGroup.C, 1, "General Conditions"));
            registry.addOverride(override("o1", "pc", "gc", OverrideType.FULL));
            registry.addListener(listener);

            RegistryResult again = registry.addOverride(override("o1", "pc", "gc", OverrideType.FULL));

            assertTrue(again.isAccepted());
            verifyNoInteractions(listener);
        }

        @Test
        @DisplayName("Writes should be serialized through the contract lock")
        void testLockUsage() {
            ContractWriteLock lock = mock(ContractWriteLock.class);
            ContractRegistry locked = ContractRegistry.builder(CONTRACT).writeLock(lock).build();

            locked.addDocument(document("a", DocumentGroup.A, 1));

            InOrder order = inOrder(lock);
            order.verify(lock).lock(CONTRACT);
            order.verify(lock).unlock(CONTRACT);
        }
    }

    @Nested
    @DisplayName("Listeners")
    class ListenerTests {

        @Test
        @DisplayName("Listeners should receive every published snapshot")
        void testPublication() {
            List<Long> versions = Collections.synchronizedList(new ArrayList<>());
            registry.addListener(snapshot -> versions.add(snapshot.getVersion()));

            registry.addDocument(document("a", DocumentGroup.A, 1));
            registry.addDocument(document("b", DocumentGroup.B, 1));

            assertEquals(List.of(1L, 2L), versions);
        }

        @Test
        @DisplayName("A failing listener should not break the write")
        void testFailingListener() {
            registry.addListener(snapshot -> {
                throw new IllegalStateException("boom");
            });

            RegistryResult result = registry.addDocument(document("a", DocumentGroup.A, 1));

            assertTrue(result.isAccepted());
            assertEquals(1, registry.snapshot().documentCount());
        }

        @Test
        @DisplayName("Retraction should tell listeners which clauses were affected")
        void testRetractionNotice() {
            SnapshotListener listener = mock(SnapshotListener.class);
            registry.addDocument(document("gc", DocumentGroup.C, 1, "General Conditions"));
            registry.addDocument(document("d1", DocumentGroup.D, 1));
            registry.addChunk(chunk("gc-14.1", "gc", "14.1"));
            registry.addChunk(chunk("d1-14.1", "d1", "14.1"));
            registry.addOverride(override("o1", "d1", "gc", OverrideType.FULL));
            registry.addListener(listener);

            RegistryResult result = registry.retractOverride("o1");

            assertTrue(result.isAccepted());
            verify(listener).onSnapshotPublished(result.snapshot());
            verify(listener).onOverrideRetracted(CONTRACT, "o1", Set.of(CanonicalClauseId.of("14.1")));
            assertEquals(1, auditService.getEntriesByAction(AuditAction.OVERRIDE_RETRACTED).size());
        }

        @Test
        @DisplayName("Removed listeners should no longer be notified")
        void testRemoveListener() {
            SnapshotListener listener = mock(SnapshotListener.class);
            registry.addListener(listener);
            registry.removeListener(listener);

            registry.addDocument(document("a", DocumentGroup.A, 1));

            verifyNoInteractions(listener);
        }
    }

    @Test
    @DisplayName("Inference should add structural overrides once")
    void testInferOverrides() {
        registry.addDocument(document("a", DocumentGroup.A, 1));
        registry.addDocument(document("b", DocumentGroup.B, 1));
        registry.addDocument(document("gc", DocumentGroup.C, 1, "General Conditions"));
        registry.addDocument(document("pc", DocumentGroup.C, 2, "Particular Conditions"));
        registry.addDocument(document("d1", DocumentGroup.D, 1));
        registry.addDocument(document("d2", DocumentGroup.D, 2));

        List<DocumentOverride> inferred = registry.inferOverrides();

        assertEquals(List.of("inferred:pc->gc", "inferred:d2->d1", "inferred:b->a"),
                inferred.stream().map(DocumentOverride::id).toList());
        assertTrue(inferred.stream().allMatch(o -> o.origin() == OverrideOrigin.INFERRED));
        verify(metricsService, times(3)).incrementOverrideInferred();
        assertTrue(registry.inferOverrides().isEmpty());
    }

    @Test
    @DisplayName("Inference should skip a proposal that would close a cycle")
    void testInferenceSkipsCycles() {
        registry.addDocument(document("d1", DocumentGroup.D, 1));
        registry.addDocument(document("d2", DocumentGroup.D, 2));
        registry.addDocument(document("d3", DocumentGroup.D, 3));
        registry.addOverride(override("back", "d1", "d3", OverrideType.FULL));
        registry.addOverride(override("mid", "d3", "d2", OverrideType.FULL));

        List<DocumentOverride> inferred = registry.inferOverrides();

        // d2 -> d1 would close d1 -> d3 -> d2 -> d1
        assertTrue(inferred.isEmpty());
        verify(metricsService, never()).incrementOverrideInferred();
        verify(metricsService, atLeastOnce()).incrementMutationRejected(eq("inferOverride"), eq(ErrorCode.ADDENDUM_ORDER));
    }

    @Test
    @DisplayName("Concurrent writers should never lose an update")
    void testConcurrentWrites() throws Exception {
        registry.addDocument(document("gc", DocumentGroup.C, 1, "General Conditions"));
        int writers = 8;
        int perWriter = 25;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int w = 0; w < writers; w++) {
                int writer = w;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perWriter; i++) {
                        String clause = (writer + 1) + "." + (i + 1);
                        registry.addChunk(chunk("w" + writer + "-" + i, "gc", clause));
                        ContractSnapshot seen = registry.snapshot();
                        assertEquals(seen.getChunks().size() + 1, seen.getVersion());
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(writers * perWriter, registry.snapshot().getChunks().size());
        assertEquals(1 + writers * perWriter, registry.snapshot().getVersion());
    }

    @Test
    @DisplayName("Builder should reject an initial snapshot of another contract")
    void testInitialSnapshotMismatch() {
        assertThrows(IllegalArgumentException.class, () -> ContractRegistry.builder(CONTRACT)
                .initialSnapshot(ContractSnapshot.empty("other"))
                .build());
    }
}
