package com.contract.resolution.audit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryAuditRepositoryTest {

    private InMemoryAuditRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryAuditRepository();
    }

    private AuditEntry entry(String subjectId, Instant timestamp) {
        return AuditEntry.builder()
                .action(AuditAction.CHUNK_ADDED)
                .contractId("c1")
                .subjectId(subjectId)
                .timestamp(timestamp)
                .build();
    }

    @Test
    @DisplayName("Should find entries in a time window")
    void testFindBetween() {
        Instant base = Instant.parse("2024-01-01T00:00:00Z");
        repository.save(entry("a", base));
        repository.save(entry("b", base.plusSeconds(60)));
        repository.save(entry("c", base.plusSeconds(120)));

        List<AuditEntry> found = repository.findBetween(base.plusSeconds(30), base.plusSeconds(120));

        assertEquals(List.of("b", "c"), found.stream().map(AuditEntry::subjectId).toList());
    }

    @Test
    @DisplayName("Should return the most recent entries in insertion order")
    void testFindRecent() {
        Instant now = Instant.now();
        repository.save(entry("a", now));
        repository.save(entry("b", now));
        repository.save(entry("c", now));

        assertEquals(List.of("b", "c"), repository.findRecent(2).stream().map(AuditEntry::subjectId).toList());
        assertEquals(3, repository.findRecent(10).size());
        assertEquals(3, repository.count());
    }

    @Test
    @DisplayName("Returned lists should not expose internal state")
    void testImmutableView() {
        repository.save(entry("a", Instant.now()));

        assertThrows(UnsupportedOperationException.class, () -> repository.findAll().clear());
    }
}
