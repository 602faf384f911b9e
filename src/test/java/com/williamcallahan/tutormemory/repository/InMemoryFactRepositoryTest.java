package com.williamcallahan.tutormemory.repository;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.tutormemory.domain.errors.FactNotFoundException;
import com.williamcallahan.tutormemory.domain.errors.FactPersistenceException;
import com.williamcallahan.tutormemory.domain.memory.Fact;
import com.williamcallahan.tutormemory.domain.memory.FactType;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies in-memory fact persistence and query filtering.
 */
class InMemoryFactRepositoryTest {

    private static final Instant AT = Instant.parse("2024-01-01T00:00:00Z");

    private InMemoryFactRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryFactRepository();
    }

    @Test
    void insertAssignsIdsAndKeepsInsertionOrder() {
        Fact first = repository.insert(fact(null, "user_1", FactType.GOAL, "math", true));
        Fact second = repository.insert(fact(null, "user_1", FactType.GOAL, "reading", true));

        assertNotNull(first.id());
        assertEquals(List.of(first, second), repository.find(FactQuery.activeFor("user_1")));
    }

    @Test
    void duplicateIdIsRejected() {
        repository.insert(fact("fixed", "user_1", FactType.GOAL, null, true));

        assertThrows(FactPersistenceException.class,
                () -> repository.insert(fact("fixed", "user_1", FactType.GOAL, null, true)));
    }

    @Test
    void updateRequiresAnExistingFact() {
        assertThrows(FactNotFoundException.class,
                () -> repository.update(fact("missing", "user_1", FactType.GOAL, null, true)));
    }

    @Test
    void deleteReportsWhetherAFactWasRemoved() {
        Fact stored = repository.insert(fact(null, "user_1", FactType.GOAL, null, true));

        assertTrue(repository.delete(stored.id()));
        assertFalse(repository.delete(stored.id()));
        assertTrue(repository.findById(stored.id()).isEmpty());
    }

    @Test
    void queriesFilterByUserActivityTypeAndSubject() {
        repository.insert(fact(null, "user_1", FactType.GOAL, "math", true));
        repository.insert(fact(null, "user_1", FactType.GOAL, "math", false));
        repository.insert(fact(null, "user_1", FactType.STRUGGLE, "math", true));
        repository.insert(fact(null, "user_2", FactType.GOAL, "math", true));

        assertEquals(1, repository.count(FactQuery.activeMatches("user_1", FactType.GOAL, "math")));
        assertEquals(3, repository.count(FactQuery.allFor("user_1")));
        assertEquals(2, repository.count(FactQuery.activeFor("user_1")));
        assertEquals(1, repository.count(FactQuery.activeFor("user_1").withFactTypes(Set.of(FactType.STRUGGLE))));
        assertEquals(0, repository.count(FactQuery.activeMatches("user_1", FactType.GOAL, null)));
    }

    @Test
    void blankUserIdIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> FactQuery.activeFor(" "));
    }

    private static Fact fact(String id, String userId, FactType type, String subject, boolean active) {
        return new Fact(id, userId, null, null, type, subject, "details", null, active, Set.of(), AT, AT);
    }
}
