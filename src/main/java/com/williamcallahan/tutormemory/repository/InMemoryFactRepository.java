package com.williamcallahan.tutormemory.repository;

import com.williamcallahan.tutormemory.domain.errors.FactNotFoundException;
import com.williamcallahan.tutormemory.domain.errors.FactPersistenceException;
import com.williamcallahan.tutormemory.domain.memory.Fact;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory fact repository backed by a {@link ConcurrentHashMap}.
 *
 * <p>Each row remembers its insertion sequence so queries return facts in a stable order.</p>
 */
public class InMemoryFactRepository implements FactRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryFactRepository.class);

    private final ConcurrentHashMap<String, StoredFact> facts = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public InMemoryFactRepository() {
        log.info("Using in-memory fact repository");
    }

    @Override
    public Fact insert(Fact fact) {
        Fact stored = fact.id() == null || fact.id().isBlank() ? fact.withId(UUID.randomUUID().toString()) : fact;
        if (facts.putIfAbsent(stored.id(), new StoredFact(sequence.incrementAndGet(), stored)) != null) {
            throw new FactPersistenceException("Fact already exists: " + stored.id());
        }
        log.debug("Inserted fact {} for user {}", stored.id(), stored.userId());
        return stored;
    }

    @Override
    public Optional<Fact> findById(String id) {
        StoredFact row = facts.get(id);
        return row == null ? Optional.empty() : Optional.of(row.fact());
    }

    @Override
    public Fact update(Fact fact) {
        StoredFact replaced = facts.computeIfPresent(fact.id(), (id, row) -> new StoredFact(row.sequence(), fact));
        if (replaced == null) {
            throw new FactNotFoundException(fact.id());
        }
        return fact;
    }

    @Override
    public boolean delete(String id) {
        return facts.remove(id) != null;
    }

    @Override
    public List<Fact> find(FactQuery query) {
        return facts.values().stream()
                .filter(row -> query.matches(row.fact()))
                .sorted(Comparator.comparingLong(StoredFact::sequence))
                .map(StoredFact::fact)
                .toList();
    }

    private record StoredFact(long sequence, Fact fact) {
    }
}
