package com.blackboard.store;

import com.blackboard.contract.Fact;
import com.blackboard.contract.FactContractValidator;

import java.time.Clock;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only fact log held in an arena array with a per-kind position index.
 *
 * Appends are serialized by a single lock, which covers id assignment, the arena
 * write and the index update. Each append ends by publishing a new
 * {@link FactSnapshot} through a volatile field, so {@link #snapshot()} is a single
 * volatile read and never waits for a writer.
 */
public class InMemoryFactStore implements FactStore {

    private static final int INITIAL_CAPACITY = 64;

    private final FactContractValidator validator;
    private final Clock clock;
    private final ReentrantLock appendLock = new ReentrantLock();

    // guarded by appendLock
    private Fact[] arena = new Fact[INITIAL_CAPACITY];
    private final Map<String, int[]> kindSlots = new HashMap<>();

    private volatile FactSnapshot published = FactSnapshot.EMPTY;
    private volatile boolean closed;

    public InMemoryFactStore() {
        this(new FactContractValidator(), Clock.systemUTC());
    }

    public InMemoryFactStore(FactContractValidator validator, Clock clock) {
        this.validator = validator;
        this.clock = clock;
    }

    @Override
    public Fact append(String kind, String producer, Map<String, Object> payload,
                       double confidence, Set<Long> dependsOn, int round) {
        appendLock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("fact store is closed");
            }
            FactSnapshot current = published;
            long latestId = current.version();
            validator.validate(kind, producer, payload, confidence, dependsOn, latestId);

            Fact fact = new Fact(latestId + 1, kind, producer, payload, confidence,
                clock.instant(), round, dependsOn);

            int position = current.size();
            if (position == arena.length) {
                arena = Arrays.copyOf(arena, arena.length * 2);
            }
            arena[position] = fact;

            published = new FactSnapshot(arena, position + 1, indexWith(current, kind, position));
            return fact;
        } finally {
            appendLock.unlock();
        }
    }

    private Map<String, FactSnapshot.KindIndex> indexWith(FactSnapshot current, String kind, int position) {
        int count = current.count(kind);

        int[] slots = kindSlots.get(kind);
        if (slots == null) {
            slots = new int[16];
        } else if (count == slots.length) {
            slots = Arrays.copyOf(slots, slots.length * 2);
        }
        slots[count] = position;
        kindSlots.put(kind, slots);

        Map<String, FactSnapshot.KindIndex> next = new HashMap<>(current.index());
        next.put(kind, new FactSnapshot.KindIndex(slots, count + 1));
        return Map.copyOf(next);
    }

    @Override
    public FactSnapshot snapshot() {
        return published;
    }

    @Override
    public long getLatestSequence() {
        return published.version();
    }

    @Override
    public void close() {
        appendLock.lock();
        try {
            closed = true;
        } finally {
            appendLock.unlock();
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }
}
