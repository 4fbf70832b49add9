package com.blackboard.store;

import com.blackboard.contract.Fact;

import java.util.List;
import java.util.Map;
import java.util.Set;

public interface FactStore {

    /**
     * Validates and appends a fact, assigning the next id.
     *
     * @throws com.blackboard.contract.FactValidationException when the fact is malformed; nothing is recorded
     * @throws IllegalStateException when the store has been closed
     */
    Fact append(String kind, String producer, Map<String, Object> payload,
                double confidence, Set<Long> dependsOn, int round);

    default Fact append(String kind, String producer, Map<String, Object> payload,
                        double confidence, Set<Long> dependsOn) {
        return append(kind, producer, payload, confidence, dependsOn, 0);
    }

    /** Point-in-time view; later appends are never visible through it. */
    FactSnapshot snapshot();

    default List<Fact> query(String kind) {
        return snapshot().query(kind);
    }

    long getLatestSequence();

    /** Makes the store read-only. Idempotent. */
    void close();

    boolean isClosed();
}
