package com.blackboard.verdict;

import com.blackboard.store.FactSnapshot;

import java.util.Map;
import java.util.Set;

/**
 * Reduces the final fact set of a run to a single outcome.
 * Aggregators are deterministic functions of the snapshot and never write facts.
 */
public interface VerdictAggregator {

    /** Mode written into the verdict payload, e.g. "forensic". */
    String mode();

    Verdict aggregate(FactSnapshot snapshot);

    /**
     * Result of aggregation, turned into the terminal verdict fact by the coordinator.
     *
     * @param label     discrete classification
     * @param score     risk probability or compliance score, in [0,1]
     * @param payload   mode-specific details
     * @param dependsOn every fact that contributed, seeds included
     */
    record Verdict(
        String label,
        double score,
        Map<String, Object> payload,
        Set<Long> dependsOn
    ) {}
}
