package com.blackboard.coordinator;

import com.blackboard.contract.Fact;

import java.util.List;
import java.util.Optional;

/**
 * Terminal outcome of a run. Facts are the full committed log, verdict included.
 *
 * @param error StallException or RunTimeoutException for runs that did not converge, else null
 */
public record RunResult(
    String runId,
    RunState status,
    int rounds,
    Fact verdict,
    List<Fact> facts,
    List<RoundReport> roundReports,
    RunException error
) {

    public RunResult {
        facts = List.copyOf(facts);
        roundReports = List.copyOf(roundReports);
    }

    public boolean isConverged() {
        return status == RunState.CONVERGED;
    }

    public Optional<RunException> failure() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns this result, or throws the run-level error for stalled and timed-out runs.
     */
    public RunResult orThrow() {
        if (error != null) {
            throw error;
        }
        return this;
    }
}
