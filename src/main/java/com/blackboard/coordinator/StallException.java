package com.blackboard.coordinator;

import java.util.List;

/**
 * Convergence was not reached within max_rounds.
 */
public class StallException extends RunException {

    private final int rounds;
    private final List<String> triggeredAgents;

    public StallException(int rounds, int factCount, List<String> triggeredAgents) {
        super("run did not converge within " + rounds + " rounds (" + factCount
            + " facts, still triggered: " + triggeredAgents + ")", factCount);
        this.rounds = rounds;
        this.triggeredAgents = List.copyOf(triggeredAgents);
    }

    public int getRounds() {
        return rounds;
    }

    public List<String> getTriggeredAgents() {
        return triggeredAgents;
    }
}
