package com.blackboard.coordinator;

import java.time.Duration;

/**
 * The overall run budget elapsed before convergence.
 */
public class RunTimeoutException extends RunException {

    private final Duration budget;
    private final int completedRounds;

    public RunTimeoutException(Duration budget, int completedRounds, int factCount) {
        super("run exceeded its " + budget.toMillis() + " ms budget after " + completedRounds
            + " completed rounds (" + factCount + " facts)", factCount);
        this.budget = budget;
        this.completedRounds = completedRounds;
    }

    public Duration getBudget() {
        return budget;
    }

    public int getCompletedRounds() {
        return completedRounds;
    }
}
