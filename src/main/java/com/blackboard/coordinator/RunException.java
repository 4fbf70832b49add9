package com.blackboard.coordinator;

/**
 * Run-level outcome that ended a run before convergence. The partial fact log is
 * still available from the {@link RunResult} that carries it.
 */
public abstract class RunException extends RuntimeException {

    private final int factCount;

    protected RunException(String message, int factCount) {
        super(message);
        this.factCount = factCount;
    }

    public int getFactCount() {
        return factCount;
    }
}
