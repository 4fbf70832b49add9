package com.blackboard.coordinator;

public enum RunState {
    INIT,
    ROUND_PENDING,
    DISPATCHING,
    COMMITTING,
    CONVERGED,
    STALLED,
    TIMED_OUT,
    CANCELLED;

    public boolean isTerminal() {
        return this == CONVERGED || this == STALLED || this == TIMED_OUT || this == CANCELLED;
    }
}
