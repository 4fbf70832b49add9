package com.blackboard.coordinator;

import java.time.Duration;

/**
 * Limits applied to a single run.
 *
 * @param maxRounds      rounds allowed before the run is STALLED
 * @param runTimeout     overall wall-clock budget before the run is TIMED_OUT
 * @param agentTimeout   per-agent per-round budget, null for none
 * @param triggerPruning reuse an agent's trigger decision while none of its read kinds changed
 */
public record RunSettings(
    int maxRounds,
    Duration runTimeout,
    Duration agentTimeout,
    boolean triggerPruning
) {

    public static final int DEFAULT_MAX_ROUNDS = 50;
    public static final Duration DEFAULT_RUN_TIMEOUT = Duration.ofSeconds(30);
    /** Upper bound for both timeouts; deadlines are tracked in nanoseconds. */
    public static final Duration MAX_TIMEOUT = Duration.ofDays(1);

    public RunSettings {
        if (maxRounds <= 0) {
            throw new InvalidRunConfigurationException("max_rounds must be > 0, got " + maxRounds);
        }
        if (runTimeout == null || runTimeout.isZero() || runTimeout.isNegative()) {
            throw new InvalidRunConfigurationException("run_timeout must be a positive duration");
        }
        if (runTimeout.compareTo(MAX_TIMEOUT) > 0) {
            throw new InvalidRunConfigurationException("run_timeout must not exceed " + MAX_TIMEOUT + ", got " + runTimeout);
        }
        if (agentTimeout != null && (agentTimeout.isZero() || agentTimeout.isNegative())) {
            throw new InvalidRunConfigurationException("agent_timeout must be a positive duration when set");
        }
        if (agentTimeout != null && agentTimeout.compareTo(MAX_TIMEOUT) > 0) {
            throw new InvalidRunConfigurationException("agent_timeout must not exceed " + MAX_TIMEOUT + ", got " + agentTimeout);
        }
    }

    public static RunSettings defaults() {
        return new RunSettings(DEFAULT_MAX_ROUNDS, DEFAULT_RUN_TIMEOUT, null, true);
    }

    /**
     * Applies caller overrides; null arguments keep the current value.
     */
    public RunSettings withOverrides(Integer maxRounds, Duration runTimeout, Duration agentTimeout) {
        return new RunSettings(
            maxRounds != null ? maxRounds : this.maxRounds,
            runTimeout != null ? runTimeout : this.runTimeout,
            agentTimeout != null ? agentTimeout : this.agentTimeout,
            triggerPruning
        );
    }
}
