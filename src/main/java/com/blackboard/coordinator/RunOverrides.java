package com.blackboard.coordinator;

import java.time.Duration;

/**
 * Per-request limits; null fields fall back to the configured {@link RunSettings}.
 */
public record RunOverrides(Integer maxRounds, Duration runTimeout, Duration agentTimeout) {

    public static final RunOverrides NONE = new RunOverrides(null, null, null);

    public RunSettings applyTo(RunSettings defaults) {
        return defaults.withOverrides(maxRounds, runTimeout, agentTimeout);
    }
}
