package com.blackboard.coordinator;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Bound from {@code blackboard.coordinator.*}.
 */
@ConfigurationProperties(prefix = "blackboard.coordinator")
public record CoordinatorProperties(
    Integer maxRounds,
    Duration runTimeout,
    Duration agentTimeout,
    Integer workerThreads,
    Boolean triggerPruning
) {

    public RunSettings toRunSettings() {
        return new RunSettings(
            maxRounds != null ? maxRounds : RunSettings.DEFAULT_MAX_ROUNDS,
            runTimeout != null ? runTimeout : RunSettings.DEFAULT_RUN_TIMEOUT,
            agentTimeout,
            triggerPruning == null || triggerPruning
        );
    }

    public int workerThreadsOrDefault() {
        if (workerThreads == null) {
            return 8;
        }
        if (workerThreads <= 0) {
            throw new InvalidRunConfigurationException("worker_threads must be > 0, got " + workerThreads);
        }
        return workerThreads;
    }
}
