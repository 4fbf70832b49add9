package com.blackboard.coordinator;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * What happened in one dispatched round.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RoundReport(
    @JsonProperty("round") int round,
    @JsonProperty("snapshot_version") long snapshotVersion,
    @JsonProperty("triggered_agents") List<String> triggeredAgents,
    @JsonProperty("committed_fact_ids") List<Long> committedFactIds,
    @JsonProperty("failures") List<AgentFailure> failures
) {

    public RoundReport {
        triggeredAgents = List.copyOf(triggeredAgents);
        committedFactIds = List.copyOf(committedFactIds);
        failures = List.copyOf(failures);
    }
}
