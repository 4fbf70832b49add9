package com.blackboard.projection;

import com.blackboard.contract.Fact;
import com.blackboard.coordinator.RoundReport;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Map;

/**
 * Read-only export of a finished run.
 *
 * Everything here is derived from committed facts and the per-round bookkeeping;
 * agent failures appear both as agent_error facts and in the {@code agent_errors} summary.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RunReport(
    @JsonProperty("run_id") String runId,
    @JsonProperty("mode") String mode,
    @JsonProperty("status") String status,
    @JsonProperty("partial") boolean partial,
    @JsonProperty("rounds") int rounds,
    @JsonProperty("label") String label,
    @JsonProperty("score") double score,
    @JsonProperty("verdict") Fact verdict,
    @JsonProperty("fact_count") int factCount,
    @JsonProperty("facts_by_kind") Map<String, Long> factsByKind,
    @JsonProperty("agent_errors") List<AgentErrorSummary> agentErrors,
    @JsonProperty("facts") List<Fact> facts,
    @JsonProperty("round_reports") List<RoundReport> roundReports,
    @JsonProperty("error") String error
) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record AgentErrorSummary(
        @JsonProperty("fact_id") long factId,
        @JsonProperty("agent") String agent,
        @JsonProperty("failure") String failure,
        @JsonProperty("round") int round,
        @JsonProperty("error") String error
    ) {}
}
