package com.blackboard.projection;

import com.blackboard.contract.Fact;
import com.blackboard.contract.FactKinds;
import com.blackboard.coordinator.RunResult;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link RunReport} from a {@link RunResult}. A pure function of the
 * committed log: projecting the same result twice yields equal reports.
 */
@Component
public class RunReportProjector {

    public RunReport project(RunResult result) {
        Fact verdict = result.verdict();
        List<Fact> facts = result.facts();

        Map<String, Long> byKind = new LinkedHashMap<>();
        for (Fact fact : facts) {
            byKind.merge(fact.kind(), 1L, Long::sum);
        }

        List<RunReport.AgentErrorSummary> errors = facts.stream()
            .filter(fact -> fact.isKind(FactKinds.AGENT_ERROR))
            .map(fact -> new RunReport.AgentErrorSummary(
                fact.id(),
                fact.text("agent"),
                fact.text("failure"),
                fact.round(),
                fact.text("error")))
            .toList();

        return new RunReport(
            result.runId(),
            verdict.text("mode"),
            result.status().name(),
            verdict.flag("partial", !result.isConverged()),
            result.rounds(),
            verdict.text("label"),
            verdict.number("score", 0.0),
            verdict,
            facts.size(),
            byKind,
            errors,
            facts,
            result.roundReports(),
            result.failure().map(Throwable::getMessage).orElse(null)
        );
    }
}
