package com.blackboard.agent.forensic;

import com.blackboard.agent.Agent;
import com.blackboard.agent.AgentDescriptor;
import com.blackboard.contract.Fact;
import com.blackboard.contract.FactKinds;
import com.blackboard.contract.ProposedFact;
import com.blackboard.contract.Severity;
import com.blackboard.store.FactSnapshot;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns each violation into one {@code risk_contribution}.
 *
 * The weight is the severity weight scaled by {@code 1 + ln(occurrences)}, capped at
 * 0.95, and the contribution inherits the violation's confidence.
 */
public class RiskAssessorAgent implements Agent {

    public static final String NAME = "risk-assessor";

    static final double MAX_WEIGHT = 0.95;

    private static final Map<Severity, Double> SEVERITY_WEIGHTS = new EnumMap<>(Map.of(
        Severity.CRITICAL, 0.45,
        Severity.HIGH, 0.30,
        Severity.MEDIUM, 0.15,
        Severity.LOW, 0.05
    ));

    private static final AgentDescriptor DESCRIPTOR = AgentDescriptor.of(
        NAME,
        Set.of(FactKinds.VIOLATION, FactKinds.RISK_CONTRIBUTION),
        Set.of(FactKinds.RISK_CONTRIBUTION)
    );

    @Override
    public AgentDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public boolean isTriggered(FactSnapshot snapshot) {
        return !unassessed(snapshot).isEmpty();
    }

    @Override
    public List<ProposedFact> run(FactSnapshot snapshot) {
        return unassessed(snapshot).stream()
            .map(this::assess)
            .toList();
    }

    static double weightOf(Severity severity, int occurrences) {
        double scale = 1.0 + Math.log(Math.max(1, occurrences));
        return Math.min(MAX_WEIGHT, SEVERITY_WEIGHTS.get(severity) * scale);
    }

    private ProposedFact assess(Fact violation) {
        Severity severity = Severity.fromValue(violation.text("severity"));
        int occurrences = (int) violation.number("occurrences", 1);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("source", violation.text("rule"));
        payload.put("weight", weightOf(severity, occurrences));
        payload.put("severity", severity.name());
        payload.put("occurrences", occurrences);
        payload.put("violation_id", violation.id());
        return ProposedFact.of(FactKinds.RISK_CONTRIBUTION, payload)
            .withConfidence(violation.confidence())
            .dependingOn(violation.id());
    }

    private List<Fact> unassessed(FactSnapshot snapshot) {
        return snapshot.query(FactKinds.VIOLATION).stream()
            .filter(violation -> snapshot.derivedFrom(FactKinds.RISK_CONTRIBUTION, violation.id()).isEmpty())
            .toList();
    }
}
