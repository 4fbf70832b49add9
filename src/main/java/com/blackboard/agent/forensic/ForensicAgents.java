package com.blackboard.agent.forensic;

import com.blackboard.agent.Agent;

import java.util.List;

public final class ForensicAgents {

    private ForensicAgents() {
    }

    /** Detectors first, then the assessor that consumes their violations. */
    public static List<Agent> defaultRoster() {
        return List.of(new PatternDetectorAgent(), new AxiomInverterAgent(), new RiskAssessorAgent());
    }
}
