package com.blackboard.agent.synthesis;

import com.blackboard.agent.Agent;

import java.util.List;

public final class SynthesisAgents {

    private SynthesisAgents() {
    }

    public static List<Agent> defaultRoster() {
        return List.of(
            new ViewGeneratorAgent(),
            new ServiceGeneratorAgent(),
            new ProjectConfigGeneratorAgent(),
            new AxiomEnforcerAgent()
        );
    }
}
