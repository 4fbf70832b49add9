package com.blackboard.agent.synthesis;

import com.blackboard.agent.Agent;
import com.blackboard.agent.AgentDescriptor;
import com.blackboard.contract.Fact;
import com.blackboard.contract.FactKinds;
import com.blackboard.contract.ProposedFact;
import com.blackboard.store.FactSnapshot;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Base for agents that turn a synthesis seed of one artifact type into ordered
 * {@code artifact_fragment} facts.
 *
 * A request is pending while no fragment depends on its seed, so each seed is
 * generated exactly once.
 */
abstract class ArtifactGeneratorAgent implements Agent {

    private final AgentDescriptor descriptor;
    private final String artifactType;

    protected ArtifactGeneratorAgent(String name, String artifactType) {
        this.descriptor = AgentDescriptor.of(
            name,
            Set.of(FactKinds.SEED, FactKinds.ARTIFACT_FRAGMENT),
            Set.of(FactKinds.ARTIFACT_FRAGMENT)
        );
        this.artifactType = artifactType;
    }

    @Override
    public AgentDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public boolean isTriggered(FactSnapshot snapshot) {
        return !pendingRequests(snapshot).isEmpty();
    }

    @Override
    public List<ProposedFact> run(FactSnapshot snapshot) {
        List<ProposedFact> proposals = new ArrayList<>();
        for (Fact request : pendingRequests(snapshot)) {
            generate(request, proposals);
        }
        return proposals;
    }

    /**
     * Appends the fragments for one request to {@code out}.
     */
    protected abstract void generate(Fact request, List<ProposedFact> out);

    /**
     * Whether a seed's {@code artifact_type} belongs to this generator.
     */
    protected boolean accepts(String requestedType) {
        return artifactType.equals(requestedType);
    }

    protected ProposedFact fragment(Fact request, int order, String section, String content) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("target", request.text("target"));
        payload.put("order", order);
        payload.put("section", section);
        payload.put("content", content);
        return ProposedFact.of(FactKinds.ARTIFACT_FRAGMENT, payload).dependingOn(request.id());
    }

    private List<Fact> pendingRequests(FactSnapshot snapshot) {
        List<Fact> fragments = snapshot.query(FactKinds.ARTIFACT_FRAGMENT);
        return snapshot.query(FactKinds.SEED).stream()
            .filter(seed -> seed.text("target") != null)
            .filter(seed -> accepts(seed.text("artifact_type")))
            .filter(seed -> fragments.stream().noneMatch(f -> f.dependsOn(seed.id())))
            .toList();
    }
}
