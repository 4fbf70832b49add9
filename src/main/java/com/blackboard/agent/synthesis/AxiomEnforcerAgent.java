package com.blackboard.agent.synthesis;

import com.blackboard.agent.Agent;
import com.blackboard.agent.AgentDescriptor;
import com.blackboard.contract.Fact;
import com.blackboard.contract.FactKinds;
import com.blackboard.contract.ProposedFact;
import com.blackboard.store.FactSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks every artifact fragment against the {@link SynthesisAxiom} rules and records
 * one {@code axiom_check} per fragment, satisfied only when all rules pass.
 */
public class AxiomEnforcerAgent implements Agent {

    private static final Logger log = LoggerFactory.getLogger(AxiomEnforcerAgent.class);

    public static final String NAME = "axiom-enforcer";
    public static final String CHECK_NAME = "artifact-axioms";

    private static final AgentDescriptor DESCRIPTOR = AgentDescriptor.of(
        NAME,
        Set.of(FactKinds.ARTIFACT_FRAGMENT, FactKinds.AXIOM_CHECK),
        Set.of(FactKinds.AXIOM_CHECK)
    );

    private final List<SynthesisAxiom> axioms;

    public AxiomEnforcerAgent() {
        this(Arrays.asList(SynthesisAxiom.values()));
    }

    public AxiomEnforcerAgent(List<SynthesisAxiom> axioms) {
        this.axioms = List.copyOf(axioms);
    }

    @Override
    public AgentDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public boolean isTriggered(FactSnapshot snapshot) {
        return !unchecked(snapshot).isEmpty();
    }

    @Override
    public List<ProposedFact> run(FactSnapshot snapshot) {
        List<Fact> fragments = snapshot.current(FactKinds.ARTIFACT_FRAGMENT);
        List<ProposedFact> proposals = new ArrayList<>();
        for (Fact fragment : unchecked(snapshot)) {
            String target = fragment.text("target");
            String artifact = fragments.stream()
                .filter(f -> Objects.equals(target, f.text("target")))
                .map(f -> f.text("content"))
                .collect(Collectors.joining("\n"));
            proposals.add(enforce(fragment, fragment.text("content"), artifact));
        }
        return proposals;
    }

    private ProposedFact enforce(Fact fragment, String content, String artifact) {
        List<String> failed = new ArrayList<>();
        List<String> reasons = new ArrayList<>();
        for (SynthesisAxiom axiom : axioms) {
            SynthesisAxiom.Outcome outcome = axiom.check(content, artifact);
            if (!outcome.passed()) {
                failed.add(axiom.name());
                reasons.add(axiom.name() + ": " + outcome.reason());
            }
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("target", fragment.text("target"));
        payload.put("axiom", CHECK_NAME);
        payload.put("fragment_id", fragment.id());
        payload.put("section", fragment.text("section"));
        payload.put("satisfied", failed.isEmpty());
        payload.put("applicable", true);
        payload.put("checked", axioms.stream().map(SynthesisAxiom::name).toList());
        payload.put("failed", failed);
        payload.put("reason", failed.isEmpty() ? "all axioms satisfied" : String.join("; ", reasons));

        if (!failed.isEmpty()) {
            log.info("Fragment {} of {} fails {}", fragment.id(), fragment.text("target"), failed);
        }
        return ProposedFact.of(FactKinds.AXIOM_CHECK, payload).dependingOn(fragment.id());
    }

    private List<Fact> unchecked(FactSnapshot snapshot) {
        return snapshot.current(FactKinds.ARTIFACT_FRAGMENT).stream()
            .filter(fragment -> snapshot.derivedFrom(FactKinds.AXIOM_CHECK, fragment.id()).isEmpty())
            .toList();
    }
}
