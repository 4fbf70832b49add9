package com.blackboard.agent.forensic;

import com.blackboard.agent.Agent;
import com.blackboard.agent.AgentDescriptor;
import com.blackboard.contract.Fact;
import com.blackboard.contract.FactKinds;
import com.blackboard.contract.ProposedFact;
import com.blackboard.store.FactSnapshot;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Base for agents that inspect each forensic seed exactly once.
 *
 * A seed counts as inspected once a {@code scan} fact from this agent depends on it,
 * so the agent stays triggered only while some seed with a {@code source} lacks one.
 */
abstract class SeedScanningAgent implements Agent {

    private final AgentDescriptor descriptor;

    protected SeedScanningAgent(String name, Set<String> findingKinds) {
        Set<String> produces = new HashSet<>(findingKinds);
        produces.add(FactKinds.SCAN);
        this.descriptor = AgentDescriptor.of(name, Set.of(FactKinds.SEED, FactKinds.SCAN), produces);
    }

    @Override
    public AgentDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public boolean isTriggered(FactSnapshot snapshot) {
        return !pendingSeeds(snapshot).isEmpty();
    }

    @Override
    public List<ProposedFact> run(FactSnapshot snapshot) {
        List<ProposedFact> proposals = new ArrayList<>();
        for (Fact seed : pendingSeeds(snapshot)) {
            int hits = inspect(seed, seed.text("source"), proposals);

            Map<String, Object> scan = new LinkedHashMap<>();
            scan.put("seed_id", seed.id());
            scan.put("scanner", name());
            scan.put("findings", hits);
            proposals.add(ProposedFact.of(FactKinds.SCAN, scan).dependingOn(seed.id()));
        }
        return proposals;
    }

    /**
     * Appends findings for one seed to {@code out} and returns how many were added.
     * Proposal indices used with {@link ProposedFact#dependingOnProposal} are positions in {@code out}.
     */
    protected abstract int inspect(Fact seed, String source, List<ProposedFact> out);

    private List<Fact> pendingSeeds(FactSnapshot snapshot) {
        List<Fact> scans = snapshot.query(FactKinds.SCAN).stream()
            .filter(scan -> name().equals(scan.producer()))
            .toList();
        return snapshot.query(FactKinds.SEED).stream()
            .filter(seed -> seed.text("source") != null)
            .filter(seed -> scans.stream().noneMatch(scan -> scan.dependsOn(seed.id())))
            .toList();
    }
}
