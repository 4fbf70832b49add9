package com.blackboard.contract;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A fact an agent wants written. Agents never append directly; the coordinator
 * commits proposals after the round barrier.
 *
 * @param kind               fact kind, must be declared in the agent's descriptor
 * @param payload            kind-specific payload
 * @param confidence         in [0,1]
 * @param dependsOn          ids of already committed facts
 * @param dependsOnProposals indices of earlier proposals from the same agent in the
 *                           same round, resolved to ids at commit time
 */
public record ProposedFact(
    String kind,
    Map<String, Object> payload,
    double confidence,
    Set<Long> dependsOn,
    Set<Integer> dependsOnProposals
) {

    public ProposedFact {
        Objects.requireNonNull(kind, "kind");
        payload = Payloads.freeze(payload);
        dependsOn = dependsOn == null ? Set.of() : Set.copyOf(dependsOn);
        dependsOnProposals = dependsOnProposals == null ? Set.of() : Set.copyOf(dependsOnProposals);
    }

    public static ProposedFact of(String kind, Map<String, ?> payload) {
        return new ProposedFact(kind, Payloads.freeze(payload), 1.0, Set.of(), Set.of());
    }

    public ProposedFact withConfidence(double value) {
        return new ProposedFact(kind, payload, value, dependsOn, dependsOnProposals);
    }

    public ProposedFact dependingOn(Collection<Long> factIds) {
        Set<Long> merged = new TreeSet<>(dependsOn);
        merged.addAll(factIds);
        return new ProposedFact(kind, payload, confidence, merged, dependsOnProposals);
    }

    public ProposedFact dependingOn(long... factIds) {
        Set<Long> merged = new TreeSet<>(dependsOn);
        for (long id : factIds) {
            merged.add(id);
        }
        return new ProposedFact(kind, payload, confidence, merged, dependsOnProposals);
    }

    public ProposedFact dependingOnProposal(int index) {
        Set<Integer> merged = new TreeSet<>(dependsOnProposals);
        merged.add(index);
        return new ProposedFact(kind, payload, confidence, dependsOn, merged);
    }
}
