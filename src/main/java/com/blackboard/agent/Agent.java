package com.blackboard.agent;

import com.blackboard.contract.ProposedFact;
import com.blackboard.store.FactSnapshot;

import java.util.List;

/**
 * A pluggable detector or generator working against the blackboard.
 *
 * Agents never write to the fact store. The coordinator evaluates
 * {@link #isTriggered} against a frozen snapshot, runs every triggered agent of a
 * round against that same snapshot, and commits the returned proposals after the
 * round barrier. Implementations hold no mutable shared state.
 */
public interface Agent {

    AgentDescriptor descriptor();

    /**
     * Whether the agent has work to do on this snapshot. Must be deterministic and
     * side-effect free: it is evaluated every round and its result may be cached
     * while none of the descriptor's read kinds change.
     */
    boolean isTriggered(FactSnapshot snapshot);

    /**
     * Performs the agent's work and returns the facts it wants written, in the
     * order they should be committed. Given the same snapshot a deterministic
     * agent returns the same proposals.
     *
     * @throws Exception any failure; the coordinator records it as an agent_error fact
     */
    List<ProposedFact> run(FactSnapshot snapshot) throws Exception;

    default String name() {
        return descriptor().name();
    }
}
