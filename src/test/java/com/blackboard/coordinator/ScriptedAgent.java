package com.blackboard.coordinator;

import com.blackboard.agent.Agent;
import com.blackboard.agent.AgentDescriptor;
import com.blackboard.contract.ProposedFact;
import com.blackboard.store.FactSnapshot;

import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Agent assembled from lambdas, for driving the coordinator through specific paths.
 */
class ScriptedAgent implements Agent {

    interface Work {
        List<ProposedFact> run(FactSnapshot snapshot) throws Exception;
    }

    private final AgentDescriptor descriptor;
    private final Predicate<FactSnapshot> trigger;
    private final Work work;

    ScriptedAgent(String name, Set<String> reads, Set<String> produces,
                  Predicate<FactSnapshot> trigger, Work work) {
        this.descriptor = AgentDescriptor.of(name, reads, produces);
        this.trigger = trigger;
        this.work = work;
    }

    @Override
    public AgentDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public boolean isTriggered(FactSnapshot snapshot) {
        return trigger.test(snapshot);
    }

    @Override
    public List<ProposedFact> run(FactSnapshot snapshot) throws Exception {
        return work.run(snapshot);
    }
}
