package com.blackboard.agent;

import java.util.Objects;
import java.util.Set;

/**
 * Static metadata of an agent.
 *
 * @param name          unique within a roster, also used as the producer of the agent's facts
 * @param reads         kinds the trigger predicate inspects; empty means "evaluate every round"
 * @param produces      kinds the agent may propose
 * @param deterministic false for agents whose output depends on anything but the snapshot
 */
public record AgentDescriptor(
    String name,
    Set<String> reads,
    Set<String> produces,
    boolean deterministic
) {

    public AgentDescriptor {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("agent name must not be blank");
        }
        reads = reads == null ? Set.of() : Set.copyOf(reads);
        produces = produces == null ? Set.of() : Set.copyOf(produces);
    }

    public static AgentDescriptor of(String name, Set<String> reads, Set<String> produces) {
        return new AgentDescriptor(name, reads, produces, true);
    }

    public boolean mayProduce(String kind) {
        return produces.contains(kind);
    }
}
