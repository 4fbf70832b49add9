package com.blackboard.coordinator;

import com.blackboard.agent.Agent;
import com.blackboard.contract.FactKinds;
import com.blackboard.store.FactStore;
import com.blackboard.verdict.VerdictAggregator;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One coordination session: a fact store seeded with input, an ordered agent
 * roster and the aggregator producing its verdict.
 *
 * Seeds are appended on construction (state INIT). The coordinator drives the run
 * to a terminal state, after which the store is closed.
 */
public class Run {

    /** Producer recorded on seed facts. */
    public static final String SEED_PRODUCER = "input";

    private final String id;
    private final FactStore store;
    private final List<Agent> roster;
    private final VerdictAggregator aggregator;
    private final RunSettings settings;
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private volatile RunState state = RunState.INIT;

    public Run(FactStore store,
               List<Agent> roster,
               VerdictAggregator aggregator,
               RunSettings settings,
               List<Map<String, Object>> seeds) {
        if (store == null || aggregator == null || settings == null) {
            throw new InvalidRunConfigurationException("store, aggregator and settings are required");
        }
        if (store.getLatestSequence() != 0 || store.isClosed()) {
            throw new InvalidRunConfigurationException("a run needs a fresh fact store");
        }
        if (roster == null || roster.stream().anyMatch(Objects::isNull)) {
            throw new InvalidRunConfigurationException("roster must not contain null agents");
        }
        Set<String> names = new HashSet<>();
        for (Agent agent : roster) {
            if (!names.add(agent.name())) {
                throw new InvalidRunConfigurationException("duplicate agent name in roster: " + agent.name());
            }
        }
        if (seeds == null || seeds.isEmpty()) {
            throw new InvalidRunConfigurationException("a run needs at least one seed");
        }

        this.id = UUID.randomUUID().toString();
        this.store = store;
        this.roster = List.copyOf(roster);
        this.aggregator = aggregator;
        this.settings = settings;

        for (Map<String, Object> seed : seeds) {
            store.append(FactKinds.SEED, SEED_PRODUCER, seed, 1.0, Set.of(), 0);
        }
    }

    public String id() {
        return id;
    }

    public FactStore store() {
        return store;
    }

    public List<Agent> roster() {
        return roster;
    }

    public VerdictAggregator aggregator() {
        return aggregator;
    }

    public RunSettings settings() {
        return settings;
    }

    public RunState state() {
        return state;
    }

    /**
     * Requests cancellation. Honoured at the next round boundary; a round already in
     * flight still commits.
     */
    public void cancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    void transition(RunState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("run " + id + " already terminated as " + state);
        }
        state = next;
    }
}
