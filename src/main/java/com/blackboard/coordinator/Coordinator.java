package com.blackboard.coordinator;

import com.blackboard.agent.Agent;
import com.blackboard.agent.AgentDescriptor;
import com.blackboard.contract.Fact;
import com.blackboard.contract.FactKinds;
import com.blackboard.contract.FactValidationException;
import com.blackboard.contract.ProposedFact;
import com.blackboard.store.FactSnapshot;
import com.blackboard.store.FactStore;
import com.blackboard.verdict.VerdictAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives a {@link Run} through synchronized rounds until it converges, stalls,
 * times out or is cancelled.
 *
 * A round takes one snapshot, evaluates every agent's trigger against it, runs the
 * triggered agents concurrently against that same snapshot and waits for all of them
 * (the round barrier). Proposals are then committed in roster order, then proposal
 * order, so the same seeds and roster always yield the same fact sequence. Agent
 * failures, timeouts and invalid proposals are contained and written as agent_error
 * facts; only stall, timeout and cancellation end a run early.
 */
public class Coordinator {

    private static final Logger log = LoggerFactory.getLogger(Coordinator.class);

    public static final String MDC_RUN_ID = "runId";

    private static final Set<String> RESERVED_KINDS =
        Set.of(FactKinds.SEED, FactKinds.VERDICT, FactKinds.AGENT_ERROR);

    private final Executor agentExecutor;

    public Coordinator(Executor agentExecutor) {
        this.agentExecutor = agentExecutor;
    }

    public RunResult execute(Run run) {
        if (run.state() != RunState.INIT) {
            throw new IllegalStateException("run " + run.id() + " was already executed");
        }
        String outerRunId = MDC.get(MDC_RUN_ID);
        MDC.put(MDC_RUN_ID, run.id());
        try {
            return drive(run);
        } finally {
            if (outerRunId != null) {
                MDC.put(MDC_RUN_ID, outerRunId);
            } else {
                MDC.remove(MDC_RUN_ID);
            }
        }
    }

    private RunResult drive(Run run) {
        RunSettings settings = run.settings();
        long deadline = System.nanoTime() + settings.runTimeout().toNanos();
        Map<String, TriggerDecision> triggerCache = new HashMap<>();
        List<RoundReport> reports = new ArrayList<>();

        log.info("Run started: seeds={}, roster={}, max_rounds={}, run_timeout={}",
            run.store().getLatestSequence(), names(run.roster()), settings.maxRounds(), settings.runTimeout());

        int round = 0;
        while (true) {
            if (run.isCancelRequested()) {
                log.info("Run cancelled after {} rounds", round);
                return finish(run, RunState.CANCELLED, round, reports, null);
            }
            if (System.nanoTime() - deadline >= 0) {
                return finish(run, RunState.TIMED_OUT, round, reports, timeout(run, round));
            }

            round++;
            run.transition(RunState.ROUND_PENDING);
            FactSnapshot snapshot = run.store().snapshot();
            TriggerPass pass = evaluateTriggers(run, round, snapshot, triggerCache);

            if (pass.triggered().isEmpty()) {
                return finish(run, RunState.CONVERGED, round, reports, null);
            }
            if (round > settings.maxRounds()) {
                StallException stall = new StallException(
                    settings.maxRounds(), snapshot.size(), names(pass.triggered()));
                log.warn("Run stalled: {}", stall.getMessage());
                return finish(run, RunState.STALLED, settings.maxRounds(), reports, stall);
            }

            run.transition(RunState.DISPATCHING);
            log.info("Round {}: dispatching {} against snapshot version {}",
                round, names(pass.triggered()), snapshot.version());
            Dispatch dispatch = dispatch(pass.triggered(), snapshot, deadline, settings.agentTimeout());

            if (dispatch.interrupted()) {
                log.warn("Coordinator interrupted during round {}; discarding the round", round);
                run.cancel();
                return finish(run, RunState.CANCELLED, round - 1, reports, null);
            }
            if (dispatch.runTimedOut()) {
                log.warn("Run budget elapsed during round {}; discarding the round", round);
                return finish(run, RunState.TIMED_OUT, round - 1, reports, timeout(run, round - 1));
            }

            run.transition(RunState.COMMITTING);
            RoundReport report = commit(run, round, snapshot, pass, dispatch.outcomes());
            reports.add(report);
            log.info("Round {} committed {} facts, {} agent failures",
                round, report.committedFactIds().size(), report.failures().size());
        }
    }

    private TriggerPass evaluateTriggers(Run run, int round, FactSnapshot snapshot,
                                         Map<String, TriggerDecision> cache) {
        List<Agent> triggered = new ArrayList<>();
        List<AgentFailure> failures = new ArrayList<>();

        for (Agent agent : run.roster()) {
            AgentDescriptor descriptor = agent.descriptor();
            boolean prunable = run.settings().triggerPruning() && !descriptor.reads().isEmpty();
            long readsVersion = prunable ? snapshot.latestIdOf(descriptor.reads()) : -1;
            TriggerDecision cached = prunable ? cache.get(descriptor.name()) : null;

            boolean fire;
            if (cached != null && cached.readsVersion() == readsVersion) {
                fire = cached.triggered();
                log.debug("Trigger for {} reused, read kinds unchanged since fact {}", descriptor.name(), readsVersion);
            } else {
                try {
                    fire = agent.isTriggered(snapshot);
                } catch (RuntimeException ex) {
                    cache.remove(descriptor.name());
                    AgentFailure failure = new AgentFailure(descriptor.name(), AgentFailure.Type.TRIGGER, describe(ex));
                    record(run, round, failure, failures);
                    continue;
                }
                if (prunable) {
                    cache.put(descriptor.name(), new TriggerDecision(readsVersion, fire));
                }
            }
            if (fire) {
                triggered.add(agent);
            }
        }
        return new TriggerPass(triggered, failures);
    }

    private Dispatch dispatch(List<Agent> triggered, FactSnapshot snapshot,
                              long runDeadline, Duration agentTimeout) {
        long dispatchedAt = System.nanoTime();
        Map<Agent, AgentOutcome> outcomes = new LinkedHashMap<>();
        Map<Agent, FutureTask<List<ProposedFact>>> tasks = new LinkedHashMap<>();

        for (Agent agent : triggered) {
            FutureTask<List<ProposedFact>> task = new FutureTask<>(() -> agent.run(snapshot));
            try {
                agentExecutor.execute(task);
                tasks.put(agent, task);
            } catch (RejectedExecutionException ex) {
                outcomes.put(agent, new AgentOutcome.Failed(ex));
            }
        }

        long agentDeadline = runDeadline;
        if (agentTimeout != null) {
            long candidate = dispatchedAt + agentTimeout.toNanos();
            if (candidate - runDeadline < 0) {
                agentDeadline = candidate;
            }
        }

        for (Map.Entry<Agent, FutureTask<List<ProposedFact>>> entry : tasks.entrySet()) {
            Agent agent = entry.getKey();
            FutureTask<List<ProposedFact>> task = entry.getValue();
            try {
                long waitNanos = Math.max(0, agentDeadline - System.nanoTime());
                List<ProposedFact> proposals = task.get(waitNanos, TimeUnit.NANOSECONDS);
                outcomes.put(agent, new AgentOutcome.Completed(proposals == null ? List.of() : proposals));
            } catch (TimeoutException ex) {
                task.cancel(true);
                if (agentTimeout == null || System.nanoTime() - runDeadline >= 0) {
                    tasks.values().forEach(t -> t.cancel(true));
                    return Dispatch.timedOut();
                }
                log.warn("Agent {} exceeded its {} ms budget; proposals discarded",
                    agent.name(), agentTimeout.toMillis());
                outcomes.put(agent, new AgentOutcome.TimedOut(agentTimeout));
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                log.warn("Agent {} failed: {}", agent.name(), cause.toString());
                outcomes.put(agent, new AgentOutcome.Failed(cause));
            } catch (CancellationException ex) {
                outcomes.put(agent, new AgentOutcome.Failed(ex));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                tasks.values().forEach(t -> t.cancel(true));
                return Dispatch.wasInterrupted();
            }
        }
        return Dispatch.completed(outcomes);
    }

    private RoundReport commit(Run run, int round, FactSnapshot snapshot, TriggerPass pass,
                               Map<Agent, AgentOutcome> outcomes) {
        List<Long> committed = new ArrayList<>();
        List<AgentFailure> failures = new ArrayList<>(pass.failures());

        for (Agent agent : pass.triggered()) {
            AgentOutcome outcome = outcomes.get(agent);
            if (outcome instanceof AgentOutcome.Completed completed) {
                commitProposals(run, round, agent, completed.proposals(), committed, failures);
            } else if (outcome instanceof AgentOutcome.Failed failed) {
                record(run, round,
                    new AgentFailure(agent.name(), AgentFailure.Type.EXCEPTION, describe(failed.cause())), failures);
            } else if (outcome instanceof AgentOutcome.TimedOut timedOut) {
                record(run, round,
                    new AgentFailure(agent.name(), AgentFailure.Type.TIMEOUT,
                        "no result within " + timedOut.budget().toMillis() + " ms"), failures);
            }
        }
        return new RoundReport(round, snapshot.version(), names(pass.triggered()), committed, failures);
    }

    private void commitProposals(Run run, int round, Agent agent, List<ProposedFact> proposals,
                                 List<Long> committed, List<AgentFailure> failures) {
        Long[] assigned = new Long[proposals.size()];
        for (int i = 0; i < proposals.size(); i++) {
            ProposedFact proposal = proposals.get(i);
            try {
                if (proposal == null) {
                    throw new FactValidationException("proposal is null");
                }
                requireProducible(agent.descriptor(), proposal.kind());
                Set<Long> dependsOn = resolveDependencies(proposal, i, assigned);
                Fact fact = run.store().append(proposal.kind(), agent.name(), proposal.payload(),
                    proposal.confidence(), dependsOn, round);
                assigned[i] = fact.id();
                committed.add(fact.id());
                log.debug("Committed fact {} ({}) from {}", fact.id(), fact.kind(), agent.name());
            } catch (FactValidationException ex) {
                String kind = proposal == null ? "null" : proposal.kind();
                record(run, round, new AgentFailure(agent.name(), AgentFailure.Type.VALIDATION,
                    "proposal " + i + " (" + kind + "): " + ex.getMessage()), failures);
            }
        }
    }

    private void requireProducible(AgentDescriptor descriptor, String kind) {
        if (RESERVED_KINDS.contains(kind)) {
            throw new FactValidationException("kind " + kind + " is reserved for the coordinator");
        }
        if (!descriptor.mayProduce(kind)) {
            throw new FactValidationException("agent does not declare kind " + kind);
        }
    }

    private Set<Long> resolveDependencies(ProposedFact proposal, int position, Long[] assigned) {
        if (proposal.dependsOnProposals().isEmpty()) {
            return proposal.dependsOn();
        }
        Set<Long> resolved = new TreeSet<>(proposal.dependsOn());
        for (int index : proposal.dependsOnProposals()) {
            if (index < 0 || index >= position) {
                throw new FactValidationException("depends on proposal " + index + " which does not precede it");
            }
            if (assigned[index] == null) {
                throw new FactValidationException("depends on rejected proposal " + index);
            }
            resolved.add(assigned[index]);
        }
        return resolved;
    }

    private void record(Run run, int round, AgentFailure failure, List<AgentFailure> failures) {
        log.warn("Agent {} {} failure in round {}: {}",
            failure.agent(), failure.type().getValue(), round, failure.error());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("agent", failure.agent());
        payload.put("failure", failure.type().getValue());
        payload.put("error", failure.error());
        payload.put("round", round);
        payload.put("authoritative", false);
        run.store().append(FactKinds.AGENT_ERROR, FactKinds.COORDINATOR, payload, 1.0, Set.of(), round);
        failures.add(failure);
    }

    private RunResult finish(Run run, RunState status, int rounds, List<RoundReport> reports, RunException error) {
        FactStore store = run.store();
        VerdictAggregator.Verdict verdict = run.aggregator().aggregate(store.snapshot());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("mode", run.aggregator().mode());
        payload.put("status", status.name());
        payload.put("partial", status != RunState.CONVERGED);
        payload.put("rounds", rounds);
        payload.put("label", verdict.label());
        payload.put("score", verdict.score());
        verdict.payload().forEach(payload::putIfAbsent);
        if (error != null) {
            payload.put("error", error.getMessage());
        }

        Fact verdictFact = store.append(FactKinds.VERDICT, FactKinds.COORDINATOR, payload, 1.0,
            verdict.dependsOn(), rounds);
        store.close();
        run.transition(status);

        List<Fact> facts = store.snapshot().facts();
        log.info("Run finished: status={}, rounds={}, facts={}, label={}, score={}",
            status, rounds, facts.size(), verdict.label(), verdict.score());
        return new RunResult(run.id(), status, rounds, verdictFact, facts, reports, error);
    }

    private RunTimeoutException timeout(Run run, int completedRounds) {
        RunTimeoutException timeout = new RunTimeoutException(
            run.settings().runTimeout(), completedRounds, run.store().snapshot().size());
        log.warn("Run timed out: {}", timeout.getMessage());
        return timeout;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank()
            ? error.getClass().getSimpleName()
            : error.getClass().getSimpleName() + ": " + message;
    }

    private static List<String> names(List<Agent> agents) {
        return agents.stream().map(Agent::name).toList();
    }

    private record TriggerDecision(long readsVersion, boolean triggered) {}

    private record TriggerPass(List<Agent> triggered, List<AgentFailure> failures) {}

    private sealed interface AgentOutcome {
        record Completed(List<ProposedFact> proposals) implements AgentOutcome {}
        record Failed(Throwable cause) implements AgentOutcome {}
        record TimedOut(Duration budget) implements AgentOutcome {}
    }

    private record Dispatch(Map<Agent, AgentOutcome> outcomes, boolean runTimedOut, boolean interrupted) {

        static Dispatch completed(Map<Agent, AgentOutcome> outcomes) {
            return new Dispatch(outcomes, false, false);
        }

        static Dispatch timedOut() {
            return new Dispatch(Map.of(), true, false);
        }

        static Dispatch wasInterrupted() {
            return new Dispatch(Map.of(), false, true);
        }
    }
}
