package com.blackboard.coordinator;

import com.blackboard.agent.Agent;
import com.blackboard.agent.forensic.ForensicAgents;
import com.blackboard.agent.synthesis.ProjectConfigGeneratorAgent;
import com.blackboard.agent.synthesis.ServiceGeneratorAgent;
import com.blackboard.agent.synthesis.SynthesisAgents;
import com.blackboard.agent.synthesis.ViewGeneratorAgent;
import com.blackboard.contract.FactContractValidator;
import com.blackboard.store.InMemoryFactStore;
import com.blackboard.verdict.ForensicProperties;
import com.blackboard.verdict.ForensicVerdictAggregator;
import com.blackboard.verdict.SynthesisVerdictAggregator;
import com.blackboard.verdict.VerdictAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Entry point for running the blackboard: builds a fresh store and {@link Run} per
 * request and drives it on the shared {@link Coordinator}. Nothing outlives the call.
 */
@Service
public class RunService {

    private static final Logger log = LoggerFactory.getLogger(RunService.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Coordinator coordinator;
    private final FactContractValidator validator;
    private final RunSettings defaults;
    private final ForensicVerdictAggregator forensicAggregator;
    private final SynthesisVerdictAggregator synthesisAggregator;
    private final int maxSourceLength;

    public RunService(Coordinator coordinator,
                      FactContractValidator validator,
                      RunSettings defaults,
                      ForensicVerdictAggregator forensicAggregator,
                      SynthesisVerdictAggregator synthesisAggregator,
                      ForensicProperties forensicProperties) {
        this.coordinator = coordinator;
        this.validator = validator;
        this.defaults = defaults;
        this.forensicAggregator = forensicAggregator;
        this.synthesisAggregator = synthesisAggregator;
        this.maxSourceLength = forensicProperties.maxSourceLengthOrDefault();
    }

    public RunResult startForensic(String source, String config, RunOverrides overrides) {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source is required");
        }
        if (source.length() > maxSourceLength) {
            throw new IllegalArgumentException(
                "source is " + source.length() + " characters, the limit is " + maxSourceLength);
        }
        Map<String, Object> seed = new LinkedHashMap<>();
        seed.put("source", source);
        if (config != null) {
            seed.put("config", config);
        }
        return execute(List.of(seed), ForensicAgents.defaultRoster(), forensicAggregator, overrides);
    }

    /**
     * Synthesizes one SwiftUI view.
     */
    public RunResult startSynthesis(String target, RunOverrides overrides) {
        return execute(List.of(request(target, ViewGeneratorAgent.ARTIFACT_TYPE)),
            SynthesisAgents.defaultRoster(), synthesisAggregator, overrides);
    }

    /**
     * Synthesizes a protocol-backed service; an empty method list falls back to
     * {@link ServiceGeneratorAgent#DEFAULT_METHODS}.
     */
    public RunResult startServiceSynthesis(String target, List<String> methods, RunOverrides overrides) {
        Map<String, Object> seed = request(target, ServiceGeneratorAgent.ARTIFACT_TYPE);
        if (methods != null && !methods.isEmpty()) {
            methods.forEach(method -> requireIdentifier(method, "method"));
            seed.put("methods", methods);
        }
        return execute(List.of(seed), SynthesisAgents.defaultRoster(), synthesisAggregator, overrides);
    }

    /**
     * Synthesizes a project: its project.yml plus every listed view and service, all
     * in one run. The verdict's primary artifact is the project configuration.
     */
    public RunResult startProjectSynthesis(String name,
                                           List<String> views,
                                           List<String> services,
                                           boolean hotReload,
                                           RunOverrides overrides) {
        List<Map<String, Object>> seeds = new ArrayList<>();
        Map<String, Object> project = request(name, ProjectConfigGeneratorAgent.ARTIFACT_TYPE);
        project.put("hot_reload", hotReload);
        seeds.add(project);

        Set<String> targets = new HashSet<>();
        targets.add(name);
        for (String view : views != null ? views : List.<String>of()) {
            requireDistinct(targets, view);
            seeds.add(request(view, ViewGeneratorAgent.ARTIFACT_TYPE));
        }
        for (String service : services != null ? services : List.<String>of()) {
            requireDistinct(targets, service);
            seeds.add(request(service, ServiceGeneratorAgent.ARTIFACT_TYPE));
        }
        return execute(seeds, SynthesisAgents.defaultRoster(), synthesisAggregator, overrides);
    }

    public RunResult execute(List<Map<String, Object>> seeds,
                             List<Agent> roster,
                             VerdictAggregator aggregator,
                             RunOverrides overrides) {
        RunSettings settings = (overrides != null ? overrides : RunOverrides.NONE).applyTo(defaults);
        Run run = new Run(new InMemoryFactStore(validator, Clock.systemUTC()), roster, aggregator, settings, seeds);
        log.info("Run {} created in {} mode with {} agents", run.id(), aggregator.mode(), roster.size());
        return coordinator.execute(run);
    }

    private Map<String, Object> request(String target, String artifactType) {
        requireIdentifier(target, "target");
        Map<String, Object> seed = new LinkedHashMap<>();
        seed.put("target", target);
        seed.put("artifact_type", artifactType);
        return seed;
    }

    private void requireDistinct(Set<String> targets, String target) {
        requireIdentifier(target, "target");
        if (!targets.add(target)) {
            throw new IllegalArgumentException("duplicate artifact name: " + target);
        }
    }

    private void requireIdentifier(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        if (!IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException(field + " must be an identifier, got '" + value + "'");
        }
    }
}
