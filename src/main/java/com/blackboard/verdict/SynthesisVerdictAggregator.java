package com.blackboard.verdict;

import com.blackboard.contract.Fact;
import com.blackboard.contract.FactKinds;
import com.blackboard.store.FactSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Synthesis verdict: assembles artifact fragments per target in ordering-key order
 * and scores compliance as satisfied / applicable axiom checks.
 *
 * Two fragments competing for the same target and order key are both kept on the
 * blackboard; the one with the higher confidence wins, then the lower id.
 */
public class SynthesisVerdictAggregator implements VerdictAggregator {

    private static final Logger log = LoggerFactory.getLogger(SynthesisVerdictAggregator.class);

    public static final String MODE = "synthesis";

    private static final String FRAGMENT_SEPARATOR = "\n\n";

    @Override
    public String mode() {
        return MODE;
    }

    @Override
    public Verdict aggregate(FactSnapshot snapshot) {
        List<Fact> seeds = snapshot.query(FactKinds.SEED);
        Set<Long> dependsOn = new TreeSet<>();
        seeds.forEach(seed -> dependsOn.add(seed.id()));

        Map<String, TreeMap<Long, Fact>> byTarget = new LinkedHashMap<>();
        List<Map<String, Object>> conflicts = new ArrayList<>();
        for (Fact fragment : snapshot.current(FactKinds.ARTIFACT_FRAGMENT)) {
            TreeMap<Long, Fact> ordered = byTarget.computeIfAbsent(fragment.text("target"), t -> new TreeMap<>());
            long order = (long) fragment.number("order", 0);
            Fact incumbent = ordered.get(order);
            if (incumbent == null) {
                ordered.put(order, fragment);
                continue;
            }
            Fact winner = prefer(incumbent, fragment);
            Fact loser = winner == incumbent ? fragment : incumbent;
            ordered.put(order, winner);
            conflicts.add(conflict(fragment.text("target"), order, winner, loser));
        }

        List<Map<String, Object>> artifacts = new ArrayList<>();
        for (Map.Entry<String, TreeMap<Long, Fact>> entry : byTarget.entrySet()) {
            List<Fact> fragments = new ArrayList<>(entry.getValue().values());
            fragments.forEach(f -> dependsOn.add(f.id()));

            Map<String, Object> artifact = new LinkedHashMap<>();
            artifact.put("target", entry.getKey());
            artifact.put("content", fragments.stream()
                .map(f -> f.text("content"))
                .collect(Collectors.joining(FRAGMENT_SEPARATOR)));
            artifact.put("fragment_ids", fragments.stream().map(Fact::id).toList());
            artifact.put("fragment_count", fragments.size());
            artifacts.add(artifact);
        }

        List<Fact> applicable = snapshot.current(FactKinds.AXIOM_CHECK).stream()
            .filter(check -> check.flag("applicable", true))
            .toList();
        List<Fact> satisfied = applicable.stream()
            .filter(check -> check.flag("satisfied", false))
            .toList();
        applicable.forEach(check -> dependsOn.add(check.id()));

        double score = applicable.isEmpty() ? 0.0 : (double) satisfied.size() / applicable.size();
        ComplianceLabel label = ComplianceLabel.classify(score);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("compliance_score", score);
        payload.put("label", label.name());
        payload.put("target", primaryTarget(seeds, byTarget));
        payload.put("artifact", primaryArtifact(seeds, artifacts));
        payload.put("artifacts", artifacts);
        payload.put("checks_applicable", applicable.size());
        payload.put("checks_satisfied", satisfied.size());
        payload.put("failed_checks", applicable.stream()
            .filter(check -> !check.flag("satisfied", false))
            .map(this::failedCheck)
            .toList());
        payload.put("conflicts", conflicts);

        log.info("Synthesis verdict score={} label={} artifacts={} conflicts={}",
            score, label, artifacts.size(), conflicts.size());
        return new Verdict(label.name(), score, payload, dependsOn);
    }

    private Fact prefer(Fact incumbent, Fact challenger) {
        if (challenger.confidence() > incumbent.confidence()) {
            return challenger;
        }
        if (challenger.confidence() < incumbent.confidence()) {
            return incumbent;
        }
        return challenger.id() < incumbent.id() ? challenger : incumbent;
    }

    private Map<String, Object> conflict(String target, long order, Fact winner, Fact loser) {
        Map<String, Object> conflict = new LinkedHashMap<>();
        conflict.put("target", target);
        conflict.put("order", order);
        conflict.put("chosen_fact_id", winner.id());
        conflict.put("discarded_fact_id", loser.id());
        return conflict;
    }

    private Map<String, Object> failedCheck(Fact check) {
        Map<String, Object> failed = new LinkedHashMap<>();
        failed.put("fact_id", check.id());
        failed.put("target", check.text("target"));
        failed.put("axiom", check.text("axiom"));
        failed.put("reason", check.text("reason"));
        return failed;
    }

    private String primaryTarget(List<Fact> seeds, Map<String, TreeMap<Long, Fact>> byTarget) {
        for (Fact seed : seeds) {
            String target = seed.text("target");
            if (target != null) {
                return target;
            }
        }
        return byTarget.isEmpty() ? null : byTarget.keySet().iterator().next();
    }

    private String primaryArtifact(List<Fact> seeds, List<Map<String, Object>> artifacts) {
        if (artifacts.isEmpty()) {
            return "";
        }
        for (Fact seed : seeds) {
            String target = seed.text("target");
            for (Map<String, Object> artifact : artifacts) {
                if (artifact.get("target").equals(target)) {
                    return (String) artifact.get("content");
                }
            }
        }
        return (String) artifacts.get(0).get("content");
    }
}
