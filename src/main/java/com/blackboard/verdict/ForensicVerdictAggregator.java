package com.blackboard.verdict;

import com.blackboard.contract.Fact;
import com.blackboard.contract.FactKinds;
import com.blackboard.contract.Severity;
import com.blackboard.store.FactSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Forensic verdict: combines risk contributions with a noisy-OR.
 *
 * Every risk_contribution fact on the blackboard yields {@code p = weight * confidence}
 * and the run's failure probability is {@code 1 - prod(1 - p)}. A contribution that
 * lists an older one in depends_on adds evidence; it does not retract the older one,
 * so the combination stays monotone: another contribution never lowers it.
 * The result is bounded to [0,1] and is 0 with no contributions.
 */
public class ForensicVerdictAggregator implements VerdictAggregator {

    private static final Logger log = LoggerFactory.getLogger(ForensicVerdictAggregator.class);

    public static final String MODE = "forensic";

    private final double lowThreshold;
    private final double moderateThreshold;

    public ForensicVerdictAggregator() {
        this(0.3, 0.6);
    }

    public ForensicVerdictAggregator(double lowThreshold, double moderateThreshold) {
        if (lowThreshold < 0.0 || moderateThreshold > 1.0 || lowThreshold > moderateThreshold) {
            throw new IllegalArgumentException(
                "thresholds must satisfy 0 <= low <= moderate <= 1, got " + lowThreshold + "/" + moderateThreshold);
        }
        this.lowThreshold = lowThreshold;
        this.moderateThreshold = moderateThreshold;
    }

    @Override
    public String mode() {
        return MODE;
    }

    @Override
    public Verdict aggregate(FactSnapshot snapshot) {
        List<Fact> contributions = snapshot.query(FactKinds.RISK_CONTRIBUTION);
        List<Fact> violations = snapshot.query(FactKinds.VIOLATION);
        List<Fact> matches = snapshot.query(FactKinds.MATCH);

        List<Double> probabilities = new ArrayList<>(contributions.size());
        List<Map<String, Object>> factors = new ArrayList<>();
        for (Fact contribution : contributions) {
            double weight = clamp(contribution.number("weight", 0.0));
            double p = clamp(weight * contribution.confidence());
            probabilities.add(p);

            Map<String, Object> factor = new LinkedHashMap<>();
            factor.put("fact_id", contribution.id());
            factor.put("source", contribution.text("source"));
            factor.put("weight", weight);
            factor.put("confidence", contribution.confidence());
            factor.put("contribution", p);
            factors.add(factor);
        }

        double probability = noisyOr(probabilities);
        RiskLabel label = RiskLabel.classify(probability, lowThreshold, moderateThreshold);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("probability", probability);
        payload.put("label", label.name());
        payload.put("risk_contributions", contributions.size());
        payload.put("violations", violations.size());
        payload.put("matches", matches.size());
        payload.put("factors", factors);
        payload.put("top_violations", topViolations(violations));

        Set<Long> dependsOn = new TreeSet<>();
        snapshot.query(FactKinds.SEED).forEach(seed -> dependsOn.add(seed.id()));
        contributions.forEach(fact -> dependsOn.add(fact.id()));
        violations.forEach(fact -> dependsOn.add(fact.id()));
        matches.forEach(fact -> dependsOn.add(fact.id()));

        log.info("Forensic verdict probability={} label={} from {} contributions",
            probability, label, contributions.size());
        return new Verdict(label.name(), probability, payload, dependsOn);
    }

    /**
     * Noisy-OR of independent failure probabilities, clamped to [0,1].
     */
    public static double noisyOr(Collection<Double> probabilities) {
        double survival = 1.0;
        for (double p : probabilities) {
            survival *= 1.0 - clamp(p);
        }
        return clamp(1.0 - survival);
    }

    private List<Map<String, Object>> topViolations(List<Fact> violations) {
        return violations.stream()
            .sorted(Comparator.comparing((Fact v) -> Severity.fromValue(v.text("severity"))).reversed()
                .thenComparingLong(Fact::id))
            .limit(5)
            .map(v -> {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("fact_id", v.id());
                entry.put("rule", v.text("rule"));
                entry.put("severity", v.text("severity"));
                entry.put("description", v.text("description"));
                return entry;
            })
            .toList();
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
