package com.blackboard.agent.forensic;

import com.blackboard.contract.Fact;
import com.blackboard.contract.FactKinds;
import com.blackboard.contract.ProposedFact;
import com.blackboard.contract.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scans seed source against a library of known antipattern signatures.
 *
 * Each signature hit yields a {@code match} fact and a {@code violation} derived from
 * it. When the seed carries a linker {@code config} without the interposable flag,
 * that is reported as a CRITICAL violation as well.
 */
public class PatternDetectorAgent extends SeedScanningAgent {

    private static final Logger log = LoggerFactory.getLogger(PatternDetectorAgent.class);

    public static final String NAME = "pattern-detector";

    static final double CONFIDENCE = 0.8;
    private static final int SAMPLE_LIMIT = 3;

    public static final List<SignaturePattern> DEFAULT_SIGNATURES = List.of(
        SignaturePattern.of("UNMANGLED_SYMBOL", "dlsym\\s*\\([^,]+,\\s*\"[a-zA-Z][a-zA-Z0-9_]*\"",
            "dlsym with unmangled Swift symbol", Severity.CRITICAL),
        SignaturePattern.of("GIANT_TEST", "XCTAssertEqual\\s*\\([^)]*analytics",
            "assertion roulette: analytics asserted in a unit test", Severity.MEDIUM),
        SignaturePattern.of("DOTNET_HALLUCINATION", "Aspnet_regiis",
            "Windows IIS command in Swift code", Severity.HIGH),
        SignaturePattern.of("GOLANG_HALLUCINATION", "GOPATH|GOROOT|go\\s+build",
            "Go environment or command in Swift code", Severity.HIGH),
        SignaturePattern.of("INIT_LEAK", "@StateObject\\s+var\\s+\\w+\\s*=\\s*\\w+\\(\\)",
            "StateObject initialized inline in declaration", Severity.HIGH),
        SignaturePattern.of("STATE_INIT", "@State\\s+var\\s+\\w+\\s*:\\s*\\w+\\s*=\\s*\\w+\\(\\)",
            "@State with inline class initialization", Severity.MEDIUM),
        SignaturePattern.of("INIT_SIDE_EFFECT", "init\\s*\\([^)]*\\)\\s*\\{[^}]*(fetch|load|start|request)",
            "side effect in initializer", Severity.CRITICAL),
        SignaturePattern.of("FORCE_CAST", "force_cast|as!",
            "force cast can crash at runtime", Severity.HIGH),
        SignaturePattern.of("FORCE_TRY", "try!",
            "force try can crash at runtime", Severity.HIGH),
        SignaturePattern.of("STRONG_SELF_CLOSURE", "\\{\\s*self\\.",
            "strong self capture in closure", Severity.MEDIUM),
        SignaturePattern.of("MAIN_QUEUE_SELF", "DispatchQueue\\.main\\.async\\s*\\{[^}]*self\\.",
            "main queue async with strong self", Severity.MEDIUM),
        SignaturePattern.of("TIMER_SELECTOR", "Timer\\.scheduledTimer.*selector",
            "timer with selector target, potential retain cycle", Severity.MEDIUM)
    );

    private final List<SignaturePattern> signatures;

    public PatternDetectorAgent() {
        this(DEFAULT_SIGNATURES);
    }

    public PatternDetectorAgent(List<SignaturePattern> signatures) {
        super(NAME, Set.of(FactKinds.MATCH, FactKinds.VIOLATION));
        this.signatures = List.copyOf(signatures);
    }

    @Override
    protected int inspect(Fact seed, String source, List<ProposedFact> out) {
        int hits = 0;
        for (SignaturePattern signature : signatures) {
            int occurrences = signature.occurrences(source);
            if (occurrences == 0) {
                continue;
            }

            Map<String, Object> match = new LinkedHashMap<>();
            match.put("pattern", signature.tag());
            match.put("description", signature.description());
            match.put("severity", signature.severity().name());
            match.put("occurrences", occurrences);
            match.put("samples", signature.samples(source, SAMPLE_LIMIT));
            int matchIndex = out.size();
            out.add(ProposedFact.of(FactKinds.MATCH, match).dependingOn(seed.id()));

            Map<String, Object> violation = new LinkedHashMap<>();
            violation.put("rule", signature.tag());
            violation.put("severity", signature.severity().name());
            violation.put("description", signature.description());
            violation.put("occurrences", occurrences);
            violation.put("detector", NAME);
            out.add(ProposedFact.of(FactKinds.VIOLATION, violation)
                .withConfidence(CONFIDENCE)
                .dependingOn(seed.id())
                .dependingOnProposal(matchIndex));

            log.debug("Signature {} matched {} times in seed {}", signature.tag(), occurrences, seed.id());
            hits++;
        }

        String config = seed.text("config");
        if (config != null && !config.contains("-interposable") && !config.contains("-Xlinker")) {
            Map<String, Object> violation = new LinkedHashMap<>();
            violation.put("rule", "MISSING_INTERPOSABLE");
            violation.put("severity", Severity.CRITICAL.name());
            violation.put("description", "linker flags lack -Xlinker -interposable");
            violation.put("occurrences", 1);
            violation.put("detector", NAME);
            violation.put("config", config);
            out.add(ProposedFact.of(FactKinds.VIOLATION, violation)
                .withConfidence(CONFIDENCE)
                .dependingOn(seed.id()));
            hits++;
        }

        log.info("Seed {} scanned against {} signatures: {} findings", seed.id(), signatures.size(), hits);
        return hits;
    }
}
