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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Looks for source that contradicts a view-layer axiom rather than for known bugs.
 *
 * Axioms checked: idempotent initializers, observable state, stable symbols and pure
 * view bodies. Each contradiction becomes one {@code violation} tagged with its axiom.
 */
public class AxiomInverterAgent extends SeedScanningAgent {

    private static final Logger log = LoggerFactory.getLogger(AxiomInverterAgent.class);

    public static final String NAME = "axiom-inverter";

    static final double CONFIDENCE = 0.9;

    private static final List<String> SIDE_EFFECTS = List.of(
        "fetchData", "loadData", "startTimer", "beginRequest",
        "URLSession", "network", "download", "upload",
        "Timer.scheduledTimer", "DispatchQueue.main.async",
        "NotificationCenter.default.post", "UserDefaults.standard.set",
        "FileManager", "write(", "save("
    );

    private static final List<String> REFERENCE_TYPES = List.of("class ", "AnyObject", "NSObject", "UIViewController");

    private static final List<String> HEAVY_BODY_WORK = List.of("URLSession.shared", "try await", "Actor", "MainActor");

    private static final Pattern DLSYM_SYMBOL = Pattern.compile("dlsym\\s*\\([^,]+,\\s*\"([^\"]+)\"");

    private static final String MANGLED_PREFIX = "_$s";

    public AxiomInverterAgent() {
        super(NAME, Set.of(FactKinds.VIOLATION));
    }

    @Override
    protected int inspect(Fact seed, String source, List<ProposedFact> out) {
        int before = out.size();

        for (String effect : SIDE_EFFECTS) {
            if (Pattern.compile("init\\s*\\([^)]*\\)\\s*\\{[^}]*" + Pattern.quote(effect), Pattern.DOTALL)
                .matcher(source).find()) {
                out.add(violation(seed, "AXIOM_IDEMPOTENCY", Severity.CRITICAL,
                    "side effect '" + effect + "' in init",
                    "duplicate work on every view re-creation",
                    "move '" + effect + "' to onAppear or a task"));
                break;
            }
        }

        if (source.contains("@State var")) {
            for (String reference : REFERENCE_TYPES) {
                if (source.contains(reference)) {
                    out.add(violation(seed, "AXIOM_OBSERVABILITY", Severity.HIGH,
                        "reference type held in @State",
                        "state changes may not trigger view updates",
                        "use @StateObject for class instances"));
                    break;
                }
            }
        }

        if (source.contains("dlsym") && !source.contains(MANGLED_PREFIX)) {
            Matcher symbol = DLSYM_SYMBOL.matcher(source);
            if (symbol.find() && !symbol.group(1).startsWith(MANGLED_PREFIX)) {
                out.add(violation(seed, "AXIOM_SYMBOLIC", Severity.CRITICAL,
                    "dlsym called with unmangled name '" + symbol.group(1) + "'",
                    "symbol lookup fails at runtime",
                    "use the mangled name or export a stable @_cdecl symbol"));
            }
        }

        if (source.contains("var body: some View")) {
            for (String heavy : HEAVY_BODY_WORK) {
                if (Pattern.compile("var body:\\s*some View\\s*\\{[^}]*" + Pattern.quote(heavy), Pattern.DOTALL)
                    .matcher(source).find()) {
                    out.add(violation(seed, "AXIOM_PURITY", Severity.MEDIUM,
                        "heavy operation '" + heavy + "' in body computation",
                        "stutter and excess recomputation",
                        "move async work into a .task modifier"));
                    break;
                }
            }
        }

        int found = out.size() - before;
        log.info("Seed {} inverted against 4 axioms: {} contradictions", seed.id(), found);
        return found;
    }

    private ProposedFact violation(Fact seed, String axiom, Severity severity,
                                   String description, String impact, String remediation) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("rule", axiom);
        payload.put("axiom", axiom);
        payload.put("severity", severity.name());
        payload.put("description", description);
        payload.put("impact", impact);
        payload.put("remediation", remediation);
        payload.put("occurrences", 1);
        payload.put("detector", NAME);
        return ProposedFact.of(FactKinds.VIOLATION, payload)
            .withConfidence(CONFIDENCE)
            .dependingOn(seed.id());
    }
}
