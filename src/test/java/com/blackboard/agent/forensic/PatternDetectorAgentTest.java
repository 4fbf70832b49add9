package com.blackboard.agent.forensic;

import com.blackboard.contract.Fact;
import com.blackboard.contract.FactKinds;
import com.blackboard.contract.ProposedFact;
import com.blackboard.store.FactSnapshot;
import com.blackboard.store.InMemoryFactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

class PatternDetectorAgentTest {

    private final PatternDetectorAgent agent = new PatternDetectorAgent();
    private InMemoryFactStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryFactStore();
    }

    @Test
    void forceTryAndForceCast_eachYieldMatchThenViolation() throws Exception {
        seed(Map.of("source", "let a = try! load()\nlet b = x as! String\nlet c = try! other()"));

        List<ProposedFact> proposals = agent.run(store.snapshot());

        List<String> kinds = proposals.stream().map(ProposedFact::kind).toList();
        assertEquals(List.of(FactKinds.MATCH, FactKinds.VIOLATION, FactKinds.MATCH, FactKinds.VIOLATION, FactKinds.SCAN),
            kinds);
        ProposedFact forceCast = proposals.get(1);
        assertEquals("FORCE_CAST", forceCast.payload().get("rule"));
        assertEquals(Set.of(0), forceCast.dependsOnProposals());
        ProposedFact forceTry = proposals.get(3);
        assertEquals("FORCE_TRY", forceTry.payload().get("rule"));
        assertEquals(2, forceTry.payload().get("occurrences"));
        assertEquals(Set.of(1L), forceTry.dependsOn());
    }

    @Test
    void configWithoutInterposableFlag_isCritical() throws Exception {
        seed(Map.of("source", "struct Clean {}", "config", "OTHER_LDFLAGS = -Onone"));

        List<ProposedFact> proposals = agent.run(store.snapshot());

        ProposedFact violation = proposals.get(0);
        assertEquals("MISSING_INTERPOSABLE", violation.payload().get("rule"));
        assertEquals("CRITICAL", violation.payload().get("severity"));
    }

    @Test
    void triggeredUntilEachSeedHasItsScan() throws Exception {
        Fact seed = seed(Map.of("source", "struct Clean {}"));
        assertTrue(agent.isTriggered(store.snapshot()));

        List<ProposedFact> proposals = agent.run(store.snapshot());
        assertEquals(1, proposals.size());
        ProposedFact scan = proposals.get(0);
        store.append(scan.kind(), PatternDetectorAgent.NAME, scan.payload(), scan.confidence(), scan.dependsOn());

        FactSnapshot after = store.snapshot();
        assertFalse(agent.isTriggered(after));
        assertEquals(seed.id(), after.query(FactKinds.SCAN).get(0).number("seed_id", 0), 0.0);
    }

    @Test
    void seedsWithoutSource_areIgnored() {
        seed(Map.of("target", "HomeView"));
        assertFalse(agent.isTriggered(store.snapshot()));
    }

    @Test
    void interruptedWorker_stopsScanningInsteadOfHoldingTheThread() {
        seed(Map.of("source", "let a = try! load()\n".repeat(1_000)));

        Thread.currentThread().interrupt();
        try {
            assertThrows(CancellationException.class, () -> agent.run(store.snapshot()));
        } finally {
            Thread.interrupted();
        }
        assertFalse(agent.run(store.snapshot()).isEmpty());
    }

    private Fact seed(Map<String, Object> payload) {
        return store.append(FactKinds.SEED, "input", payload, 1.0, Set.of());
    }
}
