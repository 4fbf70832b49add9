package com.blackboard.agent.forensic;

import com.blackboard.contract.Fact;
import com.blackboard.contract.FactKinds;
import com.blackboard.contract.ProposedFact;
import com.blackboard.contract.Severity;
import com.blackboard.store.InMemoryFactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RiskAssessorAgentTest {

    private final RiskAssessorAgent agent = new RiskAssessorAgent();
    private InMemoryFactStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryFactStore();
        store.append(FactKinds.SEED, "input", Map.of("source", "x"), 1.0, Set.of());
    }

    @Test
    void weightScalesWithOccurrencesAndIsCapped() {
        assertEquals(0.45, RiskAssessorAgent.weightOf(Severity.CRITICAL, 1), 1e-9);
        assertTrue(RiskAssessorAgent.weightOf(Severity.MEDIUM, 4) > RiskAssessorAgent.weightOf(Severity.MEDIUM, 2));
        assertEquals(0.95, RiskAssessorAgent.weightOf(Severity.CRITICAL, 1000), 1e-9);
    }

    @Test
    void eachViolationAssessedOnceWithItsConfidence() {
        Fact violation = store.append(FactKinds.VIOLATION, "detector",
            Map.of("rule", "FORCE_TRY", "severity", "HIGH", "occurrences", 1), 0.8, Set.of(1L));
        assertTrue(agent.isTriggered(store.snapshot()));

        List<ProposedFact> proposals = agent.run(store.snapshot());
        assertEquals(1, proposals.size());
        ProposedFact contribution = proposals.get(0);
        assertEquals(0.30, (Double) contribution.payload().get("weight"), 1e-9);
        assertEquals(0.8, contribution.confidence());
        assertEquals(Set.of(violation.id()), contribution.dependsOn());

        store.append(contribution.kind(), RiskAssessorAgent.NAME, contribution.payload(),
            contribution.confidence(), contribution.dependsOn());
        assertFalse(agent.isTriggered(store.snapshot()));
    }
}
