package com.blackboard.agent.synthesis;

import com.blackboard.contract.FactKinds;
import com.blackboard.contract.ProposedFact;
import com.blackboard.store.InMemoryFactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AxiomEnforcerAgentTest {

    private final AxiomEnforcerAgent agent = new AxiomEnforcerAgent();
    private InMemoryFactStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryFactStore();
        store.append(FactKinds.SEED, "input", Map.of("target", "Feed"), 1.0, Set.of());
    }

    @Test
    void generatedFragments_satisfyEveryAxiom() throws Exception {
        for (ProposedFact fragment : new ViewGeneratorAgent().run(store.snapshot())) {
            store.append(fragment.kind(), ViewGeneratorAgent.NAME, fragment.payload(), 1.0, fragment.dependsOn());
        }

        List<ProposedFact> checks = agent.run(store.snapshot());

        assertEquals(4, checks.size());
        assertTrue(checks.stream().allMatch(c -> Boolean.TRUE.equals(c.payload().get("satisfied"))),
            () -> checks.stream().map(c -> c.payload().get("reason")).toList().toString());
    }

    @Test
    void forcedTryAndStateWithoutObservable_fail() {
        fragment(10, "struct Feed: View {\n    @State private var model = Plain()\n    let x = try! load()\n}");

        ProposedFact check = agent.run(store.snapshot()).get(0);

        assertEquals(false, check.payload().get("satisfied"));
        assertEquals(List.of("OBSERVABLE_STATE", "ERROR_HANDLING"), check.payload().get("failed"));
        assertEquals(Set.of(2L), check.dependsOn());
    }

    @Test
    void checkedFragments_doNotRetrigger() {
        fragment(10, "import SwiftUI");
        ProposedFact check = agent.run(store.snapshot()).get(0);
        store.append(check.kind(), AxiomEnforcerAgent.NAME, check.payload(), 1.0, check.dependsOn());

        assertFalse(agent.isTriggered(store.snapshot()));
    }

    @Test
    void serviceAndProjectFragments_satisfyEveryAxiom() {
        store.append(FactKinds.SEED, "input", Map.of("target", "FeedService", "artifact_type", "service"), 1.0, Set.of());
        store.append(FactKinds.SEED, "input", Map.of("target", "Demo", "artifact_type", "project"), 1.0, Set.of());
        commit(new ServiceGeneratorAgent().run(store.snapshot()), ServiceGeneratorAgent.NAME);
        commit(new ProjectConfigGeneratorAgent().run(store.snapshot()), ProjectConfigGeneratorAgent.NAME);

        List<ProposedFact> checks = agent.run(store.snapshot());

        assertEquals(5, checks.size());
        assertTrue(checks.stream().allMatch(c -> Boolean.TRUE.equals(c.payload().get("satisfied"))),
            () -> checks.stream().map(c -> c.payload().get("reason")).toList().toString());
    }

    @Test
    void projectConfigWithoutInterposable_failsConfigAxiom() {
        store.append(FactKinds.SEED, "input",
            Map.of("target", "Demo", "artifact_type", "project", "hot_reload", false), 1.0, Set.of());
        commit(new ProjectConfigGeneratorAgent().run(store.snapshot()), ProjectConfigGeneratorAgent.NAME);

        ProposedFact check = agent.run(store.snapshot()).get(0);

        assertEquals(false, check.payload().get("satisfied"));
        assertEquals(List.of("INTERPOSABLE_CONFIG"), check.payload().get("failed"));
    }

    @Test
    void initSideEffects_onlyCountInsideTheInitializerBody() {
        fragment(10, "init(session: URLSession = .shared) {\n    self.session = session\n}");
        fragment(20, "init() {\n    fetchData()\n}\nfunc reload() { URLSession.shared }");

        List<ProposedFact> checks = agent.run(store.snapshot());

        assertEquals(true, checks.get(0).payload().get("satisfied"));
        assertEquals(List.of("INIT_PURITY"), checks.get(1).payload().get("failed"));
    }

    private void commit(List<ProposedFact> proposals, String producer) {
        for (ProposedFact proposal : proposals) {
            store.append(proposal.kind(), producer, proposal.payload(), 1.0, proposal.dependsOn());
        }
    }

    private void fragment(int order, String content) {
        store.append(FactKinds.ARTIFACT_FRAGMENT, ViewGeneratorAgent.NAME,
            Map.of("target", "Feed", "order", order, "content", content), 1.0, Set.of(1L));
    }
}
