package com.blackboard.contract;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FactContractValidatorTest {

    private FactContractValidator validator;

    @BeforeEach
    void setUp() {
        validator = new FactContractValidator();
    }

    @Nested
    @DisplayName("Common fields")
    class CommonFields {

        @Test
        void blankKindOrProducer_isRejected() {
            assertThrows(FactValidationException.class,
                () -> validator.validate(" ", "agent", Map.of(), 1.0, Set.of(), 0));
            assertThrows(FactValidationException.class,
                () -> validator.validate("note", "", Map.of(), 1.0, Set.of(), 0));
        }

        @Test
        void confidenceOutsideUnitInterval_isRejected() {
            assertThrows(FactValidationException.class,
                () -> validator.validate("note", "agent", Map.of(), -0.1, Set.of(), 0));
            assertThrows(FactValidationException.class,
                () -> validator.validate("note", "agent", Map.of(), Double.NaN, Set.of(), 0));
        }

        @Test
        void dependsOnMustReferenceExistingIds() {
            assertDoesNotThrow(() -> validator.validate("note", "agent", Map.of(), 1.0, Set.of(1L, 3L), 3));
            FactValidationException ex = assertThrows(FactValidationException.class,
                () -> validator.validate("note", "agent", Map.of(), 1.0, Set.of(4L), 3));
            assertTrue(ex.getMessage().contains("4"));
        }

        @Test
        void unknownKind_acceptsAnyPayload() {
            assertDoesNotThrow(() -> validator.validate("custom", "agent", Map.of("anything", 1), 0.3, Set.of(), 0));
        }
    }

    @Nested
    @DisplayName("Per-kind payloads")
    class KindPayloads {

        @Test
        void violation_requiresKnownSeverity() {
            assertDoesNotThrow(() -> validator.validate(FactKinds.VIOLATION, "agent",
                Map.of("rule", "R", "severity", "critical"), 1.0, Set.of(), 0));
            assertThrows(FactValidationException.class, () -> validator.validate(FactKinds.VIOLATION, "agent",
                Map.of("rule", "R", "severity", "SEVERE"), 1.0, Set.of(), 0));
        }

        @Test
        void match_requiresPositiveIntegerOccurrences() {
            assertThrows(FactValidationException.class, () -> validator.validate(FactKinds.MATCH, "agent",
                Map.of("pattern", "P", "occurrences", 0), 1.0, Set.of(), 0));
            assertThrows(FactValidationException.class, () -> validator.validate(FactKinds.MATCH, "agent",
                Map.of("pattern", "P", "occurrences", 1.5), 1.0, Set.of(), 0));
        }

        @Test
        void riskContribution_weightWithinUnitInterval() {
            assertDoesNotThrow(() -> validator.validate(FactKinds.RISK_CONTRIBUTION, "agent",
                Map.of("weight", 0.45, "source", "R"), 1.0, Set.of(), 0));
            assertThrows(FactValidationException.class, () -> validator.validate(FactKinds.RISK_CONTRIBUTION, "agent",
                Map.of("weight", 1.2, "source", "R"), 1.0, Set.of(), 0));
        }

        @Test
        void artifactFragment_requiresStringContentAndIntegerOrder() {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("target", "HomeView");
            payload.put("order", 10);
            payload.put("content", "");
            assertDoesNotThrow(() -> validator.validate(FactKinds.ARTIFACT_FRAGMENT, "agent", payload, 1.0, Set.of(), 0));

            payload.put("order", "first");
            assertThrows(FactValidationException.class,
                () -> validator.validate(FactKinds.ARTIFACT_FRAGMENT, "agent", payload, 1.0, Set.of(), 0));
        }

        @Test
        void axiomCheck_requiresBooleanSatisfied() {
            assertThrows(FactValidationException.class, () -> validator.validate(FactKinds.AXIOM_CHECK, "agent",
                Map.of("target", "T", "axiom", "A", "satisfied", "yes"), 1.0, Set.of(), 0));
            assertThrows(FactValidationException.class, () -> validator.validate(FactKinds.AXIOM_CHECK, "agent",
                Map.of("target", "T", "axiom", "A", "satisfied", true, "applicable", 1), 1.0, Set.of(), 0));
        }

        @Test
        void seedAndVerdict_shapes() {
            assertThrows(FactValidationException.class,
                () -> validator.validate(FactKinds.SEED, "input", Map.of(), 1.0, Set.of(), 0));
            assertThrows(FactValidationException.class, () -> validator.validate(FactKinds.VERDICT, "coordinator",
                Map.of("mode", "oracle", "status", "CONVERGED"), 1.0, Set.of(), 0));
        }
    }
}
