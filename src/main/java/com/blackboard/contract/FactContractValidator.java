package com.blackboard.contract;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates a fact before it is appended. Known kinds get a payload shape
 * check; unknown kinds only need a payload object.
 */
public class FactContractValidator {

    public void validate(String kind,
                         String producer,
                         Map<String, Object> payload,
                         double confidence,
                         Set<Long> dependsOn,
                         long latestId) {
        requireString(kind, "kind is required");
        requireString(producer, "producer is required");
        if (payload == null) {
            throw new FactValidationException("payload is required");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new FactValidationException("confidence must be within [0,1], got " + confidence);
        }
        if (dependsOn != null) {
            for (Long id : dependsOn) {
                if (id == null || id < 1 || id > latestId) {
                    throw new FactValidationException("depends_on contains unknown fact id: " + id);
                }
            }
        }

        switch (kind) {
            case FactKinds.SEED -> validateSeedPayload(payload);
            case FactKinds.VIOLATION -> validateViolationPayload(payload);
            case FactKinds.MATCH -> validateMatchPayload(payload);
            case FactKinds.RISK_CONTRIBUTION -> validateRiskContributionPayload(payload);
            case FactKinds.ARTIFACT_FRAGMENT -> validateArtifactFragmentPayload(payload);
            case FactKinds.AXIOM_CHECK -> validateAxiomCheckPayload(payload);
            case FactKinds.AGENT_ERROR -> validateAgentErrorPayload(payload);
            case FactKinds.VERDICT -> validateVerdictPayload(payload);
            default -> { /* open kinds carry agent-defined payloads */ }
        }
    }

    private void validateSeedPayload(Map<String, Object> payload) {
        if (payload.isEmpty()) {
            throw new FactValidationException("seed payload must not be empty");
        }
    }

    private void validateViolationPayload(Map<String, Object> payload) {
        requireString(payload.get("rule"), "payload.rule is required");
        String severity = requireString(payload.get("severity"), "payload.severity is required");
        try {
            Severity.fromValue(severity);
        } catch (IllegalArgumentException ex) {
            throw new FactValidationException("payload.severity is invalid: " + severity);
        }
    }

    private void validateMatchPayload(Map<String, Object> payload) {
        requireString(payload.get("pattern"), "payload.pattern is required");
        Object occurrences = payload.get("occurrences");
        requireInteger(occurrences, "payload.occurrences is required");
        if (((Number) occurrences).longValue() < 1) {
            throw new FactValidationException("payload.occurrences must be >= 1");
        }
    }

    private void validateRiskContributionPayload(Map<String, Object> payload) {
        Object weight = payload.get("weight");
        requireNumber(weight, "payload.weight is required");
        double value = ((Number) weight).doubleValue();
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new FactValidationException("payload.weight must be within [0,1]");
        }
        requireString(payload.get("source"), "payload.source is required");
    }

    private void validateArtifactFragmentPayload(Map<String, Object> payload) {
        requireString(payload.get("target"), "payload.target is required");
        requireInteger(payload.get("order"), "payload.order is required");
        if (!(payload.get("content") instanceof String)) {
            throw new FactValidationException("payload.content must be a string");
        }
    }

    private void validateAxiomCheckPayload(Map<String, Object> payload) {
        requireString(payload.get("target"), "payload.target is required");
        requireString(payload.get("axiom"), "payload.axiom is required");
        requireBoolean(payload.get("satisfied"), "payload.satisfied is required");
        if (payload.containsKey("applicable")) {
            requireBoolean(payload.get("applicable"), "payload.applicable must be a boolean");
        }
    }

    private void validateAgentErrorPayload(Map<String, Object> payload) {
        requireString(payload.get("agent"), "payload.agent is required");
        requireString(payload.get("failure"), "payload.failure is required");
        requireString(payload.get("error"), "payload.error is required");
    }

    private void validateVerdictPayload(Map<String, Object> payload) {
        String mode = requireString(payload.get("mode"), "payload.mode is required");
        if (!List.of("forensic", "synthesis").contains(mode)) {
            throw new FactValidationException("payload.mode is invalid");
        }
        requireString(payload.get("status"), "payload.status is required");
    }

    private String requireString(Object value, String message) {
        if (!(value instanceof String text) || text.isBlank()) {
            throw new FactValidationException(message);
        }
        return text;
    }

    private void requireNumber(Object value, String message) {
        if (!(value instanceof Number)) {
            throw new FactValidationException(message);
        }
    }

    private void requireInteger(Object value, String message) {
        if (!(value instanceof Integer) && !(value instanceof Long)) {
            throw new FactValidationException(message);
        }
    }

    private void requireBoolean(Object value, String message) {
        if (!(value instanceof Boolean)) {
            throw new FactValidationException(message);
        }
    }
}
