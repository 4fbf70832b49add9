package com.blackboard.contract;

/**
 * Fact kinds understood by the core. Agents may write other kinds as long as
 * they declare them in their descriptor.
 */
public final class FactKinds {

    public static final String SEED = "seed";
    public static final String VIOLATION = "violation";
    public static final String MATCH = "match";
    public static final String SCAN = "scan";
    public static final String RISK_CONTRIBUTION = "risk_contribution";
    public static final String ARTIFACT_FRAGMENT = "artifact_fragment";
    public static final String AXIOM_CHECK = "axiom_check";
    public static final String AGENT_ERROR = "agent_error";
    public static final String VERDICT = "verdict";

    /** Producer id used for facts written by the coordinator itself. */
    public static final String COORDINATOR = "coordinator";

    private FactKinds() {
    }
}
