package com.blackboard.verdict;

public enum ComplianceLabel {
    COMPLIANT,
    PARTIAL,
    NON_COMPLIANT;

    public static ComplianceLabel classify(double score) {
        if (score >= 1.0) {
            return COMPLIANT;
        }
        return score > 0.0 ? PARTIAL : NON_COMPLIANT;
    }
}
