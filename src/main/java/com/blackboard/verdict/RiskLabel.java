package com.blackboard.verdict;

public enum RiskLabel {
    LOW,
    MODERATE,
    HIGH;

    public static RiskLabel classify(double probability, double lowThreshold, double moderateThreshold) {
        if (probability < lowThreshold) {
            return LOW;
        }
        if (probability < moderateThreshold) {
            return MODERATE;
        }
        return HIGH;
    }
}
