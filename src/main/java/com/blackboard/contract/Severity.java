package com.blackboard.contract;

import java.util.Arrays;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static Severity fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.name().equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown severity: " + raw));
    }
}
