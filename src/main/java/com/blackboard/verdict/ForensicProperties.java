package com.blackboard.verdict;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Risk label thresholds and the accepted source size, bound from {@code blackboard.forensic.*}.
 */
@ConfigurationProperties(prefix = "blackboard.forensic")
public record ForensicProperties(Double lowThreshold, Double moderateThreshold, Integer maxSourceLength) {

    public static final int DEFAULT_MAX_SOURCE_LENGTH = 200_000;

    public ForensicVerdictAggregator toAggregator() {
        return new ForensicVerdictAggregator(
            lowThreshold != null ? lowThreshold : 0.3,
            moderateThreshold != null ? moderateThreshold : 0.6
        );
    }

    public int maxSourceLengthOrDefault() {
        if (maxSourceLength == null) {
            return DEFAULT_MAX_SOURCE_LENGTH;
        }
        if (maxSourceLength <= 0) {
            throw new IllegalArgumentException("max_source_length must be > 0, got " + maxSourceLength);
        }
        return maxSourceLength;
    }
}
