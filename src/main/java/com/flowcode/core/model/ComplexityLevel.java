package com.flowcode.core.model;

import java.time.Duration;

/**
 * Heuristic size buckets with their nominal time estimates.
 */
public enum ComplexityLevel {
    TRIVIAL(Duration.ofSeconds(30)),
    SIMPLE(Duration.ofMinutes(2)),
    MODERATE(Duration.ofMinutes(10)),
    COMPLEX(Duration.ofMinutes(30)),
    EXPERT(Duration.ofHours(1));

    private final Duration estimatedTime;

    ComplexityLevel(Duration estimatedTime) {
        this.estimatedTime = estimatedTime;
    }

    public Duration estimatedTime() {
        return estimatedTime;
    }

    public static ComplexityLevel fromScore(int score) {
        if (score <= 2) return TRIVIAL;
        if (score <= 5) return SIMPLE;
        if (score <= 8) return MODERATE;
        if (score <= 12) return COMPLEX;
        return EXPERT;
    }
}
