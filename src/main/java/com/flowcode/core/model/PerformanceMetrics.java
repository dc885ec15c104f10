package com.flowcode.core.model;

import java.io.Serializable;

public record PerformanceMetrics(
    long executionTimeMs,
    long memoryUsedBytes,
    double cpuTimeMs,
    int networkCalls,
    int cacheHits
) implements Serializable {

    public static PerformanceMetrics wallClock(long executionTimeMs) {
        return new PerformanceMetrics(executionTimeMs, 0, 0, 0, 0);
    }

    public PerformanceMetrics withExecutionTime(long executionTimeMs) {
        return new PerformanceMetrics(executionTimeMs, memoryUsedBytes, cpuTimeMs, networkCalls, cacheHits);
    }
}
