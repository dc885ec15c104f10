package com.flowcode.core.planning;

import com.flowcode.core.model.ComplexityLevel;

import java.time.Duration;
import java.util.List;

/**
 * Heuristic sizing of a goal.
 *
 * @param level           complexity bucket
 * @param estimatedTime   nominal time for the bucket
 * @param confidence      0.3..0.9, lower for bigger goals
 * @param score           raw heuristic score
 * @param factors         what contributed to the score
 * @param recommendations advice for complex goals
 */
public record ComplexityEstimate(
    ComplexityLevel level,
    Duration estimatedTime,
    double confidence,
    int score,
    List<String> factors,
    List<String> recommendations
) {
    public ComplexityEstimate {
        factors = List.copyOf(factors);
        recommendations = List.copyOf(recommendations);
    }
}
