package com.flowcode.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Tags distilled from a finished task and its feedback.
 *
 * @param taskId          task the entry was derived from
 * @param patterns        recognised patterns (e.g., "successful_high_risk_task")
 * @param successes       what went well
 * @param failures        what went wrong
 * @param preferenceHints inferred user preferences
 * @param adaptations     plan adaptations applied to the task
 * @param recordedAt      when the entry was created
 */
public record LearningData(
    String taskId,
    List<String> patterns,
    List<String> successes,
    List<String> failures,
    Map<String, String> preferenceHints,
    List<String> adaptations,
    Instant recordedAt
) implements Serializable {

    public LearningData {
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        successes = successes == null ? List.of() : List.copyOf(successes);
        failures = failures == null ? List.of() : List.copyOf(failures);
        preferenceHints = preferenceHints == null ? Map.of() : Map.copyOf(preferenceHints);
        adaptations = adaptations == null ? List.of() : List.copyOf(adaptations);
    }
}
