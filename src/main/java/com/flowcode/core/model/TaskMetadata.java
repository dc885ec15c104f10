package com.flowcode.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * @param createdAt   when the task was planned
 * @param updatedAt   last modification time
 * @param version     plan version, starts at 1 and increases with every adaptation
 * @param tags        classification tags (scope, complexity, strategies)
 * @param source      "user", "system" or "adapted"
 * @param annotations notes recorded during execution (rejection reasons, failure reason, redirects)
 */
public record TaskMetadata(
    Instant createdAt,
    Instant updatedAt,
    int version,
    List<String> tags,
    String source,
    Map<String, String> annotations
) implements Serializable {

    public TaskMetadata {
        tags = tags == null ? List.of() : List.copyOf(tags);
        annotations = annotations == null ? Map.of() : Map.copyOf(annotations);
    }

    public static TaskMetadata initial(List<String> tags, String source) {
        Instant now = Instant.now();
        return new TaskMetadata(now, now, 1, tags, source, Map.of());
    }

    public TaskMetadata touch() {
        return new TaskMetadata(createdAt, Instant.now(), version, tags, source, annotations);
    }

    public TaskMetadata nextVersion(String source) {
        return new TaskMetadata(createdAt, Instant.now(), version + 1, tags, source, annotations);
    }

    public TaskMetadata annotate(String key, String value) {
        var copy = new HashMap<>(annotations);
        copy.put(key, value);
        return new TaskMetadata(createdAt, Instant.now(), version, tags, source, copy);
    }
}
