package com.flowcode.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * End-of-task feedback.
 *
 * @param rating         1 (poor) to 5 (excellent)
 * @param comments       free text
 * @param suggestions    concrete improvement ideas
 * @param wouldUseAgain  whether the user would run a similar task again
 * @param timestamp      when the feedback was given
 */
public record UserFeedback(
    int rating,
    String comments,
    List<String> suggestions,
    boolean wouldUseAgain,
    Instant timestamp
) implements Serializable {

    public UserFeedback {
        if (rating < 1 || rating > 5) {
            throw new IllegalArgumentException("Rating must be between 1 and 5, got " + rating);
        }
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }
}
