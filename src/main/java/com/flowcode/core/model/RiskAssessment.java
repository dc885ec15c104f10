package com.flowcode.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * @param level       overall risk
 * @param factors     what contributed to the rating
 * @param impact      human-readable impact description
 * @param mitigations recommended safeguards
 * @param confidence  0..1 confidence in the rating
 */
public record RiskAssessment(
    RiskLevel level,
    List<String> factors,
    String impact,
    List<String> mitigations,
    double confidence
) implements Serializable {

    public RiskAssessment {
        factors = factors == null ? List.of() : List.copyOf(factors);
        mitigations = mitigations == null ? List.of() : List.copyOf(mitigations);
    }
}
