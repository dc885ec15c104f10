package com.flowcode.core.planning;

import java.util.Locale;

/**
 * How much of the workspace a goal touches. Each scope carries its weight in
 * complexity scoring.
 */
public enum GoalScope {
    FILE(1),
    MODULE(3),
    PROJECT(5),
    ARCHITECTURE(8);

    private final int complexityWeight;

    GoalScope(int complexityWeight) {
        this.complexityWeight = complexityWeight;
    }

    public int complexityWeight() {
        return complexityWeight;
    }

    public boolean isBroad() {
        return this == PROJECT || this == ARCHITECTURE;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
