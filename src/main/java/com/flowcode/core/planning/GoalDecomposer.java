package com.flowcode.core.planning;

/**
 * Strategy that reads a goal and proposes the actions needed to achieve it.
 * Implementations must be side-effect free; the planner turns the proposal
 * into ordered, risk-rated steps.
 */
public interface GoalDecomposer {

    /**
     * @param goal non-blank goal text
     * @return the analysis; an empty action list means the goal is not actionable
     */
    GoalAnalysis analyze(String goal);
}
