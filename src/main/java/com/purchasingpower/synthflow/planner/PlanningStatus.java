package com.purchasingpower.synthflow.planner;

public enum PlanningStatus {
    SATISFIED,
    UNSATISFIABLE,
    /** Conflict budget ran out before a solution or a refutation was found. */
    BUDGET_EXHAUSTED,
    CANCELLED
}
