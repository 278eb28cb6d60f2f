package com.purchasingpower.synthflow.telemetry;

public enum PlannerEventType {
    DECIDE,
    PROPAGATE,
    CONFLICT,
    LEARN,
    BACKJUMP,
    SATISFIED,
    UNSATISFIABLE,
    BUDGET_EXHAUSTED,
    CANCELLED
}
