package com.purchasingpower.synthflow.service.orchestration;

public enum SynthesisStatus {
    ACCEPTED,
    UNSATISFIABLE,
    PLANNING_BUDGET_EXHAUSTED,
    SPECIFICATION_REJECTED,
    GENERATION_EXHAUSTED,
    CANCELLED
}
