package com.purchasingpower.synthflow.model.constraint;

public enum PositionRequirement {
    NOT_ADJACENT,
    ORDERED,
    MIN_DISTANCE,
    MAX_DISTANCE
}
