package com.purchasingpower.synthflow.model.constraint;

public enum ReturnRequirement {
    EXPLICIT_RETURN
}
