package com.purchasingpower.synthflow.model.constraint;

/**
 * What the loop must do once its condition matches.
 */
public enum LoopRequirement {
    /** Return as soon as the condition matches. */
    EARLY_RETURN,
    /** Finish iterating and accumulate matches. */
    ACCUMULATE,
    /** Finish iterating and transform every element. */
    TRANSFORM
}
