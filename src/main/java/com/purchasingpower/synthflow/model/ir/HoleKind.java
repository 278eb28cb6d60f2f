package com.purchasingpower.synthflow.model.ir;

/**
 * Which part of the specification a typed hole belongs to.
 */
public enum HoleKind {
    INTENT,
    SIGNATURE,
    EFFECT,
    ASSERTION,
    IMPLEMENTATION
}
