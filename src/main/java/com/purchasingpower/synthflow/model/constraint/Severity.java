package com.purchasingpower.synthflow.model.constraint;

/**
 * Only ERROR blocks acceptance of a candidate (or generation, for semantic issues).
 */
public enum Severity {
    ERROR,
    WARNING;

    public boolean isBlocking() {
        return this == ERROR;
    }
}
