package com.purchasingpower.synthflow.planner;

import lombok.Value;

/**
 * A hole bound to a value at a decision level.
 */
@Value
public class Assignment {

    String holeId;

    String value;

    int decisionLevel;

    /** Id of the clause that forced this assignment, null for decisions. */
    Integer antecedent;

    public boolean isDecision() {
        return antecedent == null;
    }
}
