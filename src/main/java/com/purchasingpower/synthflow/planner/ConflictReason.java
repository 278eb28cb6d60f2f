package com.purchasingpower.synthflow.planner;

import lombok.Value;

import java.util.List;

/**
 * Holes whose current values jointly violate a constraint.
 */
@Value
public class ConflictReason {

    List<String> holeIds;

    String explanation;
}
