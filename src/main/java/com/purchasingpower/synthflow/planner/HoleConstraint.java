package com.purchasingpower.synthflow.planner;

import java.util.Optional;

/**
 * A registered check over hole assignments, consulted after each propagation fixpoint.
 *
 * <p>Implementations must only report a conflict when every hole in the reason is assigned,
 * and the reported holes must be sufficient: any other assignment of the remaining holes
 * would conflict in the same way.
 */
public interface HoleConstraint {

    String name();

    Optional<ConflictReason> check(PartialAssignment assignment);
}
