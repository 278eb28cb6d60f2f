package com.purchasingpower.synthflow.planner;

import com.purchasingpower.synthflow.service.verification.AssertionVerifier;
import com.purchasingpower.synthflow.service.verification.VerificationResult;

import java.util.List;
import java.util.Optional;

/**
 * Asks the assertion verifier about the resolved IR once every hole in scope is assigned.
 */
public class AssertionConstraint implements HoleConstraint {

    private final AssertionVerifier verifier;
    private final List<String> scope;

    public AssertionConstraint(AssertionVerifier verifier, List<String> scope) {
        this.verifier = verifier;
        this.scope = List.copyOf(scope);
    }

    /**
     * Checks the fully resolved IR, blaming every planned hole.
     */
    public AssertionConstraint(AssertionVerifier verifier) {
        this(verifier, List.of());
    }

    @Override
    public String name() {
        return scope.isEmpty() ? "assertions" : "assertions" + scope;
    }

    @Override
    public Optional<ConflictReason> check(PartialAssignment assignment) {
        List<String> holes = scope.isEmpty() ? assignment.plannedHoles() : scope;
        if (!assignment.assignsAll(holes)) {
            return Optional.empty();
        }
        VerificationResult result = verifier.verify(assignment.resolve());
        if (result.isVerified()) {
            return Optional.empty();
        }
        return Optional.of(new ConflictReason(holes, "assertion refuted: " + result.getMessage()));
    }
}
