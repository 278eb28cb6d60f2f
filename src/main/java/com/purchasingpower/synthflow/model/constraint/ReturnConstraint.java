package com.purchasingpower.synthflow.model.constraint;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * The function must explicitly return a named computed value.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ReturnConstraint implements Constraint {

    String expectedValueName;

    @Builder.Default
    ReturnRequirement requirement = ReturnRequirement.EXPLICIT_RETURN;

    @Builder.Default
    Severity severity = Severity.ERROR;

    String description;

    public static ReturnConstraint of(String expectedValueName) {
        return ReturnConstraint.builder().expectedValueName(expectedValueName).build();
    }

    @Override
    public ConstraintType getType() {
        return ConstraintType.RETURN;
    }

    @Override
    public String getDescription() {
        if (description != null) {
            return description;
        }
        return "Function must explicitly return the computed '" + expectedValueName + "' value";
    }
}
