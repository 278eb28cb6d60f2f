package com.purchasingpower.synthflow.service.constraint;

import com.purchasingpower.synthflow.model.constraint.Constraint;
import com.purchasingpower.synthflow.model.constraint.Severity;
import lombok.Builder;
import lombok.Value;

/**
 * A single failed check of generated code.
 *
 * <p>Produced fresh by every validation call and never stored on the IR.
 */
@Value
@Builder
public class ConstraintViolation {

    /**
     * Originating constraint. Null for structural violations (syntax, missing function).
     */
    Constraint constraint;

    ViolationType type;

    String message;

    Severity severity;

    /**
     * Actionable fix fed back into the next generation attempt.
     */
    String suggestion;

    public boolean isBlocking() {
        return severity.isBlocking();
    }

    public String toLogString() {
        return String.format("[%s] %s: %s", severity, type, message);
    }
}
