package com.purchasingpower.synthflow.service.codegen;

import com.purchasingpower.synthflow.service.constraint.ConstraintViolation;
import lombok.Builder;
import lombok.Value;

/**
 * One item of feedback carried from a rejected attempt into the next prompt.
 */
@Value
@Builder
public class RetryFeedback {

    /** Violation type name, or {@code GENERATION_ERROR} when the generator itself failed. */
    String constraintType;

    String message;

    String suggestion;

    public static RetryFeedback from(ConstraintViolation violation) {
        return RetryFeedback.builder()
                .constraintType(violation.getType().name())
                .message(violation.getMessage())
                .suggestion(violation.getSuggestion())
                .build();
    }

    public static RetryFeedback generationError(String message) {
        return RetryFeedback.builder()
                .constraintType("GENERATION_ERROR")
                .message(message)
                .suggestion("Reply with one complete Java class in a single code block")
                .build();
    }
}
