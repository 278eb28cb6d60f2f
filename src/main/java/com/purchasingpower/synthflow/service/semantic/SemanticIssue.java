package com.purchasingpower.synthflow.service.semantic;

import com.purchasingpower.synthflow.model.constraint.Severity;
import lombok.Builder;
import lombok.Value;

/**
 * A problem in the specification itself, found before any code exists.
 */
@Value
@Builder
public class SemanticIssue {

    Severity severity;

    /**
     * Stable machine-readable category, e.g. {@code implicit_return}, {@code unused_parameter}.
     */
    String category;

    String message;

    String suggestion;

    /** Zero-based effect the issue points at, null when it concerns the whole IR. */
    Integer effectIndex;

    public boolean isBlocking() {
        return severity.isBlocking();
    }

    @Override
    public String toString() {
        String location = effectIndex == null ? "" : " (effect " + (effectIndex + 1) + ")";
        return String.format("[%s] %s%s: %s", severity, category, location, message);
    }
}
