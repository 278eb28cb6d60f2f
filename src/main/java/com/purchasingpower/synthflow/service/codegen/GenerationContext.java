package com.purchasingpower.synthflow.service.codegen;

import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything one generation call needs.
 */
@Value
@Builder(toBuilder = true)
public class GenerationContext {

    /** Resolved IR with its applicable constraints attached. */
    IntermediateRepresentation ir;

    @Builder.Default
    double temperature = 0.2;

    /** One-based attempt number within the retry loop. */
    @Builder.Default
    int attempt = 1;

    /** Feedback from the previous attempt; empty on the first one. */
    @Builder.Default
    List<RetryFeedback> feedback = List.of();

    /** Source of the previous attempt, null on the first one. */
    String previousCode;

    public boolean isRetry() {
        return !feedback.isEmpty();
    }

    public String functionName() {
        return ir.getSignature() == null ? null : ir.getSignature().getName();
    }
}
