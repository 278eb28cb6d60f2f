package com.purchasingpower.synthflow.service.execution;

import lombok.Builder;
import lombok.Value;

/**
 * Represents a single compilation error.
 */
@Value
@Builder
public class CompilationError {

    /**
     * Line number where error occurred (1-indexed).
     */
    int line;

    int column;

    String message;

    /**
     * Diagnostic kind, or {@code EXCEPTION} when the compiler itself failed.
     */
    String kind;
}
