package com.purchasingpower.synthflow.service.execution;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Immutable result of an in-memory compilation.
 *
 * <p>On success carries the bytecode of every class the source declared, keyed by binary name.
 */
@Value
@Builder
public class CompilationResult {

    boolean success;

    @Builder.Default
    List<CompilationError> errors = List.of();

    @Builder.Default
    Map<String, byte[]> classes = Map.of();

    long compilationTimeMs;

    public static CompilationResult success(Map<String, byte[]> classes, long timeMs) {
        return CompilationResult.builder()
                .success(true)
                .classes(Map.copyOf(classes))
                .compilationTimeMs(timeMs)
                .build();
    }

    public static CompilationResult failure(List<CompilationError> errors, long timeMs) {
        return CompilationResult.builder()
                .success(false)
                .errors(errors)
                .compilationTimeMs(timeMs)
                .build();
    }

    /**
     * Returns detailed error messages for logging and feedback.
     */
    public String getDetailedErrors() {
        if (success) {
            return "No errors";
        }

        StringBuilder sb = new StringBuilder();
        sb.append("Compilation failed with ").append(errors.size()).append(" errors:\n");
        for (int i = 0; i < errors.size(); i++) {
            CompilationError error = errors.get(i);
            sb.append(String.format("%d. Line %d: %s%n", i + 1, error.getLine(), error.getMessage()));
        }
        return sb.toString();
    }
}
