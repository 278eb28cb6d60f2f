package com.purchasingpower.synthflow.service.selection;

import lombok.Builder;
import lombok.Value;

/**
 * One generated implementation and how it fared on the test cases.
 */
@Value
@Builder
public class GenerationCandidate {

    String sourceCode;

    int passedTests;

    int totalTests;

    /** passed / total, 0 when there were no tests or generation failed. */
    double score;

    double temperature;

    /** Why generation failed, null for a usable candidate. */
    String error;

    public boolean isFailed() {
        return error != null;
    }

    public boolean isPerfect() {
        return !isFailed() && totalTests > 0 && passedTests == totalTests;
    }

    static GenerationCandidate failed(double temperature, int totalTests, String error) {
        return GenerationCandidate.builder()
                .sourceCode("")
                .totalTests(totalTests)
                .temperature(temperature)
                .error(error)
                .build();
    }
}
