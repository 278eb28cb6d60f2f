package com.purchasingpower.synthflow.service.execution;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TestResult {

    TestCase testCase;

    boolean passed;

    Object actual;

    /** Exception or timeout message, null when the call returned normally. */
    String error;

    long durationMs;

    public static TestResult failed(TestCase testCase, String error) {
        return TestResult.builder().testCase(testCase).passed(false).error(error).build();
    }
}
