package com.purchasingpower.synthflow.service.execution;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Arrays;
import java.util.List;

/**
 * One input/expected-output example. Values are JSON-like: numbers, strings, booleans,
 * lists, maps and null.
 */
@Value
@Builder
@Jacksonized
public class TestCase {

    @Builder.Default
    List<Object> inputs = List.of();

    Object expected;

    String description;

    public static TestCase of(Object expected, Object... inputs) {
        return TestCase.builder()
                .inputs(Arrays.asList(inputs))
                .expected(expected)
                .build();
    }
}
