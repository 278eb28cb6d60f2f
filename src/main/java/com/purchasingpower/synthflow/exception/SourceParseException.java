package com.purchasingpower.synthflow.exception;

import lombok.Getter;

import java.util.List;

/**
 * Generated source could not be parsed.
 *
 * <p>Raised by the validator. The retry loop turns it into a syntax violation, so it never
 * reaches callers of the synthesis service.
 */
@Getter
public class SourceParseException extends RuntimeException {

    private final List<String> problems;

    public SourceParseException(String message, List<String> problems) {
        super(message);
        this.problems = List.copyOf(problems);
    }
}
