package com.purchasingpower.synthflow.exception;

import lombok.Getter;

@Getter
public class TestExecutionException extends RuntimeException {

    private final String errorLogs;

    public TestExecutionException(String message, String errorLogs) {
        super(message);
        this.errorLogs = errorLogs;
    }
}
