package com.purchasingpower.synthflow.exception;

import lombok.Getter;

@Getter
public class CodeGenerationException extends RuntimeException {

    private final String functionName;

    public CodeGenerationException(String message, String functionName) {
        super(message);
        this.functionName = functionName;
    }

    public CodeGenerationException(String message, String functionName, Throwable cause) {
        super(message, cause);
        this.functionName = functionName;
    }
}
