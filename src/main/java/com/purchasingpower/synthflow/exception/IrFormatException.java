package com.purchasingpower.synthflow.exception;

public class IrFormatException extends RuntimeException {

    public IrFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
