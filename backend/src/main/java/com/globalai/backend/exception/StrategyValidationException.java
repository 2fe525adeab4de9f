package com.globalai.backend.exception;

public class StrategyValidationException extends RuntimeException {
    public StrategyValidationException(String message) {
        super(message);
    }

    public StrategyValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
