package com.globalai.backend.exception;

public class BrokerOrderException extends RuntimeException {
    private final int statusCode;

    public BrokerOrderException(String message) {
        super(message);
        this.statusCode = -1;
    }

    public BrokerOrderException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
