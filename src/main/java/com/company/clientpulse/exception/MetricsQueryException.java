package com.company.clientpulse.exception;

public class MetricsQueryException extends RuntimeException {
    public MetricsQueryException(String message) {
        super(message);
    }

    public MetricsQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
