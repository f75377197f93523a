package com.company.clientpulse.exception;

public class CheckExecutionException extends RuntimeException {
    public CheckExecutionException(String checkName, Throwable cause) {
        super("Failed to run check " + checkName + ": " + cause.getMessage(), cause);
    }

    public CheckExecutionException(String message) {
        super(message);
    }
}
