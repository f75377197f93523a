package com.company.clientpulse.exception;

public class CheckNotFoundException extends RuntimeException {
    public CheckNotFoundException(String checkId) {
        super("No check found with id " + checkId);
    }
}
