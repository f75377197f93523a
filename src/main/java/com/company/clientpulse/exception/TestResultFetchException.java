package com.company.clientpulse.exception;

public class TestResultFetchException extends RuntimeException {
    public TestResultFetchException(String network, Throwable cause) {
        super("Failed to fetch test results for network " + network, cause);
    }
}
