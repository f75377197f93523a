package com.company.clientpulse.exception;

public class UnknownClientException extends RuntimeException {
    public UnknownClientException(String client) {
        super("Unknown client: " + client);
    }
}
