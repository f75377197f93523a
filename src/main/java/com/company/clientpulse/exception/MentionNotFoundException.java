package com.company.clientpulse.exception;

public class MentionNotFoundException extends RuntimeException {
    public MentionNotFoundException(String network, String client) {
        super("No mentions configured for " + client + " on " + network);
    }
}
