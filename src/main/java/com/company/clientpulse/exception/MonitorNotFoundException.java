package com.company.clientpulse.exception;

public class MonitorNotFoundException extends RuntimeException {
    public MonitorNotFoundException(String network, String client) {
        super("No monitor registered for " + client + " on " + network);
    }
}
