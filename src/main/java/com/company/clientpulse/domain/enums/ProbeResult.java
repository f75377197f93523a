package com.company.clientpulse.domain.enums;

public enum ProbeResult {
    REACHABLE("Host answered with the expected banner"),
    WRONG_BANNER("Host answered with an unexpected banner"),
    UNREACHABLE("Connection could not be established"),
    READ_TIMEOUT("Connected but no banner within the read deadline");

    private final String description;

    ProbeResult(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isReachable() {
        return this == REACHABLE;
    }
}
