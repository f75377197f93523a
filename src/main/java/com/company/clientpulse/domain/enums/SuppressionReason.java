package com.company.clientpulse.domain.enums;

public enum SuppressionReason {
    NOT_ELIGIBLE("Client is neither a root cause nor referenced by an unexplained issue"),
    NO_FAILURES("No failing checks for the client"),
    ONLY_INFRA_OR_UNRELATED("All affected instances are unreachable or caused by another client");

    private final String description;

    SuppressionReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
