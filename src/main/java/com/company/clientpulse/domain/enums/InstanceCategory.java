package com.company.clientpulse.domain.enums;

public enum InstanceCategory {
    REGULAR("Affected instances"),
    UNRELATED("Affected instances (likely unrelated)"),
    INFRASTRUCTURE_ISSUE("Potential infrastructure issues");

    private final String label;

    InstanceCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
