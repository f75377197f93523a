package com.company.clientpulse.domain.enums;

public enum ClientType {
    CONSENSUS("CL", "Consensus layer client"),
    EXECUTION("EL", "Execution layer client");

    private final String shortName;
    private final String description;

    ClientType(String shortName, String description) {
        this.shortName = shortName;
        this.description = description;
    }

    public String getShortName() {
        return shortName;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Accepts either the enum name or the short form ("CL", "EL"), case-insensitive.
     */
    public static ClientType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Client type is required");
        }
        for (ClientType type : values()) {
            if (type.name().equalsIgnoreCase(value) || type.shortName.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown client type: " + value);
    }
}
