package com.company.clientpulse.domain.enums;

public enum CheckCategory {
    GENERAL("General"),
    SYNC("Sync");

    private final String displayName;

    CheckCategory(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static CheckCategory fromString(String category) {
        if (category == null) {
            return GENERAL;
        }
        try {
            return CheckCategory.valueOf(category.toUpperCase());
        } catch (IllegalArgumentException e) {
            return GENERAL;
        }
    }
}
