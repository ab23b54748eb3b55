package com.example.FinSolve.model;

import java.util.Locale;

/**
 * Roles handed to the assistant by the identity provider.
 * A role is fixed for the lifetime of a user account.
 */
public enum Role {
    FINANCE("finance"),
    MARKETING("marketing"),
    HR("hr"),
    ENGINEERING("engineering"),
    C_LEVEL("c-level"),
    EMPLOYEE("employee");

    private final String label;

    Role(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Parse an external role label such as "c-level", "C_Level" or "Finance".
     *
     * @throws IllegalArgumentException if the label names no known role
     */
    public static Role fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Role label must not be blank");
        }
        String normalized = value.trim()
                .replace('_', '-')
                .replace(' ', '-')
                .toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.label.equals(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + value);
    }
}
