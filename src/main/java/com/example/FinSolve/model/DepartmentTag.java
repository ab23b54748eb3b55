package com.example.FinSolve.model;

import java.util.Locale;

/**
 * Classification label attached to every fragment at ingestion time.
 */
public enum DepartmentTag {
    FINANCE("finance"),
    MARKETING("marketing"),
    HR("hr"),
    ENGINEERING("engineering"),
    GENERAL("general");

    private final String label;

    DepartmentTag(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * @throws IllegalArgumentException for a malformed tag; fragments must never carry one
     */
    public static DepartmentTag fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Department tag must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DepartmentTag tag : values()) {
            if (tag.label.equals(normalized)) {
                return tag;
            }
        }
        throw new IllegalArgumentException("Malformed department tag: " + value);
    }
}
