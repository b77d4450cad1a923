package com.example.records.enums;

/**
 * Fixed subjects of a record, in the order their marks are stored.
 */
public enum Subject {
    MATH("Math"),
    SCIENCE("Science"),
    ENGLISH("English");

    public static final double MAX_MARK = 100.0;

    private final String displayName;

    Subject(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static int count() {
        return values().length;
    }
}
