package com.example.records.enums;

import java.util.Locale;
import java.util.Optional;

public enum UserRole {
    ADMIN,
    STAFF,
    PRINCIPAL,
    STUDENT,
    GUEST;

    /**
     * Case-insensitive lookup; the stored form of a role is always upper case.
     */
    public static Optional<UserRole> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        try {
            return Optional.of(UserRole.valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
