package com.example.records.enums;

/**
 * Operations guarded by {@link com.example.records.service.AccessPolicy}.
 */
public enum Permission {
    ADD_STUDENT,
    UPDATE_STUDENT,
    DELETE_STUDENT,
    DELETE_ALL,
    PERSIST_SORT,
    VIEW_STATISTICS,
    VIEW_OWN_RECORD,
    MAINTENANCE,
    TOGGLE_OBFUSCATION,
    MANAGE_CREDENTIALS
}
