package com.example.records.enums;

/**
 * Failure categories reported by the stores and services.
 *
 * MALFORMED_LINE never reaches a caller: undecodable lines are skipped on load.
 * INVALID_RANGE is reserved; range searches with crossed bounds just return nothing.
 */
public enum ErrorKind {
    IO_ERROR,
    MALFORMED_LINE,
    NOT_FOUND,
    DUPLICATE_ID,
    INVALID_INPUT,
    INVALID_RANGE,
    EMPTY_STORE,
    INVALID_CREDENTIALS,
    PERMISSION_DENIED,
    CANCELLED
}
