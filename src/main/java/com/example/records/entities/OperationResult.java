package com.example.records.entities;

import com.example.records.enums.ErrorKind;
import com.example.records.exceptions.RecordsException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Outcome of a service call: a success flag, a message fit for showing to the
 * user and, for successful queries, a value.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OperationResult<T> {
    boolean success;
    ErrorKind errorKind;
    String message;
    T value;

    public static <T> OperationResult<T> ok(String message) {
        return new OperationResult<>(true, null, message, null);
    }

    public static <T> OperationResult<T> ok(T value, String message) {
        return new OperationResult<>(true, null, message, value);
    }

    public static <T> OperationResult<T> failure(ErrorKind kind, String message) {
        return new OperationResult<>(false, kind, message, null);
    }

    public static <T> OperationResult<T> failure(RecordsException ex) {
        return failure(ex.getKind(), ex.getMessage());
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }
}
