package com.example.records.exceptions;

import com.example.records.enums.ErrorKind;
import lombok.Getter;

/**
 * Raised by the stores and the access policy. Services catch it at their
 * boundary and report it as a failed {@link com.example.records.entities.OperationResult}.
 */
@Getter
public class RecordsException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public RecordsException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RecordsException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
