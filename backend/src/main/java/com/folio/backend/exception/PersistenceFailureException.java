package com.folio.backend.exception;

public class PersistenceFailureException extends RuntimeException {
    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
