package com.example.statements.service;

/**
 * The invoice snapshot a job or report refers to cannot be loaded.
 */
public class SnapshotUnavailableException extends RuntimeException {

    public SnapshotUnavailableException(String message) {
        super(message);
    }

    public SnapshotUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
