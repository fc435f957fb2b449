package com.e2eq.dats.exceptions;

/**
 * Base type for structural failures while building, serializing or loading a DATS graph.
 * These are never recovered locally; they abort the current run.
 */
public class DatsGraphException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public DatsGraphException(String message) {
        super(message);
    }

    public DatsGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
