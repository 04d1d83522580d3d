package com.whereq.helios.exception;

/**
 * Exception thrown when a project operation conflicts with its current run
 */
public class ProjectConflictException extends RuntimeException {
    public ProjectConflictException(String message) {
        super(message);
    }
}
