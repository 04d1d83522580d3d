package com.whereq.helios.exception;

/**
 * Thrown when a submitted task graph is malformed
 */
public class InvalidTaskGraphException extends RuntimeException {
    public InvalidTaskGraphException(String message) {
        super(message);
    }
}
