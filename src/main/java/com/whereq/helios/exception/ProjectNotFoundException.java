package com.whereq.helios.exception;

/**
 * Exception thrown when a project is not known to this scheduler
 */
public class ProjectNotFoundException extends RuntimeException {
    public ProjectNotFoundException(String projectId) {
        super("Project not found: " + projectId);
    }
}
