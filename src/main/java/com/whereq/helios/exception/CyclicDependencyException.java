package com.whereq.helios.exception;

import java.util.List;

/**
 * Thrown when a submitted task graph contains a dependency cycle
 */
public class CyclicDependencyException extends InvalidTaskGraphException {

    private final List<String> unresolvedTasks;

    public CyclicDependencyException(String projectId, List<String> unresolvedTasks) {
        super("Project " + projectId + " has a dependency cycle among tasks " + unresolvedTasks);
        this.unresolvedTasks = List.copyOf(unresolvedTasks);
    }

    /**
     * Tasks that could not be ordered, the cycle members and whatever depends on them
     */
    public List<String> getUnresolvedTasks() {
        return unresolvedTasks;
    }
}
