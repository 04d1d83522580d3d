package com.whereq.helios.scheduler;

import com.whereq.helios.model.Task;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validated project graph: tasks indexed by id, edges as id lists, waves computed once at planning.
 */
public final class TaskGraph {

    private final String projectId;

    private final Map<String, Task> tasks;

    private final Map<String, List<String>> dependents;

    private final List<List<String>> waves;

    private final Map<String, Integer> waveIndex;

    TaskGraph(String projectId, Map<String, Task> tasks, Map<String, List<String>> dependents,
              List<List<String>> waves, Map<String, Integer> waveIndex) {
        this.projectId = projectId;
        this.tasks = tasks;
        this.dependents = dependents;
        this.waves = waves;
        this.waveIndex = waveIndex;
    }

    public String getProjectId() {
        return projectId;
    }

    public Task task(String taskId) {
        return tasks.get(taskId);
    }

    public Collection<Task> tasks() {
        return tasks.values();
    }

    public int size() {
        return tasks.size();
    }

    public List<List<String>> getWaves() {
        return waves;
    }

    public Map<String, Integer> getWaveIndex() {
        return waveIndex;
    }

    /**
     * Every task that depends on {@code taskId}, directly or transitively, in breadth-first order
     */
    public List<String> transitiveDependents(String taskId) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> frontier = new ArrayDeque<>(dependents.getOrDefault(taskId, List.of()));
        while (!frontier.isEmpty()) {
            String next = frontier.poll();
            if (seen.add(next)) {
                frontier.addAll(dependents.getOrDefault(next, List.of()));
            }
        }
        return new ArrayList<>(seen);
    }
}
