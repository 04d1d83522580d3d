package com.whereq.helios.scheduler;

import com.whereq.helios.config.HeliosProperties;
import com.whereq.helios.dto.TaskGraphRequest;
import com.whereq.helios.exception.CyclicDependencyException;
import com.whereq.helios.exception.InvalidTaskGraphException;
import com.whereq.helios.model.Task;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates a submitted task graph and splits it into waves with Kahn's algorithm.
 * Nothing is created for a graph that fails validation.
 */
@Component
public class TaskGraphPlanner {

    private final Clock clock;

    private final int maxRetries;

    public TaskGraphPlanner(Clock clock, HeliosProperties properties) {
        this.clock = clock;
        this.maxRetries = properties.getScheduler().getMaxRetries();
    }

    public TaskGraph plan(TaskGraphRequest request) {
        String projectId = request.getProjectId();
        if (projectId == null || projectId.isBlank()) {
            throw new InvalidTaskGraphException("Project id is required");
        }
        if (request.getTasks() == null || request.getTasks().isEmpty()) {
            throw new InvalidTaskGraphException("Project " + projectId + " has no tasks");
        }

        Map<String, TaskGraphRequest.TaskSpec> specs = new LinkedHashMap<>();
        for (TaskGraphRequest.TaskSpec spec : request.getTasks()) {
            if (spec.getTaskId() == null || spec.getTaskId().isBlank()) {
                throw new InvalidTaskGraphException("Project " + projectId + " has a task without id");
            }
            if (specs.putIfAbsent(spec.getTaskId(), spec) != null) {
                throw new InvalidTaskGraphException("Duplicate task id " + spec.getTaskId());
            }
        }

        Map<String, Set<String>> dependencies = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (TaskGraphRequest.TaskSpec spec : specs.values()) {
            Set<String> deps = new LinkedHashSet<>(spec.getDependsOn() == null ? List.of() : spec.getDependsOn());
            for (String dep : deps) {
                if (dep.equals(spec.getTaskId())) {
                    throw new InvalidTaskGraphException("Task " + dep + " depends on itself");
                }
                if (!specs.containsKey(dep)) {
                    throw new InvalidTaskGraphException("Task " + spec.getTaskId() + " depends on unknown task " + dep);
                }
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(spec.getTaskId());
            }
            dependencies.put(spec.getTaskId(), deps);
        }

        Map<String, Task> tasks = new LinkedHashMap<>();
        specs.values().forEach(spec -> tasks.put(spec.getTaskId(), toTask(projectId, spec, dependencies.get(spec.getTaskId()))));

        Instant now = clock.instant();
        Comparator<String> byPriority = Comparator
            .comparingDouble((String id) -> tasks.get(id).priorityScore(now)).reversed()
            .thenComparing(Comparator.naturalOrder());

        Map<String, Integer> remaining = new HashMap<>();
        List<String> current = new ArrayList<>();
        dependencies.forEach((id, deps) -> {
            remaining.put(id, deps.size());
            if (deps.isEmpty()) {
                current.add(id);
            }
        });

        List<List<String>> waves = new ArrayList<>();
        Map<String, Integer> waveIndex = new LinkedHashMap<>();
        while (!current.isEmpty()) {
            current.sort(byPriority);
            int index = waves.size();
            current.forEach(id -> waveIndex.put(id, index));
            waves.add(Collections.unmodifiableList(new ArrayList<>(current)));

            List<String> next = new ArrayList<>();
            for (String id : current) {
                for (String dependent : dependents.getOrDefault(id, List.of())) {
                    if (remaining.merge(dependent, -1, Integer::sum) == 0) {
                        next.add(dependent);
                    }
                }
            }
            current.clear();
            current.addAll(next);
        }

        if (waveIndex.size() < tasks.size()) {
            List<String> unresolved = new ArrayList<>(tasks.keySet());
            unresolved.removeAll(waveIndex.keySet());
            throw new CyclicDependencyException(projectId, unresolved);
        }

        return new TaskGraph(projectId, tasks, dependents, Collections.unmodifiableList(waves), waveIndex);
    }

    private Task toTask(String projectId, TaskGraphRequest.TaskSpec spec, Set<String> dependsOn) {
        return Task.builder()
            .taskId(spec.getTaskId())
            .projectId(projectId)
            .name(spec.getName() != null ? spec.getName() : spec.getTaskId())
            .agentType(spec.getAgentType() != null ? spec.getAgentType() : "general")
            .input(spec.getInput())
            .contextPrefix(spec.getContextPrefix())
            .estimatedUnits(Math.max(1, spec.getEstimatedUnits()))
            .priority(spec.getPriority())
            .requiresHighCapability(spec.isRequiresHighCapability())
            .dependsOn(new ArrayList<>(dependsOn))
            .deadline(spec.getDeadline())
            .maxRetries(maxRetries)
            .build();
    }
}
