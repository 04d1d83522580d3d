package com.whereq.helios.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.helios.config.HeliosProperties;
import com.whereq.helios.dto.ProjectStatus;
import com.whereq.helios.store.SharedStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Persists project status snapshots in the shared state store
 */
@Slf4j
@Service
public class ProjectStatusTracker {

    private static final String STATUS_KEY_PREFIX = "project:";

    private final SharedStateStore store;

    private final ObjectMapper objectMapper;

    private final Duration ttl;

    public ProjectStatusTracker(SharedStateStore store, ObjectMapper objectMapper, HeliosProperties properties) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.ttl = properties.getScheduler().getStatusTtl();
    }

    /**
     * Save a snapshot, replacing the previous one
     *
     * @param status project status
     * @return Mono that completes when saved
     */
    public Mono<Void> save(ProjectStatus status) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(status))
            .flatMap(json -> store.set(STATUS_KEY_PREFIX + status.getProjectId(), json, ttl))
            .doOnSuccess(ok -> log.debug("Project {} status saved: {}/{} completed", status.getProjectId(),
                status.getCompleted(), status.getTotalTasks()))
            .then();
    }

    /**
     * Last saved snapshot
     *
     * @param projectId project identifier
     * @return Mono with the snapshot, empty if none was saved or it expired
     */
    public Mono<ProjectStatus> load(String projectId) {
        return store.get(STATUS_KEY_PREFIX + projectId)
            .flatMap(json -> {
                try {
                    return Mono.just(objectMapper.readValue(json, ProjectStatus.class));
                } catch (JsonProcessingException e) {
                    log.error("Unreadable status snapshot for project {}", projectId, e);
                    return Mono.error(new IllegalStateException("Unreadable status of project " + projectId, e));
                }
            });
    }
}
