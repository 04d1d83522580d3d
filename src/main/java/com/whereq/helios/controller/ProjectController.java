package com.whereq.helios.controller;

import com.whereq.helios.dto.ErrorResponse;
import com.whereq.helios.dto.TaskGraphRequest;
import com.whereq.helios.exception.CyclicDependencyException;
import com.whereq.helios.exception.InvalidTaskGraphException;
import com.whereq.helios.exception.ProjectConflictException;
import com.whereq.helios.exception.ProjectNotFoundException;
import com.whereq.helios.scheduler.HybridScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * Controller for project scheduling and execution
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/helios/projects")
@Tag(name = "Projects", description = "Task graph scheduling and execution")
public class ProjectController {

    @Autowired
    private HybridScheduler scheduler;

    /**
     * Schedule a project
     *
     * @param request task graph
     * @return Mono with 201 Created and the execution plan
     */
    @PostMapping
    @Operation(summary = "Schedule project", description = "Validate the task graph and compute its execution waves")
    public Mono<ResponseEntity<?>> schedule(@Valid @RequestBody TaskGraphRequest request) {
        log.info("Received project {} with {} tasks", request.getProjectId(), request.getTasks().size());

        return scheduler.scheduleProject(request)
            .<ResponseEntity<?>>map(plan -> ResponseEntity
                .created(URI.create("/api/v1/helios/projects/" + plan.getProjectId()))
                .body(plan))
            .onErrorResume(CyclicDependencyException.class, e -> {
                log.warn("Rejected cyclic project {}: {}", request.getProjectId(), e.getMessage());
                return Mono.just(ResponseEntity.badRequest().body(error("CyclicDependency", e)));
            })
            .onErrorResume(InvalidTaskGraphException.class, e -> {
                log.warn("Rejected project {}: {}", request.getProjectId(), e.getMessage());
                return Mono.just(ResponseEntity.badRequest().body(error("InvalidTaskGraph", e)));
            })
            .onErrorResume(ProjectConflictException.class, e ->
                Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).body(error("ProjectConflict", e))));
    }

    /**
     * Execute a scheduled project; responds once every task is terminal
     */
    @PostMapping("/{projectId}/execute")
    @Operation(summary = "Execute project", description = "Run the project to completion and return its statistics")
    public Mono<ResponseEntity<?>> execute(@PathVariable String projectId) {
        log.info("Execute request for project {}", projectId);
        return scheduler.executeProject(projectId)
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .onErrorResume(ProjectNotFoundException.class, e ->
                Mono.just(ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("ProjectNotFound", e))))
            .onErrorResume(ProjectConflictException.class, e ->
                Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).body(error("ProjectConflict", e))));
    }

    @GetMapping("/{projectId}")
    @Operation(summary = "Project status", description = "Task counts per status, completion and success rates")
    public Mono<ResponseEntity<?>> status(@PathVariable String projectId) {
        return scheduler.getProjectStatus(projectId)
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .onErrorResume(ProjectNotFoundException.class, e ->
                Mono.just(ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("ProjectNotFound", e))));
    }

    @GetMapping("/{projectId}/tasks")
    @Operation(summary = "Project tasks", description = "Every task of the project with its current state")
    public Mono<ResponseEntity<?>> tasks(@PathVariable String projectId) {
        return scheduler.getTasks(projectId)
            .collectList()
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .onErrorResume(ProjectNotFoundException.class, e ->
                Mono.just(ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("ProjectNotFound", e))));
    }

    /**
     * Cancel a project
     */
    @DeleteMapping("/{projectId}")
    @Operation(summary = "Cancel project", description = "Cancel every task that has not finished yet")
    public Mono<ResponseEntity<?>> cancel(@PathVariable String projectId) {
        log.info("Cancellation request for project {}", projectId);
        return scheduler.cancelProject(projectId)
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .onErrorResume(ProjectNotFoundException.class, e ->
                Mono.just(ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("ProjectNotFound", e))));
    }

    private static ErrorResponse error(String type, Exception e) {
        return ErrorResponse.builder().error(type).message(e.getMessage()).build();
    }
}
