package com.whereq.helios.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Project submission: tasks plus their dependency edges
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskGraphRequest {
    @NotBlank
    private String projectId;

    @NotEmpty
    @Valid
    @Builder.Default
    private List<TaskSpec> tasks = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TaskSpec {
        @NotBlank
        private String taskId;

        private String name;

        /**
         * Agent/executor type; doubles as the cache task type
         */
        @NotBlank
        private String agentType;

        private String input;

        private String contextPrefix;

        @Min(1)
        @Builder.Default
        private long estimatedUnits = 1;

        @Min(0)
        @Max(10)
        @Builder.Default
        private int priority = 5;

        private boolean requiresHighCapability;

        @Builder.Default
        private List<String> dependsOn = new ArrayList<>();

        private Instant deadline;
    }
}
