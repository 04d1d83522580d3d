package com.whereq.helios.dto;

import com.whereq.helios.model.ModelTier;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Actual consumption reported after a task ran
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageRecordRequest {
    /**
     * Project the task was admitted for; omit for standalone tasks
     */
    private String projectId;

    @NotBlank
    private String taskId;

    @NotNull
    private ModelTier tier;

    @Min(0)
    private long actualUnits;
}
