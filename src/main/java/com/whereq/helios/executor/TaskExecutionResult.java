package com.whereq.helios.executor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of one execution attempt
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskExecutionResult {
    /**
     * Response produced by the backend
     */
    private String result;

    /**
     * Units actually consumed, reconciled against the reservation
     */
    private long actualUnits;

    private boolean success;

    private String errorMessage;

    public static TaskExecutionResult success(String result, long actualUnits) {
        return TaskExecutionResult.builder().result(result).actualUnits(actualUnits).success(true).build();
    }

    public static TaskExecutionResult failure(String errorMessage, long actualUnits) {
        return TaskExecutionResult.builder().errorMessage(errorMessage).actualUnits(actualUnits).success(false).build();
    }
}
