package com.whereq.helios.executor;

import com.whereq.helios.model.ModelTier;
import com.whereq.helios.model.Task;

/**
 * Boundary to the model backend that actually runs a task
 */
public interface TaskExecutor {
    /**
     * Execute a task synchronously (blocking)
     *
     * @param task the task
     * @param tier tier granted by the governor
     * @return execution result; {@code success == false} is retried like a thrown exception
     * @throws Exception if execution fails
     */
    TaskExecutionResult execute(Task task, ModelTier tier) throws Exception;
}
