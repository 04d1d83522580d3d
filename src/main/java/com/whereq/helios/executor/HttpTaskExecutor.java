package com.whereq.helios.executor;

import com.whereq.helios.config.HeliosProperties;
import com.whereq.helios.model.ModelTier;
import com.whereq.helios.model.Task;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Executes tasks by POSTing them to the agent gateway
 */
@Slf4j
@Component
public class HttpTaskExecutor implements TaskExecutor {

    private final WebClient webClient;

    private final String endpoint;

    private final Duration timeout;

    public HttpTaskExecutor(WebClient.Builder webClientBuilder, HeliosProperties properties) {
        this.webClient = webClientBuilder.build();
        this.endpoint = properties.getExecutor().getEndpoint();
        this.timeout = properties.getExecutor().getTimeout();
    }

    @Override
    public TaskExecutionResult execute(Task task, ModelTier tier) {
        log.info("Dispatching task {} ({}) to {} on {}", task.getTaskId(), task.getAgentType(), endpoint, tier);

        TaskExecutionResult result = webClient.post()
            .uri(endpoint)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(buildPayload(task, tier))
            .retrieve()
            .bodyToMono(TaskExecutionResult.class)
            .timeout(timeout)
            .block();

        if (result == null) {
            throw new IllegalStateException("Empty response from agent gateway for task " + task.getTaskId());
        }
        return result;
    }

    private Map<String, Object> buildPayload(Task task, ModelTier tier) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("taskId", task.getTaskId());
        payload.put("projectId", task.getProjectId());
        payload.put("agentType", task.getAgentType());
        payload.put("tier", tier.name());
        payload.put("input", task.getInput());
        payload.put("estimatedUnits", task.getEstimatedUnits());
        payload.put("attempt", task.getRetryCount() + 1);
        if (task.getContextPrefix() != null) {
            payload.put("contextPrefix", task.getContextPrefix());
        }
        return payload;
    }
}
