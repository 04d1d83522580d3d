package com.whereq.helios.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cache lookup request
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheLookupRequest {
    @NotBlank
    private String inputText;

    @NotBlank
    private String taskType;

    /**
     * Reusable context prefix, consulted by the context tier when long enough
     */
    private String contextPrefix;

    /**
     * Precomputed input embedding; computed by the embedding provider when absent
     */
    private double[] embedding;

    /**
     * Per-request override of the semantic similarity threshold
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double similarityThreshold;

    @Builder.Default
    private boolean useL1 = true;

    @Builder.Default
    private boolean useL2 = true;

    @Builder.Default
    private boolean useL3 = true;
}
