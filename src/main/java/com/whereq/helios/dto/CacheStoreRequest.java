package com.whereq.helios.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cache store request
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStoreRequest {
    @NotBlank
    private String inputText;

    @NotNull
    private String response;

    @NotBlank
    private String taskType;

    private String contextPrefix;

    /**
     * Cost units a future hit on this entry avoids
     */
    @Min(0)
    @Builder.Default
    private double costUnits = 1.0;

    private double[] embedding;

    @Builder.Default
    private boolean storeInL1 = true;

    @Builder.Default
    private boolean storeInL2 = true;

    @Builder.Default
    private boolean storeInL3 = true;
}
