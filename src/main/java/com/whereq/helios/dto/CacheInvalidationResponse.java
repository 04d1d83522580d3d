package com.whereq.helios.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheInvalidationResponse {
    /**
     * Task type invalidated, {@code null} for a global flush
     */
    private String taskType;

    private long removed;
}
