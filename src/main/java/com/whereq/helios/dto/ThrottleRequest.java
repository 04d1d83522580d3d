package com.whereq.helios.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Manual throttle control
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThrottleRequest {
    @NotNull
    private Action action;

    @Builder.Default
    private String reason = "Manual override";

    public enum Action {
        ACTIVATE,
        CLEAR
    }
}
