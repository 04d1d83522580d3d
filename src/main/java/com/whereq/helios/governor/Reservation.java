package com.whereq.helios.governor;

import com.whereq.helios.model.ModelTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Units provisionally charged to a window at admission, reconciled by recordUsage
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Reservation {
    private String projectId;

    private String taskId;

    private String windowId;

    private ModelTier tier;

    private long units;
}
