package com.whereq.helios.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-duration accounting period with a hard ceiling on admitted task-units.
 * Closed windows are never modified again.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UsageWindow {
    /**
     * Unique window identifier (timestamp-based)
     */
    private String windowId;

    /**
     * Window start time
     */
    private Instant startTime;

    /**
     * Window end time (start + window duration)
     */
    private Instant endTime;

    /**
     * Hard ceiling on total admitted units
     */
    private long ceiling;

    /**
     * Units consumed or reserved on the high-capability tier
     */
    private long highCapabilityUnits;

    /**
     * Units consumed or reserved on the economical tier
     */
    private long economicalUnits;

    /**
     * Whether the window has been closed by a rollover
     */
    private boolean closed;

    public static UsageWindow open(Instant start, Duration duration, long ceiling) {
        return UsageWindow.builder()
            .windowId("w-" + start.toEpochMilli())
            .startTime(start)
            .endTime(start.plus(duration))
            .ceiling(ceiling)
            .build();
    }

    public long usedUnits() {
        return highCapabilityUnits + economicalUnits;
    }

    public long remainingUnits() {
        return Math.max(0, ceiling - usedUnits());
    }

    public double utilizationPercent() {
        return ceiling > 0 ? (usedUnits() * 100.0) / ceiling : 100.0;
    }

    public long unitsOn(ModelTier tier) {
        return tier == ModelTier.HIGH_CAPABILITY ? highCapabilityUnits : economicalUnits;
    }

    public boolean hasElapsed(Instant now) {
        return !now.isBefore(endTime);
    }

    /**
     * Copy of this window with a tier counter adjusted by {@code delta}, never dropping below zero
     */
    public UsageWindow adjust(ModelTier tier, long delta) {
        if (tier == ModelTier.HIGH_CAPABILITY) {
            return toBuilder().highCapabilityUnits(Math.max(0, highCapabilityUnits + delta)).build();
        }
        return toBuilder().economicalUnits(Math.max(0, economicalUnits + delta)).build();
    }

    public UsageWindow close() {
        return toBuilder().closed(true).build();
    }
}
