package com.whereq.helios.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.whereq.helios.model.CacheLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-tier write confirmation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStoreResult {
    /**
     * Whether at least one tier accepted the entry
     */
    private boolean stored;

    @Builder.Default
    private Map<CacheLevel, Boolean> tiers = new EnumMap<>(CacheLevel.class);

    @JsonIgnore
    public boolean storedIn(CacheLevel level) {
        return Boolean.TRUE.equals(tiers.get(level));
    }
}
