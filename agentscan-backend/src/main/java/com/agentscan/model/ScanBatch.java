package com.agentscan.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

/**
 * Point-in-time view of a batch scan's progress.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ScanBatch {
    private String batchId;
    private String name;
    private BatchStatus status;
    private int concurrency;
    private int totalTargets;
    private int completedTargets;
    private int failedTargets;
    private OffsetDateTime createdAt;
    private OffsetDateTime startedAt;
    private OffsetDateTime completedAt;

    public int getPendingTargets() {
        return Math.max(0, totalTargets - completedTargets - failedTargets);
    }
}
