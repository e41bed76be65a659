package com.agentscan.report;

import com.agentscan.model.DetectionStatus;
import com.agentscan.model.Protocol;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Status counts of one protocol across a set of completed scans.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProtocolAdoption {
    private Protocol protocol;
    private Map<DetectionStatus, Integer> statusCounts;
    private int detectedCount;
    /** detected / completed scans, 0 when there are none */
    private double detectedShare;

    public int count(DetectionStatus status) {
        return statusCounts == null ? 0 : statusCounts.getOrDefault(status, 0);
    }
}
