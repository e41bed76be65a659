package com.agentscan.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Assessment of one domain: the enriched and filtered probe results, the business model and the
 * readiness score, plus scan bookkeeping.
 *
 * <p>A failed scan still carries one {@code not_detected}, low-confidence result per protocol so that
 * it stays distinguishable from a domain that was never scanned.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(value = "domain", allowGetters = true)
public class ScanResult {
    private ScanTarget target;
    private ScanStatus scanStatus;
    private String errorMessage;
    private List<ProbeResult> protocolResults;
    private BusinessModel businessModel;
    private ReadinessScore score;
    private AccessibilitySignals accessibility;
    private StructuredDataSignals structuredData;
    private Long scanDurationMs;
    private OffsetDateTime scannedAt;

    /**
     * Builds the record of a domain whose pipeline could not run.
     *
     * @param target scanned target
     * @param errorMessage failure description
     * @param durationMs elapsed time
     * @return failed scan result
     */
    public static ScanResult failed(ScanTarget target, String errorMessage, long durationMs) {
        List<ProbeResult> defaults = new ArrayList<>();
        for (Protocol p : Protocol.values()) {
            defaults.add(ProbeResult.notDetected(p));
        }
        return ScanResult.builder()
                .target(target)
                .scanStatus(ScanStatus.FAILED)
                .errorMessage(errorMessage)
                .protocolResults(defaults)
                .businessModel(BusinessModel.RETAIL)
                .score(ReadinessScore.zero())
                .accessibility(AccessibilitySignals.absent())
                .structuredData(StructuredDataSignals.absent())
                .scanDurationMs(durationMs)
                .scannedAt(OffsetDateTime.now())
                .build();
    }

    public String getDomain() {
        return target != null ? target.getDomain() : null;
    }

    public ProbeResult findResult(Protocol protocol) {
        if (protocolResults == null) {
            return null;
        }
        return protocolResults.stream()
                .filter(r -> r.getProtocol() == protocol)
                .findFirst()
                .orElse(null);
    }
}
