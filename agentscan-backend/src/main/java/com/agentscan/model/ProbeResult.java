package com.agentscan.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one protocol probe on one domain.
 *
 * <p>Absent fields read as their conservative default: status {@code not_detected}, confidence
 * {@code low}, no capabilities, no eligibility signals. {@code eligibility_signals} is append-only;
 * the pipeline copies a result before changing it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(value = "detected", allowGetters = true)
public class ProbeResult {
    private Protocol protocol;
    private DetectionStatus status;
    private Confidence confidence;
    private String detectionMethod;
    private String endpointUrl;
    private Map<String, Object> capabilities;
    private Boolean isFunctional;
    private Integer responseTimeMs;
    private List<String> eligibilitySignals;

    /**
     * Result used whenever a probe cannot give an answer (missing, failed or timed out).
     *
     * @param protocol probed protocol
     * @return a {@code not_detected}, low-confidence result
     */
    public static ProbeResult notDetected(Protocol protocol) {
        return ProbeResult.builder()
                .protocol(protocol)
                .status(DetectionStatus.NOT_DETECTED)
                .confidence(Confidence.LOW)
                .build();
    }

    public DetectionStatus getStatus() {
        return status != null ? status : DetectionStatus.NOT_DETECTED;
    }

    public Confidence getConfidence() {
        return confidence != null ? confidence : Confidence.LOW;
    }

    public Map<String, Object> getCapabilities() {
        return capabilities != null ? capabilities : Map.of();
    }

    public List<String> getEligibilitySignals() {
        return eligibilitySignals != null ? eligibilitySignals : List.of();
    }

    @JsonProperty("detected")
    public boolean isDetected() {
        return getStatus().isDetected();
    }

    /**
     * Detected and reported working by the probe. Only these results earn protocol points.
     */
    @JsonIgnore
    public boolean isDetectedAndFunctional() {
        return isDetected() && Boolean.TRUE.equals(isFunctional);
    }

    /**
     * Returns a deep-enough copy: collections are new, so appending to the copy never touches this
     * instance.
     */
    public ProbeResult copy() {
        return toBuilder()
                .capabilities(new LinkedHashMap<>(getCapabilities()))
                .eligibilitySignals(new ArrayList<>(getEligibilitySignals()))
                .build();
    }

    /**
     * Returns a copy with {@code status} replaced and {@code signal} appended.
     */
    public ProbeResult withStatus(DetectionStatus newStatus, String signal) {
        ProbeResult out = copy();
        out.setStatus(newStatus);
        if (signal != null && !signal.isBlank()) {
            out.getEligibilitySignals().add(signal);
        }
        return out;
    }
}
