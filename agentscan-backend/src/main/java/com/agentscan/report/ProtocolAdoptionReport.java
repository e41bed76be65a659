package com.agentscan.report;

import com.agentscan.model.DetectionStatus;
import com.agentscan.model.ProbeResult;
import com.agentscan.model.Protocol;
import com.agentscan.model.ReadinessGrade;
import com.agentscan.model.ScanResult;
import com.agentscan.model.ScanStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate view over a set of scan results: protocol adoption, score averages and grade distribution.
 *
 * <p>Only completed scans are aggregated; failed scans are counted but otherwise ignored.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProtocolAdoptionReport {
    private static final String UNKNOWN = "unknown";

    private int totalScans;
    private int completedScans;
    private int failedScans;
    private int averageReadinessScore;
    private Map<ReadinessGrade, Integer> gradeDistribution;
    private List<ProtocolAdoption> protocols;
    private Map<String, Integer> averageScoreByRegion;
    private Map<String, Integer> averageScoreByCategory;

    public static ProtocolAdoptionReport from(Collection<ScanResult> results) {
        List<ScanResult> completed = new ArrayList<>();
        int failed = 0;
        if (results != null) {
            for (ScanResult r : results) {
                if (r == null) {
                    continue;
                }
                if (r.getScanStatus() == ScanStatus.COMPLETED) {
                    completed.add(r);
                } else {
                    failed++;
                }
            }
        }

        Map<ReadinessGrade, Integer> grades = new EnumMap<>(ReadinessGrade.class);
        for (ReadinessGrade g : ReadinessGrade.values()) {
            grades.put(g, 0);
        }
        Map<String, int[]> byRegion = new TreeMap<>();
        Map<String, int[]> byCategory = new TreeMap<>();
        long scoreSum = 0;
        for (ScanResult r : completed) {
            int score = r.getScore() != null ? r.getScore().getReadinessScore() : 0;
            scoreSum += score;
            grades.merge(ReadinessGrade.of(score), 1, Integer::sum);
            String region = r.getTarget() != null ? r.getTarget().getRegion() : null;
            String category = r.getTarget() != null ? r.getTarget().getMerchantCategory() : null;
            accumulate(byRegion, region, score);
            accumulate(byCategory, category, score);
        }

        List<ProtocolAdoption> protocols = new ArrayList<>();
        for (Protocol protocol : Protocol.values()) {
            protocols.add(adoptionOf(protocol, completed));
        }

        return ProtocolAdoptionReport.builder()
                .totalScans(completed.size() + failed)
                .completedScans(completed.size())
                .failedScans(failed)
                .averageReadinessScore(completed.isEmpty() ? 0 : (int) Math.round((double) scoreSum / completed.size()))
                .gradeDistribution(grades)
                .protocols(protocols)
                .averageScoreByRegion(averages(byRegion))
                .averageScoreByCategory(averages(byCategory))
                .build();
    }

    public ProtocolAdoption adoptionOf(Protocol protocol) {
        if (protocols == null) {
            return null;
        }
        return protocols.stream().filter(p -> p.getProtocol() == protocol).findFirst().orElse(null);
    }

    private static ProtocolAdoption adoptionOf(Protocol protocol, List<ScanResult> completed) {
        Map<DetectionStatus, Integer> counts = new EnumMap<>(DetectionStatus.class);
        for (DetectionStatus s : DetectionStatus.values()) {
            counts.put(s, 0);
        }
        int detected = 0;
        for (ScanResult r : completed) {
            ProbeResult pr = r.findResult(protocol);
            DetectionStatus status = pr != null ? pr.getStatus() : DetectionStatus.NOT_DETECTED;
            counts.merge(status, 1, Integer::sum);
            if (status.isDetected()) {
                detected++;
            }
        }
        return ProtocolAdoption.builder()
                .protocol(protocol)
                .statusCounts(counts)
                .detectedCount(detected)
                .detectedShare(completed.isEmpty() ? 0.0 : (double) detected / completed.size())
                .build();
    }

    private static void accumulate(Map<String, int[]> acc, String key, int score) {
        String k = key == null || key.isBlank() ? UNKNOWN : key.trim();
        int[] sumAndCount = acc.computeIfAbsent(k, x -> new int[2]);
        sumAndCount[0] += score;
        sumAndCount[1]++;
    }

    private static Map<String, Integer> averages(Map<String, int[]> acc) {
        Map<String, Integer> out = new TreeMap<>();
        acc.forEach((k, v) -> out.put(k, (int) Math.round((double) v[0] / v[1])));
        return out;
    }
}
