package com.agentscan.report;

import com.agentscan.model.DetectionStatus;
import com.agentscan.model.ProbeResult;
import com.agentscan.model.Protocol;
import com.agentscan.model.ReadinessGrade;
import com.agentscan.model.ReadinessScore;
import com.agentscan.model.ScanResult;
import com.agentscan.model.ScanStatus;
import com.agentscan.model.ScanTarget;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ProtocolAdoptionReportTest {

    private static ScanResult scan(String domain, String region, int score, DetectionStatus ucp, DetectionStatus x402) {
        List<ProbeResult> results = new ArrayList<>();
        for (Protocol p : Protocol.values()) {
            ProbeResult r = ProbeResult.notDetected(p);
            if (p == Protocol.UCP) {
                r.setStatus(ucp);
            } else if (p == Protocol.X402) {
                r.setStatus(x402);
            }
            results.add(r);
        }
        return ScanResult.builder()
                .target(ScanTarget.builder().domain(domain).region(region).merchantCategory("retail").build())
                .scanStatus(ScanStatus.COMPLETED)
                .protocolResults(results)
                .score(ReadinessScore.builder().readinessScore(score).build())
                .build();
    }

    @Test
    @DisplayName("counts statuses per protocol over completed scans only")
    void aggregates() {
        List<ScanResult> scans = List.of(
                scan("a.example", "latam", 85, DetectionStatus.CONFIRMED, DetectionStatus.NOT_APPLICABLE),
                scan("b.example", "latam", 45, DetectionStatus.PLATFORM_ENABLED, DetectionStatus.NOT_APPLICABLE),
                scan("c.example", "europe", 20, DetectionStatus.NOT_DETECTED, DetectionStatus.NOT_DETECTED),
                scan("d.example", null, 10, DetectionStatus.ELIGIBLE, DetectionStatus.NOT_APPLICABLE),
                ScanResult.failed(ScanTarget.of("e.example"), "timeout", 3));

        ProtocolAdoptionReport report = ProtocolAdoptionReport.from(scans);

        assertThat(report.getTotalScans()).isEqualTo(5);
        assertThat(report.getCompletedScans()).isEqualTo(4);
        assertThat(report.getFailedScans()).isEqualTo(1);
        // (85 + 45 + 20 + 10) / 4
        assertThat(report.getAverageReadinessScore()).isEqualTo(40);

        ProtocolAdoption ucp = report.adoptionOf(Protocol.UCP);
        assertThat(ucp.count(DetectionStatus.CONFIRMED)).isEqualTo(1);
        assertThat(ucp.count(DetectionStatus.PLATFORM_ENABLED)).isEqualTo(1);
        assertThat(ucp.count(DetectionStatus.ELIGIBLE)).isEqualTo(1);
        assertThat(ucp.count(DetectionStatus.NOT_DETECTED)).isEqualTo(1);
        assertThat(ucp.getDetectedCount()).isEqualTo(3);
        assertThat(ucp.getDetectedShare()).isCloseTo(0.75, within(1e-9));

        ProtocolAdoption x402 = report.adoptionOf(Protocol.X402);
        assertThat(x402.count(DetectionStatus.NOT_APPLICABLE)).isEqualTo(3);
        assertThat(x402.getDetectedCount()).isZero();

        assertThat(report.getGradeDistribution())
                .containsEntry(ReadinessGrade.A, 1)
                .containsEntry(ReadinessGrade.C, 1)
                .containsEntry(ReadinessGrade.D, 1)
                .containsEntry(ReadinessGrade.F, 1)
                .containsEntry(ReadinessGrade.B, 0);

        assertThat(report.getAverageScoreByRegion())
                .containsEntry("latam", 65)
                .containsEntry("europe", 20)
                .containsEntry("unknown", 10);
        assertThat(report.getAverageScoreByCategory()).containsEntry("retail", 40);
        assertThat(report.getProtocols()).hasSize(Protocol.values().length);
    }

    @Test
    void emptyInput() {
        ProtocolAdoptionReport report = ProtocolAdoptionReport.from(List.of());

        assertThat(report.getTotalScans()).isZero();
        assertThat(report.getAverageReadinessScore()).isZero();
        assertThat(report.adoptionOf(Protocol.ACP).getDetectedShare()).isZero();
        assertThat(ProtocolAdoptionReport.from(null).getCompletedScans()).isZero();
    }

    @Test
    void markdownTable() {
        ProtocolAdoptionReport report = ProtocolAdoptionReport.from(List.of(
                scan("a.example", "latam", 85, DetectionStatus.CONFIRMED, DetectionStatus.NOT_APPLICABLE),
                scan("b.example", "latam", 45, DetectionStatus.NOT_DETECTED, DetectionStatus.NOT_APPLICABLE)));

        String md = ScanReportFormatter.adoptionSummary(report);

        assertThat(md).contains("| Universal Commerce Protocol | 1 | 0 | 0 | 1 | 0 | 50.0% |");
        assertThat(md).contains("| x402 | 0 | 0 | 0 | 0 | 2 | 0.0% |");
        assertThat(md).contains("**Average Readiness Score:** 65/100");
        assertThat(md).contains("| latam | 65 |");
    }
}
