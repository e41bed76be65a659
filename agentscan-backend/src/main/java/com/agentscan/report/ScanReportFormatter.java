package com.agentscan.report;

import com.agentscan.model.AccessibilitySignals;
import com.agentscan.model.DetectionStatus;
import com.agentscan.model.ProbeResult;
import com.agentscan.model.ReadinessGrade;
import com.agentscan.model.ReadinessScore;
import com.agentscan.model.ScanResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders scan results as human-readable Markdown.
 */
public final class ScanReportFormatter {

    private ScanReportFormatter() {
    }

    /**
     * Returns the display label of a probe result. Eligible and platform-enabled labels carry the first
     * eligibility signal in parentheses when one exists.
     *
     * @param result probe result
     * @return status label
     */
    public static String statusLabel(ProbeResult result) {
        if (result == null) {
            return "Not Detected";
        }
        switch (result.getStatus()) {
            case CONFIRMED:
                return Boolean.TRUE.equals(result.getIsFunctional()) ? "Confirmed (Functional)" : "Confirmed";
            case ELIGIBLE:
                return withFirstSignal("Eligible", result);
            case PLATFORM_ENABLED:
                return withFirstSignal("Platform-Enabled", result);
            case NOT_APPLICABLE:
                return "N/A (not applicable to business model)";
            case NOT_DETECTED:
            default:
                return "Not Detected";
        }
    }

    /**
     * Markdown summary of one domain's scan.
     *
     * @param result scan result
     * @return markdown text
     */
    public static String scanSummary(ScanResult result) {
        ReadinessScore score = result.getScore() != null ? result.getScore() : ReadinessScore.zero();
        List<String> lines = new ArrayList<>();
        lines.add("## Scan Results: " + result.getDomain());
        lines.add("**Readiness Score:** " + score.getReadinessScore() + "/100 (Grade " + score.getGrade() + ")");
        lines.add("**Status:** " + (result.getScanStatus() != null ? result.getScanStatus().getWireName() : "unknown"));
        if (result.getErrorMessage() != null) {
            lines.add("**Error:** " + result.getErrorMessage());
        }
        if (result.getScanDurationMs() != null) {
            lines.add("**Duration:** " + result.getScanDurationMs() + "ms");
        }
        if (result.getBusinessModel() != null) {
            lines.add("**Business Model:** " + result.getBusinessModel().getWireName());
        }
        lines.add("");
        lines.add("### Scores");
        lines.add("- Protocol: " + score.getProtocolScore() + "/100");
        lines.add("- Data: " + score.getDataScore() + "/100");
        lines.add("- Accessibility: " + score.getAccessibilityScore() + "/100");
        lines.add("- Checkout: " + score.getCheckoutScore() + "/100");

        if (result.getProtocolResults() != null && !result.getProtocolResults().isEmpty()) {
            lines.add("");
            lines.add("### Protocol Detection");
            for (ProbeResult p : result.getProtocolResults()) {
                String endpoint = p.getEndpointUrl() != null ? " (" + p.getEndpointUrl() + ")" : "";
                lines.add("- **" + p.getProtocol().getDisplayName() + "**: " + statusLabel(p) + endpoint);
            }
        }

        AccessibilitySignals acc = result.getAccessibility();
        if (acc != null) {
            lines.add("");
            lines.add("### Accessibility");
            if (acc.getEcommercePlatform() != null) {
                lines.add("- Platform: " + acc.getEcommercePlatform());
            }
            lines.add("- CAPTCHA: " + yesNo(acc.isHasCaptcha()));
            lines.add("- Guest Checkout: " + yesNo(acc.isGuestCheckoutAvailable()));
            if (!acc.getPaymentProcessors().isEmpty()) {
                lines.add("- Payment Processors: " + String.join(", ", acc.getPaymentProcessors()));
            }
            lines.add("- Blocks GPTBot: " + yesNo(acc.isRobotsBlocksGptbot()));
            lines.add("- Blocks ClaudeBot: " + yesNo(acc.isRobotsBlocksClaudebot()));
        }
        return String.join("\n", lines);
    }

    /**
     * Markdown rendering of an adoption report.
     *
     * @param report adoption report
     * @return markdown text
     */
    public static String adoptionSummary(ProtocolAdoptionReport report) {
        List<String> lines = new ArrayList<>();
        lines.add("## Protocol Adoption");
        lines.add("");
        lines.add("**Scans:** " + report.getTotalScans()
                + " (completed " + report.getCompletedScans() + ", failed " + report.getFailedScans() + ")");
        lines.add("**Average Readiness Score:** " + report.getAverageReadinessScore() + "/100");
        lines.add("");
        lines.add("| Protocol | Confirmed | Platform Enabled | Eligible | Not Detected | N/A | Detected |");
        lines.add("|----------|-----------|------------------|----------|--------------|-----|----------|");
        for (ProtocolAdoption a : report.getProtocols()) {
            lines.add("| " + a.getProtocol().getDisplayName()
                    + " | " + a.count(DetectionStatus.CONFIRMED)
                    + " | " + a.count(DetectionStatus.PLATFORM_ENABLED)
                    + " | " + a.count(DetectionStatus.ELIGIBLE)
                    + " | " + a.count(DetectionStatus.NOT_DETECTED)
                    + " | " + a.count(DetectionStatus.NOT_APPLICABLE)
                    + " | " + percent(a.getDetectedShare()) + " |");
        }
        lines.add("");
        lines.add("### Grade Distribution");
        lines.add("");
        lines.add("| Grade | Merchants |");
        lines.add("|-------|-----------|");
        for (Map.Entry<ReadinessGrade, Integer> e : report.getGradeDistribution().entrySet()) {
            lines.add("| " + e.getKey() + " | " + e.getValue() + " |");
        }
        appendAverages(lines, "Region", report.getAverageScoreByRegion());
        appendAverages(lines, "Category", report.getAverageScoreByCategory());
        return String.join("\n", lines);
    }

    private static void appendAverages(List<String> lines, String title, Map<String, Integer> averages) {
        if (averages == null || averages.isEmpty()) {
            return;
        }
        lines.add("");
        lines.add("### Average Score by " + title);
        lines.add("");
        lines.add("| " + title + " | Avg Score |");
        lines.add("|---|---|");
        averages.forEach((k, v) -> lines.add("| " + k + " | " + v + " |"));
    }

    private static String withFirstSignal(String label, ProbeResult result) {
        List<String> signals = result.getEligibilitySignals();
        return signals.isEmpty() ? label : label + " (" + signals.get(0) + ")";
    }

    private static String percent(double share) {
        return String.format(Locale.ROOT, "%.1f%%", share * 100.0);
    }

    private static String yesNo(boolean v) {
        return v ? "Yes" : "No";
    }
}
