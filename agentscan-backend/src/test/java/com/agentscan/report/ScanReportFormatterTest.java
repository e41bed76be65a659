package com.agentscan.report;

import com.agentscan.model.AccessibilitySignals;
import com.agentscan.model.BusinessModel;
import com.agentscan.model.DetectionStatus;
import com.agentscan.model.ProbeResult;
import com.agentscan.model.Protocol;
import com.agentscan.model.ReadinessScore;
import com.agentscan.model.ScanResult;
import com.agentscan.model.ScanStatus;
import com.agentscan.model.ScanTarget;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ScanReportFormatterTest {

    @Nested
    @DisplayName("status labels")
    class Labels {

        @Test
        void confirmed() {
            ProbeResult functional = ProbeResult.builder()
                    .protocol(Protocol.UCP).status(DetectionStatus.CONFIRMED).isFunctional(true).build();
            ProbeResult plain = ProbeResult.builder()
                    .protocol(Protocol.UCP).status(DetectionStatus.CONFIRMED).build();

            assertThat(ScanReportFormatter.statusLabel(functional)).isEqualTo("Confirmed (Functional)");
            assertThat(ScanReportFormatter.statusLabel(plain)).isEqualTo("Confirmed");
        }

        @Test
        @DisplayName("eligible and platform-enabled show the first signal")
        void withSignal() {
            ProbeResult eligible = ProbeResult.notDetected(Protocol.ACP)
                    .withStatus(DetectionStatus.ELIGIBLE, "Stripe.js detected — can adopt ACP via Stripe")
                    .withStatus(DetectionStatus.PLATFORM_ENABLED, "Shopify platform supports ACP integration");

            assertThat(ScanReportFormatter.statusLabel(eligible))
                    .isEqualTo("Platform-Enabled (Stripe.js detected — can adopt ACP via Stripe)");
            assertThat(ScanReportFormatter.statusLabel(ProbeResult.builder()
                    .protocol(Protocol.AP2).status(DetectionStatus.ELIGIBLE).build()))
                    .isEqualTo("Eligible");
        }

        @Test
        void notApplicableAndNotDetected() {
            ProbeResult na = ProbeResult.notDetected(Protocol.X402);
            na.setStatus(DetectionStatus.NOT_APPLICABLE);

            assertThat(ScanReportFormatter.statusLabel(na)).isEqualTo("N/A (not applicable to business model)");
            assertThat(ScanReportFormatter.statusLabel(ProbeResult.notDetected(Protocol.MCP))).isEqualTo("Not Detected");
            assertThat(ScanReportFormatter.statusLabel(null)).isEqualTo("Not Detected");
        }
    }

    @Test
    @DisplayName("scan summary lists scores, protocols and accessibility")
    void scanSummary() {
        ScanResult result = ScanResult.builder()
                .target(ScanTarget.of("shop.example"))
                .scanStatus(ScanStatus.COMPLETED)
                .businessModel(BusinessModel.RETAIL)
                .scanDurationMs(1234L)
                .score(ReadinessScore.builder()
                        .protocolScore(65).dataScore(75).accessibilityScore(95).checkoutScore(20)
                        .readinessScore(67).build())
                .protocolResults(List.of(
                        ProbeResult.builder().protocol(Protocol.UCP).status(DetectionStatus.CONFIRMED)
                                .isFunctional(true).endpointUrl("https://shop.example/.well-known/ucp").build(),
                        ProbeResult.notDetected(Protocol.NLWEB)))
                .accessibility(AccessibilitySignals.builder()
                        .ecommercePlatform("shopify")
                        .guestCheckoutAvailable(true)
                        .paymentProcessors(Set.of("stripe"))
                        .build())
                .build();

        String md = ScanReportFormatter.scanSummary(result);

        assertThat(md).startsWith("## Scan Results: shop.example");
        assertThat(md).contains("**Readiness Score:** 67/100 (Grade B)");
        assertThat(md).contains("**Status:** completed");
        assertThat(md).contains("**Duration:** 1234ms");
        assertThat(md).contains("- Protocol: 65/100");
        assertThat(md).contains("- **Universal Commerce Protocol**: Confirmed (Functional) (https://shop.example/.well-known/ucp)");
        assertThat(md).contains("- **NLWeb**: Not Detected");
        assertThat(md).contains("- Platform: shopify");
        assertThat(md).contains("- Guest Checkout: Yes");
        assertThat(md).contains("- Payment Processors: stripe");
        assertThat(md).contains("- CAPTCHA: No");
    }

    @Test
    void failedScanShowsError() {
        String md = ScanReportFormatter.scanSummary(ScanResult.failed(ScanTarget.of("down.example"), "timeout", 10));

        assertThat(md).contains("**Status:** failed");
        assertThat(md).contains("**Error:** timeout");
        assertThat(md).contains("(Grade F)");
    }
}
