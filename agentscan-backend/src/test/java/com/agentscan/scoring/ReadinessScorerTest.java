package com.agentscan.scoring;

import com.agentscan.model.AccessibilitySignals;
import com.agentscan.model.DetectionStatus;
import com.agentscan.model.ProbeResult;
import com.agentscan.model.Protocol;
import com.agentscan.model.ReadinessGrade;
import com.agentscan.model.ReadinessScore;
import com.agentscan.model.StructuredDataSignals;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ReadinessScorerTest {

    private final ReadinessScorer scorer = new ReadinessScorer();

    private static ProbeResult functional(Protocol protocol) {
        return ProbeResult.builder()
                .protocol(protocol)
                .status(DetectionStatus.CONFIRMED)
                .isFunctional(true)
                .build();
    }

    private static List<ProbeResult> functional(Protocol... protocols) {
        List<ProbeResult> out = new ArrayList<>();
        for (Protocol p : protocols) {
            out.add(functional(p));
        }
        return out;
    }

    @Nested
    @DisplayName("protocol score")
    class ProtocolScore {

        @Test
        @DisplayName("ucp, acp and mcp functional gives 65")
        void threeProtocols() {
            assertThat(scorer.protocolScore(functional(Protocol.UCP, Protocol.ACP, Protocol.MCP))).isEqualTo(65);
        }

        @Test
        @DisplayName("all eight functional caps at 100")
        void capped() {
            assertThat(scorer.protocolScore(functional(Protocol.values()))).isEqualTo(100);
        }

        @Test
        void weightsSumAbove100() {
            int raw = ReadinessScorer.PROTOCOL_WEIGHTS.values().stream().mapToInt(Integer::intValue).sum();
            assertThat(raw).isEqualTo(105);
        }

        @Test
        @DisplayName("only detections reported functional earn points")
        void onlyFunctionalCounts() {
            ProbeResult eligible = ProbeResult.notDetected(Protocol.UCP)
                    .withStatus(DetectionStatus.ELIGIBLE, "x");
            eligible.setIsFunctional(true);
            ProbeResult enabled = ProbeResult.notDetected(Protocol.ACP)
                    .withStatus(DetectionStatus.PLATFORM_ENABLED, "y");
            ProbeResult confirmedNotFunctional = ProbeResult.builder()
                    .protocol(Protocol.MCP)
                    .status(DetectionStatus.CONFIRMED)
                    .isFunctional(false)
                    .build();
            ProbeResult confirmedUnknown = ProbeResult.builder()
                    .protocol(Protocol.NLWEB)
                    .status(DetectionStatus.CONFIRMED)
                    .build();

            int score = scorer.protocolScore(List.of(enabled, confirmedNotFunctional, confirmedUnknown));
            assertThat(score).isZero();
            assertThat(scorer.protocolScore(List.of(eligible))).isEqualTo(30);
        }

        @Test
        void duplicateProtocolCountsOnce() {
            assertThat(scorer.protocolScore(functional(Protocol.UCP, Protocol.UCP))).isEqualTo(30);
        }

        @Test
        void emptyOrNull() {
            assertThat(scorer.protocolScore(List.of())).isZero();
            assertThat(scorer.protocolScore(null)).isZero();
        }
    }

    @Nested
    @DisplayName("data score")
    class DataScore {

        @Test
        void fixedWeights() {
            StructuredDataSignals sd = StructuredDataSignals.builder()
                    .hasJsonLd(true)
                    .hasSchemaProduct(true)
                    .hasSchemaOffer(true)
                    .hasOpenGraph(true)
                    .build();

            assertThat(scorer.dataScore(sd)).isEqualTo(75);
        }

        @Test
        @DisplayName("full coverage reaches 93")
        void fullCoverage() {
            StructuredDataSignals sd = StructuredDataSignals.builder()
                    .hasJsonLd(true)
                    .hasSchemaProduct(true)
                    .hasSchemaOffer(true)
                    .hasOpenGraph(true)
                    .productCount(12)
                    .productsWithPrice(12)
                    .productsWithAvailability(12)
                    .productsWithSku(12)
                    .productsWithImage(12)
                    .build();

            assertThat(scorer.dataScore(sd)).isEqualTo(93);
        }

        @Test
        void partialCoverageIsProportional() {
            StructuredDataSignals sd = StructuredDataSignals.builder()
                    .productCount(4)
                    .productsWithPrice(2)
                    .productsWithAvailability(4)
                    .productsWithSku(0)
                    .productsWithImage(1)
                    .build();

            // 4 + 5 + 0 + 1
            assertThat(scorer.dataScore(sd)).isEqualTo(10);
        }

        @Test
        void coverageCountsAboveProductCountAreBounded() {
            StructuredDataSignals sd = StructuredDataSignals.builder()
                    .productCount(2)
                    .productsWithPrice(50)
                    .build();

            assertThat(scorer.dataScore(sd)).isEqualTo(8);
        }

        @Test
        void noProductsNoCoverage() {
            StructuredDataSignals sd = StructuredDataSignals.builder()
                    .productsWithPrice(3)
                    .build();

            assertThat(scorer.dataScore(sd)).isZero();
        }
    }

    @Nested
    @DisplayName("accessibility and checkout")
    class AccessibilityAndCheckout {

        @Test
        @DisplayName("blocked bots, captcha and javascript leave 20")
        void penalties() {
            AccessibilitySignals acc = AccessibilitySignals.builder()
                    .robotsTxtExists(true)
                    .robotsBlocksAllBots(true)
                    .hasCaptcha(true)
                    .requiresJavascript(true)
                    .build();

            assertThat(scorer.accessibilityScore(acc)).isEqualTo(20);
        }

        @Test
        void penaltiesStack() {
            AccessibilitySignals acc = AccessibilitySignals.builder()
                    .robotsBlocksAllBots(true)
                    .hasCaptcha(true)
                    .requiresJavascript(true)
                    .build();

            assertThat(scorer.accessibilityScore(acc)).isEqualTo(15);
        }

        @Test
        void agentFriendlyRobotsIsCappedAt100() {
            AccessibilitySignals acc = AccessibilitySignals.builder()
                    .robotsTxtExists(true)
                    .robotsAllowsAgents(true)
                    .build();

            assertThat(scorer.accessibilityScore(acc)).isEqualTo(100);
        }

        @Test
        void checkoutSteps() {
            assertThat(scorer.checkoutScore(AccessibilitySignals.builder()
                    .requiresAccount(true).checkoutStepsCount(3).build())).isEqualTo(20);
            assertThat(scorer.checkoutScore(AccessibilitySignals.builder()
                    .requiresAccount(true).checkoutStepsCount(5).build())).isEqualTo(10);
            assertThat(scorer.checkoutScore(AccessibilitySignals.builder()
                    .requiresAccount(true).checkoutStepsCount(6).build())).isZero();
            assertThat(scorer.checkoutScore(AccessibilitySignals.builder()
                    .requiresAccount(true).checkoutStepsCount(0).build())).isZero();
        }

        @Test
        void processorsCountUpToThree() {
            AccessibilitySignals acc = AccessibilitySignals.builder()
                    .requiresAccount(true)
                    .paymentProcessors(Set.of("stripe", "adyen", "paypal", "braintree"))
                    .build();

            assertThat(scorer.checkoutScore(acc)).isEqualTo(15);
        }

        @Test
        void everythingClampsAt100() {
            AccessibilitySignals acc = AccessibilitySignals.builder()
                    .guestCheckoutAvailable(true)
                    .checkoutStepsCount(2)
                    .paymentProcessors(Set.of("stripe", "adyen", "paypal"))
                    .supportsDigitalWallets(true)
                    .supportsCrypto(true)
                    .supportsPix(true)
                    .supportsSpei(true)
                    .build();

            assertThat(scorer.checkoutScore(acc)).isEqualTo(100);
        }
    }

    @Nested
    @DisplayName("composite")
    class Composite {

        @Test
        @DisplayName("nothing detected, no robots.txt")
        void zeroDetections() {
            ReadinessScore score = scorer.score(List.of(), StructuredDataSignals.absent(), AccessibilitySignals.absent());

            assertThat(score.getProtocolScore()).isZero();
            assertThat(score.getDataScore()).isZero();
            assertThat(score.getAccessibilityScore()).isEqualTo(95);
            assertThat(score.getCheckoutScore()).isEqualTo(20);
            // 95 * 0.20 + 20 * 0.15
            assertThat(score.getReadinessScore()).isEqualTo(22);
            assertThat(score.getGrade()).isEqualTo(ReadinessGrade.D);
        }

        @Test
        void nullSignalsReadAsAbsent() {
            assertThat(scorer.score(null, null, null))
                    .isEqualTo(scorer.score(List.of(), StructuredDataSignals.absent(), AccessibilitySignals.absent()));
        }

        @Test
        void weightedAndRounded() {
            // 65*.4 + 75*.25 + 95*.2 + 20*.15 = 26 + 18.75 + 19 + 3 = 66.75
            assertThat(scorer.compositeScore(65, 75, 95, 20)).isEqualTo(67);
            assertThat(scorer.compositeScore(100, 100, 100, 100)).isEqualTo(100);
            assertThat(scorer.compositeScore(0, 0, 0, 0)).isZero();
        }
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "100, A", "80, A", "79, B", "60, B", "59, C", "40, C", "39, D", "20, D", "19, F", "0, F"
    })
    void gradeBoundaries(int score, ReadinessGrade grade) {
        assertThat(ReadinessScorer.getReadinessGrade(score)).isEqualTo(grade);
    }
}
