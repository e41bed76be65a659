package com.agentscan.scoring;

import com.agentscan.model.AccessibilitySignals;
import com.agentscan.model.ProbeResult;
import com.agentscan.model.Protocol;
import com.agentscan.model.ReadinessGrade;
import com.agentscan.model.ReadinessScore;
import com.agentscan.model.StructuredDataSignals;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Computes the four readiness sub-scores and their weighted composite.
 *
 * <p>Every sub-score is clamped to {@code [0, 100]} after it is summed, so any number of simultaneously
 * functional protocols still caps at 100.
 */
@Component
public class ReadinessScorer {

    static final Map<Protocol, Integer> PROTOCOL_WEIGHTS = new EnumMap<>(Protocol.class);

    static {
        PROTOCOL_WEIGHTS.put(Protocol.UCP, 30);
        PROTOCOL_WEIGHTS.put(Protocol.ACP, 20);
        PROTOCOL_WEIGHTS.put(Protocol.MCP, 15);
        PROTOCOL_WEIGHTS.put(Protocol.X402, 10);
        PROTOCOL_WEIGHTS.put(Protocol.AP2, 10);
        PROTOCOL_WEIGHTS.put(Protocol.NLWEB, 10);
        PROTOCOL_WEIGHTS.put(Protocol.VISA_VIC, 5);
        PROTOCOL_WEIGHTS.put(Protocol.MASTERCARD_AGENTPAY, 5);
    }

    // data_score
    private static final int JSON_LD_POINTS = 30;
    private static final int SCHEMA_PRODUCT_POINTS = 20;
    private static final int SCHEMA_OFFER_POINTS = 15;
    private static final int OPEN_GRAPH_POINTS = 10;
    private static final int PRICE_COVERAGE_POINTS = 8;
    private static final int AVAILABILITY_COVERAGE_POINTS = 5;
    private static final int SKU_COVERAGE_POINTS = 3;
    private static final int IMAGE_COVERAGE_POINTS = 2;

    // accessibility_score
    private static final int NO_ROBOTS_TXT_PENALTY = 5;
    private static final int BLOCKS_ALL_BOTS_PENALTY = 40;
    private static final int CAPTCHA_PENALTY = 25;
    private static final int REQUIRES_JAVASCRIPT_PENALTY = 15;
    private static final int ALLOWS_AGENTS_BONUS = 10;

    // checkout_score
    private static final int NO_ACCOUNT_POINTS = 20;
    private static final int GUEST_CHECKOUT_POINTS = 20;
    private static final int SHORT_CHECKOUT_POINTS = 20;
    private static final int MEDIUM_CHECKOUT_POINTS = 10;
    private static final int POINTS_PER_PROCESSOR = 5;
    private static final int MAX_COUNTED_PROCESSORS = 3;
    private static final int DIGITAL_WALLET_POINTS = 10;
    private static final int CRYPTO_POINTS = 10;
    private static final int PIX_POINTS = 5;
    private static final int SPEI_POINTS = 5;

    private static final double PROTOCOL_WEIGHT = 0.40;
    private static final double DATA_WEIGHT = 0.25;
    private static final double ACCESSIBILITY_WEIGHT = 0.20;
    private static final double CHECKOUT_WEIGHT = 0.15;

    /**
     * Scores one domain.
     *
     * @param results enriched and filtered probe results
     * @param structuredData structured data coverage, {@code null} reads as absent
     * @param accessibility accessibility and checkout signals, {@code null} reads as absent
     * @return readiness score
     */
    public ReadinessScore score(
            Collection<ProbeResult> results,
            StructuredDataSignals structuredData,
            AccessibilitySignals accessibility
    ) {
        StructuredDataSignals sd = structuredData != null ? structuredData : StructuredDataSignals.absent();
        AccessibilitySignals acc = accessibility != null ? accessibility : AccessibilitySignals.absent();

        int protocol = protocolScore(results);
        int data = dataScore(sd);
        int access = accessibilityScore(acc);
        int checkout = checkoutScore(acc);

        return ReadinessScore.builder()
                .protocolScore(protocol)
                .dataScore(data)
                .accessibilityScore(access)
                .checkoutScore(checkout)
                .readinessScore(compositeScore(protocol, data, access, checkout))
                .build();
    }

    public int protocolScore(Collection<ProbeResult> results) {
        if (results == null) {
            return 0;
        }
        Set<Protocol> counted = EnumSet.noneOf(Protocol.class);
        int total = 0;
        for (ProbeResult r : results) {
            if (r == null || r.getProtocol() == null || !r.isDetectedAndFunctional()) {
                continue;
            }
            // one result per protocol is expected; a duplicate must not add twice
            if (counted.add(r.getProtocol())) {
                total += PROTOCOL_WEIGHTS.getOrDefault(r.getProtocol(), 0);
            }
        }
        return clamp(total);
    }

    public int dataScore(StructuredDataSignals sd) {
        int total = 0;
        if (sd.isHasJsonLd()) {
            total += JSON_LD_POINTS;
        }
        if (sd.isHasSchemaProduct()) {
            total += SCHEMA_PRODUCT_POINTS;
        }
        if (sd.isHasSchemaOffer()) {
            total += SCHEMA_OFFER_POINTS;
        }
        if (sd.isHasOpenGraph()) {
            total += OPEN_GRAPH_POINTS;
        }

        int products = sd.getProductCount();
        if (products > 0) {
            total += coverage(sd.getProductsWithPrice(), products, PRICE_COVERAGE_POINTS);
            total += coverage(sd.getProductsWithAvailability(), products, AVAILABILITY_COVERAGE_POINTS);
            total += coverage(sd.getProductsWithSku(), products, SKU_COVERAGE_POINTS);
            total += coverage(sd.getProductsWithImage(), products, IMAGE_COVERAGE_POINTS);
        }
        return clamp(total);
    }

    public int accessibilityScore(AccessibilitySignals acc) {
        int total = 100;
        if (!acc.isRobotsTxtExists()) {
            total -= NO_ROBOTS_TXT_PENALTY;
        }
        if (acc.isRobotsBlocksAllBots()) {
            total -= BLOCKS_ALL_BOTS_PENALTY;
        }
        if (acc.isHasCaptcha()) {
            total -= CAPTCHA_PENALTY;
        }
        if (acc.isRequiresJavascript()) {
            total -= REQUIRES_JAVASCRIPT_PENALTY;
        }
        if (acc.isRobotsAllowsAgents()) {
            total += ALLOWS_AGENTS_BONUS;
        }
        return clamp(total);
    }

    public int checkoutScore(AccessibilitySignals acc) {
        int total = 0;
        if (!acc.isRequiresAccount()) {
            total += NO_ACCOUNT_POINTS;
        }
        if (acc.isGuestCheckoutAvailable()) {
            total += GUEST_CHECKOUT_POINTS;
        }

        Integer steps = acc.getCheckoutStepsCount();
        if (steps != null && steps > 0) {
            if (steps <= 3) {
                total += SHORT_CHECKOUT_POINTS;
            } else if (steps <= 5) {
                total += MEDIUM_CHECKOUT_POINTS;
            }
        }

        long processors = acc.getPaymentProcessors().stream()
                .filter(Objects::nonNull)
                .map(p -> p.trim().toLowerCase(Locale.ROOT))
                .filter(p -> !p.isEmpty())
                .distinct()
                .count();
        total += (int) Math.min(processors, MAX_COUNTED_PROCESSORS) * POINTS_PER_PROCESSOR;

        if (acc.isSupportsDigitalWallets()) {
            total += DIGITAL_WALLET_POINTS;
        }
        if (acc.isSupportsCrypto()) {
            total += CRYPTO_POINTS;
        }
        if (acc.isSupportsPix()) {
            total += PIX_POINTS;
        }
        if (acc.isSupportsSpei()) {
            total += SPEI_POINTS;
        }
        return clamp(total);
    }

    public int compositeScore(int protocol, int data, int accessibility, int checkout) {
        double weighted = protocol * PROTOCOL_WEIGHT
                + data * DATA_WEIGHT
                + accessibility * ACCESSIBILITY_WEIGHT
                + checkout * CHECKOUT_WEIGHT;
        return clamp((int) Math.round(weighted));
    }

    public static ReadinessGrade getReadinessGrade(int score) {
        return ReadinessGrade.of(score);
    }

    private static int coverage(int withField, int products, int points) {
        double ratio = Math.min(1.0, (double) withField / products);
        return (int) Math.round(points * ratio);
    }

    private static int clamp(int v) {
        return Math.max(0, Math.min(100, v));
    }
}
