package com.agentscan.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Robots.txt policy, bot friction and checkout characteristics of a merchant site.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AccessibilitySignals {
    private boolean robotsTxtExists;
    private boolean robotsBlocksGptbot;
    private boolean robotsBlocksClaudebot;
    private boolean robotsBlocksAllBots;
    private boolean robotsAllowsAgents;
    private boolean hasCaptcha;
    private boolean requiresJavascript;
    private boolean guestCheckoutAvailable;
    private boolean requiresAccount;
    private Integer checkoutStepsCount;
    private Set<String> paymentProcessors;
    private boolean supportsDigitalWallets;
    private boolean supportsCrypto;
    private boolean supportsPix;
    private boolean supportsSpei;
    private String ecommercePlatform;

    public static AccessibilitySignals absent() {
        return new AccessibilitySignals();
    }

    public Set<String> getPaymentProcessors() {
        return paymentProcessors != null ? paymentProcessors : Set.of();
    }
}
