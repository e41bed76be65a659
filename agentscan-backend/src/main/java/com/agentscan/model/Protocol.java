package com.agentscan.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Agentic commerce protocols the scanner checks for.
 *
 * <p>The set is closed. Adding a constant also means adding a row to the applicability matrix in
 * {@code BusinessModelFilter}, a weight in {@code ReadinessScorer} and, optionally, a rule list in
 * {@code rules/eligibility.json}.
 */
public enum Protocol {
    UCP("ucp", "Universal Commerce Protocol"),
    ACP("acp", "Agentic Commerce Protocol"),
    X402("x402", "x402"),
    AP2("ap2", "Agent Payments Protocol"),
    MCP("mcp", "Model Context Protocol"),
    NLWEB("nlweb", "NLWeb"),
    VISA_VIC("visa_vic", "Visa Intelligent Commerce"),
    MASTERCARD_AGENTPAY("mastercard_agentpay", "Mastercard Agent Pay");

    private final String wireName;
    private final String displayName;

    Protocol(String wireName, String displayName) {
        this.wireName = wireName;
        this.displayName = displayName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolves a protocol from its wire name.
     *
     * @param value wire name, case-insensitive
     * @return the protocol
     * @throws IllegalArgumentException when the name is unknown
     */
    @JsonCreator
    public static Protocol fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("protocol is required");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (Protocol p : values()) {
            if (p.wireName.equals(v)) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown protocol: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
