package com.agentscan.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Everything the signal extractor reports for one domain.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PageSignals {
    private SignalBundle signals;
    private StructuredDataSignals structuredData;
    private AccessibilitySignals accessibility;

    public static PageSignals absent() {
        return new PageSignals();
    }

    public SignalBundle getSignals() {
        return signals != null ? signals : SignalBundle.absent();
    }

    public StructuredDataSignals getStructuredData() {
        return structuredData != null ? structuredData : StructuredDataSignals.absent();
    }

    public AccessibilitySignals getAccessibility() {
        return accessibility != null ? accessibility : AccessibilitySignals.absent();
    }
}
