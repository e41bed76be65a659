package com.agentscan.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Commerce signals used by eligibility enrichment and business model classification.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SignalBundle {
    private String ecommercePlatform;
    private Set<String> paymentProcessors;
    private String merchantCategory;
    private HtmlSignals htmlSignals;
    private boolean hasSchemaProduct;
    private boolean hasSchemaOffer;
    private int productCount;

    public static SignalBundle absent() {
        return new SignalBundle();
    }

    public Set<String> getPaymentProcessors() {
        return paymentProcessors != null ? paymentProcessors : Set.of();
    }

    public HtmlSignals getHtmlSignals() {
        return htmlSignals != null ? htmlSignals : HtmlSignals.absent();
    }

    public int getProductCount() {
        return Math.max(0, productCount);
    }
}
