package com.agentscan.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Schema.org / JSON-LD / Open Graph coverage found on the merchant's pages.
 *
 * <p>The {@code productsWith*} counters are read clamped to {@code [0, productCount]}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StructuredDataSignals {
    private boolean hasJsonLd;
    private boolean hasOpenGraph;
    private boolean hasMicrodata;
    private boolean hasSchemaOrganization;
    private boolean hasSchemaProduct;
    private boolean hasSchemaOffer;
    private int productCount;
    private int productsWithPrice;
    private int productsWithAvailability;
    private int productsWithSku;
    private int productsWithImage;

    public static StructuredDataSignals absent() {
        return new StructuredDataSignals();
    }

    public int getProductCount() {
        return Math.max(0, productCount);
    }

    public int getProductsWithPrice() {
        return bounded(productsWithPrice);
    }

    public int getProductsWithAvailability() {
        return bounded(productsWithAvailability);
    }

    public int getProductsWithSku() {
        return bounded(productsWithSku);
    }

    public int getProductsWithImage() {
        return bounded(productsWithImage);
    }

    private int bounded(int v) {
        return Math.max(0, Math.min(v, getProductCount()));
    }
}
