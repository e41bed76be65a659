package com.agentscan.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Page-level hints about what kind of business a site is.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HtmlSignals {
    private boolean hasApiDocs;
    private boolean hasPricingPage;
    private boolean hasBlog;
    private boolean hasSignup;

    public static HtmlSignals absent() {
        return new HtmlSignals();
    }
}
