package com.agentscan.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A merchant to scan, as handed over by domain ingestion. {@code domain} is already normalized.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(value = "url", allowGetters = true)
public class ScanTarget {
    private String domain;
    private String merchantName;
    private String merchantCategory;
    private String countryCode;
    private String region;

    public static ScanTarget of(String domain) {
        return ScanTarget.builder().domain(domain).build();
    }

    public String getUrl() {
        return "https://" + domain;
    }
}
