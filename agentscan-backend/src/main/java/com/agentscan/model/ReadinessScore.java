package com.agentscan.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Four sub-scores and the weighted composite, each in {@code [0, 100]}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(value = "grade", allowGetters = true)
public class ReadinessScore {
    private int protocolScore;
    private int dataScore;
    private int accessibilityScore;
    private int checkoutScore;
    private int readinessScore;

    public static ReadinessScore zero() {
        return new ReadinessScore();
    }

    public ReadinessGrade getGrade() {
        return ReadinessGrade.of(readinessScore);
    }
}
