package com.agentscan.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One precondition-to-status rule for a protocol, loaded from {@code rules/eligibility.json}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EligibilityRule {
    private String ruleId;
    private RuleCondition when;
    private DetectionStatus status;
    /** Confidence to set when the rule is applied; {@code null} keeps the probe's confidence. */
    private Confidence confidence;
    private String signal;
}
