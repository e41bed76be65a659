package com.agentscan.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;

/**
 * Ordered eligibility rules of one protocol. The first matching rule wins.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProtocolRuleSet {
    private Protocol protocol;
    private List<EligibilityRule> rules;
}
