package com.agentscan.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;

/**
 * Root object of the eligibility rules resource.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EligibilityRuleFile {
    private Integer version;
    private List<ProtocolRuleSet> protocols;
}
