package com.agentscan.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Precondition of an eligibility rule. Every clause that is set must hold; a condition with no
 * clause never matches.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RuleCondition {
    /** Commerce platforms, any of which satisfies the clause. */
    private List<String> platforms;
    /** Payment processors, any of which satisfies the clause. */
    private List<String> processors;

    public boolean isEmpty() {
        return (platforms == null || platforms.isEmpty()) && (processors == null || processors.isEmpty());
    }

    public boolean matches(SignalBundle signals) {
        if (signals == null || isEmpty()) {
            return false;
        }
        if (platforms != null && !platforms.isEmpty()) {
            String platform = lower(signals.getEcommercePlatform());
            if (platform.isEmpty() || platforms.stream().map(RuleCondition::lower).noneMatch(platform::equals)) {
                return false;
            }
        }
        if (processors != null && !processors.isEmpty()) {
            boolean any = signals.getPaymentProcessors().stream()
                    .filter(Objects::nonNull)
                    .map(RuleCondition::lower)
                    .anyMatch(p -> processors.stream().map(RuleCondition::lower).anyMatch(p::equals));
            if (!any) {
                return false;
            }
        }
        return true;
    }

    private static String lower(String v) {
        return v == null ? "" : v.trim().toLowerCase(Locale.ROOT);
    }
}
