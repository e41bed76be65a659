package com.agentscan.scoring;

import com.agentscan.model.DetectionStatus;
import com.agentscan.model.EligibilityRule;
import com.agentscan.model.ProbeResult;
import com.agentscan.model.SignalBundle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Upgrades probe results that found nothing on the wire to {@code eligible} or
 * {@code platform_enabled} when platform or payment processor signals show the merchant could adopt,
 * or already has, the protocol.
 *
 * <p>Per protocol the first rule whose precondition holds proposes a status; it is applied only when it
 * ranks strictly higher than the current one. {@code confirmed} and {@code not_applicable} results are
 * never touched. Because rules only raise rank and never read eligibility signals, enriching an already
 * enriched list changes nothing.
 */
@Component
public class EligibilityEnricher {
    private static final Logger log = LoggerFactory.getLogger(EligibilityEnricher.class);

    private final EligibilityRuleRegistry ruleRegistry;

    public EligibilityEnricher(EligibilityRuleRegistry ruleRegistry) {
        this.ruleRegistry = ruleRegistry;
    }

    /**
     * Enriches probe results.
     *
     * @param results probe results of one domain
     * @param signals commerce signals of the same domain, {@code null} reads as absent
     * @return new list, same length, protocols and order as {@code results}
     */
    public List<ProbeResult> enrich(List<ProbeResult> results, SignalBundle signals) {
        if (results == null) {
            return new ArrayList<>();
        }
        SignalBundle s = signals != null ? signals : SignalBundle.absent();
        List<ProbeResult> out = new ArrayList<>(results.size());
        for (ProbeResult r : results) {
            out.add(r == null ? null : enrichOne(r, s));
        }
        return out;
    }

    private ProbeResult enrichOne(ProbeResult current, SignalBundle signals) {
        DetectionStatus status = current.getStatus();
        if (status == DetectionStatus.CONFIRMED || status == DetectionStatus.NOT_APPLICABLE) {
            return current.copy();
        }

        for (EligibilityRule rule : ruleRegistry.rulesFor(current.getProtocol())) {
            if (!rule.getWhen().matches(signals)) {
                continue;
            }
            if (!StatusHierarchy.canUpgrade(status, rule.getStatus())) {
                return current.copy();
            }

            ProbeResult upgraded = current.withStatus(rule.getStatus(), rule.getSignal());
            if (rule.getConfidence() != null) {
                upgraded.setConfidence(rule.getConfidence());
            }
            log.debug("Upgraded protocol={} from={} to={} rule_id={}",
                    current.getProtocol(), status, rule.getStatus(), rule.getRuleId());
            return upgraded;
        }
        return current.copy();
    }
}
