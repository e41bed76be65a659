package com.agentscan.scoring;

import com.agentscan.config.ScannerProperties;
import com.agentscan.model.DetectionStatus;
import com.agentscan.model.EligibilityRule;
import com.agentscan.model.EligibilityRuleFile;
import com.agentscan.model.Protocol;
import com.agentscan.model.ProtocolRuleSet;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Holds the per-protocol eligibility rule tables.
 *
 * <p>Rules are read once from a classpath JSON resource. A missing or invalid resource fails startup.
 */
@Component
public class EligibilityRuleRegistry {
    private static final Logger log = LoggerFactory.getLogger(EligibilityRuleRegistry.class);

    private final Map<Protocol, List<EligibilityRule>> rulesByProtocol;

    @Autowired
    public EligibilityRuleRegistry(ObjectMapper objectMapper, ScannerProperties properties) {
        this(objectMapper, properties.getRules().getEligibilityResource());
    }

    public EligibilityRuleRegistry(ObjectMapper objectMapper, String resource) {
        this.rulesByProtocol = load(objectMapper, resource);
    }

    /**
     * Ordered rules of a protocol.
     *
     * @param protocol protocol, may be {@code null}
     * @return rules in evaluation order, empty when the protocol has none
     */
    public List<EligibilityRule> rulesFor(Protocol protocol) {
        if (protocol == null) {
            return List.of();
        }
        return rulesByProtocol.getOrDefault(protocol, List.of());
    }

    private static Map<Protocol, List<EligibilityRule>> load(ObjectMapper objectMapper, String resource) {
        if (resource == null || resource.isBlank()) {
            throw new IllegalStateException("scanner.rules.eligibility-resource is not set");
        }
        String path = resource.startsWith("/") ? resource : "/" + resource;

        EligibilityRuleFile file;
        try (InputStream is = EligibilityRuleRegistry.class.getResourceAsStream(path)) {
            if (is == null) {
                throw new IllegalStateException("Eligibility rules not found on classpath: " + path);
            }
            file = objectMapper.readValue(is, EligibilityRuleFile.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read eligibility rules: " + path, e);
        }

        Map<Protocol, List<EligibilityRule>> out = new EnumMap<>(Protocol.class);
        if (file == null || file.getProtocols() == null) {
            log.warn("Eligibility rules file is empty: resource={}", path);
            return out;
        }

        for (ProtocolRuleSet set : file.getProtocols()) {
            if (set == null || set.getProtocol() == null) {
                throw new IllegalStateException("Rule set without protocol in " + path);
            }
            if (out.containsKey(set.getProtocol())) {
                throw new IllegalStateException("Duplicate rule set for protocol " + set.getProtocol() + " in " + path);
            }
            List<EligibilityRule> rules = set.getRules() != null ? set.getRules() : List.of();
            for (EligibilityRule rule : rules) {
                validate(set.getProtocol(), rule, path);
            }
            out.put(set.getProtocol(), Collections.unmodifiableList(rules));
        }

        int total = out.values().stream().mapToInt(List::size).sum();
        log.info("Loaded eligibility rules: resource={}, protocols={}, rules={}", path, out.size(), total);
        return out;
    }

    private static void validate(Protocol protocol, EligibilityRule rule, String path) {
        if (rule == null) {
            throw new IllegalStateException("Null rule for protocol " + protocol + " in " + path);
        }
        String id = rule.getRuleId() != null ? rule.getRuleId() : "<unnamed>";
        if (rule.getWhen() == null || rule.getWhen().isEmpty()) {
            throw new IllegalStateException("Rule " + id + " (" + protocol + ") has no precondition");
        }
        DetectionStatus status = rule.getStatus();
        if (status == null || !status.isDetected() || status == DetectionStatus.CONFIRMED) {
            throw new IllegalStateException(
                    "Rule " + id + " (" + protocol + ") must yield eligible or platform_enabled, got " + status);
        }
        if (rule.getSignal() == null || rule.getSignal().isBlank()) {
            throw new IllegalStateException("Rule " + id + " (" + protocol + ") has no signal text");
        }
    }
}
