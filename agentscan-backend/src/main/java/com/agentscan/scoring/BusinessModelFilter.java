package com.agentscan.scoring;

import com.agentscan.model.BusinessModel;
import com.agentscan.model.DetectionStatus;
import com.agentscan.model.ProbeResult;
import com.agentscan.model.Protocol;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Marks protocols that do not fit a business model as {@code not_applicable}.
 *
 * <p>Only {@code not_detected} results are changed. A live detection of an "inapplicable" protocol is
 * kept as is.
 */
@Component
public class BusinessModelFilter {

    private static final Map<Protocol, Set<BusinessModel>> APPLICABILITY = new EnumMap<>(Protocol.class);

    static {
        Set<BusinessModel> all = EnumSet.allOf(BusinessModel.class);
        Set<BusinessModel> commerce = EnumSet.of(BusinessModel.RETAIL, BusinessModel.MARKETPLACE);
        Set<BusinessModel> software = EnumSet.of(BusinessModel.SAAS, BusinessModel.API_PROVIDER);

        APPLICABILITY.put(Protocol.UCP, commerce);
        APPLICABILITY.put(Protocol.ACP, all);
        APPLICABILITY.put(Protocol.X402, software);
        APPLICABILITY.put(Protocol.AP2, all);
        APPLICABILITY.put(Protocol.MCP, all);
        APPLICABILITY.put(Protocol.NLWEB, all);
        APPLICABILITY.put(Protocol.VISA_VIC, commerce);
        APPLICABILITY.put(Protocol.MASTERCARD_AGENTPAY, commerce);
    }

    public static boolean isApplicable(Protocol protocol, BusinessModel model) {
        if (protocol == null) {
            return true;
        }
        BusinessModel m = model != null ? model : BusinessModel.RETAIL;
        return APPLICABILITY.getOrDefault(protocol, EnumSet.allOf(BusinessModel.class)).contains(m);
    }

    /**
     * Applies the applicability matrix.
     *
     * @param results probe results of one domain
     * @param model the domain's business model
     * @return new list in the same order
     */
    public List<ProbeResult> apply(List<ProbeResult> results, BusinessModel model) {
        if (results == null) {
            return new ArrayList<>();
        }
        List<ProbeResult> out = new ArrayList<>(results.size());
        for (ProbeResult r : results) {
            if (r == null) {
                out.add(null);
                continue;
            }
            ProbeResult copy = r.copy();
            if (copy.getStatus() == DetectionStatus.NOT_DETECTED && !isApplicable(copy.getProtocol(), model)) {
                copy.setStatus(DetectionStatus.NOT_APPLICABLE);
            }
            out.add(copy);
        }
        return out;
    }
}
