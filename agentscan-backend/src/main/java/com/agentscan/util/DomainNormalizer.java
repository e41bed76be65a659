package com.agentscan.util;

import com.agentscan.model.ScanTarget;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Normalizes incoming domain strings into the canonical form used as scan keys.
 *
 * This must run before targets reach the batch orchestrator; results are keyed by the normalized domain.
 */
public final class DomainNormalizer {

    private DomainNormalizer() {
    }

    /**
     * Normalize a domain.
     *
     * @param raw incoming domain or URL
     * @return lower-cased domain without scheme, leading {@code www.} or trailing slashes; empty when
     *         nothing is left
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if (v.startsWith("https://")) {
            v = v.substring("https://".length());
        } else if (v.startsWith("http://")) {
            v = v.substring("http://".length());
        }
        if (v.startsWith("www.")) {
            v = v.substring("www.".length());
        }
        int end = v.length();
        while (end > 0 && v.charAt(end - 1) == '/') {
            end--;
        }
        return v.substring(0, end).trim();
    }

    /**
     * Normalizes and de-duplicates domains, keeping first-seen order. Empty results are dropped.
     */
    public static List<String> normalizeAll(Collection<String> raw) {
        List<String> out = new ArrayList<>();
        if (raw == null) {
            return out;
        }
        for (String d : raw) {
            String n = normalize(d);
            if (!n.isEmpty() && !out.contains(n)) {
                out.add(n);
            }
        }
        return out;
    }

    /**
     * Normalizes target domains and de-duplicates by domain. The first row for a domain wins.
     */
    public static List<ScanTarget> normalizeTargets(Collection<ScanTarget> targets) {
        Map<String, ScanTarget> byDomain = new LinkedHashMap<>();
        if (targets == null) {
            return new ArrayList<>();
        }
        for (ScanTarget t : targets) {
            if (t == null) {
                continue;
            }
            String n = normalize(t.getDomain());
            if (n.isEmpty()) {
                continue;
            }
            byDomain.putIfAbsent(n, t.toBuilder().domain(n).build());
        }
        return new ArrayList<>(byDomain.values());
    }
}
