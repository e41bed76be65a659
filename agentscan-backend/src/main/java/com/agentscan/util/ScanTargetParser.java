package com.agentscan.util;

import com.agentscan.model.ScanTarget;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses bulk target lists.
 *
 * <p>Columns are {@code domain,merchant_name,merchant_category,country_code,region}; only the first is
 * required. A header row is recognized by its first cell being {@code domain}. Fields may be quoted
 * with {@code "}, and {@code ""} inside a quoted field is a literal quote. Blank lines and lines
 * starting with {@code #} are skipped.
 */
public final class ScanTargetParser {

    private ScanTargetParser() {
    }

    /**
     * Parses delimited text into normalized, de-duplicated targets.
     *
     * @param text CSV text
     * @return targets in first-seen order
     */
    public static List<ScanTarget> parseCsv(String text) {
        List<ScanTarget> rows = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return rows;
        }

        String[] lines = text.split("\\r?\\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank() || line.trim().startsWith("#")) {
                continue;
            }
            List<String> cells = splitLine(line);
            if (rows.isEmpty() && i == firstDataLine(lines) && isHeader(cells)) {
                continue;
            }
            rows.add(ScanTarget.builder()
                    .domain(cell(cells, 0))
                    .merchantName(cell(cells, 1))
                    .merchantCategory(cell(cells, 2))
                    .countryCode(cell(cells, 3))
                    .region(cell(cells, 4))
                    .build());
        }
        return DomainNormalizer.normalizeTargets(rows);
    }

    /**
     * Parses a single domain into a target.
     *
     * @param domain raw domain or URL
     * @return target with the normalized domain
     * @throws IllegalArgumentException when nothing is left after normalization
     */
    public static ScanTarget parseSingle(String domain) {
        String n = DomainNormalizer.normalize(domain);
        if (n.isEmpty()) {
            throw new IllegalArgumentException("domain is required");
        }
        return ScanTarget.of(n);
    }

    static List<String> splitLine(String line) {
        List<String> out = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        cur.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    cur.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                out.add(cur.toString());
                cur.setLength(0);
            } else {
                cur.append(c);
            }
        }
        out.add(cur.toString());
        return out;
    }

    private static int firstDataLine(String[] lines) {
        for (int i = 0; i < lines.length; i++) {
            if (!lines[i].isBlank() && !lines[i].trim().startsWith("#")) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isHeader(List<String> cells) {
        return !cells.isEmpty() && "domain".equals(cells.get(0).trim().toLowerCase(Locale.ROOT));
    }

    private static String cell(List<String> cells, int idx) {
        if (idx >= cells.size()) {
            return null;
        }
        String v = cells.get(idx).trim();
        return v.isEmpty() ? null : v;
    }
}
