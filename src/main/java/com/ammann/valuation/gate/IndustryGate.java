/* (C)2026 */
package com.ammann.valuation.gate;

import com.ammann.valuation.enumeration.GateKind;
import com.ammann.valuation.industry.IndustryKeywordCatalog;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jboss.logging.Logger;

/**
 * Scans narrative sections for keywords of another industry than the one the report is
 * classified under.
 */
public class IndustryGate implements ValidationGate {

    private static final Logger LOG = Logger.getLogger(IndustryGate.class);

    static final int SNIPPET_RADIUS = 50;
    static final double PENALTY_PER_VIOLATION = 25;

    private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();

    @Override
    public GateKind kind() {
        return GateKind.INDUSTRY;
    }

    @Override
    public GateResult evaluate(GateContext context) {
        List<IndustryViolation> violations =
                findViolations(context.naicsCode(), context.document().sections());
        List<GateIssue> errors = violations.stream().map(GateIssue::industryViolation).toList();
        List<String> warnings = new ArrayList<>();
        if (IndustryKeywordCatalog.blockedKeywords(context.naicsCode()).isEmpty()) {
            warnings.add("No industry keyword list for NAICS " + context.naicsCode() + ", scan skipped");
        }
        if (!violations.isEmpty()) {
            LOG.warnf("Industry gate found %d wrong-industry keyword(s) for NAICS %s",
                    violations.size(), context.naicsCode());
        }
        double score = Math.max(0, 100 - PENALTY_PER_VIOLATION * violations.size());
        return new GateResult(kind(), violations.isEmpty(), score, errors, warnings,
                Map.of("violations", (double) violations.size()));
    }

    /**
     * One violation per section and keyword, located at the keyword's first occurrence.
     */
    public List<IndustryViolation> findViolations(String naicsCode, Map<String, String> sections) {
        List<String> keywords = IndustryKeywordCatalog.blockedKeywords(naicsCode);
        if (keywords.isEmpty() || sections == null) {
            return List.of();
        }
        List<IndustryViolation> violations = new ArrayList<>();
        for (Map.Entry<String, String> section : sections.entrySet()) {
            String text = section.getValue();
            if (text == null || text.isBlank()) {
                continue;
            }
            for (String keyword : keywords) {
                Matcher m = patternFor(keyword).matcher(text);
                if (m.find()) {
                    violations.add(new IndustryViolation(
                            section.getKey(), keyword, snippet(text, m.start(), m.end())));
                }
            }
        }
        return violations;
    }

    static String snippet(String text, int start, int end) {
        int from = Math.max(0, start - SNIPPET_RADIUS);
        int to = Math.min(text.length(), end + SNIPPET_RADIUS);
        StringBuilder sb = new StringBuilder();
        if (from > 0) {
            sb.append("...");
        }
        sb.append(text, from, to);
        if (to < text.length()) {
            sb.append("...");
        }
        return sb.toString();
    }

    private Pattern patternFor(String keyword) {
        return patterns.computeIfAbsent(keyword, k ->
                Pattern.compile("\\b" + Pattern.quote(k) + "\\b", Pattern.CASE_INSENSITIVE));
    }
}
