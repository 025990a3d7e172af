/* (C)2026 */
package com.ammann.valuation.pass;

import java.util.regex.Pattern;

/**
 * One written report section.
 *
 * @param sectionKey section the pass writes, e.g. {@code executive_summary}
 * @param content section text
 */
public record NarrativeSection(String sectionKey, String content) implements PassOutput {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public NarrativeSection {
        content = content == null ? "" : content;
    }

    public int wordCount() {
        String trimmed = content.trim();
        return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
    }
}
