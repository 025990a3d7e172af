/* (C)2026 */
package com.ammann.valuation.pass;

import com.ammann.valuation.enumeration.PassKind;
import java.util.List;

/**
 * One fixed pipeline pass.
 *
 * @param number position in the pipeline, contiguous from 0
 * @param key function name requested from the generative service
 * @param kind research, extraction or narrative
 * @param description progress message shown while the pass runs
 * @param progress static progress percentage reported while the pass runs
 * @param dependencies lower-numbered passes whose outputs form the pass context
 * @param maxTokens token budget of one generation
 * @param temperature sampling temperature (variance budget)
 * @param sectionKey report section written by a narrative pass, null otherwise
 * @param minWords minimum word count of the narrative section, 0 otherwise
 */
public record PassDefinition(
        int number,
        String key,
        PassKind kind,
        String description,
        int progress,
        List<Integer> dependencies,
        int maxTokens,
        double temperature,
        String sectionKey,
        int minWords) {

    public PassDefinition {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    /** Only the research pass may ask the service for real-time research. */
    public boolean allowsResearch() {
        return kind == PassKind.RESEARCH;
    }

    public boolean isNarrative() {
        return kind == PassKind.NARRATIVE;
    }

    /** Narrative passes also receive the calculation engine output as authoritative values. */
    public boolean needsEngineOutput() {
        return kind == PassKind.NARRATIVE;
    }
}
