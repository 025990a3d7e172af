/* (C)2026 */
package com.ammann.valuation.enumeration;

/**
 * Category of a pipeline pass.
 */
public enum PassKind {
    /** Background research; the only kind allowed to request real-time research */
    RESEARCH,
    /** Structured extraction of financial facts */
    EXTRACTION,
    /** Narrative report section */
    NARRATIVE
}
