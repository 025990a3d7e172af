/* (C)2026 */
package com.ammann.valuation.industry;

import java.util.List;
import java.util.Map;

/**
 * Terms that must not appear in a report classified under a given NAICS code. A hit usually
 * means the narrative drifted into another industry's template.
 */
public final class IndustryKeywordCatalog {

    private static final Map<String, List<String>> BLOCKLIST = Map.of(
            "541330", List.of(
                    "hvac", "heating", "ventilation", "air conditioning", "plumbing", "plumber",
                    "electrician", "electrical contractor", "restaurant", "food service", "catering",
                    "bakery", "cafe", "bar", "tavern", "retail store", "retail shop", "convenience store",
                    "grocery", "hair salon", "beauty salon", "barber", "spa", "nail salon", "massage",
                    "medical practice", "dental practice", "dentist", "physician", "clinic",
                    "healthcare provider", "veterinary", "veterinarian", "law firm", "legal services",
                    "attorney", "accounting firm", "cpa firm", "bookkeeper", "roofing", "roofer",
                    "landscaping", "landscaper", "painting contractor", "flooring", "carpet installation",
                    "auto repair", "car wash", "auto body", "tire shop", "gym", "fitness center",
                    "yoga studio", "martial arts", "hotel", "motel", "bed and breakfast", "inn"),
            "541211", List.of(
                    "restaurant", "food service", "retail", "manufacturing", "hvac", "plumbing",
                    "construction", "medical", "dental", "engineering"),
            "722511", List.of(
                    "engineering", "consulting", "law firm", "accounting", "dental", "medical",
                    "software", "manufacturing", "construction"),
            "238220", List.of(
                    "restaurant", "food service", "retail", "software", "law firm", "accounting",
                    "dental", "medical", "engineering services"),
            "541511", List.of(
                    "restaurant", "food service", "retail", "hvac", "plumbing", "dental", "medical",
                    "law firm", "accounting"));

    private IndustryKeywordCatalog() {}

    /** Blocked keywords for the code, empty when none are defined. */
    public static List<String> blockedKeywords(String naicsCode) {
        if (naicsCode == null) {
            return List.of();
        }
        return BLOCKLIST.getOrDefault(naicsCode.trim(), List.of());
    }
}
