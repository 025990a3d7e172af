/* (C)2026 */
package com.ammann.valuation.industry;

import com.ammann.valuation.calculation.model.IndustryMultiples;
import com.ammann.valuation.calculation.model.MultipleRange;
import java.util.Map;

/**
 * Static market multiples by NAICS code. Unknown codes resolve to a general business range.
 */
public final class IndustryMultiplesTable {

    public static final String GENERAL_NAICS = "000000";
    static final String SOURCE = "Business Reference Guide";

    private static final IndustryMultiples GENERAL = entry(GENERAL_NAICS, "General Business",
            range(1.5, 2.5, 3.5, 5.0), range(3, 4, 5, 6), range(0.30, 0.45, 0.60, 0.72));

    private static final Map<String, IndustryMultiples> TABLE = Map.ofEntries(
            Map.entry("541330", entry("541330", "Engineering Services",
                    range(2.0, 2.65, 3.5, 4.2), range(3, 4.5, 6, 7.2), range(0.30, 0.45, 0.60, 0.72))),
            Map.entry("541211", entry("541211", "Offices of Certified Public Accountants",
                    range(2.5, 3.0, 3.5, 4.2), range(4, 5, 6, 7.2), range(0.40, 0.75, 1.25, 1.5))),
            Map.entry("541810", entry("541810", "Advertising Agencies",
                    range(2, 3, 4, 4.8), range(3, 4.5, 6, 7.2), range(0.40, 0.55, 0.75, 0.9))),
            Map.entry("541310", entry("541310", "Architectural Services",
                    range(2, 2.5, 3, 3.6), range(3, 4, 5, 6), range(0.40, 0.50, 0.60, 0.72))),
            Map.entry("541511", entry("541511", "Custom Computer Programming Services",
                    range(3, 5, 8, 9.6), range(6, 10, 15, 18), range(1, 2, 3, 3.6))),
            Map.entry("722511", entry("722511", "Full-Service Restaurants",
                    range(2.5, 3, 3.5, 4.2), range(3, 4, 5, 6), range(0.30, 0.35, 0.40, 0.48))),
            Map.entry("238220", entry("238220", "Plumbing, Heating, and Air-Conditioning Contractors",
                    range(2.5, 3, 3.5, 4.2), range(3, 4, 5, 6), range(0.40, 0.50, 0.60, 0.72))),
            Map.entry("511210", entry("511210", "Software Publishers (SaaS)",
                    range(5, 7, 10, 12), range(8, 12, 20, 24), range(3, 6, 10, 12))),
            Map.entry("621210", entry("621210", "Offices of Dentists",
                    range(3, 3.5, 4, 4.8), range(5, 6, 7, 8.4), range(0.60, 0.70, 0.80, 0.96))),
            Map.entry("524210", entry("524210", "Insurance Agencies and Brokerages",
                    range(3, 4, 5, 6), range(5, 6.5, 8, 9.6), range(1, 1.25, 1.5, 1.8))));

    private IndustryMultiplesTable() {}

    /**
     * Multiples for the code, or the general business entry when the code is null or unknown.
     */
    public static IndustryMultiples lookup(String naicsCode) {
        if (naicsCode == null) {
            return GENERAL;
        }
        return TABLE.getOrDefault(naicsCode.trim(), GENERAL);
    }

    public static boolean isKnown(String naicsCode) {
        return naicsCode != null && TABLE.containsKey(naicsCode.trim());
    }

    public static IndustryMultiples general() {
        return GENERAL;
    }

    private static IndustryMultiples entry(
            String code, String name, MultipleRange sde, MultipleRange ebitda, MultipleRange revenue) {
        return new IndustryMultiples(code, name, sde, ebitda, revenue);
    }

    private static MultipleRange range(double low, double median, double high, double ceiling) {
        return new MultipleRange(low, median, high, ceiling, SOURCE);
    }
}
