/* (C)2026 */
package com.ammann.valuation.pass;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Typed pass outputs of one report, keyed by pass number.
 */
public final class PassOutputs {

    private final Map<Integer, PassOutput> outputs;

    public PassOutputs(Map<Integer, PassOutput> outputs) {
        this.outputs = Collections.unmodifiableMap(new TreeMap<>(outputs));
    }

    public static PassOutputs empty() {
        return new PassOutputs(Map.of());
    }

    public Optional<PassOutput> get(int passNumber) {
        return Optional.ofNullable(outputs.get(passNumber));
    }

    public boolean has(int passNumber) {
        return outputs.containsKey(passNumber);
    }

    public List<Integer> passNumbers() {
        return List.copyOf(outputs.keySet());
    }

    public Map<Integer, PassOutput> asMap() {
        return outputs;
    }

    public Optional<CompanyBackground> companyBackground() {
        return typed(CompanyBackground.class);
    }

    public Optional<CoreCompanyData> coreCompanyData() {
        return typed(CoreCompanyData.class);
    }

    public Optional<IncomeStatementDetails> incomeStatements() {
        return typed(IncomeStatementDetails.class);
    }

    public Optional<BalanceSheetDetails> balanceSheet() {
        return typed(BalanceSheetDetails.class);
    }

    public Optional<SpecialItems> specialItems() {
        return typed(SpecialItems.class);
    }

    public Optional<BusinessMetrics> businessMetrics() {
        return typed(BusinessMetrics.class);
    }

    /**
     * Narrative sections in pass order, keyed by section key.
     */
    public Map<String, NarrativeSection> narrativeSections() {
        Map<String, NarrativeSection> sections = new LinkedHashMap<>();
        for (PassOutput output : outputs.values()) {
            if (output instanceof NarrativeSection section) {
                sections.put(section.sectionKey(), section);
            }
        }
        return sections;
    }

    private <T extends PassOutput> Optional<T> typed(Class<T> type) {
        return outputs.values().stream().filter(type::isInstance).map(type::cast).findFirst();
    }
}
