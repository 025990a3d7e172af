/* (C)2026 */
package com.ammann.valuation.pass;

import com.ammann.valuation.calculation.CalculationMath;
import com.ammann.valuation.calculation.model.BalanceSheet;
import com.ammann.valuation.calculation.model.FairValueAdjustment;
import com.ammann.valuation.calculation.model.FinancialInputs;
import com.ammann.valuation.calculation.model.FiscalYearFinancials;
import com.ammann.valuation.calculation.model.RiskFactor;
import com.ammann.valuation.calculation.model.RiskProfile;
import com.ammann.valuation.industry.IndustryMultiplesTable;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the extraction passes into the calculation engine's inputs.
 */
@ApplicationScoped
public class FinancialInputsAssembler {

    static final double RISK_PREMIUM_PER_POINT = 0.015;
    static final double MAX_COMPANY_RISK_PREMIUM = 0.06;
    static final double NEUTRAL_RISK_SCORE = 3;

    public FinancialInputs assemble(PassOutputs outputs, String fallbackCompanyName) {
        CoreCompanyData core = outputs.coreCompanyData().orElse(null);
        CompanyBackground background = outputs.companyBackground().orElse(null);

        String companyName = firstNonBlank(
                core != null ? core.companyName() : null,
                background != null ? background.companyName() : null,
                fallbackCompanyName);
        String naicsCode = firstNonBlank(
                core != null ? core.naicsCode() : null,
                background != null ? background.naicsCode() : null,
                IndustryMultiplesTable.GENERAL_NAICS);

        return new FinancialInputs(
                companyName,
                naicsCode,
                periods(outputs),
                balanceSheet(outputs.balanceSheet().orElse(null)),
                core != null ? core.totalAssets() : null,
                IndustryMultiplesTable.lookup(naicsCode),
                risk(outputs.businessMetrics().orElse(null)));
    }

    List<FiscalYearFinancials> periods(PassOutputs outputs) {
        List<IncomeStatementDetails.Period> statements = outputs.incomeStatements()
                .map(IncomeStatementDetails::periods)
                .orElse(List.of());

        Map<Integer, SpecialItems.AddBack> addBacks = new HashMap<>();
        outputs.specialItems().ifPresent(items -> items.addBacks().stream()
                .filter(a -> a.fiscalYear() != null)
                .forEach(a -> addBacks.merge(a.fiscalYear(), a, FinancialInputsAssembler::sum)));

        List<FiscalYearFinancials> periods = new ArrayList<>();
        for (IncomeStatementDetails.Period statement : statements) {
            if (statement.fiscalYear() == null) {
                continue;
            }
            FiscalYearFinancials period = new FiscalYearFinancials(
                    statement.fiscalYear(),
                    value(statement.grossReceipts()),
                    value(statement.costOfGoodsSold()),
                    value(statement.netIncome()),
                    value(statement.officerCompensation()),
                    value(statement.interestExpense()),
                    value(statement.depreciation()),
                    value(statement.amortization()),
                    value(statement.incomeTax()),
                    0, 0, 0, 0, 0, 0);
            SpecialItems.AddBack addBack = addBacks.get(statement.fiscalYear());
            if (addBack != null) {
                period = period.withAddBacks(
                        value(addBack.nonRecurring()),
                        value(addBack.personal()),
                        value(addBack.charitable()),
                        value(addBack.meals()),
                        value(addBack.auto()),
                        value(addBack.discretionary()));
            }
            periods.add(period);
        }
        return periods;
    }

    BalanceSheet balanceSheet(BalanceSheetDetails details) {
        if (details == null || details.totalAssets() == null) {
            return null;
        }
        List<FairValueAdjustment> adjustments = details.fairValueAdjustments().stream()
                .filter(a -> a.bookValue() != null && a.fairValue() != null)
                .map(a -> new FairValueAdjustment(a.item(), a.isLiability(), a.bookValue(), a.fairValue()))
                .toList();
        return new BalanceSheet(
                value(details.cash()),
                value(details.accountsReceivable()),
                value(details.allowanceForDoubtfulAccounts()),
                value(details.inventory()),
                value(details.totalCurrentAssets()),
                value(details.totalAssets()),
                value(details.totalCurrentLiabilities()),
                value(details.totalLiabilities()),
                value(details.totalEquity()),
                adjustments);
    }

    RiskProfile risk(BusinessMetrics metrics) {
        if (metrics == null) {
            return RiskProfile.empty();
        }
        List<RiskFactor> factors = metrics.riskFactors().stream()
                .map(f -> new RiskFactor(
                        f.category() != null ? f.category() : "Unknown",
                        f.score() != null ? f.score() : 5,
                        f.rating() != null ? f.rating() : "Moderate",
                        value(f.impactOnMultiple()),
                        f.description() != null ? f.description() : ""))
                .toList();

        Double companyPremium = metrics.companySpecificRiskPremium();
        if (companyPremium == null && metrics.overallRiskScore() != null) {
            companyPremium = CalculationMath.clamp(
                    (metrics.overallRiskScore() - NEUTRAL_RISK_SCORE) * RISK_PREMIUM_PER_POINT,
                    0,
                    MAX_COMPANY_RISK_PREMIUM);
        }
        return new RiskProfile(factors, companyPremium, metrics.industryRiskPremium());
    }

    private static SpecialItems.AddBack sum(SpecialItems.AddBack a, SpecialItems.AddBack b) {
        return new SpecialItems.AddBack(
                a.fiscalYear(),
                value(a.nonRecurring()) + value(b.nonRecurring()),
                value(a.personal()) + value(b.personal()),
                value(a.charitable()) + value(b.charitable()),
                value(a.meals()) + value(b.meals()),
                value(a.auto()) + value(b.auto()),
                value(a.discretionary()) + value(b.discretionary()));
    }

    private static double value(Double value) {
        return value == null || value.isNaN() ? 0 : value;
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate.trim();
            }
        }
        return null;
    }
}
