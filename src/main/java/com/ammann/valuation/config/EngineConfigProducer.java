/* (C)2026 */
package com.ammann.valuation.config;

import com.ammann.valuation.calculation.EngineConfig;
import com.ammann.valuation.enumeration.MultiplePosition;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Produces the engine configuration from {@code valuation.engine.*}. Validated once at
 * startup so a bad weight table fails fast instead of on the first finalization.
 */
@ApplicationScoped
public class EngineConfigProducer {

    private static final Logger LOG = Logger.getLogger(EngineConfigProducer.class);

    @ConfigProperty(name = "valuation.engine.weight.asset", defaultValue = "0.20")
    double assetWeight;

    @ConfigProperty(name = "valuation.engine.weight.income", defaultValue = "0.40")
    double incomeWeight;

    @ConfigProperty(name = "valuation.engine.weight.market", defaultValue = "0.40")
    double marketWeight;

    @ConfigProperty(name = "valuation.engine.risk-free-rate", defaultValue = "0.045")
    double riskFreeRate;

    @ConfigProperty(name = "valuation.engine.equity-risk-premium", defaultValue = "0.055")
    double equityRiskPremium;

    @ConfigProperty(name = "valuation.engine.size-premium", defaultValue = "0.04")
    double sizePremium;

    @ConfigProperty(name = "valuation.engine.industry-premium", defaultValue = "0.02")
    double industryPremium;

    @ConfigProperty(name = "valuation.engine.company-specific-premium", defaultValue = "0.03")
    double companySpecificPremium;

    @ConfigProperty(name = "valuation.engine.long-term-growth", defaultValue = "0.025")
    double longTermGrowth;

    @ConfigProperty(name = "valuation.engine.min-cap-rate", defaultValue = "0.10")
    double minCapRate;

    @ConfigProperty(name = "valuation.engine.dlom.enabled", defaultValue = "true")
    boolean dlomEnabled;

    @ConfigProperty(name = "valuation.engine.dlom.rate", defaultValue = "0.15")
    double dlomRate;

    @ConfigProperty(name = "valuation.engine.dloc.enabled", defaultValue = "false")
    boolean dlocEnabled;

    @ConfigProperty(name = "valuation.engine.dloc.rate", defaultValue = "0.0")
    double dlocRate;

    @ConfigProperty(name = "valuation.engine.control-premium", defaultValue = "0.0")
    double controlPremium;

    @ConfigProperty(name = "valuation.engine.multiple-position", defaultValue = "MEDIAN")
    MultiplePosition multiplePosition;

    @ConfigProperty(name = "valuation.engine.fair-market-salary", defaultValue = "75000")
    double fairMarketSalary;

    @ConfigProperty(name = "valuation.engine.range-fallback-percent", defaultValue = "0.15")
    double rangeFallbackPercent;

    @ConfigProperty(name = "valuation.engine.range-min-percent", defaultValue = "0.05")
    double rangeMinPercent;

    @ConfigProperty(name = "valuation.engine.range-max-percent", defaultValue = "0.35")
    double rangeMaxPercent;

    @Produces
    @Singleton
    public EngineConfig engineConfig() {
        EngineConfig config = new EngineConfig(
                assetWeight, incomeWeight, marketWeight,
                riskFreeRate, equityRiskPremium, sizePremium, industryPremium,
                companySpecificPremium, longTermGrowth, minCapRate,
                dlomEnabled, dlomRate, dlocEnabled, dlocRate, controlPremium,
                multiplePosition, fairMarketSalary,
                rangeFallbackPercent, rangeMinPercent, rangeMaxPercent);
        config.validate();
        LOG.infof("Engine weights asset=%.2f income=%.2f market=%.2f, DLOM %s at %.2f, range fallback %.2f",
                assetWeight, incomeWeight, marketWeight, dlomEnabled ? "on" : "off", dlomRate, rangeFallbackPercent);
        return config;
    }
}
