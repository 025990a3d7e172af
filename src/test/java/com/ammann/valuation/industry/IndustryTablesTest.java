/* (C)2026 */
package com.ammann.valuation.industry;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.valuation.calculation.model.IndustryMultiples;
import com.ammann.valuation.enumeration.EarningsMetric;
import org.junit.jupiter.api.Test;

class IndustryTablesTest {

    @Test
    void engineeringMultiplesAreListed() {
        IndustryMultiples multiples = IndustryMultiplesTable.lookup(" 541330 ");

        assertThat(multiples.industryName()).isEqualTo("Engineering Services");
        assertThat(multiples.rangeFor(EarningsMetric.SDE).median()).isEqualTo(2.65);
        assertThat(multiples.rangeFor(EarningsMetric.SDE).ceiling()).isEqualTo(4.2);
        assertThat(IndustryMultiplesTable.isKnown("541330")).isTrue();
    }

    @Test
    void unknownCodesFallBackToGeneralBusiness() {
        assertThat(IndustryMultiplesTable.lookup("999999")).isEqualTo(IndustryMultiplesTable.general());
        assertThat(IndustryMultiplesTable.lookup(null)).isEqualTo(IndustryMultiplesTable.general());
        assertThat(IndustryMultiplesTable.general().sde().ceiling()).isEqualTo(5.0);
        assertThat(IndustryMultiplesTable.isKnown(null)).isFalse();
    }

    @Test
    void keywordBlocklistsAreKeyedByNaics() {
        assertThat(IndustryKeywordCatalog.blockedKeywords("541330")).contains("car wash", "hvac", "restaurant");
        assertThat(IndustryKeywordCatalog.blockedKeywords("722511")).contains("engineering");
        assertThat(IndustryKeywordCatalog.blockedKeywords("999999")).isEmpty();
        assertThat(IndustryKeywordCatalog.blockedKeywords(null)).isEmpty();
    }
}
