/* (C)2026 */
package com.ammann.valuation.enumeration;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ReportStatusTest {

    @Test
    void terminalStatuses() {
        assertThat(ReportStatus.PENDING.isTerminal()).isFalse();
        assertThat(ReportStatus.PROCESSING.isTerminal()).isFalse();
        assertThat(ReportStatus.COMPLETED.isTerminal()).isTrue();
        assertThat(ReportStatus.FAILED.isTerminal()).isTrue();
        assertThat(ReportStatus.CANCELLED.isTerminal()).isTrue();
    }

    @Test
    void wireNameIsLowerCase() {
        assertThat(ReportStatus.PROCESSING.wireName()).isEqualTo("processing");
        assertThat(ReportStatus.CANCELLED.wireName()).isEqualTo("cancelled");
    }
}
