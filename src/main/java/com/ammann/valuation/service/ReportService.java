/* (C)2026 */
package com.ammann.valuation.service;

import com.ammann.valuation.dto.ReportDTO;
import com.ammann.valuation.dto.ReportStatusDTO;
import com.ammann.valuation.enumeration.ReportStatus;
import com.ammann.valuation.exception.ReportNotFoundException;
import com.ammann.valuation.exception.ReportStateException;
import com.ammann.valuation.model.ValuationReport;
import com.ammann.valuation.pass.PassDefinition;
import com.ammann.valuation.pass.PassRegistry;
import com.ammann.valuation.pipeline.PipelineStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import java.util.List;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * Report lifecycle outside the pipeline: creation, lookup, status and cancellation.
 */
@ApplicationScoped
public class ReportService {

    private static final Logger LOG = Logger.getLogger(ReportService.class);

    private final PassRegistry registry;
    private final PipelineStore store;

    @Inject
    public ReportService(PassRegistry registry, PipelineStore store) {
        this.registry = registry;
        this.store = store;
    }

    @Transactional
    public ReportDTO create(String companyName) {
        ValuationReport report = new ValuationReport();
        report.companyName = companyName.trim();
        report.persist();
        LOG.infof("Created report %s for '%s'", report.id, report.companyName);
        return ReportDTO.from(report, registry);
    }

    @Transactional
    public ReportDTO get(UUID reportId) {
        return ReportDTO.from(find(reportId), registry);
    }

    @Transactional
    public List<ReportDTO> recent(int limit) {
        return ValuationReport.findRecent(limit).stream()
                .map(r -> ReportDTO.from(r, registry))
                .toList();
    }

    @Transactional
    public ReportStatusDTO status(UUID reportId) {
        ValuationReport report = find(reportId);
        boolean inFlight = report.inFlight() != null;
        boolean blocked = Boolean.TRUE.equals(report.blocked);
        return new ReportStatusDTO(
                report.status.wireName(),
                report.currentPass,
                registry.size(),
                registry.progressFor(report.status, report.currentPass, inFlight),
                message(report, inFlight),
                report.concludedValue,
                report.errorMessage,
                blocked ? Boolean.TRUE : null,
                blocked ? report.blockHint : null);
    }

    /**
     * Cancels a pending or processing report. A job already running on the generative service
     * is left to finish; later advance calls do nothing.
     *
     * @throws ReportStateException if the report already reached a terminal status
     */
    public ReportDTO cancel(UUID reportId) {
        if (statusOf(reportId).isTerminal() || !store.markCancelled(reportId)) {
            throw new ReportStateException(
                    "Report " + reportId + " is " + statusOf(reportId).wireName() + " and cannot be cancelled");
        }
        LOG.infof("Cancelled report %s", reportId);
        return get(reportId);
    }

    String message(ValuationReport report, boolean inFlight) {
        return switch (report.status) {
            case PENDING -> "Waiting to start";
            case PROCESSING -> {
                if (inFlight) {
                    yield registry.find(report.currentPass + 1)
                            .map(PassDefinition::description)
                            .orElse("Processing");
                }
                yield report.currentPass >= registry.lastPassNumber()
                        ? "Finalizing valuation..."
                        : "Pass " + report.currentPass + " complete";
            }
            case COMPLETED -> "Valuation report completed";
            case CANCELLED -> "Report cancelled";
            default -> Boolean.TRUE.equals(report.blocked) ? "Finalization blocked" : "Report failed";
        };
    }

    @Transactional
    ReportStatus statusOf(UUID reportId) {
        return find(reportId).status;
    }

    private static ValuationReport find(UUID reportId) {
        ValuationReport report = ValuationReport.findById(reportId);
        if (report == null) {
            throw new ReportNotFoundException(reportId);
        }
        return report;
    }
}
