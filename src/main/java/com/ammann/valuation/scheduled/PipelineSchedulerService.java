/* (C)2026 */
package com.ammann.valuation.scheduled;

import com.ammann.valuation.config.ExecutorProducer;
import com.ammann.valuation.pipeline.AdvanceResult;
import com.ammann.valuation.pipeline.PipelineOrchestrator;
import com.ammann.valuation.pipeline.PipelineStore;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.jboss.logging.Logger;

/**
 * Drives processing reports forward without a client polling them, and fails reports that
 * stopped making progress.
 *
 * <p>Advancing is safe to overlap with client {@code advance} calls: the in-flight job id stored
 * on the report lets only one caller start a pass.
 */
@ApplicationScoped
public class PipelineSchedulerService {

    private static final Logger LOG = Logger.getLogger(PipelineSchedulerService.class);

    @Inject PipelineStore store;

    @Inject PipelineOrchestrator orchestrator;

    @Inject
    @Named(ExecutorProducer.PIPELINE_EXECUTOR)
    ManagedExecutor executor;

    @ConfigProperty(name = "valuation.pipeline.batch-size", defaultValue = "20")
    int batchSize;

    @ConfigProperty(name = "valuation.pipeline.stuck-timeout", defaultValue = "2h")
    Duration stuckTimeout;

    /**
     * Advances up to {@code batch-size} processing reports, oldest progress first, in parallel.
     *
     * @return number of reports advanced without error
     */
    @Scheduled(
            every = "${valuation.pipeline.advance-interval}",
            identity = "pipeline-advance",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public int advanceProcessingReports() {
        List<UUID> ids = store.findProcessing(batchSize);
        if (ids.isEmpty()) {
            return 0;
        }

        List<CompletableFuture<Boolean>> futures = new ArrayList<>(ids.size());
        for (UUID id : ids) {
            futures.add(executor.supplyAsync(() -> advanceOne(id)));
        }
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();

        int advanced = (int) futures.stream().filter(CompletableFuture::join).count();
        LOG.debugf("Scheduler advanced %d of %d processing reports", advanced, ids.size());
        return advanced;
    }

    /**
     * Watchdog: fails processing reports whose last progress is older than the stuck timeout.
     */
    @Scheduled(every = "10m", identity = "pipeline-watchdog")
    public int detectStuckReports() {
        Instant threshold = Instant.now().minus(stuckTimeout);
        int failed = store.failStuck(
                threshold, "Report made no progress for " + stuckTimeout.toMinutes() + " minutes");
        if (failed > 0) {
            LOG.warnf("Watchdog: marked %d stuck reports as FAILED (no progress since %s)", failed, threshold);
        }
        return failed;
    }

    boolean advanceOne(UUID reportId) {
        try {
            AdvanceResult result = orchestrator.advance(reportId);
            LOG.debugf("Report %s: %s (pass %d, %d%%)",
                    reportId, result.status(), result.pass(), result.progress());
            return true;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Scheduled advance of report %s failed", reportId);
            return false;
        }
    }
}
