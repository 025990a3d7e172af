/* (C)2026 */
package com.ammann.valuation.startup;

import com.ammann.valuation.pass.PassRegistry;
import com.ammann.valuation.pipeline.PipelineStore;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import java.util.List;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * Checks persisted pipeline state on application startup.
 * <p>
 * Processing reports survive a restart: their progress and any in-flight job id are stored, so
 * the next advance resumes them. Only reports whose current pass points beyond the registry, for
 * example after the pass list shrank between deployments, cannot resume and are failed.
 */
@ApplicationScoped
public class PipelineRecoveryService {

    private static final Logger LOG = Logger.getLogger(PipelineRecoveryService.class);

    static final int RESUME_LOG_LIMIT = 100;

    @Inject PipelineStore store;

    @Inject PassRegistry registry;

    void onStart(@Observes StartupEvent event) {
        recover();
    }

    /**
     * @return number of reports failed because they cannot resume
     */
    public int recover() {
        LOG.info("Pipeline recovery: checking processing reports...");

        int failed = store.failBeyondPass(
                registry.lastPassNumber(),
                "Report state points beyond pass " + registry.lastPassNumber() + " and cannot resume");
        if (failed > 0) {
            LOG.warnf("Pipeline recovery: marked %d reports as FAILED (pass beyond registry)", failed);
        }

        List<UUID> resumable = store.findProcessing(RESUME_LOG_LIMIT);
        if (resumable.isEmpty()) {
            LOG.info("Pipeline recovery: no processing reports to resume");
        } else {
            LOG.infof("Pipeline recovery: %d processing reports will resume on the next advance", resumable.size());
        }
        return failed;
    }
}
