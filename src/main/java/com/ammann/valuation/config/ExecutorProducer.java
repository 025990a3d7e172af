/* (C)2026 */
package com.ammann.valuation.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for the executor the scheduler uses to advance reports in parallel.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>valuation.pipeline.executor.max-async</li>
 *   <li>valuation.pipeline.executor.max-queued</li>
 * </ul>
 */
@ApplicationScoped
public class ExecutorProducer {

    public static final String PIPELINE_EXECUTOR = "pipeline-executor";

    @ConfigProperty(name = "valuation.pipeline.executor.max-async", defaultValue = "4")
    int maxAsync;

    @ConfigProperty(name = "valuation.pipeline.executor.max-queued", defaultValue = "50")
    int maxQueued;

    @Produces
    @Named(PIPELINE_EXECUTOR)
    @ApplicationScoped
    public ManagedExecutor createPipelineExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(maxAsync)
                .maxQueued(maxQueued)
                .propagated(ThreadContext.ALL_REMAINING)
                .cleared(ThreadContext.TRANSACTION)
                .build();
    }
}
