/* (C)2026 */
package com.ammann.valuation.pipeline;

import com.ammann.valuation.client.GenerativeTextClient;
import com.ammann.valuation.client.JobRequest;
import com.ammann.valuation.client.RunHandle;
import com.ammann.valuation.client.RunSnapshot;
import com.ammann.valuation.client.ToolCall;
import com.ammann.valuation.client.ToolOutput;
import com.ammann.valuation.enumeration.RunStatus;
import com.ammann.valuation.exception.GenerativeServiceException;
import com.ammann.valuation.exception.ReportNotFoundException;
import com.ammann.valuation.exception.ValidationException;
import com.ammann.valuation.parser.ParsedResponse;
import com.ammann.valuation.parser.ResponseParser;
import com.ammann.valuation.pass.PassDefinition;
import com.ammann.valuation.pass.PassRegistry;
import com.ammann.valuation.pass.StoredPassOutput;
import com.ammann.valuation.pipeline.PipelineAction.CompletePass;
import com.ammann.valuation.pipeline.PipelineAction.Finalize;
import com.ammann.valuation.pipeline.PipelineAction.MarkFailed;
import com.ammann.valuation.pipeline.PipelineAction.Poll;
import com.ammann.valuation.pipeline.PipelineAction.Respond;
import com.ammann.valuation.pipeline.PipelineAction.StartPass;
import com.ammann.valuation.pipeline.PipelineAction.SubmitToolOutputs;
import com.ammann.valuation.service.FinalizationOutcome;
import com.ammann.valuation.service.ReportFinalizationService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.control.ActivateRequestContext;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Drives reports through the passes, one unit of progress per {@link #advance(UUID)} call.
 *
 * <p>The orchestrator holds no state between calls: every call loads the report, asks
 * {@link PipelineStateMachine} what to do, executes that action against the generative service
 * or the datastore and feeds the outcome back until the machine responds. A restarted process
 * therefore resumes exactly where the datastore says the report is.
 *
 * <p>Concurrent callers are safe: a start claim is taken before a job is submitted, so only one
 * caller submits each pass, and recording a pass is a compare-and-set update whose loser discards
 * its own work.
 */
@ApplicationScoped
public class PipelineOrchestrator {

    private static final Logger LOG = Logger.getLogger(PipelineOrchestrator.class);

    /** Upper bound of actions per call; a single call needs at most five. */
    static final int MAX_STEPS = 12;
    static final String TOOL_ACKNOWLEDGEMENT = "{\"success\":true}";

    private final PipelineStore store;
    private final GenerativeTextClient client;
    private final PassRegistry registry;
    private final PassContextBuilder contextBuilder;
    private final ResponseParser parser;
    private final ReportFinalizationService finalizer;
    private final PipelineStateMachine machine;
    private final PollBackoff backoff;
    private final PollBackoff.Sleeper sleeper;

    private final Counter passesStarted;
    private final Counter passesCompleted;
    private final Counter reportsFailed;
    private final Counter transientFailures;

    @Inject
    public PipelineOrchestrator(
            PipelineStore store,
            GenerativeTextClient client,
            PassRegistry registry,
            PassContextBuilder contextBuilder,
            ResponseParser parser,
            ReportFinalizationService finalizer,
            MeterRegistry meterRegistry,
            @ConfigProperty(name = "valuation.pipeline.max-transient-failures", defaultValue = "10")
                    int maxTransientFailures,
            @ConfigProperty(name = "valuation.pipeline.poll.base-delay", defaultValue = "500ms")
                    Duration pollBaseDelay,
            @ConfigProperty(name = "valuation.pipeline.poll.multiplier", defaultValue = "2.0")
                    double pollMultiplier,
            @ConfigProperty(name = "valuation.pipeline.poll.max-delay", defaultValue = "8s")
                    Duration pollMaxDelay,
            @ConfigProperty(name = "valuation.pipeline.poll.max-attempts", defaultValue = "4")
                    int pollMaxAttempts) {
        this(store, client, registry, contextBuilder, parser, finalizer, meterRegistry,
                new PipelineStateMachine(registry.size(), maxTransientFailures),
                new PollBackoff(pollBaseDelay, pollMultiplier, pollMaxDelay, pollMaxAttempts),
                duration -> Thread.sleep(duration.toMillis()));
    }

    PipelineOrchestrator(
            PipelineStore store,
            GenerativeTextClient client,
            PassRegistry registry,
            PassContextBuilder contextBuilder,
            ResponseParser parser,
            ReportFinalizationService finalizer,
            MeterRegistry meterRegistry,
            PipelineStateMachine machine,
            PollBackoff backoff,
            PollBackoff.Sleeper sleeper) {
        this.store = store;
        this.client = client;
        this.registry = registry;
        this.contextBuilder = contextBuilder;
        this.parser = parser;
        this.finalizer = finalizer;
        this.machine = machine;
        this.backoff = backoff;
        this.sleeper = sleeper;
        this.passesStarted = Counter.builder("valuation_passes_started_total")
                .description("Pass jobs started on the generative service")
                .register(meterRegistry);
        this.passesCompleted = Counter.builder("valuation_passes_completed_total")
                .description("Pass outputs durably recorded")
                .register(meterRegistry);
        this.reportsFailed = Counter.builder("valuation_reports_failed_total")
                .description("Reports marked failed by the pipeline")
                .register(meterRegistry);
        this.transientFailures = Counter.builder("valuation_transient_failures_total")
                .description("Transient generative service errors while starting, polling or submitting")
                .register(meterRegistry);
    }

    /**
     * Moves the report by at most one unit of progress.
     *
     * @throws ReportNotFoundException if the report does not exist
     */
    @ActivateRequestContext
    public AdvanceResult advance(UUID reportId) {
        PipelineState state = store.load(reportId).orElseThrow(() -> new ReportNotFoundException(reportId));
        PipelineEvent event = new PipelineEvent.Advance();
        for (int step = 0; step < MAX_STEPS; step++) {
            Transition transition = machine.transition(state, event);
            if (transition.state().transientFailures() != state.transientFailures()) {
                store.updateTransientFailures(reportId, transition.state().transientFailures());
            }
            state = transition.state();
            if (transition.action() instanceof Respond respond) {
                return toResult(state, respond);
            }
            event = execute(state, transition.action());
        }
        throw new IllegalStateException(
                "Pipeline of report " + reportId + " did not settle within " + MAX_STEPS + " steps");
    }

    PipelineEvent execute(PipelineState state, PipelineAction action) {
        if (action instanceof StartPass start) {
            return startPass(state, start.passNumber());
        }
        if (action instanceof Poll poll) {
            return poll(state, poll.handle(), poll.afterSubmit());
        }
        if (action instanceof SubmitToolOutputs submit) {
            return submitToolOutputs(state, submit);
        }
        if (action instanceof CompletePass complete) {
            return completePass(state, complete);
        }
        if (action instanceof Finalize) {
            return finalizeReport(state);
        }
        if (action instanceof MarkFailed failed) {
            return markFailed(state.reportId(), failed.reason());
        }
        throw new IllegalArgumentException("Unhandled pipeline action: " + action);
    }

    private PipelineEvent startPass(PipelineState state, int passNumber) {
        PassDefinition pass = registry.get(passNumber);
        JobRequest request = contextBuilder.build(passNumber, state.companyName(), store.loadOutputs(state.reportId()));
        String claim = "claim-" + UUID.randomUUID();
        if (!store.tryClaimStart(state.reportId(), state.currentPass(), claim)) {
            LOG.infof("Pass %d of report %s is being started by another caller", passNumber, state.reportId());
            return new PipelineEvent.JobStartLost();
        }

        RunHandle handle;
        try {
            handle = client.startRun(request);
        } catch (GenerativeServiceException e) {
            store.releaseClaim(state.reportId(), claim);
            transientFailures.increment();
            LOG.warnf("Could not start pass %d (%s) for report %s: %s",
                    passNumber, pass.key(), state.reportId(), e.getMessage());
            return new PipelineEvent.StartFailed(e.getMessage());
        }

        if (!store.recordStartedJob(state.reportId(), claim, handle)) {
            LOG.infof("Report %s changed while pass %d was starting, cancelling run %s",
                    state.reportId(), passNumber, handle.runId());
            cancelDuplicate(handle);
            return new PipelineEvent.JobStartLost();
        }
        passesStarted.increment();
        LOG.infof("Started pass %d (%s) for report %s as run %s",
                passNumber, pass.key(), state.reportId(), handle.runId());
        return new PipelineEvent.JobStarted(handle);
    }

    private PipelineEvent poll(PipelineState state, RunHandle handle, boolean afterSubmit) {
        RunSnapshot latest = null;
        GenerativeServiceException lastError = null;
        for (int attempt = 0; attempt < backoff.maxAttempts(); attempt++) {
            if (attempt > 0 && !pause(backoff.delayAfter(attempt - 1))) {
                break;
            }
            try {
                latest = client.getRun(handle);
                if (latest.status() != RunStatus.QUEUED && latest.status() != RunStatus.IN_PROGRESS) {
                    return new PipelineEvent.Polled(latest, afterSubmit);
                }
            } catch (GenerativeServiceException e) {
                lastError = e;
                LOG.debugf("Poll %d of run %s failed: %s", attempt + 1, handle.runId(), e.getMessage());
            }
        }
        if (latest != null) {
            return new PipelineEvent.Polled(latest, afterSubmit);
        }
        transientFailures.increment();
        String reason = lastError != null ? lastError.getMessage() : "polling interrupted";
        LOG.warnf("Could not retrieve run %s of report %s: %s", handle.runId(), state.reportId(), reason);
        return new PipelineEvent.PollFailed(reason);
    }

    private PipelineEvent submitToolOutputs(PipelineState state, SubmitToolOutputs submit) {
        PassDefinition pass = registry.get(submit.passNumber());
        ToolCall call = submit.toolCalls().stream()
                .filter(c -> pass.key().equals(c.functionName()))
                .findFirst()
                .orElse(submit.toolCalls().get(0));

        boolean staged = false;
        ParsedResponse parsed = parser.parse(call.arguments(), pass.kind());
        if (parsed.succeeded()) {
            store.stageOutput(state.reportId(), submit.handle().runId(), toStored(pass.number(), parsed));
            staged = true;
        } else {
            LOG.warnf("Arguments of %s for report %s could not be parsed, waiting for the final response",
                    call.functionName(), state.reportId());
        }

        List<ToolOutput> acknowledgements = submit.toolCalls().stream()
                .map(c -> new ToolOutput(c.id(), TOOL_ACKNOWLEDGEMENT))
                .toList();
        try {
            RunSnapshot snapshot = client.submitToolOutputs(submit.handle(), acknowledgements);
            return new PipelineEvent.ToolOutputsSubmitted(snapshot, staged);
        } catch (GenerativeServiceException e) {
            transientFailures.increment();
            LOG.warnf("Could not submit tool outputs of run %s: %s", submit.handle().runId(), e.getMessage());
            return new PipelineEvent.ToolSubmitFailed(e.getMessage());
        }
    }

    private PipelineEvent completePass(PipelineState state, CompletePass complete) {
        PassDefinition pass = registry.get(complete.passNumber());
        String runId = complete.handle().runId();
        boolean recorded;
        if (complete.outputStaged()) {
            recorded = store.tryCompletePass(state.reportId(), pass.number(), runId);
        } else {
            Optional<String> text;
            try {
                text = client.latestResponseText(complete.handle());
            } catch (GenerativeServiceException e) {
                transientFailures.increment();
                return new PipelineEvent.PollFailed(e.getMessage());
            }
            if (text.isEmpty() || text.get().isBlank()) {
                return markFailed(state.reportId(),
                        "Pass " + pass.number() + " (" + pass.key() + ") completed without a response");
            }
            ParsedResponse parsed = parser.parse(text.get(), pass.kind());
            if (!parsed.succeeded()) {
                return markFailed(state.reportId(),
                        "Pass " + pass.number() + " (" + pass.key() + ") returned output that could not be parsed");
            }
            recorded = store.completePassWithOutput(state.reportId(), runId, toStored(pass.number(), parsed));
        }

        if (!recorded) {
            LOG.infof("Pass %d of report %s was already recorded by another caller", pass.number(), state.reportId());
            return new PipelineEvent.PassCompletionLost(pass.number());
        }
        passesCompleted.increment();
        LOG.infof("Completed pass %d (%s) for report %s", pass.number(), pass.key(), state.reportId());
        return new PipelineEvent.PassCompleted(pass.number());
    }

    private PipelineEvent finalizeReport(PipelineState state) {
        FinalizationOutcome outcome;
        try {
            outcome = finalizer.finalizeReport(state.reportId(), state.companyName());
        } catch (ValidationException e) {
            return markFailed(state.reportId(), "Calculation failed: " + e.getMessage());
        }
        if (outcome.blocked()) {
            return new PipelineEvent.FinalizationBlocked(outcome.gates());
        }
        return new PipelineEvent.Finalized(outcome.gates(), outcome.engine().finalConcludedValue());
    }

    private PipelineEvent markFailed(UUID reportId, String reason) {
        store.markFailed(reportId, reason);
        reportsFailed.increment();
        LOG.warnf("Report %s failed: %s", reportId, reason);
        return new PipelineEvent.Failed(reason);
    }

    private void cancelDuplicate(RunHandle handle) {
        try {
            client.cancelRun(handle);
        } catch (GenerativeServiceException e) {
            LOG.warnf("Could not cancel duplicate run %s: %s", handle.runId(), e.getMessage());
        }
    }

    private boolean pause(Duration delay) {
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Polling interrupted");
            return false;
        }
    }

    private AdvanceResult toResult(PipelineState state, Respond respond) {
        return new AdvanceResult(
                state.status(),
                state.currentPass(),
                registry.size(),
                registry.progressFor(state.status(), state.currentPass(), state.hasJobInFlight()),
                respond.message(),
                respond.gates());
    }

    private static StoredPassOutput toStored(int passNumber, ParsedResponse parsed) {
        return new StoredPassOutput(passNumber, parsed.data().toString(), parsed.attempt());
    }
}
