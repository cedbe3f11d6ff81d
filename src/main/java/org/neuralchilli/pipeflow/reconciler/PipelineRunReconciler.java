package org.neuralchilli.pipeflow.reconciler;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.pipeflow.config.ReconcilerConfig;
import org.neuralchilli.pipeflow.core.DefinitionException;
import org.neuralchilli.pipeflow.core.ExpressionContext;
import org.neuralchilli.pipeflow.core.GraphResolver;
import org.neuralchilli.pipeflow.core.PipelineDag;
import org.neuralchilli.pipeflow.domain.Labels;
import org.neuralchilli.pipeflow.domain.PipelineRun;
import org.neuralchilli.pipeflow.domain.PipelineRunReason;
import org.neuralchilli.pipeflow.domain.PipelineRunStatus;
import org.neuralchilli.pipeflow.domain.PipelineSpec;
import org.neuralchilli.pipeflow.domain.StatusCondition;
import org.neuralchilli.pipeflow.resolution.BindingResolver;
import org.neuralchilli.pipeflow.resolution.PipelineRunState;
import org.neuralchilli.pipeflow.resolution.RunExpressionContexts;
import org.neuralchilli.pipeflow.scheduler.RunScheduler;
import org.neuralchilli.pipeflow.service.PipelineRunValidator;
import org.neuralchilli.pipeflow.status.OrphanRecovery;
import org.neuralchilli.pipeflow.status.StatusAggregator;
import org.neuralchilli.pipeflow.store.ControlPlane;
import org.neuralchilli.pipeflow.store.ObjectKey;
import org.neuralchilli.pipeflow.store.StoreException;
import org.neuralchilli.pipeflow.workspace.ResourceLinker;
import org.neuralchilli.pipeflow.workspace.WorkspaceLinker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Drives one pipeline run a single step towards a terminal state.
 *
 * Each pass re-derives everything from the control plane:
 *
 * 1. Terminal runs and unknown keys are ignored
 * 2. Cancelled runs cancel their children and stop
 * 3. The pipeline is resolved, validated and turned into a graph
 * 4. Orphaned task-runs are put back into the status
 * 5. Timed-out runs cancel their children and stop
 * 6. Volume claims are created, ready tasks are started, failed ones retried
 * 7. The status is aggregated and written at most once
 */
@ApplicationScoped
public class PipelineRunReconciler {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunReconciler.class);

    private final ControlPlane controlPlane;
    private final BindingResolver bindings;
    private final PipelineRunValidator validator;
    private final GraphResolver graphs;
    private final RunScheduler scheduler;
    private final StatusAggregator aggregator;
    private final OrphanRecovery orphans;
    private final ResourceLinker resourceLinker;
    private final WorkspaceLinker workspaceLinker;
    private final ReconcilerConfig config;
    private final Clock clock;

    @Inject
    public PipelineRunReconciler(ControlPlane controlPlane, BindingResolver bindings, PipelineRunValidator validator,
                                 GraphResolver graphs, RunScheduler scheduler, StatusAggregator aggregator,
                                 OrphanRecovery orphans, ResourceLinker resourceLinker, WorkspaceLinker workspaceLinker,
                                 ReconcilerConfig config, Clock clock) {
        this.controlPlane = controlPlane;
        this.bindings = bindings;
        this.validator = validator;
        this.graphs = graphs;
        this.scheduler = scheduler;
        this.aggregator = aggregator;
        this.orphans = orphans;
        this.resourceLinker = resourceLinker;
        this.workspaceLinker = workspaceLinker;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Run one pass for the run stored under {@code namespace/name}.
     * Malformed keys and deleted or finished runs are no-ops.
     *
     * @throws ReconcileException if the pass should be retried
     */
    public void reconcile(String key) {
        ObjectKey objectKey = ObjectKey.parse(key);
        if (objectKey == null) {
            log.warn("Ignoring malformed pipeline run key: {}", key);
            return;
        }

        PipelineRun original;
        try {
            original = controlPlane.pipelineRuns().get(objectKey.namespace(), objectKey.name());
        } catch (StoreException e) {
            throw new ReconcileException("Failed to read pipeline run " + key, e);
        }
        if (original == null) {
            log.debug("Pipeline run {} no longer exists", key);
            return;
        }
        if (original.isDone()) {
            log.debug("Pipeline run {} already finished: {}", key, original.status().condition().reason());
            return;
        }

        Instant now = clock.instant();
        PipelineRun run = original;
        if (!run.hasStarted()) {
            run = run.withStatus(run.status().withStartTime(now));
        }

        try {
            run = reconcileRun(original, run, now);
        } catch (DefinitionException e) {
            log.warn("Pipeline run {} failed: {} ({})", key, e.getMessage(), e.reason());
            StatusCondition failed = StatusCondition.failed(e.reason().reason(), e.getMessage(), now);
            run = run.withStatus(StatusAggregator.transition(run.status(), failed, now));
        } catch (StoreException e) {
            throw new ReconcileException("Failed to reconcile pipeline run " + key + ": " + e.getMessage(), e);
        }

        writeStatus(original, run);
    }

    private PipelineRun reconcileRun(PipelineRun original, PipelineRun run, Instant now) {
        if (run.isCancelled()) {
            return cancel(original, run, now);
        }

        PipelineSpec spec = bindings.resolvePipeline(run);
        run = run.withMetadata(run.metadata().withLabel(Labels.PIPELINE, run.pipelineName()));
        if (run.status().pipelineSpec() == null) {
            run = run.withStatus(run.status().withPipelineSpec(spec));
        }

        validator.validatePipeline(run.pipelineName(), spec);
        PipelineDag dag = graphs.build(spec);
        validator.validateBindings(run, spec);

        run = run.withStatus(run.status().withTaskRuns(orphans.recover(run, spec)));
        PipelineRunState state = bindings.resolve(run, spec, dag);
        ExpressionContext runContext = RunExpressionContexts.forRun(run, spec);

        if (run.isTimedOut(now, config.defaultTimeout())) {
            return timeOut(run, spec, state, runContext, now);
        }

        boolean artifactStorage = resourceLinker.ensureArtifactClaim(run, spec);
        workspaceLinker.ensureClaims(run, spec);

        PipelineRunState scheduled = scheduler.schedule(run, spec, state, runContext, artifactStorage, now);
        PipelineRunStatus status = aggregator.aggregate(run, spec, run.status(), scheduled, runContext, now);
        if (status.isDone()) {
            log.info("Pipeline run {} finished: {}", run.metadata().key(), status.condition().reason());
        }
        return run.withStatus(status);
    }

    private PipelineRun cancel(PipelineRun original, PipelineRun run, Instant now) {
        run = run.withStatus(run.status().withTaskRuns(orphans.recover(run, run.status().pipelineSpec())));
        List<String> errors = scheduler.cancelChildren(run);

        if (!errors.isEmpty()) {
            String message = String.format("PipelineRun %s was cancelled but had errors trying to cancel TaskRuns: %s",
                    run.name(), String.join("\n", errors));
            StatusCondition couldntCancel = StatusCondition.unknown(PipelineRunReason.COULDNT_CANCEL.reason(), message, now);
            writeStatus(original, run.withStatus(StatusAggregator.transition(run.status(), couldntCancel, now)));
            throw new ReconcileException(message);
        }

        log.info("Pipeline run {} cancelled", run.metadata().key());
        StatusCondition cancelled = StatusCondition.failed(PipelineRunReason.CANCELLED.reason(),
                String.format("PipelineRun %s was cancelled", run.name()), now);
        return run.withStatus(StatusAggregator.transition(run.status(), cancelled, now));
    }

    private PipelineRun timeOut(PipelineRun run, PipelineSpec spec, PipelineRunState state,
                                ExpressionContext runContext, Instant now) {
        List<String> errors = scheduler.cancelChildren(run);
        if (!errors.isEmpty()) {
            throw new ReconcileException(String.format("Failed to cancel task-runs of timed out PipelineRun %s: %s",
                    run.name(), String.join("\n", errors)));
        }

        Duration timeout = run.timeout(config.defaultTimeout());
        log.info("Pipeline run {} timed out after {}", run.metadata().key(), timeout);
        PipelineRunStatus status = aggregator.aggregate(run, spec, run.status(), state, runContext, now);
        StatusCondition timedOut = StatusCondition.failed(PipelineRunReason.TIMED_OUT.reason(),
                String.format("PipelineRun %s failed to finish within %s", run.name(), timeout), now);
        return run.withStatus(StatusAggregator.transition(status, timedOut, now));
    }

    private void writeStatus(PipelineRun original, PipelineRun updated) {
        if (updated.equals(original)) {
            log.debug("Pipeline run {} unchanged", original.metadata().key());
            return;
        }
        try {
            controlPlane.pipelineRuns().update(updated);
        } catch (StoreException e) {
            throw new ReconcileException("Failed to update pipeline run " + original.metadata().key()
                    + ": " + e.getMessage(), e);
        }
    }
}
