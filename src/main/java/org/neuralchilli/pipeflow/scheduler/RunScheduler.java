package org.neuralchilli.pipeflow.scheduler;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.pipeflow.core.ExpressionContext;
import org.neuralchilli.pipeflow.domain.PipelineRun;
import org.neuralchilli.pipeflow.domain.PipelineRunConditionCheckStatus;
import org.neuralchilli.pipeflow.domain.PipelineRunTaskRunStatus;
import org.neuralchilli.pipeflow.domain.PipelineSpec;
import org.neuralchilli.pipeflow.domain.TaskRun;
import org.neuralchilli.pipeflow.domain.TaskRunStatus;
import org.neuralchilli.pipeflow.resolution.PipelineRunState;
import org.neuralchilli.pipeflow.resolution.ResolvedConditionCheck;
import org.neuralchilli.pipeflow.resolution.ResolvedPipelineTask;
import org.neuralchilli.pipeflow.resolution.RunExpressionContexts;
import org.neuralchilli.pipeflow.store.ControlPlane;
import org.neuralchilli.pipeflow.store.NotFoundException;
import org.neuralchilli.pipeflow.store.OwnedObjects;
import org.neuralchilli.pipeflow.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Decides, for each pipeline task, whether to wait, run its condition checks, create its
 * task-run, retry it, or leave it alone, and carries the decision out against the store.
 */
@ApplicationScoped
public class RunScheduler {

    private static final Logger log = LoggerFactory.getLogger(RunScheduler.class);

    private final ControlPlane controlPlane;
    private final TaskRunFactory factory;

    @Inject
    public RunScheduler(ControlPlane controlPlane, TaskRunFactory factory) {
        this.controlPlane = controlPlane;
        this.factory = factory;
    }

    /**
     * Start every runnable task and retry every retryable one.
     * Nothing new starts once a task has failed for good.
     *
     * @return the state with created and retried task-runs filled in
     */
    public PipelineRunState schedule(PipelineRun run, PipelineSpec spec, PipelineRunState state,
                                     ExpressionContext runContext, boolean artifactStorage, Instant now) {
        if (state.failure().isPresent()) {
            log.debug("Run {} has a failed task, not starting anything", run.metadata().key());
            return state;
        }

        ExpressionContext context = RunExpressionContexts.withResults(runContext, state);
        PipelineRunState current = state;

        for (ResolvedPipelineTask task : state.nextToRun()) {
            current = current.with(start(run, spec, task, context, artifactStorage, now));
        }
        for (ResolvedPipelineTask task : state.retryable()) {
            current = current.with(retry(run, task, now));
        }
        return current;
    }

    /**
     * Ask every unfinished task-run and condition check recorded in the run status to stop.
     *
     * @return one message per child that could not be patched, empty on success
     */
    public List<String> cancelChildren(PipelineRun run) {
        List<String> errors = new ArrayList<>();
        Map<String, PipelineRunTaskRunStatus> recorded = new TreeMap<>(run.status().taskRuns());

        for (Map.Entry<String, PipelineRunTaskRunStatus> entry : recorded.entrySet()) {
            if (!isDone(entry.getValue().status())) {
                cancel(run, entry.getKey(), errors);
            }
            Map<String, PipelineRunConditionCheckStatus> checks = new TreeMap<>(entry.getValue().conditionChecks());
            for (Map.Entry<String, PipelineRunConditionCheckStatus> check : checks.entrySet()) {
                if (!isDone(check.getValue().status())) {
                    cancel(run, check.getKey(), errors);
                }
            }
        }
        return errors;
    }

    private ResolvedPipelineTask start(PipelineRun run, PipelineSpec spec, ResolvedPipelineTask task,
                                       ExpressionContext context, boolean artifactStorage, Instant now) {
        ResolvedPipelineTask current = task;

        if (task.hasConditions()) {
            List<ResolvedConditionCheck> checks = new ArrayList<>();
            for (ResolvedConditionCheck check : task.conditionChecks()) {
                if (check.isStarted()) {
                    checks.add(check);
                    continue;
                }
                TaskRun created = create(run, factory.forConditionCheck(run, task, check, context, now));
                log.info("Created condition check {} for pipeline task {} of run {}",
                        created.name(), task.name(), run.metadata().key());
                checks.add(check.withCheckRun(created));
            }
            current = current.withConditionChecks(checks);
            if (!current.conditionChecksSucceeded()) {
                return current;
            }
        }

        TaskRun created = create(run, factory.forTask(run, spec, current, context, artifactStorage, now));
        log.info("Created task-run {} for pipeline task {} of run {}", created.name(), task.name(), run.metadata().key());
        return current.withTaskRun(created);
    }

    private ResolvedPipelineTask retry(PipelineRun run, ResolvedPipelineTask task, Instant now) {
        TaskRun failed = task.taskRun();
        TaskRun retried = controlPlane.taskRuns().update(failed.withStatus(failed.status().forRetry(now)));
        log.info("Retrying task-run {} of run {} (attempt {} of {})", retried.name(), run.metadata().key(),
                retried.status().retriesStatus().size() + 1, task.pipelineTask().retries() + 1);
        return task.withTaskRun(retried);
    }

    private TaskRun create(PipelineRun run, TaskRun taskRun) {
        return OwnedObjects.createOrAdopt(controlPlane.taskRuns(), taskRun, run.metadata().uid());
    }

    private void cancel(PipelineRun run, String taskRunName, List<String> errors) {
        try {
            controlPlane.taskRuns().patch(run.namespace(), taskRunName,
                    tr -> tr.spec().isCancelled() ? tr : tr.withSpec(tr.spec().cancelled()));
            log.debug("Cancelled task-run {} of run {}", taskRunName, run.metadata().key());
        } catch (NotFoundException e) {
            log.debug("Task-run {} of run {} does not exist, nothing to cancel", taskRunName, run.metadata().key());
        } catch (StoreException e) {
            log.warn("Failed to cancel task-run {} of run {}: {}", taskRunName, run.metadata().key(), e.getMessage());
            errors.add(taskRunName + ": " + e.getMessage());
        }
    }

    private static boolean isDone(TaskRunStatus status) {
        return status != null && status.isDone();
    }
}
