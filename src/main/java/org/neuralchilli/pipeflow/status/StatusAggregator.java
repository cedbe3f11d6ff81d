package org.neuralchilli.pipeflow.status;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.pipeflow.core.ExpressionContext;
import org.neuralchilli.pipeflow.domain.PipelineRun;
import org.neuralchilli.pipeflow.domain.PipelineRunConditionCheckStatus;
import org.neuralchilli.pipeflow.domain.PipelineRunReason;
import org.neuralchilli.pipeflow.domain.PipelineRunResult;
import org.neuralchilli.pipeflow.domain.PipelineRunStatus;
import org.neuralchilli.pipeflow.domain.PipelineRunTaskRunStatus;
import org.neuralchilli.pipeflow.domain.PipelineSpec;
import org.neuralchilli.pipeflow.domain.StatusCondition;
import org.neuralchilli.pipeflow.domain.TaskRunReason;
import org.neuralchilli.pipeflow.domain.TaskRunStatus;
import org.neuralchilli.pipeflow.resolution.PipelineRunState;
import org.neuralchilli.pipeflow.resolution.ResolvedConditionCheck;
import org.neuralchilli.pipeflow.resolution.ResolvedPipelineTask;
import org.neuralchilli.pipeflow.resolution.RunExpressionContexts;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Folds the observed task-runs of a pass into the run status and derives the run condition.
 */
@ApplicationScoped
public class StatusAggregator {

    static final String RUNNING_MESSAGE = "Not all Tasks in the Pipeline have finished executing";
    static final String SUCCEEDED_MESSAGE = "All Tasks have completed executing";

    private final PipelineResults pipelineResults;

    @Inject
    public StatusAggregator(PipelineResults pipelineResults) {
        this.pipelineResults = pipelineResults;
    }

    /**
     * @param current status with orphans already recovered
     */
    public PipelineRunStatus aggregate(PipelineRun run, PipelineSpec spec, PipelineRunStatus current,
                                       PipelineRunState state, ExpressionContext runContext, Instant now) {
        PipelineRunStatus status = current.withTaskRuns(mergeLive(run, current.taskRuns(), state, now));

        Optional<ResolvedPipelineTask> failure = state.failure();
        if (failure.isPresent()) {
            return transition(status, StatusCondition.failed(PipelineRunReason.FAILED.reason(),
                    String.format("TaskRun %s has failed", failure.get().taskRunName()), now), now);
        }
        if (state.isComplete()) {
            List<PipelineRunResult> results = pipelineResults.evaluate(spec.results(),
                    RunExpressionContexts.withResults(runContext, state));
            return transition(status.withPipelineResults(results),
                    StatusCondition.succeeded(PipelineRunReason.SUCCEEDED.reason(), SUCCEEDED_MESSAGE, now), now);
        }
        return transition(status, StatusCondition.unknown(PipelineRunReason.RUNNING.reason(), RUNNING_MESSAGE, now), now);
    }

    /**
     * Apply {@code next}, keeping the current condition (and its transition time) when nothing changed,
     * and stamping the completion time on the first terminal condition.
     */
    public static PipelineRunStatus transition(PipelineRunStatus status, StatusCondition next, Instant now) {
        StatusCondition effective = next.sameState(status.condition()) ? status.condition() : next;
        PipelineRunStatus updated = status.withCondition(effective);
        if (effective.status().isTerminal() && updated.completionTime() == null) {
            updated = updated.withCompletionTime(now);
        }
        return updated;
    }

    static Map<String, PipelineRunTaskRunStatus> mergeLive(PipelineRun run, Map<String, PipelineRunTaskRunStatus> recorded,
                                                          PipelineRunState state, Instant now) {
        Map<String, PipelineRunTaskRunStatus> result = new HashMap<>(recorded);

        for (ResolvedPipelineTask task : state.tasks()) {
            boolean anyCheckStarted = task.conditionChecks().stream().anyMatch(ResolvedConditionCheck::isStarted);
            PipelineRunTaskRunStatus entry = result.get(task.taskRunName());
            if (entry == null && !task.isStarted() && !anyCheckStarted) {
                continue;
            }
            if (entry == null) {
                entry = PipelineRunTaskRunStatus.of(task.name(), null);
            }

            if (task.isStarted()) {
                entry = entry.withStatus(task.taskRun().status());
            }
            for (ResolvedConditionCheck check : task.conditionChecks()) {
                if (check.isStarted()) {
                    entry = entry.withConditionCheck(check.checkName(),
                            new PipelineRunConditionCheckStatus(check.registerName(), check.checkRun().status()));
                }
            }
            if (!task.isStarted() && task.isConditionCheckFailure()) {
                entry = entry.withStatus(conditionCheckFailed(run, task, entry.status(), now));
            }
            result.put(task.taskRunName(), entry);
        }
        return result;
    }

    private static TaskRunStatus conditionCheckFailed(PipelineRun run, ResolvedPipelineTask task,
                                                      TaskRunStatus recorded, Instant now) {
        StatusCondition failed = StatusCondition.failed(TaskRunReason.CONDITION_CHECK_FAILED,
                String.format("ConditionChecks failed for Task %s in PipelineRun %s", task.taskRunName(), run.name()), now);
        if (recorded != null && failed.sameState(recorded.condition())) {
            return recorded;
        }
        return TaskRunStatus.of(failed);
    }
}
