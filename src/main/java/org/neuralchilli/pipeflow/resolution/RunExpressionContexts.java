package org.neuralchilli.pipeflow.resolution;

import org.neuralchilli.pipeflow.core.ExpressionContext;
import org.neuralchilli.pipeflow.domain.Param;
import org.neuralchilli.pipeflow.domain.ParamSpec;
import org.neuralchilli.pipeflow.domain.PipelineRun;
import org.neuralchilli.pipeflow.domain.PipelineSpec;
import org.neuralchilli.pipeflow.domain.TaskRunResult;

/**
 * Builds the values {@code $(...)} references of a run resolve against.
 */
public final class RunExpressionContexts {

    private RunExpressionContexts() {
    }

    /**
     * Pipeline param defaults overridden by the run's params, plus the run and pipeline context.
     */
    public static ExpressionContext forRun(PipelineRun run, PipelineSpec spec) {
        ExpressionContext.Builder builder = ExpressionContext.builder();
        for (ParamSpec param : spec.params()) {
            if (param.hasDefault()) {
                builder.param(param.name(), param.defaultValue());
            }
        }
        for (Param param : run.spec().params()) {
            builder.param(param.name(), param.value());
        }
        return builder
                .context("pipelineRun.name", run.name())
                .context("pipelineRun.namespace", run.namespace())
                .context("pipelineRun.uid", run.metadata().uid())
                .context("pipeline.name", run.pipelineName())
                .build();
    }

    /**
     * {@code base} plus the results of every task that has succeeded.
     */
    public static ExpressionContext withResults(ExpressionContext base, PipelineRunState state) {
        ExpressionContext.Builder builder = base.extend();
        for (ResolvedPipelineTask task : state.tasks()) {
            if (!task.isSuccessful()) {
                continue;
            }
            for (TaskRunResult result : task.taskRun().status().taskResults()) {
                builder.taskResult(task.name(), result.name(), result.value());
            }
        }
        return builder.build();
    }
}
