package org.neuralchilli.pipeflow.scheduler;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.pipeflow.config.ReconcilerConfig;
import org.neuralchilli.pipeflow.core.DefinitionException;
import org.neuralchilli.pipeflow.core.ExpressionContext;
import org.neuralchilli.pipeflow.core.ExpressionEvaluator;
import org.neuralchilli.pipeflow.core.ResultReference;
import org.neuralchilli.pipeflow.domain.ConditionSpec;
import org.neuralchilli.pipeflow.domain.Labels;
import org.neuralchilli.pipeflow.domain.ObjectMeta;
import org.neuralchilli.pipeflow.domain.OwnerReference;
import org.neuralchilli.pipeflow.domain.Param;
import org.neuralchilli.pipeflow.domain.ParamSpec;
import org.neuralchilli.pipeflow.domain.PipelineRun;
import org.neuralchilli.pipeflow.domain.PipelineRunReason;
import org.neuralchilli.pipeflow.domain.PipelineSpec;
import org.neuralchilli.pipeflow.domain.PipelineTask;
import org.neuralchilli.pipeflow.domain.PipelineTaskCondition;
import org.neuralchilli.pipeflow.domain.PipelineTaskInputResource;
import org.neuralchilli.pipeflow.domain.Step;
import org.neuralchilli.pipeflow.domain.TaskRef;
import org.neuralchilli.pipeflow.domain.TaskResourceBinding;
import org.neuralchilli.pipeflow.domain.TaskResources;
import org.neuralchilli.pipeflow.domain.TaskRun;
import org.neuralchilli.pipeflow.domain.TaskRunResources;
import org.neuralchilli.pipeflow.domain.TaskRunSpec;
import org.neuralchilli.pipeflow.domain.TaskRunStatus;
import org.neuralchilli.pipeflow.domain.TaskSpec;
import org.neuralchilli.pipeflow.resolution.ResolvedConditionCheck;
import org.neuralchilli.pipeflow.resolution.ResolvedPipelineTask;
import org.neuralchilli.pipeflow.resolution.ResolvedResource;
import org.neuralchilli.pipeflow.workspace.ResourceLinker;
import org.neuralchilli.pipeflow.workspace.WorkspaceLinker;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the task-run objects for pipeline tasks and their condition checks.
 */
@ApplicationScoped
public class TaskRunFactory {

    static final String CHECK_STEP_PREFIX = "condition-check-";
    static final String RESOURCE_ROOT = "/workspace/";

    private final ExpressionEvaluator expressions;
    private final ResourceLinker resourceLinker;
    private final WorkspaceLinker workspaceLinker;
    private final ReconcilerConfig config;

    @Inject
    public TaskRunFactory(ExpressionEvaluator expressions, ResourceLinker resourceLinker,
                          WorkspaceLinker workspaceLinker, ReconcilerConfig config) {
        this.expressions = expressions;
        this.resourceLinker = resourceLinker;
        this.workspaceLinker = workspaceLinker;
        this.config = config;
    }

    /**
     * @param context params, run context and the results of finished tasks
     * @throws DefinitionException if a referenced result was never produced
     */
    public TaskRun forTask(PipelineRun run, PipelineSpec spec, ResolvedPipelineTask task, ExpressionContext context,
                           boolean artifactStorage, Instant now) {
        PipelineTask pipelineTask = task.pipelineTask();
        requireResults(run, pipelineTask.name(), pipelineTask.params(), context);

        TaskRunSpec taskRunSpec = new TaskRunSpec(
                pipelineTask.taskRef(),
                expressions.evaluateParams(pipelineTask.params(), context),
                resourceLinker.bind(spec, task, artifactStorage),
                serviceAccount(run, pipelineTask.name()),
                TaskRunTimeouts.forTask(run, pipelineTask, now, config.defaultTimeout()),
                workspaceLinker.bind(run, pipelineTask),
                null
        );
        ObjectMeta metadata = childMetadata(run, task.taskRunName(), labels(run, pipelineTask.name()));
        return new TaskRun(metadata, taskRunSpec, TaskRunStatus.EMPTY);
    }

    /**
     * A check is a task-run with a single inline step taken from the condition.
     */
    public TaskRun forConditionCheck(PipelineRun run, ResolvedPipelineTask task, ResolvedConditionCheck check,
                                     ExpressionContext context, Instant now) {
        PipelineTaskCondition taskCondition = check.pipelineTaskCondition();
        requireResults(run, task.name(), taskCondition.params(), context);
        List<Param> params = expressions.evaluateParams(taskCondition.params(), context);

        ConditionSpec conditionSpec = check.condition().spec();
        ExpressionContext checkContext = conditionContext(conditionSpec, params, check.resources());
        Step declared = conditionSpec.check();
        Step step = new Step(
                CHECK_STEP_PREFIX + check.conditionName(),
                declared.image() != null && !declared.image().isBlank() ? declared.image() : config.shellImage(),
                expressions.evaluate(declared.command(), checkContext),
                expressions.evaluate(declared.args(), checkContext),
                expressions.evaluate(declared.script(), checkContext)
        );
        TaskSpec checkSpec = new TaskSpec(
                conditionSpec.description(),
                conditionSpec.params(),
                new TaskResources(conditionSpec.resources(), List.of()),
                List.of(),
                List.of(step),
                List.of()
        );

        List<TaskResourceBinding> inputs = new ArrayList<>();
        for (PipelineTaskInputResource input : taskCondition.resources()) {
            ResolvedResource resource = check.resources().get(input.name());
            inputs.add(resource.resourceRef() != null
                    ? new TaskResourceBinding(input.name(), resource.resourceRef(), null, List.of())
                    : new TaskResourceBinding(input.name(), null, resource.spec(), List.of()));
        }

        TaskRunSpec taskRunSpec = new TaskRunSpec(
                TaskRef.inline(checkSpec),
                params,
                new TaskRunResources(inputs, List.of()),
                serviceAccount(run, task.name()),
                TaskRunTimeouts.forTask(run, task.pipelineTask(), now, config.defaultTimeout()),
                List.of(),
                null
        );

        Map<String, String> labels = labels(run, task.name());
        labels.put(Labels.CONDITION_CHECK, check.checkName());
        labels.put(Labels.CONDITION_NAME, check.conditionName());
        return new TaskRun(childMetadata(run, check.checkName(), labels), taskRunSpec, TaskRunStatus.EMPTY);
    }

    /**
     * Run labels plus the pipeline, run and pipeline task labels.
     */
    static Map<String, String> labels(PipelineRun run, String pipelineTask) {
        Map<String, String> labels = new HashMap<>(run.metadata().labels());
        labels.put(Labels.PIPELINE, run.pipelineName());
        labels.put(Labels.PIPELINE_RUN, run.name());
        labels.put(Labels.PIPELINE_TASK, pipelineTask);
        return labels;
    }

    private String serviceAccount(PipelineRun run, String pipelineTask) {
        String account = run.spec().serviceAccountFor(pipelineTask);
        return account != null && !account.isBlank() ? account : config.defaultServiceAccount();
    }

    private static ObjectMeta childMetadata(PipelineRun run, String name, Map<String, String> labels) {
        return ObjectMeta.of(run.namespace(), name)
                .withLabels(labels)
                .withAnnotations(run.metadata().annotations())
                .withOwnerReferences(List.of(OwnerReference.controllerOf(run)));
    }

    private void requireResults(PipelineRun run, String pipelineTask, List<Param> params, ExpressionContext context) {
        for (ResultReference reference : expressions.resultReferences(params)) {
            if (!context.contains(reference.expression())) {
                throw new DefinitionException(PipelineRunReason.INVALID_TASK_RESULT_REFERENCE, String.format(
                        "Invalid task result reference %s in pipeline task %s of PipelineRun %s: task %s did not produce result %s",
                        reference, pipelineTask, run.name(), reference.pipelineTask(), reference.result()));
            }
        }
    }

    // Condition params shadow pipeline params inside the check step
    private static ExpressionContext conditionContext(ConditionSpec spec, List<Param> params,
                                                      Map<String, ResolvedResource> resources) {
        ExpressionContext.Builder builder = ExpressionContext.builder();
        for (ParamSpec param : spec.params()) {
            if (param.hasDefault()) {
                builder.param(param.name(), param.defaultValue());
            }
        }
        builder.params(params);
        resources.forEach((name, resource) -> {
            builder.resource(name, "path", RESOURCE_ROOT + name);
            resource.spec().params().forEach((key, value) -> builder.resource(name, key, value));
        });
        return builder.build();
    }
}
