package org.neuralchilli.pipeflow.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.pipeflow.core.DefinitionException;
import org.neuralchilli.pipeflow.core.ExpressionContext;
import org.neuralchilli.pipeflow.core.ExpressionEvaluator;
import org.neuralchilli.pipeflow.domain.Param;
import org.neuralchilli.pipeflow.domain.ParamSpec;
import org.neuralchilli.pipeflow.domain.PipelineResourceBinding;
import org.neuralchilli.pipeflow.domain.PipelineResult;
import org.neuralchilli.pipeflow.domain.PipelineRun;
import org.neuralchilli.pipeflow.domain.PipelineSpec;
import org.neuralchilli.pipeflow.domain.PipelineTask;
import org.neuralchilli.pipeflow.domain.PipelineTaskCondition;
import org.neuralchilli.pipeflow.domain.PipelineTaskInputResource;
import org.neuralchilli.pipeflow.domain.PipelineTaskOutputResource;
import org.neuralchilli.pipeflow.domain.PipelineRunReason;
import org.neuralchilli.pipeflow.domain.ResourceDeclaration;
import org.neuralchilli.pipeflow.domain.TaskServiceAccount;
import org.neuralchilli.pipeflow.domain.TaskSpec;
import org.neuralchilli.pipeflow.domain.WorkspaceDeclaration;
import org.neuralchilli.pipeflow.domain.WorkspacePipelineTaskBinding;
import org.neuralchilli.pipeflow.util.Names;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Admission-style checks of a pipeline and of the bindings a run supplies for it.
 * Every failure is a {@link DefinitionException}; the reason tells which rule failed.
 */
@ApplicationScoped
public class PipelineRunValidator {

    private final ExpressionEvaluator expressions;

    @Inject
    public PipelineRunValidator(ExpressionEvaluator expressions) {
        this.expressions = expressions;
    }

    /**
     * Structure of the pipeline itself: names, references between tasks, declared
     * resources, params and workspaces.
     *
     * @throws DefinitionException with reason FailedValidation
     */
    public void validatePipeline(String pipelineName, PipelineSpec spec) {
        List<String> errors = new ArrayList<>();

        if (spec.tasks().isEmpty()) {
            errors.add("pipeline must have at least one task");
        }

        Set<String> taskNames = new HashSet<>();
        for (PipelineTask task : spec.tasks()) {
            if (!Names.isDnsLabel(task.name())) {
                errors.add("pipeline task name '" + task.name() + "' must be a valid DNS label");
            }
            if (!taskNames.add(task.name())) {
                errors.add("pipeline task name '" + task.name() + "' is used more than once");
            }
        }

        Set<String> resources = spec.resources().stream().map(ResourceDeclaration::name).collect(Collectors.toSet());
        Set<String> params = spec.params().stream().map(ParamSpec::name).collect(Collectors.toSet());
        Set<String> workspaces = spec.workspaces().stream().map(WorkspaceDeclaration::name).collect(Collectors.toSet());

        for (PipelineTask task : spec.tasks()) {
            validateTaskReferences(task, taskNames, errors);
            validateResourceReferences(task, resources, errors);
            validateParamReferences(task.name(), task.params(), params, errors);
            for (PipelineTaskCondition condition : task.conditions()) {
                validateParamReferences(task.name(), condition.params(), params, errors);
            }
            for (WorkspacePipelineTaskBinding workspace : task.workspaces()) {
                if (!workspaces.contains(workspace.workspace())) {
                    errors.add("pipeline task '" + task.name() + "' uses workspace '" + workspace.workspace()
                            + "' which the pipeline does not declare");
                }
            }
        }

        for (PipelineResult result : spec.results()) {
            expressions.resultReferences(result.value()).stream()
                    .filter(ref -> !taskNames.contains(ref.pipelineTask()))
                    .forEach(ref -> errors.add("pipeline result '" + result.name() + "' refers to unknown task '"
                            + ref.pipelineTask() + "'"));
        }

        if (!errors.isEmpty()) {
            throw new DefinitionException(PipelineRunReason.FAILED_VALIDATION,
                    "Pipeline " + pipelineName + " can't be Run; it has an invalid spec: " + String.join("; ", errors));
        }
    }

    /**
     * Resources, params, workspaces and service accounts a run binds for its pipeline.
     */
    public void validateBindings(PipelineRun run, PipelineSpec spec) {
        String runName = run.name();
        String pipelineName = run.pipelineName();

        // Resources
        List<String> missingResources = new ArrayList<>();
        for (ResourceDeclaration declared : spec.resources()) {
            if (!declared.optional() && run.spec().resource(declared.name()) == null) {
                missingResources.add(declared.name());
            }
        }
        List<String> extraResources = run.spec().resources().stream()
                .map(PipelineResourceBinding::name)
                .filter(name -> spec.resource(name) == null)
                .toList();
        if (!missingResources.isEmpty() || !extraResources.isEmpty()) {
            throw new DefinitionException(PipelineRunReason.INVALID_BINDINGS, String.format(
                    "PipelineRun %s doesn't bind Pipeline %s's PipelineResources correctly: missing %s, unexpected %s",
                    runName, pipelineName, missingResources, extraResources));
        }

        // Param types
        List<String> mismatched = new ArrayList<>();
        for (Param param : run.spec().params()) {
            ParamSpec declared = spec.param(param.name());
            if (declared != null && declared.type() != param.value().type()) {
                mismatched.add(param.name() + " (expected " + declared.type().lowerName() + ")");
            }
        }
        if (!mismatched.isEmpty()) {
            throw new DefinitionException(PipelineRunReason.PARAMETER_TYPE_MISMATCH, String.format(
                    "PipelineRun %s parameters have mismatching types with Pipeline %s's parameters: %s",
                    runName, pipelineName, mismatched));
        }

        // Required params
        List<String> missingParams = spec.params().stream()
                .filter(p -> !p.hasDefault() && run.spec().param(p.name()) == null)
                .map(ParamSpec::name)
                .toList();
        if (!missingParams.isEmpty()) {
            throw new DefinitionException(PipelineRunReason.FAILED_VALIDATION, String.format(
                    "PipelineRun %s is missing some parameters required by Pipeline %s: %s",
                    runName, pipelineName, missingParams));
        }

        // Workspaces
        List<String> missingWorkspaces = spec.workspaces().stream()
                .filter(w -> !w.optional() && run.spec().workspace(w.name()) == null)
                .map(WorkspaceDeclaration::name)
                .toList();
        if (!missingWorkspaces.isEmpty()) {
            throw new DefinitionException(PipelineRunReason.INVALID_WORKSPACE_BINDINGS, String.format(
                    "PipelineRun %s doesn't bind Pipeline %s's Workspaces correctly: missing %s",
                    runName, pipelineName, missingWorkspaces));
        }

        // Per-task service accounts
        List<String> unknownTasks = run.spec().serviceAccountNames().stream()
                .map(TaskServiceAccount::taskName)
                .filter(task -> spec.task(task) == null)
                .toList();
        if (!unknownTasks.isEmpty()) {
            throw new DefinitionException(PipelineRunReason.INVALID_SERVICE_ACCOUNT_MAPPINGS, String.format(
                    "PipelineRun %s doesn't define ServiceAccountNames correctly: tasks %s are not in Pipeline %s",
                    runName, unknownTasks, pipelineName));
        }
    }

    /**
     * What one pipeline task hands to the task it runs: every param without default
     * and every required resource must be supplied.
     */
    public void validateTaskBindings(PipelineRun run, PipelineTask task, TaskSpec taskSpec) {
        List<String> errors = new ArrayList<>();

        for (ParamSpec param : taskSpec.params()) {
            if (!param.hasDefault() && task.param(param.name()) == null) {
                errors.add("missing param '" + param.name() + "'");
            }
        }

        Set<String> inputs = task.resources().inputs().stream()
                .map(PipelineTaskInputResource::name)
                .collect(Collectors.toSet());
        Set<String> outputs = task.resources().outputs().stream()
                .map(PipelineTaskOutputResource::name)
                .collect(Collectors.toSet());
        for (ResourceDeclaration input : taskSpec.resources().inputs()) {
            if (!input.optional() && !inputs.contains(input.name())) {
                errors.add("missing input resource '" + input.name() + "'");
            }
        }
        for (ResourceDeclaration output : taskSpec.resources().outputs()) {
            if (!output.optional() && !outputs.contains(output.name())) {
                errors.add("missing output resource '" + output.name() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new DefinitionException(PipelineRunReason.FAILED_VALIDATION, String.format(
                    "Pipeline %s can't be Run; task %s of PipelineRun %s is not bound correctly: %s",
                    run.pipelineName(), task.name(), run.name(), String.join(", ", errors)));
        }
    }

    private void validateTaskReferences(PipelineTask task, Set<String> taskNames, List<String> errors) {
        for (String dependency : task.runAfter()) {
            if (!taskNames.contains(dependency)) {
                errors.add("pipeline task '" + task.name() + "' runs after '" + dependency
                        + "' which is not defined in this pipeline");
            }
        }
        for (PipelineTaskInputResource input : allInputs(task)) {
            for (String from : input.from()) {
                if (!taskNames.contains(from)) {
                    errors.add("pipeline task '" + task.name() + "' takes '" + input.name() + "' from '" + from
                            + "' which is not defined in this pipeline");
                }
            }
        }
        expressions.resultReferences(task.params()).stream()
                .filter(ref -> !taskNames.contains(ref.pipelineTask()))
                .forEach(ref -> errors.add("pipeline task '" + task.name() + "' uses result " + ref
                        + " of a task not defined in this pipeline"));
    }

    private void validateResourceReferences(PipelineTask task, Set<String> declared, List<String> errors) {
        for (PipelineTaskInputResource input : allInputs(task)) {
            if (!declared.contains(input.resource())) {
                errors.add("pipeline task '" + task.name() + "' uses resource '" + input.resource()
                        + "' which the pipeline does not declare");
            }
        }
        for (PipelineTaskOutputResource output : task.resources().outputs()) {
            if (!declared.contains(output.resource())) {
                errors.add("pipeline task '" + task.name() + "' uses resource '" + output.resource()
                        + "' which the pipeline does not declare");
            }
        }
    }

    private void validateParamReferences(String taskName, List<Param> values, Set<String> declared, List<String> errors) {
        for (Param param : values) {
            List<String> templates = param.value().isArray()
                    ? param.value().arrayVal()
                    : List.of(param.value().stringVal());
            for (String template : templates) {
                for (String reference : expressions.references(template)) {
                    if (!reference.startsWith(ExpressionContext.PARAMS)) {
                        continue;
                    }
                    String name = reference.substring(ExpressionContext.PARAMS.length()).replace("[*]", "");
                    if (!declared.contains(name)) {
                        errors.add("pipeline task '" + taskName + "' uses param '" + name
                                + "' which the pipeline does not declare");
                    }
                }
            }
        }
    }

    private static List<PipelineTaskInputResource> allInputs(PipelineTask task) {
        List<PipelineTaskInputResource> inputs = new ArrayList<>(task.resources().inputs());
        task.conditions().forEach(c -> inputs.addAll(c.resources()));
        return inputs;
    }
}
