package org.neuralchilli.pipeflow.resolution;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.pipeflow.core.DefinitionException;
import org.neuralchilli.pipeflow.core.PipelineDag;
import org.neuralchilli.pipeflow.domain.ClusterTask;
import org.neuralchilli.pipeflow.domain.Condition;
import org.neuralchilli.pipeflow.domain.Pipeline;
import org.neuralchilli.pipeflow.domain.PipelineResource;
import org.neuralchilli.pipeflow.domain.PipelineResourceBinding;
import org.neuralchilli.pipeflow.domain.PipelineResourceSpec;
import org.neuralchilli.pipeflow.domain.PipelineRun;
import org.neuralchilli.pipeflow.domain.PipelineRunReason;
import org.neuralchilli.pipeflow.domain.PipelineRunTaskRunStatus;
import org.neuralchilli.pipeflow.domain.PipelineSpec;
import org.neuralchilli.pipeflow.domain.PipelineTask;
import org.neuralchilli.pipeflow.domain.PipelineTaskCondition;
import org.neuralchilli.pipeflow.domain.PipelineTaskInputResource;
import org.neuralchilli.pipeflow.domain.PipelineTaskOutputResource;
import org.neuralchilli.pipeflow.domain.ResourceDeclaration;
import org.neuralchilli.pipeflow.domain.Task;
import org.neuralchilli.pipeflow.domain.TaskRef;
import org.neuralchilli.pipeflow.domain.TaskRun;
import org.neuralchilli.pipeflow.domain.TaskSpec;
import org.neuralchilli.pipeflow.service.PipelineRunValidator;
import org.neuralchilli.pipeflow.store.ControlPlane;
import org.neuralchilli.pipeflow.util.Names;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up everything a run's pipeline refers to: the pipeline, tasks, cluster tasks,
 * conditions, resources and the task-runs already created for it.
 */
@ApplicationScoped
public class BindingResolver {

    private static final Logger log = LoggerFactory.getLogger(BindingResolver.class);

    private final ControlPlane controlPlane;
    private final PipelineRunValidator validator;

    @Inject
    public BindingResolver(ControlPlane controlPlane, PipelineRunValidator validator) {
        this.controlPlane = controlPlane;
        this.validator = validator;
    }

    /**
     * The embedded spec, or the referenced pipeline's spec.
     *
     * @throws DefinitionException with reason CouldntGetPipeline
     */
    public PipelineSpec resolvePipeline(PipelineRun run) {
        if (run.spec().pipelineSpec() != null) {
            return run.spec().pipelineSpec();
        }
        String pipelineName = run.spec().pipelineRef();
        Pipeline pipeline = controlPlane.pipelines().get(run.namespace(), pipelineName);
        if (pipeline == null) {
            throw new DefinitionException(PipelineRunReason.COULDNT_GET_PIPELINE, String.format(
                    "Error retrieving pipeline for pipelinerun %s/%s: pipeline %s not found",
                    run.namespace(), run.name(), pipelineName));
        }
        return pipeline.spec();
    }

    /**
     * Pair every pipeline task with its task-run, task spec, resources and condition checks.
     */
    public PipelineRunState resolve(PipelineRun run, PipelineSpec spec, PipelineDag dag) {
        List<ResolvedPipelineTask> resolved = new ArrayList<>();
        for (PipelineTask task : spec.tasks()) {
            resolved.add(resolveTask(run, spec, task));
        }
        log.debug("Resolved {} pipeline tasks for run {}", resolved.size(), run.metadata().key());
        return new PipelineRunState(dag, resolved);
    }

    ResolvedPipelineTask resolveTask(PipelineRun run, PipelineSpec spec, PipelineTask task) {
        String taskRunName = run.status().taskRunNameFor(task.name());
        if (taskRunName == null) {
            taskRunName = Names.withRandomSuffix(run.name() + "-" + task.name());
        }
        TaskRun taskRun = controlPlane.taskRuns().get(run.namespace(), taskRunName);

        TaskRef ref = task.taskRef();
        TaskSpec taskSpec = switch (ref.kind()) {
            case TASK -> {
                Task found = controlPlane.tasks().get(run.namespace(), ref.name());
                if (found == null) {
                    throw missingTask(run, ref);
                }
                yield found.spec();
            }
            case CLUSTER_TASK -> {
                ClusterTask found = controlPlane.clusterTasks().get("", ref.name());
                if (found == null) {
                    throw missingTask(run, ref);
                }
                yield found.spec();
            }
            case INLINE -> ref.spec();
        };

        Map<String, ResolvedResource> resources = resolveResources(run, spec, task, taskSpec);
        List<ResolvedConditionCheck> checks = resolveConditions(run, spec, task, taskRunName);
        validator.validateTaskBindings(run, task, taskSpec);

        return new ResolvedPipelineTask(task, taskRunName, taskRun, ref.kind(), ref.name(), taskSpec, resources, checks);
    }

    private Map<String, ResolvedResource> resolveResources(PipelineRun run, PipelineSpec spec, PipelineTask task, TaskSpec taskSpec) {
        Map<String, ResolvedResource> resolved = new HashMap<>();
        for (PipelineTaskInputResource input : task.resources().inputs()) {
            ResolvedResource resource = resolved.computeIfAbsent(input.resource(), r -> resolveBinding(run, spec, r));
            checkTaskType(run, task, input.name(), resource, taskSpec.resources().inputs());
        }
        for (PipelineTaskOutputResource output : task.resources().outputs()) {
            ResolvedResource resource = resolved.computeIfAbsent(output.resource(), r -> resolveBinding(run, spec, r));
            checkTaskType(run, task, output.name(), resource, taskSpec.resources().outputs());
        }
        return resolved;
    }

    private List<ResolvedConditionCheck> resolveConditions(PipelineRun run, PipelineSpec spec, PipelineTask task, String taskRunName) {
        List<ResolvedConditionCheck> checks = new ArrayList<>();
        PipelineRunTaskRunStatus entry = run.status().taskRuns().get(taskRunName);

        for (int i = 0; i < task.conditions().size(); i++) {
            PipelineTaskCondition taskCondition = task.conditions().get(i);
            Condition condition = controlPlane.conditions().get(run.namespace(), taskCondition.conditionRef());
            if (condition == null) {
                throw new DefinitionException(PipelineRunReason.COULDNT_GET_CONDITION, String.format(
                        "PipelineRun %s can't be Run; it contains Conditions that don't exist: %s",
                        run.metadata().key(), taskCondition.conditionRef()));
            }

            String registerName = taskCondition.conditionRef() + "-" + i;
            String checkName = entry != null ? entry.conditionCheckName(registerName) : null;
            if (checkName == null) {
                checkName = Names.withRandomSuffix(taskRunName + "-" + registerName);
            }
            TaskRun checkRun = controlPlane.taskRuns().get(run.namespace(), checkName);

            Map<String, ResolvedResource> resources = new HashMap<>();
            for (PipelineTaskInputResource input : taskCondition.resources()) {
                resources.put(input.name(), resolveBinding(run, spec, input.resource()));
            }

            checks.add(new ResolvedConditionCheck(registerName, checkName, taskCondition, condition, resources, checkRun));
        }
        return checks;
    }

    private ResolvedResource resolveBinding(PipelineRun run, PipelineSpec spec, String resourceName) {
        PipelineResourceBinding binding = run.spec().resource(resourceName);
        if (binding == null) {
            throw new DefinitionException(PipelineRunReason.INVALID_BINDINGS, String.format(
                    "PipelineRun %s doesn't bind Pipeline %s's PipelineResources correctly: resource %s is not bound",
                    run.name(), run.pipelineName(), resourceName));
        }

        PipelineResourceSpec resourceSpec;
        if (binding.isInline()) {
            resourceSpec = binding.resourceSpec();
        } else {
            PipelineResource stored = controlPlane.resources().get(run.namespace(), binding.resourceRef());
            if (stored == null) {
                throw new DefinitionException(PipelineRunReason.COULDNT_GET_RESOURCE, String.format(
                        "PipelineRun %s can't be Run; it tries to bind Resources that don't exist: %s",
                        run.metadata().key(), binding.resourceRef()));
            }
            resourceSpec = stored.spec();
        }

        ResourceDeclaration declared = spec.resource(resourceName);
        if (declared != null && declared.type() != resourceSpec.type()) {
            throw new DefinitionException(PipelineRunReason.INVALID_BINDINGS, String.format(
                    "PipelineRun %s binds resource %s of type %s where Pipeline %s declares %s",
                    run.name(), resourceName, resourceSpec.type().value(), run.pipelineName(), declared.type().value()));
        }
        return new ResolvedResource(resourceName, binding.resourceRef(), resourceSpec);
    }

    private void checkTaskType(PipelineRun run, PipelineTask task, String slot, ResolvedResource resource,
                               List<ResourceDeclaration> taskDeclarations) {
        taskDeclarations.stream()
                .filter(d -> d.name().equals(slot))
                .filter(d -> d.type() != resource.type())
                .findFirst()
                .ifPresent(d -> {
                    throw new DefinitionException(PipelineRunReason.INVALID_BINDINGS, String.format(
                            "PipelineRun %s binds resource %s of type %s to %s of task %s, which expects %s",
                            run.name(), resource.name(), resource.type().value(), slot, task.name(), d.type().value()));
                });
    }

    private static DefinitionException missingTask(PipelineRun run, TaskRef ref) {
        return new DefinitionException(PipelineRunReason.COULDNT_GET_TASK, String.format(
                "Pipeline %s/%s can't be Run; it contains Tasks that don't exist: %s",
                run.namespace(), run.pipelineName(), ref));
    }
}
