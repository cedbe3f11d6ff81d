package org.neuralchilli.pipeflow.reconciler;

import com.hazelcast.core.HazelcastInstance;
import org.neuralchilli.pipeflow.config.HazelcastTestProducer;
import org.neuralchilli.pipeflow.config.ReconcilerConfig;
import org.neuralchilli.pipeflow.core.ExpressionEvaluator;
import org.neuralchilli.pipeflow.core.GraphResolver;
import org.neuralchilli.pipeflow.domain.*;
import org.neuralchilli.pipeflow.resolution.BindingResolver;
import org.neuralchilli.pipeflow.scheduler.RunScheduler;
import org.neuralchilli.pipeflow.scheduler.TaskRunFactory;
import org.neuralchilli.pipeflow.service.PipelineRunValidator;
import org.neuralchilli.pipeflow.status.OrphanRecovery;
import org.neuralchilli.pipeflow.status.PipelineResults;
import org.neuralchilli.pipeflow.status.StatusAggregator;
import org.neuralchilli.pipeflow.store.ControlPlane;
import org.neuralchilli.pipeflow.store.HazelcastObjectStore;
import org.neuralchilli.pipeflow.store.ObjectStore;
import org.neuralchilli.pipeflow.workspace.ResourceLinker;
import org.neuralchilli.pipeflow.workspace.WorkspaceLinker;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.Mockito.spy;

/**
 * A reconciler wired by hand over a private set of Hazelcast maps, with spied task-run and
 * pipeline-run stores and a clock the test controls.
 */
final class ReconcilerFixture {

    static final String NAMESPACE = "ns";
    static final Instant START = Instant.parse("2026-01-01T10:00:00Z");

    final MutableClock clock = new MutableClock(START);
    final ObjectStore<TaskRun> taskRuns;
    final ObjectStore<PipelineRun> pipelineRuns;
    final ControlPlane controlPlane;
    final PipelineRunReconciler reconciler;

    ReconcilerFixture() {
        this(ReconcilerConfig.defaults());
    }

    ReconcilerFixture(ReconcilerConfig config) {
        HazelcastInstance hazelcast = HazelcastTestProducer.shared();
        String prefix = "reconciler-" + UUID.randomUUID() + "-";

        taskRuns = spy(new HazelcastObjectStore<TaskRun>(hazelcast, prefix + ControlPlane.TASK_RUNS, "TaskRun", clock));
        pipelineRuns = spy(new HazelcastObjectStore<PipelineRun>(hazelcast, prefix + ControlPlane.PIPELINE_RUNS,
                PipelineRun.KIND, clock));
        controlPlane = new ControlPlane(
                new HazelcastObjectStore<>(hazelcast, prefix + ControlPlane.PIPELINES, "Pipeline", clock),
                new HazelcastObjectStore<>(hazelcast, prefix + ControlPlane.TASKS, "Task", clock),
                new HazelcastObjectStore<>(hazelcast, prefix + ControlPlane.CLUSTER_TASKS, "ClusterTask", clock),
                new HazelcastObjectStore<>(hazelcast, prefix + ControlPlane.CONDITIONS, "Condition", clock),
                new HazelcastObjectStore<>(hazelcast, prefix + ControlPlane.PIPELINE_RESOURCES, "PipelineResource", clock),
                pipelineRuns,
                taskRuns,
                new HazelcastObjectStore<>(hazelcast, prefix + ControlPlane.VOLUME_CLAIMS, "PersistentVolumeClaim", clock)
        );

        ExpressionEvaluator expressions = new ExpressionEvaluator();
        PipelineRunValidator validator = new PipelineRunValidator(expressions);
        ResourceLinker resourceLinker = new ResourceLinker(controlPlane, config);
        WorkspaceLinker workspaceLinker = new WorkspaceLinker(controlPlane);
        TaskRunFactory factory = new TaskRunFactory(expressions, resourceLinker, workspaceLinker, config);

        reconciler = new PipelineRunReconciler(
                controlPlane,
                new BindingResolver(controlPlane, validator),
                validator,
                new GraphResolver(expressions),
                new RunScheduler(controlPlane, factory),
                new StatusAggregator(new PipelineResults(expressions)),
                new OrphanRecovery(controlPlane),
                resourceLinker,
                workspaceLinker,
                config,
                clock
        );
    }

    // Definitions

    Task task(String name, String... results) {
        TaskSpec spec = new TaskSpec(null, List.of(), TaskResources.NONE, List.of(),
                List.of(Step.of("run", "busybox", List.of("echo"), List.of("$(params.message)"))),
                Arrays.stream(results).map(r -> new TaskResultDeclaration(r, null)).toList());
        return controlPlane.tasks().create(new Task(ObjectMeta.of(NAMESPACE, name), spec));
    }

    Task task(String name, TaskSpec spec) {
        return controlPlane.tasks().create(new Task(ObjectMeta.of(NAMESPACE, name), spec));
    }

    Pipeline pipeline(String name, PipelineSpec spec) {
        return controlPlane.pipelines().create(new Pipeline(ObjectMeta.of(NAMESPACE, name), spec));
    }

    Condition condition(String name) {
        ConditionSpec spec = new ConditionSpec(
                new Step(null, null, List.of("sh", "-c"), List.of("test -f $(resources.source.path)/$(params.file)"), null),
                List.of(ParamSpec.withDefault("file", ParamValue.ofString("README"))),
                List.of(),
                null);
        return controlPlane.conditions().create(new Condition(ObjectMeta.of(NAMESPACE, name), spec));
    }

    PipelineRun createRun(String name, PipelineRunSpec spec) {
        return pipelineRuns.create(PipelineRun.of(NAMESPACE, name, spec));
    }

    // Passes

    void reconcile(PipelineRun run) {
        reconciler.reconcile(run.metadata().key());
    }

    PipelineRun run(String name) {
        return pipelineRuns.get(NAMESPACE, name);
    }

    /**
     * Task-runs of a run, condition checks excluded, ordered by name.
     */
    List<TaskRun> taskRunsOf(String runName) {
        return taskRuns.list(NAMESPACE, Map.of(Labels.PIPELINE_RUN, runName)).stream()
                .filter(tr -> !tr.isConditionCheck())
                .toList();
    }

    List<TaskRun> checksOf(String runName) {
        return taskRuns.list(NAMESPACE, Map.of(Labels.PIPELINE_RUN, runName)).stream()
                .filter(TaskRun::isConditionCheck)
                .toList();
    }

    TaskRun taskRunFor(String runName, String pipelineTask) {
        return taskRunsOf(runName).stream()
                .filter(tr -> pipelineTask.equals(tr.pipelineTaskName()))
                .findFirst()
                .orElse(null);
    }

    // Task engine stand-in

    TaskRun succeed(TaskRun taskRun, TaskRunResult... results) {
        return taskRuns.patch(taskRun.namespace(), taskRun.name(), current -> current.withStatus(
                current.status()
                        .withCondition(StatusCondition.succeeded("Succeeded", "All Steps have completed executing", clock.instant()))
                        .withResults(List.of(results))));
    }

    TaskRun fail(TaskRun taskRun) {
        return taskRuns.patch(taskRun.namespace(), taskRun.name(), current -> current.withStatus(
                current.status().withCondition(StatusCondition.failed("Failed", "step exited with 1", clock.instant()))));
    }

    TaskRun markRunning(TaskRun taskRun) {
        return taskRuns.patch(taskRun.namespace(), taskRun.name(), current -> current.withStatus(
                current.status().withCondition(StatusCondition.unknown("Running", "", clock.instant()))));
    }
}
