package org.neuralchilli.pipeflow.store;

import com.hazelcast.core.HazelcastInstance;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.pipeflow.domain.ClusterTask;
import org.neuralchilli.pipeflow.domain.Condition;
import org.neuralchilli.pipeflow.domain.PersistentVolumeClaim;
import org.neuralchilli.pipeflow.domain.Pipeline;
import org.neuralchilli.pipeflow.domain.PipelineResource;
import org.neuralchilli.pipeflow.domain.PipelineRun;
import org.neuralchilli.pipeflow.domain.Task;
import org.neuralchilli.pipeflow.domain.TaskRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * The shared control plane: one typed store per object kind.
 * Definitions (pipelines, tasks, conditions, resources) are read-only to the reconciler;
 * runs, task-runs and volume claims are written by it.
 */
@ApplicationScoped
public class ControlPlane {

    private static final Logger log = LoggerFactory.getLogger(ControlPlane.class);

    public static final String PIPELINES = "pipelines";
    public static final String TASKS = "tasks";
    public static final String CLUSTER_TASKS = "cluster-tasks";
    public static final String CONDITIONS = "conditions";
    public static final String PIPELINE_RESOURCES = "pipeline-resources";
    public static final String PIPELINE_RUNS = "pipeline-runs";
    public static final String TASK_RUNS = "task-runs";
    public static final String VOLUME_CLAIMS = "persistent-volume-claims";

    private final ObjectStore<Pipeline> pipelines;
    private final ObjectStore<Task> tasks;
    private final ObjectStore<ClusterTask> clusterTasks;
    private final ObjectStore<Condition> conditions;
    private final ObjectStore<PipelineResource> resources;
    private final ObjectStore<PipelineRun> pipelineRuns;
    private final ObjectStore<TaskRun> taskRuns;
    private final ObjectStore<PersistentVolumeClaim> volumeClaims;

    @Inject
    public ControlPlane(HazelcastInstance hazelcast, Clock clock) {
        this(hazelcast, clock, "");
    }

    /**
     * Control plane whose map names carry a prefix, so several can share one Hazelcast instance.
     */
    public ControlPlane(HazelcastInstance hazelcast, Clock clock, String mapPrefix) {
        this(
                new HazelcastObjectStore<>(hazelcast, mapPrefix + PIPELINES, "Pipeline", clock),
                new HazelcastObjectStore<>(hazelcast, mapPrefix + TASKS, "Task", clock),
                new HazelcastObjectStore<>(hazelcast, mapPrefix + CLUSTER_TASKS, "ClusterTask", clock),
                new HazelcastObjectStore<>(hazelcast, mapPrefix + CONDITIONS, "Condition", clock),
                new HazelcastObjectStore<>(hazelcast, mapPrefix + PIPELINE_RESOURCES, "PipelineResource", clock),
                new HazelcastObjectStore<>(hazelcast, mapPrefix + PIPELINE_RUNS, PipelineRun.KIND, clock),
                new HazelcastObjectStore<>(hazelcast, mapPrefix + TASK_RUNS, "TaskRun", clock),
                new HazelcastObjectStore<>(hazelcast, mapPrefix + VOLUME_CLAIMS, "PersistentVolumeClaim", clock)
        );
        log.info("Control plane initialized on Hazelcast cluster {} (map prefix '{}')",
                hazelcast.getConfig().getClusterName(), mapPrefix);
    }

    public ControlPlane(
            ObjectStore<Pipeline> pipelines,
            ObjectStore<Task> tasks,
            ObjectStore<ClusterTask> clusterTasks,
            ObjectStore<Condition> conditions,
            ObjectStore<PipelineResource> resources,
            ObjectStore<PipelineRun> pipelineRuns,
            ObjectStore<TaskRun> taskRuns,
            ObjectStore<PersistentVolumeClaim> volumeClaims
    ) {
        this.pipelines = pipelines;
        this.tasks = tasks;
        this.clusterTasks = clusterTasks;
        this.conditions = conditions;
        this.resources = resources;
        this.pipelineRuns = pipelineRuns;
        this.taskRuns = taskRuns;
        this.volumeClaims = volumeClaims;
    }

    public ObjectStore<Pipeline> pipelines() {
        return pipelines;
    }

    public ObjectStore<Task> tasks() {
        return tasks;
    }

    public ObjectStore<ClusterTask> clusterTasks() {
        return clusterTasks;
    }

    public ObjectStore<Condition> conditions() {
        return conditions;
    }

    public ObjectStore<PipelineResource> resources() {
        return resources;
    }

    public ObjectStore<PipelineRun> pipelineRuns() {
        return pipelineRuns;
    }

    public ObjectStore<TaskRun> taskRuns() {
        return taskRuns;
    }

    public ObjectStore<PersistentVolumeClaim> volumeClaims() {
        return volumeClaims;
    }
}
