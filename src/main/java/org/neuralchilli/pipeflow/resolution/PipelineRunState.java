package org.neuralchilli.pipeflow.resolution;

import org.neuralchilli.pipeflow.core.PipelineDag;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Every resolved pipeline task of a run plus the graph that orders them.
 * Derived afresh on each pass.
 */
public final class PipelineRunState {

    private final PipelineDag dag;
    private final Map<String, ResolvedPipelineTask> tasks;

    public PipelineRunState(PipelineDag dag, List<ResolvedPipelineTask> tasks) {
        this.dag = dag;
        Map<String, ResolvedPipelineTask> byName = new LinkedHashMap<>();
        tasks.forEach(t -> byName.put(t.name(), t));
        this.tasks = byName;
    }

    public PipelineDag dag() {
        return dag;
    }

    /**
     * Tasks in pipeline declaration order.
     */
    public List<ResolvedPipelineTask> tasks() {
        return List.copyOf(tasks.values());
    }

    public ResolvedPipelineTask get(String pipelineTask) {
        return tasks.get(pipelineTask);
    }

    /**
     * Copy with one task replaced.
     */
    public PipelineRunState with(ResolvedPipelineTask task) {
        List<ResolvedPipelineTask> updated = new ArrayList<>(tasks.values());
        updated.replaceAll(t -> t.name().equals(task.name()) ? task : t);
        return new PipelineRunState(dag, updated);
    }

    public Set<String> successful() {
        Set<String> names = new HashSet<>();
        tasks.values().stream().filter(ResolvedPipelineTask::isSuccessful).forEach(t -> names.add(t.name()));
        return names;
    }

    /**
     * Tasks that will never run: a condition check failed, or a predecessor failed or was skipped.
     */
    public Set<String> skipped() {
        Set<String> skipped = new HashSet<>();
        for (String name : dag.topologicalOrder()) {
            ResolvedPipelineTask task = tasks.get(name);
            if (task == null || task.isStarted()) {
                continue;
            }
            boolean blocked = dag.predecessors(name).stream()
                    .anyMatch(p -> skipped.contains(p) || tasks.get(p).isFailure());
            if (blocked || task.isConditionCheckFailure()) {
                skipped.add(name);
            }
        }
        return skipped;
    }

    /**
     * First task, in declaration order, that failed for good.
     */
    public Optional<ResolvedPipelineTask> failure() {
        return tasks.values().stream().filter(ResolvedPipelineTask::isFailure).findFirst();
    }

    /**
     * Tasks whose predecessors all succeeded and which have no task-run yet and are not skipped.
     * Tasks still waiting on condition checks are included.
     */
    public List<ResolvedPipelineTask> nextToRun() {
        Set<String> skipped = skipped();
        List<ResolvedPipelineTask> result = new ArrayList<>();
        for (String name : dag.schedulable(successful())) {
            ResolvedPipelineTask task = tasks.get(name);
            if (!task.isStarted() && !skipped.contains(name)) {
                result.add(task);
            }
        }
        return result;
    }

    public List<ResolvedPipelineTask> retryable() {
        return tasks.values().stream().filter(ResolvedPipelineTask::isRetryable).toList();
    }

    /**
     * Every task either succeeded or was skipped.
     */
    public boolean isComplete() {
        Set<String> skipped = skipped();
        return tasks.values().stream().allMatch(t -> t.isSuccessful() || skipped.contains(t.name()));
    }
}
