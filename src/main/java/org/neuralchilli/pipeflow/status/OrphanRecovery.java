package org.neuralchilli.pipeflow.status;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.pipeflow.domain.Labels;
import org.neuralchilli.pipeflow.domain.PipelineRun;
import org.neuralchilli.pipeflow.domain.PipelineRunConditionCheckStatus;
import org.neuralchilli.pipeflow.domain.PipelineRunTaskRunStatus;
import org.neuralchilli.pipeflow.domain.PipelineSpec;
import org.neuralchilli.pipeflow.domain.PipelineTask;
import org.neuralchilli.pipeflow.domain.PipelineTaskCondition;
import org.neuralchilli.pipeflow.domain.TaskRun;
import org.neuralchilli.pipeflow.store.ControlPlane;
import org.neuralchilli.pipeflow.util.Names;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Puts task-runs that carry a run's label but are missing from its status back into the
 * status. This covers a pass that created children and then failed to write the status.
 * Recorded entries are never changed or removed.
 */
@ApplicationScoped
public class OrphanRecovery {

    private static final Logger log = LoggerFactory.getLogger(OrphanRecovery.class);

    private final ControlPlane controlPlane;

    @Inject
    public OrphanRecovery(ControlPlane controlPlane) {
        this.controlPlane = controlPlane;
    }

    /**
     * Status task-runs of the run with every labelled but unrecorded child added.
     * {@code spec} places recovered condition checks at their index in the pipeline task.
     */
    public Map<String, PipelineRunTaskRunStatus> recover(PipelineRun run, @Nullable PipelineSpec spec) {
        List<TaskRun> children = controlPlane.taskRuns().list(run.namespace(), Map.of(Labels.PIPELINE_RUN, run.name()));
        return merge(run, spec, run.status().taskRuns(), children);
    }

    static Map<String, PipelineRunTaskRunStatus> merge(PipelineRun run, @Nullable PipelineSpec spec,
                                                      Map<String, PipelineRunTaskRunStatus> recorded,
                                                      List<TaskRun> children) {
        Map<String, PipelineRunTaskRunStatus> result = new HashMap<>(recorded);
        Set<String> knownChecks = new HashSet<>();
        recorded.values().forEach(entry -> knownChecks.addAll(entry.conditionChecks().keySet()));

        for (TaskRun child : children) {
            if (child.isConditionCheck() || child.pipelineTaskName() == null || result.containsKey(child.name())) {
                continue;
            }
            result.put(child.name(), PipelineRunTaskRunStatus.of(child.pipelineTaskName(), child.status()));
            log.info("Recovered orphaned task-run {} of run {}", child.name(), run.metadata().key());
        }

        for (TaskRun check : children) {
            if (!check.isConditionCheck() || check.pipelineTaskName() == null || knownChecks.contains(check.name())) {
                continue;
            }
            String pipelineTask = check.pipelineTaskName();
            String parent = parentOf(result, pipelineTask);
            Set<String> taken = parent == null ? Set.of() : registerNames(result.get(parent));
            PipelineRunConditionCheckStatus checkStatus = new PipelineRunConditionCheckStatus(
                    registerName(spec == null ? null : spec.task(pipelineTask), check, taken), check.status());

            if (parent == null) {
                parent = Names.withRandomSuffix(run.name() + "-" + pipelineTask);
                result.put(parent, new PipelineRunTaskRunStatus(pipelineTask, null, Map.of(check.name(), checkStatus)));
            } else {
                result.put(parent, result.get(parent).withConditionCheck(check.name(), checkStatus));
            }
            knownChecks.add(check.name());
            log.info("Recovered orphaned condition check {} of run {} under {}", check.name(), run.metadata().key(), parent);
        }
        return result;
    }

    /**
     * {@code <condition>-<index>} of a check. The index is the one embedded in the check's name,
     * else the first position of its condition in the task that is not yet registered.
     */
    static String registerName(@Nullable PipelineTask task, TaskRun check, Set<String> taken) {
        String condition = check.metadata().label(Labels.CONDITION_NAME);
        List<PipelineTaskCondition> conditions = task == null ? List.of() : task.conditions();
        String firstFree = null;
        for (int i = 0; i < conditions.size(); i++) {
            if (!conditions.get(i).conditionRef().equals(condition)) {
                continue;
            }
            String candidate = condition + "-" + i;
            if (check.name().contains("-" + candidate + "-")) {
                return candidate;
            }
            if (firstFree == null && !taken.contains(candidate)) {
                firstFree = candidate;
            }
        }
        return firstFree != null ? firstFree : condition + "-0";
    }

    private static Set<String> registerNames(PipelineRunTaskRunStatus entry) {
        Set<String> names = new HashSet<>();
        entry.conditionChecks().values().forEach(c -> names.add(c.conditionName()));
        return names;
    }

    private static String parentOf(Map<String, PipelineRunTaskRunStatus> entries, String pipelineTask) {
        return new TreeMap<>(entries).entrySet().stream()
                .filter(e -> e.getValue().pipelineTaskName().equals(pipelineTask))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(null);
    }
}
