package org.neuralchilli.pipeflow.controller;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.neuralchilli.pipeflow.domain.Labels;
import org.neuralchilli.pipeflow.domain.PipelineRun;
import org.neuralchilli.pipeflow.domain.TaskRun;
import org.neuralchilli.pipeflow.store.ControlPlane;
import org.neuralchilli.pipeflow.store.ObjectKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enqueues a pipeline run whenever it or one of its task-runs is added or changed.
 */
@ApplicationScoped
public class ChangeWatcher {

    private static final Logger log = LoggerFactory.getLogger(ChangeWatcher.class);

    private final ControlPlane controlPlane;
    private final ReconcileQueue queue;

    private String pipelineRunRegistration;
    private String taskRunRegistration;

    @Inject
    public ChangeWatcher(ControlPlane controlPlane, ReconcileQueue queue) {
        this.controlPlane = controlPlane;
        this.queue = queue;
    }

    void onStart(@Observes StartupEvent event) {
        pipelineRunRegistration = controlPlane.pipelineRuns().watch(this::onPipelineRun);
        taskRunRegistration = controlPlane.taskRuns().watch(this::onTaskRun);
        log.info("Watching pipeline runs and task-runs for changes");
    }

    void onStop(@Observes ShutdownEvent event) {
        if (pipelineRunRegistration != null) {
            controlPlane.pipelineRuns().unwatch(pipelineRunRegistration);
        }
        if (taskRunRegistration != null) {
            controlPlane.taskRuns().unwatch(taskRunRegistration);
        }
    }

    void onPipelineRun(PipelineRun run) {
        if (run.isDone()) {
            return;
        }
        queue.enqueue(run.metadata().key());
    }

    void onTaskRun(TaskRun taskRun) {
        String owner = taskRun.metadata().label(Labels.PIPELINE_RUN);
        if (owner == null) {
            return;
        }
        queue.enqueue(ObjectKey.of(taskRun.namespace(), owner).toString());
    }
}
