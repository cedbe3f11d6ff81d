package org.neuralchilli.pipeflow.workspace;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.pipeflow.config.ReconcilerConfig;
import org.neuralchilli.pipeflow.domain.ObjectMeta;
import org.neuralchilli.pipeflow.domain.OwnerReference;
import org.neuralchilli.pipeflow.domain.PersistentVolumeClaim;
import org.neuralchilli.pipeflow.domain.PersistentVolumeClaimSpec;
import org.neuralchilli.pipeflow.domain.PipelineRun;
import org.neuralchilli.pipeflow.domain.PipelineSpec;
import org.neuralchilli.pipeflow.domain.PipelineTask;
import org.neuralchilli.pipeflow.domain.PipelineTaskInputResource;
import org.neuralchilli.pipeflow.domain.PipelineTaskOutputResource;
import org.neuralchilli.pipeflow.domain.TaskResourceBinding;
import org.neuralchilli.pipeflow.domain.TaskRunResources;
import org.neuralchilli.pipeflow.resolution.ResolvedPipelineTask;
import org.neuralchilli.pipeflow.resolution.ResolvedResource;
import org.neuralchilli.pipeflow.store.ControlPlane;
import org.neuralchilli.pipeflow.store.OwnedObjects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Hands resources from one task to the next through a shared artifact volume.
 * The volume exists only when some input resource names a {@code from} task.
 */
@ApplicationScoped
public class ResourceLinker {

    private static final Logger log = LoggerFactory.getLogger(ResourceLinker.class);

    static final String ARTIFACT_ROOT = "/pvc";

    private final ControlPlane controlPlane;
    private final ReconcilerConfig config;

    @Inject
    public ResourceLinker(ControlPlane controlPlane, ReconcilerConfig config) {
        this.controlPlane = controlPlane;
        this.config = config;
    }

    /**
     * {@code <run>-pvc}.
     */
    public static String artifactClaimName(PipelineRun run) {
        return run.name() + "-pvc";
    }

    /**
     * True when some task takes an input {@code from} an earlier task.
     */
    public boolean needsArtifactStorage(PipelineSpec spec) {
        return spec.tasks().stream()
                .flatMap(t -> t.resources().inputs().stream())
                .anyMatch(input -> !input.from().isEmpty());
    }

    /**
     * Create the run's artifact claim if the pipeline links resources between tasks.
     *
     * @return true if the pipeline uses artifact storage
     */
    public boolean ensureArtifactClaim(PipelineRun run, PipelineSpec spec) {
        if (!needsArtifactStorage(spec)) {
            return false;
        }
        String claimName = artifactClaimName(run);
        if (controlPlane.volumeClaims().get(run.namespace(), claimName) != null) {
            return true;
        }

        PersistentVolumeClaim claim = new PersistentVolumeClaim(
                ObjectMeta.of(run.namespace(), claimName)
                        .withLabels(run.metadata().labels())
                        .withOwnerReferences(List.of(OwnerReference.controllerOf(run))),
                new PersistentVolumeClaimSpec(
                        List.of(PersistentVolumeClaimSpec.READ_WRITE_ONCE),
                        config.artifactStorage(),
                        config.artifactStorageClass()
                )
        );
        OwnedObjects.createOrAdopt(controlPlane.volumeClaims(), claim, run.metadata().uid());
        log.info("Created artifact volume claim {} for run {}", claimName, run.metadata().key());
        return true;
    }

    /**
     * Resource bindings of one task-run. With artifact storage, outputs are copied to
     * {@code /pvc/<task>/<output>} and linked inputs read from the producing task's path.
     */
    public TaskRunResources bind(PipelineSpec spec, ResolvedPipelineTask task, boolean artifactStorage) {
        PipelineTask pipelineTask = task.pipelineTask();
        Map<String, ResolvedResource> resources = task.resources();

        List<TaskResourceBinding> inputs = new ArrayList<>();
        for (PipelineTaskInputResource input : pipelineTask.resources().inputs()) {
            List<String> paths = new ArrayList<>();
            if (artifactStorage) {
                for (String from : input.from()) {
                    paths.add(artifactPath(from, outputNameFor(spec.task(from), input.resource(), input.name())));
                }
            }
            inputs.add(binding(input.name(), resources.get(input.resource()), paths));
        }

        List<TaskResourceBinding> outputs = new ArrayList<>();
        for (PipelineTaskOutputResource output : pipelineTask.resources().outputs()) {
            List<String> paths = artifactStorage ? List.of(artifactPath(task.name(), output.name())) : List.of();
            outputs.add(binding(output.name(), resources.get(output.resource()), paths));
        }

        return new TaskRunResources(inputs, outputs);
    }

    static String artifactPath(String pipelineTask, String resourceName) {
        return ARTIFACT_ROOT + "/" + pipelineTask + "/" + resourceName;
    }

    private static TaskResourceBinding binding(String name, ResolvedResource resource, List<String> paths) {
        if (resource.resourceRef() != null) {
            return new TaskResourceBinding(name, resource.resourceRef(), null, paths);
        }
        return new TaskResourceBinding(name, null, resource.spec(), paths);
    }

    // Name under which the producing task wrote the same pipeline resource
    private static String outputNameFor(PipelineTask producer, String pipelineResource, String fallback) {
        if (producer == null) {
            return fallback;
        }
        return producer.resources().outputs().stream()
                .filter(o -> o.resource().equals(pipelineResource))
                .map(PipelineTaskOutputResource::name)
                .findFirst()
                .orElse(fallback);
    }
}
