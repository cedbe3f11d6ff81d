package org.neuralchilli.pipeflow.workspace;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.pipeflow.domain.ObjectMeta;
import org.neuralchilli.pipeflow.domain.OwnerReference;
import org.neuralchilli.pipeflow.domain.PersistentVolumeClaim;
import org.neuralchilli.pipeflow.domain.PipelineRun;
import org.neuralchilli.pipeflow.domain.PipelineSpec;
import org.neuralchilli.pipeflow.domain.PipelineTask;
import org.neuralchilli.pipeflow.domain.WorkspaceBinding;
import org.neuralchilli.pipeflow.domain.WorkspacePipelineTaskBinding;
import org.neuralchilli.pipeflow.store.ControlPlane;
import org.neuralchilli.pipeflow.store.OwnedObjects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps pipeline workspaces onto task-run workspaces. Workspaces backed by a volume claim
 * template get one claim per run, shared by every task that uses the workspace.
 */
@ApplicationScoped
public class WorkspaceLinker {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceLinker.class);

    private final ControlPlane controlPlane;

    @Inject
    public WorkspaceLinker(ControlPlane controlPlane) {
        this.controlPlane = controlPlane;
    }

    /**
     * {@code <template>-<workspace>-<run>}.
     */
    public static String claimName(WorkspaceBinding binding, PipelineRun run) {
        return binding.volumeClaimTemplate().name() + "-" + binding.name() + "-" + run.name();
    }

    /**
     * Create the claims of every template-backed workspace some task uses.
     *
     * @return names of the claims the run needs
     */
    public List<String> ensureClaims(PipelineRun run, PipelineSpec spec) {
        List<String> claims = new ArrayList<>();
        for (WorkspaceBinding binding : run.spec().workspaces()) {
            if (!binding.usesTemplate() || !isUsed(spec, binding.name())) {
                continue;
            }
            String name = claimName(binding, run);
            claims.add(name);
            if (controlPlane.volumeClaims().get(run.namespace(), name) != null) {
                continue;
            }

            PersistentVolumeClaim template = binding.volumeClaimTemplate();
            PersistentVolumeClaim claim = new PersistentVolumeClaim(
                    ObjectMeta.of(run.namespace(), name)
                            .withLabels(template.metadata().labels())
                            .withAnnotations(template.metadata().annotations())
                            .withOwnerReferences(List.of(OwnerReference.controllerOf(run))),
                    template.spec()
            );
            OwnedObjects.createOrAdopt(controlPlane.volumeClaims(), claim, run.metadata().uid());
            log.info("Created volume claim {} for workspace {} of run {}", name, binding.name(), run.metadata().key());
        }
        return claims;
    }

    /**
     * Workspaces of one task-run. Unbound optional workspaces are left out.
     */
    public List<WorkspaceBinding> bind(PipelineRun run, PipelineTask task) {
        List<WorkspaceBinding> bindings = new ArrayList<>();
        for (WorkspacePipelineTaskBinding taskBinding : task.workspaces()) {
            WorkspaceBinding runBinding = run.spec().workspace(taskBinding.workspace());
            if (runBinding == null) {
                continue;
            }
            String subPath = joinSubPaths(runBinding.subPath(), taskBinding.subPath());
            if (runBinding.usesTemplate()) {
                bindings.add(WorkspaceBinding.claim(taskBinding.name(), claimName(runBinding, run), subPath));
            } else {
                bindings.add(runBinding.rebind(taskBinding.name(), subPath));
            }
        }
        return bindings;
    }

    static String joinSubPaths(String runSubPath, String taskSubPath) {
        if (runSubPath.isEmpty()) {
            return taskSubPath;
        }
        if (taskSubPath.isEmpty()) {
            return runSubPath;
        }
        return runSubPath + "/" + taskSubPath;
    }

    private static boolean isUsed(PipelineSpec spec, String workspace) {
        return spec.tasks().stream()
                .flatMap(t -> t.workspaces().stream())
                .anyMatch(w -> w.workspace().equals(workspace));
    }
}
