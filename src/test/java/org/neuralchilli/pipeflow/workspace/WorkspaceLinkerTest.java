package org.neuralchilli.pipeflow.workspace;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.pipeflow.config.HazelcastTestProducer;
import org.neuralchilli.pipeflow.domain.*;
import org.neuralchilli.pipeflow.store.ControlPlane;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class WorkspaceLinkerTest {

    private ControlPlane controlPlane;
    private WorkspaceLinker linker;

    private final PipelineSpec spec = PipelineSpec.builder()
            .workspace("source")
            .workspace("cache")
            .task(PipelineTask.builder("build").taskRef("echo")
                    .workspace("src", "source", "app")
                    .workspace("cache", "cache", null)
                    .build())
            .build();

    @BeforeEach
    void setup() {
        controlPlane = new ControlPlane(HazelcastTestProducer.shared(), Clock.systemUTC(), "ws-" + UUID.randomUUID() + "-");
        linker = new WorkspaceLinker(controlPlane);
    }

    private PipelineRun storedRun(WorkspaceBinding... bindings) {
        PipelineRunSpec.Builder builder = PipelineRunSpec.forPipeline("p");
        for (WorkspaceBinding binding : bindings) {
            builder.workspace(binding);
        }
        return controlPlane.pipelineRuns().create(PipelineRun.of("ns", "run-1", builder.build()));
    }

    private static PersistentVolumeClaim template(String name) {
        return new PersistentVolumeClaim(ObjectMeta.of("", name).withLabel("team", "ci"),
                new PersistentVolumeClaimSpec(null, "2Gi", "fast"));
    }

    @Test
    void shouldJoinRunAndTaskSubPaths() {
        assertThat(WorkspaceLinker.joinSubPaths("", "")).isEmpty();
        assertThat(WorkspaceLinker.joinSubPaths("run", "")).isEqualTo("run");
        assertThat(WorkspaceLinker.joinSubPaths("", "task")).isEqualTo("task");
        assertThat(WorkspaceLinker.joinSubPaths("run", "task")).isEqualTo("run/task");
    }

    @Test
    void shouldRebindRunWorkspacesUnderTaskNames() {
        // Given
        PipelineRun run = storedRun(
                WorkspaceBinding.claim("source", "shared-pvc", "checkout"),
                WorkspaceBinding.emptyDir("cache"));

        // When
        List<WorkspaceBinding> bound = linker.bind(run, spec.task("build"));

        // Then
        assertThat(bound).containsExactly(
                WorkspaceBinding.claim("src", "shared-pvc", "checkout/app"),
                new WorkspaceBinding("cache", "", null, true, null, null, null));
    }

    @Test
    void shouldLeaveOutUnboundWorkspaces() {
        PipelineRun run = storedRun(WorkspaceBinding.emptyDir("cache"));

        assertThat(linker.bind(run, spec.task("build"))).extracting(WorkspaceBinding::name).containsExactly("cache");
    }

    @Test
    void shouldCreateOneClaimPerTemplateWorkspace() {
        // Given
        PipelineRun run = storedRun(
                WorkspaceBinding.template("source", template("vol"), null),
                WorkspaceBinding.emptyDir("cache"));

        // When
        List<String> claims = linker.ensureClaims(run, spec);
        linker.ensureClaims(run, spec);

        // Then
        assertThat(claims).containsExactly("vol-source-run-1");
        List<PersistentVolumeClaim> stored = controlPlane.volumeClaims().list("ns");
        assertThat(stored).hasSize(1);
        PersistentVolumeClaim claim = stored.get(0);
        assertThat(claim.spec().storage()).isEqualTo("2Gi");
        assertThat(claim.spec().storageClassName()).isEqualTo("fast");
        assertThat(claim.metadata().label("team")).isEqualTo("ci");
        assertThat(claim.metadata().isControlledBy(run.metadata().uid())).isTrue();

        assertThat(linker.bind(run, spec.task("build")).get(0))
                .isEqualTo(WorkspaceBinding.claim("src", "vol-source-run-1", "app"));
    }

    @Test
    void shouldSkipTemplatesNoTaskUses() {
        PipelineRun run = storedRun(WorkspaceBinding.template("unused", template("vol"), null));

        assertThat(linker.ensureClaims(run, spec)).isEmpty();
        assertThat(controlPlane.volumeClaims().list("ns")).isEmpty();
    }
}
