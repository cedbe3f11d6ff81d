package org.neuralchilli.pipeflow.workspace;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.pipeflow.config.HazelcastTestProducer;
import org.neuralchilli.pipeflow.config.ReconcilerConfig;
import org.neuralchilli.pipeflow.domain.*;
import org.neuralchilli.pipeflow.resolution.ResolvedPipelineTask;
import org.neuralchilli.pipeflow.resolution.ResolvedResource;
import org.neuralchilli.pipeflow.store.ControlPlane;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ResourceLinkerTest {

    private static final PipelineResourceSpec GIT = PipelineResourceSpec.of(ResourceType.GIT,
            Map.of("url", "https://example.com/app.git"));

    private ControlPlane controlPlane;
    private ResourceLinker linker;

    private final PipelineSpec linked = PipelineSpec.builder()
            .resource("repo", ResourceType.GIT)
            .task(PipelineTask.builder("checkout").taskRef("git").output("out", "repo").build())
            .task(PipelineTask.builder("test").taskRef("unit").input("src", "repo", "checkout").build())
            .build();

    @BeforeEach
    void setup() {
        controlPlane = new ControlPlane(HazelcastTestProducer.shared(), Clock.systemUTC(), "res-" + UUID.randomUUID() + "-");
        linker = new ResourceLinker(controlPlane, ReconcilerConfig.defaults());
    }

    private static ResolvedPipelineTask resolved(PipelineTask task, ResolvedResource resource) {
        return new ResolvedPipelineTask(task, "run-" + task.name(), null, TaskKind.TASK, task.taskRef().name(),
                TaskSpec.EMPTY, Map.of("repo", resource), List.of());
    }

    @Test
    void shouldNeedStorageOnlyWhenAnInputNamesAProducer() {
        PipelineSpec unlinked = PipelineSpec.builder()
                .resource("repo", ResourceType.GIT)
                .task(PipelineTask.builder("test").taskRef("unit").input("src", "repo").build())
                .build();

        assertThat(linker.needsArtifactStorage(linked)).isTrue();
        assertThat(linker.needsArtifactStorage(unlinked)).isFalse();
    }

    @Test
    void shouldCreateArtifactClaimOnce() {
        // Given
        PipelineRun run = controlPlane.pipelineRuns().create(
                PipelineRun.of("ns", "r1", PipelineRunSpec.forPipeline("p").build()));

        // When
        assertThat(linker.ensureArtifactClaim(run, linked)).isTrue();
        assertThat(linker.ensureArtifactClaim(run, linked)).isTrue();

        // Then
        assertThat(controlPlane.volumeClaims().list("ns")).extracting(PersistentVolumeClaim::name)
                .containsExactly("r1-pvc");
        PersistentVolumeClaim claim = controlPlane.volumeClaims().get("ns", ResourceLinker.artifactClaimName(run));
        assertThat(claim.spec().accessModes()).containsExactly(PersistentVolumeClaimSpec.READ_WRITE_ONCE);
        assertThat(claim.spec().storage()).isEqualTo("5Gi");
    }

    @Test
    void shouldLinkOutputsToInputsThroughArtifactPaths() {
        // Given
        ResolvedResource repo = new ResolvedResource("repo", "app-repo", GIT);

        // When
        TaskRunResources producer = linker.bind(linked, resolved(linked.task("checkout"), repo), true);
        TaskRunResources consumer = linker.bind(linked, resolved(linked.task("test"), repo), true);

        // Then
        assertThat(producer.output("out").paths()).containsExactly("/pvc/checkout/out");
        assertThat(producer.output("out").resourceRef()).isEqualTo("app-repo");
        assertThat(consumer.input("src").paths()).containsExactly("/pvc/checkout/out");
    }

    @Test
    void shouldBindInlineResourcesWithoutPathsWhenStorageIsOff() {
        ResolvedResource inline = new ResolvedResource("repo", null, GIT);

        TaskRunResources resources = linker.bind(linked, resolved(linked.task("test"), inline), false);

        TaskResourceBinding src = resources.input("src");
        assertThat(src.resourceRef()).isNull();
        assertThat(src.resourceSpec()).isEqualTo(GIT);
        assertThat(src.paths()).isEmpty();
    }
}
