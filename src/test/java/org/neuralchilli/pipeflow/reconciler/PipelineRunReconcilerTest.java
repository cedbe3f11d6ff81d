package org.neuralchilli.pipeflow.reconciler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.neuralchilli.pipeflow.domain.*;
import org.neuralchilli.pipeflow.store.ConflictException;
import org.neuralchilli.pipeflow.store.ObjectKey;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.neuralchilli.pipeflow.reconciler.ReconcilerFixture.NAMESPACE;
import static org.neuralchilli.pipeflow.reconciler.ReconcilerFixture.START;

class PipelineRunReconcilerTest {

    private ReconcilerFixture f;

    @BeforeEach
    void setup() {
        f = new ReconcilerFixture();
        f.task("echo");
    }

    private PipelineRun linearRun(String runName) {
        f.pipeline("linear", PipelineSpec.builder()
                .task(PipelineTask.builder("a").taskRef("echo").build())
                .task(PipelineTask.builder("b").taskRef("echo").runAfter("a").build())
                .build());
        return f.createRun(runName, PipelineRunSpec.forPipeline("linear").build());
    }

    private static String param(TaskRun taskRun, String name) {
        return taskRun.spec().params().stream()
                .filter(p -> p.name().equals(name))
                .map(p -> p.value().stringVal())
                .findFirst()
                .orElse(null);
    }

    @Nested
    class Scheduling {

        @Test
        void shouldStartOnlyRootTasksOnFirstPass() {
            // Given: b runs after a
            PipelineRun run = linearRun("linear-run");

            // When
            f.reconcile(run);

            // Then: only a exists and the run is running
            assertThat(f.taskRunsOf("linear-run")).extracting(TaskRun::pipelineTaskName).containsExactly("a");

            PipelineRun updated = f.run("linear-run");
            assertThat(updated.status().startTime()).isEqualTo(START);
            assertThat(updated.status().completionTime()).isNull();
            assertThat(updated.status().condition().status()).isEqualTo(ConditionStatus.UNKNOWN);
            assertThat(updated.status().condition().reason()).isEqualTo("Running");
            assertThat(updated.status().condition().message())
                    .isEqualTo("Not all Tasks in the Pipeline have finished executing");
            assertThat(updated.status().taskRuns()).hasSize(1);
            assertThat(updated.metadata().label(Labels.PIPELINE)).isEqualTo("linear");
        }

        @Test
        void shouldNameAndLabelTaskRunsAfterTheirRun() {
            // Given
            PipelineRun run = linearRun("labels-run");

            // When
            f.reconcile(run);

            // Then
            TaskRun a = f.taskRunFor("labels-run", "a");
            assertThat(a.name()).startsWith("labels-run-a-").hasSize("labels-run-a-".length() + 5);
            assertThat(a.metadata().labels())
                    .containsEntry(Labels.PIPELINE, "linear")
                    .containsEntry(Labels.PIPELINE_RUN, "labels-run")
                    .containsEntry(Labels.PIPELINE_TASK, "a");
            assertThat(a.metadata().isControlledBy(run.metadata().uid())).isTrue();
            assertThat(a.spec().serviceAccountName()).isEqualTo("default");
            assertThat(a.spec().timeout()).isEqualTo(Duration.ofMinutes(60));
        }

        @Test
        void shouldNotCreateTaskRunsTwiceAcrossPasses() {
            // Given
            PipelineRun run = linearRun("idempotent-run");

            // When: several passes with nothing changing in between
            f.reconcile(run);
            f.reconcile(run);
            f.reconcile(run);

            // Then: one create and one status write
            assertThat(f.taskRunsOf("idempotent-run")).hasSize(1);
            verify(f.taskRuns, times(1)).create(any());
            verify(f.pipelineRuns, times(1)).update(any());
        }

        @Test
        void shouldStartDependentOnlyAfterPredecessorSucceeded() {
            // Given
            PipelineRun run = linearRun("ordered-run");
            f.reconcile(run);
            TaskRun a = f.taskRunFor("ordered-run", "a");

            // When: a is still running
            f.markRunning(a);
            f.reconcile(run);

            // Then
            assertThat(f.taskRunFor("ordered-run", "b")).isNull();

            // When: a succeeds
            f.succeed(a);
            f.reconcile(run);

            // Then
            assertThat(f.taskRunFor("ordered-run", "b")).isNotNull();
        }

        @Test
        void shouldSucceedOnceEveryTaskSucceeded() {
            // Given
            PipelineRun run = linearRun("success-run");
            f.reconcile(run);
            f.succeed(f.taskRunFor("success-run", "a"));
            f.reconcile(run);

            // When
            f.clock.advance(Duration.ofSeconds(30));
            f.succeed(f.taskRunFor("success-run", "b"));
            f.reconcile(run);

            // Then
            PipelineRun updated = f.run("success-run");
            assertThat(updated.status().condition().status()).isEqualTo(ConditionStatus.TRUE);
            assertThat(updated.status().condition().reason()).isEqualTo("Succeeded");
            assertThat(updated.status().condition().message()).isEqualTo("All Tasks have completed executing");
            assertThat(updated.status().completionTime()).isEqualTo(START.plusSeconds(30));
        }

        @Test
        void shouldIgnoreRunsThatAlreadyFinished() {
            // Given: a finished run
            PipelineRun run = linearRun("done-run");
            f.reconcile(run);
            f.succeed(f.taskRunFor("done-run", "a"));
            f.reconcile(run);
            f.succeed(f.taskRunFor("done-run", "b"));
            f.reconcile(run);
            verify(f.pipelineRuns, times(3)).update(any());

            // When
            f.clock.advance(Duration.ofHours(2));
            f.reconcile(run);

            // Then: nothing written, completion time kept
            verify(f.pipelineRuns, times(3)).update(any());
            assertThat(f.run("done-run").status().completionTime()).isEqualTo(START);
        }
    }

    @Nested
    class Results {

        @BeforeEach
        void definitions() {
            f.task("producer", "digest");
            f.pipeline("results", PipelineSpec.builder()
                    .task(PipelineTask.builder("a").taskRef("producer").build())
                    .task(PipelineTask.builder("b").taskRef("echo")
                            .param("image", "registry/app@$(tasks.a.results.digest)")
                            .build())
                    .result("image-digest", "$(tasks.a.results.digest)")
                    .result("missing", "$(tasks.b.results.nothing)")
                    .build());
        }

        @Test
        void shouldPassResultsToDependentTasks() {
            // Given
            PipelineRun run = f.createRun("results-run", PipelineRunSpec.forPipeline("results").build());
            f.reconcile(run);
            assertThat(f.taskRunFor("results-run", "b")).isNull();

            // When
            f.succeed(f.taskRunFor("results-run", "a"), new TaskRunResult("digest", "sha256:abc"));
            f.reconcile(run);

            // Then
            TaskRun b = f.taskRunFor("results-run", "b");
            assertThat(param(b, "image")).isEqualTo("registry/app@sha256:abc");
        }

        @Test
        void shouldPublishResolvablePipelineResultsOnSuccess() {
            // Given
            PipelineRun run = f.createRun("published-run", PipelineRunSpec.forPipeline("results").build());
            f.reconcile(run);
            f.succeed(f.taskRunFor("published-run", "a"), new TaskRunResult("digest", "sha256:abc"));
            f.reconcile(run);

            // When
            f.succeed(f.taskRunFor("published-run", "b"));
            f.reconcile(run);

            // Then: the unresolvable result is left out
            PipelineRun updated = f.run("published-run");
            assertThat(updated.status().condition().isTrue()).isTrue();
            assertThat(updated.status().pipelineResults())
                    .containsExactly(new PipelineRunResult("image-digest", "sha256:abc"));
        }

        @Test
        void shouldFailRunWhenReferencedResultWasNotProduced() {
            // Given
            PipelineRun run = f.createRun("no-result-run", PipelineRunSpec.forPipeline("results").build());
            f.reconcile(run);

            // When: a succeeds without emitting digest
            f.succeed(f.taskRunFor("no-result-run", "a"));
            f.reconcile(run);

            // Then
            PipelineRun updated = f.run("no-result-run");
            assertThat(updated.status().condition().isFalse()).isTrue();
            assertThat(updated.status().condition().reason()).isEqualTo("InvalidTaskResultReference");
            assertThat(updated.status().completionTime()).isNotNull();
            assertThat(f.taskRunFor("no-result-run", "b")).isNull();
        }
    }

    @Nested
    class Failures {

        @Test
        void shouldFailRunAndStartNothingNewWhenATaskFails() {
            // Given: a -> b, and c on its own
            f.pipeline("mixed", PipelineSpec.builder()
                    .task(PipelineTask.builder("a").taskRef("echo").build())
                    .task(PipelineTask.builder("b").taskRef("echo").runAfter("a").build())
                    .task(PipelineTask.builder("c").taskRef("echo").build())
                    .build());
            PipelineRun run = f.createRun("mixed-run", PipelineRunSpec.forPipeline("mixed").build());
            f.reconcile(run);
            TaskRun a = f.taskRunFor("mixed-run", "a");

            // When
            f.fail(a);
            f.reconcile(run);

            // Then: run failed, b never started, c left alone
            PipelineRun updated = f.run("mixed-run");
            assertThat(updated.status().condition().isFalse()).isTrue();
            assertThat(updated.status().condition().reason()).isEqualTo("Failed");
            assertThat(updated.status().condition().message()).isEqualTo("TaskRun " + a.name() + " has failed");
            assertThat(updated.status().completionTime()).isEqualTo(START);
            assertThat(f.taskRunFor("mixed-run", "b")).isNull();
            assertThat(f.taskRunFor("mixed-run", "c").spec().isCancelled()).isFalse();
        }

        @Test
        void shouldRetryFailedTaskOnTheSameTaskRun() {
            // Given: one retry allowed
            f.pipeline("flaky", PipelineSpec.builder()
                    .task(PipelineTask.builder("a").taskRef("echo").retries(1).build())
                    .build());
            PipelineRun run = f.createRun("flaky-run", PipelineRunSpec.forPipeline("flaky").build());
            f.reconcile(run);
            TaskRun a = f.taskRunFor("flaky-run", "a");

            // When: first attempt fails
            f.fail(a);
            f.reconcile(run);

            // Then: the attempt is archived and the run keeps going
            TaskRun retried = f.taskRunFor("flaky-run", "a");
            assertThat(retried.name()).isEqualTo(a.name());
            assertThat(retried.status().condition().isUnknown()).isTrue();
            assertThat(retried.status().retriesStatus()).hasSize(1);
            assertThat(retried.status().retriesStatus().get(0).isFailed()).isTrue();
            assertThat(f.run("flaky-run").status().condition().isUnknown()).isTrue();
            verify(f.taskRuns, times(1)).create(any());

            // When: second attempt fails too
            f.fail(retried);
            f.reconcile(run);

            // Then
            PipelineRun updated = f.run("flaky-run");
            assertThat(updated.status().condition().reason()).isEqualTo("Failed");
            assertThat(f.taskRunFor("flaky-run", "a").status().retriesStatus()).hasSize(1);
        }

        @Test
        void shouldNotRecordCompletionWhenStatusWriteConflicts() {
            // Given: the only task succeeded, but the run was changed since it was read
            PipelineRun run = f.createRun("raced-run", PipelineRunSpec.embedded(PipelineSpec.builder()
                    .task(PipelineTask.builder("a").taskRef("echo").build())
                    .build()).build());
            f.reconcile(run);
            f.succeed(f.taskRunFor("raced-run", "a"));
            doThrow(new ConflictException("PipelineRun", ObjectKey.of(NAMESPACE, "raced-run"), 2))
                    .when(f.pipelineRuns).update(any());

            // When / Then
            assertThatThrownBy(() -> f.reconcile(run))
                    .isInstanceOf(ReconcileException.class)
                    .hasMessageContaining("Failed to update pipeline run " + NAMESPACE + "/raced-run")
                    .hasCauseInstanceOf(ConflictException.class);

            PipelineRun stored = f.run("raced-run");
            assertThat(stored.isDone()).isFalse();
            assertThat(stored.status().condition().isUnknown()).isTrue();
            assertThat(stored.status().completionTime()).isNull();
        }

        @Test
        void shouldIgnoreMalformedAndUnknownKeys() {
            // When / Then
            assertThatCode(() -> f.reconciler.reconcile("a/b/c")).doesNotThrowAnyException();
            assertThatCode(() -> f.reconciler.reconcile("")).doesNotThrowAnyException();
            assertThatCode(() -> f.reconciler.reconcile(NAMESPACE + "/absent")).doesNotThrowAnyException();
            verify(f.pipelineRuns, never()).update(any());
        }

        @Test
        void shouldFailRunWhenPipelineIsMissing() {
            // Given
            PipelineRun run = f.createRun("orphan-run", PipelineRunSpec.forPipeline("does-not-exist").build());

            // When
            f.reconcile(run);

            // Then
            PipelineRun updated = f.run("orphan-run");
            assertThat(updated.status().condition().isFalse()).isTrue();
            assertThat(updated.status().condition().reason()).isEqualTo("CouldntGetPipeline");
            assertThat(updated.status().condition().message())
                    .isEqualTo("Error retrieving pipeline for pipelinerun ns/orphan-run: pipeline does-not-exist not found");
            assertThat(updated.status().completionTime()).isEqualTo(START);
        }

        @Test
        void shouldFailRunWhenTaskIsMissing() {
            // Given
            f.pipeline("broken", PipelineSpec.builder()
                    .task(PipelineTask.builder("a").taskRef("no-such-task").build())
                    .build());
            PipelineRun run = f.createRun("broken-run", PipelineRunSpec.forPipeline("broken").build());

            // When
            f.reconcile(run);

            // Then
            assertThat(f.run("broken-run").status().condition().reason()).isEqualTo("CouldntGetTask");
            assertThat(f.taskRunsOf("broken-run")).isEmpty();
        }

        @Test
        void shouldFailRunWhenGraphHasACycle() {
            // Given
            f.pipeline("cyclic", PipelineSpec.builder()
                    .task(PipelineTask.builder("a").taskRef("echo").runAfter("b").build())
                    .task(PipelineTask.builder("b").taskRef("echo").runAfter("a").build())
                    .build());
            PipelineRun run = f.createRun("cyclic-run", PipelineRunSpec.forPipeline("cyclic").build());

            // When
            f.reconcile(run);

            // Then
            PipelineRun updated = f.run("cyclic-run");
            assertThat(updated.status().condition().reason()).isEqualTo("InvalidGraph");
            assertThat(updated.status().completionTime()).isNotNull();
        }

        @Test
        void shouldFailRunWhenRequiredParamIsMissing() {
            // Given
            f.pipeline("needs-param", PipelineSpec.builder()
                    .param(ParamSpec.required("revision", ParamType.STRING))
                    .task(PipelineTask.builder("a").taskRef("echo").param("rev", "$(params.revision)").build())
                    .build());
            PipelineRun run = f.createRun("param-run", PipelineRunSpec.forPipeline("needs-param").build());

            // When
            f.reconcile(run);

            // Then
            assertThat(f.run("param-run").status().condition().reason()).isEqualTo("FailedValidation");
        }
    }

    @Nested
    class Cancellation {

        @Test
        void shouldCancelRunningTaskRuns() {
            // Given
            PipelineRun run = linearRun("cancel-run");
            f.reconcile(run);
            f.pipelineRuns.patch(NAMESPACE, "cancel-run", r -> r.withSpec(r.spec().cancelled()));

            // When
            f.reconcile(run);

            // Then
            assertThat(f.taskRunFor("cancel-run", "a").spec().isCancelled()).isTrue();
            PipelineRun updated = f.run("cancel-run");
            assertThat(updated.status().condition().isFalse()).isTrue();
            assertThat(updated.status().condition().reason()).isEqualTo("Cancelled");
            assertThat(updated.status().condition().message()).isEqualTo("PipelineRun cancel-run was cancelled");
            assertThat(updated.status().completionTime()).isEqualTo(START);
            assertThat(f.taskRunFor("cancel-run", "b")).isNull();
        }

        @Test
        void shouldReportAndRetryWhenChildCannotBeCancelled() {
            // Given: patching task-runs always conflicts
            PipelineRun run = linearRun("stubborn-run");
            f.reconcile(run);
            f.pipelineRuns.patch(NAMESPACE, "stubborn-run", r -> r.withSpec(r.spec().cancelled()));
            TaskRun a = f.taskRunFor("stubborn-run", "a");
            doThrow(new ConflictException("TaskRun", ObjectKey.of(NAMESPACE, a.name()), 1))
                    .when(f.taskRuns).patch(anyString(), anyString(), any());

            // When / Then
            assertThatThrownBy(() -> f.reconcile(run)).isInstanceOf(ReconcileException.class);

            PipelineRun updated = f.run("stubborn-run");
            assertThat(updated.status().condition().isUnknown()).isTrue();
            assertThat(updated.status().condition().reason()).isEqualTo("CouldntCancel");
            assertThat(updated.status().condition().message())
                    .startsWith("PipelineRun stubborn-run was cancelled but had errors trying to cancel TaskRuns: ");
            assertThat(updated.status().completionTime()).isNull();

            // And: nothing new is started on the next attempt either
            assertThatThrownBy(() -> f.reconcile(run)).isInstanceOf(ReconcileException.class);
            verify(f.taskRuns, times(1)).create(any());
        }
    }

    @Nested
    class Timeouts {

        @Test
        void shouldBoundTaskRunTimeoutByWhatIsLeftOfTheRun() {
            // Given: a ten minute run, a task allowed an hour, started five minutes in
            f.pipeline("slow", PipelineSpec.builder()
                    .task(PipelineTask.builder("a").taskRef("echo").build())
                    .task(PipelineTask.builder("b").taskRef("echo").runAfter("a").timeout(Duration.ofHours(1)).build())
                    .build());
            PipelineRun run = f.createRun("slow-run",
                    PipelineRunSpec.forPipeline("slow").timeout(Duration.ofMinutes(10)).build());
            f.reconcile(run);
            assertThat(f.taskRunFor("slow-run", "a").spec().timeout()).isEqualTo(Duration.ofMinutes(10));

            // When
            f.clock.advance(Duration.ofMinutes(5));
            f.succeed(f.taskRunFor("slow-run", "a"));
            f.reconcile(run);

            // Then
            assertThat(f.taskRunFor("slow-run", "b").spec().timeout()).isEqualTo(Duration.ofMinutes(5));
        }

        @Test
        void shouldTimeOutAndCancelInFlightTaskRuns() {
            // Given
            f.pipeline("short", PipelineSpec.builder()
                    .task(PipelineTask.builder("a").taskRef("echo").build())
                    .task(PipelineTask.builder("b").taskRef("echo").runAfter("a").build())
                    .build());
            PipelineRun run = f.createRun("short-run",
                    PipelineRunSpec.forPipeline("short").timeout(Duration.ofMinutes(1)).build());
            f.reconcile(run);

            // When
            f.clock.advance(Duration.ofMinutes(2));
            f.reconcile(run);

            // Then
            PipelineRun updated = f.run("short-run");
            assertThat(updated.status().condition().isFalse()).isTrue();
            assertThat(updated.status().condition().reason()).isEqualTo("TimedOut");
            assertThat(updated.status().condition().message())
                    .isEqualTo("PipelineRun short-run failed to finish within " + Duration.ofMinutes(1));
            assertThat(updated.status().completionTime()).isEqualTo(START.plus(Duration.ofMinutes(2)));
            assertThat(f.taskRunFor("short-run", "a").spec().isCancelled()).isTrue();
            assertThat(f.taskRunFor("short-run", "b")).isNull();
        }

        @Test
        void shouldStayRunningWhenTimedOutTaskRunCannotBeCancelled() {
            // Given: a timed out run whose task-run patches always conflict
            PipelineRun run = f.createRun("hung-run", PipelineRunSpec.embedded(PipelineSpec.builder()
                    .task(PipelineTask.builder("a").taskRef("echo").build())
                    .build()).timeout(Duration.ofMinutes(1)).build());
            f.reconcile(run);
            TaskRun a = f.taskRunFor("hung-run", "a");
            f.clock.advance(Duration.ofMinutes(2));
            doThrow(new ConflictException("TaskRun", ObjectKey.of(NAMESPACE, a.name()), 1))
                    .when(f.taskRuns).patch(anyString(), anyString(), any());

            // When / Then
            assertThatThrownBy(() -> f.reconcile(run))
                    .isInstanceOf(ReconcileException.class)
                    .hasMessageContaining("timed out PipelineRun hung-run");

            PipelineRun stored = f.run("hung-run");
            assertThat(stored.isDone()).isFalse();
            assertThat(stored.status().condition().isUnknown()).isTrue();
            assertThat(stored.status().completionTime()).isNull();
            assertThat(f.taskRunFor("hung-run", "a").spec().isCancelled()).isFalse();
        }

        @Test
        void shouldNeverTimeOutWithZeroTimeout() {
            // Given
            PipelineRun run = f.createRun("forever-run", PipelineRunSpec.embedded(PipelineSpec.builder()
                    .task(PipelineTask.builder("a").taskRef("echo").build())
                    .build()).timeout(Duration.ZERO).build());
            f.reconcile(run);

            // When
            f.clock.advance(Duration.ofDays(3));
            f.reconcile(run);

            // Then
            assertThat(f.run("forever-run").status().condition().isUnknown()).isTrue();
            assertThat(f.taskRunFor("forever-run", "a").spec().timeout()).isEqualTo(Duration.ZERO);
        }
    }

    @Nested
    class Recovery {

        @Test
        void shouldRecoverTaskRunsMissingFromStatus() {
            // Given: the status write of the first pass was lost
            PipelineRun run = linearRun("lost-run");
            f.reconcile(run);
            TaskRun a = f.taskRunFor("lost-run", "a");
            f.pipelineRuns.patch(NAMESPACE, "lost-run", r -> r.withStatus(r.status().withTaskRuns(Map.of())));

            // When
            f.reconcile(run);

            // Then: the existing task-run is adopted, not recreated
            assertThat(f.run("lost-run").status().taskRuns()).containsOnlyKeys(a.name());
            assertThat(f.run("lost-run").status().taskRuns().get(a.name()).pipelineTaskName()).isEqualTo("a");
            verify(f.taskRuns, times(1)).create(any());
        }

        @Test
        void shouldKeepStoredPipelineSpecWhenPipelineChanges() {
            // Given
            PipelineRun run = linearRun("frozen-run");
            f.reconcile(run);
            PipelineSpec original = f.run("frozen-run").status().pipelineSpec();

            // When: the pipeline gains a task
            f.controlPlane.pipelines().patch(NAMESPACE, "linear", p -> new Pipeline(p.metadata(),
                    p.spec().withTasks(List.of(
                            PipelineTask.builder("a").taskRef("echo").build(),
                            PipelineTask.builder("b").taskRef("echo").runAfter("a").build(),
                            PipelineTask.builder("c").taskRef("echo").build()))));
            f.reconcile(run);

            // Then
            assertThat(f.run("frozen-run").status().pipelineSpec()).isEqualTo(original);
            assertThat(original.tasks()).hasSize(2);
        }

        @Test
        void shouldLabelEmbeddedRunsWithTheirOwnName() {
            // Given
            PipelineSpec spec = PipelineSpec.builder()
                    .task(PipelineTask.builder("a").taskRef("echo").build())
                    .build();
            PipelineRun run = f.createRun("inline-run", PipelineRunSpec.embedded(spec).build());

            // When
            f.reconcile(run);

            // Then
            PipelineRun updated = f.run("inline-run");
            assertThat(updated.metadata().label(Labels.PIPELINE)).isEqualTo("inline-run");
            assertThat(updated.status().pipelineSpec()).isEqualTo(spec);
            assertThat(f.taskRunFor("inline-run", "a").metadata().label(Labels.PIPELINE)).isEqualTo("inline-run");
        }
    }

    @Nested
    class Volumes {

        @Test
        void shouldNotCreateArtifactClaimWithoutResourceLinks() {
            // Given
            PipelineRun run = linearRun("plain-run");

            // When
            f.reconcile(run);

            // Then
            assertThat(f.controlPlane.volumeClaims().list(NAMESPACE)).isEmpty();
        }

        @Test
        void shouldShareOutputsThroughTheArtifactClaim() {
            // Given: b reads the source a wrote
            f.controlPlane.resources().create(new PipelineResource(ObjectMeta.of(NAMESPACE, "repo"),
                    PipelineResourceSpec.of(ResourceType.GIT, Map.of("url", "https://example.com/repo.git"))));
            f.pipeline("linked", PipelineSpec.builder()
                    .resource("source", ResourceType.GIT)
                    .task(PipelineTask.builder("a").taskRef("echo").output("workspace", "source").build())
                    .task(PipelineTask.builder("b").taskRef("echo").input("workspace", "source", "a").build())
                    .build());
            PipelineRun run = f.createRun("linked-run", PipelineRunSpec.forPipeline("linked")
                    .resource(PipelineResourceBinding.ref("source", "repo"))
                    .build());

            // When
            f.reconcile(run);
            f.succeed(f.taskRunFor("linked-run", "a"));
            f.reconcile(run);

            // Then
            PersistentVolumeClaim claim = f.controlPlane.volumeClaims().get(NAMESPACE, "linked-run-pvc");
            assertThat(claim).isNotNull();
            assertThat(claim.spec().storage()).isEqualTo("5Gi");
            assertThat(claim.metadata().isControlledBy(run.metadata().uid())).isTrue();

            TaskRunResources aResources = f.taskRunFor("linked-run", "a").spec().resources();
            assertThat(aResources.output("workspace").paths()).containsExactly("/pvc/a/workspace");
            assertThat(aResources.output("workspace").resourceRef()).isEqualTo("repo");

            TaskRunResources bResources = f.taskRunFor("linked-run", "b").spec().resources();
            assertThat(bResources.input("workspace").paths()).containsExactly("/pvc/a/workspace");
        }

        @Test
        void shouldCreateOneClaimPerTemplateWorkspace() {
            // Given
            f.pipeline("shared", PipelineSpec.builder()
                    .workspace("data")
                    .task(PipelineTask.builder("a").taskRef("echo").workspace("src", "data", "a-dir").build())
                    .task(PipelineTask.builder("b").taskRef("echo").workspace("src", "data", "").build())
                    .build());
            PersistentVolumeClaim template = new PersistentVolumeClaim(ObjectMeta.of("", "vol"),
                    new PersistentVolumeClaimSpec(null, "1Gi", null));
            PipelineRun run = f.createRun("vct-run", PipelineRunSpec.forPipeline("shared")
                    .workspace(WorkspaceBinding.template("data", template, "run-dir"))
                    .build());

            // When
            f.reconcile(run);
            f.reconcile(run);

            // Then
            assertThat(f.controlPlane.volumeClaims().list(NAMESPACE))
                    .extracting(PersistentVolumeClaim::name)
                    .containsExactly("vol-data-vct-run");

            WorkspaceBinding bound = f.taskRunFor("vct-run", "a").spec().workspaces().get(0);
            assertThat(bound.name()).isEqualTo("src");
            assertThat(bound.persistentVolumeClaim()).isEqualTo("vol-data-vct-run");
            assertThat(bound.subPath()).isEqualTo("run-dir/a-dir");
            assertThat(f.taskRunFor("vct-run", "b").spec().workspaces().get(0).subPath()).isEqualTo("run-dir");
        }
    }

    @Nested
    class Conditions {

        @BeforeEach
        void definitions() {
            f.condition("is-ready");
            f.pipeline("gated", PipelineSpec.builder()
                    .task(PipelineTask.builder("deploy").taskRef("echo").condition("is-ready").build())
                    .build());
        }

        @Test
        void shouldRunConditionCheckBeforeTheTask() {
            // Given
            PipelineRun run = f.createRun("gated-run", PipelineRunSpec.forPipeline("gated").build());

            // When
            f.reconcile(run);

            // Then: only the check exists
            assertThat(f.taskRunsOf("gated-run")).isEmpty();
            List<TaskRun> checks = f.checksOf("gated-run");
            assertThat(checks).hasSize(1);
            TaskRun check = checks.get(0);
            assertThat(check.metadata().labels())
                    .containsEntry(Labels.CONDITION_NAME, "is-ready")
                    .containsEntry(Labels.CONDITION_CHECK, check.name())
                    .containsEntry(Labels.PIPELINE_TASK, "deploy");
            assertThat(check.spec().taskRef().kind()).isEqualTo(TaskKind.INLINE);
            Step step = check.spec().taskRef().spec().steps().get(0);
            assertThat(step.name()).isEqualTo("condition-check-is-ready");
            assertThat(step.image()).isEqualTo("busybox");
            assertThat(step.args()).containsExactly("test -f $(resources.source.path)/README");

            PipelineRunTaskRunStatus entry = f.run("gated-run").status().taskRuns().values().iterator().next();
            assertThat(entry.pipelineTaskName()).isEqualTo("deploy");
            assertThat(entry.conditionChecks()).containsOnlyKeys(check.name());
            assertThat(entry.conditionChecks().get(check.name()).conditionName()).isEqualTo("is-ready-0");
        }

        @Test
        void shouldStartTaskOnceConditionCheckPassed() {
            // Given
            PipelineRun run = f.createRun("pass-run", PipelineRunSpec.forPipeline("gated").build());
            f.reconcile(run);

            // When
            f.succeed(f.checksOf("pass-run").get(0));
            f.reconcile(run);

            // Then
            assertThat(f.taskRunFor("pass-run", "deploy")).isNotNull();
            assertThat(f.checksOf("pass-run")).hasSize(1);
        }

        @Test
        void shouldSkipTaskWhenConditionCheckFailed() {
            // Given
            PipelineRun run = f.createRun("skip-run", PipelineRunSpec.forPipeline("gated").build());
            f.reconcile(run);

            // When
            f.fail(f.checksOf("skip-run").get(0));
            f.reconcile(run);

            // Then: nothing left to run, so the run succeeds
            assertThat(f.taskRunsOf("skip-run")).isEmpty();
            PipelineRun updated = f.run("skip-run");
            assertThat(updated.status().condition().isTrue()).isTrue();
            PipelineRunTaskRunStatus entry = updated.status().taskRuns().values().iterator().next();
            assertThat(entry.status().condition().reason()).isEqualTo(TaskRunReason.CONDITION_CHECK_FAILED);
            assertThat(entry.status().condition().message()).endsWith("in PipelineRun skip-run");
        }

        @Test
        void shouldNotRecreateChecksLostFromStatus() {
            // Given: two gates on one task, and the status write of the first pass was lost
            f.condition("is-approved");
            f.pipeline("double-gated", PipelineSpec.builder()
                    .task(PipelineTask.builder("deploy").taskRef("echo")
                            .condition("is-ready").condition("is-approved").build())
                    .build());
            PipelineRun run = f.createRun("regate-run", PipelineRunSpec.forPipeline("double-gated").build());
            f.reconcile(run);
            assertThat(f.checksOf("regate-run")).hasSize(2);
            f.pipelineRuns.patch(NAMESPACE, "regate-run", r -> r.withStatus(r.status().withTaskRuns(Map.of())));

            // When
            f.reconcile(run);
            f.reconcile(run);

            // Then: both checks are adopted under their own index
            assertThat(f.checksOf("regate-run")).hasSize(2);
            PipelineRunTaskRunStatus entry = f.run("regate-run").status().taskRuns().values().iterator().next();
            assertThat(entry.conditionChecks().values())
                    .extracting(PipelineRunConditionCheckStatus::conditionName)
                    .containsExactlyInAnyOrder("is-ready-0", "is-approved-1");
            verify(f.taskRuns, times(2)).create(any());
        }
    }
}
