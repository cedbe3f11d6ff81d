package org.neuralchilli.pipeflow.store;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.pipeflow.config.HazelcastTestProducer;
import org.neuralchilli.pipeflow.domain.ObjectMeta;
import org.neuralchilli.pipeflow.domain.OwnerReference;
import org.neuralchilli.pipeflow.domain.Task;
import org.neuralchilli.pipeflow.domain.TaskSpec;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

class HazelcastObjectStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T08:00:00Z");

    private HazelcastObjectStore<Task> store;
    private String watchId;

    @BeforeEach
    void setup() {
        store = new HazelcastObjectStore<>(HazelcastTestProducer.shared(), "tasks-" + UUID.randomUUID(), "Task",
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void cleanup() {
        if (watchId != null) {
            store.unwatch(watchId);
        }
    }

    private static Task task(String namespace, String name) {
        return new Task(ObjectMeta.of(namespace, name), TaskSpec.EMPTY);
    }

    @Test
    void shouldStampNewObjects() {
        // When
        Task created = store.create(task("ns", "build"));

        // Then
        assertThat(created.metadata().uid()).isNotBlank();
        assertThat(created.metadata().resourceVersion()).isEqualTo(1);
        assertThat(created.metadata().creationTimestamp()).isEqualTo(NOW);
        assertThat(store.get("ns", "build")).isEqualTo(created);
        assertThat(store.get("other", "build")).isNull();
    }

    @Test
    void shouldRejectDuplicateCreate() {
        store.create(task("ns", "build"));

        assertThatThrownBy(() -> store.create(task("ns", "build")))
                .isInstanceOf(AlreadyExistsException.class)
                .hasMessageContaining("ns/build");
    }

    @Test
    void shouldBumpVersionOnUpdate() {
        // Given
        Task created = store.create(task("ns", "build"));

        // When
        Task updated = store.update(created.withMetadata(created.metadata().withLabel("tier", "gold")));

        // Then
        assertThat(updated.metadata().resourceVersion()).isEqualTo(2);
        assertThat(store.get("ns", "build").metadata().label("tier")).isEqualTo("gold");
    }

    @Test
    void shouldRejectStaleUpdate() {
        // Given: two writers read version 1
        Task first = store.create(task("ns", "build"));
        Task second = store.get("ns", "build");
        store.update(first.withMetadata(first.metadata().withLabel("writer", "one")));

        // When / Then
        assertThatThrownBy(() -> store.update(second.withMetadata(second.metadata().withLabel("writer", "two"))))
                .isInstanceOf(ConflictException.class);
        assertThat(store.get("ns", "build").metadata().label("writer")).isEqualTo("one");
    }

    @Test
    void shouldFailUpdateOfMissingObject() {
        Task never = task("ns", "ghost").withMetadata(ObjectMeta.of("ns", "ghost").withResourceVersion(1));

        assertThatThrownBy(() -> store.update(never)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.patch("ns", "ghost", t -> t)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void shouldPatchLatestVersion() {
        // Given
        store.create(task("ns", "build"));
        Task current = store.get("ns", "build");
        store.update(current.withMetadata(current.metadata().withLabel("a", "1")));

        // When
        Task patched = store.patch("ns", "build", t -> t.withMetadata(t.metadata().withLabel("b", "2")));

        // Then
        assertThat(patched.metadata().labels()).containsEntry("a", "1").containsEntry("b", "2");
        assertThat(patched.metadata().resourceVersion()).isEqualTo(3);
    }

    @Test
    void shouldListByNamespaceAndSelectorSortedByName() {
        // Given
        store.create(task("ns", "zeta").withMetadata(ObjectMeta.of("ns", "zeta").withLabel("run", "r1")));
        store.create(task("ns", "alpha").withMetadata(ObjectMeta.of("ns", "alpha").withLabel("run", "r1")));
        store.create(task("ns", "other").withMetadata(ObjectMeta.of("ns", "other").withLabel("run", "r2")));
        store.create(task("elsewhere", "beta").withMetadata(ObjectMeta.of("elsewhere", "beta").withLabel("run", "r1")));

        // When
        List<Task> selected = store.list("ns", Map.of("run", "r1"));

        // Then
        assertThat(selected).extracting(Task::name).containsExactly("alpha", "zeta");
        assertThat(store.list("ns")).hasSize(3);
        assertThat(store.keys()).contains(ObjectKey.of("elsewhere", "beta")).hasSize(4);
    }

    @Test
    void shouldNotifyWatchersOfCreatesAndUpdates() {
        // Given
        List<String> seen = new CopyOnWriteArrayList<>();
        watchId = store.watch(t -> seen.add(t.name() + "@" + t.metadata().resourceVersion()));

        // When
        store.create(task("ns", "build"));
        store.patch("ns", "build", t -> t.withMetadata(t.metadata().withLabel("x", "y")));

        // Then
        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
                assertThat(seen).containsExactly("build@1", "build@2"));
    }

    @Test
    void shouldAdoptObjectsAlreadyCreatedForTheSameOwner() {
        // Given: an object created by an earlier pass for owner uid-1
        OwnerReference owner = new OwnerReference(OwnerReference.API_VERSION, "PipelineRun", "run", "uid-1", true, true);
        Task owned = task("ns", "child").withMetadata(ObjectMeta.of("ns", "child").withOwnerReferences(List.of(owner)));
        Task first = OwnedObjects.createOrAdopt(store, owned, "uid-1");

        // When
        Task again = OwnedObjects.createOrAdopt(store, owned, "uid-1");

        // Then
        assertThat(again).isEqualTo(first);
        assertThatThrownBy(() -> OwnedObjects.createOrAdopt(store, owned, "uid-2"))
                .isInstanceOf(AlreadyExistsException.class);
    }
}
