package org.neuralchilli.pipeflow.store;

import com.hazelcast.core.EntryEvent;
import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import com.hazelcast.map.listener.EntryAddedListener;
import com.hazelcast.map.listener.EntryUpdatedListener;
import org.neuralchilli.pipeflow.domain.ClusterObject;
import org.neuralchilli.pipeflow.domain.ObjectMeta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * {@link ObjectStore} backed by a Hazelcast {@link IMap}.
 *
 * Creation uses {@code putIfAbsent}; updates run a {@link VersionedWrite} entry processor so the
 * version check and the write happen atomically on the owning partition.
 */
public class HazelcastObjectStore<T extends ClusterObject<T>> implements ObjectStore<T> {

    private static final Logger log = LoggerFactory.getLogger(HazelcastObjectStore.class);
    private static final int MAX_OPTIMISTIC_LOCK_RETRIES = 10;

    private final IMap<ObjectKey, T> map;
    private final String kind;
    private final Clock clock;

    public HazelcastObjectStore(HazelcastInstance hazelcast, String mapName, String kind, Clock clock) {
        this.map = hazelcast.getMap(mapName);
        this.kind = kind;
        this.clock = clock;
    }

    @Override
    public String kind() {
        return kind;
    }

    @Override
    public T get(String namespace, String name) {
        return map.get(ObjectKey.of(namespace, name));
    }

    @Override
    public List<T> list(String namespace, Map<String, String> selector) {
        return map.values(new LabelSelectorPredicate<>(namespace, selector)).stream()
                .sorted(Comparator.comparing(ClusterObject::name))
                .toList();
    }

    @Override
    public Set<ObjectKey> keys() {
        return Set.copyOf(map.keySet());
    }

    @Override
    public T create(T object) {
        ObjectMeta meta = object.metadata();
        ObjectKey key = ObjectKey.of(meta.namespace(), meta.name());
        String uid = meta.uid() != null ? meta.uid() : UUID.randomUUID().toString();
        T stamped = object.withMetadata(meta.created(uid, clock.instant()));

        T existing = map.putIfAbsent(key, stamped);
        if (existing != null) {
            throw new AlreadyExistsException(kind, key);
        }

        log.debug("Created {} {}", kind, key);
        return stamped;
    }

    @Override
    public T update(T object) {
        ObjectMeta meta = object.metadata();
        ObjectKey key = ObjectKey.of(meta.namespace(), meta.name());
        long expected = meta.resourceVersion();
        T next = object.withMetadata(meta.withResourceVersion(expected + 1));

        VersionedWrite.Outcome outcome = map.executeOnKey(key, new VersionedWrite<>(expected, next));
        switch (outcome) {
            case APPLIED -> {
                log.trace("Updated {} {} to version {}", kind, key, expected + 1);
                return next;
            }
            case MISSING -> throw new NotFoundException(kind, key);
            default -> throw new ConflictException(kind, key, expected);
        }
    }

    @Override
    public T patch(String namespace, String name, UnaryOperator<T> mutation) {
        ObjectKey key = ObjectKey.of(namespace, name);

        for (int attempt = 1; attempt <= MAX_OPTIMISTIC_LOCK_RETRIES; attempt++) {
            T current = map.get(key);
            if (current == null) {
                throw new NotFoundException(kind, key);
            }
            try {
                return update(mutation.apply(current));
            } catch (ConflictException e) {
                log.debug("Patch of {} {} conflicted (attempt {}/{})", kind, key, attempt, MAX_OPTIMISTIC_LOCK_RETRIES);
            }
        }

        log.warn("Failed to patch {} {} after {} attempts", kind, key, MAX_OPTIMISTIC_LOCK_RETRIES);
        T latest = map.get(key);
        throw new ConflictException(kind, key, latest != null ? latest.metadata().resourceVersion() : -1);
    }

    @Override
    public String watch(Consumer<T> listener) {
        UUID id = map.addEntryListener(new ChangeListener<>(listener), true);
        return id.toString();
    }

    @Override
    public void unwatch(String registrationId) {
        map.removeEntryListener(UUID.fromString(registrationId));
    }

    private static final class ChangeListener<T> implements EntryAddedListener<ObjectKey, T>, EntryUpdatedListener<ObjectKey, T> {

        private final Consumer<T> delegate;

        ChangeListener(Consumer<T> delegate) {
            this.delegate = delegate;
        }

        @Override
        public void entryAdded(EntryEvent<ObjectKey, T> event) {
            delegate.accept(event.getValue());
        }

        @Override
        public void entryUpdated(EntryEvent<ObjectKey, T> event) {
            delegate.accept(event.getValue());
        }
    }
}
