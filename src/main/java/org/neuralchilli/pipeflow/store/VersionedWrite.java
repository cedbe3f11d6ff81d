package org.neuralchilli.pipeflow.store;

import com.hazelcast.map.EntryProcessor;
import org.neuralchilli.pipeflow.domain.ClusterObject;

import java.io.Serial;
import java.util.Map;

/**
 * Compare-and-set on resource version, executed atomically on the key's partition.
 */
final class VersionedWrite<T extends ClusterObject<T>> implements EntryProcessor<ObjectKey, T, VersionedWrite.Outcome> {

    @Serial
    private static final long serialVersionUID = 1L;

    enum Outcome {
        APPLIED,
        CONFLICT,
        MISSING
    }

    private final long expectedVersion;
    private final T replacement;

    VersionedWrite(long expectedVersion, T replacement) {
        this.expectedVersion = expectedVersion;
        this.replacement = replacement;
    }

    @Override
    public Outcome process(Map.Entry<ObjectKey, T> entry) {
        T current = entry.getValue();
        if (current == null) {
            return Outcome.MISSING;
        }
        if (current.metadata().resourceVersion() != expectedVersion) {
            return Outcome.CONFLICT;
        }
        entry.setValue(replacement);
        return Outcome.APPLIED;
    }
}
