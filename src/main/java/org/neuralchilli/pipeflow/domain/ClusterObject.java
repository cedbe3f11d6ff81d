package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;

/**
 * An object stored in the control plane.
 * Every stored object carries {@link ObjectMeta}; the store rewrites it on create and update.
 *
 * @param <T> the concrete object type
 */
public interface ClusterObject<T extends ClusterObject<T>> extends Serializable {

    ObjectMeta metadata();

    /**
     * Copy of this object with different metadata.
     */
    T withMetadata(ObjectMeta metadata);

    default String name() {
        return metadata().name();
    }

    default String namespace() {
        return metadata().namespace();
    }
}
