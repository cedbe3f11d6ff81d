package org.neuralchilli.pipeflow.store;

import org.neuralchilli.pipeflow.domain.ClusterObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creation of objects controlled by an owner, tolerant of a previous pass having
 * created the same object already.
 */
public final class OwnedObjects {

    private static final Logger log = LoggerFactory.getLogger(OwnedObjects.class);

    private OwnedObjects() {
    }

    /**
     * Create {@code object}; if its name is taken by an object controlled by {@code ownerUid},
     * return that object instead.
     *
     * @throws AlreadyExistsException if the name is taken by an object with another owner
     */
    public static <T extends ClusterObject<T>> T createOrAdopt(ObjectStore<T> store, T object, String ownerUid) {
        try {
            return store.create(object);
        } catch (AlreadyExistsException e) {
            T existing = store.get(object.namespace(), object.name());
            if (existing != null && ownerUid != null && existing.metadata().isControlledBy(ownerUid)) {
                log.debug("Adopting existing {} {}", store.kind(), existing.metadata().key());
                return existing;
            }
            throw e;
        }
    }
}
