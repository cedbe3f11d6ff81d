package org.neuralchilli.pipeflow.store;

/**
 * Thrown by update and patch when the target object is not stored.
 */
public class NotFoundException extends StoreException {

    public NotFoundException(String kind, ObjectKey key) {
        super(kind + " " + key + " not found");
    }
}
