package org.neuralchilli.pipeflow.store;

/**
 * Thrown by create when an object with the same key is already stored.
 */
public class AlreadyExistsException extends StoreException {

    private final ObjectKey key;

    public AlreadyExistsException(String kind, ObjectKey key) {
        super(kind + " " + key + " already exists");
        this.key = key;
    }

    public ObjectKey key() {
        return key;
    }
}
