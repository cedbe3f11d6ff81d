package org.neuralchilli.pipeflow.store;

/**
 * Thrown when an update carries a resource version that is no longer current.
 */
public class ConflictException extends StoreException {

    private final String kind;
    private final ObjectKey key;

    public ConflictException(String kind, ObjectKey key, long expectedVersion) {
        super(String.format("Operation cannot be fulfilled on %s %s: object has been modified (expected version %d)",
                kind, key, expectedVersion));
        this.kind = kind;
        this.key = key;
    }

    public String kind() {
        return kind;
    }

    public ObjectKey key() {
        return key;
    }
}
