package org.neuralchilli.pipeflow.store;

/**
 * Base class of control-plane failures. All of them are transient from the reconciler's
 * point of view: the pass is abandoned and retried.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
