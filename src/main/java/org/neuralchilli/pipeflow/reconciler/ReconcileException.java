package org.neuralchilli.pipeflow.reconciler;

/**
 * A pass that could not finish and should be retried, usually after a store conflict
 * or a child that could not be patched.
 */
public class ReconcileException extends RuntimeException {

    public ReconcileException(String message) {
        super(message);
    }

    public ReconcileException(String message, Throwable cause) {
        super(message, cause);
    }
}
