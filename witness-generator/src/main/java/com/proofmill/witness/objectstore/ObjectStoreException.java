package com.proofmill.witness.objectstore;

/**
 * Thrown when the object store cannot read or write an object.
 *
 * Always treated as transient by the job processor: the job is marked
 * failed and stays eligible for requeue.
 */
public class ObjectStoreException extends RuntimeException {

    public ObjectStoreException(String message) {
        super(message);
    }

    public ObjectStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
