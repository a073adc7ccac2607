package com.proofmill.witness.objectstore;

/**
 * Identity of an object in the store.
 *
 * Implementations must derive {@link #objectName()} from their fields only,
 * so that a retried put lands on the same object and overwrites it.
 */
public interface BlobKey {

    Bucket bucket();

    String objectName();
}
