package com.proofmill.witness.objectstore;

/**
 * Raw byte storage for large artifacts.
 *
 * Puts are overwrite-in-place: storing twice under the same key leaves
 * exactly one object holding the last value.
 */
public interface ObjectStore {

    /**
     * @throws ObjectStoreException if the object is missing or unreadable
     */
    byte[] get(BlobKey key);

    /**
     * @return the object name the value was stored under
     * @throws ObjectStoreException if the write fails
     */
    String put(BlobKey key, byte[] value);
}
