package com.proofmill.witness.objectstore;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Typed access to the object store: values are encoded as JSON with Jackson.
 *
 * Storage errors surface as {@link ObjectStoreException}. A blob that was read
 * but cannot be decoded raises {@link BlobDecodeException}; a value that cannot
 * be encoded raises {@link IllegalArgumentException}.
 */
public class ObjectStoreClient {

    private final ObjectStore  store;
    private final ObjectMapper json;

    public ObjectStoreClient(ObjectStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.json  = objectMapper;
    }

    public <T> T get(BlobKey key, Class<T> type) {
        byte[] bytes = store.get(key);
        try {
            return json.readValue(bytes, type);
        } catch (IOException e) {
            throw new BlobDecodeException(
                    "Failed to decode " + key.bucket().dirName() + "/" + key.objectName()
                    + " as " + type.getSimpleName(), e);
        }
    }

    /** @return the object name the value was stored under */
    public String put(BlobKey key, Object value) {
        byte[] bytes;
        try {
            bytes = json.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "Failed to encode " + value.getClass().getSimpleName() + " for " + key.objectName(), e);
        }
        return store.put(key, bytes);
    }
}
