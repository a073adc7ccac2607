package com.proofmill.witness.objectstore;

/**
 * An object was read but its contents are not a valid encoding of the expected type:
 * malformed JSON, or an unknown {@code kind} discriminator.
 *
 * Unlike {@link ObjectStoreException} this is not a storage problem, and
 * reading the same object again gives the same result.
 */
public class BlobDecodeException extends RuntimeException {

    public BlobDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
