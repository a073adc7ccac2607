package com.proofmill.witness.objectstore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Object store on a local (or mounted) directory: one sub-directory per bucket,
 * one file per object.
 *
 * Writes go to a temp file in the bucket directory and are then moved over the
 * target, so readers never see a half-written object.
 */
public class FileBackedObjectStore implements ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(FileBackedObjectStore.class);

    private final Path basePath;

    public FileBackedObjectStore(Path basePath) {
        this.basePath = basePath;
    }

    @Override
    public byte[] get(BlobKey key) {
        Path path = resolve(key);
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new ObjectStoreException("Object not found: " + describe(key), e);
        } catch (IOException e) {
            throw new ObjectStoreException("Failed to read " + describe(key), e);
        }
    }

    @Override
    public String put(BlobKey key, byte[] value) {
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), key.objectName(), ".tmp");
            try {
                Files.write(tmp, value);
                moveIntoPlace(tmp, target);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new ObjectStoreException("Failed to write " + describe(key), e);
        }
        log.debug("Stored {} ({} bytes)", describe(key), value.length);
        return key.objectName();
    }

    public Path basePath() { return basePath; }

    private Path resolve(BlobKey key) {
        return basePath.resolve(key.bucket().dirName()).resolve(key.objectName());
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static String describe(BlobKey key) {
        return key.bucket().dirName() + "/" + key.objectName();
    }
}
