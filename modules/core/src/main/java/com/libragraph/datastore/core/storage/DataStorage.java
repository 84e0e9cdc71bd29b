package com.libragraph.datastore.core.storage;

import java.nio.file.Path;

/**
 * Read access to stored files, independent of where they live.
 *
 * <p>Upstream code holds this type and never a concrete backend, so a mounted
 * cache can stand in for the object store without changes to callers.
 * Implementations are stateless between calls and safe for concurrent use.
 */
public interface DataStorage {

    /**
     * Copies the file at {@code source} into {@code destinationDirectory}.
     *
     * @param source address of the file, in the form the backend understands
     * @param destinationDirectory local directory to place the file under; created if absent
     * @return the local path of the fetched file
     * @throws ObjectNotFoundException if the source does not exist
     * @throws StorageException on I/O or transport errors
     */
    Path fetchFile(String source, Path destinationDirectory);
}
