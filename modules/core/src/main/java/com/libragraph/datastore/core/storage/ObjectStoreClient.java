package com.libragraph.datastore.core.storage;

import java.nio.file.Path;

/**
 * Transport contract for an S3-compatible object store.
 *
 * <p>Credentials, pooling, timeouts and retries belong to the implementation.
 * A single instance is shared by all callers and must be thread-safe.
 */
public interface ObjectStoreClient {

    /**
     * Fetches object metadata.
     *
     * @throws ObjectNotFoundException if the bucket or key does not exist
     * @throws StorageException on any other failure
     */
    void statObject(String bucket, String key);

    void putObject(String bucket, String key, byte[] data);

    void uploadFile(String bucket, String key, Path source);

    /**
     * Downloads an object to {@code destination}, whose parent directory must exist.
     *
     * @throws ObjectNotFoundException if the bucket or key does not exist
     * @throws StorageException on any other failure
     */
    void downloadFile(String bucket, String key, Path destination);
}
