package com.libragraph.datastore.core.storage;

import java.nio.file.Path;

/**
 * Object store backed storage: adds existence probes and uploads to {@link DataStorage}.
 *
 * <p>Addresses are in URL form, {@code s3://bucket/key}. Objects are write-once;
 * callers must not overwrite a key with different content.
 */
public interface ObjectDataStorage extends DataStorage {

    /**
     * Probes object metadata without downloading the body.
     *
     * @return true if the object exists, false if the store reports it missing
     * @throws StorageException on any other failure
     */
    boolean checkExists(String address);

    /**
     * Uploads {@code data} to {@code address}.
     *
     * @throws StorageException on transport errors
     */
    void putObject(byte[] data, String address);

    /**
     * Uploads the contents of a local file to {@code address}.
     *
     * @throws StorageException on I/O or transport errors
     */
    void putFile(Path localPath, String address);

    /**
     * Downloads the object at {@code address} to {@code destinationDirectory/<key>}.
     *
     * <p>The key's directory structure is kept below the destination directory.
     * A missing object is not translated: the {@link ObjectNotFoundException}
     * reaches the caller.
     */
    @Override
    Path fetchFile(String address, Path destinationDirectory);
}
