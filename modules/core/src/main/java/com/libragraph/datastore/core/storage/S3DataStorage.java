package com.libragraph.datastore.core.storage;

import com.libragraph.datastore.util.BucketKey;
import com.libragraph.datastore.util.S3Paths;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * S3-backed DataStorage for production use.
 *
 * <p>Addresses are {@code s3://bucket/key}; the transport is an injected
 * {@link ObjectStoreClient}. Not-found is translated only by {@link #checkExists};
 * every other failure reaches the caller unchanged.
 */
@ApplicationScoped
@IfBuildProperty(name = "datastore.storage.type", stringValue = "s3")
public class S3DataStorage implements ObjectDataStorage {

    private static final Logger log = Logger.getLogger(S3DataStorage.class);

    private final ObjectStoreClient client;

    @Inject
    public S3DataStorage(ObjectStoreClient client) {
        this.client = client;
    }

    /**
     * Splits an address into bucket and key.
     *
     * @throws IllegalArgumentException if the address is not {@code s3://} form
     */
    public BucketKey bucketKeyFromS3Path(String address) {
        return S3Paths.bucketKey(address);
    }

    @Override
    public boolean checkExists(String address) {
        BucketKey bk = objectBucketKey(address);
        try {
            client.statObject(bk.bucket(), bk.key());
            return true;
        } catch (ObjectNotFoundException e) {
            return false;
        }
    }

    @Override
    public void putObject(byte[] data, String address) {
        BucketKey bk = objectBucketKey(address);
        client.putObject(bk.bucket(), bk.key(), data);
        log.debugf("Put %d bytes to %s", data.length, address);
    }

    @Override
    public void putFile(Path localPath, String address) {
        BucketKey bk = objectBucketKey(address);
        if (!Files.isRegularFile(localPath)) {
            throw new ObjectNotFoundException(localPath.toString());
        }
        client.uploadFile(bk.bucket(), bk.key(), localPath);
        log.debugf("Uploaded %s to %s", localPath, address);
    }

    /**
     * Downloads to {@code destinationDirectory/<key>}.
     *
     * <p>Objects are immutable, so a destination file that already exists is
     * returned as-is without contacting the store.
     */
    @Override
    public Path fetchFile(String address, Path destinationDirectory) {
        BucketKey bk = objectBucketKey(address);
        Path destination = destinationDirectory.resolve(bk.key());
        if (!destination.toAbsolutePath().normalize()
                .startsWith(destinationDirectory.toAbsolutePath().normalize())) {
            throw new IllegalArgumentException(
                    "Key escapes destination directory: " + address);
        }
        if (Files.isRegularFile(destination)) {
            log.debugf("Already present, skipping download: %s", destination);
            return destination;
        }
        try {
            Files.createDirectories(destination.getParent());
        } catch (IOException e) {
            throw new StorageException("Failed to create directory for " + destination, e);
        }
        client.downloadFile(bk.bucket(), bk.key(), destination);
        log.debugf("Fetched %s to %s", address, destination);
        return destination;
    }

    private BucketKey objectBucketKey(String address) {
        BucketKey bk = S3Paths.bucketKey(address);
        if (bk.bucket().isEmpty() || bk.key().isEmpty()) {
            throw new IllegalArgumentException("Address does not name an object: " + address);
        }
        return bk;
    }
}
