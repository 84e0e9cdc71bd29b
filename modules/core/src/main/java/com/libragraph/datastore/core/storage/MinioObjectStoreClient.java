package com.libragraph.datastore.core.storage;

import com.libragraph.datastore.core.config.StorageConfig;
import com.libragraph.datastore.util.BucketKey;
import io.minio.DownloadObjectArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.StatObjectArgs;
import io.minio.UploadObjectArgs;
import io.minio.errors.ErrorResponseException;
import io.minio.errors.InsufficientDataException;
import io.minio.errors.ServerException;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Set;

/**
 * ObjectStoreClient on the MinIO Java client, for S3 and S3-compatible stores.
 */
@ApplicationScoped
@IfBuildProperty(name = "datastore.storage.type", stringValue = "s3")
public class MinioObjectStoreClient implements ObjectStoreClient {

    private static final String CONTENT_TYPE = "application/octet-stream";

    private static final Set<String> NOT_FOUND_CODES = Set.of("NoSuchKey", "NoSuchBucket", "NotFound");

    private static final Set<String> TRANSIENT_CODES =
            Set.of("InternalError", "ServiceUnavailable", "SlowDown", "RequestTimeout");

    private final MinioClient minioClient;
    private final DownloadRetryPolicy retryPolicy;

    @Inject
    public MinioObjectStoreClient(MinioClient minioClient, StorageConfig config) {
        this(minioClient, new DownloadRetryPolicy(config.download()));
    }

    public MinioObjectStoreClient(MinioClient minioClient, DownloadRetryPolicy retryPolicy) {
        this.minioClient = minioClient;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public void statObject(String bucket, String key) {
        try {
            minioClient.statObject(StatObjectArgs.builder()
                    .bucket(bucket).object(key).build());
        } catch (Exception e) {
            throw translate("Failed to check existence", bucket, key, e);
        }
    }

    @Override
    public void putObject(String bucket, String key, byte[] data) {
        try (InputStream is = new ByteArrayInputStream(data)) {
            minioClient.putObject(PutObjectArgs.builder()
                    .bucket(bucket)
                    .object(key)
                    .stream(is, data.length, -1)
                    .contentType(CONTENT_TYPE)
                    .build());
        } catch (Exception e) {
            throw translate("Failed to put object", bucket, key, e);
        }
    }

    @Override
    public void uploadFile(String bucket, String key, Path source) {
        try {
            minioClient.uploadObject(UploadObjectArgs.builder()
                    .bucket(bucket)
                    .object(key)
                    .filename(source.toString())
                    .contentType(CONTENT_TYPE)
                    .build());
        } catch (Exception e) {
            throw translate("Failed to upload " + source, bucket, key, e);
        }
    }

    @Override
    public void downloadFile(String bucket, String key, Path destination) {
        retryPolicy.run(url(bucket, key), () -> downloadOnce(bucket, key, destination));
    }

    private void downloadOnce(String bucket, String key, Path destination) {
        try {
            minioClient.downloadObject(DownloadObjectArgs.builder()
                    .bucket(bucket)
                    .object(key)
                    .filename(destination.toString())
                    .overwrite(true)
                    .build());
        } catch (Exception e) {
            throw translate("Failed to download", bucket, key, e);
        }
    }

    static boolean isNotFound(ErrorResponseException e) {
        if (NOT_FOUND_CODES.contains(errorCode(e))) {
            return true;
        }
        return e.response() != null && e.response().code() == 404;
    }

    static boolean isTransient(ErrorResponseException e) {
        if (TRANSIENT_CODES.contains(errorCode(e))) {
            return true;
        }
        return e.response() != null && e.response().code() >= 500;
    }

    /**
     * Maps a MinIO client failure onto the storage exceptions.
     *
     * <p>Missing bucket or key becomes {@link ObjectNotFoundException}. Connection and
     * stream errors and 5xx responses are transient; 4xx responses and argument
     * errors are not.
     */
    static StorageException translate(String action, String bucket, String key, Exception e) {
        String url = url(bucket, key);
        if (e instanceof ErrorResponseException) {
            ErrorResponseException response = (ErrorResponseException) e;
            if (isNotFound(response)) {
                return new ObjectNotFoundException(url, e);
            }
            return new StorageException(action, url, e, isTransient(response));
        }
        boolean transientFailure = e instanceof ServerException
                || e instanceof InsufficientDataException
                || e instanceof IOException;
        return new StorageException(action, url, e, transientFailure);
    }

    private static String errorCode(ErrorResponseException e) {
        if (e.errorResponse() == null || e.errorResponse().code() == null) {
            return "";
        }
        return e.errorResponse().code();
    }

    private static String url(String bucket, String key) {
        return new BucketKey(bucket, key).toUrl();
    }
}
