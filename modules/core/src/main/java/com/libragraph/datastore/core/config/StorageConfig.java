package com.libragraph.datastore.core.config;

import com.libragraph.datastore.util.S3Paths;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable storage settings, built once per process.
 *
 * @param datasetsPath root of all datasets, in URL form
 * @param region object store region
 * @param storeConcatenatedBytesFilesInDataset nest column-concatenated files under each dataset
 * @param client transport tuning, handed to the object store client as-is
 * @param download download retry tuning, handed to the object store client as-is
 */
public record StorageConfig(
        String datasetsPath,
        String region,
        boolean storeConcatenatedBytesFilesInDataset,
        Client client,
        Download download) {

    public static final String DEFAULT_REGION = "us-east-1";

    public StorageConfig {
        Objects.requireNonNull(datasetsPath, "datasetsPath cannot be null");
        if (!S3Paths.isUrl(datasetsPath)) {
            throw new IllegalArgumentException(
                    "datasetsPath must start with " + S3Paths.SCHEME + ", got: " + datasetsPath);
        }
        Objects.requireNonNull(region, "region cannot be null");
        Objects.requireNonNull(client, "client cannot be null");
        Objects.requireNonNull(download, "download cannot be null");
    }

    /**
     * Config with default client and download settings.
     */
    public static StorageConfig of(String datasetsPath, boolean storeConcatenatedBytesFilesInDataset) {
        return new StorageConfig(datasetsPath, DEFAULT_REGION, storeConcatenatedBytesFilesInDataset,
                Client.DEFAULTS, Download.DEFAULTS);
    }

    /**
     * Connection settings for the object store client.
     */
    public record Client(int maxPoolConnections, Duration connectTimeout, Duration readTimeout) {

        public static final Client DEFAULTS =
                new Client(10, Duration.ofSeconds(140), Duration.ofSeconds(140));

        public Client {
            if (maxPoolConnections <= 0) {
                throw new IllegalArgumentException(
                        "maxPoolConnections must be > 0, got: " + maxPoolConnections);
            }
            Objects.requireNonNull(connectTimeout, "connectTimeout cannot be null");
            Objects.requireNonNull(readTimeout, "readTimeout cannot be null");
        }
    }

    /**
     * Retry settings for downloads: up to {@code retries} extra attempts, waiting
     * {@code retryDelay * retryBackoff^(n-1)} before the n-th retry. No retry is
     * started once its wait would end more than {@code timeout} after the first attempt.
     */
    public record Download(int retries, Duration timeout, Duration retryDelay, double retryBackoff) {

        public static final Download DEFAULTS =
                new Download(2, Duration.ofSeconds(150), Duration.ofSeconds(4), 5.0);

        public Download {
            if (retries < 0) {
                throw new IllegalArgumentException("retries must be >= 0, got: " + retries);
            }
            Objects.requireNonNull(timeout, "timeout cannot be null");
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("timeout must be > 0, got: " + timeout);
            }
            Objects.requireNonNull(retryDelay, "retryDelay cannot be null");
            if (retryDelay.isNegative()) {
                throw new IllegalArgumentException("retryDelay must not be negative, got: " + retryDelay);
            }
            if (retryBackoff < 1.0) {
                throw new IllegalArgumentException("retryBackoff must be >= 1, got: " + retryBackoff);
            }
        }
    }
}
