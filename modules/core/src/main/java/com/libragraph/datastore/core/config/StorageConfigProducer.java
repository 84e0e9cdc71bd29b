package com.libragraph.datastore.core.config;

import com.libragraph.datastore.core.path.S3PathFactory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Optional;

/**
 * Builds {@link StorageConfig} and the {@link S3PathFactory} from {@code datastore.*} properties.
 */
@ApplicationScoped
public class StorageConfigProducer {

    private static final Logger log = Logger.getLogger(StorageConfigProducer.class);

    @ConfigProperty(name = "datastore.s3.datasets-path")
    String datasetsPath;

    @ConfigProperty(name = "datastore.s3.region", defaultValue = StorageConfig.DEFAULT_REGION)
    String region;

    @ConfigProperty(name = "datastore.s3.store-concatenated-bytes-files-in-dataset", defaultValue = "false")
    boolean storeConcatenatedBytesFilesInDataset;

    @ConfigProperty(name = "datastore.s3.prefix-replace-path")
    Optional<String> prefixReplacePath;

    @ConfigProperty(name = "datastore.s3.max-pool-connections", defaultValue = "10")
    int maxPoolConnections;

    @ConfigProperty(name = "datastore.s3.connect-timeout", defaultValue = "140s")
    Duration connectTimeout;

    @ConfigProperty(name = "datastore.s3.read-timeout", defaultValue = "140s")
    Duration readTimeout;

    @ConfigProperty(name = "datastore.download.retries", defaultValue = "2")
    int downloadRetries;

    @ConfigProperty(name = "datastore.download.timeout", defaultValue = "150s")
    Duration downloadTimeout;

    @ConfigProperty(name = "datastore.download.retry-delay", defaultValue = "4s")
    Duration downloadRetryDelay;

    @ConfigProperty(name = "datastore.download.retry-backoff", defaultValue = "5")
    double downloadRetryBackoff;

    @Produces
    @Singleton
    public StorageConfig storageConfig() {
        StorageConfig config = new StorageConfig(
                datasetsPath,
                region,
                storeConcatenatedBytesFilesInDataset,
                new StorageConfig.Client(maxPoolConnections, connectTimeout, readTimeout),
                new StorageConfig.Download(downloadRetries, downloadTimeout, downloadRetryDelay, downloadRetryBackoff));
        log.infof("Storage config: datasets=%s, region=%s, perDatasetColumnFiles=%s",
                config.datasetsPath(), config.region(), config.storeConcatenatedBytesFilesInDataset());
        return config;
    }

    @Produces
    @Singleton
    public S3PathFactory pathFactory(StorageConfig config) {
        return new S3PathFactory(config, prefixReplacePath.orElse(""));
    }
}
