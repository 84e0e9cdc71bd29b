package com.libragraph.datastore.core.path;

import com.libragraph.datastore.core.config.StorageConfig;
import com.libragraph.datastore.util.S3Paths;

import java.util.Objects;
import java.util.UUID;

/**
 * Computes the canonical addresses of dataset artifacts.
 *
 * <p>Every path is composed in URL form under the datasets root. Callers may ask
 * for the mount form instead: the scheme (or an explicit cut prefix) is removed
 * and the configured prefix replacement path is put in its place, e.g.
 * {@code s3://bucket/root/x} becomes {@code /mnt/bucket/root/x} with a
 * replacement path of {@code /mnt}. Without a replacement path the mount form is
 * the bucket-relative plain path.
 *
 * <p>Immutable and free of I/O.
 */
public final class S3PathFactory {

    public static final String COLUMN_CONCATENATED_FILES_DIR = "__COLUMN_CONCATENATED_FILES__";
    public static final String TEMP_DIR = "__temp__";
    public static final String ASSETS_DIR = "assets";
    public static final String SCHEMA_FILE = "avro_schema.json";
    public static final String PARTITION_SUFFIX = ".parquet";

    private final String datasetsPath;
    private final String prefixReplacePath;
    private final boolean storeConcatenatedBytesFilesInDataset;

    public S3PathFactory(StorageConfig config) {
        this(config, "");
    }

    /**
     * @param prefixReplacePath local mount root standing in for {@code s3://}; empty for none
     */
    public S3PathFactory(StorageConfig config, String prefixReplacePath) {
        this(config, prefixReplacePath, config.datasetsPath());
    }

    /**
     * @param prefixReplacePath local mount root standing in for {@code s3://}; empty for none
     * @param datasetsPath datasets root overriding the configured one, in URL form
     */
    public S3PathFactory(StorageConfig config, String prefixReplacePath, String datasetsPath) {
        Objects.requireNonNull(config, "config cannot be null");
        Objects.requireNonNull(prefixReplacePath, "prefixReplacePath cannot be null");
        Objects.requireNonNull(datasetsPath, "datasetsPath cannot be null");
        if (!S3Paths.isUrl(datasetsPath)) {
            throw new IllegalArgumentException(
                    "datasetsPath must start with " + S3Paths.SCHEME + ", got: " + datasetsPath);
        }
        this.datasetsPath = datasetsPath;
        this.prefixReplacePath = prefixReplacePath;
        this.storeConcatenatedBytesFilesInDataset = config.storeConcatenatedBytesFilesInDataset();
    }

    public String prefixReplacePath() {
        return prefixReplacePath;
    }

    public boolean storeConcatenatedBytesFilesInDataset() {
        return storeConcatenatedBytesFilesInDataset;
    }

    /**
     * Root of all datasets, without a trailing separator.
     */
    public String getDatasetsPath(boolean s3Prefix) {
        return finish(S3Paths.trimTrailingSeparator(datasetsPath), s3Prefix, null);
    }

    public String getDatasetAssetsPath(DatasetId datasetId, boolean s3Prefix) {
        return finish(S3Paths.join(datasetsPath, datasetId.name(), datasetId.version(), ASSETS_DIR),
                s3Prefix, null);
    }

    public String getDatasetSchemaPath(DatasetId datasetId, boolean s3Prefix) {
        return finish(S3Paths.join(datasetsPath, datasetId.name(), datasetId.version(), SCHEMA_FILE),
                s3Prefix, null);
    }

    public String getDatasetPartitionPath(PartitionId partitionId, boolean s3Prefix) {
        DatasetId dataset = partitionId.dataset();
        return finish(S3Paths.join(datasetsPath, dataset.name(), dataset.version(),
                partitionId.partition() + PARTITION_SUFFIX), s3Prefix, null);
    }

    /**
     * Staging area for row files written before a dataset is committed.
     */
    public String getTemporaryRowFilesPath(DatasetId datasetId, boolean s3Prefix) {
        return finish(S3Paths.join(datasetsPath, TEMP_DIR, datasetId.name(), datasetId.version()),
                s3Prefix, null);
    }

    public String getColumnConcatenatedBytesFilesPath() {
        return getColumnConcatenatedBytesFilesPath(null, true, null);
    }

    public String getColumnConcatenatedBytesFilesPath(String datasetName) {
        return getColumnConcatenatedBytesFilesPath(datasetName, true, null);
    }

    public String getColumnConcatenatedBytesFilesPath(String datasetName, boolean s3Prefix) {
        return getColumnConcatenatedBytesFilesPath(datasetName, s3Prefix, null);
    }

    /**
     * Root directory of the column-concatenated bytes files.
     *
     * <p>Shared by all datasets ({@code <root>/__COLUMN_CONCATENATED_FILES__}) unless
     * dataset-scoped storage is configured, in which case it is
     * {@code <root>/<datasetName>/__COLUMN_CONCATENATED_FILES__}.
     *
     * <p>The URL form is returned when {@code s3Prefix} is true and no cut prefix is
     * given. Otherwise {@code cutPrefixOverride} (default {@code s3://}) is removed
     * from the front and the prefix replacement path is prepended.
     *
     * @param datasetName required when dataset-scoped storage is configured, else ignored
     * @param cutPrefixOverride leading text to replace; null or empty means none given
     * @throws IllegalArgumentException if the dataset name is missing under dataset-scoped
     *         storage, or the cut prefix does not lead the composed address
     */
    public String getColumnConcatenatedBytesFilesPath(String datasetName, boolean s3Prefix,
                                                      String cutPrefixOverride) {
        String fullPath;
        if (storeConcatenatedBytesFilesInDataset) {
            if (datasetName == null || datasetName.isEmpty()) {
                throw new IllegalArgumentException(
                        "dataset name required when dataset-scoped storage is enabled");
            }
            fullPath = S3Paths.join(datasetsPath, datasetName, COLUMN_CONCATENATED_FILES_DIR);
        } else {
            fullPath = S3Paths.join(datasetsPath, COLUMN_CONCATENATED_FILES_DIR);
        }
        return finish(fullPath, s3Prefix, cutPrefixOverride);
    }

    /**
     * Address of one column-concatenated bytes file, always in URL form.
     */
    public String getColumnConcatenatedBytesS3PathFromUuid(UUID fileId, String datasetName) {
        Objects.requireNonNull(fileId, "fileId cannot be null");
        return S3Paths.join(getColumnConcatenatedBytesFilesPath(datasetName), fileId.toString());
    }

    /**
     * Re-roots a URL-form address onto the prefix replacement path.
     *
     * @param cutPrefix leading text to replace; null or empty means the scheme
     */
    public String toMountPath(String address, String cutPrefix) {
        String remainder = S3Paths.stripPrefix(address, isBlankCut(cutPrefix) ? S3Paths.SCHEME : cutPrefix);
        return S3Paths.join(prefixReplacePath, remainder);
    }

    private String finish(String fullPath, boolean s3Prefix, String cutPrefixOverride) {
        if (s3Prefix && isBlankCut(cutPrefixOverride)) {
            return fullPath;
        }
        return toMountPath(fullPath, cutPrefixOverride);
    }

    private static boolean isBlankCut(String cutPrefix) {
        return cutPrefix == null || cutPrefix.isEmpty();
    }

    @Override
    public String toString() {
        return "S3PathFactory[datasetsPath=" + datasetsPath
                + ", prefixReplacePath=" + prefixReplacePath
                + ", perDatasetColumnFiles=" + storeConcatenatedBytesFilesInDataset + "]";
    }
}
