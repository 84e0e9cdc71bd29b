package com.libragraph.datastore.core.path;

import java.util.Objects;

/**
 * One partition (e.g. "train") of a dataset version.
 */
public record PartitionId(DatasetId dataset, String partition) {

    public PartitionId {
        Objects.requireNonNull(dataset, "dataset cannot be null");
        Objects.requireNonNull(partition, "partition cannot be null");
        if (partition.isBlank()) {
            throw new IllegalArgumentException("partition cannot be blank");
        }
    }

    @Override
    public String toString() {
        return dataset + "/" + partition;
    }
}
