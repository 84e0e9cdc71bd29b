package com.libragraph.datastore.core.path;

import java.util.Objects;

/**
 * A named, versioned dataset.
 */
public record DatasetId(String name, String version) {

    public DatasetId {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(version, "version cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("dataset name cannot be blank");
        }
        if (version.isBlank()) {
            throw new IllegalArgumentException("dataset version cannot be blank");
        }
    }

    @Override
    public String toString() {
        return name + "/" + version;
    }
}
