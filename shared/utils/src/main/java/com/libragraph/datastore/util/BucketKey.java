package com.libragraph.datastore.util;

import java.util.Objects;

/**
 * Bucket and key of an {@code s3://} address.
 *
 * <p>The key is kept verbatim: it may be empty, contain further {@code /}
 * separators, or end with one (a directory-like key).
 */
public record BucketKey(String bucket, String key) {

    public BucketKey {
        Objects.requireNonNull(bucket, "bucket cannot be null");
        Objects.requireNonNull(key, "key cannot be null");
    }

    /**
     * Returns the URL form, {@code s3://{bucket}/{key}}.
     */
    public String toUrl() {
        return S3Paths.toUrl(this);
    }

    @Override
    public String toString() {
        return toUrl();
    }
}
