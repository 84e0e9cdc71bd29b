package com.libragraph.datastore.util;

import java.util.Objects;

/**
 * String algebra for storage addresses.
 *
 * <p>Two address forms exist: URL form ({@code s3://bucket/key}) and plain form
 * (bucket-relative key or filesystem path, no scheme). Every join and prefix cut
 * used for dataset paths goes through this class so separators are handled in
 * one place.
 */
public final class S3Paths {

    public static final String SCHEME = "s3://";

    private static final char SEPARATOR = '/';

    private S3Paths() {
    }

    /**
     * Returns true if the address is in URL form.
     */
    public static boolean isUrl(String address) {
        return address != null && address.startsWith(SCHEME);
    }

    /**
     * Splits a URL-form address into bucket and key.
     *
     * <p>The bucket is everything between the scheme and the first {@code /};
     * the key is the remainder, including any trailing separator.
     * {@code s3://} alone yields an empty bucket and key.
     *
     * @throws IllegalArgumentException if the address is not in URL form
     */
    public static BucketKey bucketKey(String address) {
        Objects.requireNonNull(address, "address cannot be null");
        if (!isUrl(address)) {
            throw new IllegalArgumentException("Not an " + SCHEME + " address: " + address);
        }
        String rest = address.substring(SCHEME.length());
        int slash = rest.indexOf(SEPARATOR);
        if (slash < 0) {
            return new BucketKey(rest, "");
        }
        return new BucketKey(rest.substring(0, slash), rest.substring(slash + 1));
    }

    /**
     * Rebuilds the URL form of a bucket/key pair.
     */
    public static String toUrl(BucketKey bucketKey) {
        Objects.requireNonNull(bucketKey, "bucketKey cannot be null");
        if (bucketKey.bucket().isEmpty() && bucketKey.key().isEmpty()) {
            return SCHEME;
        }
        return SCHEME + bucketKey.bucket() + SEPARATOR + bucketKey.key();
    }

    /**
     * Joins two path fragments with exactly one separator between them.
     *
     * <p>A trailing separator on {@code root} and a leading one on {@code child}
     * collapse into one. An empty root returns the child unchanged; an empty child
     * returns the root unchanged.
     */
    public static String join(String root, String child) {
        Objects.requireNonNull(root, "root cannot be null");
        Objects.requireNonNull(child, "child cannot be null");
        if (root.isEmpty()) {
            return child;
        }
        if (child.isEmpty()) {
            return root;
        }
        String head = root.charAt(root.length() - 1) == SEPARATOR
                ? root.substring(0, root.length() - 1)
                : root;
        String tail = child.charAt(0) == SEPARATOR ? child.substring(1) : child;
        return head + SEPARATOR + tail;
    }

    /**
     * Joins a root with several segments, left to right.
     */
    public static String join(String root, String... segments) {
        String result = root;
        for (String segment : segments) {
            result = join(result, segment);
        }
        return result;
    }

    /**
     * Removes {@code prefix} from the front of {@code address}.
     *
     * @throws IllegalArgumentException if the address does not start with the prefix
     */
    public static String stripPrefix(String address, String prefix) {
        Objects.requireNonNull(address, "address cannot be null");
        Objects.requireNonNull(prefix, "prefix cannot be null");
        if (!address.startsWith(prefix)) {
            throw new IllegalArgumentException(
                    "Address '" + address + "' does not start with prefix '" + prefix + "'");
        }
        return address.substring(prefix.length());
    }

    /**
     * Converts a URL-form address to its bucket-relative plain form.
     */
    public static String removeScheme(String address) {
        return stripPrefix(address, SCHEME);
    }

    /**
     * Drops a single trailing separator, if present.
     */
    public static String trimTrailingSeparator(String path) {
        Objects.requireNonNull(path, "path cannot be null");
        if (path.length() > 1 && path.charAt(path.length() - 1) == SEPARATOR
                && !path.equals(SCHEME)) {
            return path.substring(0, path.length() - 1);
        }
        return path;
    }
}
