package com.libragraph.datastore.core.storage;

/**
 * Wraps checked I/O and transport exceptions from storage operations.
 *
 * <p>Transport failures that may succeed on a later attempt (connection errors,
 * 5xx responses) are flagged {@linkplain #isTransient() transient}.
 */
public class StorageException extends RuntimeException {

    private final String address;
    private final boolean transientFailure;

    public StorageException(String message, Throwable cause) {
        super(message, cause);
        this.address = null;
        this.transientFailure = false;
    }

    public StorageException(String message) {
        super(message);
        this.address = null;
        this.transientFailure = false;
    }

    /**
     * @param action what failed, e.g. "Failed to download"; the address is appended
     * @param address the storage address the operation targeted
     */
    public StorageException(String action, String address, Throwable cause, boolean transientFailure) {
        super(action + ": " + address, cause);
        this.address = address;
        this.transientFailure = transientFailure;
    }

    /**
     * Address the failed operation targeted, or null if not recorded.
     */
    public String address() {
        return address;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
