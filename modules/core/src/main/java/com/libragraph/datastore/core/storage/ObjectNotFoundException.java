package com.libragraph.datastore.core.storage;

/**
 * Thrown when a probe, fetch or copy targets an object or file that does not exist.
 */
public class ObjectNotFoundException extends StorageException {

    public ObjectNotFoundException(String address) {
        this(address, null);
    }

    public ObjectNotFoundException(String address, Throwable cause) {
        super("Object not found", address, cause, false);
    }
}
