package com.facility.snapshot.exception;

/**
 * The metric store could not complete a read or write (connectivity, constraint violation).
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
