package com.example.campusevents.storage;

/**
 * Disk write/read failure of an upload. Surfaces as an internal error.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
