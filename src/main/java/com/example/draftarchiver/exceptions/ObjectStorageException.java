package com.example.draftarchiver.exceptions;

/**
 * Raised by object storage clients. The transient flag tells the uploader whether
 * another attempt may succeed.
 */
public class ObjectStorageException extends RuntimeException {

    private final boolean transientFailure;

    public ObjectStorageException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}
