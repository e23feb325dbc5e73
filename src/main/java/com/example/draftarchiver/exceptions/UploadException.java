package com.example.draftarchiver.exceptions;

/**
 * Failure to transfer an archive to object storage.
 * Transient failures (network, 5xx, throttling) were retried before this was thrown;
 * permanent failures (credentials, permissions, missing bucket) were not.
 */
public class UploadException extends DraftLifecycleException {

    private final boolean transientFailure;
    private final int attempts;

    public UploadException(String message, Throwable cause, boolean transientFailure, int attempts) {
        super(message, cause);
        this.transientFailure = transientFailure;
        this.attempts = attempts;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }

    public int getAttempts() {
        return attempts;
    }

    @Override
    public String getErrorCode() {
        return "UploadError";
    }
}
