package com.example.draftarchiver.exceptions;

public class LifecycleCancelledException extends DraftLifecycleException {

    public LifecycleCancelledException(String message) {
        super(message);
    }

    public LifecycleCancelledException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "CancelledError";
    }
}
