package com.example.draftarchiver.exceptions;

public class ProvisionIOException extends DraftLifecycleException {

    public ProvisionIOException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "ProvisionIOError";
    }
}
