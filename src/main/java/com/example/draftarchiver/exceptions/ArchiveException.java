package com.example.draftarchiver.exceptions;

public class ArchiveException extends DraftLifecycleException {

    public ArchiveException(String message) {
        super(message);
    }

    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "ArchiveError";
    }
}
