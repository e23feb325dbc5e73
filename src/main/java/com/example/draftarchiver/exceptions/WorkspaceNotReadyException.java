package com.example.draftarchiver.exceptions;

public class WorkspaceNotReadyException extends DraftLifecycleException {

    public WorkspaceNotReadyException(String message) {
        super(message);
    }

    public WorkspaceNotReadyException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "WorkspaceNotReady";
    }
}
