package com.example.draftarchiver.exceptions;

/**
 * Thrown when a workspace for a draft ID is already held by another run,
 * or its directory is already present on disk.
 */
public class WorkspaceAlreadyExistsException extends DraftLifecycleException {

    private final String draftId;

    public WorkspaceAlreadyExistsException(String draftId, String message) {
        super(message);
        this.draftId = draftId;
    }

    public String getDraftId() {
        return draftId;
    }

    @Override
    public String getErrorCode() {
        return "WorkspaceAlreadyExists";
    }
}
