package com.example.draftarchiver.exceptions;

import com.example.draftarchiver.domain.FailureReason;

/**
 * Raised at the web boundary when a lifecycle run ended in FAILED.
 * The run has already cleaned up; this only carries its failure reason to the client.
 */
public class DraftArchiveFailedException extends RuntimeException {

    private final String draftId;
    private final FailureReason reason;

    public DraftArchiveFailedException(String draftId, FailureReason reason) {
        super("Draft archive run for " + draftId + " failed with " + reason.errorCode() + ": " + reason.message());
        this.draftId = draftId;
        this.reason = reason;
    }

    public String getDraftId() {
        return draftId;
    }

    public FailureReason getReason() {
        return reason;
    }
}
