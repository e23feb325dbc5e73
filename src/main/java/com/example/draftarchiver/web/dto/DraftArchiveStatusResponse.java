package com.example.draftarchiver.web.dto;

import com.example.draftarchiver.domain.DraftArchive;
import com.example.draftarchiver.domain.DraftArchive.ArchiveStatus;
import com.example.draftarchiver.domain.LifecycleState;

import java.time.Instant;

/**
 * Latest known state of a draft's archive run.
 */
public record DraftArchiveStatusResponse(
        Long archiveId,
        String draftId,
        String templateName,
        int assetCount,
        ArchiveStatus status,
        LifecycleState lifecycleState,
        boolean inFlight,
        String objectKey,
        String downloadUrl,
        Long archiveSize,
        String failureCode,
        String failureMessage,
        Instant createdAt,
        Instant updatedAt
) {

    public static DraftArchiveStatusResponse fromEntity(DraftArchive archive, boolean inFlight) {
        if (archive == null) {
            throw new NullPointerException("Cannot create DraftArchiveStatusResponse from null DraftArchive entity");
        }
        return new DraftArchiveStatusResponse(
                archive.getId(),
                archive.getDraftId(),
                archive.getTemplateName(),
                archive.getAssetCount(),
                archive.getStatus(),
                archive.getLifecycleState(),
                inFlight,
                archive.getObjectKey(),
                archive.getDownloadUrl(),
                archive.getArchiveSize(),
                archive.getFailureCode(),
                archive.getFailureMessage(),
                archive.getCreatedAt(),
                archive.getUpdatedAt()
        );
    }
}
