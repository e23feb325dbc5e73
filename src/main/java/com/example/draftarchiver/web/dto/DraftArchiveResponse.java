package com.example.draftarchiver.web.dto;

import com.example.draftarchiver.domain.UploadReceipt;

import java.time.Instant;

public record DraftArchiveResponse(
        String draftId,
        String objectKey,
        String url,
        long sizeBytes,
        Instant uploadedAt
) {

    public static DraftArchiveResponse fromReceipt(UploadReceipt receipt) {
        if (receipt == null) {
            throw new NullPointerException("Cannot create DraftArchiveResponse from null receipt");
        }
        return new DraftArchiveResponse(
                receipt.draftId(),
                receipt.objectKey(),
                receipt.url(),
                receipt.sizeBytes(),
                receipt.uploadedAt()
        );
    }
}
