package com.example.draftarchiver.service;

import com.example.draftarchiver.domain.ArchiveArtifact;
import com.example.draftarchiver.domain.UploadReceipt;
import com.example.draftarchiver.exceptions.UploadException;

public interface Uploader {

    /**
     * Transfers an archive to durable storage under a key derived from the draft ID.
     * Re-uploading under the same key overwrites.
     *
     * @throws UploadException After retries on transient failures are exhausted, or at once on a permanent failure.
     */
    UploadReceipt upload(ArchiveArtifact artifact, String draftId);

    String objectKeyFor(String draftId);
}
