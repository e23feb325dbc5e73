package com.example.draftarchiver.domain;

import java.time.Instant;

/**
 * Stable reference to an uploaded draft archive. Outlives the workspace it was built from.
 */
public record UploadReceipt(String draftId, String objectKey, String url, long sizeBytes, Instant uploadedAt) {
}
