package com.example.draftarchiver.domain;

import java.util.List;

/**
 * Structured description of why a lifecycle run ended in FAILED.
 *
 * @param stage            Stage whose work failed, named by the state the run was moving into:
 *                         {@code PROVISIONED} for provisioning, {@code ASSETS_FETCHING} for fetches,
 *                         {@code METADATA_FINALIZED}, {@code ARCHIVED} and {@code UPLOADED} for the later steps.
 *                         {@code CREATED} means the run was rejected before provisioning started.
 * @param errorCode        Taxonomy code, e.g. {@code AssetFetchError}.
 * @param message          Human readable summary.
 * @param cause            Description of the underlying cause, or null.
 * @param failedLocators   Locators that could not be fetched; empty for other failures.
 * @param transientFailure For {@code UploadError} only: whether the last attempt failed transiently
 *                         (retries exhausted) or permanently. Null for every other code.
 * @param attempts         Attempts made by the failing step, or null when it does not retry.
 */
public record FailureReason(LifecycleState stage, String errorCode, String message, String cause,
                            List<String> failedLocators, Boolean transientFailure, Integer attempts) {

    public FailureReason {
        failedLocators = failedLocators == null ? List.of() : List.copyOf(failedLocators);
    }

    public FailureReason(LifecycleState stage, String errorCode, String message, String cause,
                         List<String> failedLocators) {
        this(stage, errorCode, message, cause, failedLocators, null, null);
    }
}
