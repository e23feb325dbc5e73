package com.example.draftarchiver.service;

import com.example.draftarchiver.domain.DraftArchive;
import com.example.draftarchiver.domain.FailureReason;
import com.example.draftarchiver.domain.LifecycleState;
import com.example.draftarchiver.domain.UploadReceipt;

import java.time.Instant;
import java.util.Optional;

/**
 * Keeps the persistent record of lifecycle runs in step with their progress.
 * Update methods run in their own transactions and log failures instead of throwing,
 * so bookkeeping problems never mask the outcome of a run.
 */
public interface DraftArchiveRecordService {

    /**
     * Creates a PROCESSING record for a run that has claimed its draft ID.
     *
     * @return The record ID, or null if the record could not be created.
     */
    Long recordStarted(String draftId, String templateName, int assetCount);

    void recordState(Long recordId, LifecycleState state);

    void recordCompleted(Long recordId, UploadReceipt receipt);

    void recordFailed(Long recordId, FailureReason reason);

    Optional<DraftArchive> findLatest(String draftId);

    /**
     * Marks records still PROCESSING that were created before {@code startedBefore} as FAILED.
     * Used at startup with the process start time, so runs of the current process are never touched.
     *
     * @return The number of records updated.
     */
    int failAbandonedRuns(String reason, Instant startedBefore);
}
