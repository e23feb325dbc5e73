package com.example.draftarchiver.service.impl;

import com.example.draftarchiver.domain.DraftArchive;
import com.example.draftarchiver.domain.DraftArchive.ArchiveStatus;
import com.example.draftarchiver.domain.FailureReason;
import com.example.draftarchiver.domain.LifecycleState;
import com.example.draftarchiver.domain.UploadReceipt;
import com.example.draftarchiver.repository.DraftArchiveRepository;
import com.example.draftarchiver.service.DraftArchiveRecordService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
public class DraftArchiveRecordServiceImpl implements DraftArchiveRecordService {

    private static final Logger log = LoggerFactory.getLogger(DraftArchiveRecordServiceImpl.class);
    private static final int MAX_MESSAGE_LENGTH = 1024;

    private final DraftArchiveRepository repository;
    private final Clock clock;

    @Autowired
    public DraftArchiveRecordServiceImpl(DraftArchiveRepository repository) {
        this(repository, Clock.systemUTC());
    }

    DraftArchiveRecordServiceImpl(DraftArchiveRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Long recordStarted(String draftId, String templateName, int assetCount) {
        String txName = TransactionSynchronizationManager.getCurrentTransactionName();
        try {
            DraftArchive saved = repository.save(new DraftArchive(draftId, templateName, assetCount, Instant.now(clock)));
            log.info("[Records][TX:{}] Created archive record {} for draft {}", txName, saved.getId(), draftId);
            return saved.getId();
        } catch (Exception e) {
            log.error("[Records][TX:{}] CRITICAL: Failed to create archive record for draft {}", txName, draftId, e);
            return null;
        }
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordState(Long recordId, LifecycleState state) {
        if (recordId == null) {
            return;
        }
        String txName = TransactionSynchronizationManager.getCurrentTransactionName();
        try {
            repository.findById(recordId).ifPresentOrElse(record -> {
                record.setLifecycleState(state);
                record.setUpdatedAt(Instant.now(clock));
                repository.save(record);
                log.debug("[Records][TX:{}] Record {} now in state {}", txName, recordId, state);
            }, () -> log.error("[Records][TX:{}] Archive record {} not found for state update to {}", txName, recordId, state));
        } catch (Exception e) {
            log.error("[Records][TX:{}] Failed to record state {} for archive record {}", txName, state, recordId, e);
        }
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordCompleted(Long recordId, UploadReceipt receipt) {
        if (recordId == null) {
            return;
        }
        String txName = TransactionSynchronizationManager.getCurrentTransactionName();
        try {
            DraftArchive record = repository.findById(recordId).orElse(null);
            if (record == null) {
                log.error("[Records][TX:{}] Archive record {} not found when completing draft {}", txName, recordId, receipt.draftId());
                return;
            }
            if (record.getStatus() != ArchiveStatus.PROCESSING) {
                log.warn("[Records][TX:{}] Archive record {} was not PROCESSING when completing (actual: {}).",
                        txName, recordId, record.getStatus());
            }
            record.setStatus(ArchiveStatus.COMPLETED);
            record.setLifecycleState(LifecycleState.CLEANED_UP);
            record.setObjectKey(receipt.objectKey());
            record.setDownloadUrl(receipt.url());
            record.setArchiveSize(receipt.sizeBytes());
            record.setUpdatedAt(Instant.now(clock));
            repository.save(record);
            log.info("[Records][TX:{}] Archive record {} COMPLETED with key {}", txName, recordId, receipt.objectKey());
        } catch (Exception e) {
            log.error("[Records][TX:{}] CRITICAL: Failed to mark archive record {} as COMPLETED", txName, recordId, e);
        }
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordFailed(Long recordId, FailureReason reason) {
        if (recordId == null) {
            return;
        }
        String txName = TransactionSynchronizationManager.getCurrentTransactionName();
        try {
            DraftArchive record = repository.findById(recordId).orElse(null);
            if (record == null) {
                log.error("[Records][TX:{}] Archive record {} not found during failure update.", txName, recordId);
                return;
            }
            record.setStatus(ArchiveStatus.FAILED);
            record.setLifecycleState(reason.stage());
            record.setFailureCode(reason.errorCode());
            record.setFailureMessage(truncate(reason.message()));
            record.setUpdatedAt(Instant.now(clock));
            repository.save(record);
            log.info("[Records][TX:{}] Archive record {} FAILED with {} in {}", txName, recordId, reason.errorCode(), reason.stage());
        } catch (Exception e) {
            log.error("[Records][TX:{}] CRITICAL: Failed to mark archive record {} as FAILED", txName, recordId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DraftArchive> findLatest(String draftId) {
        return repository.findFirstByDraftIdOrderByCreatedAtDescIdDesc(draftId);
    }

    @Override
    @Transactional
    public int failAbandonedRuns(String reason, Instant startedBefore) {
        List<DraftArchive> abandoned = repository.findByStatusAndCreatedAtBefore(ArchiveStatus.PROCESSING, startedBefore);
        Instant now = Instant.now(clock);
        for (DraftArchive record : abandoned) {
            record.setStatus(ArchiveStatus.FAILED);
            record.setFailureCode("UnexpectedError");
            record.setFailureMessage(truncate(reason));
            record.setUpdatedAt(now);
        }
        repository.saveAll(abandoned);
        if (!abandoned.isEmpty()) {
            log.warn("[Records] Marked {} abandoned archive record(s) created before {} as FAILED", abandoned.size(), startedBefore);
        }
        return abandoned.size();
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_MESSAGE_LENGTH);
    }
}
