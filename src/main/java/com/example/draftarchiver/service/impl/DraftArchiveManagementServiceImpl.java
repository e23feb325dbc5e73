package com.example.draftarchiver.service.impl;

import com.example.draftarchiver.domain.DraftArchive;
import com.example.draftarchiver.domain.DraftArchive.ArchiveStatus;
import com.example.draftarchiver.exceptions.ObjectStorageException;
import com.example.draftarchiver.repository.DraftArchiveRepository;
import com.example.draftarchiver.service.DraftArchiveManagementService;
import com.example.draftarchiver.service.ObjectStorageClient;
import com.example.draftarchiver.service.WorkspaceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.util.EnumMap;
import java.util.Map;

@Service
public class DraftArchiveManagementServiceImpl implements DraftArchiveManagementService {

    private static final Logger log = LoggerFactory.getLogger(DraftArchiveManagementServiceImpl.class);
    private static final String ARCHIVE_NOT_FOUND_MESSAGE = "Archive record not found";
    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private final DraftArchiveRepository repository;
    private final ObjectStorageClient storageClient;
    private final WorkspaceRegistry registry;

    public DraftArchiveManagementServiceImpl(DraftArchiveRepository repository,
                                             ObjectStorageClient storageClient,
                                             WorkspaceRegistry registry) {
        this.repository = repository;
        this.storageClient = storageClient;
        this.registry = registry;
    }

    @Override
    @Transactional(readOnly = true)
    public Page<DraftArchive> listArchives(String draftId, Pageable pageable) {
        Pageable sorted = pageable.getSort().isSorted()
                ? pageable
                : PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(), NEWEST_FIRST);
        if (draftId == null || draftId.isBlank()) {
            return repository.findAll(sorted);
        }
        return repository.findByDraftId(draftId, sorted);
    }

    @Override
    @Transactional(readOnly = true)
    public DraftArchive getArchive(Long archiveId) {
        return repository.findById(archiveId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, ARCHIVE_NOT_FOUND_MESSAGE));
    }

    @Override
    @Transactional
    public void deleteArchive(Long archiveId) {
        log.debug("Delete process started for archive record {}", archiveId);
        DraftArchive archive = getArchive(archiveId);
        if (archive.getStatus() == ArchiveStatus.PROCESSING && registry.isActive(archive.getDraftId())) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Archive run for draft " + archive.getDraftId() + " is still in flight");
        }

        String objectKey = archive.getObjectKey();
        repository.delete(archive);
        log.info("Deleted archive record {} for draft {}", archiveId, archive.getDraftId());

        deleteStoredObject(objectKey, archiveId);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<ArchiveStatus, Long> countByStatus(String draftId) {
        Map<ArchiveStatus, Long> counts = new EnumMap<>(ArchiveStatus.class);
        for (ArchiveStatus status : ArchiveStatus.values()) {
            long count = draftId == null || draftId.isBlank()
                    ? repository.countByStatus(status)
                    : repository.countByDraftIdAndStatus(draftId, status);
            counts.put(status, count);
        }
        return counts;
    }

    /**
     * Best effort: a failure leaves an orphaned object behind, which is logged.
     */
    private void deleteStoredObject(String objectKey, Long archiveId) {
        if (objectKey == null || objectKey.isBlank()) {
            log.trace("Archive record {} has no stored object, skipping storage deletion", archiveId);
            return;
        }
        try {
            storageClient.delete(objectKey);
            log.info("Deleted stored object {} of archive record {}", objectKey, archiveId);
        } catch (ObjectStorageException e) {
            log.warn("Failed to delete stored object of archive record {}. Orphaned object might exist. Key: {}, Reason: {}",
                    archiveId, objectKey, e.getMessage());
        }
    }
}
