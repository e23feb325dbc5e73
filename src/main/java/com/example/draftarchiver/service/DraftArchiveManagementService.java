package com.example.draftarchiver.service;

import com.example.draftarchiver.domain.DraftArchive;
import com.example.draftarchiver.domain.DraftArchive.ArchiveStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

/**
 * Read and delete access to the archive records of past runs.
 */
public interface DraftArchiveManagementService {

    /**
     * @param draftId  Restricts the listing to one draft; null or blank lists every record.
     * @param pageable Page request; records are returned newest first unless it carries a sort.
     */
    Page<DraftArchive> listArchives(String draftId, Pageable pageable);

    /**
     * @throws ResponseStatusException 404 if no record has the ID.
     */
    DraftArchive getArchive(Long archiveId);

    /**
     * Deletes the record and, if the run uploaded one, its stored object. Storage failures are
     * logged and do not stop the record from being deleted.
     *
     * @throws ResponseStatusException 404 if no record has the ID, 409 if its run is still in flight.
     */
    void deleteArchive(Long archiveId);

    /**
     * Counts records per status, for one draft or for all of them.
     */
    Map<ArchiveStatus, Long> countByStatus(String draftId);
}
