package com.example.draftarchiver.repository;

import com.example.draftarchiver.domain.DraftArchive;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface DraftArchiveRepository extends JpaRepository<DraftArchive, Long> {

    Optional<DraftArchive> findFirstByDraftIdOrderByCreatedAtDescIdDesc(String draftId);

    Page<DraftArchive> findByDraftId(String draftId, Pageable pageable);

    long countByStatus(DraftArchive.ArchiveStatus status);

    long countByDraftIdAndStatus(String draftId, DraftArchive.ArchiveStatus status);

    List<DraftArchive> findByStatusAndCreatedAtBefore(DraftArchive.ArchiveStatus status, Instant cutoff);
}
