package com.example.draftarchiver.service;

import com.example.draftarchiver.domain.DraftArchive;
import com.example.draftarchiver.domain.DraftArchive.ArchiveStatus;
import com.example.draftarchiver.exceptions.ObjectStorageException;
import com.example.draftarchiver.repository.DraftArchiveRepository;
import com.example.draftarchiver.service.impl.DraftArchiveManagementServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DraftArchiveManagementServiceImpl Tests")
class DraftArchiveManagementServiceImplTest {

    @Mock
    private DraftArchiveRepository repository;
    @Mock
    private ObjectStorageClient storageClient;
    @Mock
    private WorkspaceRegistry registry;

    @InjectMocks
    private DraftArchiveManagementServiceImpl managementService;

    private DraftArchive archive;
    private final Long archiveId = 7L;
    private final String objectKey = "draft_archives/d1.zip";

    @BeforeEach
    void setUp() {
        archive = new DraftArchive("d1", "template", 2, Instant.parse("2024-05-01T10:00:00Z"));
        archive.setId(archiveId);
        archive.setStatus(ArchiveStatus.COMPLETED);
        archive.setObjectKey(objectKey);
    }

    @Test
    @DisplayName("✅ listArchives: Without a filter lists every record, newest first")
    void listArchives_AllNewestFirst() {
        Page<DraftArchive> page = new PageImpl<>(List.of(archive));
        given(repository.findAll(any(Pageable.class))).willReturn(page);

        Page<DraftArchive> result = managementService.listArchives(null, PageRequest.of(2, 10));

        assertThat(result.getContent()).containsExactly(archive);
        ArgumentCaptor<Pageable> captor = ArgumentCaptor.forClass(Pageable.class);
        then(repository).should().findAll(captor.capture());
        assertThat(captor.getValue().getPageNumber()).isEqualTo(2);
        assertThat(captor.getValue().getPageSize()).isEqualTo(10);
        assertThat(captor.getValue().getSort())
                .isEqualTo(Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id")));
        then(repository).should(never()).findByDraftId(anyString(), any(Pageable.class));
    }

    @Test
    @DisplayName("✅ listArchives: A draft filter queries by draft and keeps an explicit sort")
    void listArchives_FilteredKeepsSort() {
        PageRequest request = PageRequest.of(0, 5, Sort.by("updatedAt"));
        given(repository.findByDraftId("d1", request)).willReturn(new PageImpl<>(List.of(archive)));

        Page<DraftArchive> result = managementService.listArchives("d1", request);

        assertThat(result.getContent()).containsExactly(archive);
        then(repository).should(never()).findAll(any(Pageable.class));
    }

    @Test
    @DisplayName("❌ getArchive: Unknown ID throws 404")
    void getArchive_NotFound() {
        given(repository.findById(archiveId)).willReturn(Optional.empty());

        assertThatThrownBy(() -> managementService.getArchive(archiveId))
                .isInstanceOf(ResponseStatusException.class)
                .satisfies(e -> assertThat(((ResponseStatusException) e).getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
    }

    @Test
    @DisplayName("✅ deleteArchive: Removes the record and its stored object")
    void deleteArchive_Success() {
        given(repository.findById(archiveId)).willReturn(Optional.of(archive));

        managementService.deleteArchive(archiveId);

        then(repository).should().delete(archive);
        then(storageClient).should().delete(objectKey);
    }

    @Test
    @DisplayName("✅ deleteArchive: Storage failure still removes the record")
    void deleteArchive_StorageFailureTolerated() {
        given(repository.findById(archiveId)).willReturn(Optional.of(archive));
        willThrow(new ObjectStorageException("remove failed", null, true)).given(storageClient).delete(objectKey);

        assertThatCode(() -> managementService.deleteArchive(archiveId)).doesNotThrowAnyException();

        then(repository).should().delete(archive);
    }

    @Test
    @DisplayName("✅ deleteArchive: A failed record without an object skips storage")
    void deleteArchive_NoObjectKey() {
        archive.setStatus(ArchiveStatus.FAILED);
        archive.setObjectKey(null);
        given(repository.findById(archiveId)).willReturn(Optional.of(archive));

        managementService.deleteArchive(archiveId);

        then(repository).should().delete(archive);
        then(storageClient).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("❌ deleteArchive: A run in flight throws 409 and keeps the record")
    void deleteArchive_InFlight() {
        archive.setStatus(ArchiveStatus.PROCESSING);
        given(repository.findById(archiveId)).willReturn(Optional.of(archive));
        given(registry.isActive("d1")).willReturn(true);

        assertThatThrownBy(() -> managementService.deleteArchive(archiveId))
                .isInstanceOf(ResponseStatusException.class)
                .satisfies(e -> assertThat(((ResponseStatusException) e).getStatusCode()).isEqualTo(HttpStatus.CONFLICT));

        then(repository).should(never()).delete(any(DraftArchive.class));
        then(storageClient).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("✅ deleteArchive: An abandoned PROCESSING record can be removed")
    void deleteArchive_AbandonedProcessing() {
        archive.setStatus(ArchiveStatus.PROCESSING);
        archive.setObjectKey(null);
        given(repository.findById(archiveId)).willReturn(Optional.of(archive));
        given(registry.isActive("d1")).willReturn(false);

        managementService.deleteArchive(archiveId);

        then(repository).should().delete(archive);
    }

    @Test
    @DisplayName("✅ countByStatus: Counts every status, filtered by draft when given")
    void countByStatus() {
        given(repository.countByDraftIdAndStatus("d1", ArchiveStatus.PROCESSING)).willReturn(0L);
        given(repository.countByDraftIdAndStatus("d1", ArchiveStatus.COMPLETED)).willReturn(3L);
        given(repository.countByDraftIdAndStatus("d1", ArchiveStatus.FAILED)).willReturn(1L);

        Map<ArchiveStatus, Long> counts = managementService.countByStatus("d1");

        assertThat(counts).containsEntry(ArchiveStatus.COMPLETED, 3L)
                .containsEntry(ArchiveStatus.FAILED, 1L)
                .containsEntry(ArchiveStatus.PROCESSING, 0L);
        then(repository).should(never()).countByStatus(any());
    }
}
