package com.example.draftarchiver.service;

import com.example.draftarchiver.domain.DraftArchive;
import com.example.draftarchiver.domain.DraftArchive.ArchiveStatus;
import com.example.draftarchiver.domain.FailureReason;
import com.example.draftarchiver.domain.LifecycleState;
import com.example.draftarchiver.domain.UploadReceipt;
import com.example.draftarchiver.repository.DraftArchiveRepository;
import com.example.draftarchiver.service.impl.DraftArchiveRecordServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DraftArchiveRecordServiceImpl Tests")
class DraftArchiveRecordServiceImplTest {

    @Mock
    private DraftArchiveRepository repository;

    private DraftArchiveRecordServiceImpl recordService;

    private DraftArchive record;
    private final Long recordId = 3L;

    @BeforeEach
    void setUp() {
        recordService = new DraftArchiveRecordServiceImpl(repository);
        record = new DraftArchive("d1", "template", 2, Instant.parse("2024-05-01T10:00:00Z"));
        ReflectionTestUtils.setField(record, "id", recordId);
    }

    @Test
    @DisplayName("✅ recordStarted: Saves a PROCESSING record and returns its ID")
    void recordStarted_Success() {
        given(repository.save(any(DraftArchive.class))).willAnswer(inv -> {
            DraftArchive saved = inv.getArgument(0);
            saved.setId(11L);
            return saved;
        });

        Long id = recordService.recordStarted("d1", "template", 2);

        assertThat(id).isEqualTo(11L);
        ArgumentCaptor<DraftArchive> captor = ArgumentCaptor.forClass(DraftArchive.class);
        then(repository).should().save(captor.capture());
        assertThat(captor.getValue().getStatus()).isEqualTo(ArchiveStatus.PROCESSING);
        assertThat(captor.getValue().getLifecycleState()).isEqualTo(LifecycleState.CREATED);
        assertThat(captor.getValue().getAssetCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("❌ recordStarted: Database failure returns null instead of throwing")
    void recordStarted_DatabaseFailure() {
        given(repository.save(any(DraftArchive.class))).willThrow(new DataAccessResourceFailureException("db down"));

        assertThat(recordService.recordStarted("d1", "template", 2)).isNull();
    }

    @Test
    @DisplayName("✅ recordState: Updates the lifecycle state")
    void recordState_Success() {
        given(repository.findById(recordId)).willReturn(Optional.of(record));

        recordService.recordState(recordId, LifecycleState.ASSETS_FETCHING);

        assertThat(record.getLifecycleState()).isEqualTo(LifecycleState.ASSETS_FETCHING);
        assertThat(record.getUpdatedAt()).isNotNull();
        then(repository).should().save(record);
    }

    @Test
    @DisplayName("✅ Null record ID is ignored by every update")
    void nullRecordId_Ignored() {
        recordService.recordState(null, LifecycleState.PROVISIONED);
        recordService.recordCompleted(null, new UploadReceipt("d1", "k", "u", 1, Instant.now()));
        recordService.recordFailed(null, new FailureReason(LifecycleState.CREATED, "TemplateNotFound", "m", null, null));

        then(repository).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("✅ recordCompleted: Stores the receipt and marks COMPLETED")
    void recordCompleted_Success() {
        given(repository.findById(recordId)).willReturn(Optional.of(record));
        UploadReceipt receipt = new UploadReceipt("d1", "draft_archives/d1.zip", "http://storage/d1.zip", 2048, Instant.now());

        recordService.recordCompleted(recordId, receipt);

        assertThat(record.getStatus()).isEqualTo(ArchiveStatus.COMPLETED);
        assertThat(record.getLifecycleState()).isEqualTo(LifecycleState.CLEANED_UP);
        assertThat(record.getObjectKey()).isEqualTo("draft_archives/d1.zip");
        assertThat(record.getDownloadUrl()).isEqualTo("http://storage/d1.zip");
        assertThat(record.getArchiveSize()).isEqualTo(2048L);
        then(repository).should().save(record);
    }

    @Test
    @DisplayName("✅ recordFailed: Stores the failure and truncates long messages")
    void recordFailed_Success() {
        given(repository.findById(recordId)).willReturn(Optional.of(record));
        String longMessage = "x".repeat(5000);

        recordService.recordFailed(recordId, new FailureReason(LifecycleState.ARCHIVED, "UploadError", longMessage, null, null));

        assertThat(record.getStatus()).isEqualTo(ArchiveStatus.FAILED);
        assertThat(record.getLifecycleState()).isEqualTo(LifecycleState.ARCHIVED);
        assertThat(record.getFailureCode()).isEqualTo("UploadError");
        assertThat(record.getFailureMessage()).hasSize(1024);
    }

    @Test
    @DisplayName("❌ recordFailed: Missing record is logged, not thrown")
    void recordFailed_MissingRecord() {
        given(repository.findById(recordId)).willReturn(Optional.empty());

        assertThatCode(() -> recordService.recordFailed(recordId,
                new FailureReason(LifecycleState.ARCHIVED, "UploadError", "m", null, null)))
                .doesNotThrowAnyException();
        then(repository).should(never()).save(any());
    }

    @Test
    @DisplayName("✅ failAbandonedRuns: Fails records still PROCESSING from before the cutoff")
    void failAbandonedRuns_Success() {
        Instant processStart = Instant.parse("2026-01-01T00:00:00Z");
        DraftArchive other = new DraftArchive("d2", "template", 0, processStart.minusSeconds(60));
        given(repository.findByStatusAndCreatedAtBefore(ArchiveStatus.PROCESSING, processStart)).willReturn(List.of(record, other));

        int updated = recordService.failAbandonedRuns("abandoned", processStart);

        assertThat(updated).isEqualTo(2);
        assertThat(List.of(record, other)).allSatisfy(r -> {
            assertThat(r.getStatus()).isEqualTo(ArchiveStatus.FAILED);
            assertThat(r.getFailureCode()).isEqualTo("UnexpectedError");
            assertThat(r.getFailureMessage()).isEqualTo("abandoned");
        });
        then(repository).should().saveAll(List.of(record, other));
    }

    @Test
    @DisplayName("✅ findLatest: Delegates to the newest-first query")
    void findLatest_Delegates() {
        given(repository.findFirstByDraftIdOrderByCreatedAtDescIdDesc("d1")).willReturn(Optional.of(record));

        assertThat(recordService.findLatest("d1")).containsSame(record);
    }
}
