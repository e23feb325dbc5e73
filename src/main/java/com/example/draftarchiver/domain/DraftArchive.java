package com.example.draftarchiver.domain;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "draft_archives",
        indexes = {
                @Index(name = "idx_draft_archive_draft_id", columnList = "draftId"),
                @Index(name = "idx_draft_archive_created_at", columnList = "createdAt")
        })
public class DraftArchive {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false, length = 128)
    private String draftId;

    @Column(nullable = false, updatable = false, length = 64)
    private String templateName;

    @Column(nullable = false)
    private int assetCount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ArchiveStatus status = ArchiveStatus.PROCESSING;

    // Last lifecycle state observed for the run
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private LifecycleState lifecycleState = LifecycleState.CREATED;

    @Column(length = 512)
    private String objectKey;

    @Column(length = 1024)
    private String downloadUrl;

    @Column
    private Long archiveSize;

    @Column(length = 64)
    private String failureCode;

    @Column(length = 1024)
    private String failureMessage;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    public enum ArchiveStatus {
        PROCESSING, // Lifecycle run in progress
        COMPLETED, // Archive uploaded, download URL available
        FAILED // Run failed; failure code and message are set
    }

    public DraftArchive() {
    }

    public DraftArchive(String draftId, String templateName, int assetCount, Instant createdAt) {
        this.draftId = draftId;
        this.templateName = templateName;
        this.assetCount = assetCount;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getDraftId() {
        return draftId;
    }

    public String getTemplateName() {
        return templateName;
    }

    public int getAssetCount() {
        return assetCount;
    }

    public ArchiveStatus getStatus() {
        return status;
    }

    public void setStatus(ArchiveStatus status) {
        this.status = status;
    }

    public LifecycleState getLifecycleState() {
        return lifecycleState;
    }

    public void setLifecycleState(LifecycleState lifecycleState) {
        this.lifecycleState = lifecycleState;
    }

    public String getObjectKey() {
        return objectKey;
    }

    public void setObjectKey(String objectKey) {
        this.objectKey = objectKey;
    }

    public String getDownloadUrl() {
        return downloadUrl;
    }

    public void setDownloadUrl(String downloadUrl) {
        this.downloadUrl = downloadUrl;
    }

    public Long getArchiveSize() {
        return archiveSize;
    }

    public void setArchiveSize(Long archiveSize) {
        this.archiveSize = archiveSize;
    }

    public String getFailureCode() {
        return failureCode;
    }

    public void setFailureCode(String failureCode) {
        this.failureCode = failureCode;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    public void setFailureMessage(String failureMessage) {
        this.failureMessage = failureMessage;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
