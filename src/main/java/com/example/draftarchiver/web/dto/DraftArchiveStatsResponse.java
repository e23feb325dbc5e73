package com.example.draftarchiver.web.dto;

import com.example.draftarchiver.domain.DraftArchive.ArchiveStatus;

import java.util.Map;

public record DraftArchiveStatsResponse(
        String draftId,
        long totalArchives,
        Map<ArchiveStatus, Long> byStatus
) {

    public static DraftArchiveStatsResponse fromCounts(String draftId, Map<ArchiveStatus, Long> byStatus) {
        long total = byStatus.values().stream().mapToLong(Long::longValue).sum();
        return new DraftArchiveStatsResponse(draftId, total, Map.copyOf(byStatus));
    }
}
