package com.example.draftarchiver.web.dto;

import org.springframework.data.domain.Page;

import java.util.List;

/**
 * One page of archive records. Page numbers start at 0.
 */
public record DraftArchivePageResponse(
        List<DraftArchiveStatusResponse> archives,
        int page,
        int size,
        long totalCount,
        int totalPages
) {

    public static DraftArchivePageResponse fromPage(Page<DraftArchiveStatusResponse> page) {
        return new DraftArchivePageResponse(
                page.getContent(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements(),
                page.getTotalPages()
        );
    }
}
