package com.example.draftarchiver.web.controller;

import com.example.draftarchiver.domain.AssetDescriptor;
import com.example.draftarchiver.domain.DraftArchive;
import com.example.draftarchiver.domain.LifecycleResult;
import com.example.draftarchiver.exceptions.DraftArchiveFailedException;
import com.example.draftarchiver.service.DraftArchiveManagementService;
import com.example.draftarchiver.service.DraftArchiveRecordService;
import com.example.draftarchiver.service.DraftLifecycleOrchestrator;
import com.example.draftarchiver.service.DraftMetadataBuilder;
import com.example.draftarchiver.service.WorkspaceRegistry;
import com.example.draftarchiver.web.dto.AssetRequest;
import com.example.draftarchiver.web.dto.DraftArchivePageResponse;
import com.example.draftarchiver.web.dto.DraftArchiveRequest;
import com.example.draftarchiver.web.dto.DraftArchiveResponse;
import com.example.draftarchiver.web.dto.DraftArchiveStatsResponse;
import com.example.draftarchiver.web.dto.DraftArchiveStatusResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/draft-archives")
public class DraftArchiveController {

    private static final Logger log = LoggerFactory.getLogger(DraftArchiveController.class);
    private static final String ARCHIVE_NOT_FOUND_MSG = "No archive run found for draft.";
    private static final int MAX_PAGE_SIZE = 1000;

    private final DraftLifecycleOrchestrator orchestrator;
    private final DraftArchiveRecordService recordService;
    private final DraftArchiveManagementService managementService;
    private final WorkspaceRegistry registry;
    private final ObjectMapper objectMapper;

    public DraftArchiveController(
            DraftLifecycleOrchestrator orchestrator,
            DraftArchiveRecordService recordService,
            DraftArchiveManagementService managementService,
            WorkspaceRegistry registry,
            ObjectMapper objectMapper) {

        this.orchestrator = orchestrator;
        this.recordService = recordService;
        this.managementService = managementService;
        this.registry = registry;
        this.objectMapper = objectMapper;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DraftArchiveResponse> archiveDraft(@RequestBody @Valid DraftArchiveRequest request) {
        List<AssetDescriptor> assets = request.assetsOrEmpty().stream()
                .map(AssetRequest::toDescriptor)
                .toList();
        log.info("Archive request received for draft {} (template '{}', {} assets)",
                request.draftId(), request.templateName(), assets.size());

        LifecycleResult result = orchestrator.runLifecycle(
                request.draftId(), request.templateName(), metadataBuilderFor(request.draftContent()), assets);

        if (!result.isSuccess()) {
            throw new DraftArchiveFailedException(result.getDraftId(), result.getFailure());
        }
        log.info("Controller returning OK for draft {}", result.getDraftId());
        return ResponseEntity.ok(DraftArchiveResponse.fromReceipt(result.getReceipt()));
    }

    @PostMapping("/{draftId}/cancel")
    public ResponseEntity<Void> cancelDraft(@PathVariable String draftId) {
        if (!orchestrator.cancel(draftId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No in-flight archive run for draft " + draftId);
        }
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/{draftId}")
    public ResponseEntity<DraftArchiveStatusResponse> getDraftArchive(@PathVariable String draftId) {
        DraftArchive archive = recordService.findLatest(draftId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, ARCHIVE_NOT_FOUND_MSG));
        return ResponseEntity.ok(DraftArchiveStatusResponse.fromEntity(archive, registry.isActive(draftId)));
    }

    @GetMapping
    public ResponseEntity<DraftArchivePageResponse> listDraftArchives(
            @RequestParam(required = false) String draftId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "100") int size) {
        PageRequest pageRequest = PageRequest.of(Math.max(0, page), Math.min(Math.max(1, size), MAX_PAGE_SIZE));
        Page<DraftArchiveStatusResponse> archives = managementService.listArchives(draftId, pageRequest)
                .map(archive -> DraftArchiveStatusResponse.fromEntity(archive, registry.isActive(archive.getDraftId())));
        log.debug("Returning {} of {} archive records (draft filter: {})", archives.getNumberOfElements(), archives.getTotalElements(), draftId);
        return ResponseEntity.ok(DraftArchivePageResponse.fromPage(archives));
    }

    @GetMapping("/stats")
    public ResponseEntity<DraftArchiveStatsResponse> getDraftArchiveStats(@RequestParam(required = false) String draftId) {
        return ResponseEntity.ok(DraftArchiveStatsResponse.fromCounts(draftId, managementService.countByStatus(draftId)));
    }

    @GetMapping("/records/{archiveId}")
    public ResponseEntity<DraftArchiveStatusResponse> getArchiveRecord(@PathVariable Long archiveId) {
        DraftArchive archive = managementService.getArchive(archiveId);
        return ResponseEntity.ok(DraftArchiveStatusResponse.fromEntity(archive, registry.isActive(archive.getDraftId())));
    }

    @DeleteMapping("/records/{archiveId}")
    public ResponseEntity<Void> deleteArchiveRecord(@PathVariable Long archiveId) {
        managementService.deleteArchive(archiveId);
        return ResponseEntity.noContent().build();
    }

    private DraftMetadataBuilder metadataBuilderFor(JsonNode draftContent) {
        return workspace -> draftContent == null || draftContent.isNull()
                ? objectMapper.createObjectNode()
                : draftContent;
    }
}
