package com.example.draftarchiver.web.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request to build and upload one draft archive.
 * A missing draft ID is generated; missing draft content yields an empty metadata document.
 */
public record DraftArchiveRequest(
        @Size(max = 128, message = "Draft ID must be at most 128 characters")
        @Pattern(regexp = "[A-Za-z0-9][A-Za-z0-9_-]*", message = "Draft ID may only contain letters, digits, '_' and '-'")
        String draftId,
        @NotBlank(message = "Template name must be provided")
        String templateName,
        JsonNode draftContent,
        @Valid
        List<AssetRequest> assets
) {

    public List<AssetRequest> assetsOrEmpty() {
        return assets == null ? List.of() : assets;
    }
}
