package com.example.draftarchiver.web.dto;

import com.example.draftarchiver.domain.AssetDescriptor;
import com.example.draftarchiver.domain.AssetKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

public record AssetRequest(
        @NotBlank(message = "Asset URL must be provided")
        String url,
        @NotNull(message = "Asset kind must be provided")
        AssetKind kind,
        @NotBlank(message = "Asset target path must be provided")
        String targetPath,  // Relative to the draft folder, e.g. "assets/audio/intro.mp3"
        @Pattern(regexp = "[0-9a-fA-F]{64}", message = "sha256 must be 64 hex characters")
        String sha256       // Optional
) {

    public AssetDescriptor toDescriptor() {
        return new AssetDescriptor(url, kind, targetPath, sha256 == null ? null : sha256.toLowerCase());
    }
}
