package com.example.draftarchiver.domain;

import java.nio.file.Path;

/**
 * The single compressed file produced from a finalized workspace.
 */
public record ArchiveArtifact(String draftId, Path path, long sizeBytes) {
}
