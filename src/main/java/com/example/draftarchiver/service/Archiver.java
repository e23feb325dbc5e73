package com.example.draftarchiver.service;

import com.example.draftarchiver.domain.ArchiveArtifact;
import com.example.draftarchiver.domain.DraftWorkspace;
import com.example.draftarchiver.exceptions.ArchiveException;

import java.nio.file.Path;

public interface Archiver {

    /**
     * Compresses the whole workspace tree into a single artifact whose path depends only on
     * the draft ID. A stale artifact from an earlier attempt is replaced.
     *
     * @param workspace A workspace whose metadata has been finalized.
     * @return The artifact.
     * @throws ArchiveException If writing fails; no partial artifact is left behind.
     */
    ArchiveArtifact archive(DraftWorkspace workspace);

    Path artifactPathFor(String draftId);

    /**
     * Deletes the artifact and any temporary artifact for the draft, if present.
     *
     * @return true if anything was deleted.
     */
    boolean discard(String draftId);

    /**
     * @return The directory artifacts are written to.
     */
    Path archiveRoot();
}
