package com.example.draftarchiver.service;

import com.example.draftarchiver.exceptions.WorkspaceAlreadyExistsException;
import com.example.draftarchiver.service.support.DraftRun;

import java.util.Optional;
import java.util.Set;

/**
 * Process-wide registry of draft IDs with a lifecycle run in flight.
 * Holds one exclusive handle per draft ID.
 */
public interface WorkspaceRegistry {

    /**
     * Claims the draft ID. Release by closing the returned handle.
     *
     * @throws WorkspaceAlreadyExistsException If another run holds the ID.
     */
    DraftRun acquire(String draftId);

    Optional<DraftRun> find(String draftId);

    boolean isActive(String draftId);

    Set<String> activeDraftIds();
}
