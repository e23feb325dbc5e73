package com.example.draftarchiver.service.impl;

import com.example.draftarchiver.exceptions.WorkspaceAlreadyExistsException;
import com.example.draftarchiver.service.WorkspaceRegistry;
import com.example.draftarchiver.service.support.DraftRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Service
public class InMemoryWorkspaceRegistry implements WorkspaceRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryWorkspaceRegistry.class);

    private final ConcurrentMap<String, DraftRun> activeRuns = new ConcurrentHashMap<>();

    @Override
    public DraftRun acquire(String draftId) {
        DraftRun run = new DraftRun(draftId, this::release);
        DraftRun existing = activeRuns.putIfAbsent(draftId, run);
        if (existing != null) {
            log.warn("[Registry] Draft ID {} is already held by an in-flight run", draftId);
            throw new WorkspaceAlreadyExistsException(draftId, "A lifecycle run for draft " + draftId + " is already in flight.");
        }
        log.debug("[Registry] Acquired draft ID {} ({} active)", draftId, activeRuns.size());
        return run;
    }

    @Override
    public Optional<DraftRun> find(String draftId) {
        if (draftId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(activeRuns.get(draftId));
    }

    @Override
    public boolean isActive(String draftId) {
        return draftId != null && activeRuns.containsKey(draftId);
    }

    @Override
    public Set<String> activeDraftIds() {
        return Set.copyOf(activeRuns.keySet());
    }

    private void release(DraftRun run) {
        // only the handle that won acquire() may remove the entry
        if (activeRuns.remove(run.getDraftId(), run)) {
            log.debug("[Registry] Released draft ID {}", run.getDraftId());
        }
    }
}
