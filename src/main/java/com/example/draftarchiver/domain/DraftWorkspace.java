package com.example.draftarchiver.domain;

import com.example.draftarchiver.exceptions.ArchiveException;
import com.example.draftarchiver.exceptions.WorkspaceNotReadyException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The per-draft aggregate: an exclusively owned working directory, the asset tasks that fill it
 * and the draft metadata document written into it once everything has been fetched.
 * <p>
 * Lifecycle transitions are driven only by the orchestrator that owns the run.
 */
public class DraftWorkspace {

    private static final Logger log = LoggerFactory.getLogger(DraftWorkspace.class);
    private static final String TEMP_SUFFIX = ".tmp";

    private final String draftId;
    private final Path path;
    private final String metadataFileName;
    private final ObjectMapper objectMapper;
    private final List<AssetTask> assetTasks = new CopyOnWriteArrayList<>();

    private volatile LifecycleState state = LifecycleState.CREATED;
    private volatile FailureReason failureReason;
    private volatile boolean metadataFinalized;

    public DraftWorkspace(String draftId, Path path, String metadataFileName, ObjectMapper objectMapper) {
        if (!path.getFileName().toString().equals(draftId)) {
            throw new IllegalArgumentException("Workspace directory name must equal the draft ID: " + path + " vs " + draftId);
        }
        this.draftId = draftId;
        this.path = path.toAbsolutePath().normalize();
        this.metadataFileName = metadataFileName;
        this.objectMapper = objectMapper;
    }

    public String getDraftId() {
        return draftId;
    }

    public Path path() {
        return path;
    }

    public Path metadataPath() {
        return path.resolve(metadataFileName);
    }

    public LifecycleState getState() {
        return state;
    }

    public FailureReason getFailureReason() {
        return failureReason;
    }

    public boolean isMetadataFinalized() {
        return metadataFinalized;
    }

    public List<AssetTask> getAssetTasks() {
        return Collections.unmodifiableList(assetTasks);
    }

    /**
     * Registers an asset to be fetched into this workspace. Only allowed before fetching starts.
     *
     * @throws IllegalArgumentException if the target escapes the workspace or is already taken.
     */
    public void addAsset(AssetTask task) {
        if (state != LifecycleState.CREATED && state != LifecycleState.PROVISIONED) {
            throw new IllegalStateException("Cannot add assets to workspace " + draftId + " in state " + state);
        }
        resolveTarget(task);
        for (AssetTask existing : assetTasks) {
            if (existing.getTargetSubpath().equals(task.getTargetSubpath())) {
                throw new IllegalArgumentException("Duplicate asset target in workspace " + draftId + ": " + task.getTargetSubpath());
            }
        }
        assetTasks.add(task);
    }

    /**
     * Resolves a task's target subpath inside this workspace.
     */
    public Path resolveTarget(AssetTask task) {
        String subpath = task.getTargetSubpath();
        try {
            Path relative = Paths.get(subpath);
            if (relative.isAbsolute() || subpath.contains("..")) {
                throw new IllegalArgumentException("Asset target must be a relative path inside the workspace: " + subpath);
            }
            Path resolved = path.resolve(relative).normalize();
            if (!resolved.startsWith(path) || resolved.equals(path)) {
                throw new IllegalArgumentException("Asset target escapes the workspace: " + subpath);
            }
            if (resolved.equals(metadataPath())) {
                throw new IllegalArgumentException("Asset target collides with the draft metadata file: " + subpath);
            }
            return resolved;
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid asset target path: " + subpath, e);
        }
    }

    public Map<String, AssetTask.Status> assetStatuses() {
        Map<String, AssetTask.Status> statuses = new LinkedHashMap<>();
        for (AssetTask task : assetTasks) {
            statuses.put(task.getTargetSubpath(), task.getStatus());
        }
        return statuses;
    }

    public boolean allAssetsVerified() {
        return assetTasks.stream().allMatch(task -> task.getStatus() == AssetTask.Status.VERIFIED);
    }

    /**
     * Writes the fully assembled metadata document. The document is written to a temporary file
     * and renamed into place, so readers of the directory never observe a partial document.
     *
     * @throws WorkspaceNotReadyException if any asset is not yet verified, or metadata was already finalized.
     * @throws ArchiveException           if the document cannot be written. Metadata shares the archive's
     *                                    error code; the failure reason's stage ({@code METADATA_FINALIZED})
     *                                    tells the two apart.
     */
    public synchronized void finalizeMetadata(JsonNode document) {
        if (metadataFinalized) {
            throw new WorkspaceNotReadyException("Metadata for draft " + draftId + " has already been finalized.");
        }
        if (state != LifecycleState.ASSETS_FETCHING) {
            throw new WorkspaceNotReadyException("Workspace " + draftId + " cannot finalize metadata in state " + state);
        }
        if (!allAssetsVerified()) {
            throw new WorkspaceNotReadyException("Workspace " + draftId + " has unverified assets: " + assetStatuses());
        }
        if (document == null) {
            throw new IllegalArgumentException("Draft metadata document cannot be null.");
        }

        Path target = metadataPath();
        Path temp = target.resolveSibling("." + metadataFileName + TEMP_SUFFIX);
        try {
            objectMapper.writeValue(temp.toFile(), document);
            moveIntoPlace(temp, target);
            metadataFinalized = true;
            log.debug("[Workspace][draft:{}] Metadata written to {}", draftId, target);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new ArchiveException("Failed to write draft metadata for draft " + draftId, e);
        }
    }

    /**
     * Seeds an empty metadata document if the template did not provide one.
     */
    public void seedEmptyMetadata() throws IOException {
        Path target = metadataPath();
        if (Files.exists(target)) {
            return;
        }
        Path temp = target.resolveSibling("." + metadataFileName + TEMP_SUFFIX);
        objectMapper.writeValue(temp.toFile(), objectMapper.createObjectNode());
        moveIntoPlace(temp, target);
    }

    public void transitionTo(LifecycleState next) {
        LifecycleState current = this.state;
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal lifecycle transition for draft " + draftId + ": " + current + " -> " + next);
        }
        this.state = next;
        log.debug("[Workspace][draft:{}] {} -> {}", draftId, current, next);
    }

    public void fail(FailureReason reason) {
        this.failureReason = reason;
        if (state.canTransitionTo(LifecycleState.FAILED)) {
            transitionTo(LifecycleState.FAILED);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("[Workspace][draft:{}] Failed to delete temporary metadata file {}: {}", draftId, file, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "DraftWorkspace{" + draftId + ", " + state + ", assets=" + assetTasks.size() + "}";
    }
}
