package com.example.draftarchiver.service.impl;

import com.example.draftarchiver.domain.ArchiveArtifact;
import com.example.draftarchiver.domain.AssetDescriptor;
import com.example.draftarchiver.domain.AssetTask;
import com.example.draftarchiver.domain.DraftWorkspace;
import com.example.draftarchiver.domain.FailureReason;
import com.example.draftarchiver.domain.LifecycleResult;
import com.example.draftarchiver.domain.LifecycleState;
import com.example.draftarchiver.domain.UploadReceipt;
import com.example.draftarchiver.exceptions.AssetFetchException;
import com.example.draftarchiver.exceptions.DraftLifecycleException;
import com.example.draftarchiver.exceptions.LifecycleCancelledException;
import com.example.draftarchiver.exceptions.UploadException;
import com.example.draftarchiver.exceptions.WorkspaceAlreadyExistsException;
import com.example.draftarchiver.service.Archiver;
import com.example.draftarchiver.service.AssetFetcher;
import com.example.draftarchiver.service.DraftArchiveRecordService;
import com.example.draftarchiver.service.DraftLifecycleOrchestrator;
import com.example.draftarchiver.service.DraftMetadataBuilder;
import com.example.draftarchiver.service.TemplateProvisioner;
import com.example.draftarchiver.service.Uploader;
import com.example.draftarchiver.service.WorkspaceRegistry;
import com.example.draftarchiver.service.support.DraftRun;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

@Service
public class DraftLifecycleOrchestratorImpl implements DraftLifecycleOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DraftLifecycleOrchestratorImpl.class);
    private static final Pattern DRAFT_ID_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]{0,127}");
    private static final long PERMIT_POLL_MILLIS = 100;

    private final TemplateProvisioner provisioner;
    private final AssetFetcher assetFetcher;
    private final Archiver archiver;
    private final Uploader uploader;
    private final WorkspaceRegistry registry;
    private final DraftArchiveRecordService records;
    private final AsyncTaskExecutor fetchExecutor;
    private final int fetchParallelism;
    private final String metadataFileName;
    private final Duration cleanupWait;

    @Autowired
    public DraftLifecycleOrchestratorImpl(
            TemplateProvisioner provisioner,
            AssetFetcher assetFetcher,
            Archiver archiver,
            Uploader uploader,
            WorkspaceRegistry registry,
            DraftArchiveRecordService records,
            @Qualifier("assetFetchExecutor") AsyncTaskExecutor fetchExecutor,
            @Value("${draft.assets.fetch.parallelism:4}") int fetchParallelism,
            @Value("${draft.metadata.filename:draft_content.json}") String metadataFileName,
            @Value("${draft.cleanup.await-ms:30000}") long cleanupWaitMillis
    ) {
        if (fetchParallelism < 1) {
            throw new IllegalArgumentException("Asset fetch parallelism must be at least 1, was " + fetchParallelism);
        }
        this.provisioner = provisioner;
        this.assetFetcher = assetFetcher;
        this.archiver = archiver;
        this.uploader = uploader;
        this.registry = registry;
        this.records = records;
        this.fetchExecutor = fetchExecutor;
        this.fetchParallelism = fetchParallelism;
        this.metadataFileName = metadataFileName;
        this.cleanupWait = Duration.ofMillis(cleanupWaitMillis);
    }

    @Override
    public LifecycleResult runLifecycle(String draftId, String templateName, DraftMetadataBuilder metadataBuilder,
                                        List<AssetDescriptor> assets) {
        String id = (draftId == null || draftId.isBlank()) ? generateDraftId() : draftId;
        List<AssetTask> tasks = validateRequest(id, templateName, metadataBuilder, assets);

        DraftRun run;
        try {
            run = registry.acquire(id);
        } catch (WorkspaceAlreadyExistsException e) {
            log.warn("[Lifecycle][draft:{}] Rejected: {}", id, e.getMessage());
            return LifecycleResult.failure(id, toFailureReason(LifecycleState.CREATED, e));
        }

        try (run) {
            log.info("[Lifecycle][draft:{}] Starting run from template '{}' with {} asset(s)", id, templateName, tasks.size());
            Long recordId = records.recordStarted(id, templateName, tasks.size());
            run.bindOwner(Thread.currentThread());
            LifecycleResult result;
            try {
                result = execute(run, recordId, templateName, metadataBuilder, tasks);
            } finally {
                if (run.unbindOwner()) {
                    // Interrupt came from cancel(); the result already reports it
                    Thread.interrupted();
                }
            }
            if (result.isSuccess()) {
                records.recordCompleted(recordId, result.getReceipt());
            } else {
                records.recordFailed(recordId, result.getFailure());
            }
            log.info("[Lifecycle][draft:{}] Run finished: {}", id, result);
            return result;
        }
    }

    @Override
    public boolean cancel(String draftId) {
        boolean cancelled = registry.find(draftId).map(DraftRun::cancel).orElse(false);
        if (cancelled) {
            log.info("[Lifecycle][draft:{}] Cancellation requested", draftId);
        } else {
            log.debug("[Lifecycle][draft:{}] No cancellable run in flight", draftId);
        }
        return cancelled;
    }

    private LifecycleResult execute(DraftRun run, Long recordId, String templateName,
                                    DraftMetadataBuilder metadataBuilder, List<AssetTask> tasks) {
        String draftId = run.getDraftId();
        DraftWorkspace workspace = null;
        LifecycleResult result = null;
        // Stage whose work is in progress, reported if it fails
        LifecycleState stage = LifecycleState.PROVISIONED;
        try {
            checkpoint(run);
            workspace = provisioner.provision(templateName, draftId);
            advance(workspace, recordId, LifecycleState.PROVISIONED);
            for (AssetTask task : tasks) {
                workspace.addAsset(task);
            }

            stage = LifecycleState.ASSETS_FETCHING;
            checkpoint(run);
            advance(workspace, recordId, LifecycleState.ASSETS_FETCHING);
            fetchAll(run, workspace);

            stage = LifecycleState.METADATA_FINALIZED;
            checkpoint(run);
            JsonNode document = metadataBuilder.build(workspace);
            workspace.finalizeMetadata(document);
            advance(workspace, recordId, LifecycleState.METADATA_FINALIZED);

            stage = LifecycleState.ARCHIVED;
            checkpoint(run);
            ArchiveArtifact artifact = archiver.archive(workspace);
            advance(workspace, recordId, LifecycleState.ARCHIVED);

            stage = LifecycleState.UPLOADED;
            checkpoint(run);
            UploadReceipt receipt = uploader.upload(artifact, draftId);
            advance(workspace, recordId, LifecycleState.UPLOADED);
            result = LifecycleResult.success(receipt);

        } catch (DraftLifecycleException failure) {
            DraftLifecycleException e = failure;
            if (run.isCancelled() && !(e instanceof LifecycleCancelledException)) {
                // Interrupted I/O surfaces as a stage error once cancel() has hit the owner thread
                e = new LifecycleCancelledException("Lifecycle run for draft " + draftId + " was cancelled during " + stage + ".", failure);
            }
            log.warn("[Lifecycle][draft:{}] {} during {}: {}", draftId, e.getErrorCode(), stage, e.getMessage());
            result = fail(draftId, workspace, toFailureReason(stage, e));

        } catch (RuntimeException e) {
            log.error("[Lifecycle][draft:{}] Unexpected failure during {}", draftId, stage, e);
            FailureReason reason = new FailureReason(stage, "UnexpectedError",
                    "Unexpected failure during " + stage + ": " + e.getMessage(), e.toString(), List.of());
            result = fail(draftId, workspace, reason);

        } finally {
            cleanup(run, workspace);
        }
        return result;
    }

    private void fetchAll(DraftRun run, DraftWorkspace workspace) {
        String draftId = workspace.getDraftId();
        List<AssetTask> tasks = workspace.getAssetTasks();
        if (tasks.isEmpty()) {
            log.debug("[Lifecycle][draft:{}] No assets to fetch", draftId);
            return;
        }

        Semaphore permits = new Semaphore(fetchParallelism);
        List<Future<?>> futures = new ArrayList<>(tasks.size());
        try {
            for (AssetTask task : tasks) {
                acquirePermit(run, permits);
                Future<?> future;
                try {
                    future = submitFetch(run, permits, task, workspace);
                } catch (RuntimeException | InterruptedException e) {
                    permits.release();
                    throw e;
                }
                run.track(future);
                futures.add(future);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.cancel();
            throw new LifecycleCancelledException("Lifecycle run for draft " + draftId + " was interrupted while scheduling fetches.", e);
        }
        log.debug("[Lifecycle][draft:{}] Scheduled {} fetch(es), waiting for all to finish", draftId, futures.size());

        List<AssetFetchException> failures = new ArrayList<>();
        RuntimeException unexpected = null;
        boolean cancelled = false;
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (CancellationException e) {
                cancelled = true;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof AssetFetchException fetchFailure) {
                    failures.add(fetchFailure);
                } else if (cause instanceof LifecycleCancelledException) {
                    cancelled = true;
                } else if (cause instanceof RuntimeException runtime) {
                    if (unexpected == null) {
                        unexpected = runtime;
                    }
                } else if (cause instanceof Error error) {
                    throw error;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                run.cancel();
                throw new LifecycleCancelledException("Lifecycle run for draft " + draftId + " was interrupted while fetching assets.", e);
            }
        }

        if (cancelled || run.isCancelled()) {
            throw new LifecycleCancelledException("Lifecycle run for draft " + draftId + " was cancelled while fetching assets.");
        }
        if (unexpected != null) {
            throw unexpected;
        }
        if (!failures.isEmpty()) {
            throw AssetFetchException.aggregate(draftId, failures);
        }
        log.info("[Lifecycle][draft:{}] All {} asset(s) verified", draftId, tasks.size());
    }

    /**
     * Hands the fetch to the shared pool. While the pool is saturated the run waits and retries,
     * so every fetch runs on a pool thread where cancellation can reach it.
     */
    private Future<?> submitFetch(DraftRun run, Semaphore permits, AssetTask task, DraftWorkspace workspace)
            throws InterruptedException {
        boolean logged = false;
        while (true) {
            run.throwIfCancelled();
            try {
                return fetchExecutor.submit(() -> runFetch(run, permits, task, workspace));
            } catch (TaskRejectedException e) {
                if (!logged) {
                    log.debug("[Lifecycle][draft:{}] Fetch pool saturated, waiting to schedule {}", run.getDraftId(), task.getLocator());
                    logged = true;
                }
                TimeUnit.MILLISECONDS.sleep(PERMIT_POLL_MILLIS);
            }
        }
    }

    private void runFetch(DraftRun run, Semaphore permits, AssetTask task, DraftWorkspace workspace) {
        try {
            if (!run.enterTask()) {
                throw new LifecycleCancelledException("Fetch of " + task.getLocator() + " skipped, run was cancelled.");
            }
            try {
                assetFetcher.fetch(task, workspace);
            } finally {
                run.exitTask();
            }
        } finally {
            permits.release();
        }
    }

    private void acquirePermit(DraftRun run, Semaphore permits) throws InterruptedException {
        while (!permits.tryAcquire(PERMIT_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
            run.throwIfCancelled();
        }
        if (run.isCancelled()) {
            permits.release();
            run.throwIfCancelled();
        }
    }

    private void checkpoint(DraftRun run) {
        if (Thread.currentThread().isInterrupted()) {
            run.cancel();
        }
        run.throwIfCancelled();
    }

    private void advance(DraftWorkspace workspace, Long recordId, LifecycleState next) {
        workspace.transitionTo(next);
        records.recordState(recordId, next);
    }

    private LifecycleResult fail(String draftId, DraftWorkspace workspace, FailureReason reason) {
        if (workspace != null) {
            workspace.fail(reason);
        }
        return LifecycleResult.failure(draftId, reason);
    }

    private void cleanup(DraftRun run, DraftWorkspace workspace) {
        String draftId = run.getDraftId();
        boolean interrupted = Thread.interrupted();
        try {
            if (run.hasPendingWork()) {
                run.cancel();
                log.info("[Lifecycle][draft:{}] Waiting for {} in-flight fetch(es) to stop before cleanup", draftId, run.getActiveTasks());
                try {
                    if (!run.awaitTasksIdle(cleanupWait)) {
                        log.error("[Lifecycle][draft:{}] Fetches still active after {} ms, cleaning up anyway", draftId, cleanupWait.toMillis());
                    }
                } catch (InterruptedException e) {
                    interrupted = true;
                    log.warn("[Lifecycle][draft:{}] Interrupted while waiting for fetches to stop", draftId);
                }
            }

            // A workspace is only ever deleted by the run that provisioned it
            if (workspace != null) {
                deleteWorkspace(workspace.path(), draftId);
                archiver.discard(draftId);
                workspace.transitionTo(LifecycleState.CLEANED_UP);
            }
            log.debug("[Lifecycle][draft:{}] Cleanup complete", draftId);
        } catch (RuntimeException e) {
            log.error("[Lifecycle][draft:{}] Cleanup failed", draftId, e);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void deleteWorkspace(Path path, String draftId) {
        try {
            if (FileSystemUtils.deleteRecursively(path)) {
                log.debug("[Lifecycle][draft:{}] Deleted workspace {}", draftId, path);
            }
        } catch (IOException e) {
            log.error("[Lifecycle][draft:{}] Failed to delete workspace {}", draftId, path, e);
        }
    }

    private static FailureReason toFailureReason(LifecycleState stage, DraftLifecycleException e) {
        List<String> failedLocators = e instanceof AssetFetchException fetchFailure
                ? fetchFailure.getFailedLocators()
                : List.of();
        String cause = e.getCause() != null ? e.getCause().toString() : null;
        if (e instanceof UploadException uploadFailure) {
            return new FailureReason(stage, e.getErrorCode(), e.getMessage(), cause, failedLocators,
                    uploadFailure.isTransientFailure(), uploadFailure.getAttempts());
        }
        return new FailureReason(stage, e.getErrorCode(), e.getMessage(), cause, failedLocators);
    }

    private List<AssetTask> validateRequest(String draftId, String templateName, DraftMetadataBuilder metadataBuilder,
                                            List<AssetDescriptor> assets) {
        if (!DRAFT_ID_PATTERN.matcher(draftId).matches()) {
            throw new IllegalArgumentException("Invalid draft ID: " + draftId);
        }
        if (templateName == null || templateName.isBlank()) {
            throw new IllegalArgumentException("Template name cannot be blank.");
        }
        if (metadataBuilder == null) {
            throw new IllegalArgumentException("A draft metadata builder is required.");
        }
        if (assets == null) {
            throw new IllegalArgumentException("Asset list cannot be null; pass an empty list for drafts without assets.");
        }

        List<AssetTask> tasks = new ArrayList<>(assets.size());
        Set<Path> targets = new HashSet<>();
        for (AssetDescriptor descriptor : assets) {
            if (descriptor == null) {
                throw new IllegalArgumentException("Asset descriptors cannot be null.");
            }
            AssetTask task = new AssetTask(descriptor);
            Path target = validateSubpath(task.getTargetSubpath());
            if (!targets.add(target)) {
                throw new IllegalArgumentException("Duplicate asset target: " + task.getTargetSubpath());
            }
            tasks.add(task);
        }
        return tasks;
    }

    private Path validateSubpath(String subpath) {
        try {
            Path relative = Paths.get(subpath);
            if (relative.isAbsolute() || subpath.contains("..")) {
                throw new IllegalArgumentException("Asset target must be a relative path inside the workspace: " + subpath);
            }
            Path normalized = relative.normalize();
            if (normalized.toString().isEmpty()) {
                throw new IllegalArgumentException("Asset target cannot be the workspace itself: " + subpath);
            }
            if (normalized.equals(Paths.get(metadataFileName))) {
                throw new IllegalArgumentException("Asset target collides with the draft metadata file: " + subpath);
            }
            return normalized;
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid asset target path: " + subpath, e);
        }
    }

    private static String generateDraftId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
