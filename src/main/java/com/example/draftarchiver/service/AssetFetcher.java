package com.example.draftarchiver.service;

import com.example.draftarchiver.domain.AssetTask;
import com.example.draftarchiver.domain.DraftWorkspace;
import com.example.draftarchiver.exceptions.AssetFetchException;
import com.example.draftarchiver.exceptions.LifecycleCancelledException;

public interface AssetFetcher {

    /**
     * Downloads one asset into its target inside the workspace, retrying with backoff.
     * On return the task is VERIFIED. On any failure the partially written file has been removed
     * and the task is FAILED.
     *
     * @param task      The task to fulfil; only this fetcher mutates it.
     * @param workspace The owning workspace.
     * @throws AssetFetchException         If every attempt failed.
     * @throws LifecycleCancelledException If the fetching thread was interrupted.
     */
    void fetch(AssetTask task, DraftWorkspace workspace);
}
