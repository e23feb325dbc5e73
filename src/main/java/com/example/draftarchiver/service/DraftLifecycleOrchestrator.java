package com.example.draftarchiver.service;

import com.example.draftarchiver.domain.AssetDescriptor;
import com.example.draftarchiver.domain.LifecycleResult;

import java.util.List;

public interface DraftLifecycleOrchestrator {

    /**
     * Runs the full lifecycle for one draft: provision, fetch assets, finalize metadata, archive,
     * upload, and clean up. Blocks the caller until the run ends; cleanup has completed before this returns.
     *
     * @param draftId         The draft ID, or null/blank to generate one.
     * @param templateName    The template to provision from.
     * @param metadataBuilder Supplies the metadata document once assets are in place.
     * @param assets          The remote assets the draft requires.
     * @return A result holding the upload receipt, or the structured failure reason.
     * @throws IllegalArgumentException If the request is malformed; nothing has been acquired in that case.
     */
    LifecycleResult runLifecycle(String draftId, String templateName, DraftMetadataBuilder metadataBuilder,
                                 List<AssetDescriptor> assets);

    /**
     * Cancels the in-flight run for a draft. The run aborts its fetches, cleans up and
     * reports {@code CancelledError}.
     *
     * @return true if a run was found and cancelled.
     */
    boolean cancel(String draftId);
}
