package com.example.draftarchiver.exceptions;

import java.util.ArrayList;
import java.util.List;

/**
 * One or more assets could not be fetched after exhausting their retries.
 * A single-asset failure carries the locator and last underlying cause; an aggregated
 * failure carries every failed locator and keeps the per-asset failures as suppressed exceptions.
 */
public class AssetFetchException extends DraftLifecycleException {

    private final List<String> failedLocators;

    public AssetFetchException(String locator, String message, Throwable lastCause) {
        super(message, lastCause);
        this.failedLocators = List.of(locator);
    }

    private AssetFetchException(String message, List<String> failedLocators, Throwable firstCause) {
        super(message, firstCause);
        this.failedLocators = List.copyOf(failedLocators);
    }

    public static AssetFetchException aggregate(String draftId, List<AssetFetchException> failures) {
        if (failures == null || failures.isEmpty()) {
            throw new IllegalArgumentException("Cannot aggregate an empty list of asset failures.");
        }
        if (failures.size() == 1) {
            return failures.get(0);
        }
        List<String> locators = new ArrayList<>();
        for (AssetFetchException failure : failures) {
            locators.addAll(failure.getFailedLocators());
        }
        AssetFetchException aggregated = new AssetFetchException(
                failures.size() + " assets failed to download for draft " + draftId,
                locators,
                failures.get(0).getCause());
        failures.forEach(aggregated::addSuppressed);
        return aggregated;
    }

    public List<String> getFailedLocators() {
        return failedLocators;
    }

    @Override
    public String getErrorCode() {
        return "AssetFetchError";
    }
}
