package com.example.draftarchiver.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * States a draft workspace moves through during one lifecycle run.
 * The pipeline is strictly linear; FAILED may be entered from any non-terminal state,
 * and both UPLOADED and FAILED end in CLEANED_UP.
 */
public enum LifecycleState {
    CREATED,
    PROVISIONED,
    ASSETS_FETCHING,
    METADATA_FINALIZED,
    ARCHIVED,
    UPLOADED,
    FAILED,
    CLEANED_UP;

    private static final Set<LifecycleState> FAILABLE =
            EnumSet.of(CREATED, PROVISIONED, ASSETS_FETCHING, METADATA_FINALIZED, ARCHIVED, UPLOADED);

    public boolean canTransitionTo(LifecycleState next) {
        if (next == FAILED) {
            return FAILABLE.contains(this);
        }
        return switch (this) {
            case CREATED -> next == PROVISIONED;
            case PROVISIONED -> next == ASSETS_FETCHING;
            case ASSETS_FETCHING -> next == METADATA_FINALIZED;
            case METADATA_FINALIZED -> next == ARCHIVED;
            case ARCHIVED -> next == UPLOADED;
            case UPLOADED, FAILED -> next == CLEANED_UP;
            case CLEANED_UP -> false;
        };
    }

    public boolean isTerminal() {
        return this == CLEANED_UP;
    }
}
