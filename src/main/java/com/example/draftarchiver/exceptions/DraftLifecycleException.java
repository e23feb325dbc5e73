package com.example.draftarchiver.exceptions;

/**
 * Base type for failures that end a draft lifecycle run.
 * Each subtype maps to one code of the lifecycle error taxonomy.
 */
public abstract class DraftLifecycleException extends RuntimeException {

    protected DraftLifecycleException(String message) {
        super(message);
    }

    protected DraftLifecycleException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return The taxonomy code reported to callers, e.g. {@code TemplateNotFound}.
     */
    public abstract String getErrorCode();
}
