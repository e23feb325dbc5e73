package com.example.draftarchiver.domain;

/**
 * Outcome of one lifecycle run: either a receipt or a failure reason, never both.
 * Cleanup has already run by the time a result exists.
 */
public final class LifecycleResult {

    private final String draftId;
    private final UploadReceipt receipt;
    private final FailureReason failure;

    private LifecycleResult(String draftId, UploadReceipt receipt, FailureReason failure) {
        this.draftId = draftId;
        this.receipt = receipt;
        this.failure = failure;
    }

    public static LifecycleResult success(UploadReceipt receipt) {
        return new LifecycleResult(receipt.draftId(), receipt, null);
    }

    public static LifecycleResult failure(String draftId, FailureReason failure) {
        return new LifecycleResult(draftId, null, failure);
    }

    public boolean isSuccess() {
        return receipt != null;
    }

    public String getDraftId() {
        return draftId;
    }

    public UploadReceipt getReceipt() {
        if (receipt == null) {
            throw new IllegalStateException("Lifecycle run for draft " + draftId + " failed: " + failure.errorCode());
        }
        return receipt;
    }

    public FailureReason getFailure() {
        if (failure == null) {
            throw new IllegalStateException("Lifecycle run for draft " + draftId + " succeeded.");
        }
        return failure;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "LifecycleResult{draft=" + draftId + ", receipt=" + receipt.objectKey() + "}"
                : "LifecycleResult{draft=" + draftId + ", failure=" + failure.errorCode() + " in " + failure.stage() + "}";
    }
}
