package com.example.draftarchiver.domain;

/**
 * Download bookkeeping for one asset of one workspace.
 * Only the fetcher assigned to this task mutates it.
 */
public class AssetTask {

    public enum Status {
        PENDING,
        DOWNLOADING,
        VERIFIED,
        FAILED
    }

    private final String locator;
    private final String targetSubpath;
    private final AssetKind kind;
    private final String expectedSha256;

    private volatile Status status = Status.PENDING;
    private volatile int retryCount;
    private volatile long bytesWritten;

    public AssetTask(AssetDescriptor descriptor) {
        this(descriptor.locator(), descriptor.targetSubpath(), descriptor.kind(), descriptor.expectedSha256());
    }

    public AssetTask(String locator, String targetSubpath, AssetKind kind, String expectedSha256) {
        if (locator == null || locator.isBlank()) {
            throw new IllegalArgumentException("Asset locator cannot be blank.");
        }
        if (targetSubpath == null || targetSubpath.isBlank()) {
            throw new IllegalArgumentException("Asset target subpath cannot be blank for locator: " + locator);
        }
        this.locator = locator;
        this.targetSubpath = targetSubpath;
        this.kind = kind;
        this.expectedSha256 = expectedSha256;
    }

    public String getLocator() {
        return locator;
    }

    public String getTargetSubpath() {
        return targetSubpath;
    }

    public AssetKind getKind() {
        return kind;
    }

    public String getExpectedSha256() {
        return expectedSha256;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void incrementRetryCount() {
        this.retryCount++;
    }

    public long getBytesWritten() {
        return bytesWritten;
    }

    public void setBytesWritten(long bytesWritten) {
        this.bytesWritten = bytesWritten;
    }

    @Override
    public String toString() {
        return "AssetTask{" + kind + " " + locator + " -> " + targetSubpath + ", " + status + ", retries=" + retryCount + "}";
    }
}
