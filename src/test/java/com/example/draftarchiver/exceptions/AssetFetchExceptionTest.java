package com.example.draftarchiver.exceptions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("AssetFetchException Tests")
class AssetFetchExceptionTest {

    @Test
    @DisplayName("Single failure should carry its locator and cause")
    void singleFailure() {
        IOException cause = new IOException("connection reset");
        AssetFetchException ex = new AssetFetchException("https://cdn/a.png", "Failed to fetch asset", cause);

        assertThat(ex.getFailedLocators()).containsExactly("https://cdn/a.png");
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.getErrorCode()).isEqualTo("AssetFetchError");
    }

    @Test
    @DisplayName("Aggregate of one failure should return that failure")
    void aggregateSingle() {
        AssetFetchException only = new AssetFetchException("https://cdn/a.png", "boom", null);

        assertThat(AssetFetchException.aggregate("d1", List.of(only))).isSameAs(only);
    }

    @Test
    @DisplayName("Aggregate should list every locator and keep failures as suppressed")
    void aggregateMany() {
        IOException firstCause = new IOException("first");
        AssetFetchException a = new AssetFetchException("https://cdn/a.png", "a failed", firstCause);
        AssetFetchException b = new AssetFetchException("https://cdn/b.png", "b failed", null);

        AssetFetchException aggregated = AssetFetchException.aggregate("d1", List.of(a, b));

        assertThat(aggregated.getFailedLocators()).containsExactly("https://cdn/a.png", "https://cdn/b.png");
        assertThat(aggregated.getMessage()).isEqualTo("2 assets failed to download for draft d1");
        assertThat(aggregated.getCause()).isSameAs(firstCause);
        assertThat(aggregated.getSuppressed()).containsExactly(a, b);
    }

    @Test
    @DisplayName("Aggregate of nothing should be rejected")
    void aggregateEmpty() {
        assertThatThrownBy(() -> AssetFetchException.aggregate("d1", List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Every lifecycle exception should report its taxonomy code")
    void errorCodes() {
        assertThat(new TemplateNotFoundException("t").getErrorCode()).isEqualTo("TemplateNotFound");
        assertThat(new WorkspaceAlreadyExistsException("d1", "m").getErrorCode()).isEqualTo("WorkspaceAlreadyExists");
        assertThat(new ProvisionIOException("m", null).getErrorCode()).isEqualTo("ProvisionIOError");
        assertThat(new WorkspaceNotReadyException("m").getErrorCode()).isEqualTo("WorkspaceNotReady");
        assertThat(new ArchiveException("m", null).getErrorCode()).isEqualTo("ArchiveError");
        assertThat(new UploadException("m", null, true, 3).getErrorCode()).isEqualTo("UploadError");
        assertThat(new LifecycleCancelledException("m").getErrorCode()).isEqualTo("CancelledError");
    }
}
