package com.example.draftarchiver.domain;

import com.example.draftarchiver.exceptions.WorkspaceNotReadyException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DraftWorkspace Tests")
class DraftWorkspaceTest {

    private static final String METADATA_FILE = "draft_content.json";

    @TempDir
    Path root;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private DraftWorkspace workspace;

    @BeforeEach
    void setUp() throws IOException {
        Path dir = Files.createDirectories(root.resolve("d1"));
        workspace = new DraftWorkspace("d1", dir, METADATA_FILE, objectMapper);
    }

    private AssetTask task(String subpath) {
        return new AssetTask("https://cdn.example.com/" + subpath, subpath, AssetKind.IMAGE, null);
    }

    @Test
    @DisplayName("❌ Constructor rejects a directory not named after the draft")
    void constructor_RejectsMismatchedDirectory() {
        assertThatThrownBy(() -> new DraftWorkspace("d2", root.resolve("d1"), METADATA_FILE, objectMapper))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must equal the draft ID");
    }

    @Nested
    @DisplayName("addAsset")
    class AddAsset {

        @Test
        @DisplayName("✅ Registers assets in order and resolves them inside the workspace")
        void addAsset_Success() {
            workspace.addAsset(task("assets/image/a.png"));
            workspace.addAsset(task("assets/audio/b.mp3"));

            assertThat(workspace.getAssetTasks()).extracting(AssetTask::getTargetSubpath)
                    .containsExactly("assets/image/a.png", "assets/audio/b.mp3");
            assertThat(workspace.resolveTarget(workspace.getAssetTasks().get(0)))
                    .isEqualTo(workspace.path().resolve("assets/image/a.png"));
        }

        @Test
        @DisplayName("❌ Rejects traversal out of the workspace")
        void addAsset_RejectsTraversal() {
            assertThatThrownBy(() -> workspace.addAsset(task("../d2/evil.png")))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(workspace.getAssetTasks()).isEmpty();
        }

        @Test
        @DisplayName("❌ Rejects absolute targets")
        void addAsset_RejectsAbsolute() {
            String absolute = root.resolve("elsewhere.png").toAbsolutePath().toString();
            assertThatThrownBy(() -> workspace.addAsset(task(absolute)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("relative path");
        }

        @Test
        @DisplayName("❌ Rejects a target that would overwrite the metadata document")
        void addAsset_RejectsMetadataCollision() {
            assertThatThrownBy(() -> workspace.addAsset(task(METADATA_FILE)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("metadata");
        }

        @Test
        @DisplayName("❌ Rejects duplicate targets")
        void addAsset_RejectsDuplicate() {
            workspace.addAsset(task("assets/a.png"));
            assertThatThrownBy(() -> workspace.addAsset(task("assets/a.png")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Duplicate");
        }

        @Test
        @DisplayName("❌ Rejects new assets once fetching has started")
        void addAsset_RejectsAfterFetchingStarted() {
            workspace.transitionTo(LifecycleState.PROVISIONED);
            workspace.transitionTo(LifecycleState.ASSETS_FETCHING);

            assertThatThrownBy(() -> workspace.addAsset(task("assets/late.png")))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("finalizeMetadata")
    class FinalizeMetadata {

        private ObjectNode document;

        @BeforeEach
        void setUp() {
            document = objectMapper.createObjectNode();
            document.put("id", "d1");
            document.putArray("materials").add("assets/a.png");
        }

        private void startFetching() {
            workspace.transitionTo(LifecycleState.PROVISIONED);
            workspace.transitionTo(LifecycleState.ASSETS_FETCHING);
        }

        @Test
        @DisplayName("✅ Writes the document once every asset is verified")
        void finalize_Success() throws IOException {
            AssetTask asset = task("assets/a.png");
            workspace.addAsset(asset);
            startFetching();
            asset.setStatus(AssetTask.Status.VERIFIED);

            workspace.finalizeMetadata(document);

            JsonNode written = objectMapper.readTree(workspace.metadataPath().toFile());
            assertThat(written).isEqualTo(document);
            assertThat(workspace.isMetadataFinalized()).isTrue();
            try (Stream<Path> files = Files.list(workspace.path())) {
                assertThat(files.map(p -> p.getFileName().toString())).noneMatch(name -> name.endsWith(".tmp"));
            }
        }

        @Test
        @DisplayName("❌ Refuses while an asset is still pending")
        void finalize_FailsWithPendingAsset() {
            AssetTask verified = task("assets/a.png");
            AssetTask pending = task("assets/b.png");
            workspace.addAsset(verified);
            workspace.addAsset(pending);
            startFetching();
            verified.setStatus(AssetTask.Status.VERIFIED);

            assertThatThrownBy(() -> workspace.finalizeMetadata(document))
                    .isInstanceOf(WorkspaceNotReadyException.class)
                    .hasMessageContaining("unverified");
            assertThat(Files.exists(workspace.metadataPath())).isFalse();
        }

        @Test
        @DisplayName("❌ Refuses a second write")
        void finalize_FailsWhenAlreadyFinalized() {
            startFetching();
            workspace.finalizeMetadata(document);

            assertThatThrownBy(() -> workspace.finalizeMetadata(document))
                    .isInstanceOf(WorkspaceNotReadyException.class)
                    .hasMessageContaining("already been finalized");
        }

        @Test
        @DisplayName("❌ Refuses outside the fetching stage")
        void finalize_FailsInWrongState() {
            assertThatThrownBy(() -> workspace.finalizeMetadata(document))
                    .isInstanceOf(WorkspaceNotReadyException.class)
                    .hasMessageContaining("CREATED");
        }
    }

    @Test
    @DisplayName("✅ seedEmptyMetadata keeps a document supplied by the template")
    void seedEmptyMetadata_KeepsExisting() throws IOException {
        Files.writeString(workspace.metadataPath(), "{\"from\":\"template\"}");

        workspace.seedEmptyMetadata();

        assertThat(Files.readString(workspace.metadataPath())).isEqualTo("{\"from\":\"template\"}");
    }

    @Test
    @DisplayName("✅ seedEmptyMetadata writes an empty object when absent")
    void seedEmptyMetadata_WritesEmptyObject() throws IOException {
        workspace.seedEmptyMetadata();

        assertThat(objectMapper.readTree(workspace.metadataPath().toFile()).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("❌ Illegal transitions throw IllegalStateException")
    void transitionTo_Illegal() {
        assertThatThrownBy(() -> workspace.transitionTo(LifecycleState.ARCHIVED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("CREATED -> ARCHIVED");
    }

    @Test
    @DisplayName("✅ fail records the reason and moves to FAILED")
    void fail_MovesToFailed() {
        workspace.transitionTo(LifecycleState.PROVISIONED);
        FailureReason reason = new FailureReason(LifecycleState.PROVISIONED, "ArchiveError", "boom", null, null);

        workspace.fail(reason);

        assertThat(workspace.getState()).isEqualTo(LifecycleState.FAILED);
        assertThat(workspace.getFailureReason()).isSameAs(reason);
        assertThat(reason.failedLocators()).isEmpty();
    }
}
