package com.example.draftarchiver.service;

import com.example.draftarchiver.domain.ArchiveArtifact;
import com.example.draftarchiver.domain.DraftWorkspace;
import com.example.draftarchiver.domain.LifecycleState;
import com.example.draftarchiver.exceptions.WorkspaceNotReadyException;
import com.example.draftarchiver.service.impl.ZipArchiver;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ZipArchiver Tests")
class ZipArchiverTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ZipArchiver archiver;
    private Path archiveRoot;
    private Path workspaceDir;

    @BeforeEach
    void setUp() throws IOException {
        archiveRoot = tempDir.resolve("archives");
        archiver = new ZipArchiver(archiveRoot.toString());
        ReflectionTestUtils.invokeMethod(archiver, "initialize");

        workspaceDir = Files.createDirectories(tempDir.resolve("drafts/d1"));
        Files.createDirectories(workspaceDir.resolve("assets/image"));
        Files.writeString(workspaceDir.resolve("assets/image/b.png"), "bbb");
        Files.writeString(workspaceDir.resolve("draft_meta_info.json"), "{}");
        Files.createDirectories(workspaceDir.resolve("assets/audio"));
        Files.writeString(workspaceDir.resolve("assets/audio/a.mp3"), "aaa");
        FileTime fixed = FileTime.from(Instant.parse("2024-01-01T00:00:00Z"));
        try (var walk = Files.walk(workspaceDir)) {
            for (Path path : walk.toList()) {
                Files.setLastModifiedTime(path, fixed);
            }
        }
    }

    private DraftWorkspace finalizedWorkspace() {
        DraftWorkspace workspace = new DraftWorkspace("d1", workspaceDir, "draft_content.json", objectMapper);
        workspace.transitionTo(LifecycleState.PROVISIONED);
        workspace.transitionTo(LifecycleState.ASSETS_FETCHING);
        workspace.finalizeMetadata(objectMapper.createObjectNode().put("id", "d1"));
        workspace.transitionTo(LifecycleState.METADATA_FINALIZED);
        return workspace;
    }

    private static List<String> entryNames(Path zip) throws IOException {
        List<String> names = new ArrayList<>();
        try (InputStream in = Files.newInputStream(zip); ZipInputStream zis = new ZipInputStream(in)) {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                names.add(entry.getName());
            }
        }
        return names;
    }

    @Test
    @DisplayName("✅ archive: Zips the tree without a top folder in sorted order")
    void archive_Success() throws IOException {
        ArchiveArtifact artifact = archiver.archive(finalizedWorkspace());

        assertThat(artifact.path()).isEqualTo(archiver.artifactPathFor("d1"));
        assertThat(artifact.sizeBytes()).isEqualTo(Files.size(artifact.path()));
        assertThat(entryNames(artifact.path())).containsExactly(
                "assets/",
                "assets/audio/",
                "assets/audio/a.mp3",
                "assets/image/",
                "assets/image/b.png",
                "draft_content.json",
                "draft_meta_info.json");
    }

    @Test
    @DisplayName("✅ archive: Entries carry the file contents")
    void archive_PreservesContents() throws IOException {
        ArchiveArtifact artifact = archiver.archive(finalizedWorkspace());

        try (InputStream in = Files.newInputStream(artifact.path()); ZipInputStream zis = new ZipInputStream(in)) {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                if (entry.getName().equals("assets/image/b.png")) {
                    assertThat(new String(zis.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("bbb");
                    return;
                }
            }
        }
        fail("assets/image/b.png missing from archive");
    }

    @Test
    @DisplayName("✅ archive: Re-running over the same tree replaces the artifact with identical bytes")
    void archive_RerunIsIdentical() throws IOException {
        DraftWorkspace workspace = finalizedWorkspace();
        Files.setLastModifiedTime(workspace.metadataPath(), FileTime.from(Instant.parse("2024-01-01T00:00:00Z")));

        byte[] first = Files.readAllBytes(archiver.archive(workspace).path());
        byte[] second = Files.readAllBytes(archiver.archive(workspace).path());

        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("✅ archive: Replaces a stale artifact from an earlier attempt")
    void archive_ReplacesStaleArtifact() throws IOException {
        Files.writeString(archiver.artifactPathFor("d1"), "stale");

        ArchiveArtifact artifact = archiver.archive(finalizedWorkspace());

        assertThat(entryNames(artifact.path())).contains("draft_content.json");
        assertThat(Files.exists(archiveRoot.resolve("d1.zip.tmp"))).isFalse();
    }

    @Test
    @DisplayName("❌ archive: Refuses a workspace whose metadata is not finalized")
    void archive_NotReady() {
        DraftWorkspace workspace = new DraftWorkspace("d1", workspaceDir, "draft_content.json", objectMapper);
        workspace.transitionTo(LifecycleState.PROVISIONED);

        assertThatThrownBy(() -> archiver.archive(workspace))
                .isInstanceOf(WorkspaceNotReadyException.class)
                .hasMessageContaining("PROVISIONED");
        assertThat(Files.exists(archiver.artifactPathFor("d1"))).isFalse();
    }

    @Test
    @DisplayName("✅ discard: Removes the artifact and its temporary file")
    void discard_RemovesFiles() throws IOException {
        archiver.archive(finalizedWorkspace());
        Files.writeString(archiveRoot.resolve("d1.zip.tmp"), "partial");

        assertThat(archiver.discard("d1")).isTrue();

        assertThat(Files.exists(archiver.artifactPathFor("d1"))).isFalse();
        assertThat(Files.exists(archiveRoot.resolve("d1.zip.tmp"))).isFalse();
        assertThat(archiver.discard("d1")).isFalse();
    }

    @Test
    @DisplayName("❌ artifactPathFor: Rejects IDs that leave the archive root")
    void artifactPathFor_RejectsTraversal() {
        assertThatThrownBy(() -> archiver.artifactPathFor("../d1"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
