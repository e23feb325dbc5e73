package com.example.draftarchiver.service.impl;

import com.example.draftarchiver.domain.ArchiveArtifact;
import com.example.draftarchiver.domain.DraftWorkspace;
import com.example.draftarchiver.domain.LifecycleState;
import com.example.draftarchiver.exceptions.ArchiveException;
import com.example.draftarchiver.exceptions.WorkspaceNotReadyException;
import com.example.draftarchiver.service.Archiver;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

@Service
public class ZipArchiver implements Archiver {

    private static final Logger log = LoggerFactory.getLogger(ZipArchiver.class);
    private static final String ARCHIVE_EXTENSION = ".zip";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path archiveRoot;

    public ZipArchiver(@Value("${draft.archive.path}") String archivePath) {
        if (archivePath == null || archivePath.isBlank()) {
            throw new IllegalArgumentException("Archive path cannot be blank in configuration.");
        }
        try {
            this.archiveRoot = Paths.get(archivePath).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid path format configured for archives: " + archivePath, e);
        }
    }

    @PostConstruct
    private void initialize() {
        try {
            Files.createDirectories(archiveRoot);
            log.info("Draft archive directory initialized at: {}", archiveRoot);
        } catch (IOException e) {
            throw new ArchiveException("Could not initialize archive directory: " + archiveRoot, e);
        }
    }

    @Override
    public ArchiveArtifact archive(DraftWorkspace workspace) {
        String draftId = workspace.getDraftId();
        if (workspace.getState() != LifecycleState.METADATA_FINALIZED || !workspace.isMetadataFinalized()) {
            throw new WorkspaceNotReadyException("Workspace " + draftId + " cannot be archived in state " + workspace.getState());
        }

        Path artifact = artifactPathFor(draftId);
        Path temp = tempPathFor(draftId);
        Path source = workspace.path();

        try {
            List<Path> entries = collectEntries(source);
            try (OutputStream out = Files.newOutputStream(temp);
                 ZipOutputStream zip = new ZipOutputStream(out)) {
                for (Path entry : entries) {
                    writeEntry(zip, source, entry);
                }
            }
            moveIntoPlace(temp, artifact);
            long size = Files.size(artifact);
            log.info("[Archive][draft:{}] Wrote {} entries ({} bytes) to {}", draftId, entries.size(), size, artifact);
            return new ArchiveArtifact(draftId, artifact, size);
        } catch (IOException e) {
            deleteQuietly(temp, draftId);
            throw new ArchiveException("Failed to archive workspace for draft " + draftId, e);
        }
    }

    @Override
    public Path artifactPathFor(String draftId) {
        Path artifact = archiveRoot.resolve(draftId + ARCHIVE_EXTENSION).normalize();
        if (!artifact.getParent().equals(archiveRoot)) {
            throw new IllegalArgumentException("Draft ID does not map to a file directly under the archive root: " + draftId);
        }
        return artifact;
    }

    @Override
    public boolean discard(String draftId) {
        boolean deleted = false;
        for (Path file : List.of(tempPathFor(draftId), artifactPathFor(draftId))) {
            try {
                deleted |= Files.deleteIfExists(file);
            } catch (IOException e) {
                log.error("[Archive][draft:{}] Failed to delete archive file {}", draftId, file, e);
            }
        }
        if (deleted) {
            log.debug("[Archive][draft:{}] Discarded archive artifacts", draftId);
        }
        return deleted;
    }

    @Override
    public Path archiveRoot() {
        return archiveRoot;
    }

    private Path tempPathFor(String draftId) {
        Path artifact = artifactPathFor(draftId);
        return artifact.resolveSibling(artifact.getFileName() + TEMP_SUFFIX);
    }

    private List<Path> collectEntries(Path source) throws IOException {
        try (Stream<Path> walk = Files.walk(source)) {
            return walk.filter(path -> !path.equals(source))
                    .sorted(Comparator.comparing(path -> entryName(source, path)))
                    .collect(Collectors.toCollection(ArrayList::new));
        }
    }

    private void writeEntry(ZipOutputStream zip, Path source, Path path) throws IOException {
        boolean directory = Files.isDirectory(path);
        String name = entryName(source, path) + (directory ? "/" : "");
        ZipEntry entry = new ZipEntry(name);
        FileTime modified = Files.getLastModifiedTime(path);
        entry.setLastModifiedTime(modified);
        zip.putNextEntry(entry);
        if (!directory) {
            Files.copy(path, zip);
        }
        zip.closeEntry();
    }

    // Entry names use forward slashes regardless of platform
    private static String entryName(Path source, Path path) {
        return source.relativize(path).toString().replace('\\', '/');
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path file, String draftId) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.error("[Archive][draft:{}] Failed to delete temporary archive {}", draftId, file, e);
        }
    }
}
