package com.example.draftarchiver.service.impl;

import com.example.draftarchiver.domain.DraftWorkspace;
import com.example.draftarchiver.exceptions.ProvisionIOException;
import com.example.draftarchiver.exceptions.TemplateNotFoundException;
import com.example.draftarchiver.exceptions.WorkspaceAlreadyExistsException;
import com.example.draftarchiver.service.TemplateProvisioner;
import com.example.draftarchiver.service.TemplateStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;

@Service
public class FilesystemTemplateProvisioner implements TemplateProvisioner {

    private static final Logger log = LoggerFactory.getLogger(FilesystemTemplateProvisioner.class);

    private final TemplateStore templateStore;
    private final ObjectMapper objectMapper;
    private final Path workspaceRoot;
    private final String metadataFileName;

    @Autowired
    public FilesystemTemplateProvisioner(TemplateStore templateStore,
                                         ObjectMapper objectMapper,
                                         @Value("${draft.workspace.root}") String workspaceRoot,
                                         @Value("${draft.metadata.filename:draft_content.json}") String metadataFileName) {
        this.templateStore = templateStore;
        this.objectMapper = objectMapper;
        this.workspaceRoot = validateRootPath(workspaceRoot);
        if (metadataFileName == null || metadataFileName.isBlank()
                || metadataFileName.contains("/") || metadataFileName.contains("\\")) {
            throw new IllegalArgumentException("Invalid draft metadata file name in configuration: " + metadataFileName);
        }
        this.metadataFileName = metadataFileName;
    }

    @PostConstruct
    private void initialize() {
        try {
            Files.createDirectories(workspaceRoot);
            log.info("Draft workspace root initialized at: {}", workspaceRoot);
        } catch (IOException e) {
            throw new ProvisionIOException("Could not initialize workspace root: " + workspaceRoot, e);
        }
    }

    @Override
    public DraftWorkspace provision(String templateName, String draftId) {
        Path template = templateStore.resolve(templateName)
                .orElseThrow(() -> {
                    log.warn("[Provision][draft:{}] Template '{}' not found", draftId, templateName);
                    return new TemplateNotFoundException(templateName);
                });

        Path target = workspaceRoot.resolve(draftId).normalize();
        if (!target.getParent().equals(workspaceRoot)) {
            throw new IllegalArgumentException("Draft ID does not map to a directory directly under the workspace root: " + draftId);
        }

        try {
            // createDirectory is atomic: exactly one caller can create the workspace directory
            Files.createDirectory(target);
        } catch (FileAlreadyExistsException e) {
            throw new WorkspaceAlreadyExistsException(draftId, "Workspace directory already exists for draft " + draftId + ": " + target);
        } catch (IOException e) {
            throw new ProvisionIOException("Could not create workspace directory for draft " + draftId, e);
        }

        DraftWorkspace workspace = new DraftWorkspace(draftId, target, metadataFileName, objectMapper);
        try {
            copyTree(template, target);
            workspace.seedEmptyMetadata();
            log.info("[Provision][draft:{}] Workspace provisioned from template '{}' at {}", draftId, templateName, target);
            return workspace;
        } catch (IOException | RuntimeException e) {
            removePartialWorkspace(target, draftId);
            throw new ProvisionIOException("Failed to provision workspace for draft " + draftId + " from template " + templateName, e);
        }
    }

    @Override
    public Path workspaceRoot() {
        return workspaceRoot;
    }

    private void copyTree(Path source, Path target) throws IOException {
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Files.createDirectories(target.resolve(source.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.copy(file, target.resolve(source.relativize(file).toString()), StandardCopyOption.COPY_ATTRIBUTES);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void removePartialWorkspace(Path target, String draftId) {
        try {
            FileSystemUtils.deleteRecursively(target);
            log.debug("[Provision][draft:{}] Removed partially provisioned workspace {}", draftId, target);
        } catch (IOException ioEx) {
            log.error("[Provision][draft:{}] Failed to remove partially provisioned workspace {}", draftId, target, ioEx);
        }
    }

    private Path validateRootPath(String pathString) {
        if (pathString == null || pathString.isBlank()) {
            throw new IllegalArgumentException("Workspace root path cannot be blank in configuration.");
        }
        if (pathString.contains("..")) {
            throw new IllegalArgumentException("Workspace root path configuration contains traversal patterns ('..'): " + pathString);
        }
        try {
            return Paths.get(pathString).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid path format configured for workspace root: " + pathString, e);
        }
    }
}
