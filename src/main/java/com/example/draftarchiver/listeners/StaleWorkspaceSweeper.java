package com.example.draftarchiver.listeners;

import com.example.draftarchiver.service.Archiver;
import com.example.draftarchiver.service.DraftArchiveRecordService;
import com.example.draftarchiver.service.TemplateProvisioner;
import com.example.draftarchiver.service.WorkspaceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Removes workspaces and archives left behind by a process that died mid-run,
 * and marks their records as failed.
 * <p>
 * Runs once while the context is being built, before the web server accepts requests,
 * so no run of this process can own a workspace yet.
 */
@Component
public class StaleWorkspaceSweeper {

    private static final Logger log = LoggerFactory.getLogger(StaleWorkspaceSweeper.class);
    static final String ABANDONED_REASON = "Run was abandoned by a previous process before it completed.";

    private final TemplateProvisioner provisioner;
    private final Archiver archiver;
    private final WorkspaceRegistry registry;
    private final DraftArchiveRecordService records;
    private final boolean enabled;
    private final Instant processStart;

    @Autowired
    public StaleWorkspaceSweeper(TemplateProvisioner provisioner,
                                 Archiver archiver,
                                 WorkspaceRegistry registry,
                                 DraftArchiveRecordService records,
                                 @Value("${draft.workspace.purge-on-startup:true}") boolean enabled) {
        this(provisioner, archiver, registry, records, enabled,
                Instant.ofEpochMilli(ManagementFactory.getRuntimeMXBean().getStartTime()));
    }

    StaleWorkspaceSweeper(TemplateProvisioner provisioner,
                          Archiver archiver,
                          WorkspaceRegistry registry,
                          DraftArchiveRecordService records,
                          boolean enabled,
                          Instant processStart) {
        this.provisioner = provisioner;
        this.archiver = archiver;
        this.registry = registry;
        this.records = records;
        this.enabled = enabled;
        this.processStart = processStart;
    }

    @PostConstruct
    private void initialize() {
        if (!enabled) {
            log.info("[Sweeper] Startup purge disabled");
            return;
        }
        int removed = sweep();
        int failed = records.failAbandonedRuns(ABANDONED_REASON, processStart);
        log.info("[Sweeper] Removed {} stale entr(ies), marked {} abandoned record(s) as FAILED", removed, failed);
    }

    /**
     * Deletes every entry under the workspace and archive roots that does not belong to an active run.
     * Activity is checked per entry, right before it is removed.
     *
     * @return The number of entries removed.
     */
    public int sweep() {
        return purgeChildren(provisioner.workspaceRoot()) + purgeChildren(archiver.archiveRoot());
    }

    private int purgeChildren(Path root) {
        if (!Files.isDirectory(root)) {
            return 0;
        }
        int removed = 0;
        try (DirectoryStream<Path> children = Files.newDirectoryStream(root)) {
            for (Path child : children) {
                if (registry.isActive(draftIdOf(child))) {
                    continue;
                }
                try {
                    if (FileSystemUtils.deleteRecursively(child)) {
                        removed++;
                        log.warn("[Sweeper] Removed stale entry {}", child);
                    }
                } catch (IOException e) {
                    log.error("[Sweeper] Failed to remove stale entry {}", child, e);
                }
            }
        } catch (IOException e) {
            log.error("[Sweeper] Could not list {}", root, e);
        }
        return removed;
    }

    // "<id>", "<id>.zip" and "<id>.zip.tmp" all belong to draft <id>
    private static String draftIdOf(Path child) {
        String name = child.getFileName().toString();
        int zip = name.indexOf(".zip");
        return zip > 0 ? name.substring(0, zip) : name;
    }
}
