package com.flowcode.core.execution;

import com.flowcode.core.model.AgentAction;
import com.flowcode.core.model.ExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Snapshots files before destructive actions and restores them on rollback.
 */
@Component
public class BackupManager {

    private static final Logger log = LoggerFactory.getLogger(BackupManager.class);

    /**
     * Prior state of one file.
     *
     * @param relativePath workspace-relative path
     * @param existed      false when the file did not exist before the action
     * @param content      raw bytes, null when the file did not exist
     */
    public record FileBackup(String relativePath, boolean existed, byte[] content) {

        public String contentAsText() {
            return content == null ? null : new String(content, StandardCharsets.UTF_8);
        }
    }

    public List<FileBackup> snapshot(AgentAction action, ExecutionContext context) {
        if (!action.type().isFileMutating() && !action.type().isMutating()) {
            return List.of();
        }
        var backups = new ArrayList<FileBackup>();
        for (Path file : WorkspacePaths.affectedFiles(action, context)) {
            String relative = WorkspacePaths.relativize(context.workspaceRoot(), file);
            try {
                if (Files.isRegularFile(file)) {
                    backups.add(new FileBackup(relative, true, Files.readAllBytes(file)));
                } else if (!Files.exists(file)) {
                    backups.add(new FileBackup(relative, false, null));
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to back up " + relative, e);
            }
        }
        log.debug("Backed up {} file(s) before {}", backups.size(), action.id());
        return backups;
    }

    /**
     * Restores every backup; files that did not exist are removed again.
     *
     * @return paths that were restored
     */
    public List<String> restore(List<FileBackup> backups, Path workspaceRoot) {
        var restored = new ArrayList<String>();
        for (FileBackup backup : backups) {
            Path file = WorkspacePaths.resolve(workspaceRoot, backup.relativePath());
            try {
                if (backup.existed()) {
                    if (file.getParent() != null) {
                        Files.createDirectories(file.getParent());
                    }
                    Files.write(file, backup.content());
                } else {
                    Files.deleteIfExists(file);
                }
                restored.add(backup.relativePath());
            } catch (IOException e) {
                log.error("Failed to restore {} from backup: {}", backup.relativePath(), e.getMessage(), e);
            }
        }
        if (!restored.isEmpty()) {
            log.info("Restored {} file(s) from backup", restored.size());
        }
        return restored;
    }
}
