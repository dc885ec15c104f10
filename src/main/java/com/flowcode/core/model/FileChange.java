package com.flowcode.core.model;

import java.io.Serializable;

/**
 * A file-level side effect of a step.
 *
 * @param path       workspace-relative path
 * @param type       create, modify or delete
 * @param content    new content (null for deletes)
 * @param diff       line diff against the previous content
 * @param backup     previous content, null when the file did not exist
 * @param rolledBack whether the change was reverted from its backup
 */
public record FileChange(
    String path,
    ChangeType type,
    String content,
    String diff,
    String backup,
    boolean rolledBack
) implements Serializable {

    public FileChange withBackup(String backup) {
        return new FileChange(path, type, content, diff, backup, rolledBack);
    }

    public FileChange markRolledBack() {
        return new FileChange(path, type, content, diff, backup, true);
    }
}
