package com.flowcode.core.execution;

import com.flowcode.core.config.FlowcodeProperties;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Decides which command lines providers may run. Patterns ending in {@code *}
 * match by prefix, everything else must match exactly.
 */
@Service
public class CommandAllowlist {

    private static final List<String> SHELL_METACHARACTERS = List.of(";", "&&", "||", "|", "`", "$(", ">", "<");

    private final FlowcodeProperties properties;

    public CommandAllowlist(FlowcodeProperties properties) {
        this.properties = properties;
    }

    public boolean isCommandAllowed(String command) {
        if (command == null || command.isBlank()) {
            return false;
        }
        String trimmed = command.strip();
        for (String meta : SHELL_METACHARACTERS) {
            if (trimmed.contains(meta)) {
                return false;
            }
        }
        List<String> allowlist = properties.getWorkspace().getCommandAllowlist();
        if (allowlist == null || allowlist.isEmpty()) {
            return false;
        }
        for (String pattern : allowlist) {
            if (matches(pattern, trimmed)) {
                return true;
            }
        }
        return false;
    }

    private boolean matches(String pattern, String command) {
        if (pattern.endsWith("*")) {
            String prefix = pattern.substring(0, pattern.length() - 1);
            return command.startsWith(prefix) || command.equals(prefix.strip());
        }
        return pattern.equals(command);
    }
}
