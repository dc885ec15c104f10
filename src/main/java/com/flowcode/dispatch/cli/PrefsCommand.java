package com.flowcode.dispatch.cli;

import com.flowcode.core.state.StateStore;
import com.flowcode.core.state.UserPreferences;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Map;
import java.util.TreeMap;

/**
 * CLI command: flowcode prefs [--set key=value ...]
 */
@Command(name = "prefs", mixinStandardHelpOptions = true, description = "Show or change user preferences")
@Component
public class PrefsCommand implements Runnable {

    @Option(names = {"--set", "-s"}, description = "Preference to change, e.g. --set autoApprovalLevel=low")
    private Map<String, String> updates;

    private final StateStore stateStore;

    public PrefsCommand(StateStore stateStore) {
        this.stateStore = stateStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        UserPreferences preferences;
        if (updates != null && !updates.isEmpty()) {
            try {
                preferences = stateStore.updateUserPreferences(updates);
            } catch (IllegalArgumentException e) {
                ConsoleOutput.error(e.getMessage());
                return;
            }
            ConsoleOutput.success("Updated " + String.join(", ", updates.keySet()));
        } else {
            preferences = stateStore.getUserPreferences();
        }
        new TreeMap<>(preferences.values()).forEach((k, v) -> System.out.printf("  %-20s %s%n", k, v));
    }
}
