package com.flowcode.core.execution;

import com.flowcode.core.config.FlowcodeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandAllowlistTest {

    private FlowcodeProperties properties;
    private CommandAllowlist allowlist;

    @BeforeEach
    void setUp() {
        properties = new FlowcodeProperties();
        allowlist = new CommandAllowlist(properties);
    }

    @Nested
    @DisplayName("default allowlist")
    class Defaults {

        @ParameterizedTest
        @ValueSource(strings = {"npm test", "npm test -- --watch=false", "npm run build", "mvn -B test", "git status"})
        @DisplayName("allows common build and test commands")
        void allowsBuildCommands(String command) {
            assertTrue(allowlist.isCommandAllowed(command));
        }

        @ParameterizedTest
        @ValueSource(strings = {"rm -rf /", "curl http://example.com", "npm install left-pad"})
        @DisplayName("denies commands outside the list")
        void deniesOthers(String command) {
            assertFalse(allowlist.isCommandAllowed(command));
        }

        @ParameterizedTest
        @ValueSource(strings = {"npm test; rm -rf /", "npm test && curl x", "npm run build | tee out",
                "echo `whoami`", "echo $(id)", "ls > out.txt"})
        @DisplayName("denies shell metacharacters even behind an allowed prefix")
        void deniesMetacharacters(String command) {
            assertFalse(allowlist.isCommandAllowed(command));
        }

        @Test
        @DisplayName("denies blank commands")
        void deniesBlank() {
            assertFalse(allowlist.isCommandAllowed(null));
            assertFalse(allowlist.isCommandAllowed("   "));
        }
    }

    @Test
    @DisplayName("patterns without a wildcard match exactly")
    void exactMatch() {
        properties.getWorkspace().setCommandAllowlist(List.of("make check"));
        assertTrue(allowlist.isCommandAllowed("make check"));
        assertFalse(allowlist.isCommandAllowed("make check-all"));
    }

    @Test
    @DisplayName("a bare prefix pattern matches the command without arguments")
    void prefixWithoutArguments() {
        properties.getWorkspace().setCommandAllowlist(List.of("mvn *"));
        assertTrue(allowlist.isCommandAllowed("mvn"));
    }

    @Test
    @DisplayName("empty allowlist denies everything")
    void emptyAllowlist() {
        properties.getWorkspace().setCommandAllowlist(List.of());
        assertFalse(allowlist.isCommandAllowed("npm test"));
    }
}
