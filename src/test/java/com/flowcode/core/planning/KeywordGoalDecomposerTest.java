package com.flowcode.core.planning;

import com.flowcode.core.model.ActionPayload;
import com.flowcode.core.model.AgentActionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class KeywordGoalDecomposerTest {

    private final KeywordGoalDecomposer decomposer = new KeywordGoalDecomposer();

    @Test
    @DisplayName("keywords match whole words only")
    void wholeWordMatching() {
        var analysis = decomposer.analyze("Review the address parser in src/address.ts");
        assertFalse(analysis.contains(AgentActionType.CREATE_FILE));
        assertEquals(AgentActionType.ANALYZE_CODE, analysis.actions().get(0).payload().type());
        assertEquals("src/address.ts", analysis.actions().get(0).target());
    }

    @Test
    @DisplayName("run tests becomes a test run instead of a command")
    void runTestsIsTestRun() {
        var analysis = decomposer.analyze("Run tests for the java project");
        assertTrue(analysis.contains(AgentActionType.RUN_TESTS));
        assertFalse(analysis.contains(AgentActionType.RUN_COMMAND));
        var tests = analysis.actions().stream()
                .filter(a -> a.payload().type() == AgentActionType.RUN_TESTS).findFirst().orElseThrow();
        assertEquals("mvn test", ((ActionPayload.RunTests) tests.payload()).command());
    }

    @Test
    @DisplayName("quoted command is run verbatim")
    void quotedCommand() {
        var analysis = decomposer.analyze("Run `npm run lint` on the code");
        var command = analysis.actions().stream()
                .filter(a -> a.payload().type() == AgentActionType.RUN_COMMAND).findFirst().orElseThrow();
        assertEquals("npm run lint", ((ActionPayload.RunCommand) command.payload()).command());
        assertTrue(analysis.risks().contains("Command execution requested"));
    }

    @Test
    @DisplayName("goal without keywords falls back to analysis")
    void fallbackToAnalysis() {
        var analysis = decomposer.analyze("Explain what this code does");
        assertEquals(1, analysis.actions().size());
        assertEquals(AgentActionType.ANALYZE_CODE, analysis.actions().get(0).payload().type());
        assertEquals(java.util.List.of("analyze"), analysis.categories());
    }

    @Test
    @DisplayName("scope follows the widest word in the goal")
    void scopeDetection() {
        assertEquals(GoalScope.FILE, decomposer.analyze("Fix the typo in README.md").scope());
        assertEquals(GoalScope.MODULE, decomposer.analyze("Update the billing module").scope());
        assertEquals(GoalScope.PROJECT, decomposer.analyze("Clean the project").scope());
        assertEquals(GoalScope.ARCHITECTURE, decomposer.analyze("Refactor the entire architecture").scope());
    }

    @Test
    @DisplayName("each category contributes at most one action")
    void oneActionPerCategory() {
        var analysis = decomposer.analyze("Create and add a new file");
        assertEquals(1, analysis.actions().size());
    }

    @Test
    @DisplayName("sensitive target is reported as a risk")
    void sensitiveTargetIsRisk() {
        var analysis = decomposer.analyze("Edit config/.env.local values in config/app.key");
        assertTrue(analysis.risks().stream().anyMatch(r -> r.startsWith("Sensitive file targeted")),
                analysis.risks().toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {".env", "config/.env", "certs/server.pem", "keys/private.key", "pom.xml"})
    @DisplayName("recognises sensitive paths")
    void sensitivePaths(String path) {
        assertTrue(KeywordGoalDecomposer.isSensitive(path));
    }

    @Test
    @DisplayName("ordinary source files are not sensitive")
    void ordinaryPaths() {
        assertFalse(KeywordGoalDecomposer.isSensitive("src/main.ts"));
    }
}
