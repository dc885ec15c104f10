package com.flowcode.core.planning;

import com.flowcode.core.model.ActionPayload;
import com.flowcode.core.model.AgentActionType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default {@link GoalDecomposer}: matches goal wording against keyword strategies.
 * <p>
 * Matching is case-insensitive on word boundaries so that "add" does not fire on
 * "address". Strategies are evaluated in declaration order and each category
 * contributes at most one action.
 */
@Component
public class KeywordGoalDecomposer implements GoalDecomposer {

    private record Strategy(String category, AgentActionType type, List<String> keywords) {}

    private static final List<Strategy> STRATEGIES = List.of(
            new Strategy("branch", AgentActionType.CREATE_BRANCH, List.of("branch")),
            new Strategy("dependencies", AgentActionType.ANALYZE_DEPENDENCIES,
                    List.of("dependency", "dependencies", "packages outdated", "upgrade")),
            new Strategy("create", AgentActionType.CREATE_FILE,
                    List.of("create", "add", "new", "generate", "scaffold")),
            new Strategy("modify", AgentActionType.EDIT_FILE,
                    List.of("edit", "modify", "update", "change", "fix", "rename")),
            new Strategy("delete", AgentActionType.DELETE_FILE,
                    List.of("delete", "remove", "clean", "cleanup", "purge")),
            new Strategy("refactor", AgentActionType.REFACTOR_CODE,
                    List.of("refactor", "restructure", "simplify")),
            new Strategy("optimize", AgentActionType.OPTIMIZE_PERFORMANCE,
                    List.of("optimize", "optimise", "performance", "speed up", "faster")),
            new Strategy("command", AgentActionType.RUN_COMMAND,
                    List.of("run", "execute", "build", "install")),
            new Strategy("test", AgentActionType.RUN_TESTS, List.of("test", "tests", "spec", "specs")),
            new Strategy("audit", AgentActionType.VALIDATE_SECURITY,
                    List.of("security", "audit", "vulnerability", "vulnerabilities", "secure")),
            new Strategy("document", AgentActionType.GENERATE_DOCUMENTATION,
                    List.of("document", "documentation", "docs", "readme", "javadoc", "jsdoc")),
            new Strategy("commit", AgentActionType.COMMIT_CHANGES, List.of("commit"))
    );

    private static final List<String> ARCHITECTURE_WORDS = List.of("architecture", "restructure", "entire", "whole codebase");
    private static final List<String> MODULE_WORDS = List.of("module", "package", "component", "service");
    private static final List<String> PROJECT_WORDS = List.of("project", "app", "application", "repository", "repo");

    private static final Pattern FILE_TOKEN = Pattern.compile("([\\w./-]+\\.[A-Za-z]{1,6})\\b");
    private static final Pattern QUOTED = Pattern.compile("[\"'`]([^\"'`]+)[\"'`]");

    private static final Set<String> SENSITIVE_NAMES = Set.of(
            ".env", "credentials", "secrets", "id_rsa", "package.json", "pom.xml", "build.gradle");

    @Override
    public GoalAnalysis analyze(String goal) {
        String lower = goal.toLowerCase(Locale.ROOT);
        GoalScope scope = detectScope(lower);
        String language = detectLanguage(lower);
        String fileToken = findFileToken(goal);

        var categories = new LinkedHashSet<String>();
        var actions = new ArrayList<GoalAnalysis.PlannedAction>();
        var risks = new ArrayList<String>();

        for (Strategy strategy : STRATEGIES) {
            if (!matchesAny(lower, strategy.keywords())) {
                continue;
            }
            // "run tests" is a test request, not an arbitrary command
            if (strategy.type() == AgentActionType.RUN_COMMAND
                    && matchesAny(lower, List.of("test", "tests")) && !containsQuoted(goal)) {
                continue;
            }
            categories.add(strategy.category());
            actions.add(plan(strategy, goal, lower, language, fileToken));
            switch (strategy.type()) {
                case DELETE_FILE -> risks.add("File deletion requested");
                case RUN_COMMAND -> risks.add("Command execution requested");
                case COMMIT_CHANGES -> risks.add("Changes will be committed to version control");
                default -> { }
            }
        }

        if (actions.isEmpty() && !goal.isBlank()) {
            categories.add("analyze");
            actions.add(new GoalAnalysis.PlannedAction("Analyze code for: " + goal,
                    fileToken != null ? fileToken : ".", new ActionPayload.AnalyzeCode(List.of())));
        }

        if (scope == GoalScope.ARCHITECTURE) {
            risks.add("Architecture-wide changes requested");
        }
        if (fileToken != null && isSensitive(fileToken)) {
            risks.add("Sensitive file targeted: " + fileToken);
        }

        return new GoalAnalysis(goal, scope, List.copyOf(categories), actions, risks);
    }

    static boolean isSensitive(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        for (String name : SENSITIVE_NAMES) {
            if (lower.endsWith(name) || lower.contains("/" + name)) {
                return true;
            }
        }
        return lower.endsWith(".pem") || lower.endsWith(".key");
    }

    private GoalAnalysis.PlannedAction plan(Strategy strategy, String goal, String lower,
                                            String language, String fileToken) {
        return switch (strategy.type()) {
            case CREATE_BRANCH -> new GoalAnalysis.PlannedAction("Create working branch",
                    branchName(goal), new ActionPayload.CreateBranch(branchName(goal)));
            case ANALYZE_DEPENDENCIES -> new GoalAnalysis.PlannedAction("Analyze project dependencies",
                    manifestFor(language), new ActionPayload.AnalyzeDependencies(manifestFor(language)));
            case CREATE_FILE -> {
                String target = fileToken != null ? fileToken : defaultNewFile(language);
                yield new GoalAnalysis.PlannedAction("Create " + target, target,
                        new ActionPayload.CreateFile(skeletonFor(language, lower)));
            }
            case EDIT_FILE -> {
                String target = fileToken != null ? fileToken : ".";
                yield new GoalAnalysis.PlannedAction("Apply requested changes to " + target, target,
                        new ActionPayload.EditFile(null, null));
            }
            case DELETE_FILE -> {
                if (fileToken != null) {
                    yield new GoalAnalysis.PlannedAction("Delete " + fileToken, fileToken,
                            new ActionPayload.DeleteFile(""));
                }
                String pattern = lower.contains("temp") || lower.contains("clean")
                        ? "**/*.{tmp,temp,bak,swp}" : "**/*.tmp";
                yield new GoalAnalysis.PlannedAction("Delete files matching " + pattern, ".",
                        new ActionPayload.DeleteFile(pattern));
            }
            case REFACTOR_CODE -> new GoalAnalysis.PlannedAction("Refactor " + orWorkspace(fileToken),
                    orWorkspace(fileToken), new ActionPayload.RefactorCode(lower.contains("extract")
                    ? "extract" : "general"));
            case OPTIMIZE_PERFORMANCE -> new GoalAnalysis.PlannedAction(
                    "Identify performance improvements in " + orWorkspace(fileToken),
                    orWorkspace(fileToken), new ActionPayload.OptimizePerformance("runtime"));
            case RUN_COMMAND -> {
                String command = commandFor(goal, lower, language);
                yield new GoalAnalysis.PlannedAction("Run `" + command + "`", command,
                        new ActionPayload.RunCommand(command, lower.contains("install"), List.of()));
            }
            case RUN_TESTS -> {
                String command = testCommandFor(language);
                yield new GoalAnalysis.PlannedAction("Run the test suite", command,
                        new ActionPayload.RunTests(command));
            }
            case VALIDATE_SECURITY -> new GoalAnalysis.PlannedAction("Audit " + orWorkspace(fileToken)
                    + " for security issues", orWorkspace(fileToken), new ActionPayload.ValidateSecurity("security"));
            case GENERATE_DOCUMENTATION -> new GoalAnalysis.PlannedAction("Generate documentation for "
                    + orWorkspace(fileToken), orWorkspace(fileToken), new ActionPayload.GenerateDocumentation("markdown"));
            case COMMIT_CHANGES -> new GoalAnalysis.PlannedAction("Commit changes", ".",
                    new ActionPayload.CommitChanges(commitMessage(goal)));
            case ANALYZE_CODE -> new GoalAnalysis.PlannedAction("Analyze " + orWorkspace(fileToken),
                    orWorkspace(fileToken), new ActionPayload.AnalyzeCode(List.of()));
        };
    }

    private static GoalScope detectScope(String lower) {
        if (matchesAny(lower, ARCHITECTURE_WORDS) || lower.contains("refactor entire")) {
            return GoalScope.ARCHITECTURE;
        }
        if (matchesAny(lower, MODULE_WORDS)) {
            return GoalScope.MODULE;
        }
        if (matchesAny(lower, PROJECT_WORDS)) {
            return GoalScope.PROJECT;
        }
        return GoalScope.FILE;
    }

    private static String detectLanguage(String lower) {
        if (matchesAny(lower, List.of("typescript", "ts", "tsx"))) return "typescript";
        if (matchesAny(lower, List.of("javascript", "js", "node"))) return "javascript";
        if (matchesAny(lower, List.of("java", "spring"))) return "java";
        if (matchesAny(lower, List.of("python", "py"))) return "python";
        return "text";
    }

    private static String defaultNewFile(String language) {
        return switch (language) {
            case "typescript" -> "src/newModule.ts";
            case "javascript" -> "src/newModule.js";
            case "java" -> "src/main/java/NewModule.java";
            case "python" -> "new_module.py";
            default -> "NEW_FILE.md";
        };
    }

    private static String skeletonFor(String language, String lower) {
        boolean function = lower.contains("function");
        return switch (language) {
            case "typescript" -> function
                    ? "export function example(input: string): string {\n    return input;\n}\n"
                    : "export {};\n";
            case "javascript" -> function
                    ? "export function example(input) {\n    return input;\n}\n"
                    : "export {};\n";
            case "java" -> "public class NewModule {\n}\n";
            case "python" -> function ? "def example(value):\n    return value\n" : "";
            default -> "# New file\n";
        };
    }

    private static String manifestFor(String language) {
        return switch (language) {
            case "java" -> "pom.xml";
            case "python" -> "requirements.txt";
            default -> "package.json";
        };
    }

    private static String testCommandFor(String language) {
        return switch (language) {
            case "java" -> "mvn test";
            case "python" -> "pytest";
            default -> "npm test";
        };
    }

    private static String commandFor(String goal, String lower, String language) {
        Matcher quoted = QUOTED.matcher(goal);
        if (quoted.find()) {
            return quoted.group(1).trim();
        }
        if (lower.contains("install")) {
            return "java".equals(language) ? "mvn install" : "npm install";
        }
        return "java".equals(language) ? "mvn package" : "npm run build";
    }

    private static String branchName(String goal) {
        String slug = goal.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-|-$)", "");
        if (slug.length() > 40) {
            slug = slug.substring(0, 40).replaceAll("-$", "");
        }
        return "flowcode/" + slug;
    }

    private static String commitMessage(String goal) {
        String trimmed = goal.strip();
        return trimmed.length() > 72 ? trimmed.substring(0, 69) + "..." : trimmed;
    }

    private static String findFileToken(String goal) {
        Matcher m = FILE_TOKEN.matcher(goal);
        while (m.find()) {
            String token = m.group(1);
            // skip sentence punctuation such as "e.g" and version numbers
            if (!token.matches("\\d+(\\.\\d+)+") && !token.endsWith(".")) {
                return token;
            }
        }
        return null;
    }

    private static boolean containsQuoted(String goal) {
        return QUOTED.matcher(goal).find();
    }

    private static String orWorkspace(String fileToken) {
        return fileToken != null ? fileToken : ".";
    }

    /**
     * True when any keyword occurs as a whole word or phrase in {@code lower}.
     */
    static boolean matchesAny(String lower, List<String> keywords) {
        for (String keyword : keywords) {
            if (Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b").matcher(lower).find()) {
                return true;
            }
        }
        return false;
    }
}
