package com.flowcode.core.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.io.Serializable;
import java.util.List;

/**
 * Kind-specific arguments of an {@link AgentAction}. One record per {@link AgentActionType};
 * the payload determines the action type, so adding a kind means adding a record here.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ActionPayload.AnalyzeCode.class, name = "analyze_code"),
        @JsonSubTypes.Type(value = ActionPayload.CreateFile.class, name = "create_file"),
        @JsonSubTypes.Type(value = ActionPayload.EditFile.class, name = "edit_file"),
        @JsonSubTypes.Type(value = ActionPayload.DeleteFile.class, name = "delete_file"),
        @JsonSubTypes.Type(value = ActionPayload.RunCommand.class, name = "run_command"),
        @JsonSubTypes.Type(value = ActionPayload.ValidateSecurity.class, name = "validate_security"),
        @JsonSubTypes.Type(value = ActionPayload.RunTests.class, name = "run_tests"),
        @JsonSubTypes.Type(value = ActionPayload.CommitChanges.class, name = "commit_changes"),
        @JsonSubTypes.Type(value = ActionPayload.CreateBranch.class, name = "create_branch"),
        @JsonSubTypes.Type(value = ActionPayload.RefactorCode.class, name = "refactor_code"),
        @JsonSubTypes.Type(value = ActionPayload.GenerateDocumentation.class, name = "generate_documentation"),
        @JsonSubTypes.Type(value = ActionPayload.AnalyzeDependencies.class, name = "analyze_dependencies"),
        @JsonSubTypes.Type(value = ActionPayload.OptimizePerformance.class, name = "optimize_performance")
})
public sealed interface ActionPayload extends Serializable {

    AgentActionType type();

    /** @param focusAreas aspects to report on, empty for a general overview */
    record AnalyzeCode(List<String> focusAreas) implements ActionPayload {
        public AnalyzeCode {
            focusAreas = focusAreas == null ? List.of() : List.copyOf(focusAreas);
        }

        @Override
        public AgentActionType type() {
            return AgentActionType.ANALYZE_CODE;
        }
    }

    record CreateFile(String content) implements ActionPayload {
        public CreateFile {
            content = content == null ? "" : content;
        }

        @Override
        public AgentActionType type() {
            return AgentActionType.CREATE_FILE;
        }
    }

    /**
     * Text replacement in the target file. A null {@code search} replaces the whole
     * content with {@code replacement}; both null means the edit has no instructions yet.
     */
    record EditFile(String search, String replacement) implements ActionPayload {
        @Override
        public AgentActionType type() {
            return AgentActionType.EDIT_FILE;
        }

        public boolean hasInstructions() {
            return replacement != null;
        }
    }

    /** @param pattern glob of files to delete below the target; blank deletes the target itself */
    record DeleteFile(String pattern) implements ActionPayload {
        public DeleteFile {
            pattern = pattern == null ? "" : pattern;
        }

        @Override
        public AgentActionType type() {
            return AgentActionType.DELETE_FILE;
        }
    }

    /**
     * @param command       the command line to run
     * @param mutating      whether the command changes workspace files
     * @param affectedPaths workspace-relative files to back up before a mutating command
     */
    record RunCommand(String command, boolean mutating, List<String> affectedPaths) implements ActionPayload {
        public RunCommand {
            affectedPaths = affectedPaths == null ? List.of() : List.copyOf(affectedPaths);
        }

        @Override
        public AgentActionType type() {
            return AgentActionType.RUN_COMMAND;
        }
    }

    /** @param scope "quality" or "security" */
    record ValidateSecurity(String scope) implements ActionPayload {
        @Override
        public AgentActionType type() {
            return AgentActionType.VALIDATE_SECURITY;
        }
    }

    record RunTests(String command) implements ActionPayload {
        @Override
        public AgentActionType type() {
            return AgentActionType.RUN_TESTS;
        }
    }

    record CommitChanges(String message) implements ActionPayload {
        @Override
        public AgentActionType type() {
            return AgentActionType.COMMIT_CHANGES;
        }
    }

    record CreateBranch(String branchName) implements ActionPayload {
        @Override
        public AgentActionType type() {
            return AgentActionType.CREATE_BRANCH;
        }
    }

    record RefactorCode(String technique) implements ActionPayload {
        @Override
        public AgentActionType type() {
            return AgentActionType.REFACTOR_CODE;
        }
    }

    record GenerateDocumentation(String format) implements ActionPayload {
        @Override
        public AgentActionType type() {
            return AgentActionType.GENERATE_DOCUMENTATION;
        }
    }

    record AnalyzeDependencies(String manifest) implements ActionPayload {
        @Override
        public AgentActionType type() {
            return AgentActionType.ANALYZE_DEPENDENCIES;
        }
    }

    record OptimizePerformance(String focus) implements ActionPayload {
        @Override
        public AgentActionType type() {
            return AgentActionType.OPTIMIZE_PERFORMANCE;
        }
    }
}
