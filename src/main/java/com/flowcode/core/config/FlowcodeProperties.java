package com.flowcode.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runtime configuration bound from {@code flowcode.*}.
 */
@Component
@ConfigurationProperties(prefix = "flowcode")
public class FlowcodeProperties {

    private State state = new State();
    private Executor executor = new Executor();
    private Orchestrator orchestrator = new Orchestrator();
    private Oversight oversight = new Oversight();
    private Workspace workspace = new Workspace();

    public State getState() {
        return state;
    }

    public void setState(State state) {
        this.state = state;
    }

    public Executor getExecutor() {
        return executor;
    }

    public void setExecutor(Executor executor) {
        this.executor = executor;
    }

    public Orchestrator getOrchestrator() {
        return orchestrator;
    }

    public void setOrchestrator(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    public Oversight getOversight() {
        return oversight;
    }

    public void setOversight(Oversight oversight) {
        this.oversight = oversight;
    }

    public Workspace getWorkspace() {
        return workspace;
    }

    public void setWorkspace(Workspace workspace) {
        this.workspace = workspace;
    }

    public static class State {
        private String directory = ".flowcode";
        private String fileName = "agent-state.json";
        private Duration autosaveInterval = Duration.ofSeconds(30);
        private int learningLimit = 500;

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public String getFileName() {
            return fileName;
        }

        public void setFileName(String fileName) {
            this.fileName = fileName;
        }

        public Duration getAutosaveInterval() {
            return autosaveInterval;
        }

        public void setAutosaveInterval(Duration autosaveInterval) {
            this.autosaveInterval = autosaveInterval;
        }

        public int getLearningLimit() {
            return learningLimit;
        }

        public void setLearningLimit(int learningLimit) {
            this.learningLimit = learningLimit;
        }
    }

    public static class Executor {
        private int timeoutFactor = 3;
        private Duration minStepTimeout = Duration.ofSeconds(5);
        private int providerRetries = 3;
        private Duration backoffInitial = Duration.ofMillis(500);
        private double backoffMultiplier = 2.0;
        private Duration backoffMax = Duration.ofSeconds(10);
        private Duration performanceBudget = Duration.ofSeconds(30);

        public int getTimeoutFactor() {
            return timeoutFactor;
        }

        public void setTimeoutFactor(int timeoutFactor) {
            this.timeoutFactor = timeoutFactor;
        }

        public Duration getMinStepTimeout() {
            return minStepTimeout;
        }

        public void setMinStepTimeout(Duration minStepTimeout) {
            this.minStepTimeout = minStepTimeout;
        }

        public int getProviderRetries() {
            return providerRetries;
        }

        public void setProviderRetries(int providerRetries) {
            this.providerRetries = providerRetries;
        }

        public Duration getBackoffInitial() {
            return backoffInitial;
        }

        public void setBackoffInitial(Duration backoffInitial) {
            this.backoffInitial = backoffInitial;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public Duration getBackoffMax() {
            return backoffMax;
        }

        public void setBackoffMax(Duration backoffMax) {
            this.backoffMax = backoffMax;
        }

        public Duration getPerformanceBudget() {
            return performanceBudget;
        }

        public void setPerformanceBudget(Duration performanceBudget) {
            this.performanceBudget = performanceBudget;
        }

        /** Exponential backoff delay before retry number {@code attempt} (1-based). */
        public Duration backoffFor(int attempt) {
            double factor = Math.pow(backoffMultiplier, Math.max(0, attempt - 1));
            long ms = (long) (backoffInitial.toMillis() * factor);
            return Duration.ofMillis(Math.min(ms, backoffMax.toMillis()));
        }
    }

    public static class Orchestrator {
        private int transientRetries = 1;
        private int maxEscalationsPerStep = 3;
        private boolean autoDrainQueue = true;
        private Duration persistenceRetryDelay = Duration.ofMillis(200);
        private int persistenceRetries = 2;

        public int getTransientRetries() {
            return transientRetries;
        }

        public void setTransientRetries(int transientRetries) {
            this.transientRetries = transientRetries;
        }

        public int getMaxEscalationsPerStep() {
            return maxEscalationsPerStep;
        }

        public void setMaxEscalationsPerStep(int maxEscalationsPerStep) {
            this.maxEscalationsPerStep = maxEscalationsPerStep;
        }

        public boolean isAutoDrainQueue() {
            return autoDrainQueue;
        }

        public void setAutoDrainQueue(boolean autoDrainQueue) {
            this.autoDrainQueue = autoDrainQueue;
        }

        public Duration getPersistenceRetryDelay() {
            return persistenceRetryDelay;
        }

        public void setPersistenceRetryDelay(Duration persistenceRetryDelay) {
            this.persistenceRetryDelay = persistenceRetryDelay;
        }

        public int getPersistenceRetries() {
            return persistenceRetries;
        }

        public void setPersistenceRetries(int persistenceRetries) {
            this.persistenceRetries = persistenceRetries;
        }
    }

    public static class Oversight {
        private Duration approvalTimeout = Duration.ofMinutes(5);
        private String autoApprovalLevel = "none";
        /** Route oversight to the non-interactive interface instead of the console. */
        private boolean headless = false;

        public Duration getApprovalTimeout() {
            return approvalTimeout;
        }

        public void setApprovalTimeout(Duration approvalTimeout) {
            this.approvalTimeout = approvalTimeout;
        }

        public String getAutoApprovalLevel() {
            return autoApprovalLevel;
        }

        public void setAutoApprovalLevel(String autoApprovalLevel) {
            this.autoApprovalLevel = autoApprovalLevel;
        }

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }
    }

    public static class Workspace {
        private String root = ".";
        private List<String> restrictedPaths = new ArrayList<>(List.of("node_modules", ".git"));
        private long maxFileSizeBytes = 10L * 1024 * 1024;
        private String securityLevel = "medium";
        private List<String> commandAllowlist = new ArrayList<>(List.of(
                "npm test*", "npm run *", "mvn *", "./mvnw *", "gradle *", "git status*",
                "git add *", "git commit *", "git checkout -b *", "git diff*", "ls*", "echo *"));

        public String getRoot() {
            return root;
        }

        public void setRoot(String root) {
            this.root = root;
        }

        public List<String> getRestrictedPaths() {
            return restrictedPaths;
        }

        public void setRestrictedPaths(List<String> restrictedPaths) {
            this.restrictedPaths = restrictedPaths;
        }

        public long getMaxFileSizeBytes() {
            return maxFileSizeBytes;
        }

        public void setMaxFileSizeBytes(long maxFileSizeBytes) {
            this.maxFileSizeBytes = maxFileSizeBytes;
        }

        public String getSecurityLevel() {
            return securityLevel;
        }

        public void setSecurityLevel(String securityLevel) {
            this.securityLevel = securityLevel;
        }

        public List<String> getCommandAllowlist() {
            return commandAllowlist;
        }

        public void setCommandAllowlist(List<String> commandAllowlist) {
            this.commandAllowlist = commandAllowlist;
        }
    }
}
