package com.flowcode.dispatch.cli;

import com.flowcode.core.model.AgenticTask;
import com.flowcode.core.model.ApprovalRequest;
import com.flowcode.core.model.ApprovalResponse;
import com.flowcode.core.model.HumanIntervention;
import com.flowcode.core.model.TaskProgress;
import com.flowcode.core.model.UserFeedback;
import com.flowcode.core.oversight.EscalationDecision;
import com.flowcode.core.oversight.EscalationRequest;
import com.flowcode.core.oversight.HumanInterface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Terminal-based human interface. Prompts run on their own thread so the gate's
 * approval timeout still applies while the user thinks.
 * <p>
 * Without a terminal every prompt falls back to the safe answer: approvals are
 * rejected and escalations abort.
 */
@Component
public class ConsoleHumanInterface implements HumanInterface {

    private static final Logger log = LoggerFactory.getLogger(ConsoleHumanInterface.class);

    private final BufferedReader in;
    private final boolean interactive;
    private final ExecutorService promptThread = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "flowcode-prompt");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean feedbackPrompts;
    private volatile boolean showProgress = true;

    @Autowired
    public ConsoleHumanInterface() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.console() != null);
    }

    ConsoleHumanInterface(BufferedReader in, boolean interactive) {
        this.in = in;
        this.interactive = interactive;
    }

    public void setFeedbackPrompts(boolean feedbackPrompts) {
        this.feedbackPrompts = feedbackPrompts;
    }

    public void setShowProgress(boolean showProgress) {
        this.showProgress = showProgress;
    }

    @Override
    public CompletionStage<ApprovalResponse> onApprovalRequested(ApprovalRequest request) {
        if (!interactive) {
            ConsoleOutput.warn("Approval " + request.id() + " needs a terminal; rejecting");
            return CompletableFuture.completedFuture(ApprovalResponse.reject("No terminal available for approval"));
        }
        return CompletableFuture.supplyAsync(() -> promptApproval(request), promptThread);
    }

    ApprovalResponse promptApproval(ApprovalRequest request) {
        var risk = request.risk();
        System.out.println();
        ConsoleOutput.warn("Approval required: " + request.action().type().label() + " on " + request.action().target());
        System.out.println("  Reason: " + request.reason());
        System.out.println("  Risk: " + risk.level() + " (" + risk.impact() + ", confidence "
                + Math.round(risk.confidence() * 100) + "%)");
        risk.factors().forEach(f -> System.out.println("    - " + f));
        if (!risk.mitigations().isEmpty()) {
            System.out.println("  Mitigation:");
            risk.mitigations().forEach(m -> System.out.println("    - " + m));
        }
        if (!request.alternatives().isEmpty()) {
            System.out.println("  Alternatives:");
            request.alternatives().forEach(a -> System.out.println("    - " + a));
        }
        ConsoleOutput.prompt("Approve? [y/N]");
        String answer = readLine().orElse("").toLowerCase(Locale.ROOT);
        if (answer.equals("y") || answer.equals("yes")) {
            return ApprovalResponse.approve("Approved at the console");
        }
        ConsoleOutput.prompt("Reason for rejecting (optional):");
        String reason = readLine().orElse("");
        return ApprovalResponse.reject(reason.isBlank() ? "User denied approval" : reason);
    }

    @Override
    public void onProgressChanged(String taskId, TaskProgress progress) {
        if (showProgress) {
            ConsoleOutput.progress(taskId, progress);
        }
    }

    @Override
    public Optional<HumanIntervention> onInterventionAvailable(String taskId) {
        // control signals arrive through the orchestrator API, not the console
        return Optional.empty();
    }

    @Override
    public Optional<UserFeedback> onFeedbackRequested(AgenticTask task) {
        if (!interactive || !feedbackPrompts) {
            return Optional.empty();
        }
        ConsoleOutput.prompt("Rate this task from 1 to 5 (enter to skip):");
        Optional<String> rating = readLine().filter(s -> !s.isBlank());
        if (rating.isEmpty()) {
            return Optional.empty();
        }
        int score;
        try {
            score = Integer.parseInt(rating.get().trim());
        } catch (NumberFormatException e) {
            ConsoleOutput.warn("Not a number, skipping feedback");
            return Optional.empty();
        }
        if (score < 1 || score > 5) {
            ConsoleOutput.warn("Rating must be between 1 and 5, skipping feedback");
            return Optional.empty();
        }
        ConsoleOutput.prompt("Comments (optional):");
        String comments = readLine().orElse("");
        ConsoleOutput.prompt("Would you use this again? [Y/n]");
        boolean again = !readLine().orElse("").trim().toLowerCase(Locale.ROOT).startsWith("n");
        return Optional.of(new UserFeedback(score, comments, List.of(), again, Instant.now()));
    }

    @Override
    public EscalationDecision onEscalation(EscalationRequest request) {
        System.out.println();
        ConsoleOutput.error("Escalation (" + request.urgency() + "): step " + request.stepId() + " "
                + request.kind().label() + " after " + request.attempts() + " attempt(s)");
        System.out.println("  " + request.message());
        request.suggestions().forEach(s -> System.out.println("    - " + s));
        if (!interactive) {
            return EscalationDecision.ABORT;
        }
        ConsoleOutput.prompt("[r]etry, [s]kip or [a]bort?");
        String answer = readLine().orElse("a").trim().toLowerCase(Locale.ROOT);
        if (answer.startsWith("r")) {
            return EscalationDecision.RETRY;
        }
        if (answer.startsWith("s")) {
            return EscalationDecision.SKIP;
        }
        return EscalationDecision.ABORT;
    }

    private Optional<String> readLine() {
        try {
            return Optional.ofNullable(in.readLine());
        } catch (IOException e) {
            log.warn("Could not read from the console: {}", e.getMessage());
            throw new UncheckedIOException(e);
        }
    }
}
