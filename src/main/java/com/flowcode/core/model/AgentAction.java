package com.flowcode.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.List;

/**
 * A single intended operation.
 *
 * @param id               unique identifier (e.g., "ACT-003")
 * @param description      human-readable summary
 * @param target           file path or command string the action operates on
 * @param payload          kind-specific arguments; determines {@link #type()}
 * @param validation       rules checked against the produced result
 * @param riskLevel        inferred risk of performing the action
 * @param estimatedTimeMs  expected wall-clock time, used to derive the step timeout
 * @param requiresApproval whether a human must approve before execution
 */
public record AgentAction(
    String id,
    String description,
    String target,
    ActionPayload payload,
    List<ValidationRule> validation,
    RiskLevel riskLevel,
    long estimatedTimeMs,
    boolean requiresApproval
) implements Serializable {

    public AgentAction {
        validation = validation == null ? List.of() : List.copyOf(validation);
    }

    @JsonIgnore
    public AgentActionType type() {
        return payload.type();
    }

    /**
     * Returns the payload as the given kind, failing if the action is of another kind.
     */
    public <P extends ActionPayload> P payloadAs(Class<P> kind) {
        if (!kind.isInstance(payload)) {
            throw new IllegalStateException("Action " + id + " of type " + type()
                    + " does not carry a " + kind.getSimpleName() + " payload");
        }
        return kind.cast(payload);
    }

    public AgentAction withRequiresApproval(boolean requiresApproval) {
        return new AgentAction(id, description, target, payload, validation, riskLevel,
                estimatedTimeMs, requiresApproval);
    }

    public AgentAction withRiskLevel(RiskLevel riskLevel) {
        return new AgentAction(id, description, target, payload, validation, riskLevel,
                estimatedTimeMs, requiresApproval);
    }

    public AgentAction withTarget(String target) {
        return new AgentAction(id, description, target, payload, validation, riskLevel,
                estimatedTimeMs, requiresApproval);
    }

    public AgentAction withPayload(ActionPayload payload) {
        return new AgentAction(id, description, target, payload, validation, riskLevel,
                estimatedTimeMs, requiresApproval);
    }
}
