package com.flowcode.core.execution;

import com.flowcode.core.model.AgentAction;
import com.flowcode.core.model.AgentActionType;
import com.flowcode.core.model.ExecutionContext;
import com.flowcode.core.model.StepResult;

import java.util.Set;

/**
 * Performs actions of the kinds it declares. Providers run on a worker thread and
 * must respond to interruption, which is how the executor enforces step timeouts.
 * Once {@code perform} returns after an interrupt, nothing it started may still be
 * writing to the workspace: the executor rolls back right after.
 * <p>
 * Throw {@link ProviderUnavailableException} for transient problems and
 * {@link CapabilityException} for everything the action itself got wrong.
 */
public interface CapabilityProvider {

    Set<AgentActionType> capabilities();

    StepResult perform(AgentAction action, ExecutionContext context);
}
