package com.flowcode.core.execution;

import com.flowcode.core.model.AgentActionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps every action type to exactly one {@link CapabilityProvider}.
 */
@Service
public class CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final Map<AgentActionType, CapabilityProvider> providers = new EnumMap<>(AgentActionType.class);

    public CapabilityRegistry(List<CapabilityProvider> providers) {
        for (CapabilityProvider provider : providers) {
            for (AgentActionType type : provider.capabilities()) {
                CapabilityProvider previous = this.providers.put(type, provider);
                if (previous != null) {
                    throw new IllegalStateException("Action type " + type + " is provided by both "
                            + previous.getClass().getSimpleName() + " and " + provider.getClass().getSimpleName());
                }
            }
        }
        for (AgentActionType type : AgentActionType.values()) {
            if (!this.providers.containsKey(type)) {
                log.warn("No capability provider registered for {}", type);
            }
        }
    }

    public Optional<CapabilityProvider> providerFor(AgentActionType type) {
        return Optional.ofNullable(providers.get(type));
    }
}
