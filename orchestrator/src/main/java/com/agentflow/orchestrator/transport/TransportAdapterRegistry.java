package com.agentflow.orchestrator.transport;

import com.agentflow.orchestrator.model.Transport;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the adapter for a workflow's transport. Every {@link Transport}
 * value must have exactly one adapter bean.
 */
@Component
public class TransportAdapterRegistry {

    private final Map<Transport, TransportAdapter> adapters = new EnumMap<>(Transport.class);

    public TransportAdapterRegistry(List<TransportAdapter> allAdapters) {
        for (TransportAdapter adapter : allAdapters) {
            if (adapters.put(adapter.transport(), adapter) != null) {
                throw new IllegalStateException("Duplicate adapter for transport " + adapter.transport());
            }
        }
        for (Transport t : Transport.values()) {
            if (!adapters.containsKey(t)) {
                throw new IllegalStateException("No adapter registered for transport " + t);
            }
        }
    }

    public TransportAdapter forTransport(Transport transport) {
        return adapters.get(transport);
    }
}
