package com.dirgen.orchestrator.model;

import java.util.Map;

/**
 * The {source, type, data} envelope pushed to a run's subscriber.
 * Transient: never stored, never replayed.
 */
public record BroadcastMessage(String source, String type, Map<String, Object> data) {

    public static final String ORCHESTRATOR = "Orchestrator";

    public BroadcastMessage {
        data = data == null ? Map.of() : data;
    }

    public static BroadcastMessage of(EventType type, Map<String, Object> data) {
        return new BroadcastMessage(ORCHESTRATOR, type.wireName(), data);
    }
}
