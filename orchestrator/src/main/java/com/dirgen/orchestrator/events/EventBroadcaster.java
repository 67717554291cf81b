package com.dirgen.orchestrator.events;

import com.dirgen.orchestrator.model.BroadcastMessage;
import com.dirgen.orchestrator.model.EventType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Fans run events out to the one live subscriber of each run.
 *
 * - No subscriber: publish() is a no-op. Nothing is queued or replayed.
 * - subscribe() replaces whatever subscriber the run had before.
 * - A dead connection is noticed on the next failed send and dropped.
 *
 * Sessions are wrapped in a ConcurrentWebSocketSessionDecorator, which
 * serialises sends per session, so messages for one run reach the subscriber
 * in publish order.
 */
@Component
public class EventBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(EventBroadcaster.class);

    private static final int SEND_TIME_LIMIT_MS   = 10_000;
    private static final int BUFFER_SIZE_LIMIT    = 512 * 1024;

    private final ConcurrentMap<String, ConcurrentWebSocketSessionDecorator> subscribers = new ConcurrentHashMap<>();
    private final ObjectMapper json;

    public EventBroadcaster(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    // ------------------------------------------------------------------
    // Subscription
    // ------------------------------------------------------------------

    public void subscribe(String runId, WebSocketSession session) {
        ConcurrentWebSocketSessionDecorator decorated =
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        ConcurrentWebSocketSessionDecorator previous = subscribers.put(runId, decorated);
        if (previous != null && previous.getDelegate() != session) {
            log.info("Subscriber for run {} replaced (old session {})", runId, previous.getId());
        } else {
            log.info("Subscriber attached for run {}", runId);
        }
    }

    /** Detach {@code session}, unless it has already been replaced by a newer subscriber. */
    public void unsubscribe(String runId, WebSocketSession session) {
        subscribers.computeIfPresent(runId, (id, current) -> current.getDelegate() == session ? null : current);
    }

    public boolean hasSubscriber(String runId) {
        return subscribers.containsKey(runId);
    }

    // ------------------------------------------------------------------
    // Publishing
    // ------------------------------------------------------------------

    public void publish(String runId, EventType type, Map<String, Object> data) {
        publish(runId, BroadcastMessage.of(type, data));
    }

    public void publish(String runId, BroadcastMessage message) {
        ConcurrentWebSocketSessionDecorator session = subscribers.get(runId);
        if (session == null) {
            return;
        }
        if (!session.isOpen()) {
            drop(runId, session, "connection closed");
            return;
        }
        String payload;
        try {
            payload = json.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Could not serialise {} event for run {}", message.type(), runId, e);
            return;
        }
        try {
            session.sendMessage(new TextMessage(payload));
        } catch (IOException | IllegalStateException e) {
            drop(runId, session, e.getMessage());
        }
    }

    private void drop(String runId, ConcurrentWebSocketSessionDecorator session, String reason) {
        if (subscribers.remove(runId, session)) {
            log.info("Subscriber for run {} removed: {}", runId, reason);
        }
    }
}
