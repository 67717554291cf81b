package com.dirgen.orchestrator.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;

/**
 * WebSocket endpoint {@code /ws/{runId}}: the connection becomes the run's
 * subscriber. Anything the client sends is ignored (keep-alives).
 */
@Component
public class RunEventSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(RunEventSocketHandler.class);

    private final EventBroadcaster broadcaster;

    public RunEventSocketHandler(EventBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String runId = runIdOf(session);
        if (runId == null) {
            log.warn("WebSocket connection without run id: {}", session.getUri());
            return;
        }
        broadcaster.subscribe(runId, session);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        // client -> server traffic carries no meaning
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String runId = runIdOf(session);
        if (runId != null) {
            broadcaster.unsubscribe(runId, session);
            log.info("WebSocket for run {} closed ({})", runId, status);
        }
    }

    static String runIdOf(WebSocketSession session) {
        URI uri = session.getUri();
        if (uri == null || uri.getPath() == null) {
            return null;
        }
        String path = uri.getPath();
        String last = path.substring(path.lastIndexOf('/') + 1);
        return last.isBlank() ? null : last;
    }
}
