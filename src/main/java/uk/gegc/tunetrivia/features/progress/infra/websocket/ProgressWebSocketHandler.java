package uk.gegc.tunetrivia.features.progress.infra.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;
import uk.gegc.tunetrivia.features.progress.application.ProgressBroadcastHub;

import java.net.URI;

/**
 * Push endpoint. Clients connect with {@code ?userId=<ownerId>} and receive that owner's frames.
 * Inbound messages are ignored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProgressWebSocketHandler extends TextWebSocketHandler {

    static final String OWNER_PARAM = "userId";
    static final String OWNER_ATTRIBUTE = "progress.ownerId";
    static final CloseStatus MISSING_OWNER = CloseStatus.POLICY_VIOLATION.withReason("Missing userId parameter");

    private final ProgressBroadcastHub broadcastHub;
    private final ObjectMapper objectMapper;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String ownerId = resolveOwnerId(session.getUri());
        if (!StringUtils.hasText(ownerId)) {
            log.warn("Rejecting progress connection {}: no {} parameter", session.getId(), OWNER_PARAM);
            session.close(MISSING_OWNER);
            return;
        }
        session.getAttributes().put(OWNER_ATTRIBUTE, ownerId);
        broadcastHub.subscribe(ownerId, new WebSocketProgressConnection(session, objectMapper));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.trace("Ignoring inbound message on progress connection {}", session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on progress connection {}: {}", session.getId(), exception.getMessage());
        release(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.debug("Progress connection {} closed with {}", session.getId(), status);
        release(session);
    }

    private void release(WebSocketSession session) {
        Object ownerId = session.getAttributes().get(OWNER_ATTRIBUTE);
        if (ownerId != null) {
            broadcastHub.unsubscribe(ownerId.toString(), new WebSocketProgressConnection(session, objectMapper));
        }
    }

    private String resolveOwnerId(URI uri) {
        if (uri == null) {
            return null;
        }
        return UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst(OWNER_PARAM);
    }
}
