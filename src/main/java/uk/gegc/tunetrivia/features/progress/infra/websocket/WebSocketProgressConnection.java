package uk.gegc.tunetrivia.features.progress.infra.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import uk.gegc.tunetrivia.features.progress.application.ProgressConnection;
import uk.gegc.tunetrivia.features.progress.domain.model.ProgressFrame;

import java.io.IOException;

/**
 * {@link ProgressConnection} backed by a server-side WebSocket session. Frames are sent as JSON text.
 */
@Slf4j
public class WebSocketProgressConnection implements ProgressConnection {

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    public WebSocketProgressConnection(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(ProgressFrame frame) throws IOException {
        String payload = objectMapper.writeValueAsString(frame);
        // WebSocketSession does not allow concurrent sends
        synchronized (session) {
            session.sendMessage(new TextMessage(payload));
        }
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.GOING_AWAY);
        } catch (IOException e) {
            log.debug("Closing session {} failed: {}", session.getId(), e.getMessage());
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof WebSocketProgressConnection that)) {
            return false;
        }
        return session.getId().equals(that.session.getId());
    }

    @Override
    public int hashCode() {
        return session.getId().hashCode();
    }
}
