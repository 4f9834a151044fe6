package uk.gegc.tunetrivia.features.progress.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * {@link ProgressTransport} over a Spring {@link WebSocketClient}.
 */
@Slf4j
public class StandardWebSocketProgressTransport implements ProgressTransport {

    private final WebSocketClient webSocketClient;
    private final String websocketUrl;

    public StandardWebSocketProgressTransport(WebSocketClient webSocketClient, String websocketUrl) {
        this.webSocketClient = webSocketClient;
        this.websocketUrl = websocketUrl;
    }

    @Override
    public Session open(String ownerId, Listener listener) {
        URI uri = UriComponentsBuilder.fromUriString(websocketUrl)
                .queryParam("userId", ownerId)
                .build()
                .toUri();

        CompletableFuture<WebSocketSession> handshake =
                webSocketClient.execute(new ListenerAdapter(listener), new WebSocketHttpHeaders(), uri);
        handshake.whenComplete((session, error) -> {
            if (error != null) {
                listener.onError(error);
            }
        });

        return () -> handshake.thenAccept(session -> {
            if (session.isOpen()) {
                try {
                    session.close(CloseStatus.NORMAL);
                } catch (IOException e) {
                    log.debug("Closing progress session {} failed: {}", session.getId(), e.getMessage());
                }
            }
        });
    }

    private static final class ListenerAdapter extends TextWebSocketHandler {

        private final Listener listener;

        private ListenerAdapter(Listener listener) {
            this.listener = listener;
        }

        @Override
        public void afterConnectionEstablished(WebSocketSession session) {
            listener.onOpen();
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            listener.onMessage(message.getPayload());
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            listener.onError(exception);
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            listener.onClose(status.getCode() + (status.getReason() != null ? " " + status.getReason() : ""));
        }
    }
}
