package uk.gegc.tunetrivia.features.progress.application;

import uk.gegc.tunetrivia.features.progress.domain.model.ProgressFrame;

import java.io.IOException;

/**
 * A live push channel to one client. Implementations wrap a transport such as a WebSocket session.
 */
public interface ProgressConnection {

    String id();

    boolean isOpen();

    void send(ProgressFrame frame) throws IOException;

    void close();
}
