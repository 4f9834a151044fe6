package uk.gegc.tunetrivia.features.progress.application.impl;

import uk.gegc.tunetrivia.features.progress.application.ProgressConnection;
import uk.gegc.tunetrivia.features.progress.domain.model.ProgressFrame;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory connection that records what it was sent.
 */
class RecordingConnection implements ProgressConnection {

    private final String id;
    private final List<ProgressFrame> frames = new ArrayList<>();
    private volatile boolean open = true;
    private volatile boolean failOnSend;
    private volatile boolean closed;

    RecordingConnection(String id) {
        this.id = id;
    }

    static RecordingConnection failing(String id) {
        RecordingConnection connection = new RecordingConnection(id);
        connection.failOnSend = true;
        return connection;
    }

    void drop() {
        open = false;
    }

    void failFromNowOn() {
        failOnSend = true;
    }

    synchronized List<ProgressFrame> frames() {
        return List.copyOf(frames);
    }

    boolean wasClosed() {
        return closed;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public synchronized void send(ProgressFrame frame) throws IOException {
        if (failOnSend) {
            throw new IOException("Broken pipe");
        }
        frames.add(frame);
    }

    @Override
    public void close() {
        closed = true;
        open = false;
    }
}
