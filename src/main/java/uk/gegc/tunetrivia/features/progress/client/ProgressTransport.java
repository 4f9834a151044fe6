package uk.gegc.tunetrivia.features.progress.client;

/**
 * Opens push connections for the channel client. Opening is asynchronous; the outcome
 * arrives through the {@link Listener}.
 */
public interface ProgressTransport {

    Session open(String ownerId, Listener listener);

    interface Session {

        void close();
    }

    interface Listener {

        void onOpen();

        void onMessage(String payload);

        void onClose(String reason);

        void onError(Throwable error);
    }
}
