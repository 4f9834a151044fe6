package uk.gegc.tunetrivia.features.progress.client;

/**
 * Callbacks from a {@link ProgressChannelClient}. Invoked on transport or scheduler threads;
 * implementations must not block.
 */
public interface ProgressChannelListener {

    default void onProgress(EnhancedProgress progress) {
    }

    default void onCompletion(EnhancedProgress progress) {
    }

    default void onStateChanged(ChannelState state) {
    }

    default void onError(String message) {
    }
}
