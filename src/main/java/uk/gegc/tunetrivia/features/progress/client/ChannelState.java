package uk.gegc.tunetrivia.features.progress.client;

public enum ChannelState {
    /** Created, never connected. */
    IDLE,
    CONNECTING,
    CONNECTED,
    /** Connection lost, a reconnect is scheduled. */
    RECONNECT_PENDING,
    /** Reconnect attempts used up; only a manual reconnect leaves this state. */
    FAILED,
    /** Closed by the caller. */
    DISCONNECTED
}
