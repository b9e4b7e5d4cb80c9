package com.example.courier.realtime.client;

public enum ReconnectState {
    DISCONNECTED,
    CONNECTING,
    OPEN,
    WAITING_TO_RECONNECT,
    /** Reconnect attempts exhausted; only an explicit connect() leaves this state. */
    FAILED,
    /** Closed by the owner; never reconnects on its own. */
    CLOSED
}
