package com.example.courier.realtime.session;

/**
 * CONNECTING → OPEN → CLOSING → CLOSED. A connection rejected during the upgrade
 * never leaves CONNECTING.
 */
public enum ConnectionState {
    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED
}
