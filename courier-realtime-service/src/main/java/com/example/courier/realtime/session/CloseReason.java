package com.example.courier.realtime.session;

import org.springframework.web.reactive.socket.CloseStatus;

import java.util.Locale;

/**
 * Why a connection left the OPEN state, and the status sent to the peer when the
 * server is the side closing it.
 */
public enum CloseReason {
    CLIENT_CLOSED(CloseStatus.NORMAL, false),
    TRANSPORT_ERROR(CloseStatus.SERVER_ERROR, false),
    PROTOCOL_ERROR(CloseStatus.PROTOCOL_ERROR.withReason("Malformed message"), true),
    BUFFER_OVERFLOW(CloseStatus.POLICY_VIOLATION.withReason("Outbound buffer overflow"), true),
    IDLE_TIMEOUT(CloseStatus.GOING_AWAY.withReason("Idle timeout"), true),
    SERVER_SHUTDOWN(CloseStatus.GOING_AWAY.withReason("Server shutting down"), true),
    AUTH_REJECTED(new CloseStatus(4001, "Authentication failed"), true),
    RATE_LIMITED(CloseStatus.SERVICE_OVERLOAD.withReason("Try again later"), true);

    private final CloseStatus closeStatus;
    private final boolean serverInitiated;

    CloseReason(CloseStatus closeStatus, boolean serverInitiated) {
        this.closeStatus = closeStatus;
        this.serverInitiated = serverInitiated;
    }

    public CloseStatus getCloseStatus() {
        return closeStatus;
    }

    public boolean isServerInitiated() {
        return serverInitiated;
    }

    public String metricTag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
