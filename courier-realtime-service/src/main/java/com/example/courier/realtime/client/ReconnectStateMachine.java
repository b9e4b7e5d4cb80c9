package com.example.courier.realtime.client;

import com.example.courier.shared.util.Constants.InboundType;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Client side connection lifecycle with exponential backoff. Any close other than
 * a normal closure (1000) schedules a reconnect after
 * {@code min(2^attempt seconds, backoffCap)}; a successful open resets the attempt
 * counter and re-issues every active delivery subscription.
 *
 * <p>All inputs go through {@link #transition}, so the machine can be driven by a
 * real socket or by a test without one.
 */
@Slf4j
public class ReconnectStateMachine {

    public static final int NORMAL_CLOSURE = 1000;
    public static final int ABNORMAL_CLOSURE = 1006;

    /**
     * The socket the machine controls.
     */
    public interface Transport {

        void open();

        void send(Map<String, Object> command);

        void close(int code, String reason);
    }

    private enum Trigger {
        CONNECT,
        OPENED,
        CLOSED,
        RETRY_DUE,
        DISCONNECT
    }

    private final Transport transport;
    private final ReconnectTimer timer;
    private final int maxAttempts;
    private final Duration backoffCap;

    private final Set<Long> subscriptions = new LinkedHashSet<>();
    private final List<Duration> reconnectDelays = new ArrayList<>();

    private ReconnectState state = ReconnectState.DISCONNECTED;
    private int attempt;
    private Disposable pendingRetry;
    private Integer lastCloseCode;
    private String lastCloseReason;

    public ReconnectStateMachine(Transport transport, ReconnectTimer timer, int maxAttempts, Duration backoffCap) {
        this.transport = transport;
        this.timer = timer;
        this.maxAttempts = maxAttempts;
        this.backoffCap = backoffCap;
    }

    public void connect() {
        transition(Trigger.CONNECT, null, null);
    }

    public void onOpen() {
        transition(Trigger.OPENED, null, null);
    }

    public void onClose(int code, String reason) {
        transition(Trigger.CLOSED, code, reason);
    }

    public void disconnect() {
        transition(Trigger.DISCONNECT, NORMAL_CLOSURE, "Normal closure");
    }

    /**
     * Remembers the subscription and sends it right away when connected.
     */
    public synchronized void subscribe(long deliveryId) {
        if (subscriptions.add(deliveryId) && state == ReconnectState.OPEN) {
            transport.send(command(InboundType.SUBSCRIBE_DELIVERY, deliveryId));
        }
    }

    public synchronized void unsubscribe(long deliveryId) {
        if (subscriptions.remove(deliveryId) && state == ReconnectState.OPEN) {
            transport.send(command(InboundType.UNSUBSCRIBE_DELIVERY, deliveryId));
        }
    }

    /**
     * @return false if the socket is not open; commands are not queued while offline
     */
    public synchronized boolean send(Map<String, Object> command) {
        if (state != ReconnectState.OPEN) {
            log.warn("Not connected, dropping {} command", command.get("type"));
            return false;
        }
        transport.send(command);
        return true;
    }

    /**
     * Reconnect delay before attempt number {@code attempt + 1}.
     */
    public Duration backoff(int attempt) {
        if (attempt >= 62) {
            return backoffCap;
        }
        Duration delay = Duration.ofSeconds(1L << attempt);
        return delay.compareTo(backoffCap) > 0 ? backoffCap : delay;
    }

    public synchronized ReconnectState getState() {
        return state;
    }

    public synchronized boolean isConnected() {
        return state == ReconnectState.OPEN;
    }

    public synchronized int getAttempt() {
        return attempt;
    }

    public synchronized Set<Long> getSubscriptions() {
        return Set.copyOf(subscriptions);
    }

    /**
     * Every reconnect delay scheduled so far, oldest first.
     */
    public synchronized List<Duration> getReconnectDelays() {
        return List.copyOf(reconnectDelays);
    }

    public synchronized Integer getLastCloseCode() {
        return lastCloseCode;
    }

    public synchronized String getLastCloseReason() {
        return lastCloseReason;
    }

    private synchronized void transition(Trigger trigger, Integer code, String reason) {
        ReconnectState previous = state;
        switch (trigger) {
            case CONNECT -> {
                if (state == ReconnectState.OPEN || state == ReconnectState.CONNECTING) {
                    return;
                }
                cancelPendingRetry();
                attempt = 0;
                openTransport();
            }
            case OPENED -> {
                if (state != ReconnectState.CONNECTING) {
                    return;
                }
                state = ReconnectState.OPEN;
                attempt = 0;
                subscriptions.forEach(deliveryId -> transport.send(command(InboundType.SUBSCRIBE_DELIVERY, deliveryId)));
            }
            case CLOSED -> {
                if (state == ReconnectState.CLOSED || state == ReconnectState.DISCONNECTED || state == ReconnectState.FAILED) {
                    return;
                }
                lastCloseCode = code;
                lastCloseReason = reason;
                if (code != null && code == NORMAL_CLOSURE) {
                    state = ReconnectState.DISCONNECTED;
                } else if (attempt < maxAttempts) {
                    Duration delay = backoff(attempt);
                    reconnectDelays.add(delay);
                    state = ReconnectState.WAITING_TO_RECONNECT;
                    pendingRetry = timer.schedule(delay, () -> transition(Trigger.RETRY_DUE, null, null));
                    log.info("Connection closed ({} {}). Reconnecting in {}s (attempt {}/{})",
                            code, reason, delay.toSeconds(), attempt + 1, maxAttempts);
                } else {
                    state = ReconnectState.FAILED;
                    log.error("Connection closed ({} {}). Giving up after {} reconnect attempts", code, reason, maxAttempts);
                }
            }
            case RETRY_DUE -> {
                if (state != ReconnectState.WAITING_TO_RECONNECT) {
                    return;
                }
                pendingRetry = null;
                attempt++;
                openTransport();
            }
            case DISCONNECT -> {
                if (state == ReconnectState.CLOSED) {
                    return;
                }
                cancelPendingRetry();
                boolean live = state == ReconnectState.OPEN || state == ReconnectState.CONNECTING;
                state = ReconnectState.CLOSED;
                if (live) {
                    transport.close(code, reason);
                }
            }
        }
        log.debug("Reconnect state {} -> {} on {}", previous, state, trigger);
    }

    private void openTransport() {
        state = ReconnectState.CONNECTING;
        transport.open();
    }

    private void cancelPendingRetry() {
        if (pendingRetry != null) {
            pendingRetry.dispose();
            pendingRetry = null;
        }
    }

    private static Map<String, Object> command(InboundType type, long deliveryId) {
        Map<String, Object> command = new LinkedHashMap<>();
        command.put("type", type.getWireName());
        command.put("delivery_id", deliveryId);
        return command;
    }
}
