package com.example.courier.realtime.session;

import com.example.courier.shared.model.UserIdentity;
import com.example.courier.shared.model.UserRole;
import lombok.AccessLevel;
import lombok.Getter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One live WebSocket session of an authenticated user. Owns the bounded outbound
 * buffer the router writes into; the socket writer drains it.
 *
 * <p>Emission into the buffer is serialized on this instance because the router,
 * the heartbeat task and the inbound pipeline all write to it. The buffer holds
 * exactly {@code bufferSize} frames not yet taken by the writer; the backing queue
 * may be larger since Reactor rounds queue capacities up to a power of two.
 */
@Getter
public class Connection {

    private final String id;
    private final UserIdentity identity;
    private final OffsetDateTime connectedAt;
    private final int bufferSize;

    @Getter(AccessLevel.NONE)
    private final Sinks.Many<String> outbound;
    @Getter(AccessLevel.NONE)
    private final Sinks.One<CloseReason> closeSignal = Sinks.one();
    @Getter(AccessLevel.NONE)
    private final Sinks.Empty<Void> drainSignal = Sinks.empty();
    @Getter(AccessLevel.NONE)
    private final AtomicInteger pending = new AtomicInteger();

    private volatile ConnectionState state = ConnectionState.CONNECTING;
    private volatile CloseReason closeReason;

    public Connection(String id, UserIdentity identity, int bufferSize) {
        this.id = Objects.requireNonNull(id, "id");
        this.identity = identity;
        this.bufferSize = bufferSize;
        this.connectedAt = OffsetDateTime.now(ZoneOffset.UTC);
        this.outbound = Sinks.many().unicast().onBackpressureBuffer(Queues.<String>get(bufferSize).get());
    }

    public long getUserId() {
        return identity.getUserId();
    }

    public UserRole getRole() {
        return identity.getRole();
    }

    public boolean isOpen() {
        return state == ConnectionState.OPEN;
    }

    /**
     * CONNECTING → OPEN.
     *
     * @return false if the connection already left CONNECTING
     */
    public synchronized boolean open() {
        if (state != ConnectionState.CONNECTING) {
            return false;
        }
        state = ConnectionState.OPEN;
        return true;
    }

    /**
     * Queues a serialized frame without blocking.
     */
    public synchronized OfferResult offer(String frame) {
        if (state != ConnectionState.OPEN) {
            return OfferResult.CLOSED;
        }
        if (pending.get() >= bufferSize) {
            return OfferResult.OVERFLOW;
        }
        pending.incrementAndGet();
        Sinks.EmitResult result = outbound.tryEmitNext(frame);
        if (result.isSuccess()) {
            return OfferResult.ACCEPTED;
        }
        pending.decrementAndGet();
        return result == Sinks.EmitResult.FAIL_OVERFLOW ? OfferResult.OVERFLOW : OfferResult.CLOSED;
    }

    /**
     * Moves to CLOSING and completes the outbound stream so already queued frames
     * can drain. Only the first caller wins.
     *
     * @return true if this call started the close
     */
    public synchronized boolean beginClosing(CloseReason reason) {
        if (state == ConnectionState.CLOSING || state == ConnectionState.CLOSED) {
            return false;
        }
        state = ConnectionState.CLOSING;
        closeReason = reason;
        outbound.tryEmitComplete();
        closeSignal.tryEmitValue(reason);
        return true;
    }

    public void markDrained() {
        drainSignal.tryEmitEmpty();
    }

    public synchronized void markClosed() {
        state = ConnectionState.CLOSED;
    }

    /**
     * Frames queued for the socket. Single subscriber: the session writer.
     */
    public Flux<String> outbound() {
        return outbound.asFlux().doOnNext(frame -> pending.decrementAndGet());
    }

    /**
     * Frames queued but not yet taken by the session writer.
     */
    public int pendingFrames() {
        return pending.get();
    }

    /**
     * Emits the reason once the connection starts closing.
     */
    public Mono<CloseReason> closeRequested() {
        return closeSignal.asMono();
    }

    /**
     * Completes when the session writer has finished with the outbound stream.
     */
    public Mono<Void> drained() {
        return drainSignal.asMono();
    }

    @Override
    public String toString() {
        return String.format("Connection{id=%s, userId=%d, role=%s, state=%s}",
                id, identity != null ? identity.getUserId() : -1, identity != null ? identity.getRole() : null, state);
    }
}
