package com.example.courier.realtime.websocket;

import com.example.courier.realtime.auth.ConnectionAuthenticator;
import com.example.courier.realtime.session.CloseReason;
import com.example.courier.realtime.session.Connection;
import com.example.courier.realtime.session.ConnectionManager;
import com.example.courier.shared.config.AppProperties;
import com.example.courier.shared.exception.AuthRejectedException;
import com.example.courier.shared.exception.ProtocolException;
import com.example.courier.shared.model.UserIdentity;
import com.example.courier.shared.util.Constants;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.UUID;

/**
 * Drives one WebSocket session: authenticates the upgrade, then runs the inbound
 * command pipeline, the outbound writer and the server side close concurrently
 * until the connection is gone.
 */
@Component
@Slf4j
public class ConnectionHandler implements WebSocketHandler {

    public static final String CONNECT_RATE_LIMITER = "websocketConnect";

    private final ConnectionAuthenticator authenticator;
    private final ConnectionManager connectionManager;
    private final InboundCommandHandler commandHandler;
    private final AppProperties appProperties;
    private final RateLimiter connectRateLimiter;

    public ConnectionHandler(ConnectionAuthenticator authenticator,
                             ConnectionManager connectionManager,
                             InboundCommandHandler commandHandler,
                             AppProperties appProperties,
                             RateLimiterRegistry rateLimiterRegistry) {
        this.authenticator = authenticator;
        this.connectionManager = connectionManager;
        this.commandHandler = commandHandler;
        this.appProperties = appProperties;
        this.connectRateLimiter = rateLimiterRegistry.rateLimiter(CONNECT_RATE_LIMITER);
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        return authenticate(session)
                .flatMap(identity -> serve(session, identity));
    }

    private Mono<UserIdentity> authenticate(WebSocketSession session) {
        String token = extractToken(session);
        return Mono.fromCallable(() -> authenticator.authenticate(token))
                .transformDeferred(RateLimiterOperator.of(connectRateLimiter))
                .onErrorResume(AuthRejectedException.class,
                        e -> reject(session, CloseReason.AUTH_REJECTED).then(Mono.empty()))
                .onErrorResume(RequestNotPermitted.class, e -> {
                    log.warn("Connection rate limit exceeded. Rejecting session {} from {}",
                            session.getId(), session.getHandshakeInfo().getRemoteAddress());
                    return reject(session, CloseReason.RATE_LIMITED).then(Mono.empty());
                });
    }

    private Mono<Void> serve(WebSocketSession session, UserIdentity identity) {
        Connection connection = connectionManager.open(UUID.randomUUID().toString(), identity);
        log.debug("Session {} bound to connection {} (correlationId={})", session.getId(), connection.getId(),
                session.getAttributes().get(Constants.CORRELATION_ID_KEY));

        Mono<Void> output = session.send(connection.outbound().map(session::textMessage))
                .onErrorResume(e -> {
                    log.warn("Write to connection {} failed: {}", connection.getId(), e.getMessage());
                    connectionManager.close(connection, CloseReason.TRANSPORT_ERROR);
                    return Mono.empty();
                })
                .doFinally(signal -> connection.markDrained());

        Sinks.Many<Long> inboundActivity = Sinks.many().multicast().directBestEffort();

        Mono<Void> input = inbound(session)
                .doOnNext(payload -> inboundActivity.tryEmitNext(System.nanoTime()))
                .doOnNext(payload -> commandHandler.handle(connection, payload))
                .then()
                .onErrorResume(e -> {
                    closeOnInboundError(connection, e);
                    return Mono.empty();
                })
                .doFinally(signal -> connectionManager.close(connection, CloseReason.CLIENT_CLOSED));

        Mono<Void> closer = connection.closeRequested()
                .filter(CloseReason::isServerInitiated)
                .flatMap(reason -> connection.drained()
                        .timeout(Duration.ofMillis(appProperties.getWebsocket().getCloseGracePeriod()), Mono.empty())
                        .then(session.close(reason.getCloseStatus())));

        Mono<Void> idle = idleWatch(connection, inboundActivity.asFlux());

        return Mono.when(input, output, closer, idle)
                .doFinally(signal -> {
                    connectionManager.close(connection, CloseReason.CLIENT_CLOSED);
                    connection.markClosed();
                });
    }

    private Flux<String> inbound(WebSocketSession session) {
        return session.receive()
                .filter(message -> message.getType() == WebSocketMessage.Type.TEXT)
                .map(WebSocketMessage::getPayloadAsText);
    }

    /**
     * Closes the connection once no inbound frame arrived for the idle timeout.
     * Runs beside the inbound pipeline so the socket stays readable until the
     * close frame has been sent.
     */
    private Mono<Void> idleWatch(Connection connection, Flux<Long> inboundActivity) {
        long idleTimeout = appProperties.getWebsocket().getIdleTimeout();
        if (idleTimeout <= 0) {
            return Mono.empty();
        }
        return inboundActivity
                .startWith(System.nanoTime())
                .switchMap(lastSeen -> Mono.delay(Duration.ofMillis(idleTimeout)))
                .next()
                .takeUntilOther(connection.closeRequested())
                .doOnNext(tick -> {
                    log.info("Connection {} idle for {}ms", connection.getId(), idleTimeout);
                    connectionManager.close(connection, CloseReason.IDLE_TIMEOUT);
                })
                .then();
    }

    private void closeOnInboundError(Connection connection, Throwable error) {
        if (error instanceof ProtocolException) {
            log.warn("Malformed frame on connection {} (user {}): {}",
                    connection.getId(), connection.getUserId(), error.getMessage());
            connectionManager.close(connection, CloseReason.PROTOCOL_ERROR);
        } else {
            log.warn("Read from connection {} failed: {}", connection.getId(), error.getMessage());
            connectionManager.close(connection, CloseReason.TRANSPORT_ERROR);
        }
    }

    private Mono<Void> reject(WebSocketSession session, CloseReason reason) {
        return session.close(reason.getCloseStatus());
    }

    private String extractToken(WebSocketSession session) {
        return UriComponentsBuilder.fromUri(session.getHandshakeInfo().getUri())
                .build()
                .getQueryParams()
                .getFirst(appProperties.getAuth().getTokenParameter());
    }
}
