package com.example.courier.realtime.client;

import com.example.courier.shared.config.AppProperties;
import com.example.courier.shared.util.Constants.InboundType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * WebSocket client for the real-time channel that keeps itself connected. Runs a
 * {@link ReconnectStateMachine} against a Reactor Netty socket, pings on an
 * interval and hands every inbound frame to the registered listeners.
 *
 * <p>Nothing here blocks the caller: commands are queued on the live socket and
 * frames arrive on the socket's event loop.
 */
@Slf4j
public class ReconnectingDeliveryClient implements ReconnectStateMachine.Transport, AutoCloseable {

    private final WebSocketClient webSocketClient;
    private final URI endpoint;
    private final Duration pingInterval;
    private final ObjectMapper objectMapper;
    private final ReconnectStateMachine stateMachine;
    private final List<Consumer<String>> frameListeners = new CopyOnWriteArrayList<>();

    private volatile Sinks.Many<String> outbound;
    private volatile WebSocketSession session;
    private volatile Disposable connection;
    private volatile String lastError;

    public ReconnectingDeliveryClient(WebSocketClient webSocketClient,
                                      URI endpoint,
                                      AppProperties.Client settings,
                                      ObjectMapper objectMapper,
                                      Scheduler timerScheduler) {
        this.webSocketClient = webSocketClient;
        this.endpoint = endpoint;
        this.pingInterval = Duration.ofMillis(settings.getPingInterval());
        this.objectMapper = objectMapper;
        this.stateMachine = new ReconnectStateMachine(this, new SchedulerReconnectTimer(timerScheduler),
                settings.getMaxReconnectAttempts(), Duration.ofMillis(settings.getBackoffCap()));
    }

    public void connect() {
        stateMachine.connect();
    }

    public void subscribe(long deliveryId) {
        stateMachine.subscribe(deliveryId);
    }

    public void unsubscribe(long deliveryId) {
        stateMachine.unsubscribe(deliveryId);
    }

    public boolean requestStats() {
        return stateMachine.send(Map.of("type", InboundType.GET_STATS.getWireName()));
    }

    public void addFrameListener(Consumer<String> listener) {
        frameListeners.add(listener);
    }

    public boolean isConnected() {
        return stateMachine.isConnected();
    }

    public ReconnectState getState() {
        return stateMachine.getState();
    }

    public Integer getLastCloseCode() {
        return stateMachine.getLastCloseCode();
    }

    public String getLastCloseReason() {
        return stateMachine.getLastCloseReason();
    }

    public String getLastError() {
        return lastError;
    }

    @Override
    public void close() {
        stateMachine.disconnect();
    }

    @Override
    public void open() {
        Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();
        outbound = sink;
        AtomicReference<CloseStatus> closeStatus = new AtomicReference<>();

        connection = webSocketClient.execute(endpoint, webSocketSession -> {
                    session = webSocketSession;
                    lastError = null;
                    Flux<String> pings = Flux.interval(pingInterval, pingInterval).map(tick -> serialize(Map.of("type", InboundType.PING.getWireName())));
                    Mono<Void> output = webSocketSession.send(Flux.merge(sink.asFlux(), pings).map(webSocketSession::textMessage));
                    Mono<Void> input = webSocketSession.receive()
                            .map(WebSocketMessage::getPayloadAsText)
                            .doOnNext(this::dispatch)
                            .then();
                    stateMachine.onOpen();
                    return Mono.firstWithSignal(input, output)
                            .then(webSocketSession.closeStatus())
                            .doOnNext(closeStatus::set)
                            .then();
                })
                .subscribe(
                        unused -> { },
                        error -> {
                            lastError = error.getMessage();
                            log.warn("Connection to {} failed: {}", endpoint, error.getMessage());
                            stateMachine.onClose(ReconnectStateMachine.ABNORMAL_CLOSURE, error.getMessage());
                        },
                        () -> {
                            CloseStatus status = closeStatus.get();
                            if (status == null) {
                                stateMachine.onClose(ReconnectStateMachine.ABNORMAL_CLOSURE, "Connection lost");
                            } else {
                                stateMachine.onClose(status.getCode(), status.getReason());
                            }
                        });
    }

    @Override
    public void send(Map<String, Object> command) {
        Sinks.Many<String> sink = outbound;
        String frame = serialize(command);
        if (sink == null || frame == null) {
            return;
        }
        Sinks.EmitResult result = sink.tryEmitNext(frame);
        if (result.isFailure()) {
            log.warn("Could not queue {} command: {}", command.get("type"), result);
        }
    }

    @Override
    public void close(int code, String reason) {
        WebSocketSession current = session;
        if (current != null && current.isOpen()) {
            current.close(new CloseStatus(code, reason)).subscribe();
        } else if (connection != null) {
            connection.dispose();
        }
    }

    private void dispatch(String frame) {
        for (Consumer<String> listener : frameListeners) {
            try {
                listener.accept(frame);
            } catch (Exception e) {
                log.error("Frame listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private String serialize(Map<String, Object> command) {
        try {
            return objectMapper.writeValueAsString(command);
        } catch (JsonProcessingException e) {
            log.error("Error serializing {} command: {}", command.get("type"), e.getMessage());
            return null;
        }
    }
}
