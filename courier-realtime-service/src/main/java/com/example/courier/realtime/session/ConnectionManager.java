package com.example.courier.realtime.session;

import com.example.courier.realtime.dto.ConnectionStats;
import com.example.courier.realtime.websocket.OutboundFrameFactory;
import com.example.courier.shared.config.AppProperties;
import com.example.courier.shared.config.MonitoringConfig;
import com.example.courier.shared.model.UserIdentity;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the lifecycle of live connections: opening, frame delivery with slow
 * consumer eviction, subscription changes, teardown, heartbeats and the
 * shutdown notice.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConnectionManager {

    private final SessionRegistry sessionRegistry;
    private final SubscriptionTable subscriptionTable;
    private final PackageSubscriptionTable packageSubscriptionTable;
    private final OutboundFrameFactory frameFactory;
    private final AppProperties appProperties;
    private final MonitoringConfig.RealtimeMetricsCollector metricsCollector;

    private Disposable heartbeatSubscription;

    @PostConstruct
    public void init() {
        startHeartbeat();
    }

    @PreDestroy
    public void cleanup() {
        log.info("Commencing ConnectionManager graceful shutdown...");

        if (heartbeatSubscription != null && !heartbeatSubscription.isDisposed()) {
            heartbeatSubscription.dispose();
            log.info("Heartbeat task stopped.");
        }

        Collection<Connection> connections = sessionRegistry.allConnections();
        if (connections.isEmpty()) {
            log.info("ConnectionManager cleanup complete. No open connections.");
            return;
        }

        log.info("Sending shutdown notice to {} connected clients...", connections.size());
        deliver(sessionRegistry.allConnectionIds(), frameFactory.shutdown());
        try {
            // Brief delay to allow the notice to reach the sockets
            Thread.sleep(appProperties.getWebsocket().getShutdownNoticeDelay());
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for shutdown notice delivery");
            Thread.currentThread().interrupt();
        }

        connections.forEach(connection -> close(connection, CloseReason.SERVER_SHUTDOWN));
        log.info("ConnectionManager cleanup complete. Closed {} connections.", connections.size());
    }

    /**
     * Registers an authenticated connection, moves it to OPEN and queues the
     * {@code connection_established} frame.
     */
    public Connection open(String connectionId, UserIdentity identity) {
        Connection connection = new Connection(connectionId, identity, appProperties.getWebsocket().getOutboundBufferSize());
        connection.open();
        // Queued before registration so no routed frame can overtake it
        send(connection, frameFactory.connectionEstablished(connection));
        try {
            sessionRegistry.register(connection);
        } catch (RuntimeException e) {
            connection.beginClosing(CloseReason.TRANSPORT_ERROR);
            throw e;
        }
        updateConnectionGauges();

        log.info("Opened connection {} for user {} ({})", connectionId, identity.getUserId(), identity.getRole().getWireName());
        return connection;
    }

    /**
     * Starts the teardown of a connection: completes its outbound stream and drops
     * its subscriptions and registry entries. Idempotent; the first reason wins.
     */
    public void close(Connection connection, CloseReason reason) {
        if (!connection.beginClosing(reason)) {
            return;
        }
        int clearedSubscriptions = subscriptionTable.clear(connection.getId())
                + packageSubscriptionTable.clear(connection.getId());
        sessionRegistry.unregister(connection.getId());
        updateConnectionGauges();

        if (reason.isServerInitiated()) {
            metricsCollector.incrementCounter("courier.realtime.connections.closed", "reason", reason.metricTag());
            log.warn("Closing connection {} for user {}: {} (cleared {} subscriptions)",
                    connection.getId(), connection.getUserId(), reason, clearedSubscriptions);
        } else {
            log.info("Cleanly disconnected connection {} for user {} (cleared {} subscriptions)",
                    connection.getId(), connection.getUserId(), clearedSubscriptions);
        }
    }

    /**
     * Queues one frame on one connection. Never blocks: a full buffer evicts the
     * connection instead.
     *
     * @return true if the frame was queued
     */
    public boolean send(Connection connection, String frame) {
        if (frame == null) {
            return false;
        }
        OfferResult result = connection.offer(frame);
        switch (result) {
            case ACCEPTED -> metricsCollector.incrementCounter("courier.realtime.frames.delivered");
            case OVERFLOW -> {
                metricsCollector.incrementCounter("courier.realtime.frames.dropped", "reason", "overflow");
                log.warn("Outbound buffer of connection {} (user {}) is full ({} frames). Dropping slow consumer.",
                        connection.getId(), connection.getUserId(), connection.getBufferSize());
                close(connection, CloseReason.BUFFER_OVERFLOW);
            }
            case CLOSED -> metricsCollector.incrementCounter("courier.realtime.frames.dropped", "reason", "closed");
        }
        return result == OfferResult.ACCEPTED;
    }

    /**
     * Queues the same frame on every listed connection that is still registered.
     *
     * @return number of connections the frame was queued on
     */
    public int deliver(Collection<String> connectionIds, String frame) {
        if (frame == null || connectionIds.isEmpty()) {
            return 0;
        }
        int delivered = 0;
        for (String connectionId : connectionIds) {
            Optional<Connection> connection = sessionRegistry.find(connectionId);
            if (connection.isPresent() && send(connection.get(), frame)) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * @return true if the subscription is new and the connection is still open
     */
    public boolean subscribe(Connection connection, long deliveryId) {
        boolean added = subscriptionTable.subscribe(connection.getId(), deliveryId);
        // A concurrent close may have cleared the table before the add landed
        if (!connection.isOpen()) {
            subscriptionTable.clear(connection.getId());
            return false;
        }
        log.debug("Connection {} subscribed to delivery {}", connection.getId(), deliveryId);
        return added;
    }

    public boolean unsubscribe(Connection connection, long deliveryId) {
        boolean removed = subscriptionTable.unsubscribe(connection.getId(), deliveryId);
        log.debug("Connection {} unsubscribed from delivery {} (removed={})", connection.getId(), deliveryId, removed);
        return removed;
    }

    /**
     * Package counterpart of {@link #subscribe(Connection, long)}.
     */
    public boolean subscribePackage(Connection connection, long packageId) {
        boolean added = packageSubscriptionTable.subscribe(connection.getId(), packageId);
        if (!connection.isOpen()) {
            packageSubscriptionTable.clear(connection.getId());
            return false;
        }
        log.debug("Connection {} subscribed to package {}", connection.getId(), packageId);
        return added;
    }

    public boolean unsubscribePackage(Connection connection, long packageId) {
        boolean removed = packageSubscriptionTable.unsubscribe(connection.getId(), packageId);
        log.debug("Connection {} unsubscribed from package {} (removed={})", connection.getId(), packageId, removed);
        return removed;
    }

    public ConnectionStats stats() {
        Map<String, Integer> byRole = new LinkedHashMap<>();
        sessionRegistry.countByRole().forEach((role, count) -> byRole.put(role.getWireName(), count));
        return ConnectionStats.builder()
                .instanceId(appProperties.getInstanceId())
                .totalConnections(sessionRegistry.connectionCount())
                .totalUsers(sessionRegistry.userCount())
                .connectionsByRole(byRole)
                .totalDeliverySubscriptions(subscriptionTable.subscriptionCount())
                .totalPackageSubscriptions(packageSubscriptionTable.subscriptionCount())
                .timestamp(OffsetDateTime.now(ZoneOffset.UTC))
                .build();
    }

    public boolean isUserConnected(long userId) {
        return sessionRegistry.isUserConnected(userId);
    }

    private void startHeartbeat() {
        heartbeatSubscription = Flux.interval(Duration.ofMillis(appProperties.getWebsocket().getHeartbeatInterval()), Schedulers.parallel())
            .doOnNext(tick -> {
                try {
                    if (sessionRegistry.connectionCount() == 0) {
                        return;
                    }
                    deliver(sessionRegistry.allConnectionIds(), frameFactory.heartbeat());
                } catch (Exception e) {
                    log.error("Error in heartbeat task: {}", e.getMessage(), e);
                }
            })
            .subscribe();
    }

    private void updateConnectionGauges() {
        metricsCollector.setGauge("courier.realtime.connections.active", sessionRegistry.connectionCount());
        metricsCollector.setGauge("courier.realtime.users.connected", sessionRegistry.userCount());
    }
}
