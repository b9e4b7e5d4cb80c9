package com.example.courier.realtime.router;

import com.example.courier.realtime.session.ConnectionManager;
import com.example.courier.realtime.session.PackageSubscriptionTable;
import com.example.courier.realtime.session.SessionRegistry;
import com.example.courier.realtime.session.SubscriptionTable;
import com.example.courier.realtime.websocket.OutboundFrameFactory;
import com.example.courier.shared.config.MonitoringConfig;
import com.example.courier.shared.event.DeliveryLocationUpdated;
import com.example.courier.shared.event.DomainEvent;
import com.example.courier.shared.event.DomainEventPublisher;
import com.example.courier.shared.event.PackageAssigned;
import com.example.courier.shared.event.PackageCreated;
import com.example.courier.shared.event.PackageStatusChanged;
import com.example.courier.shared.event.SystemAnnouncement;
import com.example.courier.shared.model.UserRole;
import com.example.courier.shared.util.Constants.OutboundType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.scheduler.Scheduler;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

import static com.example.courier.realtime.websocket.OutboundFrameFactory.fields;

/**
 * Maps each domain event to its audience and fans one serialized frame out to
 * every matching connection.
 *
 * <p>{@link #publish(DomainEvent)} only enqueues: routing runs on a single worker
 * so events reach each connection in the order they were published, and the
 * producer never waits on a socket.
 */
@Service
@Slf4j
public class EventRouter implements DomainEventPublisher {

    private final ConnectionManager connectionManager;
    private final SessionRegistry sessionRegistry;
    private final SubscriptionTable subscriptionTable;
    private final PackageSubscriptionTable packageSubscriptionTable;
    private final OutboundFrameFactory frameFactory;
    private final MonitoringConfig.RealtimeMetricsCollector metricsCollector;
    private final Scheduler routerScheduler;

    public EventRouter(ConnectionManager connectionManager,
                       SessionRegistry sessionRegistry,
                       SubscriptionTable subscriptionTable,
                       PackageSubscriptionTable packageSubscriptionTable,
                       OutboundFrameFactory frameFactory,
                       MonitoringConfig.RealtimeMetricsCollector metricsCollector,
                       @Qualifier("routerScheduler") Scheduler routerScheduler) {
        this.connectionManager = connectionManager;
        this.sessionRegistry = sessionRegistry;
        this.subscriptionTable = subscriptionTable;
        this.packageSubscriptionTable = packageSubscriptionTable;
        this.frameFactory = frameFactory;
        this.metricsCollector = metricsCollector;
        this.routerScheduler = routerScheduler;
    }

    @Override
    public void publish(DomainEvent event) {
        if (event == null) {
            return;
        }
        routerScheduler.schedule(() -> routeSafely(event));
    }

    /**
     * Routes synchronously on the calling thread.
     *
     * @return number of connections the frame was queued on
     */
    public int route(DomainEvent event) {
        long start = System.currentTimeMillis();
        int delivered = switch (event.kind()) {
            case PACKAGE_CREATED -> routePackageCreated((PackageCreated) event);
            case PACKAGE_STATUS_CHANGED -> routeStatusChanged((PackageStatusChanged) event);
            case PACKAGE_ASSIGNED -> routeAssigned((PackageAssigned) event);
            case DELIVERY_LOCATION_UPDATED -> routeLocation((DeliveryLocationUpdated) event);
            case SYSTEM_ANNOUNCEMENT -> routeAnnouncement((SystemAnnouncement) event);
        };
        metricsCollector.recordTimer("courier.realtime.route.latency", System.currentTimeMillis() - start,
                "kind", event.kind().name().toLowerCase(Locale.ROOT));
        log.debug("Routed {} to {} connections", event.kind(), delivered);
        return delivered;
    }

    private void routeSafely(DomainEvent event) {
        try {
            route(event);
        } catch (Exception e) {
            log.error("Failed to route {} event: {}", event.kind(), e.getMessage(), e);
        }
    }

    private int routePackageCreated(PackageCreated event) {
        Set<String> targets = new LinkedHashSet<>(sessionRegistry.connectionsForRole(UserRole.ADMIN));
        for (Long courierId : event.eligibleCourierIds()) {
            sessionRegistry.connectionsForUser(courierId).stream()
                    .filter(this::isCourierConnection)
                    .forEach(targets::add);
        }
        String frame = frameFactory.createFrame(OutboundType.PACKAGE_CREATED, fields(
                "package_id", event.packageId(),
                "title", event.title(),
                "sender_id", event.senderId(),
                "message", "New package available for pickup: " + event.title()), event.occurredAt());
        return connectionManager.deliver(targets, frame);
    }

    private int routeStatusChanged(PackageStatusChanged event) {
        Set<String> targets = new LinkedHashSet<>();
        addUser(targets, event.senderId());
        addUser(targets, event.courierId());
        addUser(targets, event.recipientId());
        targets.addAll(sessionRegistry.connectionsForRole(UserRole.ADMIN));
        String frame = frameFactory.createFrame(OutboundType.PACKAGE_STATUS_UPDATED, fields(
                "package_id", event.packageId(),
                "old_status", event.oldStatus().getWireName(),
                "new_status", event.newStatus().getWireName(),
                "message", "Package " + event.packageId() + " status changed from "
                        + event.oldStatus().getWireName() + " to " + event.newStatus().getWireName()), event.occurredAt());
        int delivered = connectionManager.deliver(targets, frame);
        delivered += routePackageUpdate(event);
        delivered += routeStatusFollowUp(event);
        return delivered;
    }

    /**
     * Package subscribers get the change whether or not they are a participant.
     */
    private int routePackageUpdate(PackageStatusChanged event) {
        Set<String> subscribers = packageSubscriptionTable.subscribersOf(event.packageId());
        if (subscribers.isEmpty()) {
            return 0;
        }
        String frame = frameFactory.createFrame(OutboundType.PACKAGE_UPDATE, fields(
                "package_id", event.packageId(),
                "update_type", "status_updated",
                "old_status", event.oldStatus().getWireName(),
                "new_status", event.newStatus().getWireName()), event.occurredAt());
        return connectionManager.deliver(subscribers, frame);
    }

    private int routeStatusFollowUp(PackageStatusChanged event) {
        Set<String> targets = new LinkedHashSet<>();
        OutboundType type;
        String message;
        switch (event.newStatus()) {
            case PICKED_UP -> {
                type = OutboundType.PACKAGE_PICKED_UP;
                message = "Your package " + event.packageId() + " has been picked up";
                addUser(targets, event.senderId());
            }
            case DELIVERED -> {
                type = OutboundType.PACKAGE_DELIVERED;
                message = "Your package " + event.packageId() + " has been delivered successfully";
                addUser(targets, event.senderId());
            }
            case FAILED -> {
                type = OutboundType.DELIVERY_FAILED;
                message = "Delivery failed for package " + event.packageId();
                addUser(targets, event.senderId());
                addUser(targets, event.courierId());
            }
            default -> {
                return 0;
            }
        }
        if (targets.isEmpty()) {
            return 0;
        }
        String frame = frameFactory.createFrame(type, fields(
                "package_id", event.packageId(),
                "message", message), event.occurredAt());
        return connectionManager.deliver(targets, frame);
    }

    private int routeAssigned(PackageAssigned event) {
        Set<String> courierTargets = sessionRegistry.connectionsForUser(event.courierId());
        String courierFrame = frameFactory.createFrame(OutboundType.PACKAGE_ASSIGNED_TO_YOU, fields(
                "package_id", event.packageId(),
                "message", "Package " + event.packageId() + " has been assigned to you"), event.occurredAt());
        int delivered = connectionManager.deliver(courierTargets, courierFrame);

        if (event.senderId() != null) {
            Set<String> senderTargets = new LinkedHashSet<>(sessionRegistry.connectionsForUser(event.senderId()));
            senderTargets.removeAll(courierTargets);
            String senderFrame = frameFactory.createFrame(OutboundType.PACKAGE_ASSIGNED, fields(
                    "package_id", event.packageId(),
                    "courier_id", event.courierId(),
                    "message", "A courier has been assigned to package " + event.packageId()), event.occurredAt());
            delivered += connectionManager.deliver(senderTargets, senderFrame);
        }
        return delivered;
    }

    private int routeLocation(DeliveryLocationUpdated event) {
        Set<String> targets = subscriptionTable.subscribersOf(event.deliveryId());
        if (targets.isEmpty()) {
            return 0;
        }
        String frame = frameFactory.createFrame(OutboundType.DELIVERY_LOCATION, fields(
                "delivery_id", event.deliveryId(),
                "lat", event.lat(),
                "lng", event.lng()), event.occurredAt());
        return connectionManager.deliver(targets, frame);
    }

    private int routeAnnouncement(SystemAnnouncement event) {
        Set<String> targets;
        if (event.isTargeted()) {
            targets = new LinkedHashSet<>();
            for (UserRole role : event.targetRoles()) {
                targets.addAll(sessionRegistry.connectionsForRole(role));
            }
        } else {
            targets = sessionRegistry.allConnectionIds();
        }
        String frame = frameFactory.createFrame(OutboundType.SYSTEM_ANNOUNCEMENT,
                fields("message", event.message()), event.occurredAt());
        return connectionManager.deliver(targets, frame);
    }

    private void addUser(Set<String> targets, Long userId) {
        if (userId != null) {
            targets.addAll(sessionRegistry.connectionsForUser(userId));
        }
    }

    private boolean isCourierConnection(String connectionId) {
        return sessionRegistry.find(connectionId)
                .map(connection -> connection.getRole() == UserRole.COURIER)
                .orElse(false);
    }
}
