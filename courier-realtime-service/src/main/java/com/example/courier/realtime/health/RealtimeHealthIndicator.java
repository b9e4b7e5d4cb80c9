package com.example.courier.realtime.health;

import com.example.courier.realtime.dto.ConnectionStats;
import com.example.courier.realtime.session.ConnectionManager;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Scheduler;

import java.util.HashMap;
import java.util.Map;

/**
 * Reports live connection counts and whether the event router can still accept work.
 */
@Component
public class RealtimeHealthIndicator implements HealthIndicator {

    private final ConnectionManager connectionManager;
    private final Scheduler routerScheduler;

    public RealtimeHealthIndicator(ConnectionManager connectionManager,
                                   @Qualifier("routerScheduler") Scheduler routerScheduler) {
        this.connectionManager = connectionManager;
        this.routerScheduler = routerScheduler;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        boolean connectionsHealthy = checkConnections(details);
        boolean routerHealthy = !routerScheduler.isDisposed();
        details.put("routerStatus", routerHealthy ? "UP" : "DOWN");

        Health.Builder healthBuilder = connectionsHealthy && routerHealthy ? Health.up() : Health.down();
        return healthBuilder.withDetails(details).build();
    }

    private boolean checkConnections(Map<String, Object> details) {
        try {
            ConnectionStats stats = connectionManager.stats();
            details.put("connections", stats.getTotalConnections());
            details.put("connectedUsers", stats.getTotalUsers());
            details.put("deliverySubscriptions", stats.getTotalDeliverySubscriptions());
            details.put("packageSubscriptions", stats.getTotalPackageSubscriptions());
            details.put("connectionStatus", "UP");
            return true;
        } catch (Exception e) {
            details.put("connectionStatus", "DOWN");
            details.put("connectionError", e.getMessage());
            return false;
        }
    }
}
