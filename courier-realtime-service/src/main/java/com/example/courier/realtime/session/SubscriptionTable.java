package com.example.courier.realtime.session;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Which connections want updates for which delivery. Kept as a forward
 * index (delivery → connections) for routing and a reverse index
 * (connection → deliveries) so teardown only touches that connection's entries.
 *
 * <p>Both indexes change together under one lock.
 */
@Component
@Slf4j
public class SubscriptionTable {

    private final Object lock = new Object();
    private final Map<Long, Set<String>> subscribersByDelivery = new HashMap<>();
    private final Map<String, Set<Long>> deliveriesByConnection = new HashMap<>();

    /**
     * @return false if the subscription already existed
     */
    public boolean subscribe(String connectionId, long deliveryId) {
        synchronized (lock) {
            boolean added = deliveriesByConnection.computeIfAbsent(connectionId, id -> new HashSet<>()).add(deliveryId);
            if (added) {
                subscribersByDelivery.computeIfAbsent(deliveryId, id -> new HashSet<>()).add(connectionId);
            }
            return added;
        }
    }

    /**
     * @return false if there was nothing to remove
     */
    public boolean unsubscribe(String connectionId, long deliveryId) {
        synchronized (lock) {
            Set<Long> deliveries = deliveriesByConnection.get(connectionId);
            if (deliveries == null || !deliveries.remove(deliveryId)) {
                return false;
            }
            if (deliveries.isEmpty()) {
                deliveriesByConnection.remove(connectionId);
            }
            removeSubscriber(deliveryId, connectionId);
            return true;
        }
    }

    public Set<String> subscribersOf(long deliveryId) {
        synchronized (lock) {
            Set<String> subscribers = subscribersByDelivery.get(deliveryId);
            return subscribers == null ? Set.of() : Set.copyOf(subscribers);
        }
    }

    public Set<Long> subscriptionsOf(String connectionId) {
        synchronized (lock) {
            Set<Long> deliveries = deliveriesByConnection.get(connectionId);
            return deliveries == null ? Set.of() : Set.copyOf(deliveries);
        }
    }

    /**
     * Drops every subscription owned by the connection.
     *
     * @return number of subscriptions removed
     */
    public int clear(String connectionId) {
        synchronized (lock) {
            Set<Long> deliveries = deliveriesByConnection.remove(connectionId);
            if (deliveries == null) {
                return 0;
            }
            for (Long deliveryId : deliveries) {
                removeSubscriber(deliveryId, connectionId);
            }
            log.debug("Cleared {} subscriptions of connection {}", deliveries.size(), connectionId);
            return deliveries.size();
        }
    }

    public int subscriptionCount() {
        synchronized (lock) {
            return deliveriesByConnection.values().stream().mapToInt(Set::size).sum();
        }
    }

    private void removeSubscriber(long deliveryId, String connectionId) {
        Set<String> subscribers = subscribersByDelivery.get(deliveryId);
        if (subscribers != null) {
            subscribers.remove(connectionId);
            if (subscribers.isEmpty()) {
                subscribersByDelivery.remove(deliveryId);
            }
        }
    }
}
