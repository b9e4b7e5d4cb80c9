package com.example.courier.realtime.session;

import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Which connections follow which package. Same two-way index as the delivery
 * table, keyed by package id; subscribers receive {@code package_update} frames.
 */
@Component
public class PackageSubscriptionTable {

    private final SubscriptionTable subscriptions = new SubscriptionTable();

    public boolean subscribe(String connectionId, long packageId) {
        return subscriptions.subscribe(connectionId, packageId);
    }

    public boolean unsubscribe(String connectionId, long packageId) {
        return subscriptions.unsubscribe(connectionId, packageId);
    }

    public Set<String> subscribersOf(long packageId) {
        return subscriptions.subscribersOf(packageId);
    }

    public Set<Long> subscriptionsOf(String connectionId) {
        return subscriptions.subscriptionsOf(connectionId);
    }

    public int clear(String connectionId) {
        return subscriptions.clear(connectionId);
    }

    public int subscriptionCount() {
        return subscriptions.subscriptionCount();
    }
}
