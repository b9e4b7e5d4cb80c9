package com.example.courier.realtime.session;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SubscriptionTableTest {

    private final SubscriptionTable table = new SubscriptionTable();

    @Test
    void repeatedSubscribeIsIdempotent() {
        assertThat(table.subscribe("c1", 42)).isTrue();
        assertThat(table.subscribe("c1", 42)).isFalse();

        assertThat(table.subscribersOf(42)).containsExactly("c1");
        assertThat(table.subscriptionCount()).isEqualTo(1);
    }

    @Test
    void subscribersReflectTheNetEffectOfASequence() {
        table.subscribe("c1", 42);
        table.subscribe("c2", 42);
        table.subscribe("c1", 43);
        table.unsubscribe("c2", 42);
        table.subscribe("c2", 43);
        table.unsubscribe("c1", 43);

        assertThat(table.subscribersOf(42)).containsExactly("c1");
        assertThat(table.subscribersOf(43)).containsExactly("c2");
        assertThat(table.subscriptionsOf("c1")).containsExactly(42L);
    }

    @Test
    void unsubscribeWithoutSubscriptionIsANoOp() {
        assertThat(table.unsubscribe("c1", 42)).isFalse();

        table.subscribe("c1", 43);
        assertThat(table.unsubscribe("c1", 42)).isFalse();
        assertThat(table.subscribersOf(43)).containsExactly("c1");
    }

    @Test
    void clearRemovesTheConnectionFromEverySubscriberSet() {
        table.subscribe("c1", 42);
        table.subscribe("c1", 43);
        table.subscribe("c2", 43);

        assertThat(table.clear("c1")).isEqualTo(2);

        assertThat(table.subscribersOf(42)).isEmpty();
        assertThat(table.subscribersOf(43)).containsExactly("c2");
        assertThat(table.subscriptionsOf("c1")).isEmpty();
        assertThat(table.clear("c1")).isZero();
    }
}
