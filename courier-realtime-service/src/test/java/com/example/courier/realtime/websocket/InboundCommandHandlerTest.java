package com.example.courier.realtime.websocket;

import com.example.courier.realtime.RealtimeTestFixtures;
import com.example.courier.realtime.session.Connection;
import com.example.courier.shared.exception.ProtocolException;
import com.example.courier.shared.model.UserRole;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InboundCommandHandlerTest {

    private final RealtimeTestFixtures fixtures = new RealtimeTestFixtures();
    private final InboundCommandHandler handler = new InboundCommandHandler(
            new InboundCommandParser(fixtures.objectMapper), fixtures.connectionManager, fixtures.frameFactory);

    @Test
    void subscribeAndUnsubscribeAreAppliedAndAcknowledged() {
        Connection connection = fixtures.connect(7, UserRole.COURIER);

        handler.handle(connection, "{\"type\":\"subscribe_delivery\",\"delivery_id\":42}");
        assertThat(fixtures.subscriptionTable.subscribersOf(42)).containsExactly(connection.getId());

        handler.handle(connection, "{\"type\":\"unsubscribe_delivery\",\"delivery_id\":42}");
        assertThat(fixtures.subscriptionTable.subscribersOf(42)).isEmpty();

        List<JsonNode> frames = fixtures.drain(connection);
        assertThat(fixtures.types(frames))
                .containsExactly("connection_established", "delivery_subscribed", "delivery_unsubscribed");
        assertThat(frames.get(1).get("delivery_id").asLong()).isEqualTo(42);
    }

    @Test
    void packageSubscriptionsAreAppliedAcknowledgedAndClearedOnClose() {
        Connection connection = fixtures.connect(20, UserRole.SENDER);

        handler.handle(connection, "{\"type\":\"subscribe_package\",\"package_id\":100}");
        handler.handle(connection, "{\"type\":\"subscribe_package\",\"package_id\":101}");
        handler.handle(connection, "{\"type\":\"unsubscribe_package\",\"package_id\":101}");
        assertThat(fixtures.packageSubscriptionTable.subscribersOf(100)).containsExactly(connection.getId());
        assertThat(fixtures.packageSubscriptionTable.subscribersOf(101)).isEmpty();
        assertThat(fixtures.connectionManager.stats().getTotalPackageSubscriptions()).isEqualTo(1);

        List<JsonNode> frames = fixtures.drain(connection);
        assertThat(fixtures.types(frames)).containsExactly("connection_established",
                "package_subscribed", "package_subscribed", "package_unsubscribed");
        assertThat(frames.get(1).get("package_id").asLong()).isEqualTo(100);
        assertThat(fixtures.packageSubscriptionTable.subscriptionCount()).isZero();
    }

    @Test
    void pingIsAnsweredWithPong() {
        Connection connection = fixtures.connect(7, UserRole.COURIER);

        handler.handle(connection, "{\"type\":\"ping\"}");

        assertThat(fixtures.types(fixtures.drain(connection))).containsExactly("connection_established", "pong");
    }

    @Test
    void statsAreOnlyForAdmins() {
        Connection admin = fixtures.connect(1, UserRole.ADMIN);
        Connection courier = fixtures.connect(7, UserRole.COURIER);

        handler.handle(admin, "{\"type\":\"get_stats\"}");
        handler.handle(courier, "{\"type\":\"get_stats\"}");

        JsonNode stats = fixtures.drain(admin).get(1);
        assertThat(stats.get("type").asText()).isEqualTo("stats");
        assertThat(stats.get("data").get("total_connections").asInt()).isEqualTo(2);
        assertThat(stats.get("data").get("connections_by_role").get("courier").asInt()).isEqualTo(1);
        JsonNode error = fixtures.drain(courier).get(1);
        assertThat(error.get("type").asText()).isEqualTo("error");
        assertThat(error.get("message").asText()).isEqualTo("Insufficient permissions");
    }

    @Test
    void unknownCommandsProduceNoReply() {
        Connection connection = fixtures.connect(7, UserRole.COURIER);

        handler.handle(connection, "{\"type\":\"dance\"}");
        handler.handle(connection, "{\"type\":\"subscribe_delivery\",\"delivery_id\":\"x\"}");

        assertThat(connection.isOpen()).isTrue();
        assertThat(fixtures.subscriptionTable.subscriptionCount()).isZero();
        assertThat(fixtures.types(fixtures.drain(connection))).containsExactly("connection_established");
    }

    @Test
    void malformedPayloadPropagatesAsProtocolError() {
        Connection connection = fixtures.connect(7, UserRole.COURIER);

        assertThatThrownBy(() -> handler.handle(connection, "{oops"))
                .isInstanceOf(ProtocolException.class);
    }
}
