package com.example.courier.realtime.websocket;

import com.example.courier.realtime.dto.ConnectionStats;
import com.example.courier.realtime.session.Connection;
import com.example.courier.shared.util.Constants.OutboundType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the JSON text frames sent to clients:
 * {@code {"type": "<kind>", ...fields, "timestamp": "<ISO-8601>"}}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboundFrameFactory {

    private final ObjectMapper objectMapper;

    /**
     * Generic method to create any outbound frame.
     * @param type The frame kind written to the "type" field.
     * @param fields Payload fields in wire (snake_case) naming; null values are kept.
     * @param timestamp Written as the trailing "timestamp" field.
     * @return The serialized frame, or null if serialization fails.
     */
    public String createFrame(OutboundType type, Map<String, Object> fields, OffsetDateTime timestamp) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", type.getWireName());
        frame.putAll(fields);
        frame.put("timestamp", timestamp.toString());
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            log.error("Error serializing payload for frame type {}: {}", type, e.getMessage());
            return null;
        }
    }

    public String createFrame(OutboundType type, Map<String, Object> fields) {
        return createFrame(type, fields, now());
    }

    public String connectionEstablished(Connection connection) {
        return createFrame(OutboundType.CONNECTION_ESTABLISHED, fields(
                "message", "Connected to real-time updates",
                "connection_id", connection.getId(),
                "user_id", connection.getUserId(),
                "role", connection.getRole().getWireName()));
    }

    public String heartbeat() {
        return createFrame(OutboundType.HEARTBEAT, Map.of());
    }

    public String pong() {
        return createFrame(OutboundType.PONG, Map.of());
    }

    public String deliverySubscribed(long deliveryId) {
        return createFrame(OutboundType.DELIVERY_SUBSCRIBED, fields(
                "delivery_id", deliveryId,
                "message", "Subscribed to delivery " + deliveryId + " location updates"));
    }

    public String deliveryUnsubscribed(long deliveryId) {
        return createFrame(OutboundType.DELIVERY_UNSUBSCRIBED, fields(
                "delivery_id", deliveryId,
                "message", "Unsubscribed from delivery " + deliveryId + " updates"));
    }

    public String packageSubscribed(long packageId) {
        return createFrame(OutboundType.PACKAGE_SUBSCRIBED, fields(
                "package_id", packageId,
                "message", "Subscribed to package " + packageId + " updates"));
    }

    public String packageUnsubscribed(long packageId) {
        return createFrame(OutboundType.PACKAGE_UNSUBSCRIBED, fields(
                "package_id", packageId,
                "message", "Unsubscribed from package " + packageId + " updates"));
    }

    public String error(String message) {
        return createFrame(OutboundType.ERROR, fields("message", message));
    }

    public String stats(ConnectionStats stats) {
        Map<String, Object> data = fields(
                "total_connections", stats.getTotalConnections(),
                "total_users", stats.getTotalUsers(),
                "connections_by_role", stats.getConnectionsByRole(),
                "total_delivery_subscriptions", stats.getTotalDeliverySubscriptions(),
                "total_package_subscriptions", stats.getTotalPackageSubscriptions());
        return createFrame(OutboundType.STATS, fields("data", data));
    }

    public String shutdown() {
        return createFrame(OutboundType.SERVER_SHUTDOWN, fields(
                "message", "Server is shutting down. Please reconnect momentarily."));
    }

    /**
     * Ordered field map from alternating name/value arguments. Unlike Map.of it
     * accepts null values, which the wire format keeps as JSON null.
     */
    public static Map<String, Object> fields(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected name/value pairs");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            fields.put((String) namesAndValues[i], namesAndValues[i + 1]);
        }
        return fields;
    }

    private static OffsetDateTime now() {
        return OffsetDateTime.now(ZoneOffset.UTC);
    }
}
