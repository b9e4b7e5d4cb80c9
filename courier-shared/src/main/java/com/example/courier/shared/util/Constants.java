package com.example.courier.shared.util;

import java.util.Arrays;
import java.util.Optional;

public final class Constants {

    // Private constructor to prevent instantiation
    private Constants() {}

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_KEY = "correlation_id";

    /**
     * Frame types pushed from the server to connected clients.
     */
    public enum OutboundType {
        CONNECTION_ESTABLISHED("connection_established"),
        PACKAGE_CREATED("package_created"),
        PACKAGE_STATUS_UPDATED("package_status_updated"),
        PACKAGE_ASSIGNED_TO_YOU("package_assigned_to_you"),
        PACKAGE_ASSIGNED("package_assigned"),
        PACKAGE_UPDATE("package_update"),
        PACKAGE_PICKED_UP("package_picked_up"),
        PACKAGE_DELIVERED("package_delivered"),
        DELIVERY_FAILED("delivery_failed"),
        DELIVERY_LOCATION("delivery_location"),
        SYSTEM_ANNOUNCEMENT("system_announcement"),
        DELIVERY_SUBSCRIBED("delivery_subscribed"),
        DELIVERY_UNSUBSCRIBED("delivery_unsubscribed"),
        PACKAGE_SUBSCRIBED("package_subscribed"),
        PACKAGE_UNSUBSCRIBED("package_unsubscribed"),
        HEARTBEAT("heartbeat"),
        PONG("pong"),
        STATS("stats"),
        ERROR("error"),
        SERVER_SHUTDOWN("server_shutdown");

        private final String wireName;

        OutboundType(String wireName) {
            this.wireName = wireName;
        }

        public String getWireName() {
            return wireName;
        }
    }

    /**
     * Command types a client may send over its connection.
     */
    public enum InboundType {
        SUBSCRIBE_DELIVERY("subscribe_delivery"),
        UNSUBSCRIBE_DELIVERY("unsubscribe_delivery"),
        SUBSCRIBE_PACKAGE("subscribe_package"),
        UNSUBSCRIBE_PACKAGE("unsubscribe_package"),
        PING("ping"),
        GET_STATS("get_stats");

        private final String wireName;

        InboundType(String wireName) {
            this.wireName = wireName;
        }

        public String getWireName() {
            return wireName;
        }

        public static Optional<InboundType> fromWireName(String value) {
            return Arrays.stream(values()).filter(type -> type.wireName.equals(value)).findFirst();
        }
    }
}
