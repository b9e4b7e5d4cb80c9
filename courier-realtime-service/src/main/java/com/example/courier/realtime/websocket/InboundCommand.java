package com.example.courier.realtime.websocket;

/**
 * A parsed client frame. {@link Ignored} stands for frames that are well formed
 * but carry an unknown type or an unusable argument.
 */
public sealed interface InboundCommand {

    enum Kind {
        SUBSCRIBE_DELIVERY,
        UNSUBSCRIBE_DELIVERY,
        SUBSCRIBE_PACKAGE,
        UNSUBSCRIBE_PACKAGE,
        PING,
        GET_STATS,
        IGNORED
    }

    Kind kind();

    record SubscribeDelivery(long deliveryId) implements InboundCommand {
        @Override
        public Kind kind() {
            return Kind.SUBSCRIBE_DELIVERY;
        }
    }

    record UnsubscribeDelivery(long deliveryId) implements InboundCommand {
        @Override
        public Kind kind() {
            return Kind.UNSUBSCRIBE_DELIVERY;
        }
    }

    record SubscribePackage(long packageId) implements InboundCommand {
        @Override
        public Kind kind() {
            return Kind.SUBSCRIBE_PACKAGE;
        }
    }

    record UnsubscribePackage(long packageId) implements InboundCommand {
        @Override
        public Kind kind() {
            return Kind.UNSUBSCRIBE_PACKAGE;
        }
    }

    record Ping() implements InboundCommand {
        @Override
        public Kind kind() {
            return Kind.PING;
        }
    }

    record GetStats() implements InboundCommand {
        @Override
        public Kind kind() {
            return Kind.GET_STATS;
        }
    }

    record Ignored(String type, String reason) implements InboundCommand {
        @Override
        public Kind kind() {
            return Kind.IGNORED;
        }
    }
}
