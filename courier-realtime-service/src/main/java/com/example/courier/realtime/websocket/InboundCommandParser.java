package com.example.courier.realtime.websocket;

import com.example.courier.shared.exception.ProtocolException;
import com.example.courier.shared.util.Constants.InboundType;
import com.example.courier.shared.util.JsonUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Turns a client text frame into an {@link InboundCommand}.
 */
@Component
@RequiredArgsConstructor
public class InboundCommandParser {

    private final ObjectMapper objectMapper;

    /**
     * @throws ProtocolException if the payload is not a JSON object with a string {@code type}
     */
    public InboundCommand parse(String connectionId, String payload) {
        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Invalid JSON from connection " + connectionId, connectionId, e);
        }
        if (node == null || !node.isObject()) {
            throw new ProtocolException("Frame from connection " + connectionId + " is not a JSON object", connectionId);
        }
        String type = JsonUtils.readText(node, "type");
        if (type == null) {
            throw new ProtocolException("Frame from connection " + connectionId + " has no string type", connectionId);
        }

        Optional<InboundType> inboundType = InboundType.fromWireName(type);
        if (inboundType.isEmpty()) {
            return new InboundCommand.Ignored(type, "Unknown message type");
        }
        return switch (inboundType.get()) {
            case SUBSCRIBE_DELIVERY -> withId(node, type, "delivery_id", InboundCommand.SubscribeDelivery::new);
            case UNSUBSCRIBE_DELIVERY -> withId(node, type, "delivery_id", InboundCommand.UnsubscribeDelivery::new);
            case SUBSCRIBE_PACKAGE -> withId(node, type, "package_id", InboundCommand.SubscribePackage::new);
            case UNSUBSCRIBE_PACKAGE -> withId(node, type, "package_id", InboundCommand.UnsubscribePackage::new);
            case PING -> new InboundCommand.Ping();
            case GET_STATS -> new InboundCommand.GetStats();
        };
    }

    private InboundCommand withId(JsonNode node, String type, String field, IdCommandFactory factory) {
        OptionalLong id = JsonUtils.readLong(node, field);
        if (id.isEmpty()) {
            return new InboundCommand.Ignored(type, "Missing or non-integer " + field);
        }
        return factory.create(id.getAsLong());
    }

    @FunctionalInterface
    private interface IdCommandFactory {
        InboundCommand create(long id);
    }
}
