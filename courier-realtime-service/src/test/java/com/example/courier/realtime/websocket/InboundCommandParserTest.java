package com.example.courier.realtime.websocket;

import com.example.courier.shared.exception.ProtocolException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InboundCommandParserTest {

    private final InboundCommandParser parser = new InboundCommandParser(new ObjectMapper());

    @Test
    void parsesDeliverySubscriptions() {
        assertThat(parser.parse("c1", "{\"type\":\"subscribe_delivery\",\"delivery_id\":42}"))
                .isEqualTo(new InboundCommand.SubscribeDelivery(42));
        assertThat(parser.parse("c1", "{\"type\":\"unsubscribe_delivery\",\"delivery_id\":\"42\"}"))
                .isEqualTo(new InboundCommand.UnsubscribeDelivery(42));
    }

    @Test
    void parsesPackageSubscriptions() {
        assertThat(parser.parse("c1", "{\"type\":\"subscribe_package\",\"package_id\":5}"))
                .isEqualTo(new InboundCommand.SubscribePackage(5));
        assertThat(parser.parse("c1", "{\"type\":\"unsubscribe_package\",\"package_id\":5}"))
                .isEqualTo(new InboundCommand.UnsubscribePackage(5));
    }

    @Test
    void packageCommandWithoutPackageIdIsIgnored() {
        InboundCommand command = parser.parse("c1", "{\"type\":\"subscribe_package\",\"delivery_id\":5}");

        assertThat(command).isEqualTo(new InboundCommand.Ignored("subscribe_package", "Missing or non-integer package_id"));
    }

    @Test
    void parsesCommandsWithoutArguments() {
        assertThat(parser.parse("c1", "{\"type\":\"ping\"}").kind()).isEqualTo(InboundCommand.Kind.PING);
        assertThat(parser.parse("c1", "{\"type\":\"get_stats\"}").kind()).isEqualTo(InboundCommand.Kind.GET_STATS);
    }

    @Test
    void unknownTypeIsIgnoredNotFatal() {
        InboundCommand command = parser.parse("c1", "{\"type\":\"track_courier\",\"courier_id\":7}");

        assertThat(command).isInstanceOf(InboundCommand.Ignored.class);
        assertThat(((InboundCommand.Ignored) command).type()).isEqualTo("track_courier");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"type\":\"subscribe_delivery\"}",
            "{\"type\":\"subscribe_delivery\",\"delivery_id\":4.5}",
            "{\"type\":\"subscribe_delivery\",\"delivery_id\":\"abc\"}"
    })
    void unusableDeliveryIdIsIgnored(String payload) {
        assertThat(parser.parse("c1", payload).kind()).isEqualTo(InboundCommand.Kind.IGNORED);
    }

    @ParameterizedTest
    @ValueSource(strings = {"not json", "[1,2,3]", "{\"delivery_id\":42}", "{\"type\":7}", ""})
    void malformedFramesRaiseProtocolErrors(String payload) {
        assertThatThrownBy(() -> parser.parse("c1", payload))
                .isInstanceOf(ProtocolException.class)
                .extracting("connectionId").isEqualTo("c1");
    }
}
