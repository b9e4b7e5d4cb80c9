package com.example.courier.realtime.websocket;

import com.example.courier.realtime.session.Connection;
import com.example.courier.realtime.session.ConnectionManager;
import com.example.courier.shared.model.UserRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Applies client commands to the sending connection and queues the replies on it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class InboundCommandHandler {

    private final InboundCommandParser parser;
    private final ConnectionManager connectionManager;
    private final OutboundFrameFactory frameFactory;

    /**
     * @throws com.example.courier.shared.exception.ProtocolException if the payload is malformed
     */
    public void handle(Connection connection, String payload) {
        InboundCommand command = parser.parse(connection.getId(), payload);
        switch (command.kind()) {
            case SUBSCRIBE_DELIVERY -> {
                long deliveryId = ((InboundCommand.SubscribeDelivery) command).deliveryId();
                connectionManager.subscribe(connection, deliveryId);
                connectionManager.send(connection, frameFactory.deliverySubscribed(deliveryId));
            }
            case UNSUBSCRIBE_DELIVERY -> {
                long deliveryId = ((InboundCommand.UnsubscribeDelivery) command).deliveryId();
                connectionManager.unsubscribe(connection, deliveryId);
                connectionManager.send(connection, frameFactory.deliveryUnsubscribed(deliveryId));
            }
            case SUBSCRIBE_PACKAGE -> {
                long packageId = ((InboundCommand.SubscribePackage) command).packageId();
                connectionManager.subscribePackage(connection, packageId);
                connectionManager.send(connection, frameFactory.packageSubscribed(packageId));
            }
            case UNSUBSCRIBE_PACKAGE -> {
                long packageId = ((InboundCommand.UnsubscribePackage) command).packageId();
                connectionManager.unsubscribePackage(connection, packageId);
                connectionManager.send(connection, frameFactory.packageUnsubscribed(packageId));
            }
            case PING -> connectionManager.send(connection, frameFactory.pong());
            case GET_STATS -> {
                if (connection.getRole() == UserRole.ADMIN) {
                    connectionManager.send(connection, frameFactory.stats(connectionManager.stats()));
                } else {
                    connectionManager.send(connection, frameFactory.error("Insufficient permissions"));
                }
            }
            case IGNORED -> {
                InboundCommand.Ignored ignored = (InboundCommand.Ignored) command;
                log.warn("Ignoring '{}' frame from connection {} (user {}): {}",
                        ignored.type(), connection.getId(), connection.getUserId(), ignored.reason());
            }
        }
    }
}
