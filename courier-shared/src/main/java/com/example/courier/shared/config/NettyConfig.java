package com.example.courier.shared.config;

import com.example.courier.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.embedded.netty.NettyReactiveWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.config.WebFluxConfigurer;
import org.springframework.web.reactive.socket.server.WebSocketService;
import org.springframework.web.reactive.socket.server.support.HandshakeWebSocketService;
import org.springframework.web.reactive.socket.server.upgrade.ReactorNettyRequestUpgradeStrategy;
import reactor.netty.http.server.WebsocketServerSpec;
import reactor.netty.resources.LoopResources;

/**
 * Reactor Netty setup for the real-time endpoint: named event loops, the inbound
 * frame size limit, and the handshake attributes carried into each session.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class NettyConfig implements WebFluxConfigurer {

    private final AppProperties appProperties;

    @Bean
    public WebServerFactoryCustomizer<NettyReactiveWebServerFactory> nettyWebServerCustomizer() {
        return factory -> {
            String threadPrefix = appProperties.getService().getName() + "-io";
            LoopResources loopResources = LoopResources.create(threadPrefix, LoopResources.DEFAULT_IO_WORKER_COUNT, true);
            factory.addServerCustomizers(server -> server.runOn(loopResources));
            log.info("Netty event loops named '{}'", threadPrefix);
        };
    }

    @Override
    public WebSocketService getWebSocketService() {
        int maxFramePayloadLength = appProperties.getWebsocket().getMaxFramePayloadLength();
        // Oversized client frames are refused by Netty before they reach the command parser
        ReactorNettyRequestUpgradeStrategy upgradeStrategy = new ReactorNettyRequestUpgradeStrategy(
                () -> WebsocketServerSpec.builder().maxFramePayloadLength(maxFramePayloadLength));
        HandshakeWebSocketService service = new HandshakeWebSocketService(upgradeStrategy);
        service.setSessionAttributePredicate(Constants.CORRELATION_ID_KEY::equals);
        log.info("WebSocket frames limited to {} bytes", maxFramePayloadLength);
        return service;
    }
}
