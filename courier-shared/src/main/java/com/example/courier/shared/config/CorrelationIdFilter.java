package com.example.courier.shared.config;

import com.example.courier.shared.util.Constants;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Tags every request, WebSocket upgrades included, with a correlation id. Browsers
 * cannot set headers on an upgrade, so the {@code correlation_id} query parameter
 * is accepted as well. The id is echoed in the response header, kept as an
 * exchange attribute (copied into the WebSocket session) and written to the
 * Reactor context and the MDC.
 */
@Component
public class CorrelationIdFilter implements WebFilter {

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String correlationId = resolve(exchange);

        exchange.getResponse().getHeaders().set(Constants.CORRELATION_ID_HEADER, correlationId);
        exchange.getAttributes().put(Constants.CORRELATION_ID_KEY, correlationId);
        MDC.put(Constants.CORRELATION_ID_KEY, correlationId);
        return chain.filter(exchange)
                .contextWrite(context -> context.put(Constants.CORRELATION_ID_KEY, correlationId))
                .doFinally(signalType -> MDC.remove(Constants.CORRELATION_ID_KEY));
    }

    private String resolve(ServerWebExchange exchange) {
        String fromHeader = exchange.getRequest().getHeaders().getFirst(Constants.CORRELATION_ID_HEADER);
        if (StringUtils.hasText(fromHeader)) {
            return fromHeader;
        }
        String fromQuery = exchange.getRequest().getQueryParams().getFirst(Constants.CORRELATION_ID_KEY);
        if (StringUtils.hasText(fromQuery)) {
            return fromQuery;
        }
        return UUID.randomUUID().toString();
    }
}
