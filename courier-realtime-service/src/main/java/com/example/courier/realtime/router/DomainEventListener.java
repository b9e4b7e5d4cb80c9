package com.example.courier.realtime.router;

import com.example.courier.shared.aspect.Monitored;
import com.example.courier.shared.event.DomainEvent;
import com.example.courier.shared.event.DomainEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Bridges domain events published through Spring's ApplicationEventPublisher into
 * the router. Inside a transaction the event is forwarded only after commit, so
 * clients never see a change that was rolled back.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DomainEventListener {

    private final DomainEventPublisher domainEventPublisher;

    @Monitored("event-listener")
    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handleDomainEvent(DomainEvent event) {
        log.debug("Forwarding committed {} event to the router.", event.kind());
        domainEventPublisher.publish(event);
    }
}
