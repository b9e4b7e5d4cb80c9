package com.example.courier.shared.event;

/**
 * Entry point used by the package and delivery services once a state change has
 * committed. Implementations must return without waiting for delivery.
 */
public interface DomainEventPublisher {

    void publish(DomainEvent event);
}
