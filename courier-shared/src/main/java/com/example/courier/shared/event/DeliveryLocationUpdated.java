package com.example.courier.shared.event;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Objects;

public record DeliveryLocationUpdated(long deliveryId,
                                      double lat,
                                      double lng,
                                      OffsetDateTime occurredAt) implements DomainEvent {

    public DeliveryLocationUpdated {
        Objects.requireNonNull(occurredAt, "occurredAt");
    }

    public DeliveryLocationUpdated(long deliveryId, double lat, double lng) {
        this(deliveryId, lat, lng, OffsetDateTime.now(ZoneOffset.UTC));
    }

    @Override
    public EventKind kind() {
        return EventKind.DELIVERY_LOCATION_UPDATED;
    }
}
