package com.example.courier.shared.event;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Objects;

public record PackageAssigned(long packageId,
                              long courierId,
                              Long senderId,
                              OffsetDateTime occurredAt) implements DomainEvent {

    public PackageAssigned {
        Objects.requireNonNull(occurredAt, "occurredAt");
    }

    public PackageAssigned(long packageId, long courierId, Long senderId) {
        this(packageId, courierId, senderId, OffsetDateTime.now(ZoneOffset.UTC));
    }

    @Override
    public EventKind kind() {
        return EventKind.PACKAGE_ASSIGNED;
    }
}
