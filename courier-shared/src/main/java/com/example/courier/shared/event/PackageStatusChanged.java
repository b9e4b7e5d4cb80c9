package com.example.courier.shared.event;

import com.example.courier.shared.model.PackageStatus;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Objects;

public record PackageStatusChanged(long packageId,
                                   PackageStatus oldStatus,
                                   PackageStatus newStatus,
                                   Long senderId,
                                   Long courierId,
                                   Long recipientId,
                                   OffsetDateTime occurredAt) implements DomainEvent {

    public PackageStatusChanged {
        Objects.requireNonNull(oldStatus, "oldStatus");
        Objects.requireNonNull(newStatus, "newStatus");
        Objects.requireNonNull(occurredAt, "occurredAt");
    }

    public PackageStatusChanged(long packageId, PackageStatus oldStatus, PackageStatus newStatus,
                                Long senderId, Long courierId, Long recipientId) {
        this(packageId, oldStatus, newStatus, senderId, courierId, recipientId, OffsetDateTime.now(ZoneOffset.UTC));
    }

    @Override
    public EventKind kind() {
        return EventKind.PACKAGE_STATUS_CHANGED;
    }
}
