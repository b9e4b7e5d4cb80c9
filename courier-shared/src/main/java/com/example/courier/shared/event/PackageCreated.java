package com.example.courier.shared.event;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;

/**
 * @param eligibleCourierIds couriers that may pick the package up; empty when none are eligible
 */
public record PackageCreated(long packageId,
                             String title,
                             Long senderId,
                             List<Long> eligibleCourierIds,
                             OffsetDateTime occurredAt) implements DomainEvent {

    public PackageCreated {
        eligibleCourierIds = eligibleCourierIds == null ? List.of() : List.copyOf(eligibleCourierIds);
        Objects.requireNonNull(occurredAt, "occurredAt");
    }

    public PackageCreated(long packageId, String title, Long senderId, List<Long> eligibleCourierIds) {
        this(packageId, title, senderId, eligibleCourierIds, OffsetDateTime.now(ZoneOffset.UTC));
    }

    @Override
    public EventKind kind() {
        return EventKind.PACKAGE_CREATED;
    }
}
