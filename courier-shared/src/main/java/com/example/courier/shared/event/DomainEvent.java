package com.example.courier.shared.event;

import java.time.OffsetDateTime;

/**
 * An immutable fact about a package or delivery state change, produced by the
 * service layer after its write commits. Audience fields (sender, courier,
 * recipient, eligible couriers) are supplied by the producer; the router does
 * not look up ownership itself.
 */
public sealed interface DomainEvent
        permits PackageCreated, PackageStatusChanged, PackageAssigned, DeliveryLocationUpdated, SystemAnnouncement {

    EventKind kind();

    OffsetDateTime occurredAt();
}
