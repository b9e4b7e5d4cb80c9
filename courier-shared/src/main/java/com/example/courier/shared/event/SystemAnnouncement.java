package com.example.courier.shared.event;

import com.example.courier.shared.model.UserRole;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.Set;

/**
 * Announcement for every connection, or only for connections of the given roles
 * when {@code targetRoles} is not empty.
 */
public record SystemAnnouncement(String message, Set<UserRole> targetRoles, OffsetDateTime occurredAt) implements DomainEvent {

    public SystemAnnouncement {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(occurredAt, "occurredAt");
        targetRoles = targetRoles == null ? Set.of() : Set.copyOf(targetRoles);
    }

    public SystemAnnouncement(String message) {
        this(message, Set.of(), OffsetDateTime.now(ZoneOffset.UTC));
    }

    public SystemAnnouncement(String message, OffsetDateTime occurredAt) {
        this(message, Set.of(), occurredAt);
    }

    public SystemAnnouncement(String message, Set<UserRole> targetRoles) {
        this(message, targetRoles, OffsetDateTime.now(ZoneOffset.UTC));
    }

    public boolean isTargeted() {
        return !targetRoles.isEmpty();
    }

    @Override
    public EventKind kind() {
        return EventKind.SYSTEM_ANNOUNCEMENT;
    }
}
