package com.example.courier.shared.event;

public enum EventKind {
    PACKAGE_CREATED,
    PACKAGE_STATUS_CHANGED,
    PACKAGE_ASSIGNED,
    DELIVERY_LOCATION_UPDATED,
    SYSTEM_ANNOUNCEMENT
}
