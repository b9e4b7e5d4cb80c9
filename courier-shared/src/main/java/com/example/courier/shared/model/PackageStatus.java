package com.example.courier.shared.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle states of a package as reported by the package service.
 */
public enum PackageStatus {
    CREATED("created"),
    ASSIGNED("assigned"),
    PICKED_UP("picked_up"),
    IN_TRANSIT("in_transit"),
    DELIVERED("delivered"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String wireName;

    PackageStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
