package com.example.courier.shared.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum UserRole {
    ADMIN("admin"),
    COURIER("courier"),
    SENDER("sender"),
    RECIPIENT("recipient");

    private final String wireName;

    UserRole(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static Optional<UserRole> fromWireName(String value) {
        return Arrays.stream(values())
                .filter(role -> role.wireName.equalsIgnoreCase(value) || role.name().equalsIgnoreCase(value))
                .findFirst();
    }
}
