package com.example.courier.shared.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Verified identity of the user behind a live connection. Supplied by the
 * credential verifier; the broadcaster only reads it.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class UserIdentity {
    private final long userId;
    private final UserRole role;
    private final boolean active;

    public static UserIdentity active(long userId, UserRole role) {
        return new UserIdentity(userId, role, true);
    }

    public boolean hasRole(UserRole candidate) {
        return role == candidate;
    }
}
