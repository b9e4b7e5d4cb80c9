package com.example.courier.realtime.auth;

import com.example.courier.shared.model.UserIdentity;

import java.util.Optional;

/**
 * Resolves a bearer credential to the identity it was issued for.
 */
public interface CredentialVerifier {

    /**
     * @return the identity, or empty if the credential is unknown or invalid
     */
    Optional<UserIdentity> verify(String token);
}
