package com.example.courier.realtime.auth;

import com.example.courier.shared.aspect.Monitored;
import com.example.courier.shared.config.MonitoringConfig;
import com.example.courier.shared.exception.AuthRejectedException;
import com.example.courier.shared.model.UserIdentity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the credential verifier and the authorization policy for one upgrade
 * request.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConnectionAuthenticator {

    private final CredentialVerifier credentialVerifier;
    private final AuthorizationPolicy authorizationPolicy;
    private final MonitoringConfig.RealtimeMetricsCollector metricsCollector;

    /**
     * @throws AuthRejectedException if the token is missing or unknown, or the identity is not authorized
     */
    @Monitored("auth")
    public UserIdentity authenticate(String token) {
        if (token == null || token.isBlank()) {
            throw reject("Missing access token");
        }
        UserIdentity identity = credentialVerifier.verify(token)
                .orElseThrow(() -> reject("Invalid or expired access token"));
        if (!authorizationPolicy.isAuthorized(identity)) {
            throw reject("User " + identity.getUserId() + " is not allowed to connect");
        }
        log.debug("Authenticated user {} with role {}", identity.getUserId(), identity.getRole());
        return identity;
    }

    private AuthRejectedException reject(String message) {
        metricsCollector.incrementCounter("courier.realtime.auth.rejected");
        log.warn("Rejecting connection: {}", message);
        return new AuthRejectedException(message);
    }
}
