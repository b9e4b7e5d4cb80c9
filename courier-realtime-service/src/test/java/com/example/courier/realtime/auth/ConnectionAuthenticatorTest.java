package com.example.courier.realtime.auth;

import com.example.courier.shared.config.AppProperties;
import com.example.courier.shared.config.MonitoringConfig;
import com.example.courier.shared.exception.AuthRejectedException;
import com.example.courier.shared.model.UserIdentity;
import com.example.courier.shared.model.UserRole;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionAuthenticatorTest {

    private final AppProperties appProperties = new AppProperties();
    private final MonitoringConfig.RealtimeMetricsCollector metricsCollector =
            new MonitoringConfig.RealtimeMetricsCollector(new SimpleMeterRegistry());
    private ConnectionAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        appProperties.getAuth().setTokens(List.of(
                grant("courier-token", 7L, UserRole.COURIER, true),
                grant("recipient-token", 30L, UserRole.RECIPIENT, true),
                grant("suspended-token", 8L, UserRole.COURIER, false)));
        appProperties.getAuth().setAllowedRoles(EnumSet.of(UserRole.ADMIN, UserRole.COURIER, UserRole.SENDER));
        authenticator = new ConnectionAuthenticator(new ConfiguredCredentialVerifier(appProperties),
                new ActiveUserAuthorizationPolicy(appProperties), metricsCollector);
    }

    @Test
    void knownActiveTokenResolvesToItsIdentity() {
        UserIdentity identity = authenticator.authenticate("courier-token");

        assertThat(identity).isEqualTo(UserIdentity.active(7, UserRole.COURIER));
        assertThat(metricsCollector.getCounterValue("courier.realtime.auth.rejected")).isZero();
    }

    @Test
    void missingOrUnknownTokenIsRejected() {
        assertThatThrownBy(() -> authenticator.authenticate(null)).isInstanceOf(AuthRejectedException.class);
        assertThatThrownBy(() -> authenticator.authenticate(" ")).isInstanceOf(AuthRejectedException.class);
        assertThatThrownBy(() -> authenticator.authenticate("forged-token")).isInstanceOf(AuthRejectedException.class);

        assertThat(metricsCollector.getCounterValue("courier.realtime.auth.rejected")).isEqualTo(3);
    }

    @Test
    void inactiveUserIsRejected() {
        assertThatThrownBy(() -> authenticator.authenticate("suspended-token"))
                .isInstanceOf(AuthRejectedException.class)
                .hasMessageContaining("8");
    }

    @Test
    void roleOutsideTheAllowedSetIsRejected() {
        assertThatThrownBy(() -> authenticator.authenticate("recipient-token"))
                .isInstanceOf(AuthRejectedException.class);
    }

    private static AppProperties.Auth.TokenGrant grant(String token, Long userId, UserRole role, boolean active) {
        AppProperties.Auth.TokenGrant grant = new AppProperties.Auth.TokenGrant();
        grant.setToken(token);
        grant.setUserId(userId);
        grant.setRole(role);
        grant.setActive(active);
        return grant;
    }
}
