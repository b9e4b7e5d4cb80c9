package com.example.courier.realtime.auth;

import com.example.courier.shared.config.AppProperties;
import com.example.courier.shared.model.UserIdentity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Admits active users whose role is in {@code courier.auth.allowed-roles}.
 */
@Component
@RequiredArgsConstructor
public class ActiveUserAuthorizationPolicy implements AuthorizationPolicy {

    private final AppProperties appProperties;

    @Override
    public boolean isAuthorized(UserIdentity identity) {
        return identity.isActive() && appProperties.getAuth().getAllowedRoles().contains(identity.getRole());
    }
}
