package com.example.courier.realtime.auth;

import com.example.courier.shared.model.UserIdentity;

/**
 * Decides whether a verified identity may hold a real-time connection. Consulted
 * once per connection, at upgrade time.
 */
public interface AuthorizationPolicy {

    boolean isAuthorized(UserIdentity identity);
}
