package com.example.courier.realtime.session;

import com.example.courier.shared.exception.AuthRejectedException;
import com.example.courier.shared.model.UserRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live connections of this instance, indexed by connection id, user id and role.
 * A user may hold any number of concurrent connections.
 *
 * <p>Writes to the three maps happen under one lock so an unregister racing a
 * register cannot leave index entries behind. Reads stay lock free.
 */
@Component
@Slf4j
public class SessionRegistry {

    private final Object lock = new Object();
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final Map<Long, Set<String>> userToConnectionIds = new ConcurrentHashMap<>();
    private final Map<UserRole, Set<String>> roleToConnectionIds = new EnumMap<>(UserRole.class);

    public SessionRegistry() {
        for (UserRole role : UserRole.values()) {
            roleToConnectionIds.put(role, ConcurrentHashMap.newKeySet());
        }
    }

    /**
     * @throws AuthRejectedException if the connection carries no verified identity
     * @throws IllegalStateException if the id is already registered
     */
    public String register(Connection connection) {
        if (connection.getIdentity() == null) {
            throw new AuthRejectedException("Connection " + connection.getId() + " has no authenticated identity");
        }
        synchronized (lock) {
            if (connections.putIfAbsent(connection.getId(), connection) != null) {
                throw new IllegalStateException("Connection " + connection.getId() + " is already registered");
            }
            userToConnectionIds.computeIfAbsent(connection.getUserId(), userId -> ConcurrentHashMap.newKeySet())
                    .add(connection.getId());
            roleToConnectionIds.get(connection.getRole()).add(connection.getId());
        }
        log.debug("Registered {}", connection);
        return connection.getId();
    }

    /**
     * Idempotent.
     *
     * @return the removed connection, or empty if it was not registered
     */
    public Optional<Connection> unregister(String connectionId) {
        Connection connection;
        synchronized (lock) {
            connection = connections.remove(connectionId);
            if (connection == null) {
                return Optional.empty();
            }
            Set<String> userConnectionIds = userToConnectionIds.get(connection.getUserId());
            if (userConnectionIds != null) {
                userConnectionIds.remove(connectionId);
                if (userConnectionIds.isEmpty()) {
                    userToConnectionIds.remove(connection.getUserId());
                }
            }
            roleToConnectionIds.get(connection.getRole()).remove(connectionId);
        }
        log.debug("Unregistered {}", connection);
        return Optional.of(connection);
    }

    public Optional<Connection> find(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public Set<String> connectionsForUser(long userId) {
        Set<String> ids = userToConnectionIds.get(userId);
        return ids == null ? Set.of() : Set.copyOf(ids);
    }

    public Set<String> connectionsForRole(UserRole role) {
        return Set.copyOf(roleToConnectionIds.get(role));
    }

    public Set<String> allConnectionIds() {
        return Set.copyOf(connections.keySet());
    }

    public Collection<Connection> allConnections() {
        return List.copyOf(connections.values());
    }

    public boolean isUserConnected(long userId) {
        Set<String> ids = userToConnectionIds.get(userId);
        return ids != null && !ids.isEmpty();
    }

    public int connectionCount() {
        return connections.size();
    }

    public int userCount() {
        return userToConnectionIds.size();
    }

    public Map<UserRole, Integer> countByRole() {
        Map<UserRole, Integer> counts = new EnumMap<>(UserRole.class);
        roleToConnectionIds.forEach((role, ids) -> counts.put(role, ids.size()));
        return counts;
    }
}
