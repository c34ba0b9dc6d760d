package in.receipttrack.relay.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory set of open client connections, keyed by connection id.
 *
 * All mutation and snapshot copies happen under one lock, so a snapshot always
 * reflects a single instant: no half-added or half-removed entries. The critical
 * sections are a map operation or a copy of the values, nothing else.
 */
public final class ConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Object lock = new Object();
    private final Map<Long, ClientConnection> connections = new HashMap<>();
    private final AtomicLong idSequence = new AtomicLong(0);
    private final int maxConnections;

    public ConnectionRegistry(int maxConnections) {
        if (maxConnections <= 0) {
            throw new IllegalArgumentException("maxConnections must be positive");
        }
        this.maxConnections = maxConnections;
    }

    /**
     * Add an open connection and assign its id.
     *
     * @return the assigned connection id
     * @throws RegistryExhaustedException if the connection limit is reached
     * @throws IllegalStateException if the connection is no longer open
     */
    public long register(ClientConnection connection) throws RegistryExhaustedException {
        long id;
        int total;
        synchronized (lock) {
            if (connections.size() >= maxConnections) {
                throw new RegistryExhaustedException(maxConnections);
            }
            if (connection.state() != ConnectionState.OPEN) {
                throw new IllegalStateException("Connection closed before registration");
            }
            id = idSequence.incrementAndGet();
            connection.onRegistered(id);
            connections.put(id, connection);

            // A close that raced with registration may have read id 0; undo here.
            if (connection.state() != ConnectionState.OPEN) {
                connections.remove(id);
                throw new IllegalStateException("Connection closed during registration");
            }
            total = connections.size();
        }
        log.debug("[REGISTRY] Registered connection {} (total: {})", id, total);
        return id;
    }

    /**
     * Remove a connection. Unknown or already removed ids are ignored.
     */
    public void unregister(long connectionId) {
        ClientConnection removed;
        int total;
        synchronized (lock) {
            removed = connections.remove(connectionId);
            total = connections.size();
        }
        if (removed != null) {
            log.debug("[REGISTRY] Unregistered connection {} (total: {})", connectionId, total);
        }
    }

    /**
     * Point-in-time copy of the open connections. Order is unspecified.
     */
    public List<ClientConnection> snapshot() {
        synchronized (lock) {
            return List.copyOf(connections.values());
        }
    }

    public Optional<ClientConnection> find(long connectionId) {
        synchronized (lock) {
            return Optional.ofNullable(connections.get(connectionId));
        }
    }

    public int size() {
        synchronized (lock) {
            return connections.size();
        }
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    /**
     * Ask every registered connection to close. A connection leaves the registry as
     * soon as it stops being open.
     */
    public void closeAll(String reason) {
        List<ClientConnection> all = snapshot();
        log.info("[REGISTRY] Closing {} connection(s): {}", all.size(), reason);
        for (ClientConnection c : all) {
            try {
                c.requestClose(reason);
            } catch (RuntimeException e) {
                log.warn("[REGISTRY] Close request failed for connection {}", c.connectionId(), e);
                unregister(c.connectionId());
            }
        }
    }
}
