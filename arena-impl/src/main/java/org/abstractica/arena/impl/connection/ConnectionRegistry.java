package org.abstractica.arena.impl.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The set of registered connections, bounded by a player capacity.
 *
 * <p>Thread-safe for concurrent access from the accept loop, the receive
 * loops and the broadcaster. All mutation goes through {@link #tryAdd} and
 * {@link #remove}.</p>
 */
public class ConnectionRegistry
{
    private static final Logger LOG = LoggerFactory.getLogger(ConnectionRegistry.class);
    private static final String ID_PREFIX = "player_";

    /**
     * Creates the connection for a freshly minted id.
     */
    @FunctionalInterface
    public interface ConnectionFactory
    {
        Connection create(String id) throws IOException;
    }

    private final ReentrantLock lock;
    private final Map<String, Connection> connections;
    private final int maxPlayers;
    private long nextId;

    /**
     * Creates an empty registry.
     *
     * @param maxPlayers maximum number of registered connections
     */
    public ConnectionRegistry(int maxPlayers)
    {
        if (maxPlayers <= 0)
        {
            throw new IllegalArgumentException("maxPlayers must be positive: " + maxPlayers);
        }
        this.lock = new ReentrantLock();
        this.connections = new HashMap<>();
        this.maxPlayers = maxPlayers;
        this.nextId = 1;
    }

    // ========== Mutation ==========

    /**
     * Registers a new connection if capacity allows.
     *
     * <p>Ids are {@code player_1}, {@code player_2}, ... and are never reused
     * within the lifetime of this registry.</p>
     *
     * @param factory builds the connection for the assigned id
     * @return the registered connection, or empty if the registry is full
     * @throws IOException if the factory fails; nothing is registered in that case
     */
    public Optional<Connection> tryAdd(ConnectionFactory factory) throws IOException
    {
        Objects.requireNonNull(factory, "factory");

        lock.lock();
        try
        {
            if (connections.size() >= maxPlayers)
            {
                return Optional.empty();
            }

            String id = ID_PREFIX + nextId++;
            Connection connection = factory.create(id);
            connections.put(id, connection);

            LOG.debug("Connection registered: id={}, address={} ({}/{})",
                    id, connection.getRemoteAddress(), connections.size(), maxPlayers);
            return Optional.of(connection);
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Removes a connection.
     *
     * <p>Removing an absent id is a no-op, because disconnects may be reported
     * concurrently by the receive path and the broadcast path.</p>
     *
     * @param id the connection id
     * @return the removed connection, or null if it was not registered
     */
    public Connection remove(String id)
    {
        Objects.requireNonNull(id, "id");

        lock.lock();
        try
        {
            Connection removed = connections.remove(id);
            if (removed != null)
            {
                LOG.debug("Connection removed: id={} ({}/{})", id, connections.size(), maxPlayers);
            }
            return removed;
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Removes a connection and closes its socket.
     *
     * <p>The socket is closed even if another caller removed the connection
     * first; only one caller ever sees {@code true}.</p>
     *
     * @param connection the connection to tear down
     * @return true if this call removed it from the registry
     */
    public boolean removeAndClose(Connection connection)
    {
        Objects.requireNonNull(connection, "connection");

        Connection removed = remove(connection.getId());
        connection.close();
        return removed != null;
    }

    // ========== Lookup ==========

    /**
     * Returns a copy of the registered connections for iteration outside the lock.
     *
     * @return connections ordered by id number
     */
    public List<Connection> snapshotAll()
    {
        List<Connection> copy;
        lock.lock();
        try
        {
            copy = new ArrayList<>(connections.values());
        }
        finally
        {
            lock.unlock();
        }
        copy.sort((a, b) -> Long.compare(idNumber(a.getId()), idNumber(b.getId())));
        return copy;
    }

    /**
     * Finds a connection by id.
     *
     * @param id the connection id
     * @return the connection, or null if not registered
     */
    public Connection get(String id)
    {
        Objects.requireNonNull(id, "id");

        lock.lock();
        try
        {
            return connections.get(id);
        }
        finally
        {
            lock.unlock();
        }
    }

    public int size()
    {
        lock.lock();
        try
        {
            return connections.size();
        }
        finally
        {
            lock.unlock();
        }
    }

    public int getMaxPlayers()
    {
        return maxPlayers;
    }

    private static long idNumber(String id)
    {
        return Long.parseLong(id.substring(ID_PREFIX.length()));
    }
}
