package org.abstractica.arena.impl.broadcast;

import org.abstractica.arena.GameStateSnapshot;
import org.abstractica.arena.impl.connection.Connection;
import org.abstractica.arena.impl.connection.ConnectionRegistry;
import org.abstractica.arena.impl.protocol.MessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Fans one snapshot out to every registered connection.
 *
 * <p>The snapshot is serialized once and the same bytes are queued on every
 * connection; the writer threads do the actual socket writes. Connections that
 * refuse the payload are torn down after the fan-out loop.</p>
 */
public class Broadcaster
{
    private static final Logger LOG = LoggerFactory.getLogger(Broadcaster.class);

    private final ConnectionRegistry registry;
    private final Consumer<Connection> onRemoved;

    /**
     * Creates a broadcaster.
     *
     * @param registry  the recipients
     * @param onRemoved called once for each connection this broadcaster removed
     */
    public Broadcaster(ConnectionRegistry registry, Consumer<Connection> onRemoved)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.onRemoved = Objects.requireNonNull(onRemoved, "onRemoved");
    }

    /**
     * Serializes a snapshot and queues it on every registered connection.
     *
     * @param snapshot the snapshot for this tick
     * @return the number of connections the snapshot was queued on
     */
    public int broadcast(GameStateSnapshot snapshot)
    {
        Objects.requireNonNull(snapshot, "snapshot");

        byte[] payload = MessageCodec.encodeSnapshotBytes(snapshot);

        List<Connection> failed = new ArrayList<>();
        int delivered = 0;
        for (Connection connection : registry.snapshotAll())
        {
            if (connection.enqueue(payload))
            {
                delivered++;
            }
            else
            {
                failed.add(connection);
            }
        }

        for (Connection connection : failed)
        {
            if (registry.removeAndClose(connection))
            {
                LOG.info("Dropped {} after failed broadcast", connection.getId());
                onRemoved.accept(connection);
            }
        }

        return delivered;
    }
}
