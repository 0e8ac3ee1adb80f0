package org.abstractica.arena.impl.server;

import org.abstractica.arena.ServerStats;
import org.abstractica.arena.impl.connection.ConnectionRegistry;
import org.abstractica.arena.impl.routing.Router;
import org.abstractica.arena.impl.simulation.SimulationClock;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Default implementation of ServerStats.
 *
 * <p>Reads live counters from the registry, router and clock.</p>
 */
public class DefaultServerStats implements ServerStats
{
    private final ConnectionRegistry registry;
    private final Router router;
    private final SimulationClock clock;
    private final AtomicLong accepted = new AtomicLong(0);
    private final AtomicLong rejected = new AtomicLong(0);

    public DefaultServerStats(ConnectionRegistry registry, Router router, SimulationClock clock)
    {
        this.registry = registry;
        this.router = router;
        this.clock = clock;
    }

    @Override
    public int getConnectedPlayers()
    {
        return registry.size();
    }

    @Override
    public long getAcceptedConnections()
    {
        return accepted.get();
    }

    @Override
    public long getRejectedConnections()
    {
        return rejected.get();
    }

    @Override
    public long getTicks()
    {
        return clock.getTicks();
    }

    @Override
    public long getMessagesDispatched()
    {
        return router.getDispatched();
    }

    @Override
    public long getMessagesDropped()
    {
        return router.getDropped();
    }

    // ========== Update Methods ==========

    void recordAccepted()
    {
        accepted.incrementAndGet();
    }

    void recordRejected()
    {
        rejected.incrementAndGet();
    }

    @Override
    public String toString()
    {
        return "players=" + getConnectedPlayers()
                + ", accepted=" + getAcceptedConnections()
                + ", rejected=" + getRejectedConnections()
                + ", ticks=" + getTicks()
                + ", dispatched=" + getMessagesDispatched()
                + ", dropped=" + getMessagesDropped();
    }
}
