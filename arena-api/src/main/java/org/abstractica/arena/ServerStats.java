package org.abstractica.arena;

/**
 * Server statistics for monitoring.
 *
 * <p>Statistics are pollable, server-wide counters. The application can query
 * these values and push them to a monitoring system of choice.</p>
 */
public interface ServerStats
{
    /**
     * Returns the number of currently registered players.
     *
     * @return connected player count
     */
    int getConnectedPlayers();

    /**
     * Returns the number of connections accepted into the registry since start.
     *
     * @return accepted connection count
     */
    long getAcceptedConnections();

    /**
     * Returns the number of connections turned away because the server was full.
     *
     * @return rejected connection count
     */
    long getRejectedConnections();

    /**
     * Returns the number of simulation ticks run since start.
     *
     * @return tick count
     */
    long getTicks();

    /**
     * Returns the number of client messages handed to the game logic.
     *
     * @return dispatched message count
     */
    long getMessagesDispatched();

    /**
     * Returns the number of client messages dropped as malformed or unrecognized.
     *
     * @return dropped message count
     */
    long getMessagesDropped();
}
