package org.abstractica.arena.impl.server;

/**
 * Lifecycle state of a server.
 */
public enum ServerState
{
    /**
     * Built but not yet listening.
     */
    CREATED,

    /**
     * Listening, routing and ticking.
     */
    STARTED,

    /**
     * Shut down. Terminal: a stopped server is never restarted.
     */
    STOPPED
}
