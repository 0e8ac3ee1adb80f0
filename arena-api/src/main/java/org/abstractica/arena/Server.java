package org.abstractica.arena;

import org.abstractica.arena.handlers.ErrorHandler;

import java.net.InetSocketAddress;
import java.util.function.Supplier;

/**
 * An authoritative game server that accepts TCP connections, applies client
 * messages to a shared simulation and broadcasts the resulting state.
 *
 * <p>The lifecycle is {@code Created -> Started -> Stopped}. A stopped server
 * cannot be started again; build a new one instead.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Server server = serverFactory.builder()
 *     .config(ServerConfig.builder().port(8080).maxPlayers(4).build())
 *     .gameLogic(game)
 *     .build();
 *
 * server.start();
 * ...
 * server.stop();
 * }</pre>
 */
public interface Server extends AutoCloseable
{
    /**
     * Binds the listening socket and starts the accept loop, the message
     * router and the simulation clock.
     *
     * <p>This method returns immediately; the server runs on background threads.</p>
     *
     * @throws java.io.UncheckedIOException if the listening socket cannot be bound
     * @throws IllegalStateException        if the server was already started or stopped
     */
    void start();

    /**
     * Stops the server.
     *
     * <p>Closes the listening socket and every registered connection. Calling
     * this more than once has no further effect.</p>
     */
    void stop();

    /**
     * Equivalent to {@link #stop()}.
     */
    @Override
    void close();

    /**
     * Registers an error handler for exceptions thrown by the game logic
     * while a client message is applied.
     *
     * @param handler called with the offending connection id, message and exception
     */
    void onError(ErrorHandler handler);

    /**
     * Runs an action against the game state while holding the simulation lock.
     *
     * <p>The action is serialized with message application and ticks, so its
     * effect first shows up in the snapshot of the next tick.</p>
     *
     * @param action the mutation to run
     */
    void withGameState(Runnable action);

    /**
     * Reads from the game state while holding the simulation lock.
     *
     * @param reader computes the value
     * @param <T>    the result type
     * @return the computed value
     */
    <T> T readGameState(Supplier<T> reader);

    /**
     * Returns whether the server has been started and not yet stopped.
     *
     * @return true while running
     */
    boolean isRunning();

    /**
     * Returns the address the server is listening on.
     *
     * @return the bound address, or null before {@link #start()}
     */
    InetSocketAddress getLocalAddress();

    /**
     * Returns server statistics.
     *
     * @return live statistics view
     */
    ServerStats getStats();
}
