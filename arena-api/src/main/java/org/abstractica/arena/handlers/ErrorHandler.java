package org.abstractica.arena.handlers;

import org.abstractica.arena.ClientMessage;

/**
 * Handles exceptions thrown by the game logic while a client message is applied.
 *
 * <p>The server catches the exception, logs it, and invokes this handler.
 * The connection stays open; one faulty message should not end a session.</p>
 */
@FunctionalInterface
public interface ErrorHandler
{
    /**
     * Handles an exception thrown by the game logic.
     *
     * @param playerId  the connection id that sent the message
     * @param message   the message being applied
     * @param exception the exception thrown
     */
    void handle(String playerId, ClientMessage message, Exception exception);
}
