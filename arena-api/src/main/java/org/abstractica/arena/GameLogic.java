package org.abstractica.arena;

/**
 * The game-logic collaborator that owns the shared simulation state.
 *
 * <p>The server calls every method with the simulation lock held, so
 * implementations need no synchronization of their own. Implementations must
 * not block or perform I/O: the lock is shared by the router and the
 * simulation clock.</p>
 */
public interface GameLogic
{
    /**
     * Called after a connection has been registered.
     *
     * @param playerId the connection id of the new player
     */
    void onPlayerJoined(String playerId);

    /**
     * Called once after a connection has been torn down.
     *
     * @param playerId the connection id of the departed player
     */
    void onPlayerLeft(String playerId);

    /**
     * Applies a {@code player_action} message.
     *
     * @param playerId the sending connection id
     * @param action   the decoded message
     */
    void onPlayerAction(String playerId, ClientMessage.PlayerAction action);

    /**
     * Applies a {@code skill_use} message.
     *
     * @param playerId the sending connection id
     * @param skillUse the decoded message
     */
    void onSkillUse(String playerId, ClientMessage.SkillUse skillUse);

    /**
     * Advances every simulation entity.
     *
     * @param deltaTime seconds elapsed since the previous tick
     */
    void advance(double deltaTime);

    /**
     * Returns a copy of the current state that stays valid after the lock is released.
     *
     * @return the current snapshot
     */
    GameStateSnapshot snapshot();
}
