package org.abstractica.arena;

import java.util.List;

/**
 * Serializable view of all simulation entities at one tick boundary.
 *
 * <p>Elements are plain data objects (records, maps, lists, strings, numbers)
 * that the broadcaster turns into the JSON object
 * {@code {"players":[...],"boss":...}}.</p>
 *
 * @param players one state object per player
 * @param boss    the boss state, or null when there is no boss
 */
public record GameStateSnapshot(List<?> players, Object boss)
{
    public GameStateSnapshot
    {
        players = players == null ? List.of() : List.copyOf(players);
    }

    /**
     * Returns a snapshot with no players and no boss.
     *
     * @return the empty snapshot
     */
    public static GameStateSnapshot empty()
    {
        return new GameStateSnapshot(List.of(), null);
    }
}
