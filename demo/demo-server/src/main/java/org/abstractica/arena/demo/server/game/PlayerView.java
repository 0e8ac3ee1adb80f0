package org.abstractica.arena.demo.server.game;

/**
 * Player entry of a state snapshot.
 */
public record PlayerView(
        String id,
        String name,
        int playerId,
        Position position,
        int health,
        int maxHealth,
        int level,
        boolean isAlive
) {}
