package org.abstractica.arena.demo.server.game;

/**
 * Boss entry of a state snapshot.
 */
public record BossView(
        String id,
        String bossType,
        Position position,
        int health,
        int maxHealth,
        int phase,
        boolean isAlive
) {}
