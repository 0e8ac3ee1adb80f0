package org.abstractica.arena.demo.server.game;

/**
 * A point in the arena.
 */
public record Position(double x, double y) {}
