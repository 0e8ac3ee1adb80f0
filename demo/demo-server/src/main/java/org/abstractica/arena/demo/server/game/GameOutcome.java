package org.abstractica.arena.demo.server.game;

public enum GameOutcome
{
    VICTORY,
    DEFEAT
}
