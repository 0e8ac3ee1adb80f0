package org.abstractica.arena.demo.server.game;

/**
 * Restores 80 health, 5 second cooldown.
 */
public class QuickHeal extends HealingSkill
{
    public QuickHeal()
    {
        super("Quick Heal", 5.0, 80);
    }
}
