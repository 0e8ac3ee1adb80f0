package org.abstractica.arena.demo.server.game;

/**
 * 200 damage, 3 second cooldown.
 */
public class IceSpear extends DamageSkill
{
    public IceSpear()
    {
        super("Ice Spear", 3.0, 200);
    }
}
