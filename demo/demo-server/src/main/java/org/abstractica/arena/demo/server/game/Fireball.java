package org.abstractica.arena.demo.server.game;

import java.util.Random;

/**
 * 150 damage varied by up to 20% either way, 2 second cooldown.
 */
public class Fireball extends DamageSkill
{
    private final Random random;

    public Fireball(Random random)
    {
        super("Fireball", 2.0, 150);
        this.random = random;
    }

    @Override
    protected int calculateDamage()
    {
        return (int) (getBaseDamage() * (0.8 + 0.4 * random.nextDouble()));
    }
}
