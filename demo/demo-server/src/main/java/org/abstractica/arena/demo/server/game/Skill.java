package org.abstractica.arena.demo.server.game;

import java.util.Objects;

/**
 * A player ability with a cooldown.
 */
public abstract class Skill
{
    private final String name;
    private final double cooldown;
    private double remainingCooldown;

    protected Skill(String name, double cooldown)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.cooldown = cooldown;
    }

    /**
     * Uses the skill on a target if it is off cooldown.
     *
     * @param caster the player using the skill
     * @param target the target
     * @return the damage dealt or health restored, or 0 if nothing happened
     */
    public int use(Combatant caster, Combatant target)
    {
        if (!isReady() || target == null)
        {
            return 0;
        }
        int amount = apply(caster, target);
        if (amount > 0)
        {
            remainingCooldown = cooldown;
        }
        return amount;
    }

    protected abstract int apply(Combatant caster, Combatant target);

    /**
     * Returns whether the skill is aimed at allies rather than enemies.
     */
    public abstract boolean isSupportive();

    public void updateCooldown(double deltaTime)
    {
        if (remainingCooldown > 0)
        {
            remainingCooldown -= deltaTime;
        }
    }

    public boolean isReady()
    {
        return remainingCooldown <= 0;
    }

    public void resetCooldown()
    {
        remainingCooldown = 0;
    }

    public String getName()
    {
        return name;
    }
}
