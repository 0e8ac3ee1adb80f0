package org.abstractica.arena.demo.server.game;

/**
 * A skill that restores health to a living target.
 */
public abstract class HealingSkill extends Skill
{
    private final int healAmount;

    protected HealingSkill(String name, double cooldown, int healAmount)
    {
        super(name, cooldown);
        this.healAmount = healAmount;
    }

    @Override
    protected int apply(Combatant caster, Combatant target)
    {
        if (!target.isAlive())
        {
            return 0;
        }
        target.heal(healAmount);
        return healAmount;
    }

    @Override
    public boolean isSupportive()
    {
        return true;
    }
}
