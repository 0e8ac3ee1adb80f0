package org.abstractica.arena.demo.server.game;

/**
 * A skill that damages a living target.
 */
public abstract class DamageSkill extends Skill
{
    private final int baseDamage;

    protected DamageSkill(String name, double cooldown, int baseDamage)
    {
        super(name, cooldown);
        this.baseDamage = baseDamage;
    }

    @Override
    protected int apply(Combatant caster, Combatant target)
    {
        if (!target.isAlive())
        {
            return 0;
        }
        return target.takeDamage(calculateDamage());
    }

    protected int calculateDamage()
    {
        return baseDamage;
    }

    @Override
    public boolean isSupportive()
    {
        return false;
    }

    public int getBaseDamage()
    {
        return baseDamage;
    }
}
