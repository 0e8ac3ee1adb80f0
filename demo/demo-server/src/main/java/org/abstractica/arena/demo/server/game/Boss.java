package org.abstractica.arena.demo.server.game;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * The arena boss.
 *
 * <p>Fights in three phases. Below half health it attacks every living player
 * every 2 seconds; below a fifth it gains 50 defense and hits the first living
 * player hard every second.</p>
 */
public class Boss extends Combatant
{
    private static final Logger LOG = LoggerFactory.getLogger(Boss.class);

    public static final String ID = "boss";
    public static final int MAX_HEALTH = 50_000;

    static final int BASIC_DAMAGE = 50;
    static final int AOE_DAMAGE = 30;
    static final int BERSERK_DAMAGE = 100;
    static final int BERSERK_DEFENSE = 50;

    /**
     * One boss attack and the ids of the players it hit.
     */
    public record Attack(String type, int damage, List<String> targets) {}

    private final String bossType;
    private int phase;
    private double abilityCooldown;
    private double sinceLastAbility;

    public Boss(String bossType, double x, double y)
    {
        super(ID, x, y, MAX_HEALTH);
        this.bossType = bossType;
        this.phase = 1;
        this.abilityCooldown = 3.0;
        this.sinceLastAbility = 0;
    }

    @Override
    public void update(double deltaTime)
    {
        if (!isAlive())
        {
            return;
        }
        move(deltaTime);
        checkPhaseChange();
        sinceLastAbility += deltaTime;
    }

    private void checkPhaseChange()
    {
        double fraction = getHealthFraction();
        if (fraction < 0.5 && phase == 1)
        {
            phase = 2;
            abilityCooldown = 2.0;
            LOG.info("{} enters phase 2", bossType);
        }
        else if (fraction < 0.2 && phase == 2)
        {
            phase = 3;
            addDefense(BERSERK_DEFENSE);
            abilityCooldown = 1.0;
            LOG.info("{} enters berserk mode", bossType);
        }
    }

    @Override
    protected void onDeath()
    {
        LOG.info("{} defeated", bossType);
    }

    public boolean canUseAbility()
    {
        return isAlive() && sinceLastAbility >= abilityCooldown;
    }

    /**
     * Uses the ability for the current phase.
     *
     * @param targets the living players, in join order
     * @return the attack, or empty if on cooldown or there is nobody to hit
     */
    public Optional<Attack> useAbility(List<? extends Combatant> targets)
    {
        if (!canUseAbility() || targets.isEmpty())
        {
            return Optional.empty();
        }
        sinceLastAbility = 0;

        if (phase == 1)
        {
            return Optional.of(strike("basic", BASIC_DAMAGE, targets.get(0)));
        }
        if (phase == 2)
        {
            List<String> hit = targets.stream().map(Combatant::getId).toList();
            for (Combatant target : targets)
            {
                target.takeDamage(AOE_DAMAGE);
            }
            return Optional.of(new Attack("aoe", AOE_DAMAGE, hit));
        }
        return Optional.of(strike("berserk", BERSERK_DAMAGE, targets.get(0)));
    }

    private static Attack strike(String type, int damage, Combatant target)
    {
        target.takeDamage(damage);
        return new Attack(type, damage, List.of(target.getId()));
    }

    public int getPhase()
    {
        return phase;
    }

    public double getAbilityCooldown()
    {
        return abilityCooldown;
    }

    public BossView toView()
    {
        return new BossView(getId(), bossType, getPosition(), getHealth(), getMaxHealth(), phase, isAlive());
    }
}
