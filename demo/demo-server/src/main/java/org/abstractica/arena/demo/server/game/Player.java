package org.abstractica.arena.demo.server.game;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * A connected player's character.
 */
public class Player extends Combatant
{
    private static final Logger LOG = LoggerFactory.getLogger(Player.class);

    public static final int MAX_HEALTH = 200;
    public static final double RESPAWN_SECONDS = 10.0;

    private final String name;
    private final int playerNumber;
    private final double spawnX;
    private final double spawnY;
    private final List<Skill> skills;
    private final int level;
    private double respawnTimer;

    public Player(String id, String name, int playerNumber, double spawnX, double spawnY, List<Skill> skills)
    {
        super(id, spawnX, spawnY, MAX_HEALTH);
        this.name = name;
        this.playerNumber = playerNumber;
        this.spawnX = spawnX;
        this.spawnY = spawnY;
        this.skills = List.copyOf(skills);
        this.level = 1;
    }

    @Override
    public void update(double deltaTime)
    {
        if (!isAlive())
        {
            respawnTimer -= deltaTime;
            if (respawnTimer <= 0)
            {
                respawn();
            }
            return;
        }

        move(deltaTime);
        for (Skill skill : skills)
        {
            skill.updateCooldown(deltaTime);
        }
    }

    @Override
    protected void onDeath()
    {
        LOG.info("{} was defeated", name);
        stop();
        respawnTimer = RESPAWN_SECONDS;
    }

    /**
     * Brings the player back at the spawn point with full health and ready skills.
     */
    public void respawn()
    {
        restore();
        stop();
        setPosition(spawnX, spawnY);
        respawnTimer = 0;
        for (Skill skill : skills)
        {
            skill.resetCooldown();
        }
        LOG.info("{} respawned", name);
    }

    /**
     * Uses the skill in the given slot.
     *
     * @param skillIndex the slot
     * @param target     the target
     * @return the amount dealt or healed, or 0 if the skill could not be used
     */
    public int useSkill(int skillIndex, Combatant target)
    {
        Skill skill = getSkill(skillIndex);
        if (skill == null || !isAlive())
        {
            return 0;
        }
        return skill.use(this, target);
    }

    /**
     * Returns the skill in a slot, or null if there is none.
     */
    public Skill getSkill(int skillIndex)
    {
        if (skillIndex < 0 || skillIndex >= skills.size())
        {
            return null;
        }
        return skills.get(skillIndex);
    }

    public List<Skill> getSkills()
    {
        return skills;
    }

    public String getName()
    {
        return name;
    }

    public PlayerView toView()
    {
        return new PlayerView(getId(), name, playerNumber, getPosition(),
                getHealth(), getMaxHealth(), level, isAlive());
    }
}
