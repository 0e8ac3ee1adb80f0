package org.abstractica.arena.demo.server.game;

import java.util.Objects;

/**
 * Base class for everything in the arena that moves, takes damage and can die.
 */
public abstract class Combatant
{
    private final String id;
    private double x;
    private double y;
    private double velocityX;
    private double velocityY;
    private final int maxHealth;
    private int health;
    private int defense;
    private boolean alive;

    protected Combatant(String id, double x, double y, int maxHealth)
    {
        this.id = Objects.requireNonNull(id, "id");
        this.x = x;
        this.y = y;
        this.maxHealth = maxHealth;
        this.health = maxHealth;
        this.alive = true;
    }

    /**
     * Advances this combatant by one tick.
     *
     * @param deltaTime seconds since the previous tick
     */
    public abstract void update(double deltaTime);

    /**
     * Called once when health reaches zero.
     */
    protected abstract void onDeath();

    // ========== Combat ==========

    /**
     * Applies damage reduced by defense, never less than 1.
     *
     * @param damage the raw damage
     * @return the damage actually dealt
     */
    public int takeDamage(int damage)
    {
        int actual = Math.max(1, damage - defense);
        health -= actual;
        if (health <= 0)
        {
            health = 0;
            if (alive)
            {
                alive = false;
                onDeath();
            }
        }
        return actual;
    }

    /**
     * Restores health, capped at the maximum.
     *
     * @param amount the amount to heal
     */
    public void heal(int amount)
    {
        health = Math.min(maxHealth, health + amount);
    }

    protected void restore()
    {
        health = maxHealth;
        alive = true;
    }

    // ========== Movement ==========

    protected void move(double deltaTime)
    {
        x += velocityX * deltaTime;
        y += velocityY * deltaTime;
    }

    public void setVelocity(double velocityX, double velocityY)
    {
        this.velocityX = velocityX;
        this.velocityY = velocityY;
    }

    public void stop()
    {
        setVelocity(0, 0);
    }

    protected void setPosition(double x, double y)
    {
        this.x = x;
        this.y = y;
    }

    // ========== Accessors ==========

    public String getId()
    {
        return id;
    }

    public Position getPosition()
    {
        return new Position(x, y);
    }

    public int getHealth()
    {
        return health;
    }

    public int getMaxHealth()
    {
        return maxHealth;
    }

    public double getHealthFraction()
    {
        return (double) health / maxHealth;
    }

    public int getDefense()
    {
        return defense;
    }

    protected void addDefense(int amount)
    {
        defense += amount;
    }

    public boolean isAlive()
    {
        return alive;
    }
}
