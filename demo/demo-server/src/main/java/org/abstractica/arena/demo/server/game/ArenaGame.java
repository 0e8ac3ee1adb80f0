package org.abstractica.arena.demo.server.game;

import org.abstractica.arena.ClientMessage;
import org.abstractica.arena.GameLogic;
import org.abstractica.arena.GameStateSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Boss fight game logic.
 *
 * <p>Players join with 200 health and three skills: Fireball, Ice Spear and
 * Quick Heal. One boss sits in the arena and attacks the living players on its
 * own cooldown. Dead players come back after ten seconds.</p>
 *
 * <p>Not thread-safe. The server calls it under its simulation lock, and the
 * console goes through {@code Server.withGameState} and
 * {@code Server.readGameState} to get the same lock.</p>
 */
public class ArenaGame implements GameLogic
{
    private static final Logger LOG = LoggerFactory.getLogger(ArenaGame.class);

    public static final String BOSS_TYPE = "Dragon";
    public static final double BOSS_X = 500;
    public static final double BOSS_Y = 300;

    static final double SPAWN_X = 100;
    static final double SPAWN_Y = 100;
    static final double SPAWN_SPACING = 50;

    public static final String ACTION_MOVE = "move";
    public static final String ACTION_STOP = "stop";

    private final Random random;
    private final Map<String, Player> players;
    private Boss boss;
    private int nextPlayerNumber;
    private GameOutcome outcome;

    public ArenaGame()
    {
        this(new Random());
    }

    /**
     * Creates a game.
     *
     * @param random source of damage variance
     */
    public ArenaGame(Random random)
    {
        this.random = Objects.requireNonNull(random, "random");
        this.players = new LinkedHashMap<>();
        this.boss = spawnBoss();
        this.nextPlayerNumber = 1;
    }

    private static Boss spawnBoss()
    {
        return new Boss(BOSS_TYPE, BOSS_X, BOSS_Y);
    }

    // ========== Players ==========

    @Override
    public void onPlayerJoined(String playerId)
    {
        int number = nextPlayerNumber++;
        double x = SPAWN_X + SPAWN_SPACING * ((number - 1) % 8);
        List<Skill> skills = List.of(new Fireball(random), new IceSpear(), new QuickHeal());
        Player player = new Player(playerId, "Player " + number, number, x, SPAWN_Y, skills);
        players.put(playerId, player);
        LOG.info("{} joined as {}", playerId, player.getName());
    }

    @Override
    public void onPlayerLeft(String playerId)
    {
        Player removed = players.remove(playerId);
        if (removed != null)
        {
            LOG.info("{} ({}) left", playerId, removed.getName());
        }
    }

    @Override
    public void onPlayerAction(String playerId, ClientMessage.PlayerAction action)
    {
        Player player = players.get(playerId);
        if (player == null || !player.isAlive())
        {
            return;
        }

        switch (action.action())
        {
            case ACTION_MOVE -> applyMove(player, action.data());
            case ACTION_STOP -> player.stop();
            default -> LOG.debug("Ignoring unknown action '{}' from {}", action.action(), playerId);
        }
    }

    private void applyMove(Player player, Object data)
    {
        if (!(data instanceof Map<?, ?> map))
        {
            LOG.warn("Move from {} without dx/dy data", player.getId());
            return;
        }
        if (!(map.get("dx") instanceof Number dx) || !(map.get("dy") instanceof Number dy))
        {
            LOG.warn("Move from {} has non-numeric dx/dy: {}", player.getId(), map);
            return;
        }
        player.setVelocity(dx.doubleValue(), dy.doubleValue());
    }

    @Override
    public void onSkillUse(String playerId, ClientMessage.SkillUse skillUse)
    {
        Player player = players.get(playerId);
        if (player == null || !player.isAlive())
        {
            return;
        }

        Skill skill = player.getSkill(skillUse.skillIndex());
        if (skill == null)
        {
            LOG.debug("{} has no skill in slot {}", playerId, skillUse.skillIndex());
            return;
        }

        Combatant target = resolveTarget(player, skill, skillUse.targetId());
        if (target == null)
        {
            LOG.debug("{} used {} without a valid target", playerId, skill.getName());
            return;
        }

        int amount = player.useSkill(skillUse.skillIndex(), target);
        if (amount > 0)
        {
            LOG.debug("{} used {} on {}: {}", playerId, skill.getName(), target.getId(), amount);
        }
    }

    private Combatant resolveTarget(Player caster, Skill skill, String targetId)
    {
        if (targetId == null)
        {
            return skill.isSupportive() ? caster : boss;
        }
        if (targetId.equals(boss.getId()))
        {
            return boss;
        }
        return players.get(targetId);
    }

    // ========== Simulation ==========

    @Override
    public void advance(double deltaTime)
    {
        for (Player player : players.values())
        {
            player.update(deltaTime);
        }

        if (boss.isAlive())
        {
            boss.update(deltaTime);
            if (boss.canUseAbility())
            {
                boss.useAbility(alivePlayers()).ifPresent(attack ->
                        LOG.debug("Boss {} attack for {} on {}", attack.type(), attack.damage(), attack.targets()));
            }
        }

        updateOutcome();
    }

    private List<Player> alivePlayers()
    {
        List<Player> alive = new ArrayList<>();
        for (Player player : players.values())
        {
            if (player.isAlive())
            {
                alive.add(player);
            }
        }
        return alive;
    }

    private void updateOutcome()
    {
        GameOutcome current = null;
        if (!boss.isAlive())
        {
            current = GameOutcome.VICTORY;
        }
        else if (!players.isEmpty() && alivePlayers().isEmpty())
        {
            current = GameOutcome.DEFEAT;
        }

        if (current != outcome)
        {
            outcome = current;
            if (current != null)
            {
                LOG.info("Game over: {}", current);
            }
        }
    }

    @Override
    public GameStateSnapshot snapshot()
    {
        return new GameStateSnapshot(playerViews(), boss.toView());
    }

    private List<PlayerView> playerViews()
    {
        List<PlayerView> views = new ArrayList<>(players.size());
        for (Player player : players.values())
        {
            views.add(player.toView());
        }
        return views;
    }

    // ========== Console ==========

    /**
     * Spawns a fresh boss and brings every player back to full health.
     */
    public void reset()
    {
        boss = spawnBoss();
        for (Player player : players.values())
        {
            player.respawn();
        }
        outcome = null;
        LOG.info("Game reset with {} players", players.size());
    }

    public List<PlayerView> listPlayers()
    {
        return playerViews();
    }

    public BossView getBoss()
    {
        return boss.toView();
    }

    /**
     * Returns the result once the boss or every player has fallen.
     */
    public Optional<GameOutcome> getOutcome()
    {
        return Optional.ofNullable(outcome);
    }

    Player getPlayer(String playerId)
    {
        return players.get(playerId);
    }

    Boss getBossEntity()
    {
        return boss;
    }
}
