package org.abstractica.arena.demo.server;

import org.abstractica.arena.Server;
import org.abstractica.arena.ServerConfig;
import org.abstractica.arena.ServerStats;
import org.abstractica.arena.demo.server.game.ArenaGame;
import org.abstractica.arena.demo.server.game.BossView;
import org.abstractica.arena.demo.server.game.PlayerView;
import org.abstractica.arena.impl.server.DefaultServerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * Demo server hosting the boss fight.
 *
 * <p>Reads its settings from a JSON file, starts the arena server and then
 * accepts console commands until told to quit.</p>
 */
public class DemoServer
{
    private static final Logger LOG = LoggerFactory.getLogger(DemoServer.class);
    private static final String DEFAULT_SETTINGS_FILE = "arena-server.json";

    private final ArenaGame game;
    private final Server server;

    public DemoServer(ServerConfig config, ArenaGame game)
    {
        this.game = game;
        this.server = new DefaultServerFactory().builder()
                .config(config)
                .gameLogic(game)
                .build();

        server.onError((playerId, message, exception) ->
                LOG.error("Game logic failed: player={}, message={}", playerId, message, exception));
    }

    public void start()
    {
        server.start();
        LOG.info("Demo server listening on {}", server.getLocalAddress());
    }

    public void stop()
    {
        server.close();
        LOG.info("Demo server stopped");
    }

    public void runCommandLoop()
    {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        System.out.println("Server commands: list, reset, stats, quit");

        try
        {
            String line;
            while ((line = reader.readLine()) != null)
            {
                String command = line.trim().toLowerCase();

                switch (command)
                {
                    case "list" -> listPlayers();
                    case "reset" ->
                    {
                        server.withGameState(game::reset);
                        System.out.println("Boss respawned, all players restored");
                    }
                    case "stats" -> printStats();
                    case "quit", "exit", "q" ->
                    {
                        System.out.println("Shutting down...");
                        return;
                    }
                    case "" ->
                    {
                        // Ignore empty input
                    }
                    default -> System.out.println("Unknown command: " + command);
                }
            }
        }
        catch (IOException e)
        {
            LOG.error("Error reading console input", e);
        }
    }

    private void listPlayers()
    {
        BossView boss = server.readGameState(game::getBoss);
        System.out.printf("Boss %s: %d/%d (phase %d)%s%n",
                boss.bossType(), boss.health(), boss.maxHealth(), boss.phase(),
                boss.isAlive() ? "" : " defeated");

        List<PlayerView> players = server.readGameState(game::listPlayers);
        if (players.isEmpty())
        {
            System.out.println("No players connected");
            return;
        }

        System.out.println("Connected players:");
        for (PlayerView player : players)
        {
            System.out.printf("  %s (%s) at (%.0f, %.0f) %d/%d%s%n",
                    player.name(), player.id(), player.position().x(), player.position().y(),
                    player.health(), player.maxHealth(), player.isAlive() ? "" : " dead");
        }
    }

    private void printStats()
    {
        ServerStats stats = server.getStats();
        System.out.printf("Players: %d, accepted: %d, rejected: %d, ticks: %d, dispatched: %d, dropped: %d%n",
                stats.getConnectedPlayers(), stats.getAcceptedConnections(), stats.getRejectedConnections(),
                stats.getTicks(), stats.getMessagesDispatched(), stats.getMessagesDropped());
    }

    public static void main(String[] args)
    {
        Integer port = null;
        String settingsFile = DEFAULT_SETTINGS_FILE;

        for (int i = 0; i < args.length; i++)
        {
            switch (args[i])
            {
                case "-p", "--port" ->
                {
                    if (i + 1 < args.length)
                    {
                        try
                        {
                            port = Integer.parseInt(args[++i]);
                        }
                        catch (NumberFormatException e)
                        {
                            System.err.println("Invalid port number: " + args[i]);
                            System.exit(1);
                        }
                    }
                }
                case "-c", "--config" ->
                {
                    if (i + 1 < args.length)
                    {
                        settingsFile = args[++i];
                    }
                }
                case "--help" ->
                {
                    System.out.println("Usage: demo-server [options]");
                    System.out.println("Options:");
                    System.out.println("  -p, --port <port>    Port to listen on (overrides the settings file)");
                    System.out.println("  -c, --config <file>  Settings file (default: " + DEFAULT_SETTINGS_FILE + ")");
                    System.exit(0);
                }
                default ->
                {
                    System.err.println("Unknown option: " + args[i]);
                    System.exit(1);
                }
            }
        }

        ServerConfig config;
        try
        {
            config = ServerSettings.load(Path.of(settingsFile)).toServerConfig(port);
        }
        catch (UncheckedIOException | IllegalArgumentException e)
        {
            System.err.println("Invalid settings: " + e.getMessage());
            System.exit(1);
            return;
        }

        DemoServer demoServer = new DemoServer(config, new ArenaGame());
        try
        {
            demoServer.start();
        }
        catch (UncheckedIOException e)
        {
            System.err.println(e.getMessage());
            System.exit(1);
        }

        demoServer.runCommandLoop();

        demoServer.stop();
    }
}
