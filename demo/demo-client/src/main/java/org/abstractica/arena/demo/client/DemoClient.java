package org.abstractica.arena.demo.client;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.abstractica.arena.ServerConfig;
import org.abstractica.arena.impl.client.GameClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Console client for the boss fight.
 *
 * <p>Keeps the latest state received from the server and prints it on demand;
 * console commands are turned into player actions and skill uses.</p>
 */
public class DemoClient
{
    private static final Logger LOG = LoggerFactory.getLogger(DemoClient.class);

    private static final String[] SKILL_NAMES = {"Fireball", "Ice Spear", "Quick Heal"};

    private final GameClient client;
    private final AtomicReference<JsonObject> latestState;

    public DemoClient()
    {
        this.client = new GameClient();
        this.latestState = new AtomicReference<>();

        client.onState(latestState::set);
        client.onDisconnected(() ->
        {
            if (client.wasRejected())
            {
                System.out.println("Server is full, try again later");
            }
            else
            {
                System.out.println("Disconnected from server");
            }
        });
    }

    public boolean connect(String host, int port)
    {
        System.out.printf("Connecting to %s:%d...%n", host, port);
        try
        {
            client.connect(host, port);
        }
        catch (IOException e)
        {
            LOG.debug("Connect failed", e);
            System.out.println("Connection failed: " + e.getMessage());
            return false;
        }
        System.out.println("Connected! Type 'help' for commands");
        return true;
    }

    public void runCommandLoop()
    {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

        try
        {
            String line;
            while ((line = reader.readLine()) != null)
            {
                String[] parts = line.trim().split("\\s+");
                String command = parts[0].toLowerCase();

                if (!client.isConnected() && !command.equals("quit") && !command.equals("exit") && !command.equals("q"))
                {
                    System.out.println("Not connected to server");
                    continue;
                }

                switch (command)
                {
                    case "move" -> handleMoveCommand(parts);
                    case "stop" -> client.sendPlayerAction("stop", null);
                    case "skill" -> handleSkillCommand(parts);
                    case "state", "status" -> printState();
                    case "quit", "exit", "q" ->
                    {
                        System.out.println("Disconnecting...");
                        return;
                    }
                    case "help" ->
                    {
                        System.out.println("Commands:");
                        System.out.println("  move <dx> <dy>        - Set your velocity");
                        System.out.println("  stop                  - Stop moving");
                        System.out.println("  skill <n> [target]    - Use skill n (0 Fireball, 1 Ice Spear, 2 Quick Heal)");
                        System.out.println("  state                 - Show the latest game state");
                        System.out.println("  quit                  - Disconnect and exit");
                    }
                    case "" ->
                    {
                        // Ignore empty input
                    }
                    default -> System.out.println("Unknown command: " + command + " (type 'help' for commands)");
                }
            }
        }
        catch (IOException e)
        {
            LOG.error("Error reading console input", e);
        }
    }

    private void handleMoveCommand(String[] parts)
    {
        if (parts.length != 3)
        {
            System.out.println("Usage: move <dx> <dy>");
            return;
        }

        try
        {
            double dx = Double.parseDouble(parts[1]);
            double dy = Double.parseDouble(parts[2]);
            client.sendPlayerAction("move", Map.of("dx", dx, "dy", dy));
        }
        catch (NumberFormatException e)
        {
            System.out.println("Invalid velocity. Usage: move <dx> <dy>");
        }
    }

    private void handleSkillCommand(String[] parts)
    {
        if (parts.length < 2 || parts.length > 3)
        {
            System.out.println("Usage: skill <n> [target]");
            return;
        }

        int index;
        try
        {
            index = Integer.parseInt(parts[1]);
        }
        catch (NumberFormatException e)
        {
            System.out.println("Invalid skill number: " + parts[1]);
            return;
        }

        String target = parts.length == 3 ? parts[2] : null;
        if (client.sendSkillUse(index, target))
        {
            String name = index >= 0 && index < SKILL_NAMES.length ? SKILL_NAMES[index] : "skill " + index;
            System.out.println("Cast " + name + (target != null ? " on " + target : ""));
        }
    }

    private void printState()
    {
        JsonObject state = latestState.get();
        if (state == null)
        {
            System.out.println("No state received yet");
            return;
        }

        JsonElement boss = state.get("boss");
        if (boss != null && boss.isJsonObject())
        {
            JsonObject b = boss.getAsJsonObject();
            System.out.printf("Boss %s: %d/%d (phase %d)%n",
                    b.get("boss_type").getAsString(), b.get("health").getAsInt(),
                    b.get("max_health").getAsInt(), b.get("phase").getAsInt());
        }

        JsonArray players = state.getAsJsonArray("players");
        System.out.println("Players:");
        for (JsonElement element : players)
        {
            JsonObject p = element.getAsJsonObject();
            JsonObject position = p.getAsJsonObject("position");
            System.out.printf("  %s (%s) at (%.0f, %.0f) %d/%d%s%n",
                    p.get("name").getAsString(), p.get("id").getAsString(),
                    position.get("x").getAsDouble(), position.get("y").getAsDouble(),
                    p.get("health").getAsInt(), p.get("max_health").getAsInt(),
                    p.get("is_alive").getAsBoolean() ? "" : " dead");
        }
    }

    public void disconnect()
    {
        client.close();
    }

    public static void main(String[] args)
    {
        String host = ServerConfig.DEFAULT_HOST;
        int port = ServerConfig.DEFAULT_PORT;

        for (int i = 0; i < args.length; i++)
        {
            switch (args[i])
            {
                case "-h", "--host" ->
                {
                    if (i + 1 < args.length)
                    {
                        host = args[++i];
                    }
                }
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
                            System.err.println("Invalid port number");
                            System.exit(1);
                        }
                    }
                }
                case "--help" ->
                {
                    System.out.println("Usage: demo-client [options]");
                    System.out.println("Options:");
                    System.out.println("  -h, --host <host>  Server host (default: localhost)");
                    System.out.println("  -p, --port <port>  Server port (default: 8080)");
                    System.exit(0);
                }
            }
        }

        DemoClient demoClient = new DemoClient();
        if (!demoClient.connect(host, port))
        {
            System.exit(1);
        }

        demoClient.runCommandLoop();

        demoClient.disconnect();
    }
}
