package org.abstractica.arena.demo.server;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.abstractica.arena.ServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Settings file of the demo server.
 *
 * <p>A JSON document with {@code network}, {@code gameplay} and {@code graphics}
 * sections. Keys missing from the file keep their defaults; unknown keys are
 * ignored. A missing file is created with the defaults.</p>
 *
 * <pre>{@code
 * {
 *   "network":  { "server_host": "localhost", "server_port": 8080 },
 *   "gameplay": { "max_players": 4 },
 *   "graphics": { "fps": 60 }
 * }
 * }</pre>
 */
public class ServerSettings
{
    private static final Logger LOG = LoggerFactory.getLogger(ServerSettings.class);

    private static final Gson GSON = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .setPrettyPrinting()
            .create();

    static class Network
    {
        String serverHost = ServerConfig.DEFAULT_HOST;
        int serverPort = ServerConfig.DEFAULT_PORT;
    }

    static class Gameplay
    {
        int maxPlayers = ServerConfig.DEFAULT_MAX_PLAYERS;
    }

    static class Graphics
    {
        int fps = ServerConfig.DEFAULT_TICK_RATE;
    }

    private Network network = new Network();
    private Gameplay gameplay = new Gameplay();
    private Graphics graphics = new Graphics();

    /**
     * Returns the built-in defaults.
     */
    public static ServerSettings defaults()
    {
        return new ServerSettings();
    }

    /**
     * Loads settings from a file, writing the defaults there if it does not exist.
     *
     * @param path the settings file
     * @return the merged settings
     * @throws UncheckedIOException     if the file cannot be read
     * @throws IllegalArgumentException if the file is not valid JSON
     */
    public static ServerSettings load(Path path)
    {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8))
        {
            ServerSettings settings = parse(reader);
            LOG.info("Loaded settings from {}", path);
            return settings;
        }
        catch (NoSuchFileException e)
        {
            ServerSettings settings = defaults();
            settings.save(path);
            LOG.info("No settings at {}, wrote defaults", path);
            return settings;
        }
        catch (IOException e)
        {
            throw new UncheckedIOException("Failed to read settings " + path, e);
        }
    }

    static ServerSettings parse(Reader reader)
    {
        ServerSettings settings;
        try
        {
            settings = GSON.fromJson(reader, ServerSettings.class);
        }
        catch (JsonParseException e)
        {
            throw new IllegalArgumentException("Invalid settings: " + e.getMessage(), e);
        }

        if (settings == null)
        {
            return defaults();
        }
        if (settings.network == null)
        {
            settings.network = new Network();
        }
        if (settings.gameplay == null)
        {
            settings.gameplay = new Gameplay();
        }
        if (settings.graphics == null)
        {
            settings.graphics = new Graphics();
        }
        return settings;
    }

    /**
     * Writes these settings as JSON. Failure is logged, not thrown.
     *
     * @param path the target file
     */
    public void save(Path path)
    {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8))
        {
            GSON.toJson(this, writer);
        }
        catch (IOException e)
        {
            LOG.warn("Could not write settings to {}: {}", path, e.getMessage());
        }
    }

    /**
     * Builds the server configuration.
     *
     * @param portOverride port from the command line, or null to use the file's
     * @return the configuration
     */
    public ServerConfig toServerConfig(Integer portOverride)
    {
        return ServerConfig.builder()
                .host(network.serverHost)
                .port(portOverride != null ? portOverride : network.serverPort)
                .maxPlayers(gameplay.maxPlayers)
                .tickRate(graphics.fps)
                .build();
    }

    public String getHost()
    {
        return network.serverHost;
    }

    public int getPort()
    {
        return network.serverPort;
    }

    public int getMaxPlayers()
    {
        return gameplay.maxPlayers;
    }

    public int getFps()
    {
        return graphics.fps;
    }
}
