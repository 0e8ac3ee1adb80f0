package org.abstractica.arena.demo.server;

import org.abstractica.arena.ServerConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ServerSettings}.
 */
class ServerSettingsTest
{
    @TempDir
    Path tempDir;

    @Test
    void defaults_matchServerDefaults()
    {
        ServerConfig config = ServerSettings.defaults().toServerConfig(null);

        assertEquals("localhost", config.host());
        assertEquals(8080, config.port());
        assertEquals(4, config.maxPlayers());
        assertEquals(60, config.tickRate());
    }

    @Test
    void parse_mergesOverDefaults()
    {
        ServerSettings settings = ServerSettings.parse(new StringReader(
                "{\"network\":{\"server_port\":9000},\"gameplay\":{\"max_players\":2,\"boss_health_scale\":1.5}}"));

        assertEquals("localhost", settings.getHost());
        assertEquals(9000, settings.getPort());
        assertEquals(2, settings.getMaxPlayers());
        assertEquals(60, settings.getFps());
    }

    @Test
    void parse_emptyDocumentGivesDefaults()
    {
        ServerSettings settings = ServerSettings.parse(new StringReader(""));

        assertEquals(8080, settings.getPort());
        assertEquals(4, settings.getMaxPlayers());
    }

    @Test
    void parse_invalidJsonThrows()
    {
        assertThrows(IllegalArgumentException.class,
                () -> ServerSettings.parse(new StringReader("{\"network\": [")));
    }

    @Test
    void toServerConfig_portOverrideWins()
    {
        ServerSettings settings = ServerSettings.parse(new StringReader(
                "{\"network\":{\"server_host\":\"0.0.0.0\",\"server_port\":9000},\"graphics\":{\"fps\":30}}"));

        ServerConfig config = settings.toServerConfig(7000);

        assertEquals("0.0.0.0", config.host());
        assertEquals(7000, config.port());
        assertEquals(30, config.tickRate());
    }

    @Test
    void toServerConfig_rejectsInvalidValues()
    {
        ServerSettings settings = ServerSettings.parse(new StringReader("{\"gameplay\":{\"max_players\":0}}"));

        assertThrows(IllegalArgumentException.class, () -> settings.toServerConfig(null));
    }

    @Test
    void load_missingFileWritesDefaults() throws Exception
    {
        Path file = tempDir.resolve("arena-server.json");

        ServerSettings settings = ServerSettings.load(file);

        assertEquals(8080, settings.getPort());
        assertTrue(Files.exists(file));
        String written = Files.readString(file);
        assertTrue(written.contains("\"server_port\": 8080"), written);
        assertTrue(written.contains("\"max_players\": 4"), written);
    }

    @Test
    void load_readsExistingFile() throws Exception
    {
        Path file = tempDir.resolve("arena-server.json");
        Files.writeString(file, "{\"gameplay\":{\"max_players\":8}}");

        ServerSettings settings = ServerSettings.load(file);

        assertEquals(8, settings.getMaxPlayers());
    }
}
