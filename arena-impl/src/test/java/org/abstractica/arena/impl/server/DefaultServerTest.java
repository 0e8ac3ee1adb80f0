package org.abstractica.arena.impl.server;

import com.google.gson.JsonObject;
import org.abstractica.arena.ClientMessage;
import org.abstractica.arena.ServerConfig;
import org.abstractica.arena.impl.framing.Framer;
import org.abstractica.arena.impl.protocol.MessageCodec;
import org.abstractica.arena.impl.testing.Await;
import org.abstractica.arena.impl.testing.RecordingGameLogic;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for {@link DefaultServer} using raw sockets as clients.
 */
class DefaultServerTest
{
    private static final int MAX = 1024 * 1024;

    private RecordingGameLogic logic;
    private DefaultServer server;
    private final List<Socket> clients = new ArrayList<>();

    @BeforeEach
    void setUp()
    {
        logic = new RecordingGameLogic();
    }

    @AfterEach
    void tearDown() throws IOException
    {
        for (Socket client : clients)
        {
            client.close();
        }
        if (server != null)
        {
            server.close();
        }
    }

    private DefaultServer startServer(int maxPlayers)
    {
        ServerConfig config = ServerConfig.builder()
                .host("127.0.0.1")
                .port(0)
                .maxPlayers(maxPlayers)
                .build();
        server = new DefaultServer(config, logic);
        server.start();
        return server;
    }

    private Socket connect() throws IOException
    {
        Socket socket = new Socket(InetAddress.getLoopbackAddress(), server.getLocalAddress().getPort());
        socket.setSoTimeout(5000);
        clients.add(socket);
        return socket;
    }

    private Socket connectAndAwaitRegistration() throws Exception
    {
        int before = logic.joined().size();
        Socket socket = connect();
        Await.until(() -> logic.joined().size() == before + 1, "Client should be registered");
        return socket;
    }

    private interface Step
    {
        void run() throws Exception;
    }

    private static Runnable unchecked(Step step)
    {
        return () ->
        {
            try
            {
                step.run();
            }
            catch (Exception e)
            {
                throw new AssertionError(e);
            }
        };
    }

    private static Optional<Thread> findThread(String name)
    {
        return Thread.getAllStackTraces().keySet().stream()
                .filter(thread -> thread.getName().equals(name))
                .findFirst();
    }

    private static void send(Socket socket, String json) throws IOException
    {
        OutputStream out = socket.getOutputStream();
        Framer.write(out, json.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    // ========== Admission ==========

    @Test
    void thirdClientRejectedWhenFull() throws Exception
    {
        startServer(2);
        connectAndAwaitRegistration();
        connectAndAwaitRegistration();

        Socket third = connect();
        byte[] notice = third.getInputStream().readAllBytes();

        assertEquals("Server full", new String(notice, StandardCharsets.UTF_8));
        assertEquals(2, server.getRegistry().size());
        assertEquals(2, server.getStats().getConnectedPlayers());
        assertEquals(2, server.getStats().getAcceptedConnections());
        assertEquals(1, server.getStats().getRejectedConnections());
        assertEquals(List.of("player_1", "player_2"), logic.joined());
    }

    @Test
    void slotFreedByDisconnectIsReusable() throws Exception
    {
        startServer(1);
        Socket first = connectAndAwaitRegistration();

        first.close();
        Await.until(() -> server.getRegistry().size() == 0, "Closed client should be removed");
        connectAndAwaitRegistration();

        assertEquals(List.of("player_1", "player_2"), logic.joined());
        assertEquals(List.of("player_1"), logic.left());
    }

    // ========== Broadcast ==========

    @Test
    void clientsReceiveStateBroadcasts() throws Exception
    {
        startServer(4);
        Socket client = connectAndAwaitRegistration();

        JsonObject state = null;
        InputStream in = client.getInputStream();
        // Early frames may predate registration of the player
        for (int i = 0; i < 10; i++)
        {
            state = MessageCodec.decodeSnapshot(new String(Framer.decode(in, MAX), StandardCharsets.UTF_8));
            if (state.getAsJsonArray("players").size() == 1)
            {
                break;
            }
        }

        assertNotNull(state);
        assertTrue(state.has("boss"));
        assertTrue(state.get("boss").isJsonNull());
        assertEquals("player_1",
                state.getAsJsonArray("players").get(0).getAsJsonObject().get("player_id").getAsString());
    }

    // ========== Inbound Messages ==========

    @Test
    void messagesFromOneClientAppliedInOrder() throws Exception
    {
        startServer(4);
        Socket client = connectAndAwaitRegistration();

        for (int i = 0; i < 100; i++)
        {
            send(client, "{\"type\":\"skill_use\",\"skill_index\":" + i + "}");
        }

        Await.until(() -> logic.applied().size() == 100, "All messages should be applied");
        for (int i = 0; i < 100; i++)
        {
            RecordingGameLogic.Applied applied = logic.applied().get(i);
            assertEquals("player_1", applied.playerId());
            assertEquals(new ClientMessage.SkillUse(i, null), applied.message());
        }
    }

    @Test
    void unknownMessageTypeKeepsConnection() throws Exception
    {
        startServer(4);
        Socket client = connectAndAwaitRegistration();

        send(client, "{\"type\":\"unknown_kind\"}");
        send(client, "this is not json");
        send(client, "{\"type\":\"player_action\",\"action\":\"stop\"}");

        Await.until(() -> logic.applied().size() == 1, "Valid message should still be applied");
        assertEquals(1, server.getRegistry().size());
        assertTrue(logic.left().isEmpty());
        assertEquals(2, server.getStats().getMessagesDropped());
        assertEquals(1, server.getStats().getMessagesDispatched());
    }

    @Test
    void gameLogicFailureReachesErrorHandler() throws Exception
    {
        CountDownLatch reported = new CountDownLatch(1);
        startServer(4);
        server.onError((playerId, message, exception) -> reported.countDown());
        Socket client = connectAndAwaitRegistration();
        logic.failWith(new IllegalStateException("broken"));

        send(client, "{\"type\":\"skill_use\",\"skill_index\":0}");

        assertTrue(reported.await(5, TimeUnit.SECONDS));
        assertEquals(1, server.getRegistry().size());
    }

    // ========== Disconnects ==========

    @Test
    void truncatedFrameRemovesConnectionExactlyOnce() throws Exception
    {
        startServer(4);
        Socket client = connectAndAwaitRegistration();

        OutputStream out = client.getOutputStream();
        out.write(new byte[]{0, 0, 0, 5, '{', '"', 't'});
        out.flush();
        client.close();

        Await.until(() -> server.getRegistry().size() == 0, "Connection should be removed");
        // Give the broadcast path a chance to report the same connection again
        Thread.sleep(200);
        assertEquals(List.of("player_1"), logic.left());
    }

    @Test
    void oversizedFrameDisconnectsClient() throws Exception
    {
        startServer(4);
        Socket client = connectAndAwaitRegistration();

        OutputStream out = client.getOutputStream();
        out.write(new byte[]{(byte) 0x7F, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF});
        out.flush();

        Await.until(() -> server.getRegistry().size() == 0, "Connection should be removed");
        assertEquals(List.of("player_1"), logic.left());
    }

    // ========== Lifecycle ==========

    @Test
    void stopClosesClientsAndNotifiesLeave() throws Exception
    {
        startServer(4);
        Socket client = connectAndAwaitRegistration();

        server.stop();

        InputStream in = client.getInputStream();
        assertThrows(IOException.class, () ->
        {
            while (true)
            {
                Framer.decode(in, MAX);
            }
        });
        assertEquals(List.of("player_1"), logic.left());
        assertFalse(server.isRunning());
        assertEquals(ServerState.STOPPED, server.getState());
    }

    @Test
    void stopIsTerminal()
    {
        startServer(4);

        server.stop();
        server.stop();

        assertThrows(IllegalStateException.class, server::start);
    }

    @Test
    void startTwiceThrows()
    {
        startServer(4);

        assertThrows(IllegalStateException.class, server::start);
    }

    @Test
    void stopBeforeStart()
    {
        server = new DefaultServer(ServerConfig.builder().port(0).build(), logic);

        server.stop();

        assertEquals(ServerState.STOPPED, server.getState());
        assertThrows(IllegalStateException.class, server::start);
    }

    @Test
    void bindFailureThrowsAndLeavesServerStartable() throws Exception
    {
        try (ServerSocket occupied = new ServerSocket(0, 1, InetAddress.getLoopbackAddress()))
        {
            ServerConfig config = ServerConfig.builder()
                    .host("127.0.0.1")
                    .port(occupied.getLocalPort())
                    .build();
            server = new DefaultServer(config, logic);

            assertThrows(UncheckedIOException.class, server::start);
            assertFalse(server.isRunning());
            assertEquals(ServerState.CREATED, server.getState());
            assertNull(server.getLocalAddress());
        }
    }

    @Test
    void readerBlockedOnFullQueueExitsOnStop() throws Exception
    {
        CountDownLatch gate = new CountDownLatch(1);
        logic.holdActionsUntil(gate);
        ServerConfig config = ServerConfig.builder()
                .host("127.0.0.1")
                .port(0)
                .maxPlayers(1)
                .inboundQueueCapacity(1)
                .build();
        server = new DefaultServer(config, logic);
        server.start();
        Socket client = connectAndAwaitRegistration();

        for (int i = 0; i < 3; i++)
        {
            send(client, "{\"type\":\"player_action\",\"action\":\"a" + i + "\"}");
        }
        Await.until(() -> logic.actionsEntered() == 1, "Router should be held inside the game logic");
        Await.until(() -> findThread("conn-reader-player_1")
                        .map(t -> t.getState() == Thread.State.WAITING || t.getState() == Thread.State.TIMED_WAITING)
                        .orElse(false),
                "Reader should be blocked on the full queue");

        Thread stopper = new Thread(server::stop, "test-stopper");
        stopper.start();
        Await.until(() -> server.getRegistry().size() == 0, "Stop should remove the connection");
        Await.until(() -> findThread("conn-reader-player_1").isEmpty(), "Reader should exit");

        gate.countDown();
        stopper.join(5000);
        assertFalse(stopper.isAlive());
        assertEquals(List.of("player_1"), logic.left());
    }

    @Test
    void joinRacingStopLeavesNoPlayerBehind() throws Exception
    {
        startServer(1);
        Thread[] stopper = new Thread[1];

        server.withGameState(unchecked(() ->
        {
            connect();
            Await.until(() -> server.getRegistry().size() == 1, "Connection should be registered");
            stopper[0] = new Thread(server::stop, "test-stopper");
            stopper[0].start();
            Await.until(() -> server.getRegistry().size() == 0, "Stop should remove the connection");
        }));

        stopper[0].join(5000);
        assertFalse(stopper[0].isAlive());
        Await.until(() -> findThread("conn-reader-player_1").isEmpty()
                && !server.isRunning(), "Server should be fully stopped");
        assertEquals(logic.joined(), logic.left());
        assertTrue(logic.joined().isEmpty());
    }

    // ========== Game State Access ==========

    @Test
    void withGameStateExcludesTicks() throws Exception
    {
        startServer(1);
        Await.until(() -> logic.advances() > 0, "Clock should tick");

        int[] observed = new int[2];
        server.withGameState(unchecked(() ->
        {
            observed[0] = logic.advances();
            Thread.sleep(100);
            observed[1] = logic.advances();
        }));

        assertEquals(observed[0], observed[1]);
        Await.until(() -> logic.advances() > observed[1], "Clock should resume after the lock is released");
    }

    @Test
    void readGameStateReturnsValue() throws Exception
    {
        startServer(2);
        connectAndAwaitRegistration();

        List<String> joined = server.readGameState(() -> List.copyOf(logic.joined()));

        assertEquals(List.of("player_1"), joined);
    }

    @Test
    void ticksAdvanceSimulation() throws Exception
    {
        startServer(4);

        Await.until(() -> server.getStats().getTicks() >= 10, "Clock should tick");
        assertTrue(logic.advances() >= 10);
    }
}
