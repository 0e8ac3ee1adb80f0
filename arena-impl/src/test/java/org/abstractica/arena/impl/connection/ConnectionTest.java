package org.abstractica.arena.impl.connection;

import org.abstractica.arena.impl.framing.Framer;
import org.abstractica.arena.impl.framing.TruncatedFrameException;
import org.abstractica.arena.impl.testing.Await;
import org.abstractica.arena.impl.testing.SocketPair;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Connection} over loopback sockets.
 */
class ConnectionTest
{
    private static final int MAX = 64 * 1024;

    private SocketPair pair;
    private Connection connection;

    @BeforeEach
    void setUp() throws IOException
    {
        pair = SocketPair.open();
        pair.client().setSoTimeout(5000);
        connection = new Connection("player_1", pair.server(), MAX, 4);
    }

    @AfterEach
    void tearDown() throws IOException
    {
        connection.close();
        pair.close();
    }

    private String readFromClient() throws IOException
    {
        return new String(Framer.decode(pair.client().getInputStream(), MAX), StandardCharsets.UTF_8);
    }

    // ========== Receive ==========

    @Test
    void receiveOne_readsFrames() throws IOException
    {
        OutputStream out = pair.client().getOutputStream();
        out.write(Framer.encode("{\"type\":\"a\"}".getBytes(StandardCharsets.UTF_8)));
        out.write(Framer.encode("{\"type\":\"b\"}".getBytes(StandardCharsets.UTF_8)));
        out.flush();

        assertEquals("{\"type\":\"a\"}", connection.receiveOne());
        assertEquals("{\"type\":\"b\"}", connection.receiveOne());
    }

    @Test
    void receiveOne_truncatedFrame() throws IOException
    {
        OutputStream out = pair.client().getOutputStream();
        out.write(new byte[]{0, 0, 0, 5, 'a', 'b', 'c'});
        out.flush();
        pair.client().shutdownOutput();

        TruncatedFrameException e = assertThrows(TruncatedFrameException.class, connection::receiveOne);

        assertEquals(3, e.getReceived());
    }

    // ========== Send ==========

    @Test
    void sendOne_writesFrame() throws IOException
    {
        assertTrue(connection.sendOne("hello"));

        assertEquals("hello", readFromClient());
    }

    @Test
    void sendOne_afterPeerClosed_flipsFlagOnce() throws Exception
    {
        pair.client().close();

        // The first writes may still be accepted by the local TCP buffer
        boolean sent = true;
        for (int i = 0; i < 200 && sent; i++)
        {
            sent = connection.sendOne(new byte[1024]);
            Thread.sleep(5);
        }

        assertFalse(sent, "Send should eventually fail");
        assertFalse(connection.isConnected());
        assertFalse(connection.markDisconnected(), "Flag already flipped");
        assertFalse(connection.sendOne("again"));
    }

    @Test
    void concurrentSends_doNotInterleave() throws Exception
    {
        int perThread = 200;
        CountDownLatch start = new CountDownLatch(1);
        Thread a = sender(start, 'a', perThread);
        Thread b = sender(start, 'b', perThread);
        a.start();
        b.start();
        start.countDown();

        Set<String> received = new HashSet<>();
        InputStream in = pair.client().getInputStream();
        for (int i = 0; i < 2 * perThread; i++)
        {
            String payload = new String(Framer.decode(in, MAX), StandardCharsets.UTF_8);
            char c = payload.charAt(0);
            assertEquals(String.valueOf(c).repeat(payload.length()), payload, "Interleaved frame");
            received.add(payload.charAt(0) + ":" + payload.length());
        }

        a.join(5000);
        b.join(5000);
        assertEquals(2 * perThread, received.size());
    }

    private Thread sender(CountDownLatch start, char c, int count)
    {
        return new Thread(() ->
        {
            try
            {
                start.await();
                for (int i = 1; i <= count; i++)
                {
                    connection.sendOne(String.valueOf(c).repeat(i * 7));
                }
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
            }
        });
    }

    // ========== Queue ==========

    @Test
    void enqueue_drainedByWriterInOrder() throws IOException
    {
        connection.startWriter(c -> {});

        assertTrue(connection.enqueue("one".getBytes(StandardCharsets.UTF_8)));
        assertTrue(connection.enqueue("two".getBytes(StandardCharsets.UTF_8)));
        assertTrue(connection.enqueue("three".getBytes(StandardCharsets.UTF_8)));

        assertEquals("one", readFromClient());
        assertEquals("two", readFromClient());
        assertEquals("three", readFromClient());
    }

    @Test
    void enqueue_fullQueueRefuses()
    {
        byte[] payload = new byte[1];
        for (int i = 0; i < 4; i++)
        {
            assertTrue(connection.enqueue(payload));
        }

        assertFalse(connection.enqueue(payload));
        assertEquals(4, connection.getPendingFrames());
    }

    @Test
    void enqueue_afterCloseRefuses()
    {
        connection.close();

        assertFalse(connection.enqueue(new byte[1]));
    }

    @Test
    void startWriter_twiceThrows()
    {
        connection.startWriter(c -> {});

        assertThrows(IllegalStateException.class, () -> connection.startWriter(c -> {}));
    }

    @Test
    void writer_reportsFailureOnce() throws Exception
    {
        AtomicInteger failures = new AtomicInteger();
        connection.startWriter(c -> failures.incrementAndGet());
        pair.client().close();

        for (int i = 0; i < 200 && connection.isConnected(); i++)
        {
            connection.enqueue(new byte[1024]);
            Thread.sleep(5);
        }

        Await.until(() -> failures.get() == 1, "Writer should report the failure");
        Thread.sleep(200);
        assertEquals(1, failures.get());
        assertFalse(connection.isConnected());
    }

    // ========== Lifecycle ==========

    @Test
    void close_isIdempotent()
    {
        connection.close();
        connection.close();

        assertTrue(connection.isClosed());
        assertFalse(connection.isConnected());
        assertTrue(pair.server().isClosed());
    }

    @Test
    void close_unblocksReader() throws Exception
    {
        CountDownLatch failed = new CountDownLatch(1);
        Thread reader = new Thread(() ->
        {
            try
            {
                connection.receiveOne();
            }
            catch (IOException e)
            {
                failed.countDown();
            }
        });
        reader.start();
        Thread.sleep(100);

        connection.close();

        assertTrue(failed.await(5, TimeUnit.SECONDS), "Blocked read should fail after close");
    }

    @Test
    void markDisconnected_onlyFirstCallTransitions()
    {
        assertTrue(connection.markDisconnected());
        assertFalse(connection.markDisconnected());
        assertFalse(connection.isConnected());
        assertFalse(connection.isClosed());
    }
}
