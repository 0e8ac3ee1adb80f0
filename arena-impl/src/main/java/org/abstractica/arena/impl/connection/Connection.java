package org.abstractica.arena.impl.connection;

import org.abstractica.arena.impl.framing.Framer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * One client socket.
 *
 * <p>Inbound frames are read by the caller through {@link #receiveOne()}.
 * Outbound payloads are either written synchronously with {@link #sendOne(byte[])}
 * or queued with {@link #enqueue(byte[])} and drained by a dedicated writer
 * thread, so a slow peer never blocks the thread that queues for it.</p>
 *
 * <p>The liveness flag goes from connected to disconnected exactly once.
 * A send failure flips the flag but leaves the socket open; the owner closes
 * it through {@link #close()}.</p>
 */
public class Connection
{
    private static final Logger LOG = LoggerFactory.getLogger(Connection.class);
    private static final long WRITER_POLL_MS = 100;

    private final String id;
    private final Socket socket;
    private final SocketAddress remoteAddress;
    private final InputStream in;
    private final OutputStream out;
    private final int maxFrameLength;
    private final BlockingQueue<byte[]> outboundQueue;
    private final ReentrantLock writeLock;
    private final AtomicBoolean connected;
    private final AtomicBoolean closed;

    private Thread writerThread;

    /**
     * Wraps an accepted socket.
     *
     * @param id                    the connection id
     * @param socket                the connected socket
     * @param maxFrameLength        largest inbound payload accepted
     * @param outboundQueueCapacity payloads buffered before {@link #enqueue(byte[])} refuses
     * @throws IOException if the socket streams cannot be obtained
     */
    public Connection(String id, Socket socket, int maxFrameLength, int outboundQueueCapacity) throws IOException
    {
        this.id = Objects.requireNonNull(id, "id");
        this.socket = Objects.requireNonNull(socket, "socket");
        this.remoteAddress = socket.getRemoteSocketAddress();
        this.in = new BufferedInputStream(socket.getInputStream());
        this.out = new BufferedOutputStream(socket.getOutputStream());
        this.maxFrameLength = maxFrameLength;
        this.outboundQueue = new LinkedBlockingQueue<>(outboundQueueCapacity);
        this.writeLock = new ReentrantLock();
        this.connected = new AtomicBoolean(true);
        this.closed = new AtomicBoolean(false);
    }

    // ========== Receive ==========

    /**
     * Blocks until one complete message has arrived.
     *
     * @return the UTF-8 decoded payload
     * @throws IOException if the socket fails, the frame is truncated or too large
     */
    public String receiveOne() throws IOException
    {
        byte[] payload = Framer.decode(in, maxFrameLength);
        return new String(payload, StandardCharsets.UTF_8);
    }

    // ========== Send ==========

    /**
     * Frames and writes a payload on the calling thread.
     *
     * <p>Writes from different threads never interleave.</p>
     *
     * @param payload the payload bytes
     * @return true if written, false if the connection is or has just become unusable
     */
    public boolean sendOne(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");

        writeLock.lock();
        try
        {
            if (!connected.get())
            {
                return false;
            }
            Framer.write(out, payload);
            out.flush();
            return true;
        }
        catch (IOException e)
        {
            LOG.warn("Send to {} failed: {}", id, e.getMessage());
            markDisconnected();
            return false;
        }
        finally
        {
            writeLock.unlock();
        }
    }

    /**
     * Frames and writes a text payload on the calling thread.
     *
     * @param payload the text to send as UTF-8
     * @return true if written
     */
    public boolean sendOne(String payload)
    {
        Objects.requireNonNull(payload, "payload");
        return sendOne(payload.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Queues a payload for the writer thread.
     *
     * <p>The same array may be queued on many connections; it is never modified.</p>
     *
     * @param payload the payload bytes
     * @return false if the connection is not live or its queue is full
     */
    public boolean enqueue(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");

        if (!connected.get())
        {
            return false;
        }
        if (!outboundQueue.offer(payload))
        {
            LOG.warn("Connection {} outbound queue full ({} frames), peer too slow",
                    id, outboundQueue.size());
            return false;
        }
        return true;
    }

    /**
     * Starts the writer thread that drains the outbound queue.
     *
     * @param onFailure called once from the writer thread if a write fails
     */
    public void startWriter(Consumer<Connection> onFailure)
    {
        Objects.requireNonNull(onFailure, "onFailure");

        if (writerThread != null)
        {
            throw new IllegalStateException("Writer already started for " + id);
        }

        writerThread = new Thread(() -> writeLoop(onFailure), "conn-writer-" + id);
        writerThread.setDaemon(true);
        writerThread.start();
    }

    private void writeLoop(Consumer<Connection> onFailure)
    {
        LOG.debug("Writer for {} started", id);

        while (connected.get())
        {
            byte[] payload;
            try
            {
                payload = outboundQueue.poll(WRITER_POLL_MS, TimeUnit.MILLISECONDS);
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
                break;
            }

            if (payload != null && !sendOne(payload))
            {
                onFailure.accept(this);
                break;
            }
        }

        outboundQueue.clear();
        LOG.debug("Writer for {} stopped", id);
    }

    // ========== Lifecycle ==========

    /**
     * Flips the liveness flag.
     *
     * @return true if this call made the transition
     */
    public boolean markDisconnected()
    {
        return connected.compareAndSet(true, false);
    }

    /**
     * Marks the connection disconnected and closes its socket.
     *
     * <p>Idempotent. Blocked reads and writes on the socket fail and unwind.</p>
     */
    public void close()
    {
        markDisconnected();

        if (!closed.compareAndSet(false, true))
        {
            return;
        }

        try
        {
            socket.close();
        }
        catch (IOException e)
        {
            LOG.debug("Error closing socket of {}: {}", id, e.getMessage());
        }
    }

    public boolean isConnected()
    {
        return connected.get();
    }

    public boolean isClosed()
    {
        return closed.get();
    }

    public String getId()
    {
        return id;
    }

    public SocketAddress getRemoteAddress()
    {
        return remoteAddress;
    }

    /**
     * Returns the number of payloads waiting for the writer thread.
     */
    public int getPendingFrames()
    {
        return outboundQueue.size();
    }

    @Override
    public String toString()
    {
        return "Connection[" + id + ", " + remoteAddress + "]";
    }
}
