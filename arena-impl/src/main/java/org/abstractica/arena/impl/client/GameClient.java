package org.abstractica.arena.impl.client;

import com.google.gson.JsonObject;
import org.abstractica.arena.ClientMessage;
import org.abstractica.arena.ServerConfig;
import org.abstractica.arena.impl.framing.Framer;
import org.abstractica.arena.impl.protocol.MessageCodec;
import org.abstractica.arena.impl.protocol.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Client side of the wire protocol.
 *
 * <p>Runs one receive thread that decodes state snapshots and one send thread
 * that drains queued client messages. A server that is full answers with an
 * unframed notice and closes; that shows up here as a failure before the first
 * frame and is reported through {@link #wasRejected()}.</p>
 */
public class GameClient implements AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(GameClient.class);
    private static final int QUEUE_CAPACITY = 256;
    private static final long SEND_POLL_MS = 100;
    private static final int CONNECT_TIMEOUT_MS = 5000;

    private final int maxFrameLength;
    private final BlockingQueue<String> outgoing;

    private volatile Consumer<JsonObject> stateHandler;
    private volatile Runnable disconnectHandler;

    private Socket socket;
    private InputStream in;
    private OutputStream out;
    private Thread receiveThread;
    private Thread sendThread;
    private volatile boolean connected;
    private volatile boolean receivedAnyFrame;
    private volatile boolean rejected;

    public GameClient()
    {
        this(ServerConfig.DEFAULT_MAX_FRAME_LENGTH);
    }

    /**
     * Creates a client.
     *
     * @param maxFrameLength largest snapshot accepted from the server
     */
    public GameClient(int maxFrameLength)
    {
        this.maxFrameLength = maxFrameLength;
        this.outgoing = new LinkedBlockingQueue<>(QUEUE_CAPACITY);
    }

    // ========== Handlers ==========

    /**
     * Sets the handler for received state snapshots.
     *
     * <p>Called from the receive thread.</p>
     *
     * @param handler receives each snapshot as a JSON object
     */
    public void onState(Consumer<JsonObject> handler)
    {
        this.stateHandler = handler;
    }

    /**
     * Sets the handler called once when the connection ends for any reason.
     *
     * @param handler the handler
     */
    public void onDisconnected(Runnable handler)
    {
        this.disconnectHandler = handler;
    }

    // ========== Connection ==========

    /**
     * Connects and starts the receive and send threads.
     *
     * @param host the server host
     * @param port the server port
     * @throws IOException if the connection cannot be established
     */
    public synchronized void connect(String host, int port) throws IOException
    {
        if (connected)
        {
            throw new IllegalStateException("Already connected");
        }

        LOG.info("Connecting to {}:{}", host, port);

        Socket s = new Socket();
        try
        {
            s.connect(new InetSocketAddress(host, port), CONNECT_TIMEOUT_MS);
            s.setTcpNoDelay(true);
            in = new BufferedInputStream(s.getInputStream());
            out = new BufferedOutputStream(s.getOutputStream());
        }
        catch (IOException e)
        {
            s.close();
            throw e;
        }

        socket = s;
        connected = true;
        receivedAnyFrame = false;
        rejected = false;

        receiveThread = new Thread(this::receiveLoop, "client-receive");
        receiveThread.setDaemon(true);
        receiveThread.start();

        sendThread = new Thread(this::sendLoop, "client-send");
        sendThread.setDaemon(true);
        sendThread.start();
    }

    /**
     * Closes the connection. Idempotent.
     */
    public void disconnect()
    {
        shutdown();
    }

    @Override
    public void close()
    {
        disconnect();
    }

    public boolean isConnected()
    {
        return connected;
    }

    /**
     * Returns whether the server closed the connection before sending any frame,
     * which is how a full server turns a client away.
     */
    public boolean wasRejected()
    {
        return rejected;
    }

    // ========== Sending ==========

    /**
     * Queues a {@code player_action} message.
     *
     * @param action the action name
     * @param data   the action payload, or null
     * @return false if not connected or the send queue is full
     */
    public boolean sendPlayerAction(String action, Object data)
    {
        return send(new ClientMessage.PlayerAction(action, data));
    }

    /**
     * Queues a {@code skill_use} message.
     *
     * @param skillIndex the skill slot
     * @param targetId   the target entity id, or null
     * @return false if not connected or the send queue is full
     */
    public boolean sendSkillUse(int skillIndex, String targetId)
    {
        return send(new ClientMessage.SkillUse(skillIndex, targetId));
    }

    /**
     * Queues a raw text payload. Useful for protocol tooling.
     *
     * @param payload the JSON text
     * @return false if not connected or the send queue is full
     */
    public boolean sendRaw(String payload)
    {
        Objects.requireNonNull(payload, "payload");
        return connected && outgoing.offer(payload);
    }

    private boolean send(ClientMessage message)
    {
        return sendRaw(MessageCodec.encode(message));
    }

    // ========== Loops ==========

    private void receiveLoop()
    {
        try
        {
            while (connected)
            {
                byte[] payload = Framer.decode(in, maxFrameLength);
                receivedAnyFrame = true;
                deliver(new String(payload, StandardCharsets.UTF_8));
            }
        }
        catch (IOException e)
        {
            if (connected)
            {
                if (!receivedAnyFrame)
                {
                    rejected = true;
                    LOG.info("Server closed the connection before sending state; treating as rejection");
                }
                else
                {
                    LOG.info("Connection lost: {}", e.getMessage());
                }
            }
        }
        finally
        {
            shutdown();
        }
    }

    private void deliver(String payload)
    {
        JsonObject state;
        try
        {
            state = MessageCodec.decodeSnapshot(payload);
        }
        catch (ProtocolException e)
        {
            LOG.warn("Ignoring malformed state: {}", e.getMessage());
            return;
        }

        Consumer<JsonObject> handler = stateHandler;
        if (handler != null)
        {
            try
            {
                handler.accept(state);
            }
            catch (Exception e)
            {
                LOG.error("State handler error", e);
            }
        }
    }

    private void sendLoop()
    {
        while (connected)
        {
            try
            {
                String message = outgoing.poll(SEND_POLL_MS, TimeUnit.MILLISECONDS);
                if (message == null)
                {
                    continue;
                }
                Framer.write(out, message.getBytes(StandardCharsets.UTF_8));
                out.flush();
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
                break;
            }
            catch (IOException e)
            {
                if (connected)
                {
                    LOG.warn("Send failed: {}", e.getMessage());
                }
                break;
            }
        }
        shutdown();
    }

    private void shutdown()
    {
        Runnable handler;
        synchronized (this)
        {
            if (!connected)
            {
                return;
            }
            connected = false;
            handler = disconnectHandler;
            try
            {
                socket.close();
            }
            catch (IOException e)
            {
                LOG.debug("Error closing socket: {}", e.getMessage());
            }
        }

        outgoing.clear();
        LOG.info("Disconnected");

        if (handler != null)
        {
            try
            {
                handler.run();
            }
            catch (Exception e)
            {
                LOG.error("Disconnect handler error", e);
            }
        }
    }
}
