package org.abstractica.arena.impl.server;

import org.abstractica.arena.GameLogic;
import org.abstractica.arena.Server;
import org.abstractica.arena.ServerConfig;
import org.abstractica.arena.ServerStats;
import org.abstractica.arena.handlers.ErrorHandler;
import org.abstractica.arena.impl.broadcast.Broadcaster;
import org.abstractica.arena.impl.connection.Connection;
import org.abstractica.arena.impl.connection.ConnectionRegistry;
import org.abstractica.arena.impl.framing.TruncatedFrameException;
import org.abstractica.arena.impl.protocol.InboundMessage;
import org.abstractica.arena.impl.routing.Router;
import org.abstractica.arena.impl.simulation.SimulationClock;
import org.abstractica.arena.impl.simulation.SimulationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Default implementation of the Server interface.
 *
 * <p>Runs, as independent threads, an accept loop, one reader and one writer
 * per connection, the message router and the simulation clock. They share the
 * connection registry, the inbound message queue and the simulation lock.</p>
 */
public class DefaultServer implements Server
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultServer.class);
    private static final int ACCEPT_BACKLOG = 50;
    private static final long ENQUEUE_TIMEOUT_MS = 100;

    /** Sent unframed to a client turned away because the server is full. */
    public static final byte[] REJECTION_NOTICE = "Server full".getBytes(StandardCharsets.UTF_8);

    private final ServerConfig config;
    private final SimulationContext context;
    private final ConnectionRegistry registry;
    private final BlockingQueue<InboundMessage> inboundQueue;
    private final Router router;
    private final Broadcaster broadcaster;
    private final SimulationClock clock;
    private final DefaultServerStats stats;

    // Ids announced to the game logic; guarded by the simulation lock
    private final Set<String> joinedPlayers = new HashSet<>();

    private ServerState state;
    private volatile boolean running;
    private ServerSocket serverSocket;
    private Thread acceptThread;

    /**
     * Creates a new server.
     *
     * <p>Use {@link DefaultServerFactory} to create instances.</p>
     */
    DefaultServer(ServerConfig config, GameLogic gameLogic)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.context = new SimulationContext(gameLogic);
        this.registry = new ConnectionRegistry(config.maxPlayers());
        this.inboundQueue = new LinkedBlockingQueue<>(config.inboundQueueCapacity());
        this.router = new Router(inboundQueue, context);
        this.broadcaster = new Broadcaster(registry, this::onConnectionRemoved);
        this.clock = new SimulationClock(context, broadcaster::broadcast, config.frameInterval());
        this.stats = new DefaultServerStats(registry, router, clock);

        this.state = ServerState.CREATED;
        this.running = false;
    }

    // ========== Server Interface ==========

    @Override
    public synchronized void start()
    {
        if (state != ServerState.CREATED)
        {
            throw new IllegalStateException("Server cannot be started from state " + state);
        }

        LOG.info("Starting server on {}:{} (max {} players, {} ticks/s)",
                config.host(), config.port(), config.maxPlayers(), config.tickRate());

        serverSocket = bind();

        running = true;
        state = ServerState.STARTED;

        router.start();
        clock.start();

        acceptThread = new Thread(this::acceptLoop, "server-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();

        LOG.info("Server started on {}", getLocalAddress());
    }

    private ServerSocket bind()
    {
        ServerSocket socket = null;
        try
        {
            socket = new ServerSocket();
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(config.host(), config.port()), ACCEPT_BACKLOG);
            return socket;
        }
        catch (IOException e)
        {
            closeQuietly(socket);
            throw new UncheckedIOException(
                    "Failed to bind " + config.host() + ":" + config.port(), e);
        }
    }

    @Override
    public void stop()
    {
        synchronized (this)
        {
            if (state != ServerState.STARTED)
            {
                state = ServerState.STOPPED;
                return;
            }
            state = ServerState.STOPPED;
            running = false;
        }

        LOG.info("Stopping server");

        closeQuietly(serverSocket);
        if (acceptThread != null)
        {
            try
            {
                acceptThread.join(1000);
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
            }
        }

        clock.stop();
        router.stop();

        for (Connection connection : registry.snapshotAll())
        {
            disconnect(connection);
        }

        LOG.info("Server stopped ({})", stats);
    }

    @Override
    public void close()
    {
        stop();
    }

    @Override
    public void onError(ErrorHandler handler)
    {
        router.setErrorHandler(handler);
    }

    @Override
    public void withGameState(Runnable action)
    {
        Objects.requireNonNull(action, "action");
        context.withState(logic -> action.run());
    }

    @Override
    public <T> T readGameState(Supplier<T> reader)
    {
        Objects.requireNonNull(reader, "reader");
        return context.readState(logic -> reader.get());
    }

    @Override
    public boolean isRunning()
    {
        return running;
    }

    @Override
    public InetSocketAddress getLocalAddress()
    {
        ServerSocket socket = serverSocket;
        if (socket == null)
        {
            return null;
        }
        return (InetSocketAddress) socket.getLocalSocketAddress();
    }

    @Override
    public ServerStats getStats()
    {
        return stats;
    }

    public synchronized ServerState getState()
    {
        return state;
    }

    ConnectionRegistry getRegistry()
    {
        return registry;
    }

    // ========== Accept Loop ==========

    private void acceptLoop()
    {
        LOG.debug("Accept loop started");

        while (running)
        {
            Socket socket;
            try
            {
                socket = serverSocket.accept();
            }
            catch (IOException e)
            {
                if (!running || serverSocket.isClosed())
                {
                    break;
                }
                LOG.error("Accept failed", e);
                continue;
            }

            try
            {
                handleAccepted(socket);
            }
            catch (Exception e)
            {
                LOG.error("Error handling new connection from {}", socket.getRemoteSocketAddress(), e);
                closeQuietly(socket);
            }
        }

        LOG.debug("Accept loop stopped");
    }

    private void handleAccepted(Socket socket) throws IOException
    {
        socket.setTcpNoDelay(true);

        Optional<Connection> added = registry.tryAdd(id -> new Connection(
                id,
                socket,
                config.maxFrameLength(),
                config.outboundQueueCapacity()
        ));

        if (added.isEmpty())
        {
            stats.recordRejected();
            LOG.info("Rejecting {}: server full ({} players)",
                    socket.getRemoteSocketAddress(), config.maxPlayers());
            reject(socket);
            return;
        }

        Connection connection = added.get();
        stats.recordAccepted();
        LOG.info("Player {} connected from {}", connection.getId(), connection.getRemoteAddress());

        if (!announceJoin(connection))
        {
            LOG.debug("{} was torn down before joining", connection.getId());
            return;
        }
        if (!running)
        {
            disconnect(connection);
            return;
        }

        connection.startWriter(this::disconnect);

        Thread reader = new Thread(() -> receiveLoop(connection), "conn-reader-" + connection.getId());
        reader.setDaemon(true);
        reader.start();
    }

    private void reject(Socket socket)
    {
        try
        {
            OutputStream out = socket.getOutputStream();
            out.write(REJECTION_NOTICE);
            out.flush();
        }
        catch (IOException e)
        {
            LOG.debug("Could not deliver rejection notice to {}: {}",
                    socket.getRemoteSocketAddress(), e.getMessage());
        }
        finally
        {
            closeQuietly(socket);
        }
    }

    // ========== Per-Connection Receive ==========

    private void receiveLoop(Connection connection)
    {
        LOG.debug("Reader for {} started", connection.getId());

        try
        {
            while (running && connection.isConnected())
            {
                String payload = connection.receiveOne();
                enqueue(connection, new InboundMessage(connection.getId(), payload));
            }
        }
        catch (TruncatedFrameException e)
        {
            if (e.isInHeader() && e.getReceived() == 0)
            {
                LOG.debug("{} closed the connection", connection.getId());
            }
            else
            {
                LOG.warn("{} disconnected mid-frame: {}", connection.getId(), e.getMessage());
            }
        }
        catch (IOException e)
        {
            if (connection.isConnected())
            {
                LOG.warn("Receive from {} failed: {}", connection.getId(), e.getMessage());
            }
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
        finally
        {
            disconnect(connection);
        }

        LOG.debug("Reader for {} stopped", connection.getId());
    }

    private void enqueue(Connection connection, InboundMessage message) throws InterruptedException
    {
        while (running && connection.isConnected())
        {
            if (inboundQueue.offer(message, ENQUEUE_TIMEOUT_MS, TimeUnit.MILLISECONDS))
            {
                return;
            }
        }
    }

    // ========== Teardown ==========

    private void disconnect(Connection connection)
    {
        if (registry.removeAndClose(connection))
        {
            onConnectionRemoved(connection);
        }
    }

    private void onConnectionRemoved(Connection connection)
    {
        LOG.info("Player {} disconnected", connection.getId());
        String id = connection.getId();
        try
        {
            context.withState(logic ->
            {
                if (joinedPlayers.remove(id))
                {
                    logic.onPlayerLeft(id);
                }
            });
        }
        catch (RuntimeException e)
        {
            LOG.error("Game logic failed handling leave of {}", id, e);
        }
    }

    /**
     * Announces a new connection to the game logic unless it has already been
     * torn down. Join and leave both run under the simulation lock, so a leave
     * is only delivered for a player whose join was delivered.
     *
     * @return false if the connection was closed before it could join
     */
    private boolean announceJoin(Connection connection)
    {
        String id = connection.getId();
        try
        {
            return context.readState(logic ->
            {
                if (!connection.isConnected())
                {
                    return false;
                }
                joinedPlayers.add(id);
                logic.onPlayerJoined(id);
                return true;
            });
        }
        catch (RuntimeException e)
        {
            LOG.error("Game logic failed handling join of {}", id, e);
            return true;
        }
    }

    private static void closeQuietly(AutoCloseable closeable)
    {
        if (closeable == null)
        {
            return;
        }
        try
        {
            closeable.close();
        }
        catch (Exception e)
        {
            LOG.debug("Error closing {}: {}", closeable, e.getMessage());
        }
    }
}
