package org.abstractica.arena.impl.routing;

import org.abstractica.arena.ClientMessage;
import org.abstractica.arena.handlers.ErrorHandler;
import org.abstractica.arena.impl.protocol.InboundMessage;
import org.abstractica.arena.impl.protocol.MessageCodec;
import org.abstractica.arena.impl.protocol.ProtocolException;
import org.abstractica.arena.impl.simulation.SimulationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Consumes the inbound message queue and applies each message to the game logic.
 *
 * <p>A single router thread drains the queue, so messages from one connection
 * are applied in the order they were received. Malformed and unrecognized
 * messages are dropped; neither ever disconnects the sender.</p>
 */
public class Router
{
    private static final Logger LOG = LoggerFactory.getLogger(Router.class);
    private static final long POLL_TIMEOUT_MS = 100;

    private final BlockingQueue<InboundMessage> inboundQueue;
    private final SimulationContext context;
    private final AtomicBoolean running;
    private final AtomicLong dispatched;
    private final AtomicLong dropped;

    private volatile ErrorHandler errorHandler;
    private Thread routerThread;

    public Router(BlockingQueue<InboundMessage> inboundQueue, SimulationContext context)
    {
        this.inboundQueue = Objects.requireNonNull(inboundQueue, "inboundQueue");
        this.context = Objects.requireNonNull(context, "context");
        this.running = new AtomicBoolean(false);
        this.dispatched = new AtomicLong(0);
        this.dropped = new AtomicLong(0);
    }

    /**
     * Sets the handler for exceptions thrown by the game logic.
     *
     * @param errorHandler the handler, or null to only log
     */
    public void setErrorHandler(ErrorHandler errorHandler)
    {
        this.errorHandler = errorHandler;
    }

    // ========== Lifecycle ==========

    /**
     * Starts the consume loop.
     */
    public void start()
    {
        if (!running.compareAndSet(false, true))
        {
            throw new IllegalStateException("Router already started");
        }

        routerThread = new Thread(this::consumeLoop, "message-router");
        routerThread.setDaemon(true);
        routerThread.start();
    }

    /**
     * Stops the consume loop; it exits within one poll timeout.
     */
    public void stop()
    {
        if (!running.compareAndSet(true, false))
        {
            return;
        }

        if (routerThread != null)
        {
            try
            {
                routerThread.join(1000);
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void consumeLoop()
    {
        LOG.debug("Router started");

        while (running.get())
        {
            InboundMessage message;
            try
            {
                message = inboundQueue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
                break;
            }

            if (message != null)
            {
                dispatch(message.connectionId(), message.payload());
            }
        }

        LOG.debug("Router stopped");
    }

    // ========== Dispatch ==========

    /**
     * Decodes one payload and applies it to the game logic under the state lock.
     *
     * <p>Never throws: protocol errors and game-logic failures are logged and
     * the message is dropped.</p>
     *
     * @param connectionId the sending connection
     * @param payload      the raw JSON text
     */
    public void dispatch(String connectionId, String payload)
    {
        ClientMessage message;
        try
        {
            message = MessageCodec.decode(payload);
        }
        catch (ProtocolException e)
        {
            dropped.incrementAndGet();
            LOG.warn("Dropping malformed message from {}: {}", connectionId, e.getMessage());
            return;
        }

        try
        {
            if (message instanceof ClientMessage.PlayerAction action)
            {
                context.withState(logic -> logic.onPlayerAction(connectionId, action));
                dispatched.incrementAndGet();
            }
            else if (message instanceof ClientMessage.SkillUse skillUse)
            {
                context.withState(logic -> logic.onSkillUse(connectionId, skillUse));
                dispatched.incrementAndGet();
            }
            else if (message instanceof ClientMessage.Unrecognized unrecognized)
            {
                dropped.incrementAndGet();
                LOG.debug("Ignoring message of unknown type '{}' from {}", unrecognized.type(), connectionId);
            }
        }
        catch (RuntimeException e)
        {
            LOG.error("Game logic failed on {} from {}", message, connectionId, e);
            notifyError(connectionId, message, e);
        }
    }

    private void notifyError(String connectionId, ClientMessage message, Exception exception)
    {
        ErrorHandler handler = errorHandler;
        if (handler == null)
        {
            return;
        }

        try
        {
            handler.handle(connectionId, message, exception);
        }
        catch (Exception e)
        {
            LOG.error("Error handler threw", e);
        }
    }

    // ========== Stats ==========

    public long getDispatched()
    {
        return dispatched.get();
    }

    public long getDropped()
    {
        return dropped.get();
    }
}
