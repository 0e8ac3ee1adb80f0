package org.abstractica.arena.impl.simulation;

import org.abstractica.arena.GameStateSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Fixed-rate loop that advances the simulation and hands each snapshot on.
 *
 * <p>Each tick measures the wall-clock gap since the previous tick, advances
 * the simulation by that gap under the state lock, passes the snapshot to the
 * tick listener outside the lock, then sleeps for whatever remains of the
 * frame interval. Drift is not compensated across ticks.</p>
 */
public class SimulationClock
{
    private static final Logger LOG = LoggerFactory.getLogger(SimulationClock.class);
    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final SimulationContext context;
    private final Consumer<GameStateSnapshot> tickListener;
    private final long frameIntervalNanos;
    private final AtomicBoolean running;
    private final AtomicLong ticks;

    private Thread clockThread;

    /**
     * Creates a stopped clock.
     *
     * @param context       the shared simulation
     * @param tickListener  receives the snapshot of every tick, outside the state lock
     * @param frameInterval target time between tick starts
     */
    public SimulationClock(SimulationContext context, Consumer<GameStateSnapshot> tickListener, Duration frameInterval)
    {
        this.context = Objects.requireNonNull(context, "context");
        this.tickListener = Objects.requireNonNull(tickListener, "tickListener");
        Objects.requireNonNull(frameInterval, "frameInterval");
        if (frameInterval.isNegative() || frameInterval.isZero())
        {
            throw new IllegalArgumentException("Frame interval must be positive");
        }
        this.frameIntervalNanos = frameInterval.toNanos();
        this.running = new AtomicBoolean(false);
        this.ticks = new AtomicLong(0);
    }

    /**
     * Starts the clock thread.
     */
    public void start()
    {
        if (!running.compareAndSet(false, true))
        {
            throw new IllegalStateException("Clock already started");
        }

        clockThread = new Thread(this::tickLoop, "simulation-clock");
        clockThread.setDaemon(true);
        clockThread.start();
    }

    /**
     * Stops the clock and waits briefly for the current tick to finish.
     */
    public void stop()
    {
        if (!running.compareAndSet(true, false))
        {
            return;
        }

        if (clockThread != null)
        {
            clockThread.interrupt();
            try
            {
                clockThread.join(1000);
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
            }
        }
    }

    public boolean isRunning()
    {
        return running.get();
    }

    /**
     * Returns the number of completed ticks.
     */
    public long getTicks()
    {
        return ticks.get();
    }

    // ========== Tick Loop ==========

    private void tickLoop()
    {
        LOG.debug("Simulation clock started ({} ms per tick)",
                TimeUnit.NANOSECONDS.toMillis(frameIntervalNanos));

        long lastTickNanos = System.nanoTime();

        while (running.get())
        {
            long tickStartNanos = System.nanoTime();
            double deltaTime = (tickStartNanos - lastTickNanos) / NANOS_PER_SECOND;
            lastTickNanos = tickStartNanos;

            try
            {
                GameStateSnapshot snapshot = context.advanceAndSnapshot(deltaTime);
                tickListener.accept(snapshot);
            }
            catch (Exception e)
            {
                LOG.error("Error in simulation tick", e);
            }
            ticks.incrementAndGet();

            long remaining = frameIntervalNanos - (System.nanoTime() - tickStartNanos);
            if (remaining > 0)
            {
                try
                {
                    TimeUnit.NANOSECONDS.sleep(remaining);
                }
                catch (InterruptedException e)
                {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        LOG.debug("Simulation clock stopped after {} ticks", ticks.get());
    }
}
