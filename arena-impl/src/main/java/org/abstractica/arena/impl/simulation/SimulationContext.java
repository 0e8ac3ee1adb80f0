package org.abstractica.arena.impl.simulation;

import org.abstractica.arena.GameLogic;
import org.abstractica.arena.GameStateSnapshot;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * The shared simulation state and the lock that guards it.
 *
 * <p>Created once per server and handed to every component that reads or
 * mutates game state. All access to the {@link GameLogic} goes through
 * {@link #withState(Consumer)} or {@link #readState(Function)}, which hold the
 * lock for the duration of the call only.</p>
 */
public class SimulationContext
{
    private final GameLogic gameLogic;
    private final ReentrantLock stateLock;

    public SimulationContext(GameLogic gameLogic)
    {
        this.gameLogic = Objects.requireNonNull(gameLogic, "gameLogic");
        this.stateLock = new ReentrantLock();
    }

    /**
     * Runs a mutation with the state lock held.
     *
     * @param action the mutation
     */
    public void withState(Consumer<GameLogic> action)
    {
        Objects.requireNonNull(action, "action");

        stateLock.lock();
        try
        {
            action.accept(gameLogic);
        }
        finally
        {
            stateLock.unlock();
        }
    }

    /**
     * Computes a value with the state lock held.
     *
     * @param reader the computation
     * @param <T>    the result type
     * @return the computed value
     */
    public <T> T readState(Function<GameLogic, T> reader)
    {
        Objects.requireNonNull(reader, "reader");

        stateLock.lock();
        try
        {
            return reader.apply(gameLogic);
        }
        finally
        {
            stateLock.unlock();
        }
    }

    /**
     * Advances the simulation and captures the resulting snapshot under one lock hold.
     *
     * @param deltaTime seconds since the previous tick
     * @return the snapshot taken right after the advance
     */
    public GameStateSnapshot advanceAndSnapshot(double deltaTime)
    {
        return readState(logic ->
        {
            logic.advance(deltaTime);
            return logic.snapshot();
        });
    }

    /**
     * Returns a snapshot of the current state.
     */
    public GameStateSnapshot snapshot()
    {
        return readState(GameLogic::snapshot);
    }
}
