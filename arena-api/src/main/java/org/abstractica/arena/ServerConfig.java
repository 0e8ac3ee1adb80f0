package org.abstractica.arena;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable server configuration.
 *
 * @param host                  the host name or address to listen on
 * @param port                  the port to listen on (0 for an ephemeral port)
 * @param maxPlayers            maximum number of simultaneously connected players
 * @param tickRate              simulation ticks per second
 * @param maxFrameLength        largest accepted inbound frame payload in bytes
 * @param outboundQueueCapacity frames buffered per connection before it counts as too slow
 * @param inboundQueueCapacity  messages buffered between the receive loops and the router
 */
public record ServerConfig(
        String host,
        int port,
        int maxPlayers,
        int tickRate,
        int maxFrameLength,
        int outboundQueueCapacity,
        int inboundQueueCapacity
)
{
    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 8080;
    public static final int DEFAULT_MAX_PLAYERS = 4;
    public static final int DEFAULT_TICK_RATE = 60;
    public static final int DEFAULT_MAX_FRAME_LENGTH = 1024 * 1024;
    public static final int DEFAULT_OUTBOUND_QUEUE_CAPACITY = 64;
    public static final int DEFAULT_INBOUND_QUEUE_CAPACITY = 1024;

    public ServerConfig
    {
        Objects.requireNonNull(host, "host");
        if (port < 0 || port > 65535)
        {
            throw new IllegalArgumentException("Port must be 0-65535: " + port);
        }
        if (maxPlayers <= 0)
        {
            throw new IllegalArgumentException("maxPlayers must be positive: " + maxPlayers);
        }
        if (tickRate <= 0)
        {
            throw new IllegalArgumentException("tickRate must be positive: " + tickRate);
        }
        if (maxFrameLength <= 0)
        {
            throw new IllegalArgumentException("maxFrameLength must be positive: " + maxFrameLength);
        }
        if (outboundQueueCapacity <= 0)
        {
            throw new IllegalArgumentException("outboundQueueCapacity must be positive: " + outboundQueueCapacity);
        }
        if (inboundQueueCapacity <= 0)
        {
            throw new IllegalArgumentException("inboundQueueCapacity must be positive: " + inboundQueueCapacity);
        }
    }

    /**
     * Returns the target interval between two ticks.
     *
     * @return {@code 1 / tickRate} seconds
     */
    public Duration frameInterval()
    {
        return Duration.ofNanos(1_000_000_000L / tickRate);
    }

    /**
     * Creates a builder pre-populated with the defaults.
     *
     * @return a new builder
     */
    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Builder for {@link ServerConfig}.
     */
    public static final class Builder
    {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private int maxPlayers = DEFAULT_MAX_PLAYERS;
        private int tickRate = DEFAULT_TICK_RATE;
        private int maxFrameLength = DEFAULT_MAX_FRAME_LENGTH;
        private int outboundQueueCapacity = DEFAULT_OUTBOUND_QUEUE_CAPACITY;
        private int inboundQueueCapacity = DEFAULT_INBOUND_QUEUE_CAPACITY;

        private Builder()
        {
        }

        public Builder host(String host)
        {
            this.host = host;
            return this;
        }

        public Builder port(int port)
        {
            this.port = port;
            return this;
        }

        public Builder maxPlayers(int maxPlayers)
        {
            this.maxPlayers = maxPlayers;
            return this;
        }

        public Builder tickRate(int tickRate)
        {
            this.tickRate = tickRate;
            return this;
        }

        public Builder maxFrameLength(int maxFrameLength)
        {
            this.maxFrameLength = maxFrameLength;
            return this;
        }

        public Builder outboundQueueCapacity(int outboundQueueCapacity)
        {
            this.outboundQueueCapacity = outboundQueueCapacity;
            return this;
        }

        public Builder inboundQueueCapacity(int inboundQueueCapacity)
        {
            this.inboundQueueCapacity = inboundQueueCapacity;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return the validated configuration
         * @throws IllegalArgumentException if a value is out of range
         */
        public ServerConfig build()
        {
            return new ServerConfig(
                    host,
                    port,
                    maxPlayers,
                    tickRate,
                    maxFrameLength,
                    outboundQueueCapacity,
                    inboundQueueCapacity
            );
        }
    }
}
