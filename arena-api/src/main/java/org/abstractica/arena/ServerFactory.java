package org.abstractica.arena;

/**
 * Factory for creating Server instances.
 *
 * <pre>{@code
 * ServerFactory factory = new DefaultServerFactory();
 * Server server = factory.builder()
 *     .config(config)
 *     .gameLogic(game)
 *     .build();
 * }</pre>
 */
public interface ServerFactory
{
    /**
     * Creates a new server builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a Server.
     */
    interface Builder
    {
        /**
         * Sets the server configuration.
         *
         * <p>Optional. Defaults to {@code ServerConfig.builder().build()}.</p>
         *
         * @param config the configuration
         * @return this builder
         */
        Builder config(ServerConfig config);

        /**
         * Sets the game logic that owns the shared simulation state.
         *
         * @param gameLogic the game logic collaborator
         * @return this builder
         */
        Builder gameLogic(GameLogic gameLogic);

        /**
         * Builds the server.
         *
         * @return the configured server, not yet started
         * @throws IllegalStateException if required parameters are missing
         */
        Server build();
    }
}
