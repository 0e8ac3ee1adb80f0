package org.abstractica.arena.impl.server;

import org.abstractica.arena.GameLogic;
import org.abstractica.arena.Server;
import org.abstractica.arena.ServerConfig;
import org.abstractica.arena.ServerFactory;

import java.util.Objects;

/**
 * Default implementation of ServerFactory.
 *
 * <p>Creates DefaultServer instances using a builder pattern.</p>
 */
public class DefaultServerFactory implements ServerFactory
{
    @Override
    public Builder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private ServerConfig config = ServerConfig.builder().build();
        private GameLogic gameLogic;

        @Override
        public Builder config(ServerConfig config)
        {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        @Override
        public Builder gameLogic(GameLogic gameLogic)
        {
            this.gameLogic = Objects.requireNonNull(gameLogic, "gameLogic");
            return this;
        }

        @Override
        public DefaultServer build()
        {
            if (gameLogic == null)
            {
                throw new IllegalStateException("Game logic must be specified");
            }
            return new DefaultServer(config, gameLogic);
        }
    }
}
