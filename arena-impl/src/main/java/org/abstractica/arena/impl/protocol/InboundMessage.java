package org.abstractica.arena.impl.protocol;

import java.util.Objects;

/**
 * A raw message read from one connection, waiting for the router.
 *
 * @param connectionId the sending connection
 * @param payload      the undecoded text payload
 */
public record InboundMessage(String connectionId, String payload)
{
    public InboundMessage
    {
        Objects.requireNonNull(connectionId, "connectionId");
        Objects.requireNonNull(payload, "payload");
    }
}
