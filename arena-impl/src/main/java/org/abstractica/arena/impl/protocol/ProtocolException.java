package org.abstractica.arena.impl.protocol;

/**
 * A payload is not a well-formed client message.
 *
 * <p>Only the offending message is dropped; the connection stays usable.</p>
 */
public class ProtocolException extends Exception
{
    public ProtocolException(String message)
    {
        super(message);
    }

    public ProtocolException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
