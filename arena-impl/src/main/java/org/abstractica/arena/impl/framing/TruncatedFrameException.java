package org.abstractica.arena.impl.framing;

import java.io.EOFException;

/**
 * The stream ended before a frame was complete.
 *
 * <p>The partial frame is lost and the connection must be treated as closed.</p>
 */
public class TruncatedFrameException extends EOFException
{
    private final long expected;
    private final long received;
    private final boolean inHeader;

    public TruncatedFrameException(long expected, long received, boolean inHeader)
    {
        super((inHeader ? "Stream closed inside frame header: " : "Stream closed inside frame payload: ")
                + received + " of " + expected + " bytes");
        this.expected = expected;
        this.received = received;
        this.inHeader = inHeader;
    }

    public long getExpected()
    {
        return expected;
    }

    public long getReceived()
    {
        return received;
    }

    /**
     * Returns whether the stream ended before the length prefix was complete.
     */
    public boolean isInHeader()
    {
        return inHeader;
    }
}
