package org.abstractica.arena.impl.framing;

import java.io.IOException;

/**
 * A frame declared a payload longer than the configured maximum.
 *
 * <p>Raised before any payload memory is allocated.</p>
 */
public class FrameTooLargeException extends IOException
{
    private final long declaredLength;

    public FrameTooLargeException(long declaredLength, int maxFrameLength)
    {
        super("Frame length " + declaredLength + " exceeds maximum " + maxFrameLength);
        this.declaredLength = declaredLength;
    }

    public long getDeclaredLength()
    {
        return declaredLength;
    }
}
