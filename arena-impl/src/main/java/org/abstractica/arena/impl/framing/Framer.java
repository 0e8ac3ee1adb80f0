package org.abstractica.arena.impl.framing;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Encodes and decodes length-prefixed frames.
 *
 * <p>A frame is a 4-byte big-endian unsigned payload length followed by the
 * payload bytes.</p>
 */
public final class Framer
{
    /** Size of the length prefix in bytes. */
    public static final int HEADER_LENGTH = 4;

    private Framer() {}

    // ========== Encoding ==========

    /**
     * Prepends the length prefix to a payload.
     *
     * @param payload the payload bytes
     * @return a new array holding the complete frame
     */
    public static byte[] encode(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");

        ByteBuffer buffer = ByteBuffer.allocate(HEADER_LENGTH + payload.length);
        buffer.putInt(payload.length);
        buffer.put(payload);
        return buffer.array();
    }

    /**
     * Writes one frame to a stream without copying the payload.
     *
     * <p>The caller is responsible for flushing and for serializing
     * concurrent writers.</p>
     *
     * @param out     the stream to write to
     * @param payload the payload bytes
     * @throws IOException if the stream fails
     */
    public static void write(OutputStream out, byte[] payload) throws IOException
    {
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(payload, "payload");

        int length = payload.length;
        out.write((length >>> 24) & 0xFF);
        out.write((length >>> 16) & 0xFF);
        out.write((length >>> 8) & 0xFF);
        out.write(length & 0xFF);
        out.write(payload);
    }

    // ========== Decoding ==========

    /**
     * Reads exactly one frame, blocking until it is complete.
     *
     * @param in             the stream to read from
     * @param maxFrameLength largest payload length accepted
     * @return the payload bytes
     * @throws TruncatedFrameException if the stream ends inside the header or payload
     * @throws FrameTooLargeException  if the declared length exceeds {@code maxFrameLength}
     * @throws IOException             if the stream fails
     */
    public static byte[] decode(InputStream in, int maxFrameLength) throws IOException
    {
        Objects.requireNonNull(in, "in");

        byte[] header = in.readNBytes(HEADER_LENGTH);
        if (header.length < HEADER_LENGTH)
        {
            throw new TruncatedFrameException(HEADER_LENGTH, header.length, true);
        }

        long length = Integer.toUnsignedLong(ByteBuffer.wrap(header).getInt());
        if (length > maxFrameLength)
        {
            throw new FrameTooLargeException(length, maxFrameLength);
        }

        byte[] payload = in.readNBytes((int) length);
        if (payload.length < length)
        {
            throw new TruncatedFrameException(length, payload.length, false);
        }
        return payload;
    }
}
