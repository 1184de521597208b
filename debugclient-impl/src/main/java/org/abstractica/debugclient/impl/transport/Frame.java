package org.abstractica.debugclient.impl.transport;

import java.util.Objects;

/**
 * One received text frame.
 *
 * <p>A logical message may span several frames; the last one has
 * {@code endOfMessage} set.</p>
 *
 * @param payload      the UTF-8 encoded frame content
 * @param endOfMessage whether this frame completes a message
 */
public record Frame(byte[] payload, boolean endOfMessage)
{
    public Frame
    {
        Objects.requireNonNull(payload, "payload");
    }

    public int length()
    {
        return payload.length;
    }
}
