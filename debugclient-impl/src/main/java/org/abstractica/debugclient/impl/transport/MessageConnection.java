package org.abstractica.debugclient.impl.transport;

import java.io.IOException;
import java.util.Optional;

/**
 * A message-oriented duplex connection to the debug server.
 *
 * <p>Outbound messages are sent whole; inbound messages arrive as a sequence
 * of {@link Frame frames}. A connection is used by one physical connect
 * attempt only and is never reopened.</p>
 */
public interface MessageConnection extends AutoCloseable
{
    /**
     * Close status for a normal shutdown.
     */
    int NORMAL_CLOSURE = 1000;

    /**
     * Close status for an inbound message that exceeds the receive buffer.
     */
    int MESSAGE_TOO_BIG = 1009;

    /**
     * Sends one complete text message.
     *
     * <p>Thread-safe. Returns once the message was handed to the network.</p>
     *
     * @param message the message text
     * @throws IOException if the connection is closed or the write failed
     */
    void send(String message) throws IOException;

    /**
     * Waits for the next inbound frame.
     *
     * <p>Called from a single reader thread.</p>
     *
     * @return the frame, or empty once the peer closed the connection
     * @throws IOException          if the connection failed
     * @throws InterruptedException if the waiting thread was interrupted
     */
    Optional<Frame> receive() throws IOException, InterruptedException;

    /**
     * Starts a graceful close.
     *
     * <p>Best effort: failures are logged, not thrown.</p>
     *
     * @param statusCode the close status
     * @param reason     a short reason
     */
    void close(int statusCode, String reason);

    /**
     * Closes the connection immediately and wakes up a blocked {@link #receive()}.
     */
    void abort();

    /**
     * Returns whether messages can still be sent.
     *
     * @return true while open
     */
    boolean isOpen();

    /**
     * Equivalent to {@link #abort()}.
     */
    @Override
    default void close()
    {
        abort();
    }
}
