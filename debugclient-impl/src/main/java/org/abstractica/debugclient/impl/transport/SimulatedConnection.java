package org.abstractica.debugclient.impl.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory connection created by {@link SimulatedConnector}.
 *
 * <p>The client side uses the {@link MessageConnection} methods; the test
 * drives the server side through {@link #deliver}, {@link #takeSent},
 * {@link #closeFromServer()} and {@link #failFromServer}.</p>
 */
public class SimulatedConnection implements MessageConnection
{
    private static final Logger LOG = LoggerFactory.getLogger(SimulatedConnection.class);
    private static final Object CLOSED = new Object();

    private final BlockingQueue<Object> toClient = new LinkedBlockingQueue<>();
    private final BlockingQueue<String> toServer = new LinkedBlockingQueue<>();
    private final AtomicInteger closeStatus = new AtomicInteger(-1);
    private volatile boolean open = true;
    private volatile boolean inputClosed;
    private volatile Exception sendFailure;

    SimulatedConnection()
    {
    }

    // ========== MessageConnection ==========

    @Override
    public void send(String message) throws IOException
    {
        Objects.requireNonNull(message, "message");
        Exception failure = sendFailure;
        if (failure instanceof IOException io)
        {
            throw io;
        }
        if (failure instanceof RuntimeException runtime)
        {
            throw runtime;
        }
        if (!open)
        {
            throw new IOException("Connection is closed");
        }
        toServer.add(message);
    }

    @Override
    public Optional<Frame> receive() throws IOException, InterruptedException
    {
        if (inputClosed)
        {
            return Optional.empty();
        }

        Object item = toClient.take();
        if (item instanceof Frame frame)
        {
            return Optional.of(frame);
        }

        inputClosed = true;
        if (item instanceof IOException failure)
        {
            throw failure;
        }
        if (item instanceof RuntimeException failure)
        {
            throw failure;
        }
        return Optional.empty();
    }

    @Override
    public void close(int statusCode, String reason)
    {
        LOG.debug("Client closed simulated connection: {} {}", statusCode, reason);
        closeStatus.compareAndSet(-1, statusCode);
        open = false;
    }

    @Override
    public void abort()
    {
        open = false;
        toClient.add(CLOSED);
    }

    @Override
    public boolean isOpen()
    {
        return open;
    }

    // ========== Server Side ==========

    /**
     * Delivers one complete message to the client in a single frame.
     *
     * @param message the message text
     */
    public void deliver(String message)
    {
        deliverFrames(message);
    }

    /**
     * Delivers one message split across several frames.
     *
     * @param chunks the frame contents, in order
     */
    public void deliverFrames(String... chunks)
    {
        for (int i = 0; i < chunks.length; i++)
        {
            byte[] payload = chunks[i].getBytes(StandardCharsets.UTF_8);
            toClient.add(new Frame(payload, i == chunks.length - 1));
        }
    }

    /**
     * Delivers a raw frame.
     *
     * @param frame the frame
     */
    public void deliverFrame(Frame frame)
    {
        toClient.add(Objects.requireNonNull(frame, "frame"));
    }

    /**
     * Waits for the next message sent by the client.
     *
     * @param timeout how long to wait
     * @return the message, or null on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public String takeSent(Duration timeout) throws InterruptedException
    {
        return toServer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Closes the connection from the server side.
     */
    public void closeFromServer()
    {
        open = false;
        toClient.add(CLOSED);
    }

    /**
     * Breaks the connection with a transport error.
     *
     * @param failure the error the client's reader will see
     */
    public void failFromServer(IOException failure)
    {
        open = false;
        toClient.add(Objects.requireNonNull(failure, "failure"));
    }

    /**
     * Breaks the connection with an unexpected error in the client's reader.
     *
     * @param failure the error the client's reader will see
     */
    public void failReceive(RuntimeException failure)
    {
        open = false;
        toClient.add(Objects.requireNonNull(failure, "failure"));
    }

    /**
     * Makes every following client send fail.
     *
     * @param failure the error to throw
     */
    public void failSends(IOException failure)
    {
        this.sendFailure = failure;
    }

    /**
     * Makes every following client send fail with an unchecked error.
     *
     * @param failure the error to throw
     */
    public void failSends(RuntimeException failure)
    {
        this.sendFailure = failure;
    }

    /**
     * Returns the status of the client's graceful close.
     *
     * @return the close status, or -1 if the client never closed gracefully
     */
    public int getCloseStatus()
    {
        return closeStatus.get();
    }
}
