package org.abstractica.debugclient.impl.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * MessageConnection backed by a JDK {@link WebSocket}.
 *
 * <p>The JDK delivers inbound data through listener callbacks; they are
 * queued here and handed out one frame at a time by {@link #receive()}.</p>
 */
class WebSocketConnection implements MessageConnection, WebSocket.Listener
{
    private static final Logger LOG = LoggerFactory.getLogger(WebSocketConnection.class);
    private static final long CLOSE_TIMEOUT_MS = 5000;

    private final BlockingQueue<Inbound> inbound = new LinkedBlockingQueue<>();
    private final Object attachLock = new Object();
    private final StringBuilder pendingSurrogate = new StringBuilder(1);

    private volatile WebSocket webSocket;
    private volatile boolean open;
    private volatile boolean inputClosed;

    /**
     * Items queued by the listener callbacks.
     */
    private sealed interface Inbound
    {
        record Data(Frame frame) implements Inbound {}
        record Closed(int statusCode, String reason) implements Inbound {}
        record Failed(Throwable cause) implements Inbound {}
    }

    // ========== MessageConnection ==========

    @Override
    public synchronized void send(String message) throws IOException
    {
        WebSocket socket = webSocket;
        if (!open || socket == null)
        {
            throw new IOException("Connection is closed");
        }

        try
        {
            socket.sendText(message, true).get();
        }
        catch (ExecutionException e)
        {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io)
            {
                throw io;
            }
            throw new IOException("Send failed", cause);
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while sending");
        }
    }

    @Override
    public Optional<Frame> receive() throws IOException, InterruptedException
    {
        if (inputClosed)
        {
            return Optional.empty();
        }

        Inbound item = inbound.take();
        if (item instanceof Inbound.Data data)
        {
            requestNext();
            return Optional.of(data.frame());
        }

        inputClosed = true;
        if (item instanceof Inbound.Failed failed)
        {
            Throwable cause = failed.cause();
            if (cause instanceof IOException io)
            {
                throw io;
            }
            throw new IOException("WebSocket failed", cause);
        }

        Inbound.Closed closed = (Inbound.Closed) item;
        LOG.debug("WebSocket closed by peer: {} {}", closed.statusCode(), closed.reason());
        return Optional.empty();
    }

    @Override
    public void close(int statusCode, String reason)
    {
        WebSocket socket = webSocket;
        if (socket == null || socket.isOutputClosed())
        {
            return;
        }

        try
        {
            socket.sendClose(statusCode, reason).get(CLOSE_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        }
        catch (ExecutionException | TimeoutException e)
        {
            LOG.debug("Graceful close failed: {}", e.toString());
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
        finally
        {
            open = false;
        }
    }

    @Override
    public void abort()
    {
        open = false;
        WebSocket socket = webSocket;
        if (socket != null)
        {
            socket.abort();
        }
        inbound.offer(new Inbound.Closed(WebSocket.NORMAL_CLOSURE, "aborted"));
    }

    @Override
    public boolean isOpen()
    {
        WebSocket socket = webSocket;
        return open && socket != null && !socket.isOutputClosed();
    }

    /**
     * Binds the socket once the handshake completed.
     *
     * <p>Called from {@link #onOpen} and by the connector, whichever runs first.</p>
     */
    void attach(WebSocket socket)
    {
        synchronized (attachLock)
        {
            if (webSocket == null)
            {
                webSocket = socket;
                open = !socket.isOutputClosed() && !socket.isInputClosed();
            }
        }
    }

    private void requestNext()
    {
        WebSocket socket = webSocket;
        if (socket != null && !socket.isInputClosed())
        {
            socket.request(1);
        }
    }

    // ========== WebSocket.Listener ==========

    @Override
    public void onOpen(WebSocket webSocket)
    {
        attach(webSocket);
        webSocket.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last)
    {
        // Next frame is requested by receive(), so at most one frame is queued
        inbound.offer(new Inbound.Data(new Frame(encode(data, last), last)));
        return null;
    }

    @Override
    public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last)
    {
        LOG.debug("Ignoring binary frame of {} bytes", data.remaining());
        webSocket.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason)
    {
        open = false;
        inbound.offer(new Inbound.Closed(statusCode, reason));
        return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error)
    {
        open = false;
        inbound.offer(new Inbound.Failed(error));
    }

    /**
     * Encodes a text chunk, holding back a trailing high surrogate until its
     * low half arrives with the next chunk.
     */
    private byte[] encode(CharSequence data, boolean last)
    {
        StringBuilder text = new StringBuilder(pendingSurrogate.length() + data.length());
        text.append(pendingSurrogate).append(data);
        pendingSurrogate.setLength(0);

        int length = text.length();
        if (!last && length > 0 && Character.isHighSurrogate(text.charAt(length - 1)))
        {
            pendingSurrogate.append(text.charAt(length - 1));
            text.setLength(length - 1);
        }
        return text.toString().getBytes(StandardCharsets.UTF_8);
    }
}
