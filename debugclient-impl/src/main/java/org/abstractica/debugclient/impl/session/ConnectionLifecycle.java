package org.abstractica.debugclient.impl.session;

import org.abstractica.debugclient.CancellationScope;
import org.abstractica.debugclient.ConnectionState;
import org.abstractica.debugclient.CredentialProvider;
import org.abstractica.debugclient.SessionListener;
import org.abstractica.debugclient.impl.correlation.RequestCorrelator;
import org.abstractica.debugclient.impl.protocol.DebugMessages;
import org.abstractica.debugclient.impl.protocol.XmlDocuments;
import org.abstractica.debugclient.impl.transport.Connector;
import org.abstractica.debugclient.impl.transport.Frame;
import org.abstractica.debugclient.impl.transport.MessageConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps a debug session connected.
 *
 * <p>A single background thread loops until the session is disposed:</p>
 * <ol>
 *   <li>connect, reporting failures once per distinct failure signature</li>
 *   <li>restore the use path of the previous connection</li>
 *   <li>reassemble inbound frames into messages and hand them to the correlator</li>
 *   <li>tear down: report the loss, cancel the connection scope (which cancels
 *       every request sent on it) and release the connection</li>
 * </ol>
 *
 * <p>The current connection and its scope are published together as one
 * {@link ActiveConnection} handle. Senders take a snapshot of the handle and
 * never hold a lock while sending.</p>
 */
class ConnectionLifecycle implements Runnable
{
    private static final Logger LOG = LoggerFactory.getLogger(ConnectionLifecycle.class);

    private final URI serverUri;
    private final Connector connector;
    private final CredentialProvider credentialProvider;
    private final RequestCorrelator correlator;
    private final SessionListener listener;
    private final UsePathTracker usePath;
    private final DefaultSessionStats stats;
    private final Duration reconnectDelay;
    private final int receiveBufferSize;

    private final CancellationScope sessionScope = new CancellationScope();
    private final CountDownLatch disposeSignal = new CountDownLatch(1);
    private final AtomicBoolean disposing = new AtomicBoolean(false);
    private final AtomicReference<ActiveConnection> active = new AtomicReference<>();
    private final FailureDeduplicator connectFailures = new FailureDeduplicator();
    private final FailureDeduplicator communicationFaults = new FailureDeduplicator();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private Thread thread;

    /**
     * The open connection and the scope that lives as long as it does.
     *
     * @param connection the physical connection
     * @param scope      cancelled when the connection is torn down
     */
    record ActiveConnection(MessageConnection connection, CancellationScope scope) {}

    ConnectionLifecycle(
            DebugSessionConfig config,
            RequestCorrelator correlator,
            SessionListener listener,
            UsePathTracker usePath,
            DefaultSessionStats stats
    )
    {
        this.serverUri = config.serverUri();
        this.connector = config.connector();
        this.credentialProvider = config.credentialProvider();
        this.reconnectDelay = config.reconnectDelay();
        this.receiveBufferSize = config.receiveBufferSize();
        this.correlator = Objects.requireNonNull(correlator, "correlator");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.usePath = Objects.requireNonNull(usePath, "usePath");
        this.stats = Objects.requireNonNull(stats, "stats");

        sessionScope.onCancel(disposeSignal::countDown);
    }

    // ========== Control ==========

    /**
     * Starts the background connection thread.
     */
    synchronized void start()
    {
        if (thread != null)
        {
            throw new IllegalStateException("Connection loop already started");
        }

        thread = new Thread(this, "debug-session-" + serverUri.getHost());
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * Stops the loop and waits for it to exit.
     *
     * <p>Closes the open connection gracefully, then cancels the session
     * scope, which cancels the connection scope and every request linked to it.</p>
     */
    void dispose()
    {
        if (!disposing.compareAndSet(false, true))
        {
            return;
        }

        LOG.info("Closing debug session for {}", serverUri);

        ActiveConnection current = active.get();
        if (current != null && current.connection().isOpen())
        {
            current.connection().close(MessageConnection.NORMAL_CLOSURE, "Done");
        }

        sessionScope.cancel();
        joinLoop();
        state = ConnectionState.DISPOSED;
    }

    /**
     * Returns a snapshot of the current connection.
     *
     * @return the open connection, or null if disconnected
     */
    ActiveConnection currentConnection()
    {
        return active.get();
    }

    ConnectionState getState()
    {
        return state;
    }

    boolean isConnected()
    {
        ActiveConnection current = active.get();
        return state == ConnectionState.OPEN && current != null && current.connection().isOpen();
    }

    boolean isDisposing()
    {
        return disposing.get();
    }

    // ========== Loop ==========

    @Override
    public void run()
    {
        LOG.debug("Connection loop started for {}", serverUri);
        byte[] buffer = new byte[receiveBufferSize];

        try
        {
            while (!isStopping())
            {
                runConnection(buffer);
                if (!isStopping())
                {
                    disposeSignal.await(reconnectDelay.toMillis(), TimeUnit.MILLISECONDS);
                }
            }
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
        catch (RuntimeException e)
        {
            LOG.error("Connection loop failed", e);
            listener.onCommunicationFault(e);
        }
        finally
        {
            active.set(null);
            state = disposing.get() ? ConnectionState.DISPOSED : ConnectionState.DISCONNECTED;
        }

        LOG.debug("Connection loop stopped for {}", serverUri);
    }

    private void runConnection(byte[] buffer) throws InterruptedException
    {
        state = ConnectionState.CONNECTING;

        MessageConnection connection = connect();
        if (connection == null)
        {
            state = ConnectionState.DISCONNECTED;
            return;
        }

        CancellationScope connectionScope = sessionScope.newChild();
        ActiveConnection handle = new ActiveConnection(connection, connectionScope);
        connectionScope.onCancel(connection::abort);
        active.set(handle);
        state = ConnectionState.OPEN;

        stats.recordConnectionEstablished();
        connectFailures.reset();
        communicationFaults.reset();
        LOG.info("Connected to {}", serverUri);
        listener.onConnectionEstablished();

        try
        {
            restoreUsePath(connection);
            receiveLoop(connection, buffer);
        }
        catch (IOException e)
        {
            if (!disposing.get())
            {
                reportCommunicationFault(e, true);
            }
        }
        catch (RuntimeException e)
        {
            if (!disposing.get())
            {
                reportCommunicationFault(e, false);
            }
        }
        finally
        {
            teardown(handle);
        }
    }

    private MessageConnection connect() throws InterruptedException
    {
        try
        {
            return connector.connect(serverUri, DebugMessages.SUB_PROTOCOL,
                    credentialProvider.getCredentials(serverUri), sessionScope);
        }
        catch (CancellationException e)
        {
            return null;
        }
        catch (IOException e)
        {
            if (connectFailures.shouldReport(e))
            {
                LOG.warn("Connect to {} failed: {}", serverUri, e.toString());
                listener.onConnectionFailure(e);
            }
            else
            {
                LOG.debug("Connect to {} still failing: {}", serverUri, e.toString());
            }
            return null;
        }
        catch (RuntimeException e)
        {
            if (isStopping())
            {
                return null;
            }
            connectFailures.reset();
            LOG.warn("Connect to {} failed", serverUri, e);
            listener.onConnectionFailure(e);
            return null;
        }
    }

    private void restoreUsePath(MessageConnection connection) throws IOException
    {
        String path = usePath.get();
        if (path != null && !path.isEmpty() && !DebugMessages.ROOT_PATH.equals(path))
        {
            LOG.debug("Restoring use path {}", path);
            correlator.sendRestoreUse(connection, path, usePath::set);
        }
        else
        {
            usePath.set(DebugMessages.ROOT_PATH);
        }
    }

    private void receiveLoop(MessageConnection connection, byte[] buffer) throws IOException, InterruptedException
    {
        int offset = 0;
        while (!sessionScope.isCancelled())
        {
            if (offset == buffer.length)
            {
                closeTooBig(connection, buffer.length);
                return;
            }

            Optional<Frame> next = connection.receive();
            if (next.isEmpty())
            {
                return;
            }

            Frame frame = next.get();
            if (frame.length() > buffer.length - offset)
            {
                closeTooBig(connection, buffer.length);
                return;
            }
            System.arraycopy(frame.payload(), 0, buffer, offset, frame.length());
            offset += frame.length();

            if (frame.endOfMessage())
            {
                try
                {
                    Element message = XmlDocuments.parse(buffer, 0, offset);
                    correlator.dispatch(message);
                }
                catch (RuntimeException e)
                {
                    reportCommunicationFault(e, false);
                }
                offset = 0;
            }
        }
    }

    private void closeTooBig(MessageConnection connection, int capacity)
    {
        LOG.warn("Inbound message from {} exceeds {} bytes, closing connection", serverUri, capacity);
        connection.close(MessageConnection.MESSAGE_TOO_BIG, "Message too big.");
    }

    private void teardown(ActiveConnection handle)
    {
        active.compareAndSet(handle, null);
        state = ConnectionState.DISCONNECTED;

        if (!disposing.get())
        {
            LOG.info("Connection to {} lost", serverUri);
            listener.onConnectionLost();
        }

        correlator.clearRestoreUse();
        handle.scope().cancel();
        handle.scope().close();
        handle.connection().abort();
    }

    // ========== Helpers ==========

    private void reportCommunicationFault(Exception e, boolean deduplicate)
    {
        stats.recordCommunicationFault();
        if (deduplicate)
        {
            if (!communicationFaults.shouldReport(e))
            {
                LOG.debug("Communication with {} still failing: {}", serverUri, e.toString());
                return;
            }
        }
        else
        {
            communicationFaults.reset();
        }

        LOG.warn("Communication fault with {}: {}", serverUri, e.toString());
        listener.onCommunicationFault(e);
    }

    private boolean isStopping()
    {
        return disposing.get() || sessionScope.isCancelled();
    }

    private void joinLoop()
    {
        Thread loop;
        synchronized (this)
        {
            loop = thread;
        }
        if (loop == null || loop == Thread.currentThread())
        {
            return;
        }

        boolean interrupted = false;
        while (loop.isAlive())
        {
            try
            {
                loop.join();
            }
            catch (InterruptedException e)
            {
                interrupted = true;
            }
        }
        if (interrupted)
        {
            Thread.currentThread().interrupt();
        }
    }
}
