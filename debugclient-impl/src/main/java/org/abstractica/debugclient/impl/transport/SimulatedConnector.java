package org.abstractica.debugclient.impl.transport;

import org.abstractica.debugclient.CancellationScope;
import org.abstractica.debugclient.Credentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * A connector that hands out in-memory connections.
 *
 * <p>Each successful {@link #connect} creates a {@link SimulatedConnection}
 * that the test (playing the server) picks up with {@link #accept(Duration)}.</p>
 *
 * <p>Usage:</p>
 * <pre>{@code
 * SimulatedConnector connector = new SimulatedConnector();
 * DebugSession session = factory.builder()
 *     .serverUri("ws://debug.test/")
 *     .connector(connector)
 *     .build();
 *
 * SimulatedConnection server = connector.accept(Duration.ofSeconds(5));
 * String request = server.takeSent(Duration.ofSeconds(5));
 * server.deliver("<return token=\"...\"/>");
 * }</pre>
 *
 * @see WebSocketConnector for production use
 */
public class SimulatedConnector implements Connector
{
    private static final Logger LOG = LoggerFactory.getLogger(SimulatedConnector.class);

    private final BlockingQueue<SimulatedConnection> accepted = new LinkedBlockingQueue<>();
    private final List<ConnectAttempt> attempts = new CopyOnWriteArrayList<>();
    private volatile IOException refusal;

    /**
     * A recorded connect call.
     *
     * @param serverUri   the requested address
     * @param subProtocol the requested sub-protocol
     * @param credentials the presented credentials
     */
    public record ConnectAttempt(URI serverUri, String subProtocol, Optional<Credentials> credentials) {}

    @Override
    public MessageConnection connect(URI serverUri, String subProtocol, Optional<Credentials> credentials,
                                     CancellationScope scope) throws IOException
    {
        attempts.add(new ConnectAttempt(serverUri, subProtocol, credentials));
        if (scope.isCancelled())
        {
            throw new CancellationException("Connect cancelled");
        }

        IOException failure = refusal;
        if (failure != null)
        {
            throw failure;
        }

        SimulatedConnection connection = new SimulatedConnection();
        accepted.add(connection);
        LOG.debug("Simulated connection opened to {}", serverUri);
        return connection;
    }

    // ========== Test Controls ==========

    /**
     * Makes every following connect attempt fail with the given exception.
     *
     * @param failure the exception to throw
     */
    public void refuseConnections(IOException failure)
    {
        this.refusal = failure;
    }

    /**
     * Lets connect attempts succeed again.
     */
    public void acceptConnections()
    {
        this.refusal = null;
    }

    /**
     * Waits for the next connection opened by a client.
     *
     * @param timeout how long to wait
     * @return the connection, or null on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public SimulatedConnection accept(Duration timeout) throws InterruptedException
    {
        return accepted.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Returns every connect call seen so far.
     *
     * @return the recorded attempts
     */
    public List<ConnectAttempt> getConnectAttempts()
    {
        return List.copyOf(attempts);
    }
}
