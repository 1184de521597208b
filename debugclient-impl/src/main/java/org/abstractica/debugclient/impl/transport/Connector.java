package org.abstractica.debugclient.impl.transport;

import org.abstractica.debugclient.CancellationScope;
import org.abstractica.debugclient.Credentials;

import java.io.IOException;
import java.net.URI;
import java.util.Optional;

/**
 * Opens physical connections to a debug server.
 *
 * <p>Implementations provide different backends:</p>
 * <ul>
 *   <li>{@link WebSocketConnector} - real WebSocket connections for production</li>
 *   <li>{@link SimulatedConnector} - in-memory connections for testing</li>
 * </ul>
 */
public interface Connector
{
    /**
     * Opens a connection.
     *
     * @param serverUri   the server address
     * @param subProtocol the sub-protocol to negotiate
     * @param credentials credentials to present, if any
     * @param scope       aborts the attempt when cancelled
     * @return the open connection
     * @throws IOException          if the connection could not be opened
     * @throws InterruptedException if the connecting thread was interrupted
     * @throws java.util.concurrent.CancellationException if {@code scope} was cancelled
     */
    MessageConnection connect(URI serverUri, String subProtocol, Optional<Credentials> credentials,
                              CancellationScope scope) throws IOException, InterruptedException;
}
