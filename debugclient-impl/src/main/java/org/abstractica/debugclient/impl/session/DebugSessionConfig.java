package org.abstractica.debugclient.impl.session;

import org.abstractica.debugclient.CredentialProvider;
import org.abstractica.debugclient.SessionListener;
import org.abstractica.debugclient.impl.transport.Connector;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Validated settings of one debug session.
 *
 * @param serverUri          the WebSocket address
 * @param defaultTimeout     timeout for requests without explicit cancellation, zero for none
 * @param credentialProvider supplies credentials per connect
 * @param listeners          initial lifecycle listeners
 * @param connector          opens physical connections
 * @param reconnectDelay     pause between connection attempts
 * @param receiveBufferSize  maximum inbound message size in bytes
 * @param tokenSeed          seed of the token generator
 */
public record DebugSessionConfig(
        URI serverUri,
        Duration defaultTimeout,
        CredentialProvider credentialProvider,
        List<SessionListener> listeners,
        Connector connector,
        Duration reconnectDelay,
        int receiveBufferSize,
        long tokenSeed
)
{
    public DebugSessionConfig
    {
        Objects.requireNonNull(serverUri, "serverUri");
        Objects.requireNonNull(defaultTimeout, "defaultTimeout");
        Objects.requireNonNull(credentialProvider, "credentialProvider");
        Objects.requireNonNull(connector, "connector");
        Objects.requireNonNull(reconnectDelay, "reconnectDelay");
        listeners = List.copyOf(listeners);
        if (defaultTimeout.isNegative())
        {
            defaultTimeout = Duration.ZERO;
        }
        if (reconnectDelay.isNegative())
        {
            throw new IllegalArgumentException("reconnectDelay must be non-negative");
        }
        if (receiveBufferSize <= 0)
        {
            throw new IllegalArgumentException("receiveBufferSize must be positive: " + receiveBufferSize);
        }
    }
}
