package org.abstractica.debugclient.impl.session;

import org.abstractica.debugclient.CredentialProvider;
import org.abstractica.debugclient.DebugSession;
import org.abstractica.debugclient.DebugSessionFactory;
import org.abstractica.debugclient.SessionListener;
import org.abstractica.debugclient.impl.transport.Connector;
import org.abstractica.debugclient.impl.transport.WebSocketConnector;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Default implementation of DebugSessionFactory.
 */
public class DefaultDebugSessionFactory implements DebugSessionFactory
{
    static final Duration DEFAULT_RECONNECT_DELAY = Duration.ofSeconds(1);
    static final int DEFAULT_RECEIVE_BUFFER_SIZE = 1 << 20;

    @Override
    public DefaultBuilder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private URI serverUri;
        private Duration defaultTimeout = Duration.ZERO;
        private CredentialProvider credentialProvider = CredentialProvider.NONE;
        private final List<SessionListener> listeners = new ArrayList<>();
        private Connector connector; // Optional custom connector (defaults to WebSocketConnector)
        private Duration reconnectDelay = DEFAULT_RECONNECT_DELAY;
        private int receiveBufferSize = DEFAULT_RECEIVE_BUFFER_SIZE;
        private long tokenSeed = System.nanoTime();

        @Override
        public DefaultBuilder serverUri(URI serverUri)
        {
            this.serverUri = Objects.requireNonNull(serverUri, "serverUri");
            return this;
        }

        @Override
        public DefaultBuilder serverUri(String serverUri)
        {
            Objects.requireNonNull(serverUri, "serverUri");
            try
            {
                return serverUri(new URI(serverUri));
            }
            catch (URISyntaxException e)
            {
                throw new IllegalArgumentException("Invalid server address: " + serverUri, e);
            }
        }

        @Override
        public DefaultBuilder defaultTimeout(Duration timeout)
        {
            Objects.requireNonNull(timeout, "timeout");
            this.defaultTimeout = timeout.isNegative() ? Duration.ZERO : timeout;
            return this;
        }

        @Override
        public DefaultBuilder credentialProvider(CredentialProvider provider)
        {
            this.credentialProvider = Objects.requireNonNull(provider, "provider");
            return this;
        }

        @Override
        public DefaultBuilder listener(SessionListener listener)
        {
            listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        @Override
        public DefaultBuilder reconnectDelay(Duration delay)
        {
            Objects.requireNonNull(delay, "delay");
            if (delay.isNegative())
            {
                throw new IllegalArgumentException("Reconnect delay must be non-negative: " + delay);
            }
            this.reconnectDelay = delay;
            return this;
        }

        @Override
        public DefaultBuilder receiveBufferSize(int bytes)
        {
            if (bytes <= 0)
            {
                throw new IllegalArgumentException("Receive buffer size must be positive: " + bytes);
            }
            this.receiveBufferSize = bytes;
            return this;
        }

        @Override
        public DefaultBuilder tokenSeed(long seed)
        {
            this.tokenSeed = seed;
            return this;
        }

        /**
         * Sets the connector used to open physical connections.
         *
         * <p>If not set, {@link WebSocketConnector} is used. Use
         * {@link org.abstractica.debugclient.impl.transport.SimulatedConnector}
         * for testing.</p>
         *
         * @param connector the connector
         * @return this builder
         */
        public DefaultBuilder connector(Connector connector)
        {
            this.connector = Objects.requireNonNull(connector, "connector");
            return this;
        }

        @Override
        public DebugSession build()
        {
            if (serverUri == null)
            {
                throw new IllegalStateException("Server address must be specified");
            }
            if (serverUri.getScheme() == null)
            {
                throw new IllegalStateException("Server address needs a scheme: " + serverUri);
            }

            DebugSessionConfig config = new DebugSessionConfig(
                    WebSocketConnector.toWebSocketUri(serverUri),
                    defaultTimeout,
                    credentialProvider,
                    listeners,
                    connector != null ? connector : new WebSocketConnector(),
                    reconnectDelay,
                    receiveBufferSize,
                    tokenSeed
            );

            DefaultDebugSession session = new DefaultDebugSession(config);
            session.start();
            return session;
        }
    }
}
