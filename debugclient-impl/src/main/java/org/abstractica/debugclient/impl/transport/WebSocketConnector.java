package org.abstractica.debugclient.impl.transport;

import org.abstractica.debugclient.CancellationScope;
import org.abstractica.debugclient.Credentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Connector that opens WebSocket connections using the JDK HTTP client.
 */
public class WebSocketConnector implements Connector
{
    private static final Logger LOG = LoggerFactory.getLogger(WebSocketConnector.class);
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient httpClient;

    /**
     * Creates a connector with a default HTTP client.
     */
    public WebSocketConnector()
    {
        this(HttpClient.newBuilder()
                .connectTimeout(DEFAULT_CONNECT_TIMEOUT)
                .build());
    }

    /**
     * Creates a connector using the given HTTP client.
     *
     * @param httpClient the client used for the upgrade request
     */
    public WebSocketConnector(HttpClient httpClient)
    {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    /**
     * Rewrites a web address to its WebSocket equivalent.
     *
     * <p>{@code http} becomes {@code ws} and {@code https} becomes {@code wss};
     * any other scheme is returned unchanged.</p>
     *
     * @param uri the address
     * @return the WebSocket address
     * @throws IllegalArgumentException if the rewritten address is invalid
     */
    public static URI toWebSocketUri(URI uri)
    {
        Objects.requireNonNull(uri, "uri");

        String scheme = uri.getScheme();
        String rewritten;
        if ("http".equalsIgnoreCase(scheme))
        {
            rewritten = "ws";
        }
        else if ("https".equalsIgnoreCase(scheme))
        {
            rewritten = "wss";
        }
        else
        {
            return uri;
        }

        try
        {
            return new URI(rewritten, uri.getUserInfo(),
                    uri.getHost(), uri.getPort(), uri.getPath(), uri.getQuery(), uri.getFragment());
        }
        catch (URISyntaxException e)
        {
            throw new IllegalArgumentException("Cannot rewrite " + uri, e);
        }
    }

    @Override
    public MessageConnection connect(URI serverUri, String subProtocol, Optional<Credentials> credentials,
                                     CancellationScope scope) throws IOException, InterruptedException
    {
        Objects.requireNonNull(serverUri, "serverUri");
        Objects.requireNonNull(subProtocol, "subProtocol");
        Objects.requireNonNull(credentials, "credentials");
        Objects.requireNonNull(scope, "scope");

        WebSocketConnection connection = new WebSocketConnection();
        WebSocket.Builder builder = httpClient.newWebSocketBuilder()
                .subprotocols(subProtocol);
        credentials.ifPresent(c -> builder.header("Authorization", basicAuthorization(c)));

        LOG.debug("Opening WebSocket to {}", serverUri);
        CompletableFuture<WebSocket> pending = builder.buildAsync(serverUri, connection);

        try (CancellationScope.Registration ignored = scope.onCancel(() -> pending.cancel(true)))
        {
            WebSocket webSocket = pending.get();
            connection.attach(webSocket);
            if (!subProtocol.equals(webSocket.getSubprotocol()))
            {
                LOG.debug("Server selected sub-protocol '{}' instead of '{}'", webSocket.getSubprotocol(), subProtocol);
            }
            return connection;
        }
        catch (ExecutionException e)
        {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io)
            {
                throw io;
            }
            if (cause instanceof RuntimeException runtime)
            {
                throw runtime;
            }
            throw new IOException("WebSocket connect failed: " + serverUri, cause);
        }
    }

    private static String basicAuthorization(Credentials credentials)
    {
        String token = credentials.userName() + ":" + credentials.password();
        return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }
}
