package org.abstractica.debugclient;

import java.net.URI;
import java.time.Duration;

/**
 * Factory for creating DebugSession instances.
 *
 * <p>Use the builder to configure the session before creation:</p>
 * <pre>{@code
 * DebugSessionFactory factory = new DefaultDebugSessionFactory();
 * DebugSession session = factory.builder()
 *     .serverUri("https://debug.example.com/dbg")
 *     .credentialProvider(uri -> Optional.of(new Credentials("admin", secret)))
 *     .defaultTimeout(Duration.ofSeconds(10))
 *     .build();
 * }</pre>
 */
public interface DebugSessionFactory
{
    /**
     * Creates a new session builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a DebugSession.
     */
    interface Builder
    {
        /**
         * Sets the debug server address.
         *
         * <p>{@code http} and {@code https} addresses are rewritten to
         * {@code ws} and {@code wss}.</p>
         *
         * @param serverUri the server address
         * @return this builder
         */
        Builder serverUri(URI serverUri);

        /**
         * Sets the debug server address.
         *
         * @param serverUri the server address
         * @return this builder
         * @throws IllegalArgumentException if the address is not a valid URI
         */
        Builder serverUri(String serverUri);

        /**
         * Sets the timeout for requests without an explicit cancellation signal.
         *
         * <p>Optional. Defaults to no timeout; negative values count as none.</p>
         *
         * @param timeout the timeout
         * @return this builder
         */
        Builder defaultTimeout(Duration timeout);

        /**
         * Sets the credential provider consulted on every connect.
         *
         * <p>Optional. Defaults to {@link CredentialProvider#NONE}.</p>
         *
         * @param provider the provider
         * @return this builder
         */
        Builder credentialProvider(CredentialProvider provider);

        /**
         * Adds a lifecycle listener.
         *
         * <p>Optional. Without listeners, lifecycle events are only logged.</p>
         *
         * @param listener the listener
         * @return this builder
         */
        Builder listener(SessionListener listener);

        /**
         * Sets the pause between two connection attempts.
         *
         * <p>Optional. Defaults to one second.</p>
         *
         * @param delay the delay
         * @return this builder
         */
        Builder reconnectDelay(Duration delay);

        /**
         * Sets the maximum size of one inbound message in bytes.
         *
         * <p>Optional. Defaults to 1 MiB.</p>
         *
         * @param bytes the buffer size
         * @return this builder
         */
        Builder receiveBufferSize(int bytes);

        /**
         * Sets the seed of the request token generator.
         *
         * <p>Optional. Defaults to a time-based seed.</p>
         *
         * @param seed the seed
         * @return this builder
         */
        Builder tokenSeed(long seed);

        /**
         * Builds the session and starts connecting in the background.
         *
         * @return the session
         * @throws IllegalStateException if required parameters are missing
         */
        DebugSession build();
    }
}
