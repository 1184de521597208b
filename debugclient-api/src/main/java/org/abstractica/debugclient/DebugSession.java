package org.abstractica.debugclient;

import org.w3c.dom.Element;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A client session with a remote debug server.
 *
 * <p>The session keeps a connection open in the background, reconnecting after
 * transient failures and restoring the current use path. Every request returns
 * a future that completes with the reply, or completes exceptionally with:</p>
 * <ul>
 *   <li>{@link RemoteDebugException} when the server answers with an exception</li>
 *   <li>{@link java.util.concurrent.CancellationException} when the request is cancelled
 *       by the caller, by the default timeout, or because the connection dropped</li>
 *   <li>{@link java.io.UncheckedIOException} when the request could not be transmitted</li>
 * </ul>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * try (DebugSession session = new DefaultDebugSessionFactory().builder()
 *         .serverUri("http://localhost:8080/debug")
 *         .defaultTimeout(Duration.ofSeconds(5))
 *         .build())
 * {
 *     session.use("/app").join();
 *     for (ClientValue value : session.execute("1+1").join())
 *     {
 *         System.out.println(value);
 *     }
 * }
 * }</pre>
 *
 * <p>All methods are thread-safe.</p>
 */
public interface DebugSession extends AutoCloseable
{
    /**
     * Selects the remote node subsequent commands run against.
     *
     * @param nodePath the node path
     * @return the path reported by the server
     * @throws IllegalStateException if the session is not connected
     */
    CompletableFuture<String> use(String nodePath);

    /**
     * Selects the remote node, with an explicit cancellation signal.
     *
     * @param nodePath the node path
     * @param scope    cancels the wait when cancelled
     * @return the path reported by the server
     * @throws IllegalStateException if the session is not connected
     */
    CompletableFuture<String> use(String nodePath, CancellationScope scope);

    /**
     * Executes a command on the current node.
     *
     * @param command the command text
     * @return the returned values in document order
     * @throws IllegalStateException if the session is not connected
     */
    CompletableFuture<List<ClientValue>> execute(String command);

    /**
     * Executes a command on the current node, with an explicit cancellation signal.
     *
     * @param command the command text
     * @param scope   cancels the wait when cancelled
     * @return the returned values in document order
     * @throws IllegalStateException if the session is not connected
     */
    CompletableFuture<List<ClientValue>> execute(String command, CancellationScope scope);

    /**
     * Lists the members of the current node.
     *
     * @return the members in document order
     * @throws IllegalStateException if the session is not connected
     */
    CompletableFuture<List<ClientValue>> listMembers();

    /**
     * Lists the members of the current node, with an explicit cancellation signal.
     *
     * @param scope cancels the wait when cancelled
     * @return the members in document order
     * @throws IllegalStateException if the session is not connected
     */
    CompletableFuture<List<ClientValue>> listMembers(CancellationScope scope);

    /**
     * Enumerates the node tree below the current node.
     *
     * @param recursive whether to include all descendants
     * @return the raw reply document
     * @throws IllegalStateException if the session is not connected
     */
    CompletableFuture<Element> list(boolean recursive);

    /**
     * Enumerates the node tree, with an explicit cancellation signal.
     *
     * @param recursive whether to include all descendants
     * @param scope     cancels the wait when cancelled
     * @return the raw reply document
     * @throws IllegalStateException if the session is not connected
     */
    CompletableFuture<Element> list(boolean recursive, CancellationScope scope);

    /**
     * Sends a caller-built envelope and waits for its reply.
     *
     * <p>A {@code token} attribute is set on the message before transmission.</p>
     *
     * @param message the envelope
     * @return the reply document
     * @throws IllegalStateException if the session is not connected
     */
    CompletableFuture<Element> send(Element message);

    /**
     * Sends a caller-built envelope, with an explicit cancellation signal.
     *
     * @param message the envelope
     * @param scope   cancels the wait when cancelled
     * @return the reply document
     * @throws IllegalStateException if the session is not connected
     */
    CompletableFuture<Element> send(Element message, CancellationScope scope);

    /**
     * Returns the currently selected remote node.
     *
     * @return the use path, or null before the first connection
     */
    String getCurrentUsePath();

    /**
     * Returns whether a connection is currently open.
     *
     * @return true if requests can be sent
     */
    boolean isConnected();

    /**
     * Returns the connection lifecycle state.
     *
     * @return the state
     */
    ConnectionState getState();

    /**
     * Returns the timeout applied to requests without an explicit cancellation signal.
     *
     * @return the timeout, {@link Duration#ZERO} if none
     */
    Duration getDefaultTimeout();

    /**
     * Sets the timeout applied to requests without an explicit cancellation signal.
     *
     * <p>Zero or negative disables the timeout.</p>
     *
     * @param timeout the timeout
     */
    void setDefaultTimeout(Duration timeout);

    /**
     * Registers a lifecycle listener.
     *
     * @param listener the listener
     */
    void addListener(SessionListener listener);

    /**
     * Removes a lifecycle listener.
     *
     * @param listener the listener
     */
    void removeListener(SessionListener listener);

    /**
     * Returns session statistics.
     *
     * @return the statistics
     */
    SessionStats getStats();

    /**
     * Closes the session.
     *
     * <p>Cancels every outstanding request and blocks until the background
     * connection loop has stopped. No listener is called after this returns.</p>
     */
    @Override
    void close();
}
