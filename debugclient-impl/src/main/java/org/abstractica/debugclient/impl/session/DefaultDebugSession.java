package org.abstractica.debugclient.impl.session;

import org.abstractica.debugclient.CancellationScope;
import org.abstractica.debugclient.ClientValue;
import org.abstractica.debugclient.ConnectionState;
import org.abstractica.debugclient.DebugSession;
import org.abstractica.debugclient.SessionListener;
import org.abstractica.debugclient.SessionStats;
import org.abstractica.debugclient.impl.correlation.RequestCorrelator;
import org.abstractica.debugclient.impl.correlation.TokenGenerator;
import org.abstractica.debugclient.impl.protocol.DebugMessages;
import org.abstractica.debugclient.impl.protocol.ValueMarshaller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Default implementation of the DebugSession interface.
 *
 * <p>Every operation builds an envelope, registers it with the
 * {@link RequestCorrelator}, sends it on the current connection and maps the
 * reply. The connection itself is owned by a {@link ConnectionLifecycle}
 * running on a background thread.</p>
 */
public class DefaultDebugSession implements DebugSession
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultDebugSession.class);

    private final URI serverUri;
    private final SessionListeners listeners;
    private final DefaultSessionStats stats;
    private final UsePathTracker usePath;
    private final ValueMarshaller marshaller;
    private final ExecutorService completionExecutor;
    private final ScheduledExecutorService timeoutScheduler;
    private final RequestCorrelator correlator;
    private final ConnectionLifecycle lifecycle;

    private volatile Duration defaultTimeout;

    /**
     * Creates a session. Call {@link #start()} to begin connecting.
     *
     * @param config the session settings
     */
    DefaultDebugSession(DebugSessionConfig config)
    {
        Objects.requireNonNull(config, "config");

        this.serverUri = config.serverUri();
        this.defaultTimeout = config.defaultTimeout();
        this.listeners = new SessionListeners();
        config.listeners().forEach(listeners::add);

        this.stats = new DefaultSessionStats();
        this.usePath = new UsePathTracker(listeners);
        this.marshaller = new ValueMarshaller();
        this.completionExecutor = Executors.newCachedThreadPool(daemonThreads("debug-completion"));
        this.timeoutScheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("debug-timeout"));
        this.correlator = new RequestCorrelator(new TokenGenerator(config.tokenSeed()), completionExecutor, stats);
        this.lifecycle = new ConnectionLifecycle(config, correlator, listeners, usePath, stats);
    }

    /**
     * Starts connecting in the background.
     */
    void start()
    {
        LOG.info("Starting debug session for {}", serverUri);
        lifecycle.start();
    }

    // ========== Operations ==========

    @Override
    public CompletableFuture<String> use(String nodePath)
    {
        return sendUse(nodePath, null);
    }

    @Override
    public CompletableFuture<String> use(String nodePath, CancellationScope scope)
    {
        return sendUse(nodePath, Objects.requireNonNull(scope, "scope"));
    }

    @Override
    public CompletableFuture<List<ClientValue>> execute(String command)
    {
        return sendForValues(DebugMessages.execute(command), null);
    }

    @Override
    public CompletableFuture<List<ClientValue>> execute(String command, CancellationScope scope)
    {
        return sendForValues(DebugMessages.execute(command), Objects.requireNonNull(scope, "scope"));
    }

    @Override
    public CompletableFuture<List<ClientValue>> listMembers()
    {
        return sendForValues(DebugMessages.member(), null);
    }

    @Override
    public CompletableFuture<List<ClientValue>> listMembers(CancellationScope scope)
    {
        return sendForValues(DebugMessages.member(), Objects.requireNonNull(scope, "scope"));
    }

    @Override
    public CompletableFuture<Element> list(boolean recursive)
    {
        return sendMessage(DebugMessages.list(recursive), null, null);
    }

    @Override
    public CompletableFuture<Element> list(boolean recursive, CancellationScope scope)
    {
        return sendMessage(DebugMessages.list(recursive), Objects.requireNonNull(scope, "scope"), null);
    }

    @Override
    public CompletableFuture<Element> send(Element message)
    {
        return sendMessage(message, null, null);
    }

    @Override
    public CompletableFuture<Element> send(Element message, CancellationScope scope)
    {
        return sendMessage(message, Objects.requireNonNull(scope, "scope"), null);
    }

    // ========== State ==========

    @Override
    public String getCurrentUsePath()
    {
        return usePath.get();
    }

    @Override
    public boolean isConnected()
    {
        return lifecycle.isConnected();
    }

    @Override
    public ConnectionState getState()
    {
        return lifecycle.getState();
    }

    @Override
    public Duration getDefaultTimeout()
    {
        return defaultTimeout;
    }

    @Override
    public void setDefaultTimeout(Duration timeout)
    {
        Objects.requireNonNull(timeout, "timeout");
        this.defaultTimeout = timeout.isNegative() ? Duration.ZERO : timeout;
    }

    @Override
    public void addListener(SessionListener listener)
    {
        listeners.add(listener);
    }

    @Override
    public void removeListener(SessionListener listener)
    {
        listeners.remove(listener);
    }

    @Override
    public SessionStats getStats()
    {
        return stats;
    }

    @Override
    public void close()
    {
        lifecycle.dispose();
        completionExecutor.shutdown();
        timeoutScheduler.shutdownNow();
    }

    // ========== Sending ==========

    private CompletableFuture<String> sendUse(String nodePath, CancellationScope scope)
    {
        // Path is applied on the receive thread so replies update it in arrival order
        return map(sendMessage(DebugMessages.use(nodePath), scope,
                reply -> usePath.set(DebugMessages.getUsePath(reply))), DebugMessages::getUsePath);
    }

    private CompletableFuture<List<ClientValue>> sendForValues(Element message, CancellationScope scope)
    {
        return map(sendMessage(message, scope, null), marshaller::parseReturn);
    }

    private CompletableFuture<Element> sendMessage(Element message, CancellationScope callerScope,
                                                  Consumer<Element> replyHook)
    {
        Objects.requireNonNull(message, "message");

        if (lifecycle.isDisposing())
        {
            throw new IllegalStateException("Debug session is closed");
        }

        ConnectionLifecycle.ActiveConnection current = lifecycle.currentConnection();
        if (current == null || !current.connection().isOpen())
        {
            throw new IllegalStateException("Debug session is disconnected");
        }

        CancellationScope scope = requestScope(current.scope(), callerScope);
        CompletableFuture<Element> reply;
        try
        {
            reply = correlator.send(current.connection(), message, scope, replyHook);
        }
        catch (IOException e)
        {
            releaseScope(scope, current.scope());
            return CompletableFuture.failedFuture(
                    new UncheckedIOException("Failed to send <" + message.getTagName() + ">", e));
        }
        catch (RuntimeException e)
        {
            releaseScope(scope, current.scope());
            throw e;
        }

        if (scope != current.scope())
        {
            reply.whenComplete((result, error) -> scope.close());
        }
        return reply;
    }

    /**
     * Builds the scope a request waits under.
     *
     * <ul>
     *   <li>no caller scope, default timeout set: child of the connection scope with a timer</li>
     *   <li>no caller scope, no timeout: the connection scope itself</li>
     *   <li>caller scope: linked to both the caller scope and the connection scope</li>
     * </ul>
     */
    private CancellationScope requestScope(CancellationScope connectionScope, CancellationScope callerScope)
    {
        if (callerScope == null)
        {
            Duration timeout = defaultTimeout;
            if (timeout.isZero())
            {
                return connectionScope;
            }
            return connectionScope.newChild().cancelAfter(timeout, timeoutScheduler);
        }
        return CancellationScope.linkedTo(connectionScope, callerScope);
    }

    private static void releaseScope(CancellationScope scope, CancellationScope connectionScope)
    {
        if (scope != connectionScope)
        {
            scope.close();
        }
    }

    /**
     * Maps a reply while keeping cancellation visible on the returned future.
     */
    private static <T, R> CompletableFuture<R> map(CompletableFuture<T> source, Function<T, R> mapper)
    {
        CompletableFuture<R> result = new CompletableFuture<>();
        source.whenComplete((value, error) ->
        {
            if (error == null)
            {
                try
                {
                    result.complete(mapper.apply(value));
                }
                catch (RuntimeException e)
                {
                    result.completeExceptionally(e);
                }
                return;
            }

            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
            if (cause instanceof CancellationException)
            {
                result.cancel(false);
            }
            else
            {
                result.completeExceptionally(cause);
            }
        });
        result.whenComplete((value, error) ->
        {
            if (result.isCancelled())
            {
                source.cancel(false);
            }
        });
        return result;
    }

    private static ThreadFactory daemonThreads(String prefix)
    {
        AtomicInteger counter = new AtomicInteger();
        return runnable ->
        {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
