package org.abstractica.debugclient.impl.correlation;

import org.abstractica.debugclient.CancellationScope;
import org.abstractica.debugclient.RemoteDebugException;
import org.abstractica.debugclient.impl.protocol.DebugMessages;
import org.abstractica.debugclient.impl.protocol.XmlDocuments;
import org.abstractica.debugclient.impl.session.DefaultSessionStats;
import org.abstractica.debugclient.impl.transport.MessageConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Matches replies to the requests that caused them.
 *
 * <p>Every outgoing request is stamped with a token and, if a reply is
 * expected, registered as a {@link PendingRequest} before it is transmitted.
 * {@link #dispatch(Element)} removes the request for an incoming token and
 * completes it on the completion executor, so slow consumers never hold up
 * the receive loop.</p>
 *
 * <p>A request leaves the table on the first of: reply, remote fault,
 * cancellation of its scope, cancellation of its future, or a failed
 * transmission.</p>
 */
public class RequestCorrelator
{
    private static final Logger LOG = LoggerFactory.getLogger(RequestCorrelator.class);

    private final Object lock = new Object();
    private final Map<Integer, PendingRequest> pending = new HashMap<>();
    private final TokenGenerator tokenGenerator;
    private final Executor completionExecutor;
    private final DefaultSessionStats stats;

    // In-flight "use" sent after a reconnect; its reply has no waiting caller
    private RestoreUse restoreUse;

    private record RestoreUse(int token, Consumer<String> pathHandler) {}

    /**
     * Creates a correlator.
     *
     * @param tokenGenerator     the session's token source
     * @param completionExecutor runs request completions
     * @param stats              the session statistics
     */
    public RequestCorrelator(TokenGenerator tokenGenerator, Executor completionExecutor, DefaultSessionStats stats)
    {
        this.tokenGenerator = Objects.requireNonNull(tokenGenerator, "tokenGenerator");
        this.completionExecutor = Objects.requireNonNull(completionExecutor, "completionExecutor");
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    // ========== Sending ==========

    /**
     * Registers a request and transmits it.
     *
     * <p>If transmission fails the registration is removed before the
     * exception propagates. If {@code scope} is already cancelled the message
     * is not sent and the returned future is cancelled.</p>
     *
     * @param connection the connection to send on
     * @param message    the envelope; its {@code token} attribute is overwritten
     * @param scope      cancels the request when cancelled
     * @return the future completed by the reply
     * @throws IOException if the message could not be transmitted
     */
    public CompletableFuture<Element> send(MessageConnection connection, Element message, CancellationScope scope)
            throws IOException
    {
        return send(connection, message, scope, null);
    }

    /**
     * Registers a request with a reply hook and transmits it.
     *
     * <p>The hook sees a successful reply on the receive thread, before the
     * future completes and before any later message is dispatched. It is not
     * called for remote faults or for replies to cancelled requests.</p>
     *
     * @param connection the connection to send on
     * @param message    the envelope; its {@code token} attribute is overwritten
     * @param scope      cancels the request when cancelled
     * @param replyHook  runs for a successful reply, or null
     * @return the future completed by the reply
     * @throws IOException if the message could not be transmitted
     */
    public CompletableFuture<Element> send(MessageConnection connection, Element message, CancellationScope scope,
                                           Consumer<Element> replyHook) throws IOException
    {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(scope, "scope");

        PendingRequest request;
        synchronized (lock)
        {
            int token = tokenGenerator.next(this::isInUse);
            request = new PendingRequest(token, replyHook);
            pending.put(token, request);
        }
        int token = request.getToken();
        DebugMessages.setToken(message, token);

        CancellationScope.Registration registration = scope.onCancel(request::cancel);
        request.getFuture().whenComplete((reply, error) ->
        {
            registration.close();
            remove(request);
            if (request.getOutcome() == PendingRequest.Outcome.CANCELLED)
            {
                stats.recordCancelled();
                LOG.debug("Request {} cancelled", token);
            }
        });

        if (request.getFuture().isDone())
        {
            return request.getFuture();
        }

        try
        {
            transmit(connection, message, token);
        }
        catch (IOException | RuntimeException e)
        {
            registration.close();
            remove(request);
            throw e;
        }
        return request.getFuture();
    }

    /**
     * Sends a {@code use} request whose reply is consumed by the correlator itself.
     *
     * <p>Used to restore the use path after a reconnect. The reply calls
     * {@code pathHandler} with the reported path, or with the root path if
     * the server answered with an exception.</p>
     *
     * @param connection  the connection to send on
     * @param nodePath    the path to restore
     * @param pathHandler receives the resulting path on the receive thread
     * @return the request token
     * @throws IOException if the message could not be transmitted
     */
    public int sendRestoreUse(MessageConnection connection, String nodePath, Consumer<String> pathHandler)
            throws IOException
    {
        Objects.requireNonNull(pathHandler, "pathHandler");

        Element message = DebugMessages.use(nodePath);
        int token;
        synchronized (lock)
        {
            token = tokenGenerator.next(this::isInUse);
            restoreUse = new RestoreUse(token, pathHandler);
        }
        DebugMessages.setToken(message, token);

        try
        {
            transmit(connection, message, token);
        }
        catch (IOException | RuntimeException e)
        {
            clearRestoreUse();
            throw e;
        }
        return token;
    }

    /**
     * Forgets the in-flight restore request, if any.
     */
    public void clearRestoreUse()
    {
        synchronized (lock)
        {
            restoreUse = null;
        }
    }

    // ========== Dispatch ==========

    /**
     * Routes an inbound message to the request it answers.
     *
     * <p>Token 0 marks a server notification and is ignored. Replies for
     * unknown tokens (already cancelled requests) are dropped.</p>
     *
     * @param reply the inbound message
     */
    public void dispatch(Element reply)
    {
        int token = DebugMessages.getToken(reply);
        LOG.debug("Received <{}> token={}", reply.getTagName(), token);

        if (token == DebugMessages.NOTIFICATION_TOKEN)
        {
            return;
        }

        RestoreUse restore = null;
        PendingRequest request;
        synchronized (lock)
        {
            if (restoreUse != null && restoreUse.token() == token)
            {
                restore = restoreUse;
                restoreUse = null;
                request = null;
            }
            else
            {
                request = pending.remove(token);
            }
        }

        boolean exception = DebugMessages.isException(reply);
        if (restore != null)
        {
            stats.recordReply(exception);
            restore.pathHandler().accept(exception ? DebugMessages.ROOT_PATH : DebugMessages.getUsePath(reply));
            return;
        }

        if (request == null)
        {
            LOG.debug("No pending request for token {}", token);
            return;
        }

        stats.recordReply(exception);
        if (exception)
        {
            RemoteDebugException fault = DebugMessages.toRemoteException(reply);
            complete(request, () -> request.fault(fault));
        }
        else
        {
            runReplyHook(request, reply);
            complete(request, () -> request.resolve(reply));
        }
    }

    /**
     * Returns the number of requests waiting for a reply.
     *
     * @return the pending count
     */
    public int getPendingCount()
    {
        synchronized (lock)
        {
            return pending.size();
        }
    }

    // ========== Helpers ==========

    private void transmit(MessageConnection connection, Element message, int token) throws IOException
    {
        String xml = XmlDocuments.toXml(message);
        connection.send(xml);
        stats.recordRequestSent();
        LOG.debug("Sent <{}> token={}", message.getTagName(), token);
    }

    private void runReplyHook(PendingRequest request, Element reply)
    {
        Consumer<Element> hook = request.getReplyHook();
        if (hook == null || request.getFuture().isDone())
        {
            return;
        }
        try
        {
            hook.accept(reply);
        }
        catch (RuntimeException e)
        {
            LOG.warn("Reply hook for token {} failed", request.getToken(), e);
        }
    }

    private void complete(PendingRequest request, Runnable completion)
    {
        try
        {
            completionExecutor.execute(completion);
        }
        catch (RejectedExecutionException e)
        {
            // Session is shutting down
            request.cancel();
        }
    }

    private void remove(PendingRequest request)
    {
        synchronized (lock)
        {
            pending.remove(request.getToken(), request);
        }
    }

    private boolean isInUse(int token)
    {
        return pending.containsKey(token) || (restoreUse != null && restoreUse.token() == token);
    }
}
