package org.abstractica.debugclient.impl.correlation;

import org.abstractica.debugclient.RemoteDebugException;
import org.w3c.dom.Element;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * An outstanding request waiting for its reply.
 *
 * <p>The result slot completes exactly once: with the reply, with a remote
 * fault, or cancelled. Later completion attempts are ignored.</p>
 */
public final class PendingRequest
{
    /**
     * Terminal state of a request.
     */
    public enum Outcome
    {
        PENDING,
        REPLIED,
        FAULTED,
        CANCELLED
    }

    private final int token;
    private final Consumer<Element> replyHook; // null if none
    private final CompletableFuture<Element> future = new CompletableFuture<>();

    PendingRequest(int token)
    {
        this(token, null);
    }

    PendingRequest(int token, Consumer<Element> replyHook)
    {
        this.token = token;
        this.replyHook = replyHook;
    }

    public int getToken()
    {
        return token;
    }

    public CompletableFuture<Element> getFuture()
    {
        return future;
    }

    /**
     * Returns the hook run on the receive thread for a successful reply.
     *
     * @return the hook, or null
     */
    Consumer<Element> getReplyHook()
    {
        return replyHook;
    }

    /**
     * Completes the request with a reply.
     *
     * @param reply the reply document
     * @return false if the request had already completed
     */
    boolean resolve(Element reply)
    {
        return future.complete(reply);
    }

    /**
     * Completes the request with a remote fault.
     *
     * @param fault the fault
     * @return false if the request had already completed
     */
    boolean fault(RemoteDebugException fault)
    {
        return future.completeExceptionally(fault);
    }

    /**
     * Cancels the request.
     *
     * @return false if the request had already completed
     */
    boolean cancel()
    {
        return future.cancel(false);
    }

    public Outcome getOutcome()
    {
        if (!future.isDone())
        {
            return Outcome.PENDING;
        }
        if (future.isCancelled())
        {
            return Outcome.CANCELLED;
        }
        return future.isCompletedExceptionally() ? Outcome.FAULTED : Outcome.REPLIED;
    }

    @Override
    public String toString()
    {
        return "PendingRequest[token=" + token + ", " + getOutcome() + "]";
    }
}
