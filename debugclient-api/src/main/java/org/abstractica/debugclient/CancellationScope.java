package org.abstractica.debugclient;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * A cancellation signal that can be linked into a hierarchy.
 *
 * <p>Cancelling a scope runs its registered callbacks and cancels every scope
 * linked to it. A scope linked to several parents is cancelled by whichever
 * parent is cancelled first. Cancellation is one-way and idempotent.</p>
 *
 * <p>Usage:</p>
 * <pre>{@code
 * CancellationScope caller = new CancellationScope();
 * session.execute("longRunning()", caller);
 *
 * // later, from any thread
 * caller.cancel();
 * }</pre>
 *
 * <p>{@link #close()} detaches a scope from its parents and stops its timer
 * without cancelling it. Close linked scopes once they are no longer needed so
 * long-lived parents do not accumulate callbacks.</p>
 */
public final class CancellationScope implements AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(CancellationScope.class);

    private final Object lock = new Object();
    private final Set<CallbackRegistration> callbacks = new LinkedHashSet<>();
    private final List<Registration> parentLinks = new ArrayList<>();
    private final List<Future<?>> timers = new ArrayList<>();
    private boolean cancelled;

    /**
     * Handle for a registered cancellation callback.
     */
    public interface Registration extends AutoCloseable
    {
        /**
         * Removes the callback. Has no effect after the scope was cancelled.
         */
        @Override
        void close();
    }

    /**
     * Creates a root scope that is only cancelled explicitly.
     */
    public CancellationScope()
    {
    }

    /**
     * Creates a scope cancelled when any of the given scopes is cancelled.
     *
     * <p>If a parent is already cancelled, the new scope starts cancelled.</p>
     *
     * @param parents the scopes to link to
     * @return the linked scope
     */
    public static CancellationScope linkedTo(CancellationScope... parents)
    {
        CancellationScope scope = new CancellationScope();
        for (CancellationScope parent : parents)
        {
            Objects.requireNonNull(parent, "parent");
            Registration link = parent.onCancel(scope::cancel);
            synchronized (scope.lock)
            {
                scope.parentLinks.add(link);
            }
        }
        return scope;
    }

    /**
     * Creates a scope linked to this one.
     *
     * @return the child scope
     */
    public CancellationScope newChild()
    {
        return linkedTo(this);
    }

    /**
     * Cancels this scope after the given delay unless it is closed first.
     *
     * @param delay     the delay
     * @param scheduler the scheduler that fires the cancellation
     * @return this scope
     */
    public CancellationScope cancelAfter(Duration delay, ScheduledExecutorService scheduler)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(scheduler, "scheduler");

        Future<?> timer = scheduler.schedule(this::cancel, delay.toNanos(), TimeUnit.NANOSECONDS);
        synchronized (lock)
        {
            if (!cancelled)
            {
                timers.add(timer);
                return this;
            }
        }
        timer.cancel(false);
        return this;
    }

    /**
     * Registers a callback run once when this scope is cancelled.
     *
     * <p>If the scope is already cancelled the callback runs immediately on
     * the calling thread.</p>
     *
     * @param callback the callback
     * @return a registration that removes the callback when closed
     */
    public Registration onCancel(Runnable callback)
    {
        Objects.requireNonNull(callback, "callback");

        CallbackRegistration registration = new CallbackRegistration(callback);
        synchronized (lock)
        {
            if (!cancelled)
            {
                callbacks.add(registration);
                return registration;
            }
        }
        runSafely(callback);
        return registration;
    }

    /**
     * Returns whether this scope has been cancelled.
     *
     * @return true once cancelled
     */
    public boolean isCancelled()
    {
        synchronized (lock)
        {
            return cancelled;
        }
    }

    /**
     * Returns the number of callbacks waiting for cancellation.
     *
     * <p>Linked scopes count as one callback each. Zero once cancelled.</p>
     *
     * @return the callback count
     */
    public int getCallbackCount()
    {
        synchronized (lock)
        {
            return callbacks.size();
        }
    }

    /**
     * Cancels this scope and everything linked to it.
     */
    public void cancel()
    {
        List<CallbackRegistration> toRun;
        synchronized (lock)
        {
            if (cancelled)
            {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }

        releaseLinks();
        for (CallbackRegistration registration : toRun)
        {
            runSafely(registration.callback);
        }
    }

    /**
     * Detaches this scope from its parents and stops its timer.
     *
     * <p>Does not cancel the scope.</p>
     */
    @Override
    public void close()
    {
        releaseLinks();
    }

    private void releaseLinks()
    {
        List<Registration> links;
        List<Future<?>> pendingTimers;
        synchronized (lock)
        {
            links = new ArrayList<>(parentLinks);
            pendingTimers = new ArrayList<>(timers);
            parentLinks.clear();
            timers.clear();
        }
        links.forEach(Registration::close);
        pendingTimers.forEach(timer -> timer.cancel(false));
    }

    private static void runSafely(Runnable callback)
    {
        try
        {
            callback.run();
        }
        catch (RuntimeException e)
        {
            LOG.warn("Cancellation callback failed", e);
        }
    }

    private final class CallbackRegistration implements Registration
    {
        private final Runnable callback;

        CallbackRegistration(Runnable callback)
        {
            this.callback = callback;
        }

        @Override
        public void close()
        {
            synchronized (lock)
            {
                callbacks.remove(this);
            }
        }
    }
}
