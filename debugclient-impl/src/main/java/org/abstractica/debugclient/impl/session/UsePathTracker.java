package org.abstractica.debugclient.impl.session;

import org.abstractica.debugclient.SessionListener;

import java.util.Objects;

/**
 * Holds the current use path and reports changes.
 *
 * <p>Setting the path to its current value does not raise an event.</p>
 */
final class UsePathTracker
{
    private final Object lock = new Object();
    private final SessionListener listener;
    private String current;

    UsePathTracker(SessionListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    String get()
    {
        synchronized (lock)
        {
            return current;
        }
    }

    void set(String path)
    {
        Objects.requireNonNull(path, "path");

        String previous;
        synchronized (lock)
        {
            if (path.equals(current))
            {
                return;
            }
            previous = current;
            current = path;
        }
        listener.onUsePathChanged(previous, path);
    }
}
