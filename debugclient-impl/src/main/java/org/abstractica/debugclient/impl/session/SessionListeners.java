package org.abstractica.debugclient.impl.session;

import org.abstractica.debugclient.SessionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans lifecycle events out to the registered listeners.
 *
 * <p>A listener that throws is logged and does not prevent the others from
 * being called.</p>
 */
final class SessionListeners implements SessionListener
{
    private static final Logger LOG = LoggerFactory.getLogger(SessionListeners.class);

    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

    void add(SessionListener listener)
    {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    void remove(SessionListener listener)
    {
        listeners.remove(listener);
    }

    @Override
    public void onConnectionEstablished()
    {
        fire(SessionListener::onConnectionEstablished);
    }

    @Override
    public void onConnectionLost()
    {
        fire(SessionListener::onConnectionLost);
    }

    @Override
    public void onConnectionFailure(Exception cause)
    {
        fire(listener -> listener.onConnectionFailure(cause));
    }

    @Override
    public void onCommunicationFault(Exception cause)
    {
        fire(listener -> listener.onCommunicationFault(cause));
    }

    @Override
    public void onUsePathChanged(String previous, String current)
    {
        fire(listener -> listener.onUsePathChanged(previous, current));
    }

    private void fire(Consumer<SessionListener> event)
    {
        for (SessionListener listener : listeners)
        {
            try
            {
                event.accept(listener);
            }
            catch (Exception e)
            {
                LOG.error("Listener callback error", e);
            }
        }
    }
}
