package org.abstractica.debugclient;

/**
 * Observer of a debug session's connection lifecycle.
 *
 * <p>All methods have empty defaults so implementations override only what
 * they need. Callbacks run on the session's connection thread and must not
 * block; exceptions thrown by a listener are logged and ignored.</p>
 */
public interface SessionListener
{
    /**
     * Called after a physical connection was opened.
     */
    default void onConnectionEstablished()
    {
    }

    /**
     * Called after an established connection was lost.
     *
     * <p>Not called when the loss is caused by closing the session.</p>
     */
    default void onConnectionLost()
    {
    }

    /**
     * Called when a connection attempt fails.
     *
     * <p>Repeated failures with the same signature are reported once.</p>
     *
     * @param cause the failure
     */
    default void onConnectionFailure(Exception cause)
    {
    }

    /**
     * Called when the receive loop hits a transport or parse error.
     *
     * @param cause the failure
     */
    default void onCommunicationFault(Exception cause)
    {
    }

    /**
     * Called when the current use path changed.
     *
     * @param previous the previous path, or null before the first connection
     * @param current  the new path
     */
    default void onUsePathChanged(String previous, String current)
    {
    }
}
