package org.abstractica.debugclient;

/**
 * Counters describing the traffic of a debug session.
 *
 * <p>All values are cumulative over the life of the session.</p>
 */
public interface SessionStats
{
    /**
     * Returns the number of messages handed to the transport.
     *
     * @return requests sent
     */
    long getRequestsSent();

    /**
     * Returns the number of replies matched to a waiting request.
     *
     * @return replies received
     */
    long getRepliesReceived();

    /**
     * Returns the number of replies that carried a remote exception.
     *
     * @return remote faults
     */
    long getRemoteFaults();

    /**
     * Returns the number of requests that ended cancelled (timeout, disconnect or caller).
     *
     * @return cancelled requests
     */
    long getCancelledRequests();

    /**
     * Returns how often a physical connection was established.
     *
     * @return established connections
     */
    long getConnectionsEstablished();

    /**
     * Returns the number of communication faults seen by the receive loop.
     *
     * @return communication faults
     */
    long getCommunicationFaults();
}
