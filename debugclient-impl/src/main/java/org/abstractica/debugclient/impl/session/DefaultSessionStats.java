package org.abstractica.debugclient.impl.session;

import org.abstractica.debugclient.SessionStats;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Default implementation of SessionStats.
 */
public class DefaultSessionStats implements SessionStats
{
    private final AtomicLong requestsSent = new AtomicLong(0);
    private final AtomicLong repliesReceived = new AtomicLong(0);
    private final AtomicLong remoteFaults = new AtomicLong(0);
    private final AtomicLong cancelledRequests = new AtomicLong(0);
    private final AtomicLong connectionsEstablished = new AtomicLong(0);
    private final AtomicLong communicationFaults = new AtomicLong(0);

    @Override
    public long getRequestsSent()
    {
        return requestsSent.get();
    }

    @Override
    public long getRepliesReceived()
    {
        return repliesReceived.get();
    }

    @Override
    public long getRemoteFaults()
    {
        return remoteFaults.get();
    }

    @Override
    public long getCancelledRequests()
    {
        return cancelledRequests.get();
    }

    @Override
    public long getConnectionsEstablished()
    {
        return connectionsEstablished.get();
    }

    @Override
    public long getCommunicationFaults()
    {
        return communicationFaults.get();
    }

    // ========== Update Methods ==========

    public void recordRequestSent()
    {
        requestsSent.incrementAndGet();
    }

    public void recordReply(boolean remoteFault)
    {
        repliesReceived.incrementAndGet();
        if (remoteFault)
        {
            remoteFaults.incrementAndGet();
        }
    }

    public void recordCancelled()
    {
        cancelledRequests.incrementAndGet();
    }

    public void recordConnectionEstablished()
    {
        connectionsEstablished.incrementAndGet();
    }

    public void recordCommunicationFault()
    {
        communicationFaults.incrementAndGet();
    }

    @Override
    public String toString()
    {
        return "SessionStats[sent=" + requestsSent + ", replies=" + repliesReceived
                + ", faults=" + remoteFaults + ", cancelled=" + cancelledRequests
                + ", connections=" + connectionsEstablished + ", commFaults=" + communicationFaults + "]";
    }
}
