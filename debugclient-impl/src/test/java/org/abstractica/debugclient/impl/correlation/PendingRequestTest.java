package org.abstractica.debugclient.impl.correlation;

import org.abstractica.debugclient.RemoteDebugException;
import org.abstractica.debugclient.impl.protocol.XmlDocuments;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link PendingRequest}.
 */
class PendingRequestTest
{
    @Test
    void newRequest_isPending()
    {
        PendingRequest request = new PendingRequest(5);

        assertEquals(5, request.getToken());
        assertEquals(PendingRequest.Outcome.PENDING, request.getOutcome());
    }

    @Test
    void resolve_thenCancel_keepsReply()
    {
        PendingRequest request = new PendingRequest(1);

        assertTrue(request.resolve(XmlDocuments.parse("<return/>")));
        assertFalse(request.cancel());

        assertEquals(PendingRequest.Outcome.REPLIED, request.getOutcome());
    }

    @Test
    void cancel_thenResolve_staysCancelled()
    {
        PendingRequest request = new PendingRequest(1);

        assertTrue(request.cancel());
        assertFalse(request.resolve(XmlDocuments.parse("<return/>")));

        assertEquals(PendingRequest.Outcome.CANCELLED, request.getOutcome());
        assertTrue(request.getFuture().isCancelled());
    }

    @Test
    void fault_isFaulted()
    {
        PendingRequest request = new PendingRequest(1);

        assertTrue(request.fault(new RemoteDebugException("Boom", "Exception", null)));

        assertEquals(PendingRequest.Outcome.FAULTED, request.getOutcome());
    }
}
