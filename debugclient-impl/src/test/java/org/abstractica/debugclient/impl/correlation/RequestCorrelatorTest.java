package org.abstractica.debugclient.impl.correlation;

import org.abstractica.debugclient.CancellationScope;
import org.abstractica.debugclient.RemoteDebugException;
import org.abstractica.debugclient.impl.protocol.DebugMessages;
import org.abstractica.debugclient.impl.protocol.XmlDocuments;
import org.abstractica.debugclient.impl.session.DefaultSessionStats;
import org.abstractica.debugclient.impl.transport.Frame;
import org.abstractica.debugclient.impl.transport.MessageConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link RequestCorrelator}.
 */
class RequestCorrelatorTest
{
    private RecordingConnection connection;
    private DefaultSessionStats stats;
    private RequestCorrelator correlator;

    @BeforeEach
    void setUp()
    {
        connection = new RecordingConnection();
        stats = new DefaultSessionStats();
        correlator = new RequestCorrelator(new TokenGenerator(1234L), Runnable::run, stats);
    }

    @Test
    void send_stampsTokenAndRegisters() throws IOException
    {
        CompletableFuture<Element> reply = correlator.send(connection, DebugMessages.member(), new CancellationScope());

        assertFalse(reply.isDone());
        assertEquals(1, correlator.getPendingCount());
        assertEquals(1, connection.sent.size());
        int token = tokenOf(connection.sent.get(0));
        assertTrue(token > 0);
        assertEquals(1, stats.getRequestsSent());
    }

    @Test
    void dispatch_matchesRepliesOutOfOrder() throws IOException
    {
        CompletableFuture<Element> first = correlator.send(connection, DebugMessages.execute("a"), new CancellationScope());
        CompletableFuture<Element> second = correlator.send(connection, DebugMessages.execute("b"), new CancellationScope());
        int firstToken = tokenOf(connection.sent.get(0));
        int secondToken = tokenOf(connection.sent.get(1));
        assertNotEquals(firstToken, secondToken);

        correlator.dispatch(XmlDocuments.parse("<return token=\"" + secondToken + "\" id=\"second\"/>"));
        assertFalse(first.isDone());
        assertEquals("second", second.join().getAttribute("id"));

        correlator.dispatch(XmlDocuments.parse("<return token=\"" + firstToken + "\" id=\"first\"/>"));
        assertEquals("first", first.join().getAttribute("id"));
        assertEquals(0, correlator.getPendingCount());
        assertEquals(2, stats.getRepliesReceived());
    }

    @Test
    void replyHook_runsOnDispatchBeforeCompletion() throws IOException
    {
        List<Runnable> completions = new ArrayList<>();
        RequestCorrelator deferred = new RequestCorrelator(new TokenGenerator(5L), completions::add, stats);
        List<String> seen = new ArrayList<>();

        CompletableFuture<Element> reply = deferred.send(connection, DebugMessages.use("/app"), new CancellationScope(),
                element -> seen.add(element.getAttribute("node")));
        int token = tokenOf(connection.sent.get(0));

        deferred.dispatch(XmlDocuments.parse("<use token=\"" + token + "\" node=\"/app\"/>"));

        assertEquals(List.of("/app"), seen);
        assertFalse(reply.isDone());

        completions.forEach(Runnable::run);
        assertTrue(reply.isDone());
    }

    @Test
    void replyHook_notCalledForExceptionReply() throws IOException
    {
        List<Element> seen = new ArrayList<>();
        CompletableFuture<Element> reply = correlator.send(connection, DebugMessages.use("/x"), new CancellationScope(),
                seen::add);
        int token = tokenOf(connection.sent.get(0));

        correlator.dispatch(XmlDocuments.parse("<exception token=\"" + token + "\" message=\"No such node\"/>"));

        assertTrue(seen.isEmpty());
        assertTrue(reply.isCompletedExceptionally());
    }

    @Test
    void dispatch_exceptionReply_faultsRequest() throws IOException
    {
        CompletableFuture<Element> reply = correlator.send(connection, DebugMessages.execute("x"), new CancellationScope());
        int token = tokenOf(connection.sent.get(0));

        correlator.dispatch(XmlDocuments.parse(
                "<exception token=\"" + token + "\" message=\"Boom\" type=\"InvalidOperation\"/>"));

        CompletionException e = assertThrows(CompletionException.class, reply::join);
        RemoteDebugException fault = assertInstanceOf(RemoteDebugException.class, e.getCause());
        assertEquals("Boom", fault.getMessage());
        assertEquals("InvalidOperation", fault.getExceptionType());
        assertEquals(1, stats.getRemoteFaults());
        assertEquals(0, correlator.getPendingCount());
    }

    @Test
    void dispatch_notificationToken_ignored() throws IOException
    {
        CompletableFuture<Element> reply = correlator.send(connection, DebugMessages.member(), new CancellationScope());

        correlator.dispatch(XmlDocuments.parse("<event token=\"0\"/>"));
        correlator.dispatch(XmlDocuments.parse("<event/>"));

        assertFalse(reply.isDone());
        assertEquals(1, correlator.getPendingCount());
        assertEquals(0, stats.getRepliesReceived());
    }

    @Test
    void dispatch_unknownToken_dropped() throws IOException
    {
        CompletableFuture<Element> reply = correlator.send(connection, DebugMessages.member(), new CancellationScope());
        int token = tokenOf(connection.sent.get(0));

        correlator.dispatch(XmlDocuments.parse("<return token=\"" + (token == 1 ? 2 : token - 1) + "\"/>"));

        assertFalse(reply.isDone());
    }

    @Test
    void scopeCancel_cancelsAndRemovesRequest() throws IOException
    {
        CancellationScope scope = new CancellationScope();
        CompletableFuture<Element> reply = correlator.send(connection, DebugMessages.member(), scope);
        int token = tokenOf(connection.sent.get(0));

        scope.cancel();

        assertTrue(reply.isCancelled());
        assertThrows(CancellationException.class, reply::join);
        assertEquals(0, correlator.getPendingCount());
        assertEquals(1, stats.getCancelledRequests());

        // A late reply is discarded
        correlator.dispatch(XmlDocuments.parse("<return token=\"" + token + "\"/>"));
        assertTrue(reply.isCancelled());
    }

    @Test
    void futureCancel_removesRequest() throws IOException
    {
        CompletableFuture<Element> reply = correlator.send(connection, DebugMessages.member(), new CancellationScope());

        reply.cancel(false);

        assertEquals(0, correlator.getPendingCount());
    }

    @Test
    void send_scopeAlreadyCancelled_notTransmitted() throws IOException
    {
        CancellationScope scope = new CancellationScope();
        scope.cancel();

        CompletableFuture<Element> reply = correlator.send(connection, DebugMessages.member(), scope);

        assertTrue(reply.isCancelled());
        assertTrue(connection.sent.isEmpty());
        assertEquals(0, correlator.getPendingCount());
    }

    @Test
    void send_transmitFails_removesRegistration()
    {
        connection.failure = new IOException("Broken pipe");

        IOException e = assertThrows(IOException.class,
                () -> correlator.send(connection, DebugMessages.member(), new CancellationScope()));

        assertEquals("Broken pipe", e.getMessage());
        assertEquals(0, correlator.getPendingCount());
        assertEquals(0, stats.getRequestsSent());
    }

    @Test
    void send_uncheckedTransmitFailure_removesRegistration()
    {
        connection.runtimeFailure = new IllegalStateException("Serializer failed");
        CancellationScope scope = new CancellationScope();

        assertThrows(IllegalStateException.class, () -> correlator.send(connection, DebugMessages.member(), scope));

        assertEquals(0, correlator.getPendingCount());
        assertEquals(0, scope.getCallbackCount());
    }

    @Test
    void sendRestoreUse_replyUpdatesPath() throws IOException
    {
        AtomicReference<String> restored = new AtomicReference<>();
        int token = correlator.sendRestoreUse(connection, "/app", restored::set);

        Element sent = XmlDocuments.parse(connection.sent.get(0));
        assertEquals("use", sent.getTagName());
        assertEquals("/app", sent.getAttribute("node"));
        assertEquals(token, tokenOf(connection.sent.get(0)));

        correlator.dispatch(XmlDocuments.parse("<use token=\"" + token + "\" node=\"/app\"/>"));

        assertEquals("/app", restored.get());
        assertEquals(0, correlator.getPendingCount());
    }

    @Test
    void sendRestoreUse_exceptionReply_fallsBackToRoot() throws IOException
    {
        AtomicReference<String> restored = new AtomicReference<>();
        int token = correlator.sendRestoreUse(connection, "/gone", restored::set);

        correlator.dispatch(XmlDocuments.parse("<exception token=\"" + token + "\" message=\"No such node\"/>"));

        assertEquals("/", restored.get());
    }

    @Test
    void clearRestoreUse_lateReplyIgnored() throws IOException
    {
        AtomicReference<String> restored = new AtomicReference<>();
        int token = correlator.sendRestoreUse(connection, "/app", restored::set);

        correlator.clearRestoreUse();
        correlator.dispatch(XmlDocuments.parse("<use token=\"" + token + "\" node=\"/app\"/>"));

        assertNull(restored.get());
    }

    @Test
    void completionExecutorRejects_cancelsRequest() throws IOException
    {
        RequestCorrelator rejecting = new RequestCorrelator(new TokenGenerator(1L), runnable ->
        {
            throw new RejectedExecutionException("shut down");
        }, stats);
        CompletableFuture<Element> reply = rejecting.send(connection, DebugMessages.member(), new CancellationScope());
        int token = tokenOf(connection.sent.get(0));

        rejecting.dispatch(XmlDocuments.parse("<return token=\"" + token + "\"/>"));

        assertTrue(reply.isCancelled());
    }

    private static int tokenOf(String xml)
    {
        return DebugMessages.getToken(XmlDocuments.parse(xml));
    }

    /**
     * Captures sent messages; never receives anything.
     */
    private static class RecordingConnection implements MessageConnection
    {
        final List<String> sent = new ArrayList<>();
        IOException failure;
        RuntimeException runtimeFailure;

        @Override
        public void send(String message) throws IOException
        {
            if (failure != null)
            {
                throw failure;
            }
            if (runtimeFailure != null)
            {
                throw runtimeFailure;
            }
            sent.add(message);
        }

        @Override
        public Optional<Frame> receive()
        {
            return Optional.empty();
        }

        @Override
        public void close(int statusCode, String reason)
        {
        }

        @Override
        public void abort()
        {
        }

        @Override
        public boolean isOpen()
        {
            return true;
        }
    }
}
