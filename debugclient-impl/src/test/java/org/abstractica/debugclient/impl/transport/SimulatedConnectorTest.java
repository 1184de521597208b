package org.abstractica.debugclient.impl.transport;

import org.abstractica.debugclient.CancellationScope;
import org.abstractica.debugclient.Credentials;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SimulatedConnector} and {@link SimulatedConnection}.
 */
class SimulatedConnectorTest
{
    private static final URI SERVER = URI.create("ws://debug.test/");
    private static final Duration WAIT = Duration.ofSeconds(2);

    private final SimulatedConnector connector = new SimulatedConnector();

    @Test
    void connect_recordsAttempt() throws Exception
    {
        Optional<Credentials> credentials = Optional.of(new Credentials("admin", "secret"));

        MessageConnection client = connector.connect(SERVER, "dedbg", credentials, new CancellationScope());

        assertTrue(client.isOpen());
        assertNotNull(connector.accept(WAIT));
        SimulatedConnector.ConnectAttempt attempt = connector.getConnectAttempts().get(0);
        assertEquals(SERVER, attempt.serverUri());
        assertEquals("dedbg", attempt.subProtocol());
        assertEquals(credentials, attempt.credentials());
    }

    @Test
    void connect_refused_throws() throws Exception
    {
        connector.refuseConnections(new IOException("Connection refused"));

        assertThrows(IOException.class,
                () -> connector.connect(SERVER, "dedbg", Optional.empty(), new CancellationScope()));

        connector.acceptConnections();
        assertNotNull(connector.connect(SERVER, "dedbg", Optional.empty(), new CancellationScope()));
    }

    @Test
    void connect_cancelledScope_throwsCancellation()
    {
        CancellationScope scope = new CancellationScope();
        scope.cancel();

        assertThrows(CancellationException.class,
                () -> connector.connect(SERVER, "dedbg", Optional.empty(), scope));
    }

    @Test
    void messagesFlowBothWays() throws Exception
    {
        MessageConnection client = connector.connect(SERVER, "dedbg", Optional.empty(), new CancellationScope());
        SimulatedConnection server = connector.accept(WAIT);

        client.send("<member token=\"1\"/>");
        assertEquals("<member token=\"1\"/>", server.takeSent(WAIT));

        server.deliverFrames("<ret", "urn/>");
        Frame first = client.receive().orElseThrow();
        Frame second = client.receive().orElseThrow();
        assertFalse(first.endOfMessage());
        assertTrue(second.endOfMessage());
        assertEquals("urn/>", new String(second.payload(), StandardCharsets.UTF_8));
    }

    @Test
    void closeFromServer_endsInput() throws Exception
    {
        MessageConnection client = connector.connect(SERVER, "dedbg", Optional.empty(), new CancellationScope());
        SimulatedConnection server = connector.accept(WAIT);

        server.closeFromServer();

        assertTrue(client.receive().isEmpty());
        assertTrue(client.receive().isEmpty());
        assertFalse(client.isOpen());
        assertThrows(IOException.class, () -> client.send("<member/>"));
    }

    @Test
    void failFromServer_receiveThrows() throws Exception
    {
        MessageConnection client = connector.connect(SERVER, "dedbg", Optional.empty(), new CancellationScope());
        SimulatedConnection server = connector.accept(WAIT);

        server.failFromServer(new IOException("Connection reset"));

        IOException e = assertThrows(IOException.class, client::receive);
        assertEquals("Connection reset", e.getMessage());
    }

    @Test
    void close_recordsStatus() throws Exception
    {
        MessageConnection client = connector.connect(SERVER, "dedbg", Optional.empty(), new CancellationScope());
        SimulatedConnection server = connector.accept(WAIT);

        client.close(MessageConnection.MESSAGE_TOO_BIG, "Message too big.");
        client.close(MessageConnection.NORMAL_CLOSURE, "Done");

        assertEquals(1009, server.getCloseStatus());
        assertFalse(client.isOpen());
    }

    @Test
    void abort_wakesBlockedReceiver() throws Exception
    {
        MessageConnection client = connector.connect(SERVER, "dedbg", Optional.empty(), new CancellationScope());

        Thread aborter = new Thread(() ->
        {
            try
            {
                Thread.sleep(50);
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
            }
            client.abort();
        });
        aborter.start();

        assertTrue(client.receive().isEmpty());
        aborter.join();
    }
}
