package org.abstractica.debugclient.impl.transport;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link WebSocketConnector} address handling.
 */
class WebSocketConnectorTest
{
    @Test
    void toWebSocketUri_http_becomesWs()
    {
        assertEquals(URI.create("ws://localhost:8080/debug"),
                WebSocketConnector.toWebSocketUri(URI.create("http://localhost:8080/debug")));
    }

    @Test
    void toWebSocketUri_https_becomesWss()
    {
        assertEquals(URI.create("wss://debug.example.com/dbg?x=1"),
                WebSocketConnector.toWebSocketUri(URI.create("https://debug.example.com/dbg?x=1")));
    }

    @Test
    void toWebSocketUri_schemeIsCaseInsensitive()
    {
        assertEquals("ws", WebSocketConnector.toWebSocketUri(URI.create("HTTP://host/")).getScheme());
    }

    @Test
    void toWebSocketUri_wsUnchanged()
    {
        URI uri = URI.create("wss://host:9000/debug");
        assertSame(uri, WebSocketConnector.toWebSocketUri(uri));
    }
}
