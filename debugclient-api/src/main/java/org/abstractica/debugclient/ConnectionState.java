package org.abstractica.debugclient;

/**
 * Lifecycle state of the physical connection behind a {@link DebugSession}.
 *
 * <p>A session loops through {@code DISCONNECTED -> CONNECTING -> OPEN -> DISCONNECTED}
 * until it is closed, after which it stays {@code DISPOSED}.</p>
 */
public enum ConnectionState
{
    DISCONNECTED,
    CONNECTING,
    OPEN,
    DISPOSED
}
