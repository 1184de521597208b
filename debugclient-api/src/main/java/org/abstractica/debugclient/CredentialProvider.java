package org.abstractica.debugclient;

import java.net.URI;
import java.util.Optional;

/**
 * Supplies credentials for each connection attempt.
 *
 * <p>Called once per connect, so implementations may return fresh
 * credentials after a reconnect.</p>
 */
@FunctionalInterface
public interface CredentialProvider
{
    /**
     * Provider that never supplies credentials.
     */
    CredentialProvider NONE = serverUri -> Optional.empty();

    /**
     * Returns the credentials for a connection to the given server.
     *
     * @param serverUri the (already rewritten) WebSocket address
     * @return the credentials, or empty to connect anonymously
     */
    Optional<Credentials> getCredentials(URI serverUri);
}
