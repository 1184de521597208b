/**
 * Debug client implementation module.
 *
 * <p>Provides the default implementation of the debug client API.</p>
 */
module debugclient.impl
{
    requires transitive debugclient.api;
    requires java.net.http;
    requires java.xml;
    requires org.slf4j;

    // Export factory implementations for external use
    exports org.abstractica.debugclient.impl.session;
    exports org.abstractica.debugclient.impl.transport;

    // Export envelope helpers for callers building their own messages
    exports org.abstractica.debugclient.impl.protocol;
}
