/**
 * Debug client API module.
 *
 * <p>Provides interfaces for talking to a remote debug server over a
 * persistent, self-healing session.</p>
 */
module debugclient.api
{
    requires transitive java.xml;
    requires org.slf4j;

    exports org.abstractica.debugclient;
}
