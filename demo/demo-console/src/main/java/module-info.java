/**
 * Demo console module.
 *
 * <p>Interactive command line client for a remote debug server.</p>
 */
module debugclient.demo
{
    requires debugclient.api;
    requires debugclient.impl;
    requires org.slf4j;
}
