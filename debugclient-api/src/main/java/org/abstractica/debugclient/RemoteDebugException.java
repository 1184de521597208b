package org.abstractica.debugclient;

import java.util.Objects;
import java.util.Optional;

/**
 * An exception reported by the debug server as the reply to a request.
 *
 * <p>Remote faults are delivered through the request's future and never
 * indicate a transport problem: the connection stays open.</p>
 */
public class RemoteDebugException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    private final String exceptionType;
    private final String remoteStackTrace;

    /**
     * Creates a remote fault.
     *
     * @param message          the message reported by the server
     * @param exceptionType    the category (exception type name) reported by the server
     * @param remoteStackTrace the server-side stack trace, or null if none was sent
     */
    public RemoteDebugException(String message, String exceptionType, String remoteStackTrace)
    {
        super(message);
        this.exceptionType = Objects.requireNonNull(exceptionType, "exceptionType");
        this.remoteStackTrace = remoteStackTrace;
    }

    /**
     * Returns the exception type name reported by the server.
     *
     * @return the remote exception category
     */
    public String getExceptionType()
    {
        return exceptionType;
    }

    /**
     * Returns the stack trace recorded on the server.
     *
     * @return the remote stack trace, or empty if the server sent none
     */
    public Optional<String> getRemoteStackTrace()
    {
        return Optional.ofNullable(remoteStackTrace);
    }

    @Override
    public String toString()
    {
        return "RemoteDebugException[" + exceptionType + "]: " + getMessage();
    }
}
