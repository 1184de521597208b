package org.abstractica.debugclient.impl.protocol;

/**
 * Indicates that a received message is not a well-formed XML document.
 */
public final class MalformedMessageException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    public MalformedMessageException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
