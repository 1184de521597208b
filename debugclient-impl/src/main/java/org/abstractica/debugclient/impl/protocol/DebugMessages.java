package org.abstractica.debugclient.impl.protocol;

import org.abstractica.debugclient.RemoteDebugException;
import org.w3c.dom.Element;

import java.util.Objects;

/**
 * Builds request envelopes and reads the protocol attributes of replies.
 *
 * <p>Wire format:</p>
 * <ul>
 *   <li>{@code <use node="/path"/>} selects the current node</li>
 *   <li>{@code <execute>command</execute>} runs a command</li>
 *   <li>{@code <member/>} lists members of the current node</li>
 *   <li>{@code <list r="true|false"/>} enumerates nodes</li>
 * </ul>
 *
 * <p>Every request gets a {@code token} attribute that the reply echoes.
 * A reply with the root tag {@code exception} reports a remote fault.</p>
 */
public final class DebugMessages
{
    private DebugMessages() {}

    /**
     * Sub-protocol negotiated on every connection.
     */
    public static final String SUB_PROTOCOL = "dedbg";

    /**
     * Path of the root node.
     */
    public static final String ROOT_PATH = "/";

    /**
     * Token of unsolicited server notifications.
     */
    public static final int NOTIFICATION_TOKEN = 0;

    static final String TOKEN_ATTRIBUTE = "token";
    static final String NODE_ATTRIBUTE = "node";
    static final String RECURSIVE_ATTRIBUTE = "r";
    static final String EXCEPTION_TAG = "exception";

    // ========== Requests ==========

    /**
     * Creates a {@code use} request.
     *
     * @param nodePath the node to select
     * @return the envelope
     */
    public static Element use(String nodePath)
    {
        Objects.requireNonNull(nodePath, "nodePath");

        Element message = XmlDocuments.newElement("use");
        message.setAttribute(NODE_ATTRIBUTE, nodePath);
        return message;
    }

    /**
     * Creates an {@code execute} request.
     *
     * @param command the command text
     * @return the envelope
     */
    public static Element execute(String command)
    {
        Objects.requireNonNull(command, "command");

        Element message = XmlDocuments.newElement("execute");
        message.appendChild(message.getOwnerDocument().createTextNode(command));
        return message;
    }

    /**
     * Creates a {@code member} request.
     *
     * @return the envelope
     */
    public static Element member()
    {
        return XmlDocuments.newElement("member");
    }

    /**
     * Creates a {@code list} request.
     *
     * @param recursive whether to list all descendants
     * @return the envelope
     */
    public static Element list(boolean recursive)
    {
        Element message = XmlDocuments.newElement("list");
        message.setAttribute(RECURSIVE_ATTRIBUTE, Boolean.toString(recursive));
        return message;
    }

    // ========== Tokens ==========

    /**
     * Stamps a request token onto a message.
     *
     * @param message the message
     * @param token   the token
     */
    public static void setToken(Element message, int token)
    {
        message.setAttribute(TOKEN_ATTRIBUTE, Integer.toString(token));
    }

    /**
     * Reads the token of a message.
     *
     * @param message the message
     * @return the token, {@link #NOTIFICATION_TOKEN} if missing or invalid
     */
    public static int getToken(Element message)
    {
        return XmlDocuments.getIntAttribute(message, TOKEN_ATTRIBUTE, NOTIFICATION_TOKEN);
    }

    // ========== Replies ==========

    /**
     * Returns whether a reply reports a remote exception.
     *
     * @param reply the reply
     * @return true for {@code <exception>} replies
     */
    public static boolean isException(Element reply)
    {
        return EXCEPTION_TAG.equals(reply.getTagName());
    }

    /**
     * Converts an {@code <exception>} reply into a remote fault.
     *
     * @param reply the reply
     * @return the fault
     */
    public static RemoteDebugException toRemoteException(Element reply)
    {
        String message = XmlDocuments.getAttribute(reply, "message", "No message");
        String type = XmlDocuments.getAttribute(reply, "type", "Exception");
        Element stackTrace = XmlDocuments.getChildElement(reply, "stackTrace");
        return new RemoteDebugException(message, type, stackTrace == null ? null : stackTrace.getTextContent());
    }

    /**
     * Reads the node path reported by a {@code use} reply.
     *
     * @param reply the reply
     * @return the path, {@link #ROOT_PATH} if none was reported
     */
    public static String getUsePath(Element reply)
    {
        return XmlDocuments.getAttribute(reply, NODE_ATTRIBUTE, ROOT_PATH);
    }
}
