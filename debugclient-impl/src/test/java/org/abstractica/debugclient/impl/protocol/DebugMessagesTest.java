package org.abstractica.debugclient.impl.protocol;

import org.abstractica.debugclient.RemoteDebugException;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DebugMessages} and {@link XmlDocuments}.
 */
class DebugMessagesTest
{
    @Test
    void use_setsNodeAttribute()
    {
        Element message = DebugMessages.use("/app");
        DebugMessages.setToken(message, 42);

        assertEquals("<use node=\"/app\" token=\"42\"/>", XmlDocuments.toXml(message));
    }

    @Test
    void execute_escapesCommandText()
    {
        String xml = XmlDocuments.toXml(DebugMessages.execute("a < b && c"));

        assertEquals("<execute>a &lt; b &amp;&amp; c</execute>", xml);
        assertEquals("a < b && c", XmlDocuments.parse(xml).getTextContent());
    }

    @Test
    void list_setsRecursiveFlag()
    {
        assertEquals("true", DebugMessages.list(true).getAttribute("r"));
        assertEquals("false", DebugMessages.list(false).getAttribute("r"));
        assertEquals("member", DebugMessages.member().getTagName());
    }

    @Test
    void getToken_missingOrInvalid_isNotification()
    {
        assertEquals(DebugMessages.NOTIFICATION_TOKEN, DebugMessages.getToken(XmlDocuments.parse("<event/>")));
        assertEquals(DebugMessages.NOTIFICATION_TOKEN,
                DebugMessages.getToken(XmlDocuments.parse("<return token=\"x\"/>")));
        assertEquals(17, DebugMessages.getToken(XmlDocuments.parse("<return token=\"17\"/>")));
    }

    @Test
    void toRemoteException_readsAttributesAndStackTrace()
    {
        Element reply = XmlDocuments.parse(
                "<exception token=\"3\" message=\"Boom\" type=\"InvalidOperation\">"
                        + "<stackTrace>at Foo.Bar()</stackTrace></exception>");

        assertTrue(DebugMessages.isException(reply));
        RemoteDebugException fault = DebugMessages.toRemoteException(reply);
        assertEquals("Boom", fault.getMessage());
        assertEquals("InvalidOperation", fault.getExceptionType());
        assertEquals("at Foo.Bar()", fault.getRemoteStackTrace().orElseThrow());
    }

    @Test
    void toRemoteException_defaults()
    {
        RemoteDebugException fault = DebugMessages.toRemoteException(XmlDocuments.parse("<exception/>"));

        assertEquals("No message", fault.getMessage());
        assertEquals("Exception", fault.getExceptionType());
        assertTrue(fault.getRemoteStackTrace().isEmpty());
    }

    @Test
    void getUsePath_missingNode_isRoot()
    {
        assertEquals("/", DebugMessages.getUsePath(XmlDocuments.parse("<use token=\"1\"/>")));
        assertEquals("/app", DebugMessages.getUsePath(XmlDocuments.parse("<use node=\"/app\"/>")));
    }

    @Test
    void parse_malformed_throws()
    {
        assertThrows(MalformedMessageException.class, () -> XmlDocuments.parse("<return"));
    }

    @Test
    void parse_rejectsDoctype()
    {
        String xml = "<!DOCTYPE r [<!ENTITY e SYSTEM \"file:///etc/passwd\">]><r>&e;</r>";
        assertThrows(MalformedMessageException.class, () -> XmlDocuments.parse(xml));
    }
}
