package org.abstractica.debugclient.impl.protocol;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * DOM helpers for protocol envelopes.
 *
 * <p>Parsing is hardened: DOCTYPE declarations and external entities are rejected.</p>
 */
public final class XmlDocuments
{
    private XmlDocuments() {}

    private static final DocumentBuilderFactory BUILDER_FACTORY = createBuilderFactory();
    private static final TransformerFactory TRANSFORMER_FACTORY = TransformerFactory.newInstance();

    // Parse errors surface as exceptions only, never on stderr
    private static final ErrorHandler RETHROWING_HANDLER = new ErrorHandler()
    {
        @Override
        public void warning(SAXParseException exception)
        {
        }

        @Override
        public void error(SAXParseException exception) throws SAXException
        {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException
        {
            throw exception;
        }
    };

    // ========== Parsing ==========

    /**
     * Parses a UTF-8 encoded document.
     *
     * @param data   the buffer
     * @param offset the start of the document
     * @param length the number of bytes
     * @return the root element
     * @throws MalformedMessageException if the bytes are not a well-formed document
     */
    public static Element parse(byte[] data, int offset, int length)
    {
        try
        {
            Document document = newDocumentBuilder().parse(new ByteArrayInputStream(data, offset, length));
            return document.getDocumentElement();
        }
        catch (SAXException | IOException e)
        {
            throw new MalformedMessageException("Malformed message: " + e.getMessage(), e);
        }
    }

    /**
     * Parses a document from text.
     *
     * @param xml the document text
     * @return the root element
     * @throws MalformedMessageException if the text is not a well-formed document
     */
    public static Element parse(String xml)
    {
        byte[] bytes = xml.getBytes(StandardCharsets.UTF_8);
        return parse(bytes, 0, bytes.length);
    }

    // ========== Building ==========

    /**
     * Creates a new document with an empty root element.
     *
     * @param tagName the root tag
     * @return the root element
     */
    public static Element newElement(String tagName)
    {
        Objects.requireNonNull(tagName, "tagName");

        Document document = newDocumentBuilder().newDocument();
        Element root = document.createElement(tagName);
        document.appendChild(root);
        return root;
    }

    /**
     * Serialises an element without an XML declaration.
     *
     * @param element the element
     * @return the XML text
     */
    public static String toXml(Element element)
    {
        Objects.requireNonNull(element, "element");

        try
        {
            Transformer transformer;
            synchronized (TRANSFORMER_FACTORY)
            {
                transformer = TRANSFORMER_FACTORY.newTransformer();
            }
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");

            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(element), new StreamResult(writer));
            return writer.toString();
        }
        catch (TransformerException e)
        {
            throw new IllegalStateException("Failed to serialise <" + element.getTagName() + ">", e);
        }
    }

    // ========== Access ==========

    /**
     * Returns an attribute value.
     *
     * @param element      the element
     * @param name         the attribute name
     * @param defaultValue returned when the attribute is missing
     * @return the value
     */
    public static String getAttribute(Element element, String name, String defaultValue)
    {
        return element.hasAttribute(name) ? element.getAttribute(name) : defaultValue;
    }

    /**
     * Returns an integer attribute value.
     *
     * @param element      the element
     * @param name         the attribute name
     * @param defaultValue returned when the attribute is missing or not a number
     * @return the value
     */
    public static int getIntAttribute(Element element, String name, int defaultValue)
    {
        if (!element.hasAttribute(name))
        {
            return defaultValue;
        }

        try
        {
            return Integer.parseInt(element.getAttribute(name).trim());
        }
        catch (NumberFormatException e)
        {
            return defaultValue;
        }
    }

    /**
     * Returns the direct child elements with the given tag, in document order.
     *
     * @param parent  the parent element
     * @param tagName the child tag
     * @return the children
     */
    public static List<Element> getChildElements(Element parent, String tagName)
    {
        List<Element> result = new ArrayList<>();
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++)
        {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE && tagName.equals(child.getNodeName()))
            {
                result.add((Element) child);
            }
        }
        return result;
    }

    /**
     * Returns the first direct child element with the given tag.
     *
     * @param parent  the parent element
     * @param tagName the child tag
     * @return the child, or null if there is none
     */
    public static Element getChildElement(Element parent, String tagName)
    {
        List<Element> children = getChildElements(parent, tagName);
        return children.isEmpty() ? null : children.get(0);
    }

    // ========== Helpers ==========

    private static DocumentBuilder newDocumentBuilder()
    {
        try
        {
            DocumentBuilder builder;
            synchronized (BUILDER_FACTORY)
            {
                builder = BUILDER_FACTORY.newDocumentBuilder();
            }
            builder.setErrorHandler(RETHROWING_HANDLER);
            return builder;
        }
        catch (ParserConfigurationException e)
        {
            throw new IllegalStateException("XML parser unavailable", e);
        }
    }

    private static DocumentBuilderFactory createBuilderFactory()
    {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        try
        {
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        }
        catch (ParserConfigurationException e)
        {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
        factory.setExpandEntityReferences(false);
        factory.setNamespaceAware(false);
        return factory;
    }
}
