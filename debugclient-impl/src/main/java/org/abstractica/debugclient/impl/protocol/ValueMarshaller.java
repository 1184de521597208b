package org.abstractica.debugclient.impl.protocol;

import org.abstractica.debugclient.ClientValue;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts value-bearing replies into {@link ClientValue} lists.
 *
 * <p>Each {@code <v>} child is one value:</p>
 * <ul>
 *   <li>{@code n} - member name; if missing, {@code $} plus the {@code i}
 *       attribute or the element's position</li>
 *   <li>{@code t} - declared type, default {@code object}; {@code table} marks
 *       nested {@code <v>} children</li>
 *   <li>element text - the value</li>
 * </ul>
 *
 * <p>Conversion never fails: a type that cannot be resolved, or text that
 * does not fit it, leaves the raw text as an unconverted value.</p>
 */
public final class ValueMarshaller
{
    static final String VALUE_TAG = "v";
    static final String NAME_ATTRIBUTE = "n";
    static final String INDEX_ATTRIBUTE = "i";
    static final String TYPE_ATTRIBUTE = "t";
    static final String DEFAULT_TYPE = "object";

    private final TypeResolver typeResolver;

    public ValueMarshaller()
    {
        this(TypeResolver.defaults());
    }

    public ValueMarshaller(TypeResolver typeResolver)
    {
        this.typeResolver = Objects.requireNonNull(typeResolver, "typeResolver");
    }

    /**
     * Parses every {@code <v>} child of a reply, positions starting at 0.
     *
     * @param reply the reply
     * @return the values in document order
     */
    public List<ClientValue> parseReturn(Element reply)
    {
        return parseChildren(reply, 0);
    }

    /**
     * Parses one {@code <v>} element.
     *
     * @param element         the value element
     * @param positionalIndex the position used when the element has neither {@code n} nor {@code i}
     * @return the value
     */
    public ClientValue parseValue(Element element, int positionalIndex)
    {
        String name = XmlDocuments.getAttribute(element, NAME_ATTRIBUTE, "");
        if (name.isEmpty())
        {
            name = "$" + XmlDocuments.getIntAttribute(element, INDEX_ATTRIBUTE, positionalIndex);
        }

        String typeName = XmlDocuments.getAttribute(element, TYPE_ATTRIBUTE, DEFAULT_TYPE);
        if (ClientValue.TABLE_TYPE.equals(typeName))
        {
            return new ClientValue(name, typeName, null, parseChildren(element, 1));
        }

        String text = element.getTextContent();
        try
        {
            TypeResolver.Conversion<?> conversion = typeResolver.resolve(typeName);
            return new ClientValue(name, typeName, conversion.type(), conversion.convert(text));
        }
        catch (RuntimeException e)
        {
            return new ClientValue(name, typeName, null, text);
        }
    }

    private List<ClientValue> parseChildren(Element parent, int firstIndex)
    {
        List<ClientValue> values = new ArrayList<>();
        int index = firstIndex;
        for (Element child : XmlDocuments.getChildElements(parent, VALUE_TAG))
        {
            values.add(parseValue(child, index++));
        }
        return values;
    }
}
