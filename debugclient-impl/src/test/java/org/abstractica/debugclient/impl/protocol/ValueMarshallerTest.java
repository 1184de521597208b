package org.abstractica.debugclient.impl.protocol;

import org.abstractica.debugclient.ClientValue;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ValueMarshaller}.
 */
class ValueMarshallerTest
{
    private final ValueMarshaller marshaller = new ValueMarshaller();

    @Test
    void parseReturn_positionalInt()
    {
        List<ClientValue> values = marshaller.parseReturn(
                XmlDocuments.parse("<return token=\"5\"><v t=\"int\">2</v></return>"));

        assertEquals(1, values.size());
        ClientValue value = values.get(0);
        assertEquals("$0", value.getName());
        assertEquals("int", value.getTypeName());
        assertEquals(Integer.class, value.getType());
        assertEquals(2, value.getValue());
    }

    @Test
    void parseReturn_namedMembersInDocumentOrder()
    {
        List<ClientValue> values = marshaller.parseReturn(XmlDocuments.parse(
                "<members><v n=\"Name\" t=\"string\">svc</v><v n=\"Port\" t=\"ushort\">8080</v></members>"));

        assertEquals(2, values.size());
        assertEquals("Name", values.get(0).getName());
        assertEquals("svc", values.get(0).getValue());
        assertEquals("Port", values.get(1).getName());
        assertEquals(8080, values.get(1).getValue());
    }

    @Test
    void parseReturn_noValues_returnsEmptyList()
    {
        assertTrue(marshaller.parseReturn(XmlDocuments.parse("<return token=\"1\"/>")).isEmpty());
    }

    @Test
    void parseValue_table_childrenIndexedFromOne()
    {
        List<ClientValue> values = marshaller.parseReturn(XmlDocuments.parse(
                "<return><v t=\"table\"><v t=\"string\">a</v><v t=\"int\">3</v></v></return>"));

        ClientValue table = values.get(0);
        assertTrue(table.isTable());
        assertEquals("$0", table.getName());
        List<ClientValue> members = table.getMembers();
        assertEquals(2, members.size());
        assertEquals("$1", members.get(0).getName());
        assertEquals("a", members.get(0).getValue());
        assertEquals("$2", members.get(1).getName());
        assertEquals(3, members.get(1).getValue());
    }

    @Test
    void parseValue_nestedTables()
    {
        List<ClientValue> values = marshaller.parseReturn(XmlDocuments.parse(
                "<return><v t=\"table\"><v n=\"inner\" t=\"table\"><v t=\"bool\">true</v></v></v></return>"));

        ClientValue inner = values.get(0).getMembers().get(0);
        assertEquals("inner", inner.getName());
        assertEquals(Boolean.TRUE, inner.getMembers().get(0).getValue());
    }

    @Test
    void parseValue_indexAttribute_overridesPosition()
    {
        List<ClientValue> values = marshaller.parseReturn(XmlDocuments.parse(
                "<return><v i=\"7\" t=\"int\">1</v><v t=\"int\">2</v></return>"));

        assertEquals("$7", values.get(0).getName());
        assertEquals("$1", values.get(1).getName());
    }

    @Test
    void parseValue_conversionFails_keepsRawText()
    {
        ClientValue value = marshaller.parseReturn(
                XmlDocuments.parse("<return><v t=\"int\">abc</v></return>")).get(0);

        assertFalse(value.isConverted());
        assertEquals(String.class, value.getType());
        assertEquals("abc", value.getValue());
        assertEquals("int", value.getTypeName());
    }

    @Test
    void parseValue_unknownType_keepsRawText()
    {
        ClientValue value = marshaller.parseReturn(
                XmlDocuments.parse("<return><v t=\"My.Custom.Type\">xyz</v></return>")).get(0);

        assertFalse(value.isConverted());
        assertEquals("xyz", value.getValue());
        assertEquals("My.Custom.Type", value.getTypeName());
    }

    @Test
    void parseValue_missingType_defaultsToObject()
    {
        ClientValue value = marshaller.parseReturn(XmlDocuments.parse("<return><v>hello</v></return>")).get(0);

        assertEquals("object", value.getTypeName());
        assertEquals("hello", value.getValue());
        assertTrue(value.isConverted());
    }

    @Test
    void parseValue_wideTypes()
    {
        String guid = "0f8fad5b-d9cb-469f-a165-70867728950e";
        List<ClientValue> values = marshaller.parseReturn(XmlDocuments.parse(
                "<return><v t=\"ulong\">18446744073709551615</v><v t=\"System.Guid\">" + guid + "</v></return>"));

        assertEquals(new BigInteger("18446744073709551615"), values.get(0).getValue());
        assertEquals(UUID.fromString(guid), values.get(1).getValue());
    }

    @Test
    void parseValue_customResolver()
    {
        TypeResolver resolver = new TypeResolver.Builder()
                .register(String.class, String::toUpperCase, "shout")
                .build();
        ValueMarshaller custom = new ValueMarshaller(resolver);

        List<ClientValue> values = custom.parseReturn(
                XmlDocuments.parse("<return><v t=\"shout\">hi</v><v t=\"int\">1</v></return>"));

        assertEquals("HI", values.get(0).getValue());
        assertFalse(values.get(1).isConverted());
    }
}
