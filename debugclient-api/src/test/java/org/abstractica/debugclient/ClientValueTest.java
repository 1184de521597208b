package org.abstractica.debugclient;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ClientValue}.
 */
class ClientValueTest
{
    @Test
    void convertedValue_reportsResolvedType()
    {
        ClientValue value = new ClientValue("$0", "int", Integer.class, 2);

        assertTrue(value.isConverted());
        assertEquals(Integer.class, value.getType());
        assertEquals(Integer.class, value.getResolvedType().orElseThrow());
        assertEquals("2", value.getValueAsString());
    }

    @Test
    void unconvertedValue_isStringAndQuoted()
    {
        ClientValue value = new ClientValue("x", "Foo.Bar", null, "abc");

        assertFalse(value.isConverted());
        assertTrue(value.getResolvedType().isEmpty());
        assertEquals(String.class, value.getType());
        assertEquals("'abc'", value.getValueAsString());
    }

    @Test
    void nullValue_printsNull()
    {
        assertEquals("null", new ClientValue("x", "object", Object.class, null).getValueAsString());
    }

    @Test
    void table_formatsMembers()
    {
        ClientValue table = new ClientValue("t", ClientValue.TABLE_TYPE, null, List.of(
                new ClientValue("$1", "string", String.class, "a"),
                new ClientValue("$2", "int", Integer.class, 3)
        ));

        assertTrue(table.isTable());
        assertEquals(2, table.getMembers().size());
        assertEquals("{$1='a', $2=3}", table.getValueAsString());
    }

    @Test
    void table_copiesMembers()
    {
        List<ClientValue> members = new ArrayList<>();
        members.add(new ClientValue("$1", "int", Integer.class, 1));
        ClientValue table = new ClientValue("t", ClientValue.TABLE_TYPE, null, members);

        members.clear();

        assertEquals(1, table.getMembers().size());
        assertThrows(UnsupportedOperationException.class, () -> table.getMembers().clear());
    }

    @Test
    void scalar_hasNoMembers()
    {
        assertTrue(new ClientValue("x", "int", Integer.class, 1).getMembers().isEmpty());
    }

    @Test
    void equals_comparesAllFields()
    {
        ClientValue a = new ClientValue("x", "int", Integer.class, 1);

        assertEquals(a, new ClientValue("x", "int", Integer.class, 1));
        assertEquals(a.hashCode(), new ClientValue("x", "int", Integer.class, 1).hashCode());
        assertNotEquals(a, new ClientValue("x", "int", null, "1"));
        assertNotEquals(a, new ClientValue("y", "int", Integer.class, 1));
    }

    @Test
    void toString_includesNameTypeAndValue()
    {
        assertEquals("x:string = 'hi'", new ClientValue("x", "string", String.class, "hi").toString());
    }
}
