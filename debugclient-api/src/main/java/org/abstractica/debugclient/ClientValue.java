package org.abstractica.debugclient;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A named value returned by the debug server.
 *
 * <p>The value is one of:</p>
 * <ul>
 *   <li>a converted scalar, when the declared type could be resolved ({@link #isConverted()})</li>
 *   <li>the raw text, when resolution or conversion failed</li>
 *   <li>an ordered list of nested values, when the declared type is {@code table}</li>
 * </ul>
 *
 * <p>Instances are immutable.</p>
 */
public final class ClientValue
{
    /**
     * Declared type name of nested tabular values.
     */
    public static final String TABLE_TYPE = "table";

    private final String name;
    private final String typeName;
    private final Class<?> type; // null if the value was not converted
    private final Object value;

    /**
     * Creates a value.
     *
     * @param name     the member name, or {@code $N} for positional members
     * @param typeName the declared wire type name
     * @param type     the resolved runtime type, or null if not converted
     * @param value    the converted value, raw text, or list of nested values
     */
    public ClientValue(String name, String typeName, Class<?> type, Object value)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.type = type;
        this.value = value instanceof List<?> list ? List.copyOf(list) : value;
    }

    public String getName()
    {
        return name;
    }

    public String getTypeName()
    {
        return typeName;
    }

    /**
     * Returns the resolved runtime type.
     *
     * @return the type, or empty if the value was not converted
     */
    public Optional<Class<?>> getResolvedType()
    {
        return Optional.ofNullable(type);
    }

    /**
     * Returns the runtime type of {@link #getValue()}, {@code String} for unconverted values.
     *
     * @return the effective type
     */
    public Class<?> getType()
    {
        return type != null ? type : String.class;
    }

    public Object getValue()
    {
        return value;
    }

    public boolean isConverted()
    {
        return type != null;
    }

    public boolean isTable()
    {
        return TABLE_TYPE.equals(typeName);
    }

    /**
     * Returns the nested values of a table.
     *
     * @return the members, or an empty list if this is not a table
     */
    @SuppressWarnings("unchecked")
    public List<ClientValue> getMembers()
    {
        return value instanceof List<?> ? (List<ClientValue>) value : List.of();
    }

    /**
     * Formats the value for display.
     *
     * <p>{@code null} prints as {@code null}, strings are quoted with single
     * quotes and tables print as {@code {name=value, ...}}.</p>
     *
     * @return the display text
     */
    public String getValueAsString()
    {
        if (value == null)
        {
            return "null";
        }
        if (value instanceof List<?>)
        {
            return getMembers().stream()
                    .map(member -> member.getName() + "=" + member.getValueAsString())
                    .collect(Collectors.joining(", ", "{", "}"));
        }
        if (getType() == String.class)
        {
            return "'" + value + "'";
        }
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (!(o instanceof ClientValue other))
        {
            return false;
        }
        return name.equals(other.name)
                && typeName.equals(other.typeName)
                && Objects.equals(type, other.type)
                && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(name, typeName, type, value);
    }

    @Override
    public String toString()
    {
        return name + ":" + typeName + " = " + getValueAsString();
    }
}
