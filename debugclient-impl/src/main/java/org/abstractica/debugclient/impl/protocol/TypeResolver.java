package org.abstractica.debugclient.impl.protocol;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;

/**
 * Maps declared wire type names to Java types and text converters.
 *
 * <p>Names are matched case-insensitively. The defaults cover the scripting
 * type names used by the server ({@code int}, {@code string}, ...) and their
 * fully qualified runtime aliases ({@code System.Int32}, ...). Unknown names
 * and text that does not fit the type both fail with an exception; callers
 * decide how to degrade.</p>
 */
public final class TypeResolver
{
    private final Map<String, Conversion<?>> conversions;

    /**
     * A resolved type and the function that converts text into it.
     *
     * @param type      the Java type
     * @param converter converts wire text; throws if the text does not fit
     * @param <T>       the Java type
     */
    public record Conversion<T>(Class<T> type, Function<String, ? extends T> converter)
    {
        public Conversion
        {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(converter, "converter");
        }

        /**
         * Converts text into the type.
         *
         * @param text the wire text
         * @return the converted value
         * @throws RuntimeException if the text does not fit the type
         */
        public T convert(String text)
        {
            return converter.apply(text);
        }
    }

    private TypeResolver(Map<String, Conversion<?>> conversions)
    {
        this.conversions = Map.copyOf(conversions);
    }

    /**
     * Returns a resolver with the default type names.
     *
     * @return the resolver
     */
    public static TypeResolver defaults()
    {
        return new Builder().withDefaults().build();
    }

    /**
     * Resolves a declared type name.
     *
     * @param typeName the wire type name
     * @return the conversion
     * @throws IllegalArgumentException if the name is unknown
     */
    public Conversion<?> resolve(String typeName)
    {
        Objects.requireNonNull(typeName, "typeName");

        Conversion<?> conversion = conversions.get(typeName.trim().toLowerCase(Locale.ROOT));
        if (conversion == null)
        {
            throw new IllegalArgumentException("Unknown type: " + typeName);
        }
        return conversion;
    }

    // ========== Converters ==========

    private static Boolean parseBoolean(String text)
    {
        String value = text.trim();
        if (value.equalsIgnoreCase("true"))
        {
            return Boolean.TRUE;
        }
        if (value.equalsIgnoreCase("false"))
        {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("Not a boolean: " + text);
    }

    private static Character parseChar(String text)
    {
        if (text.length() != 1)
        {
            throw new IllegalArgumentException("Not a single character: " + text);
        }
        return text.charAt(0);
    }

    private static long parseUnsigned(String text, long max)
    {
        long value = Long.parseLong(text.trim());
        if (value < 0 || value > max)
        {
            throw new NumberFormatException("Out of range 0.." + max + ": " + text);
        }
        return value;
    }

    private static BigInteger parseUnsignedLong(String text)
    {
        BigInteger value = new BigInteger(text.trim());
        if (value.signum() < 0 || value.bitLength() > 64)
        {
            throw new NumberFormatException("Out of range for ulong: " + text);
        }
        return value;
    }

    private static LocalDateTime parseDateTime(String text)
    {
        String value = text.trim();
        try
        {
            return LocalDateTime.parse(value);
        }
        catch (RuntimeException e)
        {
            return OffsetDateTime.parse(value).toLocalDateTime();
        }
    }

    // ========== Builder ==========

    /**
     * Builder for custom type tables.
     */
    public static final class Builder
    {
        private final Map<String, Conversion<?>> conversions = new HashMap<>();

        /**
         * Registers a type under one or more names.
         *
         * @param type      the Java type
         * @param converter the text converter
         * @param names     the wire names
         * @param <T>       the Java type
         * @return this builder
         */
        public <T> Builder register(Class<T> type, Function<String, ? extends T> converter, String... names)
        {
            Conversion<T> conversion = new Conversion<>(type, converter);
            for (String name : names)
            {
                conversions.put(name.toLowerCase(Locale.ROOT), conversion);
            }
            return this;
        }

        /**
         * Registers the default type names.
         *
         * @return this builder
         */
        public Builder withDefaults()
        {
            register(Object.class, text -> text, "object", "System.Object");
            register(String.class, text -> text, "string", "System.String");
            register(Boolean.class, TypeResolver::parseBoolean, "bool", "boolean", "System.Boolean");
            register(Character.class, TypeResolver::parseChar, "char", "System.Char");
            register(Byte.class, text -> Byte.parseByte(text.trim()), "sbyte", "System.SByte");
            register(Short.class, text -> (short) parseUnsigned(text, 0xFF), "byte", "System.Byte");
            register(Short.class, text -> Short.parseShort(text.trim()), "short", "int16", "System.Int16");
            register(Integer.class, text -> (int) parseUnsigned(text, 0xFFFF), "ushort", "uint16", "System.UInt16");
            register(Integer.class, text -> Integer.parseInt(text.trim()), "int", "int32", "System.Int32");
            register(Long.class, text -> parseUnsigned(text, 0xFFFFFFFFL), "uint", "uint32", "System.UInt32");
            register(Long.class, text -> Long.parseLong(text.trim()), "long", "int64", "System.Int64");
            register(BigInteger.class, TypeResolver::parseUnsignedLong, "ulong", "uint64", "System.UInt64");
            register(Float.class, text -> Float.parseFloat(text.trim()), "float", "single", "System.Single");
            register(Double.class, text -> Double.parseDouble(text.trim()), "double", "System.Double");
            register(BigDecimal.class, text -> new BigDecimal(text.trim()), "decimal", "System.Decimal");
            register(LocalDateTime.class, TypeResolver::parseDateTime, "datetime", "System.DateTime");
            register(UUID.class, text -> UUID.fromString(text.trim()), "guid", "System.Guid");
            return this;
        }

        public TypeResolver build()
        {
            return new TypeResolver(conversions);
        }
    }
}
