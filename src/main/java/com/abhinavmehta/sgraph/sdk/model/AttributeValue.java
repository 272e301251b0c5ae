package com.abhinavmehta.sgraph.sdk.model;

import com.abhinavmehta.sgraph.sdk.dto.AttributeType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Attribute value restricted to string, number or boolean.
 * <p>
 * Equality is type-sensitive: the string {@code "5"} never equals the number {@code 5}.
 * Numbers compare by numeric value, so {@code 5} equals {@code 5.0}.
 */
public final class AttributeValue {
    private final AttributeType type;
    private final Object value; // String, BigDecimal or Boolean

    private AttributeValue(AttributeType type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static AttributeValue ofString(String value) {
        return new AttributeValue(AttributeType.STRING, Objects.requireNonNull(value, "value"));
    }

    public static AttributeValue ofBoolean(boolean value) {
        return new AttributeValue(AttributeType.BOOLEAN, value);
    }

    public static AttributeValue ofNumber(Number value) {
        return new AttributeValue(AttributeType.NUMBER, toBigDecimal(Objects.requireNonNull(value, "value")));
    }

    /**
     * Converts a raw value as produced by a JSON parser.
     *
     * @throws IllegalArgumentException if the value is null or not a string, number or boolean
     */
    public static AttributeValue of(Object raw) {
        if (raw instanceof AttributeValue) {
            return (AttributeValue) raw;
        }
        if (raw instanceof String) {
            return ofString((String) raw);
        }
        if (raw instanceof Boolean) {
            return ofBoolean((Boolean) raw);
        }
        if (raw instanceof Number) {
            return ofNumber((Number) raw);
        }
        throw new IllegalArgumentException("Unsupported attribute value: "
                + (raw == null ? "null" : raw.getClass().getSimpleName()));
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (number instanceof BigInteger) {
            return new BigDecimal((BigInteger) number);
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("Unsupported numeric attribute value: " + d);
            }
            return BigDecimal.valueOf(d);
        }
        return BigDecimal.valueOf(number.longValue());
    }

    public AttributeType getType() {
        return type;
    }

    /**
     * Plain Java value for serialization: {@link String}, {@link Boolean}, {@link Long} for
     * integral numbers that fit, {@link BigDecimal} otherwise.
     */
    public Object toJavaValue() {
        if (type != AttributeType.NUMBER) {
            return value;
        }
        BigDecimal number = (BigDecimal) value;
        BigDecimal stripped = number.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            try {
                return stripped.longValueExact();
            } catch (ArithmeticException e) {
                return number;
            }
        }
        return number;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttributeValue)) return false;
        AttributeValue other = (AttributeValue) o;
        if (type != other.type) return false;
        if (type == AttributeType.NUMBER) {
            return ((BigDecimal) value).compareTo((BigDecimal) other.value) == 0;
        }
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        Object key = type == AttributeType.NUMBER ? ((BigDecimal) value).stripTrailingZeros() : value;
        return 31 * type.hashCode() + key.hashCode();
    }

    @Override
    public String toString() {
        return type == AttributeType.STRING ? "\"" + value + "\"" : String.valueOf(toJavaValue());
    }
}
