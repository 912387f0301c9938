package com.clinical.phenotype.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Tagged value produced by tasks and consumed by expressions.
 * One of boolean, numeric, string, structured record, or absent.
 *
 * <p>Coercions are deliberately narrow: only {@link #isTruthy()} crosses types, and
 * it is what a bare define reference means inside {@code AND}/{@code OR}/{@code NOT}.</p>
 */
public final class Value {

    private static final Value ABSENT = new Value(ValueType.ABSENT, null);
    private static final Value TRUE = new Value(ValueType.BOOLEAN, Boolean.TRUE);
    private static final Value FALSE = new Value(ValueType.BOOLEAN, Boolean.FALSE);

    private final ValueType type;
    private final Object payload;

    private Value(ValueType type, Object payload) {
        this.type = type;
        this.payload = payload;
    }

    public static Value bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Value number(double value) {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("numeric value must not be NaN");
        }
        return new Value(ValueType.NUMERIC, value);
    }

    public static Value string(String value) {
        Objects.requireNonNull(value, "value");
        return new Value(ValueType.STRING, value);
    }

    public static Value structured(Map<String, Value> fields) {
        Objects.requireNonNull(fields, "fields");
        return new Value(ValueType.STRUCTURED, Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
    }

    public static Value absent() {
        return ABSENT;
    }

    /**
     * Converts a plain Java object (as read from JSON or returned by a collaborator) into a value.
     *
     * @throws IllegalArgumentException for collections and other types with no value form
     */
    @SuppressWarnings("unchecked")
    public static Value of(Object raw) {
        if (raw == null) {
            return ABSENT;
        }
        if (raw instanceof Value v) {
            return v;
        }
        if (raw instanceof Boolean b) {
            return bool(b);
        }
        if (raw instanceof Number n) {
            return number(n.doubleValue());
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, Value> fields = new LinkedHashMap<>();
            ((Map<Object, Object>) map).forEach((k, v) -> fields.put(String.valueOf(k), of(v)));
            return structured(fields);
        }
        if (raw instanceof CharSequence || raw instanceof Character || raw instanceof Enum<?>) {
            return string(raw.toString());
        }
        throw new IllegalArgumentException("Cannot represent " + raw.getClass().getName()
                + " as a value; lists must be returned as separate results");
    }

    public ValueType type() {
        return type;
    }

    public boolean isPresent() {
        return type != ValueType.ABSENT;
    }

    /**
     * Presence test: boolean values count as themselves, any other present value counts as a hit.
     */
    public boolean isTruthy() {
        if (type == ValueType.BOOLEAN) {
            return (Boolean) payload;
        }
        return isPresent();
    }

    public boolean asBoolean() {
        requireType(ValueType.BOOLEAN);
        return (Boolean) payload;
    }

    public double asNumber() {
        requireType(ValueType.NUMERIC);
        return (Double) payload;
    }

    public String asString() {
        requireType(ValueType.STRING);
        return (String) payload;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Value> fields() {
        requireType(ValueType.STRUCTURED);
        return (Map<String, Value>) payload;
    }

    /**
     * Field access. {@code value} on a scalar returns the scalar itself; anything missing is absent.
     */
    public Value field(String name) {
        if (type == ValueType.STRUCTURED) {
            return fields().getOrDefault(name, ABSENT);
        }
        if ("value".equals(name) && type != ValueType.ABSENT) {
            return this;
        }
        return ABSENT;
    }

    /**
     * Plain Java form for serialization: Boolean, Double, String, Map or null.
     */
    public Object toJava() {
        if (type == ValueType.STRUCTURED) {
            Map<String, Object> out = new LinkedHashMap<>();
            fields().forEach((k, v) -> out.put(k, v.toJava()));
            return out;
        }
        return payload;
    }

    private void requireType(ValueType expected) {
        if (type != expected) {
            throw new IllegalStateException("Expected " + expected + " value but was " + type);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value other)) return false;
        return type == other.type && Objects.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, payload);
    }

    @Override
    public String toString() {
        return type == ValueType.ABSENT ? "absent" : String.valueOf(payload);
    }
}
