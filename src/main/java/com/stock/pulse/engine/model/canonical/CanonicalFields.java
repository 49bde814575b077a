package com.stock.pulse.engine.model.canonical;

import com.stock.pulse.engine.enums.ValueType;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable normalizer output: canonical field to typed value.
 * Absent fields are simply not in the map; nothing is zero-filled.
 */
public final class CanonicalFields {

    private static final CanonicalFields EMPTY = new CanonicalFields(new EnumMap<>(CanonicalField.class));

    private final Map<CanonicalField, Object> values;

    private CanonicalFields(EnumMap<CanonicalField, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static CanonicalFields empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Object> get(CanonicalField field) {
        return Optional.ofNullable(values.get(field));
    }

    public Optional<Double> number(CanonicalField field) {
        Object v = values.get(field);
        return (v instanceof Double d) ? Optional.of(d) : Optional.empty();
    }

    /**
     * Looks a value up under its canonical key or any alias.
     */
    public Optional<Object> lookup(String name) {
        return CanonicalField.fromName(name).flatMap(this::get);
    }

    public boolean has(CanonicalField field) {
        return values.containsKey(field);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public Set<CanonicalField> fields() {
        return values.keySet();
    }

    public Map<CanonicalField, Object> asMap() {
        return values;
    }

    /**
     * Canonical keys only, in catalogue order.
     */
    public Map<String, Object> asKeyMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        values.forEach((f, v) -> out.put(f.key(), v));
        return out;
    }

    /**
     * Every name a consumer may ask for: each value appears under its key and all its aliases.
     */
    public Map<String, Object> asAliasMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        values.forEach((f, v) -> f.allNames().forEach(n -> out.put(n, v)));
        return out;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.values.putAll(values);
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CanonicalFields other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "CanonicalFields" + asKeyMap();
    }

    public static final class Builder {
        private final EnumMap<CanonicalField, Object> values = new EnumMap<>(CanonicalField.class);

        private Builder() {
        }

        public Builder put(CanonicalField field, Object value) {
            Objects.requireNonNull(field, "field");
            if (value == null) return this;
            requireType(field, value);
            values.put(field, value);
            return this;
        }

        public Builder putIfAbsent(CanonicalField field, Object value) {
            if (!values.containsKey(field)) put(field, value);
            return this;
        }

        public boolean has(CanonicalField field) {
            return values.containsKey(field);
        }

        public Optional<Double> number(CanonicalField field) {
            Object v = values.get(field);
            return (v instanceof Double d) ? Optional.of(d) : Optional.empty();
        }

        public CanonicalFields build() {
            return new CanonicalFields(new EnumMap<>(values));
        }
    }

    static void requireType(CanonicalField field, Object value) {
        if (!matches(field.type(), value)) {
            throw new IllegalArgumentException(field.key() + " expects " + field.type()
                    + " but got " + value.getClass().getSimpleName());
        }
    }

    private static boolean matches(ValueType type, Object value) {
        return switch (type) {
            case NUMBER -> value instanceof Double;
            case TEXT -> value instanceof String;
            case BOOLEAN -> value instanceof Boolean;
            case DATE -> value instanceof LocalDate;
            case TIMESTAMP -> value instanceof Instant;
        };
    }
}
