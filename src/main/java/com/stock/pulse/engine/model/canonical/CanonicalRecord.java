package com.stock.pulse.engine.model.canonical;

import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One symbol's canonical data as of a point in time, with per-field provenance.
 * <p>
 * Values can only be written through {@link #put}, which records availability and
 * the update instant in the same step, so a populated field always has provenance.
 */
public final class CanonicalRecord {

    @Getter
    private final String symbol;
    @Getter
    private Instant asOf;

    private final EnumMap<CanonicalField, Object> values = new EnumMap<>(CanonicalField.class);
    private final EnumMap<CanonicalField, Boolean> availability = new EnumMap<>(CanonicalField.class);
    private final EnumMap<CanonicalField, Instant> lastUpdated = new EnumMap<>(CanonicalField.class);

    public CanonicalRecord(String symbol, Instant asOf) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.asOf = Objects.requireNonNull(asOf, "asOf");
    }

    /**
     * Record built from a normalizer result where every field was observed at {@code asOf}.
     */
    public static CanonicalRecord of(String symbol, CanonicalFields fields, Instant asOf) {
        CanonicalRecord r = new CanonicalRecord(symbol, asOf);
        fields.asMap().forEach((f, v) -> r.put(f, v, asOf));
        return r;
    }

    public CanonicalRecord put(CanonicalField field, Object value, Instant updatedAt) {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(updatedAt, "updatedAt");
        if (value == null) {
            markUnavailable(field);
            return this;
        }
        CanonicalFields.requireType(field, value);
        values.put(field, value);
        availability.put(field, Boolean.TRUE);
        lastUpdated.put(field, updatedAt);
        if (updatedAt.isAfter(asOf)) asOf = updatedAt;
        return this;
    }

    /**
     * Records that a field was looked for and not found. Never overrides a present value.
     */
    public CanonicalRecord markUnavailable(CanonicalField field) {
        if (!values.containsKey(field)) availability.put(field, Boolean.FALSE);
        return this;
    }

    /**
     * Takes every field of {@code other} that is newer than (or missing from) this record.
     */
    public CanonicalRecord merge(CanonicalRecord other) {
        if (other == null) return this;
        other.values.forEach((f, v) -> {
            Instant theirs = other.lastUpdated.get(f);
            Instant ours = lastUpdated.get(f);
            if (ours == null || theirs.isAfter(ours)) put(f, v, theirs);
        });
        other.availability.forEach((f, present) -> {
            if (!present) markUnavailable(f);
        });
        return this;
    }

    public Optional<Object> value(CanonicalField field) {
        return Optional.ofNullable(values.get(field));
    }

    public Optional<Double> number(CanonicalField field) {
        Object v = values.get(field);
        return (v instanceof Double d) ? Optional.of(d) : Optional.empty();
    }

    public Optional<Boolean> flag(CanonicalField field) {
        Object v = values.get(field);
        return (v instanceof Boolean b) ? Optional.of(b) : Optional.empty();
    }

    public Optional<String> text(CanonicalField field) {
        Object v = values.get(field);
        return (v instanceof String s) ? Optional.of(s) : Optional.empty();
    }

    public boolean isAvailable(CanonicalField field) {
        return Boolean.TRUE.equals(availability.get(field));
    }

    public Optional<Instant> lastUpdated(CanonicalField field) {
        return Optional.ofNullable(lastUpdated.get(field));
    }

    public int size() {
        return values.size();
    }

    public CanonicalFields toFields() {
        CanonicalFields.Builder b = CanonicalFields.builder();
        values.forEach(b::put);
        return b.build();
    }

    public Map<String, Object> getValues() {
        Map<String, Object> out = new LinkedHashMap<>();
        values.forEach((f, v) -> out.put(f.key(), v));
        return Collections.unmodifiableMap(out);
    }

    public Map<String, Boolean> getFieldAvailability() {
        Map<String, Boolean> out = new LinkedHashMap<>();
        availability.forEach((f, v) -> out.put(f.key(), v));
        return Collections.unmodifiableMap(out);
    }

    public Map<String, Instant> getFieldLastUpdated() {
        Map<String, Instant> out = new LinkedHashMap<>();
        lastUpdated.forEach((f, v) -> out.put(f.key(), v));
        return Collections.unmodifiableMap(out);
    }

    public String getNseCode() {
        return text(CanonicalField.NSE_CODE).orElse(symbol);
    }

    public String getBseCode() {
        return text(CanonicalField.BSE_CODE).orElse(null);
    }

    public String getIsin() {
        return text(CanonicalField.ISIN).orElse(null);
    }
}
