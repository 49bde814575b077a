package com.stock.pulse.engine.service.persistence;

import com.stock.pulse.engine.model.canonical.CanonicalField;
import com.stock.pulse.engine.model.canonical.CanonicalRecord;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Binds one numeric canonical field to one entity column.
 */
record ColumnBinding<E>(CanonicalField field, Function<E, Double> getter, BiConsumer<E, Double> setter) {

    static <E> ColumnBinding<E> dbl(CanonicalField field, Function<E, Double> getter, BiConsumer<E, Double> setter) {
        return new ColumnBinding<>(field, getter, setter);
    }

    static <E> ColumnBinding<E> decimal(CanonicalField field, Function<E, BigDecimal> getter, BiConsumer<E, BigDecimal> setter) {
        return new ColumnBinding<>(field,
                e -> getter.apply(e) == null ? null : getter.apply(e).doubleValue(),
                (e, v) -> setter.accept(e, v == null ? null : BigDecimal.valueOf(v).setScale(4, RoundingMode.HALF_UP)));
    }

    static <E> ColumnBinding<E> whole(CanonicalField field, Function<E, Long> getter, BiConsumer<E, Long> setter) {
        return new ColumnBinding<>(field,
                e -> getter.apply(e) == null ? null : getter.apply(e).doubleValue(),
                (e, v) -> setter.accept(e, v == null ? null : Math.round(v)));
    }

    /**
     * Copies every present value; absent fields leave the column untouched.
     *
     * @return number of columns written
     */
    static <E> int apply(List<ColumnBinding<E>> bindings, E entity, CanonicalRecord record) {
        int written = 0;
        for (ColumnBinding<E> b : bindings) {
            Double v = record.number(b.field()).orElse(null);
            if (v == null) continue;
            b.setter().accept(entity, v);
            written++;
        }
        return written;
    }

    static <E> void read(List<ColumnBinding<E>> bindings, E entity, CanonicalRecord into, Instant updatedAt) {
        for (ColumnBinding<E> b : bindings) {
            Double v = b.getter().apply(entity);
            if (v != null) into.put(b.field(), v, updatedAt);
        }
    }

    static <E> boolean anyPresent(List<ColumnBinding<E>> bindings, CanonicalRecord record) {
        for (ColumnBinding<E> b : bindings) {
            if (record.number(b.field()).isPresent()) return true;
        }
        return false;
    }
}
