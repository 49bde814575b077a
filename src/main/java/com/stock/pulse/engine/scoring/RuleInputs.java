package com.stock.pulse.engine.scoring;

import com.stock.pulse.engine.common.exception.ScoringInputIncompleteException;
import com.stock.pulse.engine.model.canonical.CanonicalField;
import com.stock.pulse.engine.model.canonical.CanonicalRecord;

import java.util.Objects;
import java.util.Optional;

/**
 * Read access for rule predicates. Every {@code require*} method throws
 * {@link ScoringInputIncompleteException} instead of substituting a default.
 */
public final class RuleInputs {

    private final CanonicalRecord record;
    private final HistoricalAggregates history;

    public RuleInputs(CanonicalRecord record, HistoricalAggregates history) {
        this.record = Objects.requireNonNull(record, "record");
        this.history = history == null ? HistoricalAggregates.EMPTY : history;
    }

    public CanonicalRecord record() {
        return record;
    }

    public HistoricalAggregates history() {
        return history;
    }

    public Optional<Double> number(CanonicalField field) {
        return record.number(field);
    }

    public double require(CanonicalField field) {
        return record.number(field).orElseThrow(() -> new ScoringInputIncompleteException(field.key()));
    }

    public boolean requireFlag(CanonicalField field) {
        return record.flag(field).orElseThrow(() -> new ScoringInputIncompleteException(field.key()));
    }

    /**
     * Last traded price, else the close.
     */
    public Optional<Double> price() {
        return record.number(CanonicalField.LAST_PRICE).or(() -> record.number(CanonicalField.CLOSE_PRICE));
    }

    public double requirePrice() {
        return price().orElseThrow(() -> new ScoringInputIncompleteException(CanonicalField.LAST_PRICE.key()));
    }

    /**
     * Sector P/E from the record, else from history.
     */
    public Optional<Double> sectorPe() {
        return record.number(CanonicalField.SECTOR_PE).or(() -> Optional.ofNullable(history.getSectorPe()));
    }

    public double requireSectorPe() {
        return sectorPe().orElseThrow(() -> new ScoringInputIncompleteException(CanonicalField.SECTOR_PE.key()));
    }
}
