package com.stock.pulse.engine.test.service;

import com.stock.pulse.engine.model.canonical.CanonicalField;
import com.stock.pulse.engine.model.canonical.CanonicalRecord;
import com.stock.pulse.engine.service.persistence.PersistContext;
import com.stock.pulse.engine.service.persistence.TimeSeriesSink;
import com.stock.pulse.engine.service.persistence.TimeSeriesStore;
import com.stock.pulse.engine.service.persistence.UpsertSummary;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TimeSeriesSinkTest {

    private static final Instant NOW = Instant.parse("2024-06-14T10:00:00Z");

    private final TimeSeriesStore store = mock(TimeSeriesStore.class);
    private final TimeSeriesSink sink = new TimeSeriesSink(store);

    @Test
    void naturalKeyRaceIsRetriedOnce() {
        CanonicalRecord r = new CanonicalRecord("TCS", NOW).put(CanonicalField.LAST_PRICE, 3900.0, NOW);
        when(store.upsert(r))
                .thenThrow(new DataIntegrityViolationException("duplicate key"))
                .thenReturn(new UpsertSummary(true, false, false, false, false));

        sink.write(r, PersistContext.adhoc("test", NOW));

        verify(store, times(2)).upsert(r);
    }

    @Test
    void secondRaceIsNotSwallowed() {
        CanonicalRecord r = new CanonicalRecord("TCS", NOW).put(CanonicalField.LAST_PRICE, 3900.0, NOW);
        when(store.upsert(r)).thenThrow(new DataIntegrityViolationException("duplicate key"));

        assertThatThrownBy(() -> sink.write(r, PersistContext.adhoc("test", NOW))).isInstanceOf(DataIntegrityViolationException.class);
        verify(store, times(2)).upsert(r);
    }
}
