package com.stock.pulse.engine.test.repo;

import com.stock.pulse.engine.common.constants.PipelineProperties;
import com.stock.pulse.engine.common.exception.ValidationException;
import com.stock.pulse.engine.dto.ScreenerFilter;
import com.stock.pulse.engine.dto.ScreenerQuery;
import com.stock.pulse.engine.model.canonical.CanonicalField;
import com.stock.pulse.engine.model.canonical.CanonicalRecord;
import com.stock.pulse.engine.model.entity.market.PriceDailyEntity;
import com.stock.pulse.engine.repo.market.FundamentalsQuarterlyRepository;
import com.stock.pulse.engine.repo.market.PriceDailyRepository;
import com.stock.pulse.engine.service.persistence.TechnicalIndicatorCalculator;
import com.stock.pulse.engine.service.persistence.TimeSeriesStore;
import com.stock.pulse.engine.service.persistence.UpsertSummary;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.stock.pulse.engine.model.canonical.CanonicalField.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({TimeSeriesStore.class, TechnicalIndicatorCalculator.class, TimeSeriesStoreTest.Config.class})
class TimeSeriesStoreTest {

    private static final Instant NOW = Instant.parse("2024-06-14T10:00:00Z");

    @TestConfiguration
    static class Config {
        @Bean
        PipelineProperties pipelineProperties() {
            return new PipelineProperties();
        }

        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private TimeSeriesStore store;

    @Autowired
    private PriceDailyRepository prices;

    @Autowired
    private FundamentalsQuarterlyRepository fundamentals;

    private static CanonicalRecord quote(String symbol, double price) {
        return new CanonicalRecord(symbol, NOW)
                .put(LAST_PRICE, price, NOW)
                .put(VOLUME, 1000.0, NOW);
    }

    @Test
    void sameDayUpsertIsIdempotent() {
        UpsertSummary first = store.upsert(quote("TCS", 3900.0));
        store.upsert(quote("TCS", 3910.5));

        assertThat(first.price()).isTrue();
        assertThat(first.technical()).isFalse();
        assertThat(prices.countBySymbol("TCS")).isEqualTo(1);
        PriceDailyEntity row = store.latestPrice("TCS").orElseThrow();
        assertThat(row.getTradeDate()).isEqualTo(LocalDate.of(2024, 6, 14));
        assertThat(row.getClosePrice().doubleValue()).isEqualTo(3910.5);
        assertThat(row.getVolume()).isEqualTo(1000L);
    }

    @Test
    void quarterlyDataKeysOnThePeriodEnd() {
        CanonicalRecord r = quote("INFY", 1500.0)
                .put(ROE, 31.0, NOW)
                .put(PROMOTER_HOLDING, 14.9, NOW);

        UpsertSummary s = store.upsert(r);
        store.upsert(new CanonicalRecord("INFY", NOW).put(ROE, 32.0, NOW));

        assertThat(s.tables()).containsExactly("prices_daily", "fundamentals_quarterly", "shareholding_quarterly");
        assertThat(fundamentals.count()).isEqualTo(1);

        CanonicalRecord latest = store.latestRecord("INFY").orElseThrow();
        assertThat(latest.number(ROE)).contains(32.0);
        assertThat(latest.number(PROMOTER_HOLDING)).contains(14.9);
        assertThat(latest.number(CLOSE_PRICE)).contains(1500.0);
        assertThat(latest.value(PERIOD_END)).contains(LocalDate.of(2024, 3, 31));
        assertThat(latest.text(PERIOD_TYPE)).contains(TimeSeriesStore.DEFAULT_PERIOD_TYPE);
        assertThat(store.latestRecord("UNKNOWN")).isEmpty();
    }

    @Test
    void screenerFiltersSortsAndLimits() {
        store.upsert(quote("AAA", 100.0).put(ROE, 25.0, NOW));
        store.upsert(quote("BBB", 200.0).put(ROE, 12.0, NOW));
        store.upsert(quote("CCC", 300.0));

        ScreenerQuery q = ScreenerQuery.builder()
                .filters(List.of(new ScreenerFilter("close", "gte", 150.0)))
                .sortBy("close").sortOrder("desc")
                .build();
        List<Map<String, Object>> rows = store.screen(q);
        assertThat(rows).extracting(m -> m.get("symbol")).containsExactly("CCC", "BBB");

        ScreenerQuery byRoe = ScreenerQuery.builder()
                .filters(List.of(new ScreenerFilter("roe", "between", 10.0, 30.0)))
                .sortBy("roe").sortOrder("asc")
                .build();
        assertThat(store.screen(byRoe)).extracting(m -> m.get("symbol")).containsExactly("BBB", "AAA");

        ScreenerQuery nullsLast = ScreenerQuery.builder().sortBy("roe").sortOrder("desc").limit(3).build();
        assertThat(store.screen(nullsLast)).extracting(m -> m.get("symbol")).containsExactly("AAA", "BBB", "CCC");

        ScreenerQuery limited = ScreenerQuery.builder().symbols(List.of("aaa", "ccc")).limit(1).build();
        assertThat(store.screen(limited)).extracting(m -> m.get("symbol")).containsExactly("AAA");
    }

    @Test
    void screenerRejectsUnknownInput() {
        assertThatThrownBy(() -> store.screen(ScreenerQuery.builder()
                .filters(List.of(new ScreenerFilter("close; DROP TABLE prices_daily", "gt", 1.0))).build()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.screen(ScreenerQuery.builder()
                .filters(List.of(new ScreenerFilter("close", "like", 1.0))).build()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.screen(ScreenerQuery.builder().sortBy("password").build()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.screen(ScreenerQuery.builder().limit(201).build()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.screen(ScreenerQuery.builder().limit(0).build()))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void quarterEnds() {
        assertThat(TimeSeriesStore.quarterEnd(LocalDate.of(2024, 6, 14))).isEqualTo(LocalDate.of(2024, 3, 31));
        assertThat(TimeSeriesStore.quarterEnd(LocalDate.of(2024, 6, 30))).isEqualTo(LocalDate.of(2024, 6, 30));
        assertThat(TimeSeriesStore.quarterEnd(LocalDate.of(2024, 1, 2))).isEqualTo(LocalDate.of(2023, 12, 31));
        assertThat(store.stats()).containsKeys("prices_daily", "technical_indicators");
    }
}
