package com.stock.pulse.engine.test.repo;

import com.stock.pulse.engine.common.constants.PipelineProperties;
import com.stock.pulse.engine.model.canonical.CanonicalRecord;
import com.stock.pulse.engine.repo.market.PriceDailyRepository;
import com.stock.pulse.engine.repo.market.ShareholdingQuarterlyRepository;
import com.stock.pulse.engine.service.persistence.TechnicalIndicatorCalculator;
import com.stock.pulse.engine.service.persistence.TimeSeriesStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static com.stock.pulse.engine.model.canonical.CanonicalField.LAST_PRICE;
import static com.stock.pulse.engine.model.canonical.CanonicalField.PROMOTER_HOLDING;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({TimeSeriesStore.class, TechnicalIndicatorCalculator.class, TimeSeriesStoreRollbackTest.Config.class})
class TimeSeriesStoreRollbackTest {

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

    @MockBean
    private ShareholdingQuarterlyRepository shareholding;

    @Autowired
    private TimeSeriesStore store;

    @Autowired
    private PriceDailyRepository prices;

    @Test
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    void failedLaterTableRollsBackThePriceRow() {
        when(shareholding.saveAndFlush(any())).thenThrow(new DataAccessResourceFailureException("shareholding down"));
        CanonicalRecord r = new CanonicalRecord("WIPRO", NOW)
                .put(LAST_PRICE, 480.0, NOW)
                .put(PROMOTER_HOLDING, 72.9, NOW);

        assertThatThrownBy(() -> store.upsert(r)).isInstanceOf(DataAccessResourceFailureException.class);

        assertThat(prices.countBySymbol("WIPRO")).isZero();
    }
}
