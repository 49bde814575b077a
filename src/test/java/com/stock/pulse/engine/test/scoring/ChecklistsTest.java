package com.stock.pulse.engine.test.scoring;

import com.stock.pulse.engine.enums.ChecklistStatus;
import com.stock.pulse.engine.enums.ChecklistVerdict;
import com.stock.pulse.engine.model.canonical.CanonicalRecord;
import com.stock.pulse.engine.scoring.ChecklistItemResult;
import com.stock.pulse.engine.scoring.ChecklistReport;
import com.stock.pulse.engine.scoring.Checklists;
import com.stock.pulse.engine.scoring.HistoricalAggregates;
import com.stock.pulse.engine.scoring.RuleInputs;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.stock.pulse.engine.model.canonical.CanonicalField.*;
import static org.assertj.core.api.Assertions.assertThat;

class ChecklistsTest {

    private static final Instant NOW = Instant.parse("2024-06-14T10:00:00Z");

    private static CanonicalRecord longTermAllPass() {
        CanonicalRecord r = new CanonicalRecord("CHK", NOW);
        r.put(ROE, 20.0, NOW);
        r.put(ROCE, 20.0, NOW);
        r.put(DEBT_TO_EQUITY, 0.5, NOW);
        r.put(INTEREST_COVERAGE, 5.0, NOW);
        r.put(REVENUE_GROWTH_YOY, 12.0, NOW);
        r.put(PROFIT_GROWTH_YOY, 12.0, NOW);
        r.put(FREE_CASH_FLOW, 5.0e8, NOW);
        r.put(PROMOTER_HOLDING, 55.0, NOW);
        r.put(PROMOTER_PLEDGING, 0.0, NOW);
        r.put(PE_RATIO, 20.0, NOW);
        r.put(SECTOR_PE, 20.0, NOW);
        return r;
    }

    private static ChecklistReport longTerm(CanonicalRecord r) {
        return Checklists.evaluate("long_term", Checklists.LONG_TERM, new RuleInputs(r, HistoricalAggregates.EMPTY));
    }

    @Test
    void everyItemPassing() {
        ChecklistReport rep = longTerm(longTermAllPass());

        assertThat(rep.getPassed()).isEqualTo(10);
        assertThat(rep.getScorePercent()).isEqualTo(100.0);
        assertThat(rep.getVerdict()).isEqualTo(ChecklistVerdict.PASS);
    }

    @Test
    void failedDealBreakerFailsTheChecklistRegardlessOfPercent() {
        CanonicalRecord r = longTermAllPass();
        r.put(DEBT_TO_EQUITY, 1.5, NOW);

        ChecklistReport rep = longTerm(r);

        assertThat(rep.getScorePercent()).isEqualTo(90.0);
        assertThat(rep.getDealBreakerFailures()).isEqualTo(1);
        assertThat(rep.getVerdict()).isEqualTo(ChecklistVerdict.FAIL);
    }

    @Test
    void sixOfTenIsCaution() {
        CanonicalRecord r = longTermAllPass();
        r.put(ROE, 8.0, NOW);
        r.put(ROCE, 8.0, NOW);
        r.put(REVENUE_GROWTH_YOY, 2.0, NOW);
        r.put(PROFIT_GROWTH_YOY, 2.0, NOW);

        ChecklistReport rep = longTerm(r);

        assertThat(rep.getPassed()).isEqualTo(6);
        assertThat(rep.getFailed()).isEqualTo(4);
        assertThat(rep.getVerdict()).isEqualTo(ChecklistVerdict.CAUTION);
    }

    @Test
    void indeterminateItemsAreLeftOutOfThePercentage() {
        CanonicalRecord r = new CanonicalRecord("FEW", NOW);
        r.put(DEBT_TO_EQUITY, 0.4, NOW);
        r.put(INTEREST_COVERAGE, 6.0, NOW);
        r.put(PROMOTER_PLEDGING, 2.0, NOW);

        ChecklistReport rep = longTerm(r);

        assertThat(rep.getPassed()).isEqualTo(3);
        assertThat(rep.getIndeterminate()).isEqualTo(7);
        assertThat(rep.getScorePercent()).isEqualTo(100.0);
        assertThat(rep.getVerdict()).isEqualTo(ChecklistVerdict.PASS);
        ChecklistItemResult l1 = rep.getItems().get(0);
        assertThat(l1.getStatus()).isEqualTo(ChecklistStatus.INDETERMINATE);
        assertThat(l1.getMissingField()).isEqualTo(ROE.key());
    }

    @Test
    void nothingDeterminateIsInsufficientData() {
        CanonicalRecord r = new CanonicalRecord("NONE", NOW);

        ChecklistReport rep = Checklists.evaluate("short_term", Checklists.SHORT_TERM,
                new RuleInputs(r, HistoricalAggregates.EMPTY));

        assertThat(rep.getIndeterminate()).isEqualTo(Checklists.SHORT_TERM.size());
        assertThat(rep.getScorePercent()).isEqualTo(0.0);
        assertThat(rep.getVerdict()).isEqualTo(ChecklistVerdict.INSUFFICIENT_DATA);
    }

    @Test
    void regulatoryActionFailsTheShortTermList() {
        CanonicalRecord r = new CanonicalRecord("REG", NOW);
        r.put(LAST_PRICE, 100.0, NOW);
        r.put(SMA_20, 95.0, NOW);
        r.put(SMA_50, 90.0, NOW);
        r.put(RSI_14, 55.0, NOW);
        r.put(MACD, 1.2, NOW);
        r.put(MACD_SIGNAL, 0.8, NOW);
        r.put(VOLUME_RATIO, 1.4, NOW);
        r.put(DELIVERY_PCT, 48.0, NOW);
        r.put(PROMOTER_PLEDGING, 0.0, NOW);
        r.put(REGULATORY_ACTION, Boolean.TRUE, NOW);

        ChecklistReport rep = Checklists.evaluate("short_term", Checklists.SHORT_TERM,
                new RuleInputs(r, HistoricalAggregates.EMPTY));

        assertThat(rep.getPassed()).isEqualTo(7);
        assertThat(rep.getDealBreakerFailures()).isEqualTo(1);
        assertThat(rep.getVerdict()).isEqualTo(ChecklistVerdict.FAIL);
    }
}
