package com.stock.pulse.engine.service.analysis;

import com.stock.pulse.engine.common.Result;
import com.stock.pulse.engine.common.constants.PipelineProperties;
import com.stock.pulse.engine.model.canonical.CanonicalField;
import com.stock.pulse.engine.model.canonical.CanonicalRecord;
import com.stock.pulse.engine.model.documents.ExtractionAuditLog;
import com.stock.pulse.engine.model.entity.market.PriceDailyEntity;
import com.stock.pulse.engine.repo.documents.ExtractionAuditLogRepo;
import com.stock.pulse.engine.scoring.HistoricalAggregates;
import com.stock.pulse.engine.scoring.ScoreResult;
import com.stock.pulse.engine.scoring.ScoringEngine;
import com.stock.pulse.engine.service.persistence.CacheService;
import com.stock.pulse.engine.service.persistence.TechnicalIndicatorCalculator;
import com.stock.pulse.engine.service.persistence.TimeSeriesStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Loads a symbol's latest data, scores it and caches the result.
 * <p>
 * Input is the latest stored rows merged with the latest audit snapshot, field by field,
 * newest value winning; history for the cross-checks comes from stored daily prices.
 */
@Slf4j
@Service
public class AnalysisService {

    private static final int TRADING_DAYS_52W = 252;

    private final TimeSeriesStore store;
    private final ExtractionAuditLogRepo auditRepo;
    private final TechnicalIndicatorCalculator calculator;
    private final CacheService cache;
    private final PipelineProperties props;
    private final Clock clock;

    public AnalysisService(TimeSeriesStore store,
                           ExtractionAuditLogRepo auditRepo,
                           TechnicalIndicatorCalculator calculator,
                           CacheService cache,
                           PipelineProperties props,
                           Clock clock) {
        this.store = store;
        this.auditRepo = auditRepo;
        this.calculator = calculator;
        this.cache = cache;
        this.props = props;
        this.clock = clock;
    }

    public Result<ScoreResult> analyze(String symbol, boolean refresh) {
        if (symbol == null || symbol.isBlank()) return Result.fail("ERR-VAL-001", "symbol is required");
        String sym = symbol.trim().toUpperCase(Locale.ROOT);

        if (!refresh) {
            Optional<ScoreResult> cached = cache.cachedAnalysis(sym, ScoreResult.class);
            if (cached.isPresent()) return Result.ok(cached.get());
        }

        Optional<CanonicalRecord> record = loadRecord(sym);
        if (record.isEmpty()) return Result.fail("ERR-NOT-FOUND", "No data for " + sym);

        HistoricalAggregates history = aggregates(sym);
        ScoreResult result = ScoringEngine.score(record.get(), history, clock.instant());
        log.info("Scored {}: short={}, long={}, verdict={}, confidence={}", sym, result.getShortTermScore(),
                result.getLongTermScore(), result.getVerdict(), result.getConfidence().getScore());

        try {
            cache.cacheAnalysis(sym, result);
        } catch (RuntimeException e) {
            log.warn("Analysis for {} not cached: {}", sym, e.getMessage());
        }
        return Result.ok(result);
    }

    Optional<CanonicalRecord> loadRecord(String sym) {
        Optional<CanonicalRecord> stored = store.latestRecord(sym);
        Optional<CanonicalRecord> audited = latestAudit(sym);
        if (stored.isPresent()) return Optional.of(stored.get().merge(audited.orElse(null)));
        return audited;
    }

    private Optional<CanonicalRecord> latestAudit(String sym) {
        try {
            return auditRepo.findTopBySymbolOrderByTsDesc(sym).map(AnalysisService::fromAudit);
        } catch (RuntimeException e) {
            log.warn("Audit snapshot for {} unavailable: {}", sym, e.getMessage());
            return Optional.empty();
        }
    }

    static CanonicalRecord fromAudit(ExtractionAuditLog doc) {
        Instant ts = doc.getTs() == null ? Instant.EPOCH : doc.getTs();
        CanonicalRecord r = new CanonicalRecord(doc.getSymbol(), ts);
        if (doc.getFields() == null) return r;
        doc.getFields().forEach((key, raw) -> CanonicalField.fromName(key)
                .ifPresent(f -> {
                    Object v = restore(f, raw);
                    if (v != null) r.put(f, v, ts);
                }));
        return r;
    }

    // inverse of what the audit sink stores: dates as ISO strings, numbers as any BSON numeric
    private static Object restore(CanonicalField f, Object raw) {
        if (raw == null) return null;
        try {
            return switch (f.type()) {
                case NUMBER -> raw instanceof Number n ? n.doubleValue() : null;
                case TEXT -> raw.toString();
                case BOOLEAN -> raw instanceof Boolean b ? b : null;
                case DATE -> raw instanceof LocalDate d ? d : LocalDate.parse(raw.toString());
                case TIMESTAMP -> raw instanceof Instant i ? i
                        : raw instanceof Date d ? d.toInstant() : Instant.parse(raw.toString());
            };
        } catch (DateTimeParseException e) {
            log.debug("Unreadable audit value for {}: {}", f.key(), raw);
            return null;
        }
    }

    HistoricalAggregates aggregates(String sym) {
        List<PriceDailyEntity> rows = store.priceHistory(sym, props.getTechnicalLookbackDays());
        if (rows.isEmpty()) return HistoricalAggregates.EMPTY;

        List<PriceDailyEntity> year = rows.subList(Math.max(0, rows.size() - TRADING_DAYS_52W), rows.size());
        double high = year.stream().mapToDouble(r -> value(r.getHighPrice(), r.getClosePrice())).max().orElse(Double.NaN);
        double low = year.stream().mapToDouble(r -> value(r.getLowPrice(), r.getClosePrice())).min().orElse(Double.NaN);
        Map<CanonicalField, Double> ind = calculator.compute(sym, rows);

        return HistoricalAggregates.builder()
                .lastStoredClose(rows.get(rows.size() - 1).getClosePrice().doubleValue())
                .high52w(Double.isNaN(high) ? null : high)
                .low52w(Double.isNaN(low) ? null : low)
                .sma50(ind.get(CanonicalField.SMA_50))
                .sma200(ind.get(CanonicalField.SMA_200))
                .avgVolume20d(ind.get(CanonicalField.AVG_VOLUME_20D))
                .barCount(rows.size())
                .build();
    }

    private static double value(BigDecimal v, BigDecimal fallback) {
        return (v == null ? fallback : v).doubleValue();
    }
}
