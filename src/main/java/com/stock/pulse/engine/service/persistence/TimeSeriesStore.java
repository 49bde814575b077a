package com.stock.pulse.engine.service.persistence;

import com.stock.pulse.engine.common.constants.PipelineConsts;
import com.stock.pulse.engine.common.constants.PipelineProperties;
import com.stock.pulse.engine.common.exception.ValidationException;
import com.stock.pulse.engine.dto.ScreenerFilter;
import com.stock.pulse.engine.dto.ScreenerQuery;
import com.stock.pulse.engine.model.canonical.CanonicalField;
import com.stock.pulse.engine.model.canonical.CanonicalRecord;
import com.stock.pulse.engine.model.entity.market.FundamentalsQuarterlyEntity;
import com.stock.pulse.engine.model.entity.market.PriceDailyEntity;
import com.stock.pulse.engine.model.entity.market.ShareholdingQuarterlyEntity;
import com.stock.pulse.engine.model.entity.market.TechnicalIndicatorEntity;
import com.stock.pulse.engine.repo.market.FundamentalsQuarterlyRepository;
import com.stock.pulse.engine.repo.market.PriceDailyRepository;
import com.stock.pulse.engine.repo.market.ShareholdingQuarterlyRepository;
import com.stock.pulse.engine.repo.market.TechnicalIndicatorRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static com.stock.pulse.engine.model.canonical.CanonicalField.*;

/**
 * Time-series tier: one row per natural key in each of the four market tables.
 * <p>
 * Upserts are find-then-save. Two writers racing on the same key surface as a unique-key
 * violation on the loser, which then re-reads the winner's row and updates it.
 */
@Slf4j
@Service
public class TimeSeriesStore {

    public static final String DEFAULT_PERIOD_TYPE = "QUARTERLY";

    /**
     * Screener metric name to SQL column. Nothing outside this map reaches the query text.
     */
    static final Map<String, String> SCREENER_COLUMNS = screenerColumns();

    private static final List<String> OPERATORS = List.of("gt", "gte", "lt", "lte", "eq", "between");

    private final PriceDailyRepository prices;
    private final TechnicalIndicatorRepository technicals;
    private final FundamentalsQuarterlyRepository fundamentals;
    private final ShareholdingQuarterlyRepository shareholding;
    private final NamedParameterJdbcTemplate jdbc;
    private final TechnicalIndicatorCalculator calculator;
    private final PipelineProperties props;
    private final Clock clock;
    private final ZoneId zone;

    public TimeSeriesStore(PriceDailyRepository prices,
                           TechnicalIndicatorRepository technicals,
                           FundamentalsQuarterlyRepository fundamentals,
                           ShareholdingQuarterlyRepository shareholding,
                           NamedParameterJdbcTemplate jdbc,
                           TechnicalIndicatorCalculator calculator,
                           PipelineProperties props,
                           Clock clock) {
        this.prices = prices;
        this.technicals = technicals;
        this.fundamentals = fundamentals;
        this.shareholding = shareholding;
        this.jdbc = jdbc;
        this.calculator = calculator;
        this.props = props;
        this.clock = clock;
        this.zone = ZoneId.of(props.getZone());
    }

    // ---------------------------------------------------------------------
    // Writes
    // ---------------------------------------------------------------------

    /**
     * Upserts every table the record has data for. When the record carries a price but no
     * technical indicators, they are computed from stored history and added to the record.
     * All tables are written in one transaction. A natural-key race surfaces as
     * {@link DataIntegrityViolationException} after the rollback.
     */
    @Transactional
    public UpsertSummary upsert(CanonicalRecord record) {
        String symbol = record.getSymbol();
        LocalDate tradeDate = tradeDate(record);
        Instant now = clock.instant();

        boolean pricesWritten = upsertPrice(symbol, tradeDate, record, now);

        boolean computed = false;
        if (pricesWritten && !ColumnBinding.anyPresent(TimeSeriesColumns.TECHNICAL, record)) {
            computed = enrichTechnicals(symbol, tradeDate, record);
        }
        boolean tech = upsertTechnical(symbol, tradeDate, record, computed, now);
        boolean fund = upsertFundamentals(symbol, tradeDate, record, now);
        boolean share = upsertShareholding(symbol, tradeDate, record, now);

        UpsertSummary summary = new UpsertSummary(pricesWritten, tech, fund, share, computed);
        log.debug("{} {} upserted into {}", symbol, tradeDate, summary.tables());
        return summary;
    }

    private boolean upsertPrice(String symbol, LocalDate tradeDate, CanonicalRecord record, Instant now) {
        Optional<Double> close = record.number(CLOSE_PRICE).or(() -> record.number(LAST_PRICE));
        if (close.isEmpty()) return false;

        upsertRow(prices,
                () -> prices.findBySymbolAndTradeDate(symbol, tradeDate),
                () -> PriceDailyEntity.builder().symbol(symbol).tradeDate(tradeDate).build(),
                e -> {
                    ColumnBinding.apply(TimeSeriesColumns.PRICE, e, record);
                    e.setClosePrice(BigDecimal.valueOf(close.get()).setScale(4, RoundingMode.HALF_UP));
                    record.text(ISIN).ifPresent(e::setIsin);
                    record.text(SERIES).ifPresent(e::setSeriesCode);
                    e.setUpdatedAt(now);
                });
        return true;
    }

    private boolean upsertTechnical(String symbol, LocalDate tradeDate, CanonicalRecord record,
                                    boolean computed, Instant now) {
        if (!ColumnBinding.anyPresent(TimeSeriesColumns.TECHNICAL, record)) return false;
        upsertRow(technicals,
                () -> technicals.findBySymbolAndTradeDate(symbol, tradeDate),
                () -> TechnicalIndicatorEntity.builder().symbol(symbol).tradeDate(tradeDate).build(),
                e -> {
                    ColumnBinding.apply(TimeSeriesColumns.TECHNICAL, e, record);
                    e.setComputed(computed);
                    e.setUpdatedAt(now);
                });
        return true;
    }

    private boolean upsertFundamentals(String symbol, LocalDate tradeDate, CanonicalRecord record, Instant now) {
        if (!ColumnBinding.anyPresent(TimeSeriesColumns.FUNDAMENTALS, record)) return false;
        LocalDate periodEnd = record.value(PERIOD_END)
                .filter(LocalDate.class::isInstance).map(LocalDate.class::cast)
                .orElseGet(() -> quarterEnd(tradeDate));
        String periodType = record.text(PERIOD_TYPE)
                .map(s -> s.trim().toUpperCase(Locale.ROOT))
                .filter(s -> !s.isEmpty())
                .orElse(DEFAULT_PERIOD_TYPE);

        upsertRow(fundamentals,
                () -> fundamentals.findBySymbolAndPeriodEndAndPeriodType(symbol, periodEnd, periodType),
                () -> FundamentalsQuarterlyEntity.builder().symbol(symbol).periodEnd(periodEnd).periodType(periodType).build(),
                e -> {
                    ColumnBinding.apply(TimeSeriesColumns.FUNDAMENTALS, e, record);
                    e.setUpdatedAt(now);
                });
        return true;
    }

    private boolean upsertShareholding(String symbol, LocalDate tradeDate, CanonicalRecord record, Instant now) {
        if (!ColumnBinding.anyPresent(TimeSeriesColumns.SHAREHOLDING, record)) return false;
        LocalDate quarterEnd = record.value(QUARTER_END)
                .filter(LocalDate.class::isInstance).map(LocalDate.class::cast)
                .orElseGet(() -> quarterEnd(tradeDate));

        upsertRow(shareholding,
                () -> shareholding.findBySymbolAndQuarterEnd(symbol, quarterEnd),
                () -> ShareholdingQuarterlyEntity.builder().symbol(symbol).quarterEnd(quarterEnd).build(),
                e -> {
                    ColumnBinding.apply(TimeSeriesColumns.SHAREHOLDING, e, record);
                    e.setUpdatedAt(now);
                });
        return true;
    }

    private static <E> E upsertRow(JpaRepository<E, Long> repo, Supplier<Optional<E>> find,
                                   Supplier<E> create, Consumer<E> apply) {
        E row = find.get().orElseGet(create);
        apply.accept(row);
        return repo.saveAndFlush(row);
    }

    private boolean enrichTechnicals(String symbol, LocalDate tradeDate, CanonicalRecord record) {
        List<PriceDailyEntity> history = prices.findBySymbolAndTradeDateGreaterThanEqualOrderByTradeDateAsc(
                symbol, tradeDate.minusDays(props.getTechnicalLookbackDays()));
        Map<CanonicalField, Double> computed = calculator.compute(symbol, history);
        if (computed.isEmpty()) return false;
        Instant at = record.getAsOf();
        computed.forEach((f, v) -> {
            if (!record.isAvailable(f)) record.put(f, v, at);
        });
        return true;
    }

    // ---------------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------------

    public Optional<PriceDailyEntity> latestPrice(String symbol) {
        return prices.findTopBySymbolOrderByTradeDateDesc(symbol);
    }

    /**
     * Daily rows oldest first, going back {@code days} calendar days from today.
     */
    public List<PriceDailyEntity> priceHistory(String symbol, int days) {
        LocalDate from = LocalDate.now(clock.withZone(zone)).minusDays(Math.max(0, days));
        return prices.findBySymbolAndTradeDateGreaterThanEqualOrderByTradeDateAsc(symbol, from);
    }

    /**
     * Latest row of every table assembled into one record, each value stamped with its row's update time.
     */
    public Optional<CanonicalRecord> latestRecord(String symbol) {
        Optional<PriceDailyEntity> p = prices.findTopBySymbolOrderByTradeDateDesc(symbol);
        Optional<TechnicalIndicatorEntity> t = technicals.findTopBySymbolOrderByTradeDateDesc(symbol);
        Optional<FundamentalsQuarterlyEntity> f = fundamentals.findTopBySymbolOrderByPeriodEndDesc(symbol);
        Optional<ShareholdingQuarterlyEntity> s = shareholding.findTopBySymbolOrderByQuarterEndDesc(symbol);
        if (p.isEmpty() && t.isEmpty() && f.isEmpty() && s.isEmpty()) return Optional.empty();

        CanonicalRecord r = new CanonicalRecord(symbol, Instant.EPOCH);
        p.ifPresent(e -> {
            ColumnBinding.read(TimeSeriesColumns.PRICE, e, r, e.getUpdatedAt());
            r.put(CLOSE_PRICE, e.getClosePrice().doubleValue(), e.getUpdatedAt());
            if (!r.isAvailable(LAST_PRICE)) r.put(LAST_PRICE, e.getClosePrice().doubleValue(), e.getUpdatedAt());
            if (e.getIsin() != null) r.put(ISIN, e.getIsin(), e.getUpdatedAt());
            if (e.getSeriesCode() != null) r.put(SERIES, e.getSeriesCode(), e.getUpdatedAt());
        });
        t.ifPresent(e -> ColumnBinding.read(TimeSeriesColumns.TECHNICAL, e, r, e.getUpdatedAt()));
        f.ifPresent(e -> {
            ColumnBinding.read(TimeSeriesColumns.FUNDAMENTALS, e, r, e.getUpdatedAt());
            r.put(PERIOD_END, e.getPeriodEnd(), e.getUpdatedAt());
            r.put(PERIOD_TYPE, e.getPeriodType(), e.getUpdatedAt());
        });
        s.ifPresent(e -> {
            ColumnBinding.read(TimeSeriesColumns.SHAREHOLDING, e, r, e.getUpdatedAt());
            r.put(QUARTER_END, e.getQuarterEnd(), e.getUpdatedAt());
        });
        r.put(SYMBOL, symbol, r.getAsOf());
        return Optional.of(r);
    }

    /**
     * Row count per table.
     */
    public Map<String, Long> stats() {
        Map<String, Long> out = new LinkedHashMap<>();
        out.put("prices_daily", prices.count());
        out.put("technical_indicators", technicals.count());
        out.put("fundamentals_quarterly", fundamentals.count());
        out.put("shareholding_quarterly", shareholding.count());
        return out;
    }

    // ---------------------------------------------------------------------
    // Screener
    // ---------------------------------------------------------------------

    /**
     * Latest price joined with the latest technical, fundamental and shareholding rows per symbol,
     * filtered, sorted (nulls last) and limited.
     *
     * @throws ValidationException for unknown metrics, operators or sort keys
     */
    public List<Map<String, Object>> screen(ScreenerQuery query) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        StringBuilder sql = new StringBuilder("SELECT p.symbol AS symbol, p.trade_date AS trade_date");
        SCREENER_COLUMNS.forEach((metric, col) -> sql.append(", ").append(col).append(" AS ").append(metric));
        sql.append(" FROM prices_daily p")
                .append(" LEFT JOIN technical_indicators t ON t.id = ")
                .append(latestId("technical_indicators", "trade_date"))
                .append(" LEFT JOIN fundamentals_quarterly f ON f.id = ")
                .append(latestId("fundamentals_quarterly", "period_end"))
                .append(" LEFT JOIN shareholding_quarterly s ON s.id = ")
                .append(latestId("shareholding_quarterly", "quarter_end"))
                .append(" WHERE p.id = ")
                .append(latestId("prices_daily", "trade_date"));

        List<ScreenerFilter> filters = query.getFilters() == null ? List.of() : query.getFilters();
        for (int i = 0; i < filters.size(); i++) {
            sql.append(" AND ").append(condition(filters.get(i), i, params));
        }
        if (query.getSymbols() != null && !query.getSymbols().isEmpty()) {
            sql.append(" AND p.symbol IN (:symbols)");
            params.addValue("symbols", query.getSymbols().stream()
                    .map(s -> s.trim().toUpperCase(Locale.ROOT)).collect(Collectors.toList()));
        }

        String sortBy = query.getSortBy() == null ? "symbol" : query.getSortBy().trim().toLowerCase(Locale.ROOT);
        String direction = "desc".equalsIgnoreCase(query.getSortOrder()) ? "DESC" : "ASC";
        String sortCol = "symbol".equals(sortBy) ? "p.symbol" : column(sortBy);
        sql.append(" ORDER BY ").append(sortCol).append(' ').append(direction).append(" NULLS LAST, p.symbol ASC");

        int limit = query.getLimit() == null ? PipelineConsts.Screener.DEFAULT_LIMIT : query.getLimit();
        if (limit < 1 || limit > PipelineConsts.Screener.MAX_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + PipelineConsts.Screener.MAX_LIMIT);
        }
        sql.append(" FETCH FIRST ").append(limit).append(" ROWS ONLY");

        List<Map<String, Object>> rows = jdbc.queryForList(sql.toString(), params);
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> clean = new LinkedHashMap<>();
            row.forEach((k, v) -> clean.put(k.toLowerCase(Locale.ROOT), jsonFriendly(v)));
            out.add(clean);
        }
        return out;
    }

    private static String latestId(String table, String orderColumn) {
        return "(SELECT x.id FROM " + table + " x WHERE x.symbol = p.symbol"
                + " ORDER BY x." + orderColumn + " DESC, x.id DESC FETCH FIRST 1 ROWS ONLY)";
    }

    private static String condition(ScreenerFilter f, int i, MapSqlParameterSource params) {
        if (f == null || f.getMetric() == null || f.getOperator() == null || f.getValue() == null) {
            throw new ValidationException("Screener filter needs metric, operator and value");
        }
        String col = column(f.getMetric().trim().toLowerCase(Locale.ROOT));
        String op = f.getOperator().trim().toLowerCase(Locale.ROOT);
        String v = "v" + i;
        params.addValue(v, f.getValue());
        switch (op) {
            case "gt":
                return col + " > :" + v;
            case "gte":
                return col + " >= :" + v;
            case "lt":
                return col + " < :" + v;
            case "lte":
                return col + " <= :" + v;
            case "eq":
                return col + " = :" + v;
            case "between":
                if (f.getValue2() == null) throw new ValidationException("between needs value2 for " + f.getMetric());
                String w = "w" + i;
                params.addValue(w, f.getValue2());
                return col + " BETWEEN :" + v + " AND :" + w;
            default:
                throw new ValidationException("Unknown operator '" + f.getOperator() + "', expected one of " + OPERATORS);
        }
    }

    private static String column(String metric) {
        String col = SCREENER_COLUMNS.get(metric);
        if (col == null) {
            throw new ValidationException("Unknown screener metric '" + metric + "', expected one of " + SCREENER_COLUMNS.keySet());
        }
        return col;
    }

    private static Object jsonFriendly(Object v) {
        if (v instanceof Date d) return d.toLocalDate();
        if (v instanceof Timestamp ts) return ts.toInstant();
        return v;
    }

    private static Map<String, String> screenerColumns() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("close", "p.close_price");
        m.put("prev_close", "p.prev_close");
        m.put("volume", "p.volume");
        m.put("turnover", "p.turnover");
        m.put("delivery_pct", "p.delivery_pct");
        m.put("week_52_high", "p.week_52_high");
        m.put("week_52_low", "p.week_52_low");
        m.put("sma_20", "t.sma_20");
        m.put("sma_50", "t.sma_50");
        m.put("sma_200", "t.sma_200");
        m.put("ema_12", "t.ema_12");
        m.put("ema_26", "t.ema_26");
        m.put("rsi_14", "t.rsi_14");
        m.put("macd", "t.macd");
        m.put("macd_signal", "t.macd_signal");
        m.put("atr_14", "t.atr_14");
        m.put("adx_14", "t.adx_14");
        m.put("volatility_30d", "t.volatility_30d");
        m.put("revenue", "f.revenue");
        m.put("net_profit", "f.net_profit");
        m.put("eps", "f.eps");
        m.put("roe", "f.roe");
        m.put("roce", "f.roce");
        m.put("debt_to_equity", "f.debt_to_equity");
        m.put("operating_margin", "f.operating_margin");
        m.put("net_profit_margin", "f.net_profit_margin");
        m.put("current_ratio", "f.current_ratio");
        m.put("interest_coverage", "f.interest_coverage");
        m.put("free_cash_flow", "f.free_cash_flow");
        m.put("promoter_holding", "s.promoter_holding");
        m.put("promoter_pledging", "s.promoter_pledging");
        m.put("fii_holding", "s.fii_holding");
        m.put("dii_holding", "s.dii_holding");
        m.put("public_holding", "s.public_holding");
        return Collections.unmodifiableMap(m);
    }

    // ---------------------------------------------------------------------
    // Natural keys
    // ---------------------------------------------------------------------

    LocalDate tradeDate(CanonicalRecord record) {
        Instant at = record.value(AS_OF)
                .filter(Instant.class::isInstance).map(Instant.class::cast)
                .orElse(record.getAsOf());
        return at.atZone(zone).toLocalDate();
    }

    /**
     * Last calendar-quarter end on or before {@code d}.
     */
    public static LocalDate quarterEnd(LocalDate d) {
        int endMonth = ((d.getMonthValue() - 1) / 3) * 3 + 3;
        LocalDate current = LocalDate.of(d.getYear(), endMonth, 1).with(TemporalAdjusters.lastDayOfMonth());
        if (!d.isBefore(current)) return current;
        return current.minusMonths(3).with(TemporalAdjusters.lastDayOfMonth());
    }
}
