package com.stock.pulse.engine.service.extraction;

import com.stock.pulse.engine.model.canonical.CanonicalField;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import static com.stock.pulse.engine.model.canonical.CanonicalField.*;

/**
 * Upstream key vocabulary. Every canonical key and alias is accepted, plus the
 * wire-only spellings seen from the quote API and exchange feeds.
 * Keys are compared after {@link #normalizeKey(String)}.
 */
public final class FieldSynonyms {

    private static final Pattern LOWER_UPPER = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern ACRONYM_WORD = Pattern.compile("([A-Z]+)([A-Z][a-z])");
    private static final Pattern NON_KEY = Pattern.compile("[^a-z0-9.]+");

    private static final Map<String, CanonicalField> TABLE;

    static {
        Map<String, CanonicalField> m = new HashMap<>();
        for (CanonicalField f : CanonicalField.values()) {
            f.allNames().forEach(n -> m.put(n, f));
        }
        wire(m, LAST_PRICE, "last_traded_price", "ltp_price", "last_trade_price");
        wire(m, OPEN_PRICE, "ohlc.open");
        wire(m, HIGH_PRICE, "ohlc.high", "intra_day_high");
        wire(m, LOW_PRICE, "ohlc.low", "intra_day_low");
        wire(m, CLOSE_PRICE, "ohlc.close");
        wire(m, PREV_CLOSE, "prev_close_price", "previous_close_price");
        wire(m, VOLUME, "traded_volume", "vol", "volume_traded");
        wire(m, TURNOVER, "traded_value", "value_traded", "total_turnover");
        wire(m, TOTAL_TRADES, "num_trades", "number_of_trades");
        wire(m, DELIVERY_QTY, "deliverable_qty", "deliverable_quantity");
        wire(m, DELIVERY_PCT, "deliverable_pct", "delivery_to_traded_quantity");
        wire(m, VWAP, "avg_price", "avg_trade_price", "average_trade_price");
        wire(m, WEEK_52_HIGH, "52_week_high", "week52_high", "year_high", "week_52_high_price");
        wire(m, WEEK_52_LOW, "52_week_low", "week52_low", "year_low", "week_52_low_price");
        wire(m, BID_PRICE, "best_bid_price");
        wire(m, ASK_PRICE, "best_ask_price", "offer_price");
        wire(m, PRICE_CHANGE, "net_change", "day_change_abs");
        wire(m, PRICE_CHANGE_PCT, "p_change", "percent_change", "change_pct", "day_change_percent");
        wire(m, COMPANY_NAME, "company", "company_short_name");
        wire(m, AS_OF, "last_trade_time", "timestamp", "last_update_time");
        wire(m, MARKET_CAP, "market_capitalization", "marketcap");
        wire(m, PE_RATIO, "price_to_earnings", "ttm_pe", "p_e");
        wire(m, PB_RATIO, "price_to_book", "p_b");
        wire(m, DIVIDEND_YIELD, "yield");
        wire(m, REVENUE, "net_sales");
        wire(m, NET_PROFIT, "profit_after_tax");
        wire(m, EPS, "eps_ttm");
        wire(m, DEBT_TO_EQUITY, "debt_equity");
        wire(m, INTEREST_COVERAGE, "icr");
        wire(m, NET_PROFIT_MARGIN, "net_margin");
        wire(m, OPERATING_MARGIN, "operating_profit_margin");
        wire(m, FII_HOLDING, "fpi_holding");
        wire(m, PUBLIC_HOLDING, "public");
        wire(m, PROMOTER_PLEDGING, "pledged_pct", "promoter_pledge");
        TABLE = Collections.unmodifiableMap(m);
    }

    private FieldSynonyms() {
    }

    private static void wire(Map<String, CanonicalField> m, CanonicalField field, String... names) {
        for (String n : names) {
            CanonicalField previous = m.putIfAbsent(n, field);
            if (previous != null && previous != field) {
                throw new IllegalStateException("Synonym " + n + " already maps to " + previous);
            }
        }
    }

    /**
     * camelCase to snake_case, lower-cased, punctuation collapsed to underscores. Dots are kept
     * so nested paths stay addressable.
     */
    public static String normalizeKey(String raw) {
        if (raw == null) return "";
        String s = raw.trim();
        s = LOWER_UPPER.matcher(s).replaceAll("$1_$2");
        s = ACRONYM_WORD.matcher(s).replaceAll("$1_$2");
        s = NON_KEY.matcher(s.toLowerCase(Locale.ROOT)).replaceAll("_");
        s = s.replaceAll("_+", "_");
        s = s.replaceAll("(^_)|(_$)", "");
        return s.replace("_.", ".").replace("._", ".");
    }

    public static Optional<CanonicalField> resolve(String normalizedKey) {
        return Optional.ofNullable(TABLE.get(normalizedKey));
    }

    public static Optional<CanonicalField> resolveRaw(String rawKey) {
        return resolve(normalizeKey(rawKey));
    }
}
