package com.stock.pulse.engine.model.canonical;

import com.stock.pulse.engine.enums.FieldCategory;
import com.stock.pulse.engine.enums.ValueType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.stock.pulse.engine.enums.FieldCategory.*;
import static com.stock.pulse.engine.enums.ValueType.*;

/**
 * Canonical field catalogue. Each field has one canonical key plus the aliases
 * downstream consumers (screener, UI, scoring) are allowed to look it up under.
 * Upstream synonyms that are only ever seen on the wire live in {@code FieldSynonyms}.
 */
public enum CanonicalField {

    // ====== Master data ======
    SYMBOL("symbol", MASTER, TEXT, "ticker", "trading_symbol"),
    COMPANY_NAME("company_name", MASTER, TEXT, "name"),
    ISIN("isin", MASTER, TEXT, "isin_code"),
    NSE_CODE("nse_code", MASTER, TEXT, "nse_symbol"),
    BSE_CODE("bse_code", MASTER, TEXT, "bse_scrip_code"),
    EXCHANGE("exchange", MASTER, TEXT),
    SECTOR("sector", MASTER, TEXT),
    INDUSTRY("industry", MASTER, TEXT),
    MARKET_CAP_CATEGORY("market_cap_category", MASTER, TEXT, "cap_category"),
    LISTING_DATE("listing_date", MASTER, DATE),
    FACE_VALUE("face_value", MASTER, NUMBER),
    SERIES("series", MASTER, TEXT),

    // ====== Price / volume ======
    LAST_PRICE("current_price", PRICE_VOLUME, NUMBER, "ltp", "last_price", "price"),
    OPEN_PRICE("open", PRICE_VOLUME, NUMBER, "day_open", "open_price"),
    HIGH_PRICE("high", PRICE_VOLUME, NUMBER, "day_high", "high_price"),
    LOW_PRICE("low", PRICE_VOLUME, NUMBER, "day_low", "low_price"),
    CLOSE_PRICE("close", PRICE_VOLUME, NUMBER, "close_price"),
    PREV_CLOSE("prev_close", PRICE_VOLUME, NUMBER, "previous_close"),
    VOLUME("volume", PRICE_VOLUME, NUMBER, "total_traded_volume"),
    TURNOVER("turnover", PRICE_VOLUME, NUMBER, "total_traded_value"),
    TOTAL_TRADES("total_trades", PRICE_VOLUME, NUMBER, "no_of_trades"),
    DELIVERY_QTY("delivery_qty", PRICE_VOLUME, NUMBER, "delivery_quantity"),
    DELIVERY_PCT("delivery_pct", PRICE_VOLUME, NUMBER, "delivery_percentage"),
    VWAP("vwap", PRICE_VOLUME, NUMBER, "average_price"),
    WEEK_52_HIGH("week_52_high", PRICE_VOLUME, NUMBER, "fifty_two_week_high", "high_52w"),
    WEEK_52_LOW("week_52_low", PRICE_VOLUME, NUMBER, "fifty_two_week_low", "low_52w"),
    UPPER_CIRCUIT("upper_circuit", PRICE_VOLUME, NUMBER, "upper_circuit_limit"),
    LOWER_CIRCUIT("lower_circuit", PRICE_VOLUME, NUMBER, "lower_circuit_limit"),
    BID_PRICE("bid_price", PRICE_VOLUME, NUMBER, "best_bid"),
    ASK_PRICE("ask_price", PRICE_VOLUME, NUMBER, "best_ask"),
    BID_QTY("bid_qty", PRICE_VOLUME, NUMBER, "total_buy_quantity"),
    ASK_QTY("ask_qty", PRICE_VOLUME, NUMBER, "total_sell_quantity"),

    // ====== Derived metrics ======
    PRICE_CHANGE("price_change", DERIVED, NUMBER, "day_change", "change"),
    PRICE_CHANGE_PCT("price_change_pct", DERIVED, NUMBER, "day_change_perc", "change_percent"),
    DAY_RANGE_PCT("day_range_pct", DERIVED, NUMBER),
    PCT_FROM_52W_HIGH("pct_from_52w_high", DERIVED, NUMBER),
    PCT_FROM_52W_LOW("pct_from_52w_low", DERIVED, NUMBER),
    AVG_VOLUME_20D("avg_volume_20d", DERIVED, NUMBER, "average_volume"),
    VOLUME_RATIO("volume_ratio", DERIVED, NUMBER),
    RETURN_1M("return_1m", DERIVED, NUMBER),
    RETURN_3M("return_3m", DERIVED, NUMBER),
    RETURN_6M("return_6m", DERIVED, NUMBER),
    RETURN_1Y("return_1y", DERIVED, NUMBER, "one_year_return"),
    VOLATILITY_30D("volatility_30d", DERIVED, NUMBER, "volatility"),
    BETA("beta", DERIVED, NUMBER),

    // ====== Income statement ======
    REVENUE("revenue", INCOME_STATEMENT, NUMBER, "total_revenue", "sales"),
    REVENUE_GROWTH_YOY("revenue_growth_yoy", INCOME_STATEMENT, NUMBER, "sales_growth"),
    REVENUE_CAGR_3Y("revenue_cagr_3y", INCOME_STATEMENT, NUMBER, "sales_cagr_3y"),
    OPERATING_PROFIT("operating_profit", INCOME_STATEMENT, NUMBER),
    EBITDA("ebitda", INCOME_STATEMENT, NUMBER),
    EBIT("ebit", INCOME_STATEMENT, NUMBER),
    INTEREST_EXPENSE("interest_expense", INCOME_STATEMENT, NUMBER, "finance_cost"),
    DEPRECIATION("depreciation", INCOME_STATEMENT, NUMBER),
    PROFIT_BEFORE_TAX("profit_before_tax", INCOME_STATEMENT, NUMBER, "pbt"),
    TAX_EXPENSE("tax_expense", INCOME_STATEMENT, NUMBER),
    NET_PROFIT("net_profit", INCOME_STATEMENT, NUMBER, "pat", "net_income"),
    PROFIT_GROWTH_YOY("profit_growth_yoy", INCOME_STATEMENT, NUMBER, "net_profit_growth"),
    PROFIT_CAGR_3Y("profit_cagr_3y", INCOME_STATEMENT, NUMBER),
    EPS("eps", INCOME_STATEMENT, NUMBER, "earnings_per_share"),
    EPS_GROWTH_YOY("eps_growth_yoy", INCOME_STATEMENT, NUMBER),
    OTHER_INCOME("other_income", INCOME_STATEMENT, NUMBER),

    // ====== Balance sheet ======
    TOTAL_ASSETS("total_assets", BALANCE_SHEET, NUMBER),
    TOTAL_LIABILITIES("total_liabilities", BALANCE_SHEET, NUMBER),
    TOTAL_EQUITY("total_equity", BALANCE_SHEET, NUMBER, "net_worth"),
    TOTAL_DEBT("total_debt", BALANCE_SHEET, NUMBER, "borrowings"),
    CASH_AND_EQUIV("cash_and_equiv", BALANCE_SHEET, NUMBER, "cash_and_equivalents"),
    CURRENT_ASSETS("current_assets", BALANCE_SHEET, NUMBER),
    CURRENT_LIABILITIES("current_liabilities", BALANCE_SHEET, NUMBER),
    INVENTORY("inventory", BALANCE_SHEET, NUMBER),
    RECEIVABLES("receivables", BALANCE_SHEET, NUMBER, "trade_receivables"),
    FIXED_ASSETS("fixed_assets", BALANCE_SHEET, NUMBER, "net_block"),
    RESERVES("reserves", BALANCE_SHEET, NUMBER, "reserves_and_surplus"),
    SHARE_CAPITAL("share_capital", BALANCE_SHEET, NUMBER, "equity_capital"),
    BOOK_VALUE_PER_SHARE("book_value", BALANCE_SHEET, NUMBER, "book_value_per_share", "bvps"),

    // ====== Cash flow ======
    OPERATING_CASH_FLOW("operating_cash_flow", CASH_FLOW, NUMBER, "cash_from_operations", "cfo"),
    INVESTING_CASH_FLOW("investing_cash_flow", CASH_FLOW, NUMBER, "cfi"),
    FINANCING_CASH_FLOW("financing_cash_flow", CASH_FLOW, NUMBER, "cff"),
    CAPEX("capex", CASH_FLOW, NUMBER, "capital_expenditure"),
    FREE_CASH_FLOW("free_cash_flow", CASH_FLOW, NUMBER, "fcf"),
    NET_CASH_FLOW("net_cash_flow", CASH_FLOW, NUMBER),
    DIVIDENDS_PAID("dividends_paid", CASH_FLOW, NUMBER),
    FCF_YIELD("fcf_yield", CASH_FLOW, NUMBER),

    // ====== Ratios ======
    ROE("roe", RATIOS, NUMBER, "return_on_equity"),
    ROCE("roce", RATIOS, NUMBER, "return_on_capital_employed"),
    ROA("roa", RATIOS, NUMBER, "return_on_assets"),
    DEBT_TO_EQUITY("debt_to_equity", RATIOS, NUMBER, "de_ratio"),
    CURRENT_RATIO("current_ratio", RATIOS, NUMBER),
    QUICK_RATIO("quick_ratio", RATIOS, NUMBER),
    INTEREST_COVERAGE("interest_coverage", RATIOS, NUMBER, "interest_coverage_ratio"),
    OPERATING_MARGIN("operating_margin", RATIOS, NUMBER, "opm"),
    NET_PROFIT_MARGIN("net_profit_margin", RATIOS, NUMBER, "npm"),
    EBITDA_MARGIN("ebitda_margin", RATIOS, NUMBER),
    ASSET_TURNOVER("asset_turnover", RATIOS, NUMBER),
    INVENTORY_TURNOVER("inventory_turnover", RATIOS, NUMBER),
    RECEIVABLE_DAYS("receivable_days", RATIOS, NUMBER, "debtor_days"),
    PAYOUT_RATIO("payout_ratio", RATIOS, NUMBER, "dividend_payout"),

    // ====== Valuation ======
    MARKET_CAP("market_cap", VALUATION, NUMBER, "mcap"),
    PE_RATIO("pe_ratio", VALUATION, NUMBER, "pe"),
    PB_RATIO("pb_ratio", VALUATION, NUMBER, "pb"),
    PS_RATIO("ps_ratio", VALUATION, NUMBER, "price_to_sales"),
    ENTERPRISE_VALUE("enterprise_value", VALUATION, NUMBER, "ev"),
    EV_EBITDA("ev_ebitda", VALUATION, NUMBER, "ev_to_ebitda"),
    PEG_RATIO("peg_ratio", VALUATION, NUMBER, "peg"),
    DIVIDEND_YIELD("dividend_yield", VALUATION, NUMBER, "div_yield"),
    EARNINGS_YIELD("earnings_yield", VALUATION, NUMBER),
    SECTOR_PE("sector_pe", VALUATION, NUMBER, "industry_pe"),
    SECTOR_PB("sector_pb", VALUATION, NUMBER, "industry_pb"),
    GRAHAM_NUMBER("graham_number", VALUATION, NUMBER),

    // ====== Shareholding ======
    PROMOTER_HOLDING("promoter_holding", SHAREHOLDING, NUMBER, "promoters"),
    PROMOTER_PLEDGING("promoter_pledging", SHAREHOLDING, NUMBER, "pledged_percentage"),
    FII_HOLDING("fii_holding", SHAREHOLDING, NUMBER, "fiis"),
    DII_HOLDING("dii_holding", SHAREHOLDING, NUMBER, "diis"),
    MF_HOLDING("mf_holding", SHAREHOLDING, NUMBER, "mutual_funds"),
    INSURANCE_HOLDING("insurance_holding", SHAREHOLDING, NUMBER),
    PUBLIC_HOLDING("public_holding", SHAREHOLDING, NUMBER),
    GOVERNMENT_HOLDING("government_holding", SHAREHOLDING, NUMBER),
    PROMOTER_HOLDING_CHANGE("promoter_holding_change", SHAREHOLDING, NUMBER),
    FII_HOLDING_CHANGE("fii_holding_change", SHAREHOLDING, NUMBER),
    DII_HOLDING_CHANGE("dii_holding_change", SHAREHOLDING, NUMBER),
    NUM_SHAREHOLDERS("num_shareholders", SHAREHOLDING, NUMBER),
    QUARTER_END("quarter_end", SHAREHOLDING, DATE, "shareholding_date"),

    // ====== Corporate actions ======
    LAST_DIVIDEND("last_dividend", CORPORATE_ACTIONS, NUMBER, "dividend_per_share", "dps"),
    EX_DIVIDEND_DATE("ex_dividend_date", CORPORATE_ACTIONS, DATE),
    RECORD_DATE("record_date", CORPORATE_ACTIONS, DATE),
    BONUS_RATIO("bonus_ratio", CORPORATE_ACTIONS, TEXT),
    SPLIT_RATIO("split_ratio", CORPORATE_ACTIONS, TEXT),
    LAST_SPLIT_DATE("last_split_date", CORPORATE_ACTIONS, DATE),
    BUYBACK_ANNOUNCED("buyback_announced", CORPORATE_ACTIONS, BOOLEAN),
    RIGHTS_ISSUE("rights_issue", CORPORATE_ACTIONS, BOOLEAN),
    NEXT_RESULTS_DATE("next_results_date", CORPORATE_ACTIONS, DATE, "upcoming_earnings_date"),

    // ====== News / sentiment ======
    NEWS_SENTIMENT_SCORE("news_sentiment_score", NEWS_SENTIMENT, NUMBER, "sentiment_score"),
    NEWS_COUNT_7D("news_count_7d", NEWS_SENTIMENT, NUMBER),
    POSITIVE_NEWS_COUNT("positive_news_count", NEWS_SENTIMENT, NUMBER),
    NEGATIVE_NEWS_COUNT("negative_news_count", NEWS_SENTIMENT, NUMBER),
    SOCIAL_SENTIMENT("social_sentiment", NEWS_SENTIMENT, NUMBER),
    ANALYST_RATING("analyst_rating", NEWS_SENTIMENT, TEXT),
    ANALYST_TARGET_PRICE("analyst_target_price", NEWS_SENTIMENT, NUMBER, "target_price"),
    ANALYST_COUNT("analyst_count", NEWS_SENTIMENT, NUMBER),

    // ====== Technical indicators ======
    SMA_20("sma_20", TECHNICAL, NUMBER, "dma_20"),
    SMA_50("sma_50", TECHNICAL, NUMBER, "dma_50"),
    SMA_200("sma_200", TECHNICAL, NUMBER, "dma_200"),
    EMA_12("ema_12", TECHNICAL, NUMBER),
    EMA_26("ema_26", TECHNICAL, NUMBER),
    RSI_14("rsi_14", TECHNICAL, NUMBER, "rsi"),
    MACD("macd", TECHNICAL, NUMBER, "macd_line"),
    MACD_SIGNAL("macd_signal", TECHNICAL, NUMBER, "signal_line"),
    MACD_HISTOGRAM("macd_histogram", TECHNICAL, NUMBER, "macd_hist"),
    BOLLINGER_UPPER("bollinger_upper", TECHNICAL, NUMBER, "bb_upper"),
    BOLLINGER_LOWER("bollinger_lower", TECHNICAL, NUMBER, "bb_lower"),
    ATR_14("atr_14", TECHNICAL, NUMBER, "atr"),
    ADX_14("adx_14", TECHNICAL, NUMBER, "adx"),
    OBV("obv", TECHNICAL, NUMBER, "on_balance_volume"),
    STOCH_K("stoch_k", TECHNICAL, NUMBER),
    STOCH_D("stoch_d", TECHNICAL, NUMBER),
    SUPPORT_LEVEL("support_level", TECHNICAL, NUMBER, "support"),
    RESISTANCE_LEVEL("resistance_level", TECHNICAL, NUMBER, "resistance"),
    SUPERTREND("supertrend", TECHNICAL, NUMBER),

    // ====== Qualitative / metadata ======
    AS_OF("as_of", QUALITATIVE, TIMESTAMP, "last_updated"),
    PERIOD_END("period_end", QUALITATIVE, DATE, "result_date"),
    PERIOD_TYPE("period_type", QUALITATIVE, TEXT),
    DATA_SOURCE("data_source", QUALITATIVE, TEXT),
    REGULATORY_ACTION("regulatory_action", QUALITATIVE, BOOLEAN),
    AUDITOR_QUALIFICATION("auditor_qualification", QUALITATIVE, BOOLEAN, "qualified_opinion"),
    CREDIT_RATING("credit_rating", QUALITATIVE, TEXT),
    MANAGEMENT_SCORE("management_score", QUALITATIVE, NUMBER),
    GOVERNANCE_SCORE("governance_score", QUALITATIVE, NUMBER),
    ESG_SCORE("esg_score", QUALITATIVE, NUMBER),
    MOAT_RATING("moat_rating", QUALITATIVE, TEXT, "moat");

    private static final Map<String, CanonicalField> BY_NAME = new HashMap<>();

    static {
        for (CanonicalField f : values()) {
            for (String n : f.allNames()) {
                CanonicalField previous = BY_NAME.put(n, f);
                if (previous != null) {
                    throw new IllegalStateException("Name " + n + " used by " + previous + " and " + f);
                }
            }
        }
    }

    private final String key;
    private final FieldCategory category;
    private final ValueType type;
    private final List<String> aliases;

    CanonicalField(String key, FieldCategory category, ValueType type, String... aliases) {
        this.key = key;
        this.category = category;
        this.type = type;
        this.aliases = List.of(aliases);
    }

    public String key() {
        return key;
    }

    public FieldCategory category() {
        return category;
    }

    public ValueType type() {
        return type;
    }

    /**
     * Canonical key first, then every consumer-facing alias.
     */
    public Set<String> allNames() {
        Set<String> names = new LinkedHashSet<>();
        names.add(key);
        names.addAll(aliases);
        return Collections.unmodifiableSet(names);
    }

    public boolean isNumeric() {
        return type == NUMBER;
    }

    /**
     * Resolves a canonical key or alias, case-insensitively.
     */
    public static Optional<CanonicalField> fromName(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(BY_NAME.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    public static Set<CanonicalField> inCategory(FieldCategory category) {
        EnumSet<CanonicalField> out = EnumSet.noneOf(CanonicalField.class);
        for (CanonicalField f : values()) {
            if (f.category == category) out.add(f);
        }
        return out;
    }
}
