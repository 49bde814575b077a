package com.stock.pulse.engine.service.persistence;

import com.stock.pulse.engine.common.constants.PipelineProperties;
import com.stock.pulse.engine.model.canonical.CanonicalField;
import com.stock.pulse.engine.model.entity.market.PriceDailyEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.Indicator;
import org.ta4j.core.indicators.ATRIndicator;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.MACDIndicator;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.adx.ADXIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsLowerIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsMiddleIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsUpperIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.helpers.HighPriceIndicator;
import org.ta4j.core.indicators.helpers.HighestValueIndicator;
import org.ta4j.core.indicators.helpers.LowPriceIndicator;
import org.ta4j.core.indicators.helpers.LowestValueIndicator;
import org.ta4j.core.indicators.helpers.VolumeIndicator;
import org.ta4j.core.indicators.statistics.StandardDeviationIndicator;
import org.ta4j.core.indicators.volume.OnBalanceVolumeIndicator;
import org.ta4j.core.num.Num;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.stock.pulse.engine.model.canonical.CanonicalField.*;

/**
 * Daily technical indicators computed with ta4j from stored price rows.
 * Longer windows are only reported when enough bars exist.
 */
@Slf4j
@Component
public class TechnicalIndicatorCalculator {

    public static final int MIN_BARS = 20;
    private static final int TRADING_DAYS = 252;

    private final ZoneId zone;

    public TechnicalIndicatorCalculator(PipelineProperties props) {
        this.zone = ZoneId.of(props.getZone());
    }

    /**
     * Builds a daily series, oldest first. Rows without a close are skipped.
     */
    public BarSeries buildSeries(String name, List<PriceDailyEntity> rows) {
        BarSeries series = new BaseBarSeriesBuilder().withName(name == null ? "series" : name).build();
        for (PriceDailyEntity r : rows) {
            if (r == null || r.getTradeDate() == null || r.getClosePrice() == null) continue;
            ZonedDateTime end = r.getTradeDate().plusDays(1).atStartOfDay(zone);
            BigDecimal close = r.getClosePrice();
            series.addBar(Duration.ofDays(1), end,
                    orElse(r.getOpenPrice(), close),
                    orElse(r.getHighPrice(), close),
                    orElse(r.getLowPrice(), close),
                    close,
                    r.getVolume() == null ? 0L : r.getVolume());
        }
        return series;
    }

    public Map<CanonicalField, Double> compute(String symbol, List<PriceDailyEntity> rows) {
        Map<CanonicalField, Double> out = new EnumMap<>(CanonicalField.class);
        BarSeries s = buildSeries(symbol, rows);
        int n = s.getBarCount();
        if (n < MIN_BARS) {
            log.debug("{}: {} bars, need {} for indicators", symbol, n, MIN_BARS);
            return out;
        }
        int last = s.getEndIndex();
        ClosePriceIndicator close = new ClosePriceIndicator(s);

        SMAIndicator sma20 = new SMAIndicator(close, 20);
        put(out, SMA_20, sma20, last);
        if (n >= 50) put(out, SMA_50, new SMAIndicator(close, 50), last);
        if (n >= 200) put(out, SMA_200, new SMAIndicator(close, 200), last);
        put(out, EMA_12, new EMAIndicator(close, 12), last);
        if (n >= 26) put(out, EMA_26, new EMAIndicator(close, 26), last);
        put(out, RSI_14, new RSIIndicator(close, 14), last);

        if (n >= 26) {
            MACDIndicator macd = new MACDIndicator(close, 12, 26);
            put(out, MACD, macd, last);
            if (n >= 35) {
                EMAIndicator signal = new EMAIndicator(macd, 9);
                put(out, MACD_SIGNAL, signal, last);
                double hist = macd.getValue(last).doubleValue() - signal.getValue(last).doubleValue();
                if (Double.isFinite(hist)) out.put(MACD_HISTOGRAM, hist);
            }
        }

        BollingerBandsMiddleIndicator middle = new BollingerBandsMiddleIndicator(sma20);
        StandardDeviationIndicator sd = new StandardDeviationIndicator(close, 20);
        put(out, BOLLINGER_UPPER, new BollingerBandsUpperIndicator(middle, sd), last);
        put(out, BOLLINGER_LOWER, new BollingerBandsLowerIndicator(middle, sd), last);

        put(out, ATR_14, new ATRIndicator(s, 14), last);
        if (n >= 28) put(out, ADX_14, new ADXIndicator(s, 14), last);
        put(out, OBV, new OnBalanceVolumeIndicator(s), last);
        put(out, SUPPORT_LEVEL, new LowestValueIndicator(new LowPriceIndicator(s), 20), last);
        put(out, RESISTANCE_LEVEL, new HighestValueIndicator(new HighPriceIndicator(s), 20), last);
        put(out, AVG_VOLUME_20D, new SMAIndicator(new VolumeIndicator(s), 20), last);

        if (n > 30) {
            Double vol = annualizedVolatility(s, 30);
            if (vol != null) out.put(VOLATILITY_30D, vol);
        }
        return out;
    }

    /**
     * Annualized stdev of daily log returns over the last {@code window} returns, in percent.
     */
    static Double annualizedVolatility(BarSeries s, int window) {
        int end = s.getEndIndex();
        int start = end - window;
        if (start < s.getBeginIndex()) return null;
        double[] r = new double[window];
        for (int i = 0; i < window; i++) {
            double prev = s.getBar(start + i).getClosePrice().doubleValue();
            double cur = s.getBar(start + i + 1).getClosePrice().doubleValue();
            if (prev <= 0 || cur <= 0) return null;
            r[i] = Math.log(cur / prev);
        }
        double mean = 0;
        for (double v : r) mean += v;
        mean /= window;
        double var = 0;
        for (double v : r) var += (v - mean) * (v - mean);
        var /= (window - 1);
        return Math.sqrt(var) * Math.sqrt(TRADING_DAYS) * 100.0;
    }

    private static void put(Map<CanonicalField, Double> out, CanonicalField f, Indicator<Num> ind, int index) {
        double v = ind.getValue(index).doubleValue();
        if (Double.isFinite(v)) out.put(f, v);
    }

    private static BigDecimal orElse(BigDecimal v, BigDecimal fallback) {
        return v == null ? fallback : v;
    }
}
