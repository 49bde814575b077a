package com.stock.pulse.engine.service.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stock.pulse.engine.common.constants.PipelineConsts;
import com.stock.pulse.engine.core.HotCache;
import com.stock.pulse.engine.enums.FieldCategory;
import com.stock.pulse.engine.model.canonical.CanonicalField;
import com.stock.pulse.engine.model.canonical.CanonicalRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Hot-cache access for quotes, analyses, pipeline status and top movers.
 * <p>
 * Writes propagate backend errors (the fan-out decides what they mean); reads degrade to
 * "not cached" and let callers fall back.
 */
@Slf4j
@Service
public class CacheService {

    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {
    };

    private final HotCache cache;
    private final ObjectMapper mapper;
    private final TimeSeriesStore store;

    public CacheService(HotCache cache, ObjectMapper mapper, TimeSeriesStore store) {
        this.cache = cache;
        this.mapper = mapper;
        this.store = store;
    }

    // ---------------------------------------------------------------------
    // Quotes
    // ---------------------------------------------------------------------

    public void cacheQuote(CanonicalRecord record) {
        String symbol = record.getSymbol();
        Map<String, Object> view = quoteView(record);
        String json = toJson(view);
        cache.put(PipelineConsts.Cache.PRICE_PREFIX + symbol, json, PipelineConsts.Cache.PRICE_TTL);

        Map<String, String> hash = new LinkedHashMap<>();
        view.forEach((k, v) -> hash.put(k, String.valueOf(v)));
        cache.putHash(PipelineConsts.Cache.STOCK_PREFIX + symbol, hash, PipelineConsts.Cache.STOCK_HASH_TTL);

        cache.publish(PipelineConsts.Cache.PRICE_CHANNEL, json);
    }

    /**
     * Cached quote, else the latest stored price. The map's {@code source} tells which.
     */
    public Optional<Map<String, Object>> quote(String symbol) {
        String sym = symbol.trim().toUpperCase(Locale.ROOT);
        Optional<Map<String, Object>> hit = readJson(PipelineConsts.Cache.PRICE_PREFIX + sym);
        if (hit.isPresent()) {
            Map<String, Object> out = new LinkedHashMap<>(hit.get());
            out.put("source", "cache");
            return Optional.of(out);
        }
        return store.latestRecord(sym)
                .filter(r -> r.isAvailable(CanonicalField.CLOSE_PRICE))
                .map(r -> {
                    Map<String, Object> out = quoteView(r);
                    out.put("source", "database");
                    return out;
                });
    }

    static Map<String, Object> quoteView(CanonicalRecord r) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("symbol", r.getSymbol());
        out.put("as_of", r.getAsOf().toString());
        for (CanonicalField f : CanonicalField.values()) {
            if (f.category() != FieldCategory.PRICE_VOLUME && f.category() != FieldCategory.DERIVED) continue;
            r.value(f).ifPresent(v -> out.put(f.key(), v));
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Analyses and status
    // ---------------------------------------------------------------------

    public void cacheAnalysis(String symbol, Object analysis) {
        cache.put(PipelineConsts.Cache.ANALYSIS_PREFIX + symbol, toJson(analysis), PipelineConsts.Cache.ANALYSIS_TTL);
    }

    public <T> Optional<T> cachedAnalysis(String symbol, Class<T> type) {
        try {
            Optional<String> raw = cache.get(PipelineConsts.Cache.ANALYSIS_PREFIX + symbol);
            if (raw.isEmpty()) return Optional.empty();
            return Optional.of(mapper.readValue(raw.get(), type));
        } catch (JsonProcessingException | RuntimeException e) {
            log.debug("Cached analysis for {} unreadable: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }

    public void publishStatus(Object status) {
        cache.put(PipelineConsts.Cache.PIPELINE_STATUS_KEY, toJson(status), PipelineConsts.Cache.PIPELINE_STATUS_TTL);
    }

    public Optional<Map<String, Object>> pipelineStatus() {
        return readJson(PipelineConsts.Cache.PIPELINE_STATUS_KEY);
    }

    // ---------------------------------------------------------------------
    // Top movers
    // ---------------------------------------------------------------------

    /**
     * Replaces both rankings with the given change percentages, keeping the top
     * {@link PipelineConsts.Cache#TOP_MOVERS_KEPT} each way.
     */
    public void updateTopMovers(Map<String, Double> changePct) {
        Map<String, Double> gainers = new LinkedHashMap<>();
        Map<String, Double> losers = new LinkedHashMap<>();
        changePct.entrySet().stream()
                .filter(e -> e.getValue() != null && e.getValue() > 0)
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed())
                .limit(PipelineConsts.Cache.TOP_MOVERS_KEPT)
                .forEach(e -> gainers.put(e.getKey(), e.getValue()));
        changePct.entrySet().stream()
                .filter(e -> e.getValue() != null && e.getValue() < 0)
                .sorted(Map.Entry.comparingByValue())
                .limit(PipelineConsts.Cache.TOP_MOVERS_KEPT)
                .forEach(e -> losers.put(e.getKey(), e.getValue()));
        cache.replaceRanking(PipelineConsts.Cache.TOP_GAINERS_KEY, gainers, PipelineConsts.Cache.RANKING_TTL);
        cache.replaceRanking(PipelineConsts.Cache.TOP_LOSERS_KEY, losers, PipelineConsts.Cache.RANKING_TTL);
    }

    public TopMovers topMovers(int count) {
        try {
            return new TopMovers(
                    movers(cache.topRanked(PipelineConsts.Cache.TOP_GAINERS_KEY, count, true)),
                    movers(cache.topRanked(PipelineConsts.Cache.TOP_LOSERS_KEY, count, false)));
        } catch (RuntimeException e) {
            log.warn("Top movers unavailable: {}", e.getMessage());
            return new TopMovers(List.of(), List.of());
        }
    }

    private static List<Mover> movers(List<HotCache.Ranked> ranked) {
        return ranked.stream().map(r -> new Mover(r.member(), r.score())).toList();
    }

    // ---------------------------------------------------------------------
    // Backend
    // ---------------------------------------------------------------------

    public boolean ping() {
        try {
            return cache.ping();
        } catch (RuntimeException e) {
            log.warn("Cache ping failed: {}", e.getMessage());
            return false;
        }
    }

    public Map<String, Object> stats() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("fallback", cache.isFallback());
        try {
            out.putAll(cache.stats());
        } catch (RuntimeException e) {
            out.put("error", e.getMessage());
        }
        return out;
    }

    public boolean isFallback() {
        return cache.isFallback();
    }

    private Optional<Map<String, Object>> readJson(String key) {
        try {
            Optional<String> raw = cache.get(key);
            if (raw.isEmpty()) return Optional.empty();
            return Optional.of(mapper.readValue(raw.get(), MAP));
        } catch (JsonProcessingException | RuntimeException e) {
            log.debug("Cache read for {} failed: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public record Mover(String symbol, double changePct) {
    }

    public record TopMovers(List<Mover> gainers, List<Mover> losers) {
    }
}
