package com.stock.pulse.engine.core;

import java.time.Duration;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory implementation of HotCache.
 * Intended for local/dev/testing only (single JVM).
 */
public final class InMemoryHotCache implements HotCache {

    private static final class Entry {
        final Object v;
        final long expAtMillis; // 0 = no expiry

        Entry(Object v, long expAtMillis) {
            this.v = v;
            this.expAtMillis = expAtMillis;
        }
    }

    private final ConcurrentMap<String, Entry> map = new ConcurrentHashMap<>();
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final String prefix;

    public InMemoryHotCache(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
    }

    private static long now() {
        return System.currentTimeMillis();
    }

    private static long expiry(Duration ttl) {
        return (ttl == null || ttl.isZero() || ttl.isNegative()) ? 0L : now() + ttl.toMillis();
    }

    private String k(String key) {
        return prefix + key;
    }

    private Object live(String key) {
        String kk = k(key);
        Entry e = map.get(kk);
        if (e == null) {
            misses.incrementAndGet();
            return null;
        }
        if (e.expAtMillis > 0 && now() >= e.expAtMillis) {
            map.remove(kk, e);
            misses.incrementAndGet();
            return null;
        }
        hits.incrementAndGet();
        return e.v;
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        map.put(k(key), new Entry(value, expiry(ttl)));
    }

    @Override
    public Optional<String> get(String key) {
        Object v = live(key);
        return v instanceof String s ? Optional.of(s) : Optional.empty();
    }

    @Override
    public void delete(String key) {
        map.remove(k(key));
    }

    @Override
    public void putHash(String key, Map<String, String> fields, Duration ttl) {
        map.put(k(key), new Entry(Collections.unmodifiableMap(new LinkedHashMap<>(fields)), expiry(ttl)));
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, String> getHash(String key) {
        Object v = live(key);
        return v instanceof Map<?, ?> m ? (Map<String, String>) m : Map.of();
    }

    @Override
    public long publish(String channel, String message) {
        published.incrementAndGet();
        return 0L;
    }

    @Override
    public void replaceRanking(String key, Map<String, Double> scores, Duration ttl) {
        List<Ranked> ranked = scores.entrySet().stream()
                .map(e -> new Ranked(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingDouble(Ranked::score))
                .collect(Collectors.toUnmodifiableList());
        map.put(k(key), new Entry(new Ranking(ranked), expiry(ttl)));
    }

    @Override
    public List<Ranked> topRanked(String key, int count, boolean highestFirst) {
        Object v = live(key);
        if (!(v instanceof Ranking r) || count <= 0) return List.of();
        List<Ranked> asc = r.ascending();
        int n = Math.min(count, asc.size());
        if (!highestFirst) return asc.subList(0, n);
        return asc.subList(asc.size() - n, asc.size()).stream()
                .sorted(Comparator.comparingDouble(Ranked::score).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public boolean ping() {
        return true;
    }

    @Override
    public Map<String, Object> stats() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("backend", "in-memory");
        out.put("keys", map.size());
        out.put("hits", hits.get());
        out.put("misses", misses.get());
        out.put("published_messages", published.get());
        return out;
    }

    @Override
    public boolean isFallback() {
        return true;
    }

    private record Ranking(List<Ranked> ascending) {
    }
}
