package com.stock.pulse.engine.core;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Small abstraction over the hot cache tier: TTL key-values, hashes, sorted rankings and a publish channel.
 * <p>
 * Contracts:
 * <ul>
 *   <li>All methods are thread-safe.</li>
 *   <li>TTL of null or non-positive means "no expiry".</li>
 *   <li>{@link #replaceRanking} swaps the whole ranking; readers never see a half-written one.</li>
 * </ul>
 */
public interface HotCache {

    void put(String key, String value, Duration ttl);

    Optional<String> get(String key);

    void delete(String key);

    void putHash(String key, Map<String, String> fields, Duration ttl);

    Map<String, String> getHash(String key);

    /**
     * @return number of receivers reached, when the backend knows it
     */
    long publish(String channel, String message);

    void replaceRanking(String key, Map<String, Double> scores, Duration ttl);

    List<Ranked> topRanked(String key, int count, boolean highestFirst);

    boolean ping();

    Map<String, Object> stats();

    /**
     * True for the single-JVM fallback used when Redis is disabled.
     */
    boolean isFallback();

    record Ranked(String member, double score) {
    }
}
