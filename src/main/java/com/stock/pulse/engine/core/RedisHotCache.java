package com.stock.pulse.engine.core;

import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Redis implementation using StringRedisTemplate.
 * Keys are prefixed with the provided prefix.
 */
public final class RedisHotCache implements HotCache {

    private final StringRedisTemplate redis;
    private final String prefix;

    public RedisHotCache(StringRedisTemplate redis, String prefix) {
        if (redis == null) {
            throw new IllegalArgumentException("redis must not be null");
        }
        this.redis = redis;
        this.prefix = prefix == null ? "" : prefix;
    }

    private String k(String key) {
        return prefix + key;
    }

    private static boolean expires(Duration ttl) {
        return ttl != null && !ttl.isZero() && !ttl.isNegative();
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        final String k = k(key);
        if (expires(ttl)) {
            redis.opsForValue().set(k, value, ttl.toMillis(), TimeUnit.MILLISECONDS);
        } else {
            redis.opsForValue().set(k, value);
        }
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(k(key)));
    }

    @Override
    public void delete(String key) {
        redis.delete(k(key));
    }

    @Override
    public void putHash(String key, Map<String, String> fields, Duration ttl) {
        final String k = k(key);
        if (fields.isEmpty()) {
            redis.delete(k);
            return;
        }
        // staged so fields from an earlier, wider hash never survive
        final String staging = k + ":staging";
        redis.delete(staging);
        redis.opsForHash().putAll(staging, fields);
        redis.rename(staging, k);
        if (expires(ttl)) redis.expire(k, ttl.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public Map<String, String> getHash(String key) {
        Map<Object, Object> raw = redis.opsForHash().entries(k(key));
        Map<String, String> out = new HashMap<>();
        raw.forEach((f, v) -> out.put(String.valueOf(f), String.valueOf(v)));
        return out;
    }

    @Override
    public long publish(String channel, String message) {
        Long receivers = redis.execute((RedisCallback<Long>) c -> c.publish(
                channel.getBytes(StandardCharsets.UTF_8),
                message.getBytes(StandardCharsets.UTF_8)));
        return receivers == null ? 0L : receivers;
    }

    @Override
    public void replaceRanking(String key, Map<String, Double> scores, Duration ttl) {
        final String k = k(key);
        final String staging = k + ":staging";
        redis.delete(staging);
        if (scores.isEmpty()) {
            redis.delete(k);
            return;
        }
        Set<ZSetOperations.TypedTuple<String>> tuples = new HashSet<>();
        scores.forEach((member, score) -> tuples.add(ZSetOperations.TypedTuple.of(member, score)));
        redis.opsForZSet().add(staging, tuples);
        redis.rename(staging, k);
        if (expires(ttl)) redis.expire(k, ttl.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public List<Ranked> topRanked(String key, int count, boolean highestFirst) {
        if (count <= 0) return List.of();
        Set<ZSetOperations.TypedTuple<String>> raw = highestFirst
                ? redis.opsForZSet().reverseRangeWithScores(k(key), 0, count - 1L)
                : redis.opsForZSet().rangeWithScores(k(key), 0, count - 1L);
        List<Ranked> out = new ArrayList<>();
        if (raw == null) return out;
        for (ZSetOperations.TypedTuple<String> t : raw) {
            if (t.getValue() == null || t.getScore() == null) continue;
            out.add(new Ranked(t.getValue(), t.getScore()));
        }
        return out;
    }

    @Override
    public boolean ping() {
        String pong = redis.execute((RedisCallback<String>) RedisConnection::ping, true);
        return "PONG".equalsIgnoreCase(pong);
    }

    @Override
    public Map<String, Object> stats() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("backend", "redis");
        out.put("keys", redis.execute((RedisCallback<Long>) c -> c.serverCommands().dbSize()));
        return out;
    }

    @Override
    public boolean isFallback() {
        return false;
    }
}
