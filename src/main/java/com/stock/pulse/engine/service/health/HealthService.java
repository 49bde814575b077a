package com.stock.pulse.engine.service.health;

import com.stock.pulse.engine.service.persistence.CacheService;
import com.stock.pulse.engine.service.persistence.TimeSeriesStore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeSet;

/**
 * Composite health of the three storage tiers.
 * Healthy only when the relational and document stores answer and the cache is a live Redis.
 */
@Slf4j
@Service
public class HealthService {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";

    private final TimeSeriesStore store;
    private final MongoTemplate mongo;
    private final CacheService cache;
    private final Clock clock;

    public HealthService(TimeSeriesStore store, MongoTemplate mongo, CacheService cache, Clock clock) {
        this.store = store;
        this.mongo = mongo;
        this.cache = cache;
        this.clock = clock;
    }

    public HealthReport check() {
        TierHealth postgres = postgres();
        TierHealth mongodb = mongodb();
        TierHealth redis = redis();
        boolean healthy = postgres.isConnected() && mongodb.isConnected() && redis.isConnected() && !redis.isFallback();
        if (!healthy) log.warn("Storage degraded: postgres={}, mongodb={}, redis={} (fallback={})",
                postgres.isConnected(), mongodb.isConnected(), redis.isConnected(), redis.isFallback());
        return HealthReport.builder()
                .status(healthy ? HEALTHY : DEGRADED)
                .postgres(postgres)
                .mongodb(mongodb)
                .redis(redis)
                .timestamp(clock.instant())
                .build();
    }

    private TierHealth postgres() {
        try {
            Map<String, Object> tables = new LinkedHashMap<>(store.stats());
            return TierHealth.builder().connected(true).details(tables).build();
        } catch (RuntimeException e) {
            log.warn("PostgreSQL health check failed: {}", e.getMessage());
            return TierHealth.builder().connected(false).error(e.getMessage()).build();
        }
    }

    private TierHealth mongodb() {
        try {
            Map<String, Object> collections = new LinkedHashMap<>();
            for (String name : new TreeSet<>(mongo.getCollectionNames())) {
                collections.put(name, mongo.getCollection(name).estimatedDocumentCount());
            }
            return TierHealth.builder().connected(true).details(collections).build();
        } catch (RuntimeException e) {
            log.warn("MongoDB health check failed: {}", e.getMessage());
            return TierHealth.builder().connected(false).error(e.getMessage()).build();
        }
    }

    private TierHealth redis() {
        boolean up = cache.ping();
        return TierHealth.builder()
                .connected(up)
                .fallback(cache.isFallback())
                .details(cache.stats())
                .build();
    }

    @Value
    @Builder
    public static class TierHealth {
        boolean connected;
        boolean fallback;
        String error;
        Map<String, Object> details;
    }

    @Value
    @Builder
    public static class HealthReport {
        String status;
        TierHealth postgres;
        TierHealth mongodb;
        TierHealth redis;
        Instant timestamp;
    }
}
