package com.stock.pulse.engine.common.constants;

import java.time.Duration;

/**
 * Defaults shared by the pipeline, cache and scoring layers.
 * Percentages are "human percent" (e.g., 3.0 == 3%).
 */
public interface PipelineConsts {

    // ====== Hot cache ======
    interface Cache {
        Duration PRICE_TTL = Duration.ofSeconds(60);
        Duration STOCK_HASH_TTL = Duration.ofSeconds(60);
        Duration ANALYSIS_TTL = Duration.ofSeconds(300);
        Duration PIPELINE_STATUS_TTL = Duration.ofSeconds(30);
        Duration RANKING_TTL = Duration.ofSeconds(60);

        String PRICE_PREFIX = "price:";
        String STOCK_PREFIX = "stock:";
        String ANALYSIS_PREFIX = "analysis:";
        String PIPELINE_STATUS_KEY = "pipeline:status";
        String TOP_GAINERS_KEY = "top_gainers";
        String TOP_LOSERS_KEY = "top_losers";
        String PRICE_CHANNEL = "channel:prices";

        int TOP_MOVERS_KEPT = 50;
    }

    // ====== Structured event log ======
    interface Events {
        String JOB_STARTED = "job_started";
        String JOB_COMPLETED = "job_completed";
        String JOB_FAILED = "job_failed";
        String JOB_CANCELLED = "job_cancelled";
        String SYMBOL_FAILED = "symbol_failed";
        String SCHEDULER_STARTED = "scheduler_started";
        String SCHEDULER_STOPPED = "scheduler_stopped";
        String SCHEDULER_RECONFIGURED = "scheduler_reconfigured";
        String SCHEDULER_SKIPPED = "scheduler_skipped";
        String SCHEDULER_ERROR = "scheduler_error";
        String SYMBOLS_ADDED = "symbols_added";
        String SYMBOLS_REMOVED = "symbols_removed";
    }

    // ====== Scheduler bounds ======
    interface Scheduler {
        int MIN_INTERVAL_MINUTES = 5;
        int MAX_INTERVAL_MINUTES = 1440;
    }

    // ====== Job record ======
    interface Jobs {
        int ERRORS_IN_SNAPSHOT = 10;
        int MISSING_SYMBOLS_REPORTED = 20;
        int RECENT_UPSTREAM_ERRORS = 20;
        String DEFAULT_EXTRACTION_TYPE = "quotes";
    }

    // ====== Screener ======
    interface Screener {
        int DEFAULT_LIMIT = 50;
        int MAX_LIMIT = 200;
    }
}
