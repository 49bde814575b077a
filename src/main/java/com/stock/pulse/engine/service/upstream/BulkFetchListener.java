package com.stock.pulse.engine.service.upstream;

/**
 * Hooks a bulk fetch calls on its worker threads.
 */
public interface BulkFetchListener {

    BulkFetchListener NONE = new BulkFetchListener() {
    };

    /**
     * Checked before each request is started. Requests not yet started when this turns true are skipped.
     */
    default boolean shouldStop() {
        return false;
    }

    default void onStart(UpstreamRequest request) {
    }

    /**
     * Runs on the worker right after the fetch. A job-fatal pipeline exception thrown here
     * stops the remaining requests.
     */
    default void onComplete(FetchOutcome outcome) {
    }
}
