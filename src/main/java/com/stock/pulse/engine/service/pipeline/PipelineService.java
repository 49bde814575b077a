package com.stock.pulse.engine.service.pipeline;

import com.stock.pulse.engine.common.Result;
import com.stock.pulse.engine.common.constants.PipelineConsts;
import com.stock.pulse.engine.common.constants.PipelineProperties;
import com.stock.pulse.engine.common.exception.BasePipelineException;
import com.stock.pulse.engine.common.exception.SymbolProcessingException;
import com.stock.pulse.engine.common.exception.UpstreamCallException;
import com.stock.pulse.engine.common.exception.ValidationException;
import com.stock.pulse.engine.config.SchedulingConfig;
import com.stock.pulse.engine.enums.JobStatus;
import com.stock.pulse.engine.enums.PipelineState;
import com.stock.pulse.engine.enums.SymbolStatus;
import com.stock.pulse.engine.model.canonical.CanonicalField;
import com.stock.pulse.engine.model.canonical.CanonicalRecord;
import com.stock.pulse.engine.model.documents.ExtractionJobDocument;
import com.stock.pulse.engine.repo.documents.PipelineJobRepo;
import com.stock.pulse.engine.service.extraction.NormalizationResult;
import com.stock.pulse.engine.service.extraction.QuoteNormalizer;
import com.stock.pulse.engine.service.persistence.CacheService;
import com.stock.pulse.engine.service.persistence.FanoutReport;
import com.stock.pulse.engine.service.persistence.PersistContext;
import com.stock.pulse.engine.service.persistence.PersistenceFanout;
import com.stock.pulse.engine.service.upstream.BulkFetchListener;
import com.stock.pulse.engine.service.upstream.FetchOutcome;
import com.stock.pulse.engine.service.upstream.GrowwClient;
import com.stock.pulse.engine.service.upstream.GrowwSessionService;
import com.stock.pulse.engine.service.upstream.UpstreamCallMetrics;
import com.stock.pulse.engine.service.upstream.UpstreamQuote;
import com.stock.pulse.engine.service.upstream.UpstreamRequest;
import jakarta.annotation.PostConstruct;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs extraction jobs: fetch every symbol under the shared budget, normalize it and
 * fan it out to storage, recording each symbol's outcome on the job.
 * <p>
 * At most one job runs at a time. Fatal errors (authentication, authoritative storage)
 * stop new symbol work; anything else fails only the symbol concerned.
 */
@Slf4j
@Service
public class PipelineService {

    public static final String JOB_RUNNING = "ERR-JOB-409";

    private final GrowwClient client;
    private final GrowwSessionService session;
    private final QuoteNormalizer normalizer;
    private final PersistenceFanout fanout;
    private final CacheService cache;
    private final SymbolUniverse universe;
    private final PipelineEventLog events;
    private final PipelineMetricsTracker metrics;
    private final PipelineJobRepo jobRepo;
    private final PipelineProperties props;
    private final Clock clock;
    private final Executor executor;

    private final AtomicReference<ExtractionJob> current = new AtomicReference<>();
    private final Map<String, ExtractionJob> liveJobs = new ConcurrentHashMap<>();
    private final Deque<JobSnapshot> history = new ArrayDeque<>();

    private volatile boolean scheduled;
    private volatile boolean lastJobFatal;

    public PipelineService(GrowwClient client,
                           GrowwSessionService session,
                           QuoteNormalizer normalizer,
                           PersistenceFanout fanout,
                           CacheService cache,
                           SymbolUniverse universe,
                           PipelineEventLog events,
                           PipelineMetricsTracker metrics,
                           PipelineJobRepo jobRepo,
                           PipelineProperties props,
                           Clock clock,
                           @Qualifier(SchedulingConfig.JOB_EXECUTOR) Executor executor) {
        this.client = client;
        this.session = session;
        this.normalizer = normalizer;
        this.fanout = fanout;
        this.cache = cache;
        this.universe = universe;
        this.events = events;
        this.metrics = metrics;
        this.jobRepo = jobRepo;
        this.props = props;
        this.clock = clock;
        this.executor = executor;
    }

    @PostConstruct
    void loadHistory() {
        try {
            List<ExtractionJobDocument> docs = jobRepo.findByOrderByCreatedAtDesc(
                    PageRequest.of(0, Math.max(1, props.getHistorySize())));
            synchronized (history) {
                for (int i = docs.size() - 1; i >= 0; i--) addHistory(fromDocument(docs.get(i)));
            }
            log.info("Loaded {} jobs into history", docs.size());
        } catch (RuntimeException e) {
            log.warn("Job history not loaded: {}", e.getMessage());
        }
    }

    // ---------------------------------------------------------------------
    // Triggering
    // ---------------------------------------------------------------------

    /**
     * Starts a job in the background. Null or empty {@code symbols} means the whole universe.
     *
     * @return the pending job, or {@link #JOB_RUNNING} while another job is active
     */
    public Result<JobSnapshot> trigger(List<String> symbols, String extractionType) {
        List<String> list = normalizeSymbols(symbols == null || symbols.isEmpty() ? universe.all() : symbols);
        if (list.isEmpty()) return Result.fail("ERR-VAL-001", "No symbols to extract");

        ExtractionJob job = new ExtractionJob(UUID.randomUUID().toString(), extractionType, list, clock.instant());
        if (!current.compareAndSet(null, job)) {
            ExtractionJob running = current.get();
            return Result.fail(JOB_RUNNING, "Job " + (running == null ? "?" : running.getId()) + " is already running");
        }
        liveJobs.put(job.getId(), job);
        try {
            executor.execute(() -> runJob(job));
        } catch (RejectedExecutionException e) {
            current.compareAndSet(job, null);
            liveJobs.remove(job.getId());
            return Result.fail(JOB_RUNNING, "Job executor is busy: " + e.getMessage());
        }
        return Result.ok(job.toSnapshot());
    }

    public boolean isJobRunning() {
        return current.get() != null;
    }

    void runJob(ExtractionJob job) {
        Map<String, Object> started = new LinkedHashMap<>();
        started.put("job_id", job.getId());
        started.put("extraction_type", job.getExtractionType());
        started.put("symbols", job.getSymbols().size());
        events.log(PipelineConsts.Events.JOB_STARTED, started);
        try {
            // authenticate before any fetch so a dead session costs zero upstream calls
            session.getValidToken();

            List<UpstreamRequest> requests = job.getSymbols().stream().map(client::requestFor).toList();
            JobListener listener = new JobListener(job);
            Map<UpstreamRequest, FetchOutcome> results = client.fetchBulk(requests, props.getConcurrency(), listener);

            // outcomes that never reached the listener, or escaped it
            results.forEach((r, o) -> {
                if (job.isRecorded(r.symbol())) return;
                if (o.isSkipped()) {
                    job.record(SymbolOutcome.skipped(r.symbol(), o.skipReason(), clock.instant()));
                } else if (o.isFailed()) {
                    listener.recordFailure(r.symbol(), o.error(), o.latencyMs());
                }
            });
        } catch (BasePipelineException e) {
            log.error("Job {} failed: {}", job.getId(), e.getMessage());
            job.recordFatal(e);
        } catch (RuntimeException e) {
            log.error("Job {} failed unexpectedly", job.getId(), e);
            job.recordFatal(e);
        } finally {
            finalizeJob(job);
        }
    }

    private void finalizeJob(ExtractionJob job) {
        JobStatus status = job.finish(clock.instant());
        JobSnapshot snap = job.toSnapshot();
        lastJobFatal = snap.getFatalError() != null;

        synchronized (history) {
            addHistory(snap);
        }
        metrics.recordJob(job);
        current.compareAndSet(job, null);
        trimLiveJobs();

        saveDocument(job, snap);
        updateTopMovers(job);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("job_id", job.getId());
        data.put("status", snap.getStatus());
        data.put("successful", snap.getSuccessfulSymbols());
        data.put("failed", snap.getFailedSymbols());
        data.put("skipped", snap.getSkippedSymbols());
        data.put("duration_seconds", snap.getDurationSeconds());
        if (snap.getFatalError() != null) data.put("error", snap.getFatalError());
        String type = status == JobStatus.FAILED ? PipelineConsts.Events.JOB_FAILED : PipelineConsts.Events.JOB_COMPLETED;
        events.log(type, data);
    }

    private void saveDocument(ExtractionJob job, JobSnapshot snap) {
        try {
            Map<String, String> symbolStatus = new LinkedHashMap<>();
            snap.getOutcomes().forEach(o -> symbolStatus.put(o.getSymbol(), o.getStatus().name()));
            jobRepo.save(ExtractionJobDocument.builder()
                    .jobId(job.getId())
                    .extractionType(job.getExtractionType())
                    .status(snap.getStatus())
                    .symbols(job.getSymbols())
                    .createdAt(snap.getCreatedAt())
                    .startedAt(snap.getStartedAt())
                    .completedAt(snap.getCompletedAt())
                    .successCount(snap.getSuccessfulSymbols())
                    .failedCount(snap.getFailedSymbols())
                    .skippedCount(snap.getSkippedSymbols())
                    .dataPoints(snap.getDataPoints())
                    .fatalError(snap.getFatalError())
                    .symbolStatus(symbolStatus)
                    .errors(snap.getErrors().stream().map(o -> o.getSymbol() + ": " + o.getMessage()).toList())
                    .build());
        } catch (RuntimeException e) {
            log.warn("Job {} not saved to history store: {}", job.getId(), e.getMessage());
        }
    }

    private void updateTopMovers(ExtractionJob job) {
        Map<String, Double> changes = new HashMap<>();
        for (SymbolOutcome o : job.outcomes()) {
            if (o.getStatus() == SymbolStatus.SUCCESS && o.getChangePct() != null) changes.put(o.getSymbol(), o.getChangePct());
        }
        if (changes.isEmpty()) return;
        try {
            cache.updateTopMovers(changes);
        } catch (RuntimeException e) {
            log.warn("Top movers not cached: {}", e.getMessage());
        }
    }

    /**
     * Processes each symbol on the fetch worker as soon as its quote arrives.
     */
    private final class JobListener implements BulkFetchListener {
        private final ExtractionJob job;

        JobListener(ExtractionJob job) {
            this.job = job;
        }

        @Override
        public boolean shouldStop() {
            return job.isCancelRequested() || job.hasFatal();
        }

        @Override
        public void onStart(UpstreamRequest request) {
            job.markStarted(clock.instant());
        }

        @Override
        public void onComplete(FetchOutcome outcome) {
            String symbol = outcome.request().symbol();
            if (outcome.isSkipped()) {
                job.record(SymbolOutcome.skipped(symbol, outcome.skipReason(), clock.instant()));
                return;
            }
            if (!outcome.isSuccess()) {
                recordFailure(symbol, outcome.error(), outcome.latencyMs());
                if (outcome.error().isFatalForJob()) job.recordFatal(outcome.error());
                return;
            }
            UpstreamQuote quote = outcome.quote();
            try {
                NormalizationResult norm = normalizer.transform(quote);
                PersistContext ctx = new PersistContext(job.getId(), props.getSource(), quote.receivedAt(),
                        quote.shape(), norm.warnings());
                FanoutReport report = fanout.persist(symbol, norm.fields(), ctx);
                CanonicalRecord record = report.record();
                job.record(SymbolOutcome.builder()
                        .symbol(symbol)
                        .status(SymbolStatus.SUCCESS)
                        .attempts(quote.attempts())
                        .latencyMs(quote.latencyMs())
                        .fieldCount(record.size())
                        .warnings(norm.warnings())
                        .changePct(record.number(CanonicalField.PRICE_CHANGE_PCT).orElse(null))
                        .lastHttpStatus(200)
                        .completedAt(clock.instant())
                        .build());
            } catch (BasePipelineException e) {
                recordFailure(symbol, e, quote.latencyMs());
                if (e.isFatalForJob()) {
                    job.recordFatal(e);
                    throw e;
                }
            } catch (RuntimeException e) {
                log.warn("Processing failed for {}", symbol, e);
                recordFailure(symbol, new SymbolProcessingException(
                        "Processing failed for " + symbol + ": " + e, e), quote.latencyMs());
            }
        }

        private void recordFailure(String symbol, BasePipelineException e, long latencyMs) {
            Integer status = null;
            int attempts = 0;
            if (e instanceof UpstreamCallException uce) {
                status = uce.getLastStatus() == 0 ? null : uce.getLastStatus();
                attempts = uce.getAttempts();
            }
            job.record(SymbolOutcome.builder()
                    .symbol(symbol)
                    .status(SymbolStatus.FAILED)
                    .errorType(e.getClass().getSimpleName())
                    .errorCode(e.getErrorCode())
                    .message(e.getMessage())
                    .lastHttpStatus(status)
                    .attempts(attempts)
                    .latencyMs(latencyMs)
                    .warnings(List.of())
                    .completedAt(clock.instant())
                    .build());
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("job_id", job.getId());
            data.put("symbol", symbol);
            data.put("error_type", e.getClass().getSimpleName());
            data.put("error", e.getMessage());
            events.log(PipelineConsts.Events.SYMBOL_FAILED, data);
        }
    }

    // ---------------------------------------------------------------------
    // Job control and views
    // ---------------------------------------------------------------------

    public Result<JobSnapshot> stopJob(String jobId) {
        ExtractionJob job = liveJobs.get(jobId);
        if (job == null) {
            return findInHistory(jobId).isPresent()
                    ? Result.fail(JOB_RUNNING, "Job " + jobId + " already finished")
                    : Result.fail("ERR-NOT-FOUND", "Job not found: " + jobId);
        }
        if (job.getStatus().isTerminal()) return Result.fail(JOB_RUNNING, "Job " + jobId + " already finished");
        job.requestCancel();
        events.log(PipelineConsts.Events.JOB_CANCELLED, Map.of("job_id", jobId));
        return Result.ok(job.toSnapshot());
    }

    public Result<JobSnapshot> getJob(String jobId) {
        ExtractionJob live = liveJobs.get(jobId);
        if (live != null) return Result.ok(live.toSnapshot());
        return findInHistory(jobId)
                .map(Result::ok)
                .orElseGet(() -> Result.fail("ERR-NOT-FOUND", "Job not found: " + jobId));
    }

    /**
     * Running and finished jobs, newest first.
     */
    public List<JobSnapshot> jobs(int limit) {
        Map<String, JobSnapshot> byId = new LinkedHashMap<>();
        liveJobs.values().forEach(j -> byId.put(j.getId(), j.toSnapshot()));
        history(Integer.MAX_VALUE).forEach(s -> byId.putIfAbsent(s.getJobId(), s));
        return byId.values().stream()
                .sorted(Comparator.comparing(JobSnapshot::getCreatedAt).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }

    /**
     * Finished jobs, newest first.
     */
    public List<JobSnapshot> history(int limit) {
        List<JobSnapshot> out = new ArrayList<>();
        synchronized (history) {
            var it = history.descendingIterator();
            while (it.hasNext() && out.size() < limit) out.add(it.next());
        }
        return out;
    }

    public List<PipelineEventLog.PipelineEvent> logs(String eventType, int limit) {
        return events.recent(eventType, limit);
    }

    public PipelineMetricsTracker.MetricsSnapshot metrics() {
        return metrics.snapshot();
    }

    public PipelineState state() {
        if (current.get() != null) return PipelineState.RUNNING;
        if (lastJobFatal) return PipelineState.ERROR;
        return scheduled ? PipelineState.SCHEDULED : PipelineState.IDLE;
    }

    void markScheduled(boolean scheduled) {
        this.scheduled = scheduled;
    }

    public StatusView status() {
        ExtractionJob job = current.get();
        return StatusView.builder()
                .status(state().name().toLowerCase(Locale.ROOT))
                .scheduled(scheduled)
                .currentJob(job == null ? null : job.toSnapshot())
                .metrics(metrics.snapshot())
                .upstreamMetrics(client.metrics())
                .session(session.sessionInfo())
                .defaultSymbolsCount(universe.size())
                .timestamp(clock.instant())
                .build();
    }

    @Scheduled(fixedDelayString = "${stockpulse.pipeline.status-publish-ms:10000}")
    public void publishStatus() {
        try {
            cache.publishStatus(status());
        } catch (RuntimeException e) {
            log.debug("Pipeline status not published: {}", e.getMessage());
        }
    }

    /**
     * Latest successful extraction per symbol over the last ten finished jobs.
     */
    public DataSummary dataSummary() {
        Map<String, SymbolExtraction> bySymbol = new LinkedHashMap<>();
        for (JobSnapshot s : history(10)) {
            if (!"success".equals(s.getStatus()) && !"partial".equals(s.getStatus())) continue;
            for (SymbolOutcome o : s.getOutcomes()) {
                if (o.getStatus() != SymbolStatus.SUCCESS) continue;
                bySymbol.putIfAbsent(o.getSymbol(), new SymbolExtraction(s.getJobId(),
                        o.getCompletedAt() == null ? s.getCompletedAt() : o.getCompletedAt(), o.getFieldCount()));
            }
        }
        return new DataSummary(bySymbol.size(), bySymbol, metrics.snapshot().getLastRunTime());
    }

    // ---------------------------------------------------------------------
    // Symbol universe
    // ---------------------------------------------------------------------

    public Map<String, List<String>> symbolCategories() {
        return universe.categories();
    }

    public SymbolUniverse.ChangeResult addSymbols(List<String> symbols, String category) {
        SymbolUniverse.ChangeResult r = universe.add(symbols, category);
        if (!r.changed().isEmpty()) {
            events.log(PipelineConsts.Events.SYMBOLS_ADDED, Map.of("symbols", r.changed(), "total", r.totalSymbols()));
        }
        return r;
    }

    public SymbolUniverse.ChangeResult removeSymbols(List<String> symbols) {
        SymbolUniverse.ChangeResult r = universe.remove(symbols);
        if (!r.changed().isEmpty()) {
            events.log(PipelineConsts.Events.SYMBOLS_REMOVED, Map.of("symbols", r.changed(), "total", r.totalSymbols()));
        }
        return r;
    }

    // ---------------------------------------------------------------------
    // Probe
    // ---------------------------------------------------------------------

    /**
     * Authenticates, fetches and normalizes one symbol without persisting anything.
     */
    public ConnectionReport testConnection(String symbol) {
        String sym = SymbolUniverse.clean(symbol);
        if (sym == null) {
            List<String> all = universe.all();
            if (all.isEmpty()) throw new ValidationException("No symbol to test");
            sym = all.get(0);
        }
        long t0 = System.nanoTime();
        ConnectionReport.ConnectionReportBuilder b = ConnectionReport.builder().symbol(sym);
        try {
            session.getValidToken();
            UpstreamQuote quote = client.fetch(client.requestFor(sym));
            NormalizationResult norm = normalizer.transform(quote);
            return b.success(true)
                    .latencyMs((System.nanoTime() - t0) / 1_000_000L)
                    .attempts(quote.attempts())
                    .payloadShape(quote.shape().name())
                    .fieldCount(norm.fields().size())
                    .fields(norm.fields().asKeyMap())
                    .warnings(norm.warnings())
                    .build();
        } catch (BasePipelineException e) {
            log.warn("Connection test for {} failed: {}", sym, e.getMessage());
            return b.success(false)
                    .latencyMs((System.nanoTime() - t0) / 1_000_000L)
                    .error(e.getMessage())
                    .errorCode(e.getErrorCode())
                    .build();
        }
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    static List<String> normalizeSymbols(List<String> symbols) {
        Set<String> out = new LinkedHashSet<>();
        for (String s : symbols) {
            String c = SymbolUniverse.clean(s);
            if (c != null) out.add(c);
        }
        return new ArrayList<>(out);
    }

    private Optional<JobSnapshot> findInHistory(String jobId) {
        synchronized (history) {
            return history.stream().filter(s -> s.getJobId().equals(jobId)).findFirst();
        }
    }

    private void addHistory(JobSnapshot snap) {
        history.addLast(snap);
        while (history.size() > Math.max(1, props.getHistorySize())) history.removeFirst();
    }

    private void trimLiveJobs() {
        liveJobs.values().removeIf(j -> j.getStatus().isTerminal() && j != current.get());
    }

    private static JobSnapshot fromDocument(ExtractionJobDocument d) {
        List<SymbolOutcome> outcomes = new ArrayList<>();
        if (d.getSymbolStatus() != null) {
            d.getSymbolStatus().forEach((sym, st) -> outcomes.add(SymbolOutcome.builder()
                    .symbol(sym)
                    .status(SymbolStatus.valueOf(st))
                    .warnings(List.of())
                    .build()));
        }
        List<String> symbols = d.getSymbols() == null ? List.of() : d.getSymbols();
        int processed = d.getSuccessCount() + d.getFailedCount() + d.getSkippedCount();
        return JobSnapshot.builder()
                .jobId(d.getJobId())
                .extractionType(d.getExtractionType())
                .status(d.getStatus())
                .symbols(symbols)
                .createdAt(d.getCreatedAt())
                .startedAt(d.getStartedAt())
                .completedAt(d.getCompletedAt())
                .totalSymbols(symbols.size())
                .processedSymbols(processed)
                .successfulSymbols(d.getSuccessCount())
                .failedSymbols(d.getFailedCount())
                .skippedSymbols(d.getSkippedCount())
                .progressPercent(symbols.isEmpty() ? 0.0 : Math.round(processed * 10000.0 / symbols.size()) / 100.0)
                .dataPoints(d.getDataPoints())
                .fatalError(d.getFatalError())
                .errors(List.of())
                .outcomes(outcomes)
                .build();
    }

    @Value
    @Builder
    public static class StatusView {
        String status;
        boolean scheduled;
        JobSnapshot currentJob;
        PipelineMetricsTracker.MetricsSnapshot metrics;
        UpstreamCallMetrics.Snapshot upstreamMetrics;
        GrowwSessionService.SessionInfo session;
        int defaultSymbolsCount;
        Instant timestamp;
    }

    @Value
    @Builder
    public static class ConnectionReport {
        String symbol;
        boolean success;
        long latencyMs;
        int attempts;
        String payloadShape;
        int fieldCount;
        Map<String, Object> fields;
        List<String> warnings;
        String error;
        String errorCode;
    }

    public record SymbolExtraction(String jobId, Instant extractedAt, int fieldCount) {
    }

    public record DataSummary(int uniqueSymbolsExtracted, Map<String, SymbolExtraction> dataBySymbol,
                              Instant lastExtractionTime) {
    }
}
