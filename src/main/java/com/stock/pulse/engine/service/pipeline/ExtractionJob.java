package com.stock.pulse.engine.service.pipeline;

import com.stock.pulse.engine.common.constants.PipelineConsts;
import com.stock.pulse.engine.common.exception.BasePipelineException;
import com.stock.pulse.engine.enums.JobStatus;
import com.stock.pulse.engine.enums.SymbolStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One extraction run over a fixed symbol list.
 * <p>
 * Only the orchestrator mutates a job (every mutator is package-private). Status moves
 * {@code PENDING -> RUNNING -> SUCCESS | PARTIAL | FAILED}, or straight from PENDING to FAILED
 * on a fatal error before any fetch; illegal moves throw {@link IllegalStateException}.
 */
@Slf4j
public final class ExtractionJob {

    private final String id;
    private final String extractionType;
    private final List<String> symbols;
    private final Instant createdAt;

    private JobStatus status = JobStatus.PENDING;
    private Instant startedAt;
    private Instant completedAt;
    private String fatalError;
    private String fatalErrorCode;
    private volatile boolean cancelRequested;
    private long dataPoints;

    private final Map<String, SymbolOutcome> outcomes = new LinkedHashMap<>();

    ExtractionJob(String id, String extractionType, List<String> symbols, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.extractionType = extractionType == null ? PipelineConsts.Jobs.DEFAULT_EXTRACTION_TYPE : extractionType;
        this.symbols = List.copyOf(symbols);
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        if (this.symbols.isEmpty()) throw new IllegalArgumentException("A job needs at least one symbol");
        if (this.symbols.stream().distinct().count() != this.symbols.size()) {
            throw new IllegalArgumentException("Job symbols must be unique");
        }
    }

    public String getId() {
        return id;
    }

    public String getExtractionType() {
        return extractionType;
    }

    public List<String> getSymbols() {
        return symbols;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized JobStatus getStatus() {
        return status;
    }

    public synchronized boolean hasFatal() {
        return fatalError != null;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public synchronized SymbolOutcome outcome(String symbol) {
        return outcomes.get(symbol);
    }

    public synchronized List<SymbolOutcome> outcomes() {
        return new ArrayList<>(outcomes.values());
    }

    // ---------------------------------------------------------------------
    // Mutators (orchestrator only)
    // ---------------------------------------------------------------------

    /**
     * Enters RUNNING on the first symbol fetch; later calls are no-ops.
     */
    synchronized void markStarted(Instant at) {
        if (status == JobStatus.RUNNING) return;
        moveTo(JobStatus.RUNNING);
        startedAt = at;
    }

    synchronized void record(SymbolOutcome outcome) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Job " + id + " is " + status + ", cannot record " + outcome.getSymbol());
        }
        if (!symbols.contains(outcome.getSymbol())) {
            throw new IllegalArgumentException(outcome.getSymbol() + " is not part of job " + id);
        }
        if (outcomes.containsKey(outcome.getSymbol())) {
            throw new IllegalStateException(outcome.getSymbol() + " already recorded on job " + id);
        }
        outcomes.put(outcome.getSymbol(), outcome);
        if (outcome.getStatus() == SymbolStatus.SUCCESS) dataPoints += outcome.getFieldCount();
    }

    synchronized boolean isRecorded(String symbol) {
        return outcomes.containsKey(symbol);
    }

    /**
     * Keeps the first fatal error; later ones only get logged.
     */
    synchronized void recordFatal(Throwable cause) {
        String msg = cause.getMessage() == null ? cause.toString() : cause.getMessage();
        if (fatalError != null) {
            log.debug("Job {} already failed fatally, ignoring: {}", id, msg);
            return;
        }
        fatalError = msg;
        fatalErrorCode = cause instanceof BasePipelineException bpe ? bpe.getErrorCode() : null;
    }

    void requestCancel() {
        cancelRequested = true;
    }

    /**
     * Marks every symbol never reached as SKIPPED and settles the final status:
     * FAILED on a fatal error or zero successes, SUCCESS when every symbol succeeded, otherwise PARTIAL.
     */
    synchronized JobStatus finish(Instant at) {
        if (status.isTerminal()) throw new IllegalStateException("Job " + id + " already finished as " + status);

        String skipReason = fatalError != null ? "aborted: " + fatalError
                : cancelRequested ? "cancelled" : "not processed";
        for (String s : symbols) {
            outcomes.computeIfAbsent(s, k -> SymbolOutcome.skipped(k, skipReason, at));
        }

        long ok = count(SymbolStatus.SUCCESS);
        long failed = count(SymbolStatus.FAILED);
        long skipped = count(SymbolStatus.SKIPPED);

        JobStatus next;
        if (fatalError != null || ok == 0) next = JobStatus.FAILED;
        else if (failed == 0 && skipped == 0) next = JobStatus.SUCCESS;
        else next = JobStatus.PARTIAL;

        moveTo(next);
        completedAt = at;
        return next;
    }

    private void moveTo(JobStatus next) {
        if (!status.canMoveTo(next)) {
            throw new IllegalStateException("Job " + id + ": illegal transition " + status + " -> " + next);
        }
        status = next;
    }

    private long count(SymbolStatus s) {
        return outcomes.values().stream().filter(o -> o.getStatus() == s).count();
    }

    // ---------------------------------------------------------------------
    // Views
    // ---------------------------------------------------------------------

    public synchronized JobSnapshot toSnapshot() {
        int ok = (int) count(SymbolStatus.SUCCESS);
        int failed = (int) count(SymbolStatus.FAILED);
        int skipped = (int) count(SymbolStatus.SKIPPED);
        int processed = ok + failed + skipped;

        List<SymbolOutcome> all = new ArrayList<>(outcomes.values());
        List<SymbolOutcome> errors = all.stream().filter(o -> o.getStatus() == SymbolStatus.FAILED).toList();
        if (errors.size() > PipelineConsts.Jobs.ERRORS_IN_SNAPSHOT) {
            errors = errors.subList(errors.size() - PipelineConsts.Jobs.ERRORS_IN_SNAPSHOT, errors.size());
        }

        return JobSnapshot.builder()
                .jobId(id)
                .extractionType(extractionType)
                .status(status.name().toLowerCase(Locale.ROOT))
                .symbols(symbols)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .totalSymbols(symbols.size())
                .processedSymbols(processed)
                .successfulSymbols(ok)
                .failedSymbols(failed)
                .skippedSymbols(skipped)
                .progressPercent(Math.round(processed * 10000.0 / symbols.size()) / 100.0)
                .dataPoints(dataPoints)
                .cancelRequested(cancelRequested)
                .fatalError(fatalError)
                .fatalErrorCode(fatalErrorCode)
                .errors(List.copyOf(errors))
                .outcomes(all)
                .durationSeconds(startedAt != null && completedAt != null
                        ? Duration.between(startedAt, completedAt).toMillis() / 1000.0 : null)
                .build();
    }
}
