package com.stock.pulse.engine.test.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stock.pulse.engine.common.Result;
import com.stock.pulse.engine.common.constants.PipelineConsts;
import com.stock.pulse.engine.common.constants.PipelineProperties;
import com.stock.pulse.engine.common.constants.UpstreamProperties;
import com.stock.pulse.engine.common.exception.AuthenticationException;
import com.stock.pulse.engine.common.exception.PersistenceTierUnavailableException;
import com.stock.pulse.engine.enums.PipelineState;
import com.stock.pulse.engine.enums.SymbolStatus;
import com.stock.pulse.engine.model.canonical.CanonicalFields;
import com.stock.pulse.engine.model.canonical.CanonicalRecord;
import com.stock.pulse.engine.repo.documents.PipelineJobRepo;
import com.stock.pulse.engine.service.extraction.QuoteNormalizer;
import com.stock.pulse.engine.service.persistence.CacheService;
import com.stock.pulse.engine.service.persistence.FanoutReport;
import com.stock.pulse.engine.service.persistence.PersistContext;
import com.stock.pulse.engine.service.persistence.PersistenceFanout;
import com.stock.pulse.engine.service.pipeline.JobSnapshot;
import com.stock.pulse.engine.service.pipeline.PipelineEventLog;
import com.stock.pulse.engine.service.pipeline.PipelineMetricsTracker;
import com.stock.pulse.engine.service.pipeline.PipelineService;
import com.stock.pulse.engine.service.pipeline.SymbolOutcome;
import com.stock.pulse.engine.service.pipeline.SymbolUniverse;
import com.stock.pulse.engine.service.upstream.GrowwClient;
import com.stock.pulse.engine.service.upstream.GrowwSessionService;
import com.stock.pulse.engine.service.upstream.RequestBudget;
import com.stock.pulse.engine.service.upstream.UpstreamCallMetrics;
import com.stock.pulse.engine.service.upstream.UpstreamRequest;
import com.stock.pulse.engine.service.upstream.UpstreamResponse;
import com.stock.pulse.engine.service.upstream.UpstreamTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PipelineServiceTest {

    private static final String QUOTE = "{\"ltp\": 110.0, \"prev_close\": 100.0, \"volume\": 1000}";

    private UpstreamTransport transport;
    private GrowwSessionService session;
    private PersistenceFanout fanout;
    private CacheService cache;
    private PipelineJobRepo jobRepo;
    private PipelineEventLog events;
    private PipelineProperties props;
    private final List<Runnable> deferred = new ArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        transport = mock(UpstreamTransport.class);
        session = mock(GrowwSessionService.class);
        fanout = mock(PersistenceFanout.class);
        cache = mock(CacheService.class);
        jobRepo = mock(PipelineJobRepo.class);

        when(session.getValidToken()).thenReturn("tok");
        when(transport.execute(any(), anyString())).thenReturn(new UpstreamResponse(200, QUOTE));
        when(fanout.persist(anyString(), any(CanonicalFields.class), any(PersistContext.class))).thenAnswer(inv -> {
            String sym = inv.getArgument(0);
            CanonicalFields fields = inv.getArgument(1);
            PersistContext ctx = inv.getArgument(2);
            return new FanoutReport(sym, CanonicalRecord.of(sym, fields, ctx.asOf()), List.of());
        });

        props = new PipelineProperties();
        props.setConcurrency(1);
    }

    private PipelineService service(Executor executor) {
        Clock clock = Clock.systemUTC();
        UpstreamProperties upstream = new UpstreamProperties();
        upstream.setMaxAttempts(2);
        upstream.setInitialBackoff(Duration.ofMillis(10));
        upstream.setRequestsPerSecond(10_000);
        upstream.setRequestsPerMinute(100_000);
        GrowwClient client = new GrowwClient(transport, session, new RequestBudget(upstream),
                new UpstreamCallMetrics(clock), upstream, new ObjectMapper(), clock);
        events = new PipelineEventLog(props, clock);
        return new PipelineService(client, session, new QuoteNormalizer(props), fanout, cache, new SymbolUniverse(),
                events, new PipelineMetricsTracker(clock), jobRepo, props, clock, executor);
    }

    private PipelineService inline() {
        return service(Runnable::run);
    }

    private PipelineService deferredStart() {
        return service(deferred::add);
    }

    @Test
    void fullUniverseRunSucceeds() {
        props.setConcurrency(5);
        PipelineService svc = inline();

        Result<JobSnapshot> r = svc.trigger(null, "quotes");

        assertThat(r.isOk()).isTrue();
        JobSnapshot job = r.get();
        assertThat(job.getStatus()).isEqualTo("success");
        assertThat(job.getTotalSymbols()).isEqualTo(143);
        assertThat(job.getSuccessfulSymbols()).isEqualTo(143);
        assertThat(job.getDataPoints()).isPositive();
        assertThat(job.getProgressPercent()).isEqualTo(100.0);

        verify(fanout, times(143)).persist(anyString(), any(CanonicalFields.class), any(PersistContext.class));
        verify(cache).updateTopMovers(anyMap());
        verify(jobRepo).save(any());
        assertThat(svc.isJobRunning()).isFalse();
        assertThat(svc.state()).isEqualTo(PipelineState.IDLE);
        assertThat(svc.metrics().getTotalJobsRun()).isEqualTo(1);
        assertThat(svc.metrics().getDataCompletenessPercent()).isEqualTo(100.0);
        assertThat(svc.dataSummary().uniqueSymbolsExtracted()).isEqualTo(143);
        assertThat(svc.logs(PipelineConsts.Events.JOB_COMPLETED, 10)).hasSize(1);
    }

    @Test
    void oneBadSymbolMakesThePartialOutcome() throws Exception {
        when(transport.execute(any(UpstreamRequest.class), anyString())).thenAnswer(inv -> {
            UpstreamRequest req = inv.getArgument(0);
            return req.symbol().equals("BBB") ? new UpstreamResponse(404, "unknown") : new UpstreamResponse(200, QUOTE);
        });
        PipelineService svc = inline();

        JobSnapshot job = svc.trigger(List.of("aaa", " bbb ", "CCC", "aaa"), null).get();

        assertThat(job.getSymbols()).containsExactly("AAA", "BBB", "CCC");
        assertThat(job.getStatus()).isEqualTo("partial");
        assertThat(job.getSuccessfulSymbols()).isEqualTo(2);
        assertThat(job.getFailedSymbols()).isEqualTo(1);
        SymbolOutcome bad = job.getErrors().get(0);
        assertThat(bad.getSymbol()).isEqualTo("BBB");
        assertThat(bad.getLastHttpStatus()).isEqualTo(404);
        assertThat(svc.logs(PipelineConsts.Events.SYMBOL_FAILED, 10)).hasSize(1);
        assertThat(svc.state()).isEqualTo(PipelineState.IDLE);
    }

    @Test
    void unexpectedProcessingErrorIsAttributedToTheSymbol() {
        doThrow(new IllegalStateException("sink exploded"))
                .when(fanout).persist(eq("BBB"), any(CanonicalFields.class), any(PersistContext.class));
        PipelineService svc = inline();

        JobSnapshot job = svc.trigger(List.of("AAA", "BBB", "CCC"), null).get();

        assertThat(job.getStatus()).isEqualTo("partial");
        assertThat(job.getSuccessfulSymbols()).isEqualTo(2);
        assertThat(job.getFailedSymbols()).isEqualTo(1);
        assertThat(job.getSkippedSymbols()).isZero();
        SymbolOutcome bad = job.getErrors().get(0);
        assertThat(bad.getSymbol()).isEqualTo("BBB");
        assertThat(bad.getStatus()).isEqualTo(SymbolStatus.FAILED);
        assertThat(bad.getErrorCode()).isEqualTo("ERR-SYS-001");
        assertThat(bad.getMessage()).contains("sink exploded");
        assertThat(svc.logs(PipelineConsts.Events.SYMBOL_FAILED, 10)).hasSize(1);
    }

    @Test
    void authenticationFailureCostsNoUpstreamCalls() {
        when(session.getValidToken()).thenThrow(new AuthenticationException("Token exchange rejected: HTTP 401"));
        PipelineService svc = inline();

        JobSnapshot job = svc.trigger(List.of("AAA", "BBB"), null).get();

        assertThat(job.getStatus()).isEqualTo("failed");
        assertThat(job.getFatalErrorCode()).isEqualTo("ERR-AUTH-101");
        assertThat(job.getSkippedSymbols()).isEqualTo(2);
        assertThat(job.getOutcomes()).allMatch(o -> o.getStatus() == SymbolStatus.SKIPPED);
        verifyNoInteractions(transport);
        assertThat(svc.state()).isEqualTo(PipelineState.ERROR);
        assertThat(svc.logs(PipelineConsts.Events.JOB_FAILED, 10)).hasSize(1);
    }

    @Test
    void authoritativeStorageFailureStopsTheJob() {
        doThrow(new PersistenceTierUnavailableException("timeseries", "database down", null))
                .when(fanout).persist(anyString(), any(CanonicalFields.class), any(PersistContext.class));
        PipelineService svc = inline();

        JobSnapshot job = svc.trigger(List.of("AAA", "BBB", "CCC"), null).get();

        assertThat(job.getStatus()).isEqualTo("failed");
        assertThat(job.getFatalErrorCode()).isEqualTo("ERR-DB-101");
        assertThat(job.getFailedSymbols()).isEqualTo(1);
        assertThat(job.getSkippedSymbols()).isEqualTo(2);
        verify(fanout, times(1)).persist(anyString(), any(CanonicalFields.class), any(PersistContext.class));
        verify(cache, never()).updateTopMovers(anyMap());
    }

    @Test
    void onlyOneJobRunsAtATime() {
        PipelineService svc = deferredStart();

        Result<JobSnapshot> first = svc.trigger(List.of("AAA"), null);
        Result<JobSnapshot> second = svc.trigger(List.of("BBB"), null);

        assertThat(first.isOk()).isTrue();
        assertThat(first.get().getStatus()).isEqualTo("pending");
        assertThat(second.isOk()).isFalse();
        assertThat(second.getErrorCode()).isEqualTo(PipelineService.JOB_RUNNING);
        assertThat(svc.isJobRunning()).isTrue();
        assertThat(svc.state()).isEqualTo(PipelineState.RUNNING);

        deferred.forEach(Runnable::run);

        assertThat(svc.isJobRunning()).isFalse();
        assertThat(svc.trigger(List.of("BBB"), null).isOk()).isTrue();
    }

    @Test
    void stoppingAJob() {
        PipelineService svc = deferredStart();
        String id = svc.trigger(List.of("AAA", "BBB"), null).get().getJobId();

        Result<JobSnapshot> stopped = svc.stopJob(id);
        assertThat(stopped.isOk()).isTrue();
        assertThat(stopped.get().isCancelRequested()).isTrue();

        deferred.forEach(Runnable::run);

        JobSnapshot done = svc.getJob(id).get();
        assertThat(done.getSkippedSymbols()).isEqualTo(2);
        assertThat(done.getOutcomes()).allMatch(o -> "cancelled".equals(o.getMessage()));
        assertThat(svc.stopJob(id).getErrorCode()).isEqualTo(PipelineService.JOB_RUNNING);
        assertThat(svc.stopJob("missing").getErrorCode()).isEqualTo("ERR-NOT-FOUND");
        assertThat(svc.logs(PipelineConsts.Events.JOB_CANCELLED, 10)).hasSize(1);
        verifyNoInteractions(transport);
    }

    @Test
    void blankSymbolListIsRejected() {
        PipelineService svc = inline();

        Result<JobSnapshot> r = svc.trigger(List.of(" ", ""), null);

        assertThat(r.isOk()).isFalse();
        assertThat(r.getErrorCode()).isEqualTo("ERR-VAL-001");
    }

    @Test
    void historyAndLookupAfterRuns() {
        PipelineService svc = inline();
        String first = svc.trigger(List.of("AAA"), null).get().getJobId();
        String second = svc.trigger(List.of("BBB"), null).get().getJobId();

        assertThat(svc.history(10)).extracting(JobSnapshot::getJobId).containsExactly(second, first);
        assertThat(svc.jobs(1)).hasSize(1);
        assertThat(svc.getJob(first).isOk()).isTrue();
        assertThat(svc.getJob("nope").getErrorCode()).isEqualTo("ERR-NOT-FOUND");
    }

    @Test
    void universeChangesAreLogged() {
        PipelineService svc = inline();

        SymbolUniverse.ChangeResult added = svc.addSymbols(List.of("newco", "TCS"), null);
        SymbolUniverse.ChangeResult removed = svc.removeSymbols(List.of("NEWCO", "GHOST"));

        assertThat(added.changed()).containsExactly("NEWCO");
        assertThat(added.unchanged()).containsExactly("TCS");
        assertThat(removed.changed()).containsExactly("NEWCO");
        assertThat(removed.unchanged()).containsExactly("GHOST");
        assertThat(svc.logs(null, 10)).extracting(PipelineEventLog.PipelineEvent::eventType)
                .containsExactly(PipelineConsts.Events.SYMBOLS_ADDED, PipelineConsts.Events.SYMBOLS_REMOVED);
    }

    @Test
    void connectionProbeDoesNotPersist() {
        PipelineService svc = inline();

        PipelineService.ConnectionReport report = svc.testConnection("reliance");

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.getSymbol()).isEqualTo("RELIANCE");
        assertThat(report.getPayloadShape()).isEqualTo("FLAT");
        assertThat(report.getFields()).containsKey("current_price");
        verifyNoInteractions(fanout);
    }

    @Test
    void connectionProbeReportsFailure() throws Exception {
        when(transport.execute(any(), eq("tok"))).thenReturn(new UpstreamResponse(404, "unknown"));
        PipelineService svc = inline();

        PipelineService.ConnectionReport report = svc.testConnection("NOPE");

        assertThat(report.isSuccess()).isFalse();
        assertThat(report.getErrorCode()).isEqualTo("ERR-UPS-002");
        assertThat(svc.symbolCategories()).containsKey("nifty_50");
        assertThat(Map.copyOf(svc.symbolCategories())).hasSize(3);
    }
}
