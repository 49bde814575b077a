package com.stock.pulse.engine.test.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stock.pulse.engine.common.constants.UpstreamProperties;
import com.stock.pulse.engine.common.exception.AuthenticationException;
import com.stock.pulse.engine.common.exception.NormalizationException;
import com.stock.pulse.engine.common.exception.UpstreamCallException;
import com.stock.pulse.engine.enums.PayloadShape;
import com.stock.pulse.engine.service.upstream.FetchOutcome;
import com.stock.pulse.engine.service.upstream.GrowwClient;
import com.stock.pulse.engine.service.upstream.GrowwSessionService;
import com.stock.pulse.engine.service.upstream.RequestBudget;
import com.stock.pulse.engine.service.upstream.UpstreamCallMetrics;
import com.stock.pulse.engine.service.upstream.UpstreamQuote;
import com.stock.pulse.engine.service.upstream.UpstreamRequest;
import com.stock.pulse.engine.service.upstream.UpstreamResponse;
import com.stock.pulse.engine.service.upstream.UpstreamTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GrowwClientTest {

    private static final String FLAT = "{\"ltp\": 2950.5, \"open\": 2930, \"high\": 2961, \"low\": 2925, \"volume\": 1200000}";

    private UpstreamTransport transport;
    private GrowwSessionService session;
    private UpstreamCallMetrics metrics;
    private GrowwClient client;

    @BeforeEach
    void setUp() {
        UpstreamProperties props = new UpstreamProperties();
        props.setMaxAttempts(3);
        props.setInitialBackoff(Duration.ofMillis(10));
        props.setRequestsPerSecond(1000);
        props.setRequestsPerMinute(10_000);

        transport = mock(UpstreamTransport.class);
        session = mock(GrowwSessionService.class);
        when(session.getValidToken()).thenReturn("tok");
        Clock clock = Clock.systemUTC();
        metrics = new UpstreamCallMetrics(clock);
        client = new GrowwClient(transport, session, new RequestBudget(props), metrics, props, new ObjectMapper(), clock);
    }

    private UpstreamRequest req(String symbol) {
        return client.requestFor(symbol);
    }

    @Test
    void transientStatusesAreRetriedWithBackoff() throws Exception {
        when(transport.execute(any(), anyString()))
                .thenReturn(new UpstreamResponse(503, "busy"))
                .thenReturn(new UpstreamResponse(502, "bad gateway"))
                .thenReturn(new UpstreamResponse(200, FLAT));

        UpstreamQuote q = client.fetch(req("RELIANCE"));

        assertThat(q.attempts()).isEqualTo(3);
        assertThat(q.shape()).isEqualTo(PayloadShape.FLAT);
        assertThat(q.fields().get("ltp").asDouble()).isEqualTo(2950.5);
        assertThat(client.metrics().getRetryCount()).isEqualTo(2);
        assertThat(client.metrics().getSuccessfulRequests()).isEqualTo(1);
    }

    @Test
    void ioErrorsCountAsTransient() throws Exception {
        when(transport.execute(any(), anyString()))
                .thenThrow(new IOException("connection reset"))
                .thenReturn(new UpstreamResponse(200, FLAT));

        assertThat(client.fetch(req("TCS")).attempts()).isEqualTo(2);
    }

    @Test
    void exhaustedRetriesFailTheSymbolWithAttemptsAndStatus() throws Exception {
        when(transport.execute(any(), anyString())).thenReturn(new UpstreamResponse(503, "busy"));

        assertThatThrownBy(() -> client.fetch(req("INFY")))
                .isInstanceOfSatisfying(UpstreamCallException.class, e -> {
                    assertThat(e.getAttempts()).isEqualTo(3);
                    assertThat(e.getLastStatus()).isEqualTo(503);
                    assertThat(e.isFatalForJob()).isFalse();
                });
        verify(transport, times(3)).execute(any(), anyString());
        assertThat(client.metrics().getFailedRequests()).isEqualTo(1);
    }

    @Test
    void throttlingIsRetried() throws Exception {
        when(transport.execute(any(), anyString()))
                .thenReturn(new UpstreamResponse(429, "slow down"))
                .thenReturn(new UpstreamResponse(200, FLAT));

        client.fetch(req("SBIN"));

        assertThat(client.metrics().getRateLimitHits()).isEqualTo(1);
    }

    @Test
    void clientErrorsAreNotRetried() throws Exception {
        when(transport.execute(any(), anyString())).thenReturn(new UpstreamResponse(404, "unknown symbol"));

        assertThatThrownBy(() -> client.fetch(req("NOPE")))
                .isInstanceOfSatisfying(UpstreamCallException.class, e -> assertThat(e.getLastStatus()).isEqualTo(404));
        verify(transport, times(1)).execute(any(), anyString());
    }

    @Test
    void a401RefreshesTheSessionOnceAndReplays() throws Exception {
        when(session.getValidToken()).thenReturn("old", "new");
        when(transport.execute(any(), eq("old"))).thenReturn(new UpstreamResponse(401, "expired"));
        when(transport.execute(any(), eq("new"))).thenReturn(new UpstreamResponse(200, FLAT));

        UpstreamQuote q = client.fetch(req("ITC"));

        assertThat(q.symbol()).isEqualTo("ITC");
        verify(session, times(1)).invalidate();
    }

    @Test
    void aSecond401IsAnAuthenticationFailure() throws Exception {
        when(transport.execute(any(), anyString())).thenReturn(new UpstreamResponse(401, "nope"));

        assertThatThrownBy(() -> client.fetch(req("ITC")))
                .isInstanceOfSatisfying(AuthenticationException.class, e -> assertThat(e.isFatalForJob()).isTrue());
        verify(session, times(1)).invalidate();
        verify(transport, times(2)).execute(any(), anyString());
    }

    @Test
    void envelopePayload() throws Exception {
        when(transport.execute(any(), anyString())).thenReturn(new UpstreamResponse(200,
                "{\"status\": \"SUCCESS\", \"payload\": {\"last_price\": 101.5, \"volume\": 5000}}"));

        UpstreamQuote q = client.fetch(req("HDFCBANK"));

        assertThat(q.shape()).isEqualTo(PayloadShape.STATUS_ENVELOPE);
        assertThat(q.fields().get("last_price").asDouble()).isEqualTo(101.5);
    }

    @Test
    void envelopeFailureIsADefinitiveAnswer() throws Exception {
        when(transport.execute(any(), anyString())).thenReturn(new UpstreamResponse(200,
                "{\"status\": \"FAILURE\", \"error\": {\"message\": \"Invalid trading symbol\"}}"));

        assertThatThrownBy(() -> client.fetch(req("BADSYM")))
                .isInstanceOf(UpstreamCallException.class)
                .hasMessageContaining("Invalid trading symbol");
        verify(transport, times(1)).execute(any(), anyString());
    }

    @Test
    void payloadNestedUnderDataOrSymbol() throws Exception {
        when(transport.execute(any(), anyString()))
                .thenReturn(new UpstreamResponse(200, "{\"data\": {\"ltp\": 10.0}}"))
                .thenReturn(new UpstreamResponse(200, "{\"WIPRO\": {\"ltp\": 450.0}}"));

        UpstreamQuote underData = client.fetch(req("TITAN"));
        UpstreamQuote underSymbol = client.fetch(req("WIPRO"));

        assertThat(underData.shape()).isEqualTo(PayloadShape.NESTED_UNDER_KEY);
        assertThat(underData.fields().get("ltp").asDouble()).isEqualTo(10.0);
        assertThat(underSymbol.shape()).isEqualTo(PayloadShape.NESTED_UNDER_KEY);
        assertThat(underSymbol.fields().get("ltp").asDouble()).isEqualTo(450.0);
    }

    @Test
    void unknownLayoutIsANormalizationFailure() throws Exception {
        when(transport.execute(any(), anyString())).thenReturn(new UpstreamResponse(200, "{\"hello\": \"world\"}"));

        assertThatThrownBy(() -> client.fetch(req("LT"))).isInstanceOf(NormalizationException.class);
    }

    @Test
    void bulkFetchStopsAfterAFatalError() throws Exception {
        when(transport.execute(argThat(r -> r != null && r.symbol().equals("AAA")), anyString()))
                .thenReturn(new UpstreamResponse(401, "nope"));

        List<UpstreamRequest> requests = List.of(req("AAA"), req("BBB"), req("CCC"));
        Map<UpstreamRequest, FetchOutcome> out = client.fetchBulk(requests, 1);

        assertThat(out.keySet()).containsExactlyElementsOf(requests);
        assertThat(out.get(requests.get(0)).error()).isInstanceOf(AuthenticationException.class);
        assertThat(out.get(requests.get(1)).isSkipped()).isTrue();
        assertThat(out.get(requests.get(2)).isSkipped()).isTrue();
        verify(transport, never()).execute(argThat(r -> r != null && !r.symbol().equals("AAA")), anyString());
    }

    @Test
    void bulkFetchIsolatesPerSymbolFailures() throws Exception {
        when(transport.execute(any(), anyString())).thenAnswer(inv -> {
            UpstreamRequest r = inv.getArgument(0);
            return r.symbol().equals("BBB") ? new UpstreamResponse(404, "gone") : new UpstreamResponse(200, FLAT);
        });

        List<UpstreamRequest> requests = List.of(req("AAA"), req("BBB"), req("CCC"));
        Map<UpstreamRequest, FetchOutcome> out = client.fetchBulk(requests, 3);

        assertThat(out.get(requests.get(0)).isSuccess()).isTrue();
        assertThat(out.get(requests.get(1)).error()).isInstanceOf(UpstreamCallException.class);
        assertThat(out.get(requests.get(2)).isSuccess()).isTrue();
    }

    @Test
    void duplicateRequestsInABulkFetchAreFetchedOnce() throws Exception {
        when(transport.execute(any(), anyString())).thenReturn(new UpstreamResponse(200, FLAT));

        Map<UpstreamRequest, FetchOutcome> out = client.fetchBulk(List.of(req("AAA"), req("AAA"), req("BBB")), 2);

        assertThat(out).hasSize(2);
        verify(transport, times(2)).execute(any(), anyString());
    }
}
