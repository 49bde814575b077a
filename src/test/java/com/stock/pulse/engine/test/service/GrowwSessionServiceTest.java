package com.stock.pulse.engine.test.service;

import com.stock.pulse.engine.common.constants.UpstreamProperties;
import com.stock.pulse.engine.common.exception.AuthenticationException;
import com.stock.pulse.engine.common.exception.TransientNetworkException;
import com.stock.pulse.engine.service.upstream.GrowwAuthClient;
import com.stock.pulse.engine.service.upstream.GrowwSessionService;
import com.stock.pulse.engine.service.upstream.IssuedToken;
import com.stock.pulse.engine.test.TestClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GrowwSessionServiceTest {

    private static final Instant T0 = Instant.parse("2024-06-14T03:45:00Z");

    private TestClock clock;
    private UpstreamProperties props;
    private GrowwAuthClient auth;
    private GrowwSessionService session;

    @BeforeEach
    void setUp() {
        clock = new TestClock(T0);
        props = new UpstreamProperties();
        props.setRefreshBackoff(Duration.ZERO);
        auth = mock(GrowwAuthClient.class);
        session = new GrowwSessionService(auth, props, clock);
    }

    @Test
    void tokenIsReusedUntilItExpires() {
        when(auth.exchange())
                .thenReturn(new IssuedToken("t1", T0.plus(Duration.ofHours(1))))
                .thenReturn(new IssuedToken("t2", T0.plus(Duration.ofHours(3))));

        assertThat(session.getValidToken()).isEqualTo("t1");
        assertThat(session.getValidToken()).isEqualTo("t1");
        verify(auth, times(1)).exchange();

        // inside the expiry skew counts as expired
        clock.advance(Duration.ofMinutes(59).plusSeconds(45));
        assertThat(session.getValidToken()).isEqualTo("t2");
        verify(auth, times(2)).exchange();
        assertThat(session.sessionInfo().refreshCount()).isEqualTo(2);
    }

    @Test
    void concurrentCallersShareOneRefresh() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        when(auth.exchange()).thenAnswer(inv -> {
            calls.incrementAndGet();
            Thread.sleep(50);
            return new IssuedToken("shared", T0.plus(Duration.ofHours(8)));
        });

        int workers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<String>> results = new ArrayList<>();
        for (int i = 0; i < workers; i++) {
            Callable<String> c = () -> {
                go.await();
                return session.getValidToken();
            };
            results.add(pool.submit(c));
        }
        go.countDown();
        for (Future<String> f : results) assertThat(f.get(5, TimeUnit.SECONDS)).isEqualTo("shared");
        pool.shutdown();

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void invalidationInsideDedupWindowReusesTheFreshToken() {
        when(auth.exchange()).thenReturn(new IssuedToken("t1", T0.plus(Duration.ofHours(8))));

        session.getValidToken();
        clock.advance(Duration.ofSeconds(2));
        session.invalidate();

        assertThat(session.getValidToken()).isEqualTo("t1");
        verify(auth, times(1)).exchange();
        assertThat(session.sessionInfo().stale()).isFalse();
    }

    @Test
    void invalidationAfterDedupWindowRefreshes() {
        when(auth.exchange())
                .thenReturn(new IssuedToken("t1", T0.plus(Duration.ofHours(8))))
                .thenReturn(new IssuedToken("t2", T0.plus(Duration.ofHours(9))));

        session.getValidToken();
        clock.advance(Duration.ofMinutes(10));
        session.invalidate();
        assertThat(session.sessionInfo().active()).isFalse();

        assertThat(session.getValidToken()).isEqualTo("t2");
        verify(auth, times(2)).exchange();
    }

    @Test
    void transientExchangeFailuresAreRetried() {
        when(auth.exchange())
                .thenThrow(new TransientNetworkException(503, "down"))
                .thenReturn(new IssuedToken("t1", T0.plus(Duration.ofHours(8))));

        assertThat(session.getValidToken()).isEqualTo("t1");
        verify(auth, times(2)).exchange();
        assertThat(session.sessionInfo().lastError()).isNull();
    }

    @Test
    void exhaustedRetriesRaiseAuthenticationFailure() {
        props.setRefreshAttempts(3);
        when(auth.exchange()).thenThrow(new TransientNetworkException(0, "no route"));

        assertThatThrownBy(() -> session.getValidToken())
                .isInstanceOf(AuthenticationException.class)
                .hasMessageContaining("3 attempts");
        verify(auth, times(3)).exchange();
        assertThat(session.sessionInfo().lastError()).isEqualTo("no route");
    }

    @Test
    void rejectedCredentialsAreNotRetried() {
        when(auth.exchange()).thenThrow(new AuthenticationException("Token exchange rejected: HTTP 401"));

        assertThatThrownBy(() -> session.getValidToken()).isInstanceOf(AuthenticationException.class);
        verify(auth, times(1)).exchange();
    }
}
