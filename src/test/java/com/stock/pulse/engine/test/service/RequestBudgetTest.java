package com.stock.pulse.engine.test.service;

import com.stock.pulse.engine.common.constants.UpstreamProperties;
import com.stock.pulse.engine.service.upstream.RequestBudget;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RequestBudgetTest {

    @Test
    void callsOverThePerSecondWindowWaitForTheNextOne() throws Exception {
        UpstreamProperties props = new UpstreamProperties();
        props.setRequestsPerSecond(1);
        props.setRequestsPerMinute(100);
        props.setPermitTimeout(Duration.ofSeconds(5));
        RequestBudget budget = new RequestBudget(props);

        long t0 = System.nanoTime();
        for (int i = 0; i < 3; i++) budget.acquire();
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;

        // three permits at one per second span at least two window boundaries
        assertThat(budget.waitCount()).isGreaterThanOrEqualTo(1);
        assertThat(elapsedMs).isGreaterThanOrEqualTo(900L);
    }

    @Test
    void callsWithinBudgetDoNotWait() throws Exception {
        UpstreamProperties props = new UpstreamProperties();
        props.setRequestsPerSecond(1000);
        props.setRequestsPerMinute(10_000);
        RequestBudget budget = new RequestBudget(props);

        budget.acquire();
        budget.acquire();

        assertThat(budget.waitCount()).isZero();
    }
}
