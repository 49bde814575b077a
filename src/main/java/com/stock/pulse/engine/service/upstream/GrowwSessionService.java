package com.stock.pulse.engine.service.upstream;

import com.stock.pulse.engine.common.constants.UpstreamProperties;
import com.stock.pulse.engine.common.exception.AuthenticationException;
import com.stock.pulse.engine.common.exception.TransientNetworkException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the upstream bearer session. Callers never see the session itself:
 * they ask for a valid token and report rejections through {@link #invalidate()}.
 * <p>
 * Refresh is single-flight. Workers that hit a 401 at the same time queue on one lock,
 * and whoever gets it after a refresh finished inside the dedup window reuses that token.
 */
@Slf4j
@Service
public class GrowwSessionService {

    private final GrowwAuthClient authClient;
    private final UpstreamProperties props;
    private final Clock clock;

    private final ReentrantLock refreshLock = new ReentrantLock();
    private final AtomicReference<UpstreamSession> current = new AtomicReference<>();
    private final AtomicLong refreshCount = new AtomicLong();

    private volatile Instant lastRefreshAt;
    private volatile String lastError;

    public GrowwSessionService(GrowwAuthClient authClient, UpstreamProperties props, Clock clock) {
        this.authClient = authClient;
        this.props = props;
        this.clock = clock;
    }

    /**
     * Returns a token that is neither expired nor marked stale, refreshing first when needed.
     *
     * @throws AuthenticationException when every refresh attempt failed
     */
    public String getValidToken() {
        UpstreamSession s = current.get();
        if (s != null && s.usableAt(clock.instant(), props.getExpirySkew())) return s.token();

        refreshLock.lock();
        try {
            Instant now = clock.instant();
            s = current.get();
            if (s != null && s.usableAt(now, props.getExpirySkew())) return s.token();

            if (s != null && refreshedWithin(now) && !s.expiredAt(now, props.getExpirySkew())) {
                log.debug("Reusing session refreshed at {}", lastRefreshAt);
                UpstreamSession revived = s.revived();
                current.set(revived);
                return revived.token();
            }

            UpstreamSession fresh = exchangeWithRetry();
            current.set(fresh);
            lastRefreshAt = fresh.issuedAt();
            return fresh.token();
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Marks the held token stale after the upstream rejected it.
     */
    public void invalidate() {
        UpstreamSession was = current.getAndUpdate(s -> s == null ? null : s.markedStale());
        if (was != null && !was.stale()) log.info("Upstream session invalidated");
    }

    public SessionInfo sessionInfo() {
        UpstreamSession s = current.get();
        Instant now = clock.instant();
        return new SessionInfo(
                s != null && s.usableAt(now, props.getExpirySkew()),
                s == null ? null : s.issuedAt(),
                s == null ? null : s.expiresAt(),
                s != null && s.stale(),
                lastRefreshAt,
                refreshCount.get(),
                lastError);
    }

    private boolean refreshedWithin(Instant now) {
        Instant at = lastRefreshAt;
        return at != null && Duration.between(at, now).compareTo(props.getRefreshDedupWindow()) < 0;
    }

    private UpstreamSession exchangeWithRetry() {
        int attempts = Math.max(1, props.getRefreshAttempts());
        TransientNetworkException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                IssuedToken t = authClient.exchange();
                refreshCount.incrementAndGet();
                lastError = null;
                log.info("Upstream session refreshed on attempt {}, expires at {}", attempt, t.expiresAt());
                return new UpstreamSession(t.token(), clock.instant(), t.expiresAt(), false);
            } catch (AuthenticationException e) {
                lastError = e.getMessage();
                log.error("Upstream rejected credentials: {}", e.getMessage());
                throw e;
            } catch (TransientNetworkException e) {
                last = e;
                lastError = e.getMessage();
                log.warn("Token exchange attempt {}/{} failed: {}", attempt, attempts, e.getMessage());
                if (attempt < attempts) pause(attempt);
            }
        }
        throw new AuthenticationException("Token refresh failed after " + attempts + " attempts", last);
    }

    private void pause(int attempt) {
        long ms = props.getRefreshBackoff().toMillis() * attempt;
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthenticationException("Interrupted while refreshing the upstream session", e);
        }
    }

    private record UpstreamSession(String token, Instant issuedAt, Instant expiresAt, boolean stale) {

        boolean usableAt(Instant now, Duration skew) {
            return !stale && !expiredAt(now, skew);
        }

        boolean expiredAt(Instant now, Duration skew) {
            return !now.isBefore(expiresAt.minus(skew));
        }

        UpstreamSession markedStale() {
            return stale ? this : new UpstreamSession(token, issuedAt, expiresAt, true);
        }

        UpstreamSession revived() {
            return new UpstreamSession(token, issuedAt, expiresAt, false);
        }

        @Override
        public String toString() {
            return "UpstreamSession[issuedAt=" + issuedAt + ", expiresAt=" + expiresAt + ", stale=" + stale + "]";
        }
    }

    /**
     * Observable session state. Never carries the token.
     */
    public record SessionInfo(boolean active, Instant issuedAt, Instant expiresAt, boolean stale,
                              Instant lastRefreshAt, long refreshCount, String lastError) {
    }
}
