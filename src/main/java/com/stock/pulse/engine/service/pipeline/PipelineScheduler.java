package com.stock.pulse.engine.service.pipeline;

import com.stock.pulse.engine.common.Result;
import com.stock.pulse.engine.common.constants.PipelineConsts;
import com.stock.pulse.engine.common.constants.PipelineProperties;
import com.stock.pulse.engine.common.constants.UpstreamProperties;
import com.stock.pulse.engine.common.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodic trigger for full-universe extractions.
 * <p>
 * A tick that finds a job still running is skipped, never queued.
 * Config (application.yml):
 * stockpulse.pipeline.scheduler-interval-minutes: 15   # 5..1440
 * stockpulse.pipeline.auto-start: true                 # only with credentials present
 */
@Slf4j
@Service
public class PipelineScheduler {

    public static final String SCHEDULED_TYPE = "scheduled";

    private final PipelineService pipeline;
    private final PipelineEventLog events;
    private final PipelineMetricsTracker metrics;
    private final TaskScheduler taskScheduler;
    private final PipelineProperties props;
    private final UpstreamProperties upstream;
    private final Clock clock;

    private ScheduledFuture<?> future;
    private int intervalMinutes;
    private volatile Instant nextRunAt;
    private volatile Instant lastTickAt;

    public PipelineScheduler(PipelineService pipeline,
                             PipelineEventLog events,
                             PipelineMetricsTracker metrics,
                             TaskScheduler taskScheduler,
                             PipelineProperties props,
                             UpstreamProperties upstream,
                             Clock clock) {
        this.pipeline = pipeline;
        this.events = events;
        this.metrics = metrics;
        this.taskScheduler = taskScheduler;
        this.props = props;
        this.upstream = upstream;
        this.clock = clock;
        this.intervalMinutes = props.getSchedulerIntervalMinutes();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void autoStart() {
        if (!props.isAutoStart()) {
            log.info("Scheduler auto-start disabled");
            return;
        }
        if (!upstream.hasCredentials()) {
            log.warn("Scheduler not started: upstream credentials missing");
            return;
        }
        try {
            start(props.getSchedulerIntervalMinutes());
        } catch (ValidationException e) {
            log.warn("Scheduler not started: {}", e.getMessage());
        }
    }

    /**
     * Starts (or restarts) the periodic trigger; the first run fires one interval from now.
     */
    public synchronized SchedulerState start(int minutes) {
        validate(minutes);
        cancel();
        intervalMinutes = minutes;
        Duration period = Duration.ofMinutes(minutes);
        Instant first = clock.instant().plus(period);
        future = taskScheduler.scheduleAtFixedRate(this::tick, first, period);
        setNextRun(first);
        pipeline.markScheduled(true);
        events.log(PipelineConsts.Events.SCHEDULER_STARTED, Map.of("interval_minutes", minutes));
        return state();
    }

    public synchronized SchedulerState stop() {
        boolean wasRunning = cancel();
        pipeline.markScheduled(false);
        setNextRun(null);
        if (wasRunning) events.log(PipelineConsts.Events.SCHEDULER_STOPPED, Map.of());
        return state();
    }

    /**
     * Changes the interval. A stopped scheduler only remembers it for the next start.
     */
    public synchronized SchedulerState reconfigure(int minutes) {
        validate(minutes);
        int previous = intervalMinutes;
        boolean running = isRunning();
        if (running) {
            start(minutes);
        } else {
            intervalMinutes = minutes;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("previous_minutes", previous);
        data.put("interval_minutes", minutes);
        data.put("running", running);
        events.log(PipelineConsts.Events.SCHEDULER_RECONFIGURED, data);
        return state();
    }

    /**
     * Applies whichever settings are given. {@code autoStart} takes effect at the next application start.
     */
    public synchronized SchedulerState configure(Integer minutes, Boolean autoStart) {
        if (minutes != null) reconfigure(minutes);
        if (autoStart != null) props.setAutoStart(autoStart);
        return state();
    }

    public boolean isAutoStart() {
        return props.isAutoStart();
    }

    /**
     * One scheduled firing. Public so the trigger can also be exercised directly.
     */
    public void tick() {
        lastTickAt = clock.instant();
        synchronized (this) {
            if (isRunning()) setNextRun(lastTickAt.plus(Duration.ofMinutes(intervalMinutes)));
        }
        try {
            if (pipeline.isJobRunning()) {
                log.info("Scheduled run skipped: a job is still running");
                events.log(PipelineConsts.Events.SCHEDULER_SKIPPED, Map.of("reason", "job_running"));
                return;
            }
            Result<JobSnapshot> r = pipeline.trigger(null, SCHEDULED_TYPE);
            if (!r.isOk()) {
                events.log(PipelineConsts.Events.SCHEDULER_SKIPPED, Map.of("reason", String.valueOf(r.getError())));
            }
        } catch (RuntimeException e) {
            log.error("Scheduled run failed", e);
            events.log(PipelineConsts.Events.SCHEDULER_ERROR, Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    public synchronized boolean isRunning() {
        return future != null && !future.isCancelled();
    }

    public synchronized SchedulerState state() {
        return new SchedulerState(isRunning(), intervalMinutes, props.isAutoStart(), nextRunAt, lastTickAt);
    }

    private boolean cancel() {
        if (future == null) return false;
        boolean was = !future.isCancelled();
        future.cancel(false);
        future = null;
        return was;
    }

    private void setNextRun(Instant next) {
        nextRunAt = next;
        metrics.setNextScheduledRun(next);
    }

    private static void validate(int minutes) {
        if (minutes < PipelineConsts.Scheduler.MIN_INTERVAL_MINUTES || minutes > PipelineConsts.Scheduler.MAX_INTERVAL_MINUTES) {
            throw new ValidationException("Interval must be between " + PipelineConsts.Scheduler.MIN_INTERVAL_MINUTES
                    + " and " + PipelineConsts.Scheduler.MAX_INTERVAL_MINUTES + " minutes, got " + minutes);
        }
    }

    public record SchedulerState(boolean running, int intervalMinutes, boolean autoStart, Instant nextRunAt,
                                 Instant lastTickAt) {
    }
}
