package com.facility.snapshot.job;

import com.facility.snapshot.config.TelemetryProperties;
import com.facility.snapshot.generator.SnapshotGenerator;
import com.facility.snapshot.generator.SnapshotResult;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the single recurring snapshot job and the timer that fires it.
 *
 * <p>The job is absent, active or paused. Control operations only change which
 * future firings happen: they synchronize on a small monitor that the firing
 * thread never holds, so they return immediately even while a snapshot is being
 * written, and they never cancel a run in progress.
 *
 * <p>Firings are single-flight: the timer has one thread, and a firing that finds
 * a run still in progress is skipped.
 */
@Component
@Slf4j
public class SnapshotJobController {

    public static final String JOB_ID = "snapshot_job";

    private final SnapshotGenerator generator;
    private final TelemetryProperties properties;

    private final Object monitor = new Object();
    private final AtomicBoolean inFlight = new AtomicBoolean();

    // guarded by monitor
    private ThreadPoolTaskScheduler timer;
    private boolean registered;
    private ScheduledFuture<?> trigger; // null while paused

    public SnapshotJobController(SnapshotGenerator generator, TelemetryProperties properties) {
        this.generator = generator;
        this.properties = properties;
    }

    public JobCommandResult start() {
        synchronized (monitor) {
            if (registered) {
                return JobCommandResult.ALREADY_RUNNING;
            }
            ensureTimerRunning();
            trigger = scheduleFirings();
            registered = true;
            log.info("Snapshot job '{}' started with interval {}", JOB_ID, interval());
            return JobCommandResult.STARTED;
        }
    }

    public JobCommandResult pause() {
        synchronized (monitor) {
            if (!registered) {
                return JobCommandResult.NOT_RUNNING;
            }
            cancelTrigger();
            log.info("Snapshot job '{}' paused", JOB_ID);
            return JobCommandResult.PAUSED;
        }
    }

    public JobCommandResult resume() {
        synchronized (monitor) {
            if (!registered) {
                return JobCommandResult.NOT_RUNNING;
            }
            if (trigger != null) {
                return JobCommandResult.ALREADY_RUNNING;
            }
            trigger = scheduleFirings();
            log.info("Snapshot job '{}' resumed", JOB_ID);
            return JobCommandResult.RESUMED;
        }
    }

    public JobCommandResult stop() {
        synchronized (monitor) {
            if (!registered) {
                return JobCommandResult.NOT_RUNNING;
            }
            cancelTrigger();
            registered = false;
            log.info("Snapshot job '{}' stopped", JOB_ID);
            return JobCommandResult.STOPPED;
        }
    }

    public JobStatus status() {
        synchronized (monitor) {
            boolean timerRunning = timer != null && !timer.getScheduledExecutor().isShutdown();
            return new JobStatus(timerRunning, registered, registered ? trigger == null : null);
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startOnReady() {
        if (properties.getSnapshot().isAutoStart()) {
            log.info("Auto-start enabled: {}", start().getToken());
        }
    }

    @PreDestroy
    public void shutdown() {
        synchronized (monitor) {
            cancelTrigger();
            registered = false;
            if (timer != null) {
                timer.shutdown();
                log.info("Snapshot timer shut down");
            }
        }
    }

    /**
     * Runs one snapshot unless the previous one is still in progress.
     */
    void fire() {
        if (!inFlight.compareAndSet(false, true)) {
            log.warn("Previous snapshot run still in progress, skipping this firing");
            return;
        }
        try {
            SnapshotResult result = generator.generate();
            if (!result.isSuccess()) {
                log.warn("Snapshot execution {} recorded as failed: {}", result.executionId(), result.error());
            }
        } catch (RuntimeException e) {
            // keep the recurring trigger alive
            log.error("Snapshot run raised unexpectedly: {}", e.getMessage(), e);
        } finally {
            inFlight.set(false);
        }
    }

    /**
     * Number of firings queued on the timer. Zero when absent or paused.
     */
    int scheduledFirings() {
        synchronized (monitor) {
            return timer == null ? 0 : timer.getScheduledThreadPoolExecutor().getQueue().size();
        }
    }

    ThreadPoolTaskScheduler timer() {
        synchronized (monitor) {
            return timer;
        }
    }

    private Duration interval() {
        return properties.getSnapshot().getInterval();
    }

    private void ensureTimerRunning() {
        if (timer != null && !timer.getScheduledExecutor().isShutdown()) {
            return;
        }
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("snapshot-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        timer = scheduler;
    }

    private ScheduledFuture<?> scheduleFirings() {
        Duration interval = interval();
        return timer.scheduleAtFixedRate(this::fire, Instant.now().plus(interval), interval);
    }

    private void cancelTrigger() {
        if (trigger != null) {
            trigger.cancel(false);
            trigger = null;
        }
    }
}
