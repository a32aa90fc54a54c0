package com.facility.snapshot.job;

import com.facility.snapshot.config.TelemetryProperties;
import com.facility.snapshot.generator.SnapshotGenerator;
import com.facility.snapshot.generator.SnapshotResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SnapshotJobControllerTest {

    private SnapshotGenerator generator;
    private TelemetryProperties properties;
    private SnapshotJobController controller;

    @BeforeEach
    void setUp() {
        generator = mock(SnapshotGenerator.class);
        when(generator.generate()).thenReturn(SnapshotResult.success(1L, 0, 0, 1));
        properties = new TelemetryProperties();
        properties.getSnapshot().setInterval(Duration.ofSeconds(2));
        controller = new SnapshotJobController(generator, properties);
    }

    @AfterEach
    void tearDown() {
        controller.shutdown();
    }

    @Test
    void absentJob_reportsNotRunningForEveryControlExceptStart() {
        assertThat(controller.pause()).isEqualTo(JobCommandResult.NOT_RUNNING);
        assertThat(controller.resume()).isEqualTo(JobCommandResult.NOT_RUNNING);
        assertThat(controller.stop()).isEqualTo(JobCommandResult.NOT_RUNNING);

        assertThat(controller.status()).isEqualTo(new JobStatus(false, false, null));
    }

    @Test
    void startTwice_keepsOneTimerAndOneTrigger() {
        assertThat(controller.start()).isEqualTo(JobCommandResult.STARTED);
        ThreadPoolTaskScheduler timer = controller.timer();

        assertThat(controller.start()).isEqualTo(JobCommandResult.ALREADY_RUNNING);

        assertThat(controller.timer()).isSameAs(timer);
        assertThat(controller.scheduledFirings()).isEqualTo(1);
        assertThat(controller.status()).isEqualTo(new JobStatus(true, true, false));
    }

    @Test
    void activeJob_followsTheTransitionTable() {
        controller.start();

        assertThat(controller.resume()).isEqualTo(JobCommandResult.ALREADY_RUNNING);
        assertThat(controller.pause()).isEqualTo(JobCommandResult.PAUSED);
        assertThat(controller.status()).isEqualTo(new JobStatus(true, true, true));
        assertThat(controller.scheduledFirings()).isZero();
    }

    @Test
    void pausedJob_followsTheTransitionTable() {
        controller.start();
        controller.pause();

        assertThat(controller.pause()).isEqualTo(JobCommandResult.PAUSED);
        assertThat(controller.start()).isEqualTo(JobCommandResult.ALREADY_RUNNING);
        assertThat(controller.status().jobPaused()).isTrue();

        assertThat(controller.resume()).isEqualTo(JobCommandResult.RESUMED);
        assertThat(controller.status()).isEqualTo(new JobStatus(true, true, false));
        assertThat(controller.scheduledFirings()).isEqualTo(1);
    }

    @Test
    void pausedJob_canBeStopped() {
        controller.start();
        controller.pause();

        assertThat(controller.stop()).isEqualTo(JobCommandResult.STOPPED);
        assertThat(controller.status()).isEqualTo(new JobStatus(true, false, null));
    }

    @Test
    void stopTwice_returnsStoppedThenNotRunning() {
        controller.start();

        assertThat(controller.stop()).isEqualTo(JobCommandResult.STOPPED);
        assertThat(controller.stop()).isEqualTo(JobCommandResult.NOT_RUNNING);
        assertThat(controller.scheduledFirings()).isZero();
    }

    @Test
    void stoppedJob_canBeStartedAgainOnTheSameTimer() {
        controller.start();
        ThreadPoolTaskScheduler timer = controller.timer();
        controller.stop();

        assertThat(controller.start()).isEqualTo(JobCommandResult.STARTED);
        assertThat(controller.timer()).isSameAs(timer);
    }

    @Test
    void status_neverMutatesState() {
        JobStatus before = controller.status();
        controller.status();
        assertThat(controller.status()).isEqualTo(before);

        controller.start();
        JobStatus running = controller.status();
        controller.status();
        assertThat(controller.status()).isEqualTo(running);
        assertThat(controller.scheduledFirings()).isEqualTo(1);
    }

    @Test
    void startedJob_firesTheGeneratorOnItsInterval() {
        properties.getSnapshot().setInterval(Duration.ofMillis(50));

        controller.start();

        verify(generator, timeout(2_000).atLeast(3)).generate();
    }

    @Test
    void pausedJob_doesNotFire() throws Exception {
        properties.getSnapshot().setInterval(Duration.ofMillis(200));
        controller.start();
        controller.pause();

        Thread.sleep(500);

        verify(generator, never()).generate();
    }

    @Test
    void generatorException_doesNotCancelTheRecurringTrigger() {
        properties.getSnapshot().setInterval(Duration.ofMillis(50));
        when(generator.generate()).thenThrow(new IllegalStateException("boom"));

        controller.start();

        verify(generator, timeout(2_000).atLeast(3)).generate();
        assertThat(controller.status().jobExists()).isTrue();
    }

    @Test
    void controlCalls_returnPromptly_andStopDoesNotInterruptAnInFlightRun() throws Exception {
        properties.getSnapshot().setInterval(Duration.ofMillis(50));
        CountDownLatch runStarted = new CountDownLatch(1);
        CountDownLatch releaseRun = new CountDownLatch(1);
        AtomicInteger completed = new AtomicInteger();
        AtomicInteger interrupted = new AtomicInteger();
        when(generator.generate()).thenAnswer(invocation -> {
            runStarted.countDown();
            try {
                releaseRun.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                interrupted.incrementAndGet();
                Thread.currentThread().interrupt();
            }
            completed.incrementAndGet();
            return SnapshotResult.success(1L, 0, 0, 1);
        });

        controller.start();
        assertThat(runStarted.await(2, TimeUnit.SECONDS)).isTrue();

        long startNanos = System.nanoTime();
        assertThat(controller.pause()).isEqualTo(JobCommandResult.PAUSED);
        assertThat(controller.status().jobPaused()).isTrue();
        assertThat(controller.stop()).isEqualTo(JobCommandResult.STOPPED);
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos)).isLessThan(1_000);
        assertThat(completed.get()).isZero();

        releaseRun.countDown();
        verify(generator, timeout(2_000).atLeast(1)).generate();
        Thread.sleep(200);
        assertThat(completed.get()).isEqualTo(1);
        assertThat(interrupted.get()).isZero();
    }

    @Test
    void firings_areNeverConcurrent() throws Exception {
        properties.getSnapshot().setInterval(Duration.ofMillis(10));
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        when(generator.generate()).thenAnswer(invocation -> {
            int now = active.incrementAndGet();
            maxActive.accumulateAndGet(now, Math::max);
            Thread.sleep(30);
            active.decrementAndGet();
            return SnapshotResult.success(1L, 0, 0, 30);
        });

        controller.start();
        // pause/resume cycles create new triggers while a run may be in flight
        for (int i = 0; i < 10; i++) {
            Thread.sleep(15);
            controller.pause();
            controller.resume();
        }
        verify(generator, timeout(2_000).atLeast(5)).generate();

        assertThat(maxActive.get()).isEqualTo(1);
    }

    @Test
    void shutdown_stopsTheTimer() {
        controller.start();

        controller.shutdown();

        assertThat(controller.status()).isEqualTo(new JobStatus(false, false, null));
    }

    @Test
    void autoStart_registersJobWhenEnabled() {
        properties.getSnapshot().setAutoStart(true);

        controller.startOnReady();

        assertThat(controller.status().jobExists()).isTrue();
    }

    @Test
    void autoStart_disabledByDefault() {
        controller.startOnReady();

        assertThat(controller.status().jobExists()).isFalse();
        verify(generator, never()).generate();
        assertThat(controller.timer()).isNull();
    }
}
