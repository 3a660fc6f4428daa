package de.mirkosertic.catalog.bitbucket.scheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ScheduledTaskRunner Tests")
class ScheduledTaskRunnerTest {

    private final TaskScheduler scheduler = new TaskScheduler();

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    @DisplayName("Should run the task repeatedly")
    void shouldRunRepeatedly() throws InterruptedException {
        final CountDownLatch threeRuns = new CountDownLatch(3);
        final TaskRunner runner = scheduler.createScheduledTaskRunner(
                new TaskScheduleDefinition(Duration.ofMillis(20), Duration.ofSeconds(5)));

        runner.run(new TaskInvocationDefinition("repeat", threeRuns::countDown));

        assertThat(threeRuns.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("Should keep scheduling after a failing run")
    void shouldSurviveFailures() throws InterruptedException {
        final AtomicInteger attempts = new AtomicInteger();
        final CountDownLatch secondRun = new CountDownLatch(2);
        final TaskRunner runner = scheduler.createScheduledTaskRunner(
                new TaskScheduleDefinition(Duration.ofMillis(20), Duration.ofSeconds(5)));

        runner.run(new TaskInvocationDefinition("failing", () -> {
            secondRun.countDown();
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("first run fails");
            }
        }));

        assertThat(secondRun.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("Should interrupt runs exceeding the timeout and continue")
    void shouldEnforceTimeout() throws InterruptedException {
        final CountDownLatch interrupted = new CountDownLatch(1);
        final CountDownLatch nextRun = new CountDownLatch(2);
        final TaskRunner runner = scheduler.createScheduledTaskRunner(
                new TaskScheduleDefinition(Duration.ofMillis(20), Duration.ofMillis(100)));

        runner.run(new TaskInvocationDefinition("slow", () -> {
            nextRun.countDown();
            if (interrupted.getCount() > 0) {
                try {
                    Thread.sleep(10_000);
                } catch (final InterruptedException e) {
                    interrupted.countDown();
                    throw e;
                }
            }
        }));

        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(nextRun.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("Should never run the same task concurrently")
    void shouldNotOverlap() throws InterruptedException {
        final AtomicInteger inFlight = new AtomicInteger();
        final AtomicInteger maxInFlight = new AtomicInteger();
        final CountDownLatch runs = new CountDownLatch(5);
        final TaskRunner runner = scheduler.createScheduledTaskRunner(
                new TaskScheduleDefinition(Duration.ofMillis(1), Duration.ofSeconds(5)));

        runner.run(new TaskInvocationDefinition("exclusive", () -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            Thread.sleep(20);
            inFlight.decrementAndGet();
            runs.countDown();
        }));

        assertThat(runs.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(maxInFlight.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject non-positive frequency and timeout")
    void shouldValidateSchedule() {
        assertThatThrownBy(() -> new TaskScheduleDefinition(Duration.ZERO, Duration.ofMinutes(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TaskScheduleDefinition(Duration.ofMinutes(1), Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new TaskScheduleDefinition(Duration.ofMinutes(1), Duration.ofMinutes(1), null).initialDelay())
                .isEqualTo(Duration.ZERO);
    }
}
