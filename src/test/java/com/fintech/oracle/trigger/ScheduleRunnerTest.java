package com.fintech.oracle.trigger;

import com.fintech.oracle.config.OracleProperties;
import com.fintech.oracle.dispatch.ActionDispatcher;
import com.fintech.oracle.domain.Trigger;
import com.fintech.oracle.domain.TriggerRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link ScheduleRunner} against a real task scheduler. Schedules use the six-field
 * every-second form so a firing happens within the test's wait.
 */
@DisplayName("ScheduleRunner Tests")
class ScheduleRunnerTest {

    private static final String EVERY_SECOND = "* * * * * *";

    private TriggerRegistry registry;
    private ActionDispatcher dispatcher;
    private ScheduleRunner runner;

    @BeforeEach
    void setUp() {
        registry = new TriggerRegistry();
        dispatcher = mock(ActionDispatcher.class);
        runner = new ScheduleRunner(registry, dispatcher, new OracleProperties());
    }

    @AfterEach
    void tearDown() {
        runner.stop();
    }

    @Test
    @DisplayName("Start schedules triggers already in the registry")
    void testStartPicksUpRegisteredTriggers() {
        Trigger trigger = registry.create(TriggerRequest.schedule("s1", "alice", EVERY_SECOND, "fn-1", null));

        runner.start();

        assertThat(runner.isRunning()).isTrue();
        assertThat(runner.isScheduled("s1")).isTrue();
        verify(dispatcher, timeout(3000).atLeastOnce()).dispatch(trigger);
    }

    @Test
    @DisplayName("Trigger scheduled while running fires on the next match")
    void testScheduleWhileRunning() {
        runner.start();
        Trigger trigger = registry.create(TriggerRequest.schedule("s1", "alice", EVERY_SECOND, "fn-1", null));

        runner.schedule(trigger);

        verify(dispatcher, timeout(3000).atLeastOnce()).dispatch(trigger);
    }

    @Test
    @DisplayName("Schedule while stopped is deferred to start")
    void testScheduleWhileStopped() {
        Trigger trigger = registry.create(TriggerRequest.schedule("s1", "alice", EVERY_SECOND, "fn-1", null));

        runner.schedule(trigger);

        assertThat(runner.isScheduled("s1")).isFalse();
        assertThat(runner.scheduledCount()).isZero();
        verifyNoInteractions(dispatcher);
    }

    @Test
    @DisplayName("Firing re-checks the registry and skips removed triggers")
    void testFireSkipsRemovedTrigger() {
        registry.create(TriggerRequest.schedule("s1", "alice", "0 0 1 1 *", "fn-1", null));
        runner.start();
        registry.delete("s1");

        runner.fire("s1");

        verify(dispatcher, never()).dispatch(any(Trigger.class));
    }

    @Test
    @DisplayName("Unschedule stops further firings")
    void testUnschedule() {
        Trigger trigger = registry.create(TriggerRequest.schedule("s1", "alice", "0 0 1 1 *", "fn-1", null));
        runner.start();

        assertThat(runner.unschedule(trigger.id())).isTrue();
        assertThat(runner.unschedule(trigger.id())).isFalse();
        assertThat(runner.scheduledCount()).isZero();
    }

    @Test
    @DisplayName("Stop cancels every schedule and nothing fires afterwards")
    void testStop() {
        registry.create(TriggerRequest.schedule("s1", "alice", EVERY_SECOND, "fn-1", null));
        runner.start();

        runner.stop();
        clearInvocations(dispatcher);

        assertThat(runner.isRunning()).isFalse();
        assertThat(runner.scheduledCount()).isZero();
        verify(dispatcher, after(1500).never()).dispatch(any(Trigger.class));
    }

    /**
     * <b>Given:</b> a single scheduler thread held by trigger "a"'s hand-off while trigger "b"
     * becomes due
     * <p><b>When:</b> stop is called and "a" is then released
     * <p><b>Then:</b> stop waits, and "b"'s due match still reaches the dispatcher.
     */
    @Test
    @DisplayName("Stop hands off firings that are already due")
    void testStopDeliversDueFirings() throws Exception {
        OracleProperties properties = new OracleProperties();
        properties.getSchedule().setPoolSize(1);
        runner = new ScheduleRunner(registry, dispatcher, properties);

        CountDownLatch aBlocked = new CountDownLatch(1);
        CountDownLatch releaseA = new CountDownLatch(1);
        AtomicInteger bDispatches = new AtomicInteger();
        doAnswer(inv -> {
            Trigger fired = inv.getArgument(0);
            if (fired.id().equals("a") && aBlocked.getCount() > 0) {
                aBlocked.countDown();
                releaseA.await(5, TimeUnit.SECONDS);
            } else if (fired.id().equals("b")) {
                bDispatches.incrementAndGet();
            }
            return true;
        }).when(dispatcher).dispatch(any(Trigger.class));

        registry.create(TriggerRequest.schedule("a", "alice", EVERY_SECOND, "fn-a", null));
        registry.create(TriggerRequest.schedule("b", "alice", EVERY_SECOND, "fn-b", null));
        runner.start();

        assertThat(aBlocked.await(3, TimeUnit.SECONDS)).isTrue();
        // b's next match passes while the only scheduler thread is busy
        Thread.sleep(1500);
        int beforeStop = bDispatches.get();

        CompletableFuture<Void> stopping = CompletableFuture.runAsync(runner::stop);
        Thread.sleep(200);
        assertThat(stopping).isNotDone();

        releaseA.countDown();
        stopping.get(5, TimeUnit.SECONDS);

        assertThat(bDispatches.get()).isGreaterThan(beforeStop);
        assertThat(runner.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Trigger removed from the registry is not scheduled")
    void testScheduleSkipsRemovedTrigger() {
        Trigger trigger = registry.create(TriggerRequest.schedule("s1", "alice", EVERY_SECOND, "fn-1", null));
        registry.delete("s1");
        runner.start();

        runner.schedule(trigger);

        assertThat(runner.isScheduled("s1")).isFalse();
        assertThat(runner.scheduledCount()).isZero();
        verify(dispatcher, after(1500).never()).dispatch(any(Trigger.class));
    }

    @Test
    @DisplayName("Runner can be restarted")
    void testRestart() {
        Trigger trigger = registry.create(TriggerRequest.schedule("s1", "alice", EVERY_SECOND, "fn-1", null));
        runner.start();
        runner.stop();

        runner.start();

        assertThat(runner.isScheduled("s1")).isTrue();
        verify(dispatcher, timeout(3000).atLeastOnce()).dispatch(trigger);
    }

    @Test
    @DisplayName("Price alerts cannot be scheduled")
    void testRejectsPriceAlert() {
        Trigger alert = registry.create(TriggerRequest.priceAlert("p1", "alice", "NEO above 10", "fn-1", null));

        assertThatThrownBy(() -> runner.schedule(alert)).isInstanceOf(IllegalArgumentException.class);
    }
}
