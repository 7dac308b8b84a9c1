package com.fintech.oracle.trigger;

import com.fintech.oracle.config.OracleProperties;
import com.fintech.oracle.dispatch.ActionDispatcher;
import com.fintech.oracle.domain.Trigger;
import com.fintech.oracle.domain.TriggerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * Fires schedule triggers on their cron expressions.
 *
 * Lifecycle is Stopped, Running, Stopped. On start every registered schedule trigger is
 * scheduled on a private task scheduler. Each firing re-reads the registry, so a trigger
 * deleted after its tick was computed is skipped, and hands the trigger to the
 * {@link ActionDispatcher} without waiting for the execution. A trigger is only scheduled
 * while it is still registered.
 */
@Component
public class ScheduleRunner implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ScheduleRunner.class);

    private final TriggerRegistry registry;
    private final ActionDispatcher dispatcher;
    private final OracleProperties.Schedule config;

    private final Map<String, ScheduledFuture<?>> scheduled = new ConcurrentHashMap<>();
    private volatile boolean running;

    // Guarded by this; non-null only while running
    private ThreadPoolTaskScheduler scheduler;

    public ScheduleRunner(TriggerRegistry registry, ActionDispatcher dispatcher, OracleProperties properties) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.config = properties.getSchedule();
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(config.getPoolSize());
        scheduler.setThreadNamePrefix("schedule-runner-");
        scheduler.setRemoveOnCancelPolicy(true);
        // On shutdown only firings that are already due are still run
        scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationMillis(config.getAwaitTermination().toMillis());
        scheduler.initialize();
        running = true;

        registry.listByType(TriggerType.SCHEDULE).forEach(this::scheduleTrigger);
        log.info("Schedule runner started with {} schedule trigger(s)", scheduled.size());
    }

    /**
     * Stops accepting matches and waits, up to the configured await time, for firings that
     * are running or already due to reach the dispatcher. Matches that are not yet due are
     * dropped. Dispatched executions keep running.
     */
    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        ScheduledThreadPoolExecutor executor = scheduler.getScheduledThreadPoolExecutor();
        scheduler.shutdown();
        if (!executor.isTerminated()) {
            log.warn("Schedule runner stopped with {} due firing(s) not handed off after {}",
                     executor.getQueue().size(), config.getAwaitTermination());
        }
        scheduled.values().forEach(future -> future.cancel(false));
        scheduled.clear();
        scheduler = null;
        log.info("Schedule runner stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Adds a schedule trigger. While running the first firing is the next cron match after
     * now; while stopped the trigger is picked up from the registry on the next start.
     */
    public synchronized void schedule(Trigger trigger) {
        if (trigger.type() != TriggerType.SCHEDULE) {
            throw new IllegalArgumentException("Not a schedule trigger: " + trigger.id());
        }
        if (!running) {
            log.debug("Schedule runner stopped; {} will be scheduled on start", trigger.id());
            return;
        }
        if (registry.find(trigger.id()).isEmpty()) {
            log.debug("Not scheduling {}: no longer registered", trigger.id());
            return;
        }
        unschedule(trigger.id());
        scheduleTrigger(trigger);
    }

    /** Cancels future firings of a trigger. Returns false if it was not scheduled. */
    public synchronized boolean unschedule(String triggerId) {
        ScheduledFuture<?> future = scheduled.remove(triggerId);
        if (future == null) {
            return false;
        }
        future.cancel(false);
        log.debug("Unscheduled trigger {}", triggerId);
        return true;
    }

    public boolean isScheduled(String triggerId) {
        return scheduled.containsKey(triggerId);
    }

    public int scheduledCount() {
        return scheduled.size();
    }

    // Caller holds the monitor and running is true
    private void scheduleTrigger(Trigger trigger) {
        String triggerId = trigger.id();
        ScheduledFuture<?> future = scheduler.schedule(() -> fire(triggerId), new CronTrigger(trigger.schedule()));
        if (future != null) {
            scheduled.put(triggerId, future);
            log.debug("Scheduled trigger {} with '{}'", triggerId, trigger.schedule());
        }
    }

    void fire(String triggerId) {
        registry.find(triggerId).ifPresentOrElse(
            trigger -> {
                log.debug("Schedule trigger fired: {}", triggerId);
                dispatcher.dispatch(trigger);
            },
            () -> log.debug("Skipping firing of removed trigger {}", triggerId));

        if (!running) {
            // Last firing during shutdown; stop the cron trigger from rescheduling
            ScheduledFuture<?> future = scheduled.get(triggerId);
            if (future != null) {
                future.cancel(false);
            }
        }
    }
}
