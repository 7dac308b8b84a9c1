package com.fintech.oracle.service;

import com.fintech.oracle.dispatch.ActionDispatcher;
import com.fintech.oracle.domain.Trigger;
import com.fintech.oracle.domain.TriggerRequest;
import com.fintech.oracle.domain.TriggerType;
import com.fintech.oracle.exception.TriggerNotFoundException;
import com.fintech.oracle.trigger.ScheduleRunner;
import com.fintech.oracle.trigger.TriggerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Management operations for triggers.
 *
 * Keeps the registry and the schedule runner in step: schedule triggers are scheduled after
 * they are registered and unscheduled after they are removed.
 */
@Service
public class AutomationService {

    private static final Logger log = LoggerFactory.getLogger(AutomationService.class);

    private final TriggerRegistry registry;
    private final ScheduleRunner scheduleRunner;
    private final ActionDispatcher dispatcher;

    public AutomationService(TriggerRegistry registry, ScheduleRunner scheduleRunner, ActionDispatcher dispatcher) {
        this.registry = registry;
        this.scheduleRunner = scheduleRunner;
        this.dispatcher = dispatcher;
    }

    public Trigger createTrigger(TriggerRequest request) {
        Trigger trigger = registry.create(request);
        if (trigger.type() == TriggerType.SCHEDULE) {
            scheduleRunner.schedule(trigger);
        }
        return trigger;
    }

    /**
     * @throws TriggerNotFoundException if no trigger has this id
     */
    public void deleteTrigger(String id) {
        // Unschedule after removal; schedule() skips triggers that are no longer registered
        registry.delete(id);
        scheduleRunner.unschedule(id);
    }

    public Trigger getTrigger(String id) {
        return registry.get(id);
    }

    public List<Trigger> listTriggers() {
        return registry.list();
    }

    public List<Trigger> listTriggersByOwner(String ownerId) {
        return registry.listByOwner(ownerId);
    }

    /**
     * Dispatches a trigger's function immediately, outside its schedule or condition.
     *
     * @return false if the dispatch queue rejected the execution
     * @throws TriggerNotFoundException if no trigger has this id
     */
    public boolean executeTrigger(String id) {
        Trigger trigger = registry.get(id);
        log.info("Manual execution requested: trigger={}, function={}", id, trigger.functionId());
        return dispatcher.dispatch(trigger);
    }
}
