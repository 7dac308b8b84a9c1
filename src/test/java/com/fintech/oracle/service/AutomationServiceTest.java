package com.fintech.oracle.service;

import com.fintech.oracle.dispatch.ActionDispatcher;
import com.fintech.oracle.domain.Trigger;
import com.fintech.oracle.domain.TriggerRequest;
import com.fintech.oracle.exception.InvalidScheduleException;
import com.fintech.oracle.exception.TriggerNotFoundException;
import com.fintech.oracle.trigger.ScheduleRunner;
import com.fintech.oracle.trigger.TriggerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("AutomationService Tests")
class AutomationServiceTest {

    private TriggerRegistry registry;
    private ScheduleRunner scheduleRunner;
    private ActionDispatcher dispatcher;
    private AutomationService service;

    @BeforeEach
    void setUp() {
        registry = new TriggerRegistry();
        scheduleRunner = mock(ScheduleRunner.class);
        dispatcher = mock(ActionDispatcher.class);
        service = new AutomationService(registry, scheduleRunner, dispatcher);
    }

    @Test
    @DisplayName("Creating a schedule trigger registers and schedules it")
    void testCreateSchedule() {
        Trigger trigger = service.createTrigger(TriggerRequest.schedule("s1", "alice", "0 9 * * *", "fn-1", Map.of()));

        assertThat(service.getTrigger("s1")).isEqualTo(trigger);
        verify(scheduleRunner).schedule(trigger);
    }

    @Test
    @DisplayName("Creating a price alert does not touch the schedule runner")
    void testCreatePriceAlert() {
        service.createTrigger(TriggerRequest.priceAlert("p1", "alice", "NEO above 10", "fn-1", Map.of()));

        verifyNoInteractions(scheduleRunner);
        assertThat(registry.alertsFor("NEO")).hasSize(1);
    }

    @Test
    @DisplayName("Invalid trigger is neither registered nor scheduled")
    void testCreateInvalid() {
        assertThatThrownBy(() -> service.createTrigger(TriggerRequest.schedule("s1", "alice", "bad", "fn-1", null)))
            .isInstanceOf(InvalidScheduleException.class);

        assertThat(service.listTriggers()).isEmpty();
        verifyNoInteractions(scheduleRunner);
    }

    @Test
    @DisplayName("Delete unschedules and unregisters")
    void testDelete() {
        service.createTrigger(TriggerRequest.schedule("s1", "alice", "0 9 * * *", "fn-1", null));

        service.deleteTrigger("s1");

        verify(scheduleRunner).unschedule("s1");
        assertThatThrownBy(() -> service.getTrigger("s1")).isInstanceOf(TriggerNotFoundException.class);
        assertThatThrownBy(() -> service.deleteTrigger("s1")).isInstanceOf(TriggerNotFoundException.class);
    }

    @Test
    @DisplayName("List by owner returns only that owner's triggers")
    void testListByOwner() {
        service.createTrigger(TriggerRequest.priceAlert("a", "alice", "NEO above 10", "fn", null));
        service.createTrigger(TriggerRequest.priceAlert("b", "bob", "GAS below 5", "fn", null));

        assertThat(service.listTriggersByOwner("bob")).extracting(Trigger::id).containsExactly("b");
        assertThat(service.listTriggers()).hasSize(2);
    }

    @Test
    @DisplayName("Manual execution dispatches the trigger")
    void testExecuteTrigger() {
        Trigger trigger = service.createTrigger(TriggerRequest.priceAlert("a", "alice", "NEO above 10", "fn", null));
        when(dispatcher.dispatch(trigger)).thenReturn(true);

        assertThat(service.executeTrigger("a")).isTrue();
        verify(dispatcher).dispatch(trigger);
        assertThatThrownBy(() -> service.executeTrigger("missing")).isInstanceOf(TriggerNotFoundException.class);
        verify(dispatcher, never()).dispatch(any(Trigger.class), any());
    }
}
