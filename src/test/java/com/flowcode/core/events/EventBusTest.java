package com.flowcode.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static FlowcodeEvent event(String type, String taskId) {
        return FlowcodeEvent.of(type, taskId, null, Map.of());
    }

    // -- Subscribe and publish tests ------------------------------------------

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to task subscriber")
        void deliversEventToTaskSubscriber() {
            List<FlowcodeEvent> received = new ArrayList<>();
            eventBus.subscribe("FLOW-0001-0001", received::add);

            var event = FlowcodeEvent.of("step.started", "FLOW-0001-0001", "STEP-001", Map.of("n", 1));
            eventBus.publish(event);

            assertEquals(List.of(event), received);
        }

        @Test
        @DisplayName("does not deliver event to subscribers of a different task")
        void doesNotDeliverToDifferentTask() {
            List<FlowcodeEvent> received = new ArrayList<>();
            eventBus.subscribe("FLOW-0001-0002", received::add);

            eventBus.publish(event("step.started", "FLOW-0001-0001"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("delivers multiple events in order")
        void deliversMultipleEventsInOrder() {
            List<FlowcodeEvent> received = new ArrayList<>();
            eventBus.subscribe("FLOW-0001-0001", received::add);

            eventBus.publish(event("task.planned", "FLOW-0001-0001"));
            eventBus.publish(event("step.started", "FLOW-0001-0001"));
            eventBus.publish(event("step.completed", "FLOW-0001-0001"));

            assertEquals(List.of("task.planned", "step.started", "step.completed"),
                    received.stream().map(FlowcodeEvent::eventType).toList());
        }

        @Test
        @DisplayName("events without a task reach only global subscribers")
        void taskLessEvents() {
            List<FlowcodeEvent> task = new ArrayList<>();
            List<FlowcodeEvent> global = new ArrayList<>();
            eventBus.subscribe("FLOW-0001-0001", task::add);
            eventBus.subscribeAll(global::add);

            eventBus.publish(event("state.saved", null));

            assertTrue(task.isEmpty());
            assertEquals(1, global.size());
        }
    }

    // -- Filter tests ---------------------------------------------------------

    @Nested
    @DisplayName("filters")
    class FilterTests {

        @Test
        @DisplayName("a filtered listener sees only matching events")
        void filteredListener() {
            List<FlowcodeEvent> approvals = new ArrayList<>();
            eventBus.subscribe(e -> "approval".equals(e.category()), approvals::add);

            eventBus.publish(event("step.started", "FLOW-0001-0001"));
            eventBus.publish(event("approval.requested", "FLOW-0001-0001"));
            eventBus.publish(event("approval.resolved", "FLOW-0001-0002"));

            assertEquals(List.of("approval.requested", "approval.resolved"),
                    approvals.stream().map(FlowcodeEvent::eventType).toList());
        }

        @Test
        @DisplayName("events expose their category and whether they end a task")
        void eventHelpers() {
            var completed = event("task.completed", "FLOW-0001-0001");
            var stepFailed = event("step.failed", "FLOW-0001-0001");

            assertEquals("task", completed.category());
            assertEquals("step", stepFailed.category());
            assertTrue(completed.isTaskOutcome());
            assertTrue(event("task.cancelled", "FLOW-0001-0001").isTaskOutcome());
            assertFalse(event("task.paused", "FLOW-0001-0001").isTaskOutcome());
            assertFalse(stepFailed.isTaskOutcome());
            assertTrue(completed.belongsTo("FLOW-0001-0001"));
            assertFalse(event("state.saved", null).belongsTo("FLOW-0001-0001"));
        }
    }

    // -- Unsubscribe tests ----------------------------------------------------

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("unsubscribing stops delivery of future events")
        void unsubscribeStopsDelivery() {
            List<FlowcodeEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("FLOW-0001-0001", received::add);

            eventBus.publish(event("step.started", "FLOW-0001-0001"));
            subscription.unsubscribe();
            eventBus.publish(event("step.completed", "FLOW-0001-0001"));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("unsubscribing global subscription stops delivery")
        void unsubscribeGlobalStopsDelivery() {
            List<FlowcodeEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribeAll(received::add);

            eventBus.publish(event("task.planned", "FLOW-0001-0001"));
            subscription.unsubscribe();
            eventBus.publish(event("task.planned", "FLOW-0001-0002"));

            assertEquals(1, received.size());
        }
    }

    @Test
    @DisplayName("unsubscribing removes only that registration of a shared consumer")
    void unsubscribeRemovesOneRegistration() {
        List<FlowcodeEvent> received = new ArrayList<>();
        Consumer<FlowcodeEvent> consumer = received::add;
        EventBus.Subscription first = eventBus.subscribe("FLOW-0001-0001", consumer);
        eventBus.subscribeAll(consumer);
        assertEquals(2, eventBus.listenerCount());

        first.unsubscribe();
        first.unsubscribe();
        eventBus.publish(event("step.started", "FLOW-0001-0001"));

        assertEquals(1, eventBus.listenerCount());
        assertEquals(1, received.size());
    }

    // -- Concurrency tests ----------------------------------------------------

    @Test
    @DisplayName("handles concurrent publishes safely")
    void handlesConcurrentPublishes() throws InterruptedException {
        CopyOnWriteArrayList<FlowcodeEvent> received = new CopyOnWriteArrayList<>();
        eventBus.subscribe("FLOW-0001-0001", received::add);

        int threadCount = 8;
        int eventsPerThread = 50;
        CountDownLatch latch = new CountDownLatch(threadCount);
        for (int t = 0; t < threadCount; t++) {
            new Thread(() -> {
                for (int i = 0; i < eventsPerThread; i++) {
                    eventBus.publish(event("step.progress", "FLOW-0001-0001"));
                }
                latch.countDown();
            }).start();
        }

        assertTrue(latch.await(10, TimeUnit.SECONDS));
        assertEquals(threadCount * eventsPerThread, received.size());
    }

    @Test
    @DisplayName("subscriber exception does not prevent delivery to other subscribers")
    void subscriberExceptionDoesNotPreventOthers() {
        List<FlowcodeEvent> received = new ArrayList<>();
        eventBus.subscribe("FLOW-0001-0001", e -> {
            throw new RuntimeException("boom");
        });
        eventBus.subscribe("FLOW-0001-0001", received::add);

        eventBus.publish(event("step.started", "FLOW-0001-0001"));

        assertEquals(1, received.size());
    }
}
