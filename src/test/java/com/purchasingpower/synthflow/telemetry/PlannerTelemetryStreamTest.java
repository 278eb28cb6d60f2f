package com.purchasingpower.synthflow.telemetry;

import com.purchasingpower.synthflow.configuration.SynthesisProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Planner Telemetry Stream Tests")
class PlannerTelemetryStreamTest {

    private PlannerTelemetryStream stream;

    @BeforeEach
    void setUp() {
        SynthesisProperties properties = new SynthesisProperties();
        properties.getPlanner().setTelemetryBufferSize(3);
        stream = new PlannerTelemetryStream(properties);
    }

    private static PlannerEvent event(long sequence, PlannerEventType type) {
        return PlannerEvent.builder().runId("run-1").sequence(sequence).type(type).build();
    }

    @Test
    @DisplayName("Subscribers receive events published after subscribing")
    void testEvents_ShouldDeliverToSubscriber() {
        // Given
        stream.publish(event(0, PlannerEventType.DECIDE));
        List<PlannerEvent> received = new ArrayList<>();
        Disposable subscription = stream.events().subscribe(received::add);

        // When
        stream.publish(event(1, PlannerEventType.PROPAGATE));
        stream.publish(event(2, PlannerEventType.SATISFIED));
        subscription.dispose();

        // Then
        assertEquals(2, received.size(), "event before subscribing is not replayed");
        assertEquals(PlannerEventType.PROPAGATE, received.get(0).getType());
    }

    @Test
    @DisplayName("Recent window is bounded and keeps the newest events")
    void testRecentEvents_ShouldKeepBoundedWindow() {
        for (long i = 0; i < 5; i++) {
            stream.publish(event(i, PlannerEventType.DECIDE));
        }

        List<PlannerEvent> recent = stream.recentEvents(10);
        assertEquals(3, recent.size());
        assertEquals(2, recent.get(0).getSequence());
        assertEquals(4, recent.get(2).getSequence());

        List<PlannerEvent> lastTwo = stream.recentEvents(2);
        assertEquals(3, lastTwo.get(0).getSequence());
    }

    @Test
    @DisplayName("Negative limit is rejected with a clear message; zero returns nothing")
    void testRecentEvents_NegativeLimit_ShouldThrow() {
        stream.publish(event(0, PlannerEventType.DECIDE));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> stream.recentEvents(-1));
        assertTrue(e.getMessage().contains("limit must not be negative"), e.getMessage());
        assertTrue(stream.recentEvents(0).isEmpty());
    }

    @Test
    @DisplayName("Publishing without subscribers is not an error")
    void testPublish_NoSubscribers_ShouldBuffer() {
        stream.publish(event(0, PlannerEventType.CONFLICT));

        assertEquals(1, stream.recentEvents(5).size());
        stream.clear();
        assertTrue(stream.recentEvents(5).isEmpty());
    }

    @Test
    @DisplayName("Event text names run, sequence, type and level")
    void testToString_ShouldBeReadable() {
        PlannerEvent event = PlannerEvent.builder()
                .runId("r").sequence(7).type(PlannerEventType.LEARN).decisionLevel(2)
                .clause("¬(B=1) ∨ ¬(A=1)").build();

        assertEquals("[r#7] LEARN @2 clause=¬(B=1) ∨ ¬(A=1)", event.toString());
    }
}
