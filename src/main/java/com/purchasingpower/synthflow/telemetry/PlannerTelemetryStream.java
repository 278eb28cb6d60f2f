package com.purchasingpower.synthflow.telemetry;

import com.google.common.base.Preconditions;
import com.purchasingpower.synthflow.configuration.SynthesisProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Live feed of planner events for observability tooling.
 *
 * Subscribers to {@link #events()} see events emitted after they subscribe. Late subscribers can
 * catch up through {@link #recentEvents(int)}, which keeps a bounded window of the latest events
 * across all runs.
 */
@Slf4j
@Service
public class PlannerTelemetryStream {

    private final Sinks.Many<PlannerEvent> sink = Sinks.many().multicast().directBestEffort();

    private final Deque<PlannerEvent> recent = new ArrayDeque<>();

    private final int capacity;

    public PlannerTelemetryStream(SynthesisProperties properties) {
        this.capacity = properties.getPlanner().getTelemetryBufferSize();
    }

    /**
     * Publish one event. Serialized because concurrent runs share the sink.
     */
    public synchronized void publish(PlannerEvent event) {
        if (recent.size() >= capacity) {
            recent.removeFirst();
        }
        recent.addLast(event);

        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("⚠️ Dropped planner event {} ({})", event.getSequence(), result);
        }
    }

    public Flux<PlannerEvent> events() {
        return sink.asFlux();
    }

    /**
     * @return up to {@code limit} most recent events, oldest first
     * @throws IllegalArgumentException if {@code limit} is negative
     */
    public synchronized List<PlannerEvent> recentEvents(int limit) {
        Preconditions.checkArgument(limit >= 0, "limit must not be negative: %s", limit);
        List<PlannerEvent> all = new ArrayList<>(recent);
        return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
    }

    public synchronized void clear() {
        recent.clear();
    }
}
