package com.purchasingpower.synthflow.telemetry;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One step of a planning run, in emission order.
 */
@Value
@Builder
public class PlannerEvent {

    String runId;

    /** Position within the run, starting at 0. */
    long sequence;

    PlannerEventType type;

    int decisionLevel;

    /** Literal decided or propagated, null for other event types. */
    String literal;

    /** Clause learned or in conflict, null for other event types. */
    String clause;

    String message;

    @Builder.Default
    Instant timestamp = Instant.now();

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder()
                .append('[').append(runId).append('#').append(sequence).append("] ")
                .append(type).append(" @").append(decisionLevel);
        if (literal != null) {
            sb.append(' ').append(literal);
        }
        if (clause != null) {
            sb.append(" clause=").append(clause);
        }
        if (message != null) {
            sb.append(" (").append(message).append(')');
        }
        return sb.toString();
    }
}
