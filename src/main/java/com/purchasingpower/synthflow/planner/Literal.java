package com.purchasingpower.synthflow.planner;

import lombok.Value;

/**
 * The boolean variable {@code hole = value}, or its negation.
 */
@Value
public class Literal {

    String holeId;

    String value;

    boolean positive;

    public static Literal is(String holeId, String value) {
        return new Literal(holeId, value, true);
    }

    public static Literal isNot(String holeId, String value) {
        return new Literal(holeId, value, false);
    }

    public Literal negate() {
        return new Literal(holeId, value, !positive);
    }

    /**
     * Key of the underlying variable, shared by a literal and its negation.
     */
    public Variable variable() {
        return new Variable(holeId, value);
    }

    @Override
    public String toString() {
        return positive ? variable().toString() : "¬(" + variable() + ")";
    }

    /**
     * A hole paired with one candidate value. Compared field by field, so identifiers or values
     * containing {@code =} never collide.
     */
    public record Variable(String holeId, String value) {

        @Override
        public String toString() {
            return holeId + "=" + value;
        }
    }
}
