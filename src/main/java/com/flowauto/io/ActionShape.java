package com.flowauto.io;

import java.util.List;
import java.util.Map;

/**
 * The recognized forms of a step in a decompiled action list. Produced only by
 * {@link ActionShapes#parse(Map)}; everything downstream switches on the variant
 * instead of probing map keys.
 */
public sealed interface ActionShape {

    /** Pause step; {@code data} is the step as written. */
    record Delay(Map<String, Object> data) implements ActionShape {
    }

    /** Wait-for-template or wait-for-trigger step, as written. */
    record Wait(Map<String, Object> data) implements ActionShape {
    }

    /** Service call with {@code action:} already renamed to {@code service:}. */
    record ServiceCall(Map<String, Object> data) implements ActionShape {
    }

    /** {@code if/then/else}; {@code elseSteps} is null when there is no else. */
    record If(String alias, List<Object> conditions, List<Object> thenSteps, List<Object> elseSteps)
            implements ActionShape {
    }

    /** {@code choose} with its options and optional default. */
    record Choose(String alias, List<Option> options, List<Object> defaultSteps) implements ActionShape {
    }

    /** One option of a {@code choose}. */
    record Option(String alias, List<Object> conditions, List<Object> steps) {
    }

    /** {@code parallel} with one step list per branch. */
    record Parallel(List<List<Object>> branches) implements ActionShape {
    }

    /** Assignment of the program-counter variable. */
    record Transition(String alias, String value) implements ActionShape {
    }

    /** Anything else; kept verbatim. */
    record Unknown(Map<String, Object> data) implements ActionShape {
    }
}
