package com.flowauto.validate;

import com.flowauto.node.ConditionType;
import com.flowauto.node.NodeKind;
import com.flowauto.validate.ValidationError.Code;

import java.util.*;

/**
 * Shape rules for node data, per node kind.
 *
 * <p>
 * Only known fields are checked. Unknown fields pass through untouched so newer
 * platform options survive a round trip.
 */
public final class NodeDataSchema {

    /** Accepted value shapes. */
    enum FieldType {
        STRING, BOOLEAN, NUMBER_OR_STRING, STRING_OR_LIST, MAP, LIST_OF_MAPS, DURATION
    }

    private static final Set<String> WEEKDAYS = Set.of("mon", "tue", "wed", "thu", "fri", "sat", "sun");
    private static final Set<String> DURATION_KEYS = Set.of("hours", "minutes", "seconds", "milliseconds", "days");

    private static final Map<String, FieldType> TRIGGER_FIELDS = fields(
            "alias", FieldType.STRING,
            "platform", FieldType.STRING,
            "trigger", FieldType.STRING,
            "entity_id", FieldType.STRING_OR_LIST,
            "from", FieldType.STRING_OR_LIST,
            "to", FieldType.STRING_OR_LIST,
            "for", FieldType.DURATION,
            "at", FieldType.STRING_OR_LIST,
            "event_type", FieldType.STRING,
            "event_data", FieldType.MAP,
            "above", FieldType.NUMBER_OR_STRING,
            "below", FieldType.NUMBER_OR_STRING,
            "value_template", FieldType.STRING,
            "template", FieldType.STRING,
            "webhook_id", FieldType.STRING,
            "zone", FieldType.STRING,
            "topic", FieldType.STRING,
            "device_id", FieldType.STRING,
            "domain", FieldType.STRING);

    private static final Map<String, FieldType> CONDITION_FIELDS = fields(
            "alias", FieldType.STRING,
            "attribute", FieldType.STRING,
            "for", FieldType.DURATION,
            "entity_id", FieldType.STRING_OR_LIST,
            "state", FieldType.STRING_OR_LIST,
            "above", FieldType.NUMBER_OR_STRING,
            "below", FieldType.NUMBER_OR_STRING,
            "value_template", FieldType.STRING,
            "template", FieldType.STRING,
            "after", FieldType.STRING,
            "before", FieldType.STRING,
            "weekday", FieldType.STRING_OR_LIST,
            "after_offset", FieldType.STRING,
            "before_offset", FieldType.STRING,
            "zone", FieldType.STRING,
            "device_id", FieldType.STRING,
            "domain", FieldType.STRING,
            "type", FieldType.STRING,
            "subtype", FieldType.STRING,
            "id", FieldType.STRING_OR_LIST);

    private static final Map<String, FieldType> ACTION_FIELDS = fields(
            "alias", FieldType.STRING,
            "service", FieldType.STRING,
            "target", FieldType.MAP,
            "data", FieldType.MAP,
            "data_template", FieldType.MAP,
            "response_variable", FieldType.STRING,
            "continue_on_error", FieldType.BOOLEAN,
            "enabled", FieldType.BOOLEAN);

    private static final Map<String, FieldType> DELAY_FIELDS = fields(
            "alias", FieldType.STRING,
            "delay", FieldType.DURATION);

    private static final Map<String, FieldType> WAIT_FIELDS = fields(
            "alias", FieldType.STRING,
            "wait_template", FieldType.STRING,
            "wait_for_trigger", FieldType.LIST_OF_MAPS,
            "timeout", FieldType.DURATION,
            "continue_on_timeout", FieldType.BOOLEAN);

    /**
     * Checks {@code data} against the rules for {@code kind}, appending problems
     * to {@code errors}. Paths are prefixed with {@code path}.
     */
    public void check(NodeKind kind, Map<String, ?> data, String path, List<ValidationError> errors) {
        switch (kind) {
            case TRIGGER -> checkFields(TRIGGER_FIELDS, data, path, errors);
            case CONDITION -> checkCondition(data, path, 0, errors);
            case ACTION -> {
                checkFields(ACTION_FIELDS, data, path, errors);
                Object service = data.get("service");
                if (service == null || (service instanceof String s && s.isEmpty()))
                    errors.add(new ValidationError(Code.REQUIRED, path + ".service", "Action requires a service"));
            }
            case DELAY -> {
                checkFields(DELAY_FIELDS, data, path, errors);
                if (data.get("delay") == null)
                    errors.add(new ValidationError(Code.REQUIRED, path + ".delay", "Delay requires a duration"));
            }
            case WAIT -> {
                checkFields(WAIT_FIELDS, data, path, errors);
                if (data.get("wait_template") == null && data.get("wait_for_trigger") == null)
                    errors.add(new ValidationError(Code.REQUIRED, path,
                            "Wait requires wait_template or wait_for_trigger"));
            }
        }
    }

    private void checkCondition(Map<String, ?> data, String path, int depth, List<ValidationError> errors) {
        Object tag = data.get("condition_type");
        if (tag == null) {
            errors.add(new ValidationError(Code.REQUIRED, path + ".condition_type", "Condition requires a condition_type"));
        } else if (!(tag instanceof String s) || ConditionType.fromWire(s) == null) {
            errors.add(new ValidationError(Code.INVALID_VALUE, path + ".condition_type",
                    "Unknown condition_type: " + tag));
        }
        checkFields(CONDITION_FIELDS, data, path, errors);

        Object weekday = data.get("weekday");
        if (weekday != null) {
            for (Object day : weekday instanceof List<?> l ? l : List.of(weekday))
                if (!WEEKDAYS.contains(day))
                    errors.add(new ValidationError(Code.INVALID_VALUE, path + ".weekday", "Unknown weekday: " + day));
        }

        Object children = data.get("conditions");
        if (children == null)
            return;
        if (!(children instanceof List<?> list)) {
            errors.add(new ValidationError(Code.INVALID_TYPE, path + ".conditions", "Expected a list"));
            return;
        }
        if (depth >= 1) {
            errors.add(new ValidationError(Code.CONDITION_TOO_DEEP, path + ".conditions",
                    "Nested conditions are limited to one level"));
            return;
        }
        for (int i = 0; i < list.size(); i++) {
            String childPath = path + ".conditions." + i;
            if (list.get(i) instanceof Map<?, ?> m)
                checkCondition(asStringMap(m), childPath, depth + 1, errors);
            else
                errors.add(new ValidationError(Code.INVALID_TYPE, childPath, "Expected a condition object"));
        }
    }

    private static void checkFields(Map<String, FieldType> rules, Map<String, ?> data, String path,
            List<ValidationError> errors) {
        for (Map.Entry<String, FieldType> rule : rules.entrySet()) {
            Object value = data.get(rule.getKey());
            if (value != null && !matches(rule.getValue(), value))
                errors.add(new ValidationError(Code.INVALID_TYPE, path + "." + rule.getKey(),
                        "Expected " + describe(rule.getValue()) + " but was " + value.getClass().getSimpleName()));
        }
    }

    static boolean matches(FieldType type, Object value) {
        return switch (type) {
            case STRING -> value instanceof String;
            case BOOLEAN -> value instanceof Boolean;
            case NUMBER_OR_STRING -> value instanceof Number || value instanceof String;
            case STRING_OR_LIST -> value instanceof String || (value instanceof List<?> l && allStrings(l));
            case MAP -> value instanceof Map;
            case LIST_OF_MAPS -> value instanceof List<?> l && l.stream().allMatch(v -> v instanceof Map);
            case DURATION -> value instanceof String || (value instanceof Map<?, ?> m && isDuration(m));
        };
    }

    private static boolean allStrings(List<?> list) {
        for (Object o : list)
            if (!(o instanceof String))
                return false;
        return true;
    }

    private static boolean isDuration(Map<?, ?> m) {
        for (Map.Entry<?, ?> e : m.entrySet())
            if (!DURATION_KEYS.contains(e.getKey()) || !(e.getValue() instanceof Number))
                return false;
        return true;
    }

    private static String describe(FieldType type) {
        return switch (type) {
            case STRING -> "a string";
            case BOOLEAN -> "a boolean";
            case NUMBER_OR_STRING -> "a number or string";
            case STRING_OR_LIST -> "a string or list of strings";
            case MAP -> "an object";
            case LIST_OF_MAPS -> "a list of objects";
            case DURATION -> "a duration string or object";
        };
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> asStringMap(Map<?, ?> m) {
        return (Map<String, ?>) m;
    }

    private static Map<String, FieldType> fields(Object... pairs) {
        Map<String, FieldType> out = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2)
            out.put((String) pairs[i], (FieldType) pairs[i + 1]);
        return Collections.unmodifiableMap(out);
    }
}
