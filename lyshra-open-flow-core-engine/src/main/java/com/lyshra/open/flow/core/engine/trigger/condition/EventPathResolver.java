package com.lyshra.open.flow.core.engine.trigger.condition;

import com.lyshra.open.flow.core.engine.misc.LyshraOpenFlowObjectMapper;

import java.lang.reflect.Array;
import java.util.List;
import java.util.Map;

/**
 * Walks a dot-delimited path through maps, lists (numeric segments) and plain objects, which
 * are viewed through their Jackson property map.
 */
public class EventPathResolver {

    public record Resolution(boolean found, Object value) {

        static final Resolution MISSING = new Resolution(false, null);

        static Resolution of(Object value) {
            return new Resolution(true, value);
        }
    }

    public Resolution resolve(Object root, String path) {
        if (path == null || path.isEmpty()) {
            return Resolution.of(root);
        }
        Object current = root;
        for (String segment : path.split("\\.", -1)) {
            Resolution step = step(current, segment);
            if (!step.found()) {
                return Resolution.MISSING;
            }
            current = step.value();
        }
        return Resolution.of(current);
    }

    private Resolution step(Object current, String segment) {
        if (current == null || segment.isEmpty()) {
            return Resolution.MISSING;
        }
        if (current instanceof Map<?, ?> map) {
            return map.containsKey(segment) ? Resolution.of(map.get(segment)) : Resolution.MISSING;
        }
        if (current instanceof List<?> list) {
            Integer index = parseIndex(segment);
            return index != null && index < list.size() ? Resolution.of(list.get(index)) : Resolution.MISSING;
        }
        if (current.getClass().isArray()) {
            Integer index = parseIndex(segment);
            return index != null && index < Array.getLength(current) ? Resolution.of(Array.get(current, index)) : Resolution.MISSING;
        }
        if (isScalar(current)) {
            return Resolution.MISSING;
        }
        try {
            Map<?, ?> properties = LyshraOpenFlowObjectMapper.getInstance().convertValue(current, Map.class);
            return step(properties, segment);
        } catch (IllegalArgumentException e) {
            return Resolution.MISSING;
        }
    }

    private static boolean isScalar(Object value) {
        return value instanceof CharSequence || value instanceof Number || value instanceof Boolean
                || value instanceof Character || value instanceof Enum<?>;
    }

    private static Integer parseIndex(String segment) {
        try {
            int index = Integer.parseInt(segment);
            return index < 0 ? null : index;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
