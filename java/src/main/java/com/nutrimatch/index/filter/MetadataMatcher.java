package com.nutrimatch.index.filter;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates {@link MetadataFilter}s against metadata maps.
 */
public final class MetadataMatcher {

    private MetadataMatcher() {}

    /**
     * @return true when every constraint holds; a field missing from the
     *         metadata fails its constraint
     */
    public static boolean matches(Map<String, Object> metadata, MetadataFilter filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        if (metadata == null) {
            return false;
        }
        for (Map.Entry<String, FieldConstraint> entry : filter.constraints().entrySet()) {
            if (!metadata.containsKey(entry.getKey())) {
                return false;
            }
            if (!matches(metadata.get(entry.getKey()), entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    public static boolean matches(Object fieldValue, FieldConstraint constraint) {
        switch (constraint.kind()) {
            case EQUALS:
                return Objects.equals(fieldValue, ((FieldConstraint.Equals) constraint).value());
            case IN:
                return intersects(fieldValue, ((FieldConstraint.In) constraint).values());
            case CONTAINS:
                return appearsIn(((FieldConstraint.Contains) constraint).value(), fieldValue);
            case NOT_CONTAINS:
                for (Object value : ((FieldConstraint.NotContains) constraint).values()) {
                    if (appearsIn(value, fieldValue)) {
                        return false;
                    }
                }
                return true;
            default:
                throw new IllegalStateException("Unhandled constraint kind: " + constraint.kind());
        }
    }

    private static boolean intersects(Object fieldValue, Collection<Object> values) {
        if (fieldValue instanceof Collection) {
            Collection<?> field = (Collection<?>) fieldValue;
            for (Object value : values) {
                if (field.contains(value)) {
                    return true;
                }
            }
            return false;
        }
        return values.contains(fieldValue);
    }

    private static boolean appearsIn(Object value, Object fieldValue) {
        if (fieldValue instanceof Collection) {
            return ((Collection<?>) fieldValue).contains(value);
        }
        if (fieldValue instanceof String && value instanceof String) {
            return ((String) fieldValue).contains((String) value);
        }
        return Objects.equals(fieldValue, value);
    }
}
