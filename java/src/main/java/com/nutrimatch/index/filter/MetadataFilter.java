package com.nutrimatch.index.filter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conjunction of field constraints. An empty filter accepts every entry.
 */
public final class MetadataFilter {

    private final Map<String, FieldConstraint> constraints = new LinkedHashMap<>();

    private MetadataFilter() {}

    public static MetadataFilter none() {
        return new MetadataFilter();
    }

    public static MetadataFilter of(String field, FieldConstraint constraint) {
        return new MetadataFilter().and(field, constraint);
    }

    /**
     * Adds a constraint, replacing any earlier constraint on the same field.
     */
    public MetadataFilter and(String field, FieldConstraint constraint) {
        constraints.put(field, constraint);
        return this;
    }

    public Map<String, FieldConstraint> constraints() {
        return Collections.unmodifiableMap(constraints);
    }

    public boolean isEmpty() {
        return constraints.isEmpty();
    }

    @Override
    public String toString() {
        return "MetadataFilter" + constraints;
    }
}
