package com.nutrimatch.index.filter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Constraint on a single metadata field. The set of constraint kinds is closed:
 * the only subclasses are the nested ones, and {@link MetadataMatcher} handles
 * each {@link Kind} explicitly.
 */
public abstract class FieldConstraint {

    public enum Kind {
        EQUALS,
        IN,
        CONTAINS,
        NOT_CONTAINS
    }

    private FieldConstraint() {}

    public abstract Kind kind();

    public static FieldConstraint equalTo(Object value) {
        return new Equals(value);
    }

    public static FieldConstraint in(Collection<?> values) {
        return new In(values);
    }

    public static FieldConstraint contains(Object value) {
        return new Contains(value);
    }

    public static FieldConstraint notContains(Collection<?> values) {
        return new NotContains(values);
    }

    private static List<Object> withoutNulls(Collection<?> values) {
        Objects.requireNonNull(values, "values");
        List<Object> copy = new ArrayList<>();
        for (Object value : values) {
            if (value != null) {
                copy.add(value);
            }
        }
        return Collections.unmodifiableList(copy);
    }

    /**
     * Field must equal the value.
     */
    public static final class Equals extends FieldConstraint {
        private final Object value;

        private Equals(Object value) {
            this.value = value;
        }

        public Object value() {
            return value;
        }

        @Override
        public Kind kind() {
            return Kind.EQUALS;
        }

        @Override
        public String toString() {
            return "Equals(" + value + ")";
        }
    }

    /**
     * Field (scalar or collection) must share at least one value with the list.
     */
    public static final class In extends FieldConstraint {
        private final List<Object> values;

        private In(Collection<?> values) {
            this.values = withoutNulls(values);
        }

        public List<Object> values() {
            return values;
        }

        @Override
        public Kind kind() {
            return Kind.IN;
        }

        @Override
        public String toString() {
            return "In" + values;
        }
    }

    /**
     * Value must be an element of a collection field or a substring of a string field.
     */
    public static final class Contains extends FieldConstraint {
        private final Object value;

        private Contains(Object value) {
            this.value = value;
        }

        public Object value() {
            return value;
        }

        @Override
        public Kind kind() {
            return Kind.CONTAINS;
        }

        @Override
        public String toString() {
            return "Contains(" + value + ")";
        }
    }

    /**
     * None of the values may appear in the field, using the same rule as {@link Contains}.
     */
    public static final class NotContains extends FieldConstraint {
        private final List<Object> values;

        private NotContains(Collection<?> values) {
            this.values = withoutNulls(values);
        }

        public List<Object> values() {
            return values;
        }

        @Override
        public Kind kind() {
            return Kind.NOT_CONTAINS;
        }

        @Override
        public String toString() {
            return "NotContains" + values;
        }
    }
}
