package io.cfgdb.common;

import java.util.List;
import java.util.Objects;

public sealed interface FieldValue permits FieldValue.Scalar, FieldValue.Values {

    static FieldValue of(String value) {
        return new Scalar(value);
    }

    static FieldValue of(List<String> values) {
        return new Values(values);
    }

    record Scalar(String value) implements FieldValue {
        public Scalar {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String toString() {
            return value;
        }
    }

    record Values(List<String> values) implements FieldValue {
        public Values {
            Objects.requireNonNull(values, "values must not be null");
            values = List.copyOf(values);
        }

        @Override
        public String toString() {
            return values.toString();
        }
    }
}
