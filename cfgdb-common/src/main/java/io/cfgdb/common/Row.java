package io.cfgdb.common;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Typed value of a table row: column name to either a scalar string or an ordered list of strings.
 *
 * <p>An empty row is a valid, existing entry. It is distinct from "no entry", which callers
 * express with {@code null} on write paths.
 */
public record Row(Map<String, FieldValue> fields) {

    private static final Row EMPTY = new Row(Map.of());

    public Row {
        Objects.requireNonNull(fields, "fields must not be null");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Row empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a row from loosely typed values. {@link List} values become list columns, anything
     * else is stringified.
     */
    public static Row of(Map<String, ?> values) {
        Builder builder = builder();
        values.forEach(builder::put);
        return builder.build();
    }

    public Optional<FieldValue> get(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public Optional<String> scalar(String name) {
        FieldValue value = fields.get(name);
        if (value instanceof FieldValue.Scalar scalar) {
            return Optional.of(scalar.value());
        }
        return Optional.empty();
    }

    public Optional<List<String>> list(String name) {
        FieldValue value = fields.get(name);
        if (value instanceof FieldValue.Values list) {
            return Optional.of(list.values());
        }
        return Optional.empty();
    }

    public boolean contains(String name) {
        return fields.containsKey(name);
    }

    public Set<String> names() {
        return fields.keySet();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public int size() {
        return fields.size();
    }

    @Override
    public String toString() {
        return fields.toString();
    }

    public static final class Builder {
        private final Map<String, FieldValue> fields = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(String name, Object value) {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(value, "value must not be null");
            if (value instanceof FieldValue fieldValue) {
                fields.put(name, fieldValue);
            } else if (value instanceof List<?> list) {
                putList(name, list);
            } else {
                fields.put(name, FieldValue.of(String.valueOf(value)));
            }
            return this;
        }

        public Builder putList(String name, List<?> values) {
            Objects.requireNonNull(name, "name must not be null");
            fields.put(name, FieldValue.of(values.stream().map(v -> String.valueOf(v)).toList()));
            return this;
        }

        public Row build() {
            return new Row(fields);
        }
    }
}
