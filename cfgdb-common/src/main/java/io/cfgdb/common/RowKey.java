package io.cfgdb.common;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Logical key of a table row: a single part, or an ordered tuple of parts for multi-key tables.
 *
 * <p>Parts are joined with the database separator when stored, so a part must never contain that
 * separator. A composite key whose parts rejoin to a single token cannot be told apart from a
 * scalar key after a round trip through the store.
 */
public record RowKey(List<String> parts) {

    public RowKey {
        Objects.requireNonNull(parts, "parts must not be null");
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("parts must not be empty");
        }
        parts = List.copyOf(parts);
    }

    public static RowKey of(String key) {
        Objects.requireNonNull(key, "key must not be null");
        return new RowKey(List.of(key));
    }

    public static RowKey of(String first, String second, String... rest) {
        List<String> parts = new ArrayList<>(2 + rest.length);
        parts.add(first);
        parts.add(second);
        parts.addAll(List.of(rest));
        return new RowKey(parts);
    }

    public static RowKey of(List<String> parts) {
        return new RowKey(parts);
    }

    public boolean isComposite() {
        return parts.size() > 1;
    }

    public int size() {
        return parts.size();
    }

    public String part(int index) {
        return parts.get(index);
    }

    public String scalar() {
        if (isComposite()) {
            throw new IllegalStateException("Composite key has no scalar form: " + this);
        }
        return parts.get(0);
    }

    @Override
    public String toString() {
        if (!isComposite()) {
            return parts.get(0);
        }
        return "(" + String.join(", ", parts) + ")";
    }
}
