package io.cfgdb.common;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps row keys and table names to the flat string keys of the store, using the separator of a
 * single database: {@code TABLE<sep>part1<sep>part2}.
 */
public final class KeyCodec {

    private final String separator;
    private final Pattern splitter;

    public KeyCodec(String separator) {
        Objects.requireNonNull(separator, "separator must not be null");
        if (separator.length() != 1) {
            throw new IllegalArgumentException("separator must be a single character: '" + separator + "'");
        }
        this.separator = separator;
        this.splitter = Pattern.compile(Pattern.quote(separator));
    }

    public String separator() {
        return separator;
    }

    public String serialize(RowKey key) {
        return String.join(separator, key.parts());
    }

    public RowKey deserialize(String raw) {
        Objects.requireNonNull(raw, "raw must not be null");
        return RowKey.of(Arrays.asList(splitter.split(raw, -1)));
    }

    public String tableName(String table) {
        return table.toUpperCase(Locale.ROOT);
    }

    public String hashKey(String table, RowKey key) {
        return tableName(table) + separator + serialize(key);
    }

    public String tablePattern(String table) {
        return tableName(table) + separator + "*";
    }

    /**
     * Splits a store key at the first separator. Keys without a separator are not table rows.
     */
    public Optional<TableKey> parse(String hashKey) {
        int idx = hashKey.indexOf(separator);
        if (idx < 0) {
            return Optional.empty();
        }
        return Optional.of(new TableKey(hashKey.substring(0, idx), deserialize(hashKey.substring(idx + 1))));
    }
}
