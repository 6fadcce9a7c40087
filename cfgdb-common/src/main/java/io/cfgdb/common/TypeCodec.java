package io.cfgdb.common;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts between typed rows and the flat field map stored in a hash.
 *
 * <p>A list column {@code F = [a, b]} is stored as field {@code F@} with value {@code a,b}. A row
 * with no columns is stored as the single field {@code NULL=NULL} so that it still exists.
 * Column names ending in {@code @}, a column named {@code NULL}, list elements containing commas
 * and empty lists do not survive a round trip; none is rejected on encode. An empty list is stored
 * as an empty string, which decodes to a list holding one empty element.
 */
public final class TypeCodec {

    public static final String LIST_SUFFIX = "@";
    public static final String LIST_DELIMITER = ",";
    public static final String NULL_FIELD = "NULL";
    public static final String NULL_VALUE = "NULL";

    private TypeCodec() {}

    public static Map<String, String> encode(Row row) {
        Objects.requireNonNull(row, "row must not be null");
        if (row.isEmpty()) {
            return Map.of(NULL_FIELD, NULL_VALUE);
        }
        Map<String, String> raw = new LinkedHashMap<>();
        row.fields().forEach((name, value) -> {
            if (value instanceof FieldValue.Values list) {
                raw.put(name + LIST_SUFFIX, String.join(LIST_DELIMITER, list.values()));
            } else {
                raw.put(name, ((FieldValue.Scalar) value).value());
            }
        });
        return raw;
    }

    public static Row decode(Map<String, String> raw) {
        Objects.requireNonNull(raw, "raw must not be null");
        Row.Builder builder = Row.builder();
        raw.forEach((field, value) -> {
            if (field.equals(NULL_FIELD)) {
                return;
            }
            if (field.endsWith(LIST_SUFFIX)) {
                builder.putList(field.substring(0, field.length() - LIST_SUFFIX.length()), splitList(value));
            } else {
                builder.put(field, value);
            }
        });
        return builder.build();
    }

    /**
     * Name of the stored field that holds the given column, as needed when deleting it.
     */
    public static String storedFieldName(String name, FieldValue value) {
        return value instanceof FieldValue.Values ? name + LIST_SUFFIX : name;
    }

    private static List<String> splitList(String value) {
        return Arrays.asList(value.split(LIST_DELIMITER, -1));
    }
}
