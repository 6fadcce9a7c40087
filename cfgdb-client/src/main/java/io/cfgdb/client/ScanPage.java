package io.cfgdb.client;

import java.util.List;
import java.util.Objects;

public record ScanPage(String cursor, List<String> keys) {

    public static final String INITIAL_CURSOR = "0";

    public ScanPage {
        Objects.requireNonNull(cursor, "cursor must not be null");
        keys = List.copyOf(keys);
    }

    public boolean isFinished() {
        return INITIAL_CURSOR.equals(cursor);
    }
}
