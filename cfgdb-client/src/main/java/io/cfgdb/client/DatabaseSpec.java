package io.cfgdb.client;

import io.cfgdb.common.KeyCodec;

import java.util.Objects;

public record DatabaseSpec(String name, int id, String separator) {

    public DatabaseSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(separator, "separator must not be null");
        if (id < 0) {
            throw new IllegalArgumentException("id must be non-negative");
        }
        if (separator.length() != 1) {
            throw new IllegalArgumentException("separator must be a single character");
        }
    }

    public KeyCodec keyCodec() {
        return new KeyCodec(separator);
    }

    public String keyspaceChannelPrefix() {
        return "__keyspace@" + id + "__:";
    }
}
