package io.cfgdb.client;

import io.cfgdb.common.exception.StoreException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Logical database names known to a client, with their numeric ids and key separators.
 */
public final class DatabaseCatalog {

    private final Map<String, DatabaseSpec> byName;

    public DatabaseCatalog(Collection<DatabaseSpec> databases) {
        Map<String, DatabaseSpec> map = new LinkedHashMap<>();
        for (DatabaseSpec db : databases) {
            if (map.putIfAbsent(db.name(), db) != null) {
                throw new IllegalArgumentException("Duplicate database name: " + db.name());
            }
        }
        this.byName = Map.copyOf(map);
    }

    public static DatabaseCatalog defaults() {
        return new DatabaseCatalog(List.of(
            new DatabaseSpec("APPL_DB", 0, ":"),
            new DatabaseSpec("ASIC_DB", 1, ":"),
            new DatabaseSpec("COUNTERS_DB", 2, ":"),
            new DatabaseSpec("LOGLEVEL_DB", 3, ":"),
            new DatabaseSpec("CONFIG_DB", 4, "|"),
            new DatabaseSpec("PFC_WD_DB", 5, ":"),
            new DatabaseSpec("FLEX_COUNTER_DB", 5, ":"),
            new DatabaseSpec("STATE_DB", 6, "|"),
            new DatabaseSpec("SNMP_OVERLAY_DB", 7, "|")
        ));
    }

    public Optional<DatabaseSpec> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public DatabaseSpec get(String name) {
        DatabaseSpec db = byName.get(name);
        if (db == null) {
            throw new StoreException.MissingClient(name);
        }
        return db;
    }

    public Collection<DatabaseSpec> databases() {
        return byName.values();
    }
}
