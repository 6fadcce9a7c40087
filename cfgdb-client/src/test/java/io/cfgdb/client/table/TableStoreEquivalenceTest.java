package io.cfgdb.client.table;

import io.cfgdb.client.ConnectionRegistry;
import io.cfgdb.client.DatabaseSpec;
import io.cfgdb.client.InMemoryStore;
import io.cfgdb.client.StoreClientConfig;
import io.cfgdb.common.Row;
import io.cfgdb.common.RowKey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class TableStoreEquivalenceTest {

    private static final DatabaseSpec CONFIG_DB = new DatabaseSpec("CONFIG_DB", 4, "|");
    private static final List<String> TABLES = List.of("PORT", "VLAN", "VLAN_MEMBER", "ACL_RULE");

    private static TableStore open(boolean pipelined) {
        ConnectionRegistry registry = new ConnectionRegistry(new InMemoryStore(), StoreClientConfig.defaults());
        registry.connect(CONFIG_DB, false);
        return pipelined ? new PipelinedTableStore(registry, CONFIG_DB, 3) : new DirectTableStore(registry, CONFIG_DB);
    }

    private static Map<String, Map<RowKey, Row>> randomSnapshot(Random random) {
        Map<String, Map<RowKey, Row>> config = new HashMap<>();
        for (String table : TABLES) {
            int choice = random.nextInt(4);
            if (choice == 0) {
                continue;
            }
            if (choice == 1) {
                config.put(table, null);
                continue;
            }
            Map<RowKey, Row> rows = new HashMap<>();
            int count = random.nextInt(8);
            for (int i = 0; i < count; i++) {
                RowKey key = table.equals("VLAN_MEMBER")
                    ? RowKey.of("Vlan" + random.nextInt(3), "Ethernet" + random.nextInt(5))
                    : RowKey.of("k" + random.nextInt(10));
                rows.put(key, random.nextInt(5) == 0 ? null : randomRow(random));
            }
            config.put(table, rows);
        }
        return config;
    }

    private static Row randomRow(Random random) {
        Row.Builder builder = Row.builder();
        int fields = random.nextInt(4);
        for (int i = 0; i < fields; i++) {
            String name = "f" + random.nextInt(5);
            if (random.nextBoolean()) {
                builder.putList(name, List.of("v" + random.nextInt(3), "w" + random.nextInt(3)));
            } else {
                builder.put(name, "v" + random.nextInt(100));
            }
        }
        return builder.build();
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 7L, 42L, 1234L, 99999L})
    void strategiesProduceIdenticalSnapshots(long seed) {
        Random random = new Random(seed);
        TableStore direct = open(false);
        TableStore pipelined = open(true);

        for (int step = 0; step < 20; step++) {
            Map<String, Map<RowKey, Row>> snapshot = randomSnapshot(random);
            direct.modConfig(snapshot);
            pipelined.modConfig(snapshot);

            assertThat(pipelined.getConfig()).isEqualTo(direct.getConfig());
        }
    }

    @Test
    void sameTableWrittenAndDeletedUnderDifferentCase() {
        Map<RowKey, Row> rows = Map.of(
            RowKey.of("Ethernet0"), Row.builder().put("mtu", "9100").build(),
            RowKey.of("Ethernet4"), Row.builder().put("mtu", "1500").build());
        Map<String, Map<RowKey, Row>> writeThenDelete = new LinkedHashMap<>();
        writeThenDelete.put("PORT", rows);
        writeThenDelete.put("port", null);
        Map<String, Map<RowKey, Row>> deleteThenWrite = new LinkedHashMap<>();
        deleteThenWrite.put("port", null);
        deleteThenWrite.put("PORT", rows);

        for (Map<String, Map<RowKey, Row>> snapshot : List.of(writeThenDelete, deleteThenWrite)) {
            TableStore direct = open(false);
            TableStore pipelined = open(true);

            direct.modConfig(snapshot);
            pipelined.modConfig(snapshot);

            assertThat(pipelined.getConfig()).isEqualTo(direct.getConfig());
        }
        TableStore pipelined = open(true);
        pipelined.modConfig(writeThenDelete);
        assertThat(pipelined.getTable("PORT")).isEmpty();
    }
}
