package io.cfgdb.client;

import io.cfgdb.client.table.PipelinedTableStore;
import io.cfgdb.common.Row;
import io.cfgdb.common.RowKey;
import io.cfgdb.common.exception.StoreException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs against a real store on {@code CFGDB_REDIS_HOST}, using database 15.
 */
@EnabledIfEnvironmentVariable(named = "CFGDB_REDIS_HOST", matches = ".+")
class LettuceStoreLiveTest {

    private static final DatabaseSpec TEST_DB = new DatabaseSpec("TEST_DB", 15, "|");

    private DatabaseClient client;

    @BeforeEach
    void setUp() {
        StoreClientConfig config = StoreClientConfig.tcp(System.getenv("CFGDB_REDIS_HOST"), StoreClientConfig.DEFAULT_PORT);
        BlockingConfig blocking = new BlockingConfig(Duration.ofMillis(200), Duration.ofSeconds(2), Duration.ZERO, 10, 15);
        client = DatabaseClient.create(config, blocking, new DatabaseCatalog(List.of(TEST_DB)));
        client.connect("TEST_DB", false);
        client.deleteAllByPattern("TEST_DB", "*");
    }

    @AfterEach
    void tearDown() {
        client.deleteAllByPattern("TEST_DB", "*");
        client.close();
    }

    @Test
    void tableRoundTripThroughPipelines() {
        PipelinedTableStore tables = new PipelinedTableStore(client.registry(), TEST_DB, 5);
        for (int i = 0; i < 12; i++) {
            tables.modEntry("PORT", RowKey.of("Ethernet" + i), Row.builder()
                .put("mtu", "9100")
                .putList("lanes", List.of(String.valueOf(i), String.valueOf(i + 1)))
                .build());
        }

        Map<RowKey, Row> port = tables.getTable("PORT");

        assertThat(port).hasSize(12);
        assertThat(port.get(RowKey.of("Ethernet3")).list("lanes")).contains(List.of("3", "4"));
    }

    @Test
    void blockingReadSeesLaterWrite() throws InterruptedException {
        Thread writer = new Thread(() -> {
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            client.set("TEST_DB", "PORT|Ethernet0", "mtu", "1500");
        });
        writer.start();

        ReadResult<String> mtu = client.get("TEST_DB", "PORT|Ethernet0", "mtu", AccessPolicy.blocking());

        writer.join();
        assertThat(mtu.orElseThrow()).isEqualTo("1500");
    }

    @Test
    void wrongTypeIsBadRequest() {
        client.set("TEST_DB", "PORT|Ethernet0", "mtu", "1500");

        assertThatThrownBy(() -> client.connection("TEST_DB").get("PORT|Ethernet0"))
            .isInstanceOf(StoreException.BadRequest.class);
    }
}
