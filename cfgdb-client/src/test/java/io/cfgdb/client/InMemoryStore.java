package io.cfgdb.client;

import io.cfgdb.common.exception.StoreException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Store fake holding numbered databases of hashes and strings. Publishes keyspace and keyevent
 * notifications once {@code notify-keyspace-events} has been configured, and can be told to fail
 * connects or commands.
 */
public final class InMemoryStore implements StoreConnector {

    private final Object lock = new Object();
    private final Map<Integer, TreeMap<String, Object>> databases = new HashMap<>();
    private final List<FakeChannel> channels = new CopyOnWriteArrayList<>();
    private final List<String> configSets = new CopyOnWriteArrayList<>();
    private final Map<String, AtomicInteger> commandCounts = new ConcurrentHashMap<>();
    private final Set<String> rejected = ConcurrentHashMap.newKeySet();
    private final AtomicInteger failConnects = new AtomicInteger();
    private final AtomicInteger failCommands = new AtomicInteger();
    private final AtomicInteger connects = new AtomicInteger();
    private final AtomicInteger pipelines = new AtomicInteger();
    private volatile String keyspaceEvents = "";

    public void failNextConnects(int count) {
        failConnects.set(count);
    }

    public void failNextCommands(int count) {
        failCommands.set(count);
    }

    public void reject(String command) {
        rejected.add(command);
    }

    public int connects() {
        return connects.get();
    }

    public int pipelinesExecuted() {
        return pipelines.get();
    }

    public int commandCount(String command) {
        AtomicInteger count = commandCounts.get(command);
        return count == null ? 0 : count.get();
    }

    public List<String> configSets() {
        return List.copyOf(configSets);
    }

    /**
     * Disconnects every open subscription; their next empty poll fails.
     */
    public void dropSubscriptions() {
        for (FakeChannel channel : channels) {
            channel.dropped = true;
        }
    }

    public int openChannels() {
        return channels.size();
    }

    public Map<String, String> hash(int db, String key) {
        synchronized (lock) {
            Object value = data(db).get(key);
            if (value instanceof Map<?, ?> map) {
                @SuppressWarnings("unchecked")
                Map<String, String> hash = (Map<String, String>) map;
                return Map.copyOf(hash);
            }
            return Map.of();
        }
    }

    public boolean contains(int db, String key) {
        synchronized (lock) {
            return data(db).containsKey(key);
        }
    }

    public void putHash(int db, String key, Map<String, String> fields) {
        doHset(db, key, fields);
    }

    public void putString(int db, String key, String value) {
        synchronized (lock) {
            data(db).put(key, value);
        }
        notifyChange(db, key, "set");
    }

    public void remove(int db, String key) {
        doDel(db, key);
    }

    @Override
    public StoreConnection connect(DatabaseSpec database) {
        if (failConnects.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new StoreException.ConnectionFailed(database.name(), "Connection refused", null);
        }
        connects.incrementAndGet();
        return new FakeConnection(database);
    }

    private TreeMap<String, Object> data(int db) {
        return databases.computeIfAbsent(db, id -> new TreeMap<>());
    }

    private void count(String command) {
        commandCounts.computeIfAbsent(command, c -> new AtomicInteger()).incrementAndGet();
    }

    private long doHset(int db, String key, Map<String, String> fields) {
        long added = 0;
        synchronized (lock) {
            Object existing = data(db).get(key);
            if (existing != null && !(existing instanceof Map)) {
                throw wrongType();
            }
            @SuppressWarnings("unchecked")
            Map<String, String> hash = existing == null ? new LinkedHashMap<>() : (Map<String, String>) existing;
            for (Map.Entry<String, String> field : fields.entrySet()) {
                if (hash.put(field.getKey(), field.getValue()) == null) {
                    added++;
                }
            }
            data(db).put(key, hash);
        }
        notifyChange(db, key, "hset");
        return added;
    }

    private long doHdel(int db, String key, String... fields) {
        long removed = 0;
        boolean emptied = false;
        synchronized (lock) {
            Object existing = data(db).get(key);
            if (existing == null) {
                return 0;
            }
            if (!(existing instanceof Map)) {
                throw wrongType();
            }
            Map<?, ?> hash = (Map<?, ?>) existing;
            for (String field : fields) {
                if (hash.remove(field) != null) {
                    removed++;
                }
            }
            if (hash.isEmpty()) {
                data(db).remove(key);
                emptied = true;
            }
        }
        if (removed > 0) {
            notifyChange(db, key, "hdel");
        }
        if (emptied) {
            notifyChange(db, key, "del");
        }
        return removed;
    }

    private long doDel(int db, String... keys) {
        long removed = 0;
        for (String key : keys) {
            boolean existed;
            synchronized (lock) {
                existed = data(db).remove(key) != null;
            }
            if (existed) {
                removed++;
                notifyChange(db, key, "del");
            }
        }
        return removed;
    }

    private Map<String, String> doHgetall(int db, String key) {
        synchronized (lock) {
            Object existing = data(db).get(key);
            if (existing == null) {
                return Map.of();
            }
            if (!(existing instanceof Map)) {
                throw wrongType();
            }
            @SuppressWarnings("unchecked")
            Map<String, String> hash = (Map<String, String>) existing;
            return new LinkedHashMap<>(hash);
        }
    }

    private static StoreException wrongType() {
        return new StoreException.BadRequest("WRONGTYPE Operation against a key holding the wrong kind of value", null);
    }

    private void notifyChange(int db, String key, String event) {
        if (keyspaceEvents.isEmpty()) {
            return;
        }
        publishLocal("__keyspace@" + db + "__:" + key, event);
        publishLocal("__keyevent@" + db + "__:" + event, key);
    }

    private long publishLocal(String channel, String message) {
        long receivers = 0;
        for (FakeChannel subscriber : channels) {
            if (subscriber.matcher.matcher(channel).matches()) {
                subscriber.events.add(new KeyspaceEvent(subscriber.pattern, channel, message));
                receivers++;
            }
        }
        return receivers;
    }

    static Pattern glob(String glob) {
        StringBuilder regex = new StringBuilder();
        boolean inClass = false;
        for (char c : glob.toCharArray()) {
            if (inClass) {
                if (c == ']') {
                    inClass = false;
                }
                regex.append(c == '\\' ? "\\\\" : String.valueOf(c));
                continue;
            }
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                case '[' -> {
                    inClass = true;
                    regex.append('[');
                }
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private final class FakeConnection implements StoreConnection {
        private final DatabaseSpec database;
        private volatile boolean closed;

        FakeConnection(DatabaseSpec database) {
            this.database = database;
        }

        private int db() {
            return database.id();
        }

        private void check(String command) {
            count(command);
            if (closed) {
                throw new StoreException.ConnectionFailed(database.name(), "Connection closed", null);
            }
            if (failCommands.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw new StoreException.ConnectionFailed(database.name(), "Connection reset by peer", null);
            }
            if (rejected.contains(command)) {
                throw new StoreException.BadRequest("ERR unknown command '" + command + "'", null);
            }
        }

        @Override
        public DatabaseSpec database() {
            return database;
        }

        @Override
        public Optional<String> get(String key) {
            check("get");
            synchronized (lock) {
                Object value = data(db()).get(key);
                if (value instanceof Map) {
                    throw wrongType();
                }
                return Optional.ofNullable((String) value);
            }
        }

        @Override
        public Optional<String> hget(String key, String field) {
            check("hget");
            return Optional.ofNullable(doHgetall(db(), key).get(field));
        }

        @Override
        public Map<String, String> hgetall(String key) {
            check("hgetall");
            return doHgetall(db(), key);
        }

        @Override
        public long hset(String key, Map<String, String> fields) {
            check("hset");
            return doHset(db(), key, fields);
        }

        @Override
        public long hdel(String key, String... fields) {
            check("hdel");
            return doHdel(db(), key, fields);
        }

        @Override
        public long del(String... keys) {
            check("del");
            return doDel(db(), keys);
        }

        @Override
        public List<String> keys(String pattern) {
            check("keys");
            Pattern matcher = glob(pattern);
            synchronized (lock) {
                return data(db()).keySet().stream().filter(k -> matcher.matcher(k).matches()).toList();
            }
        }

        /**
         * Cursor is {@code "@" + next key}; {@code count} keys are examined per call whether they
         * match or not, so pages may come back empty before the scan is finished.
         */
        @Override
        public ScanPage scan(String cursor, String pattern, int count) {
            check("scan");
            Pattern matcher = glob(pattern);
            synchronized (lock) {
                NavigableMap<String, Object> rest = ScanPage.INITIAL_CURSOR.equals(cursor)
                    ? data(db())
                    : data(db()).tailMap(cursor.substring(1), true);
                List<String> page = new ArrayList<>();
                String next = ScanPage.INITIAL_CURSOR;
                int examined = 0;
                for (String key : rest.keySet()) {
                    if (examined == count) {
                        next = "@" + key;
                        break;
                    }
                    examined++;
                    if (matcher.matcher(key).matches()) {
                        page.add(key);
                    }
                }
                return new ScanPage(next, page);
            }
        }

        @Override
        public boolean expire(String key, Duration ttl) {
            check("expire");
            if (!contains(db(), key)) {
                return false;
            }
            notifyChange(db(), key, "expire");
            return true;
        }

        @Override
        public boolean exists(String key) {
            check("exists");
            return contains(db(), key);
        }

        @Override
        public long publish(String channel, String message) {
            check("publish");
            return publishLocal(channel, message);
        }

        @Override
        public void configSet(String parameter, String value) {
            check("config");
            configSets.add(parameter + "=" + value);
            if (ConnectionRegistry.NOTIFY_KEYSPACE_EVENTS.equals(parameter)) {
                keyspaceEvents = value;
            }
        }

        @Override
        public StorePipeline pipeline() {
            return new FakePipeline(this);
        }

        @Override
        public NotificationChannel psubscribe(String pattern) {
            check("psubscribe");
            FakeChannel channel = new FakeChannel(database.name(), pattern);
            channels.add(channel);
            return channel;
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    private final class FakePipeline implements StorePipeline {
        private final FakeConnection connection;
        private final List<Runnable> queued = new ArrayList<>();

        FakePipeline(FakeConnection connection) {
            this.connection = connection;
        }

        @Override
        public Supplier<Map<String, String>> hgetall(String key) {
            Map<String, String>[] reply = newReply();
            queued.add(() -> reply[0] = connection.hgetall(key));
            return () -> {
                if (reply[0] == null) {
                    throw new IllegalStateException("Pipeline not executed");
                }
                return reply[0];
            };
        }

        @SuppressWarnings("unchecked")
        private Map<String, String>[] newReply() {
            return (Map<String, String>[]) new Map[1];
        }

        @Override
        public void hset(String key, Map<String, String> fields) {
            queued.add(() -> connection.hset(key, fields));
        }

        @Override
        public void hdel(String key, String... fields) {
            queued.add(() -> connection.hdel(key, fields));
        }

        @Override
        public void del(String key) {
            queued.add(() -> connection.del(key));
        }

        @Override
        public int size() {
            return queued.size();
        }

        @Override
        public void execute() {
            if (queued.isEmpty()) {
                return;
            }
            pipelines.incrementAndGet();
            try {
                queued.forEach(Runnable::run);
            } finally {
                queued.clear();
            }
        }
    }

    private final class FakeChannel implements NotificationChannel {
        private final String database;
        private final String pattern;
        private final Pattern matcher;
        private final LinkedBlockingQueue<KeyspaceEvent> events = new LinkedBlockingQueue<>();
        private volatile boolean closed;
        private volatile boolean dropped;

        FakeChannel(String database, String pattern) {
            this.database = database;
            this.pattern = pattern;
            this.matcher = glob(pattern);
        }

        @Override
        public String pattern() {
            return pattern;
        }

        @Override
        public Optional<KeyspaceEvent> poll(Duration timeout) throws InterruptedException {
            if (closed) {
                throw new IllegalStateException("Channel closed");
            }
            KeyspaceEvent event = events.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
            if (event == null && dropped) {
                throw new StoreException.ConnectionFailed(database, "Subscription connection lost", null);
            }
            return Optional.ofNullable(event);
        }

        @Override
        public void close() {
            closed = true;
            channels.remove(this);
        }
    }
}
