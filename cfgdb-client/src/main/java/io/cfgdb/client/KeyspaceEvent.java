package io.cfgdb.client;

import java.util.Objects;

/**
 * One pattern-subscription message. For keyspace channels ({@code __keyspace@<db>__:<key>}) the
 * message is the event name; for keyevent channels ({@code __keyevent@<db>__:<event>}) it is the key.
 */
public record KeyspaceEvent(String pattern, String channel, String message) {

    public KeyspaceEvent {
        Objects.requireNonNull(channel, "channel must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /**
     * Everything after the first colon of the channel name.
     */
    public String key() {
        return channel.substring(channel.indexOf(':') + 1);
    }

    public boolean isKeyspace() {
        return channel.startsWith("__keyspace@");
    }
}
