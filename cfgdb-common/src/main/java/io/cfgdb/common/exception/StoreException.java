package io.cfgdb.common.exception;

public sealed class StoreException extends RuntimeException
    permits StoreException.ConnectionFailed,
            StoreException.BadRequest,
            StoreException.DataUnavailable,
            StoreException.MissingClient {

    protected StoreException(String message) {
        super(message);
    }

    protected StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Transport or network failure. Retried by blocking accessors, surfaced otherwise.
     */
    public static final class ConnectionFailed extends StoreException {
        private final String database;

        public ConnectionFailed(String database, String message, Throwable cause) {
            super(message, cause);
            this.database = database;
        }

        public String database() {
            return database;
        }
    }

    /**
     * The store rejected the command itself. Never retried.
     */
    public static final class BadRequest extends StoreException {
        public BadRequest(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static final class DataUnavailable extends StoreException {
        private final String awaited;

        public DataUnavailable(String awaited, String message) {
            super(message);
            this.awaited = awaited;
        }

        public String awaited() {
            return awaited;
        }
    }

    public static final class MissingClient extends StoreException {
        private final String database;

        public MissingClient(String database) {
            super("No client connected for database '" + database + "'");
            this.database = database;
        }

        public String database() {
            return database;
        }
    }
}
