package io.cfgdb.client;

import io.cfgdb.common.exception.StoreException;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a read that may find nothing. Absent data is an expected result, not an error.
 */
public sealed interface ReadResult<T> permits ReadResult.Present, ReadResult.Unavailable {

    static <T> ReadResult<T> present(T value) {
        return new Present<>(value);
    }

    /**
     * @param awaited the notification payload that would indicate the data has been written
     */
    static <T> ReadResult<T> unavailable(String awaited, String reason) {
        return new Unavailable<>(awaited, reason);
    }

    boolean isPresent();

    Optional<T> toOptional();

    default T orElse(T other) {
        return toOptional().orElse(other);
    }

    T orElseThrow();

    <R> ReadResult<R> map(Function<? super T, ? extends R> mapper);

    record Present<T>(T value) implements ReadResult<T> {
        public Present {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public boolean isPresent() {
            return true;
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.of(value);
        }

        @Override
        public T orElseThrow() {
            return value;
        }

        @Override
        public <R> ReadResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Present<>(mapper.apply(value));
        }
    }

    record Unavailable<T>(String awaited, String reason) implements ReadResult<T> {
        public Unavailable {
            Objects.requireNonNull(awaited, "awaited must not be null");
            Objects.requireNonNull(reason, "reason must not be null");
        }

        @Override
        public boolean isPresent() {
            return false;
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.empty();
        }

        @Override
        public T orElseThrow() {
            throw new StoreException.DataUnavailable(awaited, reason);
        }

        @Override
        public <R> ReadResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Unavailable<>(awaited, reason);
        }
    }
}
