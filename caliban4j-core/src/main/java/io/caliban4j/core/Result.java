package io.caliban4j.core;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a remote operation: a value or a {@link ConnectError}.
 */
public sealed interface Result<T> permits Result.Ok, Result.Err {

    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Result<T> err(ConnectError error) {
        return new Err<>(error);
    }

    boolean isOk();

    Optional<T> value();

    Optional<ConnectError> error();

    <U> Result<U> map(Function<? super T, ? extends U> mapper);

    <U> Result<U> flatMap(Function<? super T, Result<U>> mapper);

    T orElse(T other);

    record Ok<T>(T get) implements Result<T> {
        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public Optional<T> value() {
            return Optional.ofNullable(get);
        }

        @Override
        public Optional<ConnectError> error() {
            return Optional.empty();
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new Ok<>(mapper.apply(get));
        }

        @Override
        public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
            return mapper.apply(get);
        }

        @Override
        public T orElse(T other) {
            return get;
        }
    }

    record Err<T>(ConnectError cause) implements Result<T> {
        public Err {
            Objects.requireNonNull(cause, "cause must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public Optional<T> value() {
            return Optional.empty();
        }

        @Override
        public Optional<ConnectError> error() {
            return Optional.of(cause);
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new Err<>(cause);
        }

        @Override
        public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
            return new Err<>(cause);
        }

        @Override
        public T orElse(T other) {
            return other;
        }
    }
}
